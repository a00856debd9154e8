package com.github.automaton.att;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.StringReader;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.junit.Test;

import com.github.automaton.AutomatonException;
import com.github.automaton.AutomatonException.Code;

/**
 * Tests for reading AT&T symbol tables.
 */
public class SymbolTableTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  static Path resource(final String name) throws Exception {
    return Paths.get(SymbolTableTest.class.getResource(name).toURI());
  }

  @Test
  public void testReadFromFile() throws Exception {
    final SymbolTable symbols = SymbolTable.read(resource("/att/symbols.txt"));
    assertEquals(3, symbols.size());
    assertTrue(symbols.hasEmptySymbol());
    assertEquals("<eps>", symbols.getEmptySymbol());
    assertEquals("<eps>", symbols.getSymbol(0));
    assertEquals("a", symbols.getSymbol(1));
    assertEquals("c", symbols.getSymbol(3));
    assertEquals(0, symbols.indexOf("<eps>"));
    assertEquals(2, symbols.indexOf("b"));
    assertEquals(-1, symbols.indexOf("z"));
    assertFalse(symbols.hasSymbol("z"));
  }

  @Test
  public void testWithoutEmptySymbol() throws AutomatonException {
    final SymbolTable symbols = SymbolTable.read(new StringReader("\n  b 2\na 1\n\n"));
    assertEquals(2, symbols.size());
    assertFalse(symbols.hasEmptySymbol());
    assertNull(symbols.getEmptySymbol());
    assertEquals("a", symbols.getSymbol(1));
    assertEquals("b", symbols.getSymbol(2));
  }

  @Test
  public void testEmpty() throws AutomatonException {
    final SymbolTable symbols = SymbolTable.read(new StringReader(""));
    assertEquals(0, symbols.size());
    assertFalse(symbols.hasEmptySymbol());
  }

  @Test(expected = IndexOutOfBoundsException.class)
  public void testNoSuchIndex() throws AutomatonException {
    SymbolTable.read(new StringReader("a 1\n")).getSymbol(2);
  }

  @Test
  public void testInconsistencies() {
    assertParseFailure("a 0\nb 1\nc 1\n", "Duplicate index");
    assertParseFailure("a 1\nb 2\na 3\n", "Duplicate name");
    assertParseFailure("a 2\nb 3\n", "lowest index");
    assertParseFailure("eps 0\na 1\nb 3\n", "dense");
    assertParseFailure("a\n", "Line 1");
    assertParseFailure("a 1\nb two\n", "Line 2");
    assertParseFailure("a -1\n", "Line 1");
  }

  private static void assertParseFailure(final String text, final String expectedMessage) {
    try {
      SymbolTable.read(new StringReader(text));
      fail("Expected PARSE_FAILURE for " + text);
    } catch (AutomatonException problem) {
      assertEquals(Code.PARSE_FAILURE, problem.getCode());
      assertTrue(problem.getMessage(), problem.getMessage().contains(expectedMessage));
    }
  }

}
