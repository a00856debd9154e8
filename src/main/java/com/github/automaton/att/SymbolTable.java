package com.github.automaton.att;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.automaton.AutomatonException;
import com.github.automaton.AutomatonException.Code;

import it.unimi.dsi.fastutil.ints.Int2ObjectAVLTreeMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

/**
 * Symbol table in AT&T text format: one {@code symbol index} pair per line.
 *
 * Indices must be dense and start at 0 or 1. Index 0, if present, is the empty symbol, which stands
 * for no symbol at all on a transducer tape. Regular symbols are numbered from 1.
 */
public final class SymbolTable {
  private static final Logger logger = LogManager.getLogger(SymbolTable.class.getSimpleName());

  private final String emptySymbol;
  // index i+1 -> symbol
  private final ObjectArrayList<String> symbols;
  // K=symbol, V=index
  private final Object2IntOpenHashMap<String> indices;

  private SymbolTable(final String emptySymbol, final ObjectArrayList<String> symbols) {
    this.emptySymbol = emptySymbol;
    this.symbols = symbols;
    this.indices = new Object2IntOpenHashMap<>(symbols.size() + 1);
    this.indices.defaultReturnValue(-1);
    if (emptySymbol != null) {
      indices.put(emptySymbol, 0);
    }
    for (int i = 0; i < symbols.size(); i++) {
      indices.put(symbols.get(i), i + 1);
    }
  }

  public static SymbolTable read(final Path path) throws AutomatonException {
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      final SymbolTable table = read(reader);
      logger.info("Read " + table.size() + " symbols from " + path);
      return table;
    } catch (IOException ioProblem) {
      throw new AutomatonException(Code.PARSE_FAILURE, ioProblem);
    }
  }

  public static SymbolTable read(final Reader reader) throws AutomatonException {
    final BufferedReader lines =
        reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
    // sorted by index, to check density afterwards
    final Int2ObjectAVLTreeMap<String> byIndex = new Int2ObjectAVLTreeMap<>();
    final Object2IntOpenHashMap<String> byName = new Object2IntOpenHashMap<>();
    byName.defaultReturnValue(-1);
    int lineNumber = 0;
    try {
      String line;
      while ((line = lines.readLine()) != null) {
        lineNumber++;
        final String trimmed = line.trim();
        if (trimmed.isEmpty()) {
          continue;
        }
        final String[] fields = trimmed.split("\\s+");
        if (fields.length != 2) {
          throw parseFailure(lineNumber, "expected 'symbol index' but got '" + trimmed + "'");
        }
        final String name = fields[0];
        final int index = parseIndex(lineNumber, fields[1]);
        if (byIndex.containsKey(index)) {
          throw parseFailure(lineNumber, "Duplicate index: " + index + " (for "
              + byIndex.get(index) + " and " + name + ")");
        }
        if (byName.containsKey(name)) {
          throw parseFailure(lineNumber, "Duplicate name: " + name + " (with "
              + byName.getInt(name) + " and " + index + ")");
        }
        byIndex.put(index, name);
        byName.put(name, index);
      }
    } catch (IOException ioProblem) {
      throw new AutomatonException(Code.PARSE_FAILURE, ioProblem);
    }

    if (byIndex.isEmpty()) {
      return new SymbolTable(null, new ObjectArrayList<String>());
    }
    final int lowestIndex = byIndex.firstIntKey();
    if (lowestIndex != 0 && lowestIndex != 1) {
      throw new AutomatonException(Code.PARSE_FAILURE,
          "The lowest index in symbol table must be 0 or 1, not " + lowestIndex + " (for "
              + byIndex.get(lowestIndex) + ")");
    }
    String emptySymbol = null;
    final ObjectArrayList<String> symbols = new ObjectArrayList<>(byIndex.size());
    int previousIndex = 0;
    for (final Int2ObjectMap.Entry<String> mapping : byIndex.int2ObjectEntrySet()) {
      final int index = mapping.getIntKey();
      if (index == 0) {
        emptySymbol = mapping.getValue();
        continue;
      }
      if (index != previousIndex + 1) {
        throw new AutomatonException(Code.PARSE_FAILURE,
            "The indices in the symbol table must be dense, which " + previousIndex + " and "
                + index + " (for " + mapping.getValue() + ") are not");
      }
      symbols.add(mapping.getValue());
      previousIndex = index;
    }
    return new SymbolTable(emptySymbol, symbols);
  }

  public boolean hasEmptySymbol() {
    return emptySymbol != null;
  }

  /**
   * The symbol with index 0, or null if there is none.
   */
  public String getEmptySymbol() {
    return emptySymbol;
  }

  /**
   * Symbol by index. Index 0 is the empty symbol.
   */
  public String getSymbol(final int index) {
    if (index == 0 && emptySymbol != null) {
      return emptySymbol;
    }
    if (index < 1 || index > symbols.size()) {
      throw new IndexOutOfBoundsException("No symbol with index " + index);
    }
    return symbols.get(index - 1);
  }

  /**
   * Index of the symbol, or -1 if it is not in the table.
   */
  public int indexOf(final String symbol) {
    return indices.getInt(symbol);
  }

  public boolean hasSymbol(final String symbol) {
    return indices.containsKey(symbol);
  }

  /**
   * Number of symbols, not counting the empty symbol.
   */
  public int size() {
    return symbols.size();
  }

  @Override
  public String toString() {
    return "SymbolTable [emptySymbol=" + emptySymbol + ", symbols=" + symbols + "]";
  }

  private static int parseIndex(final int lineNumber, final String field)
      throws AutomatonException {
    try {
      final int index = Integer.parseInt(field);
      if (index < 0) {
        throw parseFailure(lineNumber, "negative index " + index);
      }
      return index;
    } catch (NumberFormatException notNumber) {
      throw parseFailure(lineNumber, "index is not a number: " + field);
    }
  }

  private static AutomatonException parseFailure(final int lineNumber, final String message) {
    return new AutomatonException(Code.PARSE_FAILURE, "Line " + lineNumber + ": " + message);
  }
}
