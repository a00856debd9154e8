package com.github.automaton.att;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.automaton.Automaton;
import com.github.automaton.AutomatonConfiguration;
import com.github.automaton.AutomatonException;
import com.github.automaton.AutomatonException.Code;
import com.github.automaton.AutomatonImpl;
import com.github.automaton.Direction;

/**
 * Reads a weighted transducer in AT&T text format into an {@link Automaton} over integer states,
 * labelled with {@link TransducerLabel}.
 *
 * Every non-blank line is one of:<br>
 * 1. {@code source target input output [cost]}: an arc. States are created as they are first
 * mentioned; a missing cost means 0. The source of the first arc is the start state.<br>
 * 2. {@code state [cost]}: a final state, with the given final cost or 0.<br>
 *
 * Symbols must be in the symbol table for their tape. The table's empty symbol stands for an empty
 * sequence on that tape.
 */
public final class AttAutomatonReader {
  private static final Logger logger =
      LogManager.getLogger(AttAutomatonReader.class.getSimpleName());

  private final SymbolTable inputSymbols;
  private final SymbolTable outputSymbols;
  private final AutomatonConfiguration config;

  public AttAutomatonReader(final SymbolTable symbols) {
    this(symbols, symbols, null);
  }

  public AttAutomatonReader(final SymbolTable inputSymbols, final SymbolTable outputSymbols,
      final AutomatonConfiguration config) {
    this.inputSymbols = inputSymbols;
    this.outputSymbols = outputSymbols;
    this.config = config;
  }

  public Automaton<Integer> read(final Path path) throws AutomatonException {
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      final Automaton<Integer> automaton = read(reader);
      logger.info("[a:" + automaton.getId() + "] Read automaton from " + path);
      return automaton;
    } catch (IOException ioProblem) {
      throw new AutomatonException(Code.PARSE_FAILURE, ioProblem);
    }
  }

  public Automaton<Integer> read(final Reader reader) throws AutomatonException {
    final BufferedReader lines =
        reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
    final Automaton<Integer> automaton = new AutomatonImpl<>(config);
    boolean seenArc = false;
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
        switch (fields.length) {
          case 1:
          case 2:
            addFinalState(automaton, lineNumber, fields);
            break;
          case 4:
          case 5:
            final Integer source = addArc(automaton, lineNumber, fields);
            if (!seenArc) {
              automaton.setTerminalLabel(Direction.FORWARD, source, TransducerLabel.one());
              seenArc = true;
            }
            break;
          default:
            throw parseFailure(lineNumber, "expected an arc or a final state but got '"
                + trimmed + "'");
        }
      }
    } catch (IOException ioProblem) {
      throw new AutomatonException(Code.PARSE_FAILURE, ioProblem);
    }
    logger.info("[a:" + automaton.getId() + "] Read " + lineNumber + " lines: "
        + automaton.getStatistics());
    return automaton;
  }

  private Integer addArc(final Automaton<Integer> automaton, final int lineNumber,
      final String[] fields) throws AutomatonException {
    final Integer source = ensureState(automaton, parseState(lineNumber, fields[0]));
    final Integer target = ensureState(automaton, parseState(lineNumber, fields[1]));
    final List<String> input = parseSymbol(inputSymbols, lineNumber, fields[2]);
    final List<String> output = parseSymbol(outputSymbols, lineNumber, fields[3]);
    final double cost = fields.length == 5 ? parseCost(lineNumber, fields[4]) : 0.0;
    automaton.addArc(source, target, new TransducerLabel(input, output, cost));
    return source;
  }

  private static void addFinalState(final Automaton<Integer> automaton, final int lineNumber,
      final String[] fields) throws AutomatonException {
    final Integer state = ensureState(automaton, parseState(lineNumber, fields[0]));
    final double cost = fields.length == 2 ? parseCost(lineNumber, fields[1]) : 0.0;
    automaton.setTerminalLabel(Direction.BACKWARD, state, new TransducerLabel(
        Collections.<String>emptyList(), Collections.<String>emptyList(), cost));
  }

  private static Integer ensureState(final Automaton<Integer> automaton, final Integer state)
      throws AutomatonException {
    if (!automaton.hasState(state)) {
      automaton.addState(state);
    }
    return state;
  }

  private static Integer parseState(final int lineNumber, final String field)
      throws AutomatonException {
    try {
      final int state = Integer.parseInt(field);
      if (state < 0) {
        throw parseFailure(lineNumber, "negative state " + state);
      }
      return state;
    } catch (NumberFormatException notNumber) {
      throw parseFailure(lineNumber, "state is not a number: " + field);
    }
  }

  private static double parseCost(final int lineNumber, final String field)
      throws AutomatonException {
    try {
      return Double.parseDouble(field);
    } catch (NumberFormatException notNumber) {
      throw parseFailure(lineNumber, "cost is not a number: " + field);
    }
  }

  private static List<String> parseSymbol(final SymbolTable symbols, final int lineNumber,
      final String field) throws AutomatonException {
    if (symbols.hasEmptySymbol() && field.equals(symbols.getEmptySymbol())) {
      return Collections.<String>emptyList();
    }
    if (!symbols.hasSymbol(field)) {
      throw parseFailure(lineNumber, "unknown symbol " + field);
    }
    return Collections.singletonList(field);
  }

  private static AutomatonException parseFailure(final int lineNumber, final String message) {
    return new AutomatonException(Code.PARSE_FAILURE, "Line " + lineNumber + ": " + message);
  }
}
