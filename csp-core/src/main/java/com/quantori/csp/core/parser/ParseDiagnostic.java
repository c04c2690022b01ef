package com.quantori.csp.core.parser;

import com.quantori.csp.api.ErrorKind;
import com.quantori.csp.api.SmilesException;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Error raised inside the parser. Each enclosing level adds a context line while the error propagates; the column
 * always refers to the whole input.
 */
@Getter
class ParseDiagnostic extends RuntimeException {
  private final ErrorKind kind;
  private final String detail;
  private final String offending;
  private final int column;
  private final Deque<String> context = new ArrayDeque<>();

  ParseDiagnostic(ErrorKind kind, String detail, String offending, int column) {
    super(kind.getLabel() + ": " + detail);
    this.kind = kind;
    this.detail = detail;
    this.offending = offending == null ? "" : offending;
    this.column = column;
  }

  static ParseDiagnostic syntax(String detail, String offending, int column) {
    return new ParseDiagnostic(ErrorKind.SYNTAX, detail, offending, column);
  }

  static ParseDiagnostic bond(String detail, String offending, int column) {
    return new ParseDiagnostic(ErrorKind.BOND, detail, offending, column);
  }

  static ParseDiagnostic ring(String detail, String offending, int column) {
    return new ParseDiagnostic(ErrorKind.RING, detail, offending, column);
  }

  /**
   * Adds a context line in front of the lines added so far.
   */
  ParseDiagnostic withContext(String line) {
    context.addFirst(line);
    return this;
  }

  List<String> getContext() {
    return List.copyOf(context);
  }

  SmilesException toException(String smiles) {
    StringBuilder message = new StringBuilder();
    context.forEach(line -> message.append(line).append('\n'));
    message.append(getMessage()).append('\n')
        .append(smiles).append('\n')
        .append(StringUtils.repeat(' ', Math.max(0, Math.min(column, smiles.length()))))
        .append(StringUtils.repeat('^', Math.max(1, offending.length())));
    return new SmilesException(kind, message.toString(), smiles, offending, column);
  }
}
