package com.quantori.csp.api;

import lombok.Getter;

/**
 * An error raised when a SMILES string cannot be turned into a valid structure.
 * <p>
 * The message is already flattened for display: context lines, the error itself, the original input and a caret
 * underlining the offending column.
 */
@Getter
public class SmilesException extends RuntimeException {
  private final ErrorKind kind;
  private final String smiles;
  private final String offending;
  private final int column;

  /**
   * Constructs a {@code SmilesException}.
   *
   * @param kind      the kind of the error
   * @param message   the flattened, user facing message
   * @param smiles    the original input
   * @param offending the offending substring
   * @param column    the column of the offending substring in the original input
   */
  public SmilesException(ErrorKind kind, String message, String smiles, String offending, int column) {
    super(message);
    this.kind = kind;
    this.smiles = smiles;
    this.offending = offending;
    this.column = column;
  }
}
