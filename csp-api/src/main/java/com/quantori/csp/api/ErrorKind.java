package com.quantori.csp.api;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Kinds of errors reported while reading a SMILES string.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorKind {
  /**
   * Malformed token stream, unbalanced delimiters or an unexpected character.
   */
  SYNTAX("Syntax Error"),
  /**
   * Conflicting or invalid explicit or implicit bond.
   */
  BOND("Bond Error"),
  /**
   * Unclosed ring, ring bridging molecules or inconsistent aromatic ring.
   */
  RING("Ring Error"),
  /**
   * Bond count outside the allowed valences of an element.
   */
  VALENCE("Bond Error");

  private final String label;
}
