package com.quantori.csp.api.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

/**
 * Supported bond types.
 */
@Getter
@RequiredArgsConstructor
public enum BondType {
  /**
   * Explicit single bond {@code -}.
   */
  SINGLE("-", 1),
  /**
   * Double bond {@code =}.
   */
  DOUBLE("=", 2),
  /**
   * Triple bond {@code #}.
   */
  TRIPLE("#", 3),
  /**
   * Aromatic bond {@code :}, counted with a fractional bond order.
   */
  AROMATIC(":", 1.5),
  /**
   * Bond implied by adjacency of two atoms, behaves as a single bond.
   */
  DEFAULT("", 1);

  private final String symbol;
  private final double weight;

  /**
   * Finds the bond type written with the given character.
   *
   * @param symbol a character of the input
   * @return the bond type, empty if the character is not a bond symbol
   */
  public static Optional<BondType> fromSymbol(char symbol) {
    return Arrays.stream(values())
        .filter(type -> type.symbol.length() == 1 && type.symbol.charAt(0) == symbol)
        .findFirst();
  }

  public boolean isSingle() {
    return this == SINGLE || this == DEFAULT;
  }

  /**
   * Compares bond types treating the implied bond as a single bond.
   *
   * @param other a bond type to compare with
   * @return true if both types describe the same bond order
   */
  public boolean matches(BondType other) {
    return this == other || (isSingle() && other != null && other.isSingle());
  }
}
