package com.quantori.csp.api.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * A bond stored on one of its atoms.
 * <p>
 * Only the destination is recorded; the owning atom is implied by the list the bond is stored in. Adjacency questions
 * must go through {@link Molecule#getAllBonds(int)} which also sees bonds stored on the other atom.
 */
@Getter
@ToString
@AllArgsConstructor
public class Bond {
  @Setter
  private BondType type;
  private final int dest;
}
