package com.quantori.csp.api.model;

/**
 * A bond seen from one of its atoms, regardless of which atom stores it.
 *
 * @param atom     the atom the bond is seen from
 * @param neighbor the atom on the other side
 * @param bond     the stored bond record
 */
public record TouchingBond(int atom, int neighbor, Bond bond) {

  public BondType type() {
    return bond.getType();
  }
}
