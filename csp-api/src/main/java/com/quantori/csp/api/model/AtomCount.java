package com.quantori.csp.api.model;

/**
 * Number of occurrences of an element or a bracket group with a given charge.
 *
 * @param atom   element symbol or group string, e.g. {@code C} or {@code NH4}
 * @param charge the charge the entry is tagged with, {@code null} when atoms were split out of their groups
 * @param count  the number of occurrences
 */
public record AtomCount(String atom, Integer charge, int count) {

  public AtomCount add(int more) {
    return new AtomCount(atom, charge, count + more);
  }

  int chargeOrZero() {
    return charge == null ? 0 : charge;
  }
}
