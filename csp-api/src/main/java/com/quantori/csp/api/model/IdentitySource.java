package com.quantori.csp.api.model;

/**
 * Hands out atom and ring identities in creation order.
 * <p>
 * One instance belongs to one parse result, so identities are unique within it and no state is shared between
 * parses.
 */
public class IdentitySource {
  private int nextAtomId;
  private int nextRingId;

  public int nextAtomId() {
    return nextAtomId++;
  }

  public int nextRingId() {
    return nextRingId++;
  }
}
