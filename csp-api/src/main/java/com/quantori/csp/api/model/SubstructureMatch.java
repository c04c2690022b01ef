package com.quantori.csp.api.model;

import java.util.Map;

/**
 * One match of a substructure pattern.
 *
 * @param atoms  matched atom identities keyed by pattern label
 * @param ringId the matched ring, {@code null} for patterns not anchored on a ring
 */
public record SubstructureMatch(Map<String, Integer> atoms, Integer ringId) {

  public Integer atom(String label) {
    return atoms.get(label);
  }
}
