package com.quantori.csp.api.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A node of a substructure pattern.
 * <p>
 * Matched atoms are reported under {@link #label}; unlabeled nodes must match but are not reported.
 */
@Value
@Builder
public class MatchAtom {
  /**
   * Element symbol the atom must be, any element if {@code null}.
   */
  String atom;
  String label;
  /**
   * Required charge, any charge if {@code null}.
   */
  Integer charge;
  /**
   * Type of the bond leading to this node, any type if {@code null}.
   */
  BondType bond;
  @Singular("bondedTo")
  List<MatchAtom> bondedTo;

  public static MatchAtom of(String atom) {
    return MatchAtom.builder().atom(atom).build();
  }

  public static MatchAtom of(String atom, String label) {
    return MatchAtom.builder().atom(atom).label(label).build();
  }
}
