package com.quantori.csp.api.model;

import lombok.Builder;
import lombok.Value;

/**
 * Options of {@link Molecule#countAtoms(CountAtomsOptions)}.
 */
@Value
@Builder(toBuilder = true)
public class CountAtomsOptions {
  /**
   * Count single elements instead of whole bracket groups.
   */
  boolean splitGroups;
  /**
   * Order carbons, hydrogens and then the rest alphabetically.
   */
  @Builder.Default
  boolean hillSystemOrder = true;
  /**
   * Count atoms regardless of the charge of their group.
   */
  boolean ignoreCharge;

  public static CountAtomsOptions defaults() {
    return CountAtomsOptions.builder().build();
  }
}
