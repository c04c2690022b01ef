package com.quantori.csp.api.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Switches controlling which parts of the SMILES grammar are accepted and which checks run after parsing.
 * <p>
 * Options are immutable; per call overrides produce a copy, see {@link #withOverrides(Map)}.
 */
@Value
@Builder(toBuilder = true)
public class ParseOptions {
  public static final int DEFAULT_MAX_BRANCH_DEPTH = 256;
  public static final int DEFAULT_MAX_RING_PATHS = 10_000;

  private static final Map<String, BiConsumer<ParseOptionsBuilder, Boolean>> OPTION_SETTERS = Map.ofEntries(
      Map.entry("enable-disconnected-structures", ParseOptionsBuilder::enableDisconnectedStructures),
      Map.entry("enable-reactions", ParseOptionsBuilder::enableReactions),
      Map.entry("enable-multiple-reactions", ParseOptionsBuilder::enableMultipleReactions),
      Map.entry("enable-aromatic-bonds", ParseOptionsBuilder::enableAromaticBonds),
      Map.entry("enable-charge-clauses", ParseOptionsBuilder::enableChargeClauses),
      Map.entry("cumulative-charge", ParseOptionsBuilder::cumulativeCharge),
      Map.entry("enable-bracket-atoms", ParseOptionsBuilder::enableBracketAtoms),
      Map.entry("enable-branches", ParseOptionsBuilder::enableBranches),
      Map.entry("enable-rings", ParseOptionsBuilder::enableRings),
      Map.entry("enable-radicals", ParseOptionsBuilder::enableRadicals),
      Map.entry("show-implicit-atomic-mass", ParseOptionsBuilder::showImplicitAtomicMass),
      Map.entry("add-implicit-hydrogens", ParseOptionsBuilder::addImplicitHydrogens),
      Map.entry("check-bond-counts", ParseOptionsBuilder::checkBondCounts));

  @Builder.Default
  boolean enableDisconnectedStructures = true;
  @Builder.Default
  boolean enableReactions = true;
  @Builder.Default
  boolean enableMultipleReactions = true;
  @Builder.Default
  boolean enableAromaticBonds = true;
  @Builder.Default
  boolean enableChargeClauses = true;
  boolean cumulativeCharge;
  @Builder.Default
  boolean enableBracketAtoms = true;
  @Builder.Default
  boolean enableBranches = true;
  @Builder.Default
  boolean enableRings = true;
  @Builder.Default
  boolean enableRadicals = true;
  boolean showImplicitAtomicMass;
  @Builder.Default
  boolean addImplicitHydrogens = true;
  @Builder.Default
  boolean checkBondCounts = true;
  /**
   * Deepest allowed branch nesting.
   */
  @Builder.Default
  int maxBranchDepth = DEFAULT_MAX_BRANCH_DEPTH;
  /**
   * Largest number of candidate paths explored when resolving one ring.
   */
  @Builder.Default
  int maxRingPaths = DEFAULT_MAX_RING_PATHS;

  public static ParseOptions defaults() {
    return ParseOptions.builder().build();
  }

  public static Set<String> optionNames() {
    return OPTION_SETTERS.keySet();
  }

  /**
   * Returns a copy with the given switches replaced.
   *
   * @param overrides switch values keyed by option name, e.g. {@code enable-rings}
   * @return the effective options
   * @throws IllegalArgumentException if a key is not a known option name
   */
  public ParseOptions withOverrides(Map<String, Boolean> overrides) {
    if (overrides == null || overrides.isEmpty()) {
      return this;
    }
    ParseOptionsBuilder builder = toBuilder();
    overrides.forEach((name, value) -> {
      BiConsumer<ParseOptionsBuilder, Boolean> setter = OPTION_SETTERS.get(name);
      if (setter == null) {
        throw new IllegalArgumentException("Unknown parse option: " + name);
      }
      setter.accept(builder, value);
    });
    return builder.build();
  }
}
