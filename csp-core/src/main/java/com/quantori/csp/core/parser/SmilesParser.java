package com.quantori.csp.core.parser;

import com.quantori.csp.api.ErrorKind;
import com.quantori.csp.api.SmilesException;
import com.quantori.csp.api.model.AtomGroup;
import com.quantori.csp.api.model.BondCountViolation;
import com.quantori.csp.api.model.BondType;
import com.quantori.csp.api.model.Molecule;
import com.quantori.csp.api.model.ParseOptions;
import com.quantori.csp.api.model.ParseResult;
import com.quantori.csp.api.model.Ring;
import com.quantori.csp.core.configuration.ParserConfiguration;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Parses SMILES strings into molecular graphs.
 * <p>
 * Instances are immutable and may be shared between threads; every call builds its own {@link ParseResult}.
 * A call either returns a fully validated result or throws a {@link SmilesException}.
 */
@Slf4j
public class SmilesParser {
  @Getter
  private final ParseOptions options;

  /**
   * Creates a parser with the options configured under {@code csp.parser}.
   */
  public SmilesParser() {
    this(ParserConfiguration.load());
  }

  public SmilesParser(ParseOptions options) {
    this.options = Objects.requireNonNull(options, "options");
  }

  public ParseResult parse(String smiles) {
    return parse(smiles, Map.of());
  }

  /**
   * Parses a SMILES string.
   *
   * @param smiles    the input
   * @param overrides option switches for this call only, keyed by option name, e.g. {@code enable-rings}
   * @return the validated result
   * @throws SmilesException          if the input is not valid
   * @throws IllegalArgumentException if an override names an unknown option
   */
  public ParseResult parse(String smiles, Map<String, Boolean> overrides) {
    Objects.requireNonNull(smiles, "smiles");
    ParseResult result = new ParseResult(smiles, options.withOverrides(overrides));
    try {
      new ChainParser(result).parse();
      validate(result);
    } catch (ParseDiagnostic diagnostic) {
      diagnostic.withContext(String.format("Error in SMILES '%s'", smiles));
      log.debug("Failed to parse '{}': {}", smiles, diagnostic.getMessage());
      throw diagnostic.toException(smiles);
    }
    log.debug("Parsed '{}' into {} molecule(s) with {} ring(s)", smiles, result.getMolecules().size(),
        result.getRings().size());
    return result;
  }

  private void validate(ParseResult result) {
    String smiles = result.getSmiles();
    if (result.getReactionIndexes().size() % 2 == 1) {
      throw ParseDiagnostic.syntax("'>' expected (incomplete reaction SMILES)",
          StringUtils.right(smiles, 1), smiles.length() - 1);
    }
    checkRingsWithinMolecules(result);
    closeRings(result);

    RingResolver resolver = new RingResolver(result.getOptions().getMaxRingPaths());
    for (Molecule molecule : result.getMolecules()) {
      for (Ring ring : molecule.getRings()) {
        resolver.resolve(molecule, ring);
      }
    }
    checkLowercaseAtoms(result);

    if (result.getOptions().isAddImplicitHydrogens()) {
      result.addImplicitHydrogens();
    }
    if (result.getOptions().isCheckBondCounts()) {
      for (Molecule molecule : result.getMolecules()) {
        Optional<BondCountViolation> violation = molecule.checkBondCounts();
        if (violation.isPresent()) {
          AtomGroup group = molecule.getGroup(violation.get().atomId());
          throw new ParseDiagnostic(ErrorKind.VALENCE, violation.get().describe(), group.toString(),
              violation.get().position());
        }
      }
    }
  }

  private static void checkRingsWithinMolecules(ParseResult result) {
    for (Molecule molecule : result.getMolecules()) {
      for (Ring ring : molecule.getRings()) {
        boolean bridging = ring.getMembers().stream().anyMatch(member -> !molecule.containsGroup(member))
            || (ring.isClosed() && !molecule.containsGroup(ring.getEnd()));
        if (bridging) {
          AtomGroup start = result.getGroup(ring.getStart());
          throw ParseDiagnostic.ring("ring structure cannot bridge molecules", start.toString(),
              start.getPosition());
        }
      }
    }
  }

  private static void closeRings(ParseResult result) {
    for (Ring ring : result.getRings()) {
      AtomGroup start = result.getGroup(ring.getStart());
      if (!ring.isClosed()) {
        throw ParseDiagnostic.ring(String.format("unclosed ring '%d'", ring.getDigit()),
            result.getSmiles().substring(start.getPosition()), start.getPosition());
      }
      AtomGroup end = result.getGroup(ring.getEnd());
      if (start.getId() == end.getId()) {
        throw ParseDiagnostic.ring(String.format("ring '%d' opens and closes on the same atom", ring.getDigit()),
            end.toString(), end.getPosition());
      }
      // atoms bonded already keep their bond, the ring resolves through it
      if (start.findBond(end.getId()).isEmpty() && end.findBond(start.getId()).isEmpty()) {
        start.addBond(ring.isAromatic() ? BondType.AROMATIC : BondType.SINGLE, end);
      }
    }
  }

  private static void checkLowercaseAtoms(ParseResult result) {
    for (AtomGroup group : result.getGroupMap().values()) {
      boolean inRing = result.getRings().stream().anyMatch(ring -> ring.getMembers().contains(group.getId()));
      if (group.isLowercase() && !inRing) {
        String text = group.toString();
        throw ParseDiagnostic.syntax(String.format(
            "unexpected lowercase atom outside of ring structure. Did you mean \"%s\" ?",
            StringUtils.capitalize(text)), text, group.getPosition());
      }
    }
  }
}
