package com.quantori.csp.core.parser;

import com.quantori.csp.api.PathLimitExceededException;
import com.quantori.csp.api.model.AtomGroup;
import com.quantori.csp.api.model.Bond;
import com.quantori.csp.api.model.BondType;
import com.quantori.csp.api.model.Molecule;
import com.quantori.csp.api.model.Ring;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;

/**
 * Replaces the candidate members collected while parsing with the real cycle of a ring and checks its aromaticity.
 * <p>
 * The cycle is the longest simple path between the start and end atoms through the candidates.
 */
@Slf4j
class RingResolver {
  private final int maxPaths;

  RingResolver(int maxPaths) {
    this.maxPaths = maxPaths;
  }

  void resolve(Molecule molecule, Ring ring) {
    List<List<Integer>> paths;
    try {
      paths = molecule.pathfind(ring.getStart(), ring.getEnd(), ring.getMembers(), maxPaths);
    } catch (PathLimitExceededException e) {
      AtomGroup start = molecule.getGroup(ring.getStart());
      throw ParseDiagnostic.ring(String.format("ring '%d' has more than %d candidate paths", ring.getDigit(),
          e.getLimit()), start.toString(), start.getPosition());
    }
    log.trace("Ring {} from atom {} to atom {}: {} candidate paths", ring.getDigit(), ring.getStart(), ring.getEnd(),
        paths.size());
    List<Integer> longest = paths.stream().max(Comparator.comparingInt(List::size)).orElse(List.of());
    ring.setMembers(molecule.traceBondPath(ring.getStart(), longest));

    checkCase(molecule, ring);
    if (ring.isAromatic()) {
      checkAromaticBonds(molecule, ring);
    }
  }

  private static void checkCase(Molecule molecule, Ring ring) {
    List<Integer> members = ring.getMembers();
    boolean lowercase = molecule.getGroup(members.get(0)).isLowercase();
    for (int i = 1; i < members.size(); i++) {
      AtomGroup member = molecule.getGroup(members.get(i));
      if (member.isLowercase() != lowercase) {
        String detail = lowercase
            ? "expected lowercase ring atom [b,c,n,o,p,s,se,as] in aromatic ring"
            : "unexpected lowercase atom in ring";
        throw ParseDiagnostic.ring(detail, member.toString(), member.getPosition());
      }
    }
  }

  private static void checkAromaticBonds(Molecule molecule, Ring ring) {
    List<Integer> members = ring.getMembers();
    boolean lowercase = molecule.getGroup(members.get(0)).isLowercase();
    for (int i = 0; i < members.size() - 1; i++) {
      Bond bond = molecule.getBond(members.get(i), members.get(i + 1))
          .orElseThrow(() -> new IllegalStateException("Resolved ring members are not bonded"));
      if (lowercase) {
        bond.setType(BondType.AROMATIC);
      } else if (bond.getType() != BondType.AROMATIC) {
        AtomGroup member = molecule.getGroup(members.get(i + 1));
        throw ParseDiagnostic.ring(String.format("expected aromatic bond ':' in aromatic ring, got bond '%s'",
            bond.getType().getSymbol()), member.toString(), member.getPosition());
      }
    }
  }
}
