package com.quantori.csp.api.model;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Backtracking matcher for {@link MatchAtom} patterns. Every failed attempt restores the used atoms and the record
 * to the state before the attempt.
 */
final class SubstructureMatcher {
  private final Molecule molecule;

  SubstructureMatcher(Molecule molecule) {
    this.molecule = molecule;
  }

  boolean match(int atomId, MatchAtom pattern, Integer fromId, Set<Integer> used, Map<String, Integer> record) {
    AtomGroup group = molecule.getGroup(atomId);
    if (pattern.getAtom() != null && !pattern.getAtom().equals(group.getElementString())) {
      return false;
    }
    if (pattern.getCharge() != null && pattern.getCharge() != group.getCharge()) {
      return false;
    }
    if (pattern.getBond() != null && fromId != null) {
      Optional<Bond> bond = molecule.getBond(fromId, atomId);
      if (bond.isEmpty() || !pattern.getBond().matches(bond.get().getType())) {
        return false;
      }
    }

    Set<Integer> usedBefore = new HashSet<>(used);
    Map<String, Integer> recordBefore = new LinkedHashMap<>(record);
    used.add(atomId);
    if (pattern.getLabel() != null) {
      record.put(pattern.getLabel(), atomId);
    }
    if (matchNeighbors(atomId, pattern.getBondedTo(), 0, used, record)) {
      return true;
    }
    restore(used, usedBefore, record, recordBefore);
    return false;
  }

  private boolean matchNeighbors(int atomId, List<MatchAtom> patterns, int index, Set<Integer> used,
      Map<String, Integer> record) {
    if (index == patterns.size()) {
      return true;
    }
    for (TouchingBond bond : molecule.getAllBonds(atomId)) {
      int neighbor = bond.neighbor();
      if (used.contains(neighbor) || !molecule.containsGroup(neighbor)) {
        continue;
      }
      Set<Integer> usedBefore = new HashSet<>(used);
      Map<String, Integer> recordBefore = new LinkedHashMap<>(record);
      if (match(neighbor, patterns.get(index), atomId, used, record)
          && matchNeighbors(atomId, patterns, index + 1, used, record)) {
        return true;
      }
      restore(used, usedBefore, record, recordBefore);
    }
    return false;
  }

  Optional<Map<String, Integer>> matchRing(Ring ring, List<MatchAtom> patterns) {
    List<Integer> members = ring.getMembers();
    int size = members.size();
    for (int rotation = 0; rotation < size; rotation++) {
      Map<String, Integer> record = new LinkedHashMap<>();
      Set<Integer> used = new HashSet<>(members);
      boolean matched = true;
      for (int j = 0; j < size && matched; j++) {
        int index = (rotation + j) % size;
        int member = members.get(index);
        MatchAtom pattern = patterns.get(j);
        if (pattern.getBond() != null) {
          Optional<Bond> bond = molecule.getBond(members.get((index - 1 + size) % size), member);
          matched = bond.isPresent() && pattern.getBond().matches(bond.get().getType());
        }
        matched = matched && match(member, pattern, null, used, record);
      }
      if (matched) {
        return Optional.of(record);
      }
    }
    return Optional.empty();
  }

  Optional<Map<String, Integer>> matchBenzene(Ring ring, MatchAtom substituent) {
    List<Integer> members = ring.getMembers();
    int carbons = 0;
    int hydrogens = 0;
    int substituted = -1;
    Map<String, Integer> substituentRecord = new LinkedHashMap<>();
    for (int i = 0; i < members.size(); i++) {
      int member = members.get(i);
      if (!molecule.getGroup(member).isElement("C")) {
        continue;
      }
      carbons++;
      Optional<TouchingBond> outside = molecule.getAllBonds(member).stream()
          .filter(bond -> !members.contains(bond.neighbor()) && molecule.containsGroup(bond.neighbor()))
          .findFirst();
      if (outside.isEmpty()) {
        continue;
      }
      int neighbor = outside.get().neighbor();
      if (substituted == -1 && match(neighbor, substituent, member, new HashSet<>(members), substituentRecord)) {
        substituted = i;
      } else if (molecule.getGroup(neighbor).isElement("H")) {
        hydrogens++;
      }
    }
    if (carbons != 6 || hydrogens != 5 || substituted == -1) {
      return Optional.empty();
    }
    Map<String, Integer> record = new LinkedHashMap<>();
    for (int i = 0; i < 6; i++) {
      record.put(String.valueOf(i), members.get((substituted + i) % 6));
    }
    record.putAll(substituentRecord);
    return Optional.of(record);
  }

  private static void restore(Set<Integer> used, Set<Integer> usedBefore, Map<String, Integer> record,
      Map<String, Integer> recordBefore) {
    used.clear();
    used.addAll(usedBefore);
    record.clear();
    record.putAll(recordBefore);
  }
}
