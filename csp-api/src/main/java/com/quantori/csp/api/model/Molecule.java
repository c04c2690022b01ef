package com.quantori.csp.api.model;

import com.quantori.csp.api.PathLimitExceededException;
import com.quantori.csp.api.util.FormulaUtilities;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * A set of atom groups keyed by identity, together with the rings fully contained in it.
 * <p>
 * Bonds reference atoms by identity, so groups can be moved between molecules without touching other structures.
 * Every adjacency question goes through {@link #getAllBonds(int)}.
 */
@Slf4j
public class Molecule {
  private final IdentitySource ids;
  private final Map<Integer, AtomGroup> groups = new TreeMap<>();
  private final List<Ring> rings = new ArrayList<>();

  public Molecule(IdentitySource ids) {
    this.ids = ids;
  }

  public Molecule(IdentitySource ids, Collection<AtomGroup> groups) {
    this(ids);
    groups.forEach(this::addGroup);
  }

  public Map<Integer, AtomGroup> getGroups() {
    return Collections.unmodifiableMap(groups);
  }

  public List<Ring> getRings() {
    return Collections.unmodifiableList(rings);
  }

  public AtomGroup getGroup(int id) {
    AtomGroup group = groups.get(id);
    if (group == null) {
      throw new IllegalArgumentException("Atom " + id + " is not part of the molecule");
    }
    return group;
  }

  public boolean containsGroup(int id) {
    return groups.containsKey(id);
  }

  public void addGroup(AtomGroup group) {
    groups.put(group.getId(), group);
  }

  public void addRing(Ring ring) {
    rings.add(ring);
  }

  public boolean isEmpty() {
    return groups.isEmpty();
  }

  public int size() {
    return groups.size();
  }

  /**
   * Calculates the relative molecular mass.
   *
   * @return the sum of the masses of all groups
   */
  public double calculateMr() {
    return groups.values().stream().mapToDouble(AtomGroup::calculateMr).sum();
  }

  /**
   * Finds the stored bond between two atoms, whichever of them stores it.
   *
   * @param id1 an atom
   * @param id2 another atom
   * @return the bond, empty if the atoms are not bonded
   */
  public Optional<Bond> getBond(int id1, int id2) {
    Optional<Bond> bond = getGroup(id1).findBond(id2);
    if (bond.isPresent()) {
      return bond;
    }
    return getGroup(id2).findBond(id1);
  }

  /**
   * Returns every bond touching an atom: its own bonds followed by bonds stored on other atoms pointing to it.
   *
   * @param id the atom
   * @return touching bonds with the neighbor on the other side
   */
  public List<TouchingBond> getAllBonds(int id) {
    List<TouchingBond> bonds = new ArrayList<>();
    for (Bond bond : getGroup(id).getBonds()) {
      bonds.add(new TouchingBond(id, bond.getDest(), bond));
    }
    for (AtomGroup other : groups.values()) {
      if (other.getId() == id) {
        continue;
      }
      for (Bond bond : other.getBonds()) {
        if (bond.getDest() == id) {
          bonds.add(new TouchingBond(id, other.getId(), bond));
        }
      }
    }
    return bonds;
  }

  /**
   * Removes the bond between two atoms.
   *
   * @return false if the atoms were not bonded
   */
  public boolean severBond(int id1, int id2) {
    return getGroup(id1).removeBond(id2) || getGroup(id2).removeBond(id1);
  }

  /**
   * Sums the bond orders of all bonds touching an atom, aromatic bonds counting 1.5.
   *
   * @param id the atom
   * @return the bond count weight
   */
  public double getBondCount(int id) {
    return getAllBonds(id).stream().mapToDouble(bond -> bond.type().getWeight()).sum();
  }

  /**
   * Returns the bond count compared with allowed valences: the weight truncated to an integer, so an atom shared by
   * fused aromatic rings (4.5) counts as 4.
   */
  public int getValenceBondCount(int id) {
    return (int) getBondCount(id);
  }

  /**
   * Evicts every group not reachable from the start atom.
   *
   * @param startId the atom to keep the component of
   * @return the evicted groups keyed by identity
   */
  public Map<Integer, AtomGroup> removeUnbondedGroups(int startId) {
    Set<Integer> bonded = new HashSet<>();
    Deque<Integer> stack = new ArrayDeque<>();
    stack.push(startId);
    while (!stack.isEmpty()) {
      int id = stack.pop();
      if (bonded.add(id)) {
        for (TouchingBond bond : getAllBonds(id)) {
          if (!bonded.contains(bond.neighbor()) && groups.containsKey(bond.neighbor())) {
            stack.push(bond.neighbor());
          }
        }
      }
    }

    Map<Integer, AtomGroup> discarded = new TreeMap<>();
    groups.entrySet().removeIf(entry -> {
      if (bonded.contains(entry.getKey())) {
        return false;
      }
      discarded.put(entry.getKey(), entry.getValue());
      return true;
    });
    log.debug("Removed {} unbonded groups starting from atom {}", discarded.size(), startId);
    return discarded;
  }

  /**
   * Severs a bond and moves the part no longer connected to the first atom into a new molecule.
   *
   * @param id1 the atom whose part stays in this molecule
   * @param id2 the other atom of the bond
   * @return the split off molecule, empty if the bond did not exist or the molecule stayed connected
   */
  public Optional<Molecule> severAndSplit(int id1, int id2) {
    if (!severBond(id1, id2)) {
      return Optional.empty();
    }
    Map<Integer, AtomGroup> discarded = removeUnbondedGroups(id1);
    if (discarded.isEmpty()) {
      return Optional.empty();
    }
    Molecule split = new Molecule(ids, discarded.values());
    rings.removeIf(ring -> {
      if (discarded.keySet().containsAll(ring.getMembers())) {
        split.addRing(ring);
        return true;
      }
      return false;
    });
    return Optional.of(split);
  }

  /**
   * Bonds hydrogens to neutral, non radical organic atoms until their bond count reaches the smallest allowed
   * valence. The hydrogens are flagged implicit.
   *
   * @return the added hydrogens
   */
  public List<AtomGroup> addImplicitHydrogens() {
    List<AtomGroup> added = new ArrayList<>();
    for (AtomGroup group : new ArrayList<>(groups.values())) {
      if (group.isRadical() || group.getCharge() != 0 || !group.isOrganicSubset()) {
        continue;
      }
      int bonds = getValenceBondCount(group.getId());
      OptionalTarget target = smallestValenceAtLeast(group.getValences(), bonds);
      for (int i = 0; target.found && i < target.valence - bonds; i++) {
        AtomGroup hydrogen = new AtomGroup(ids.nextAtomId(), group.getChainDepth() + 1).addElement("H");
        hydrogen.setImplicit(true);
        hydrogen.setPosition(group.getPosition());
        group.addBond(BondType.DEFAULT, hydrogen);
        addGroup(hydrogen);
        added.add(hydrogen);
      }
    }
    return added;
  }

  /**
   * Checks every neutral, non radical organic atom against the allowed valences of its element.
   *
   * @return the first violation, empty if all atoms are valid
   */
  public Optional<BondCountViolation> checkBondCounts() {
    for (AtomGroup group : groups.values()) {
      if (group.getCharge() != 0 || group.isRadical() || !group.isOrganicSubset()) {
        continue;
      }
      int[] valences = group.getValences();
      int bonds = getValenceBondCount(group.getId());
      if (valences.length > 0 && IntStream.of(valences).noneMatch(valence -> valence == bonds)) {
        return Optional.of(
            new BondCountViolation(group.getId(), group.getFirstElement(), group.getPosition(), bonds, valences));
      }
    }
    return Optional.empty();
  }

  /**
   * Turns a ring aromatic: every ring bond becomes {@link BondType#AROMATIC}. A member left with four or more bonds
   * loses one of its hydrogens.
   *
   * @param ringId    the ring
   * @param lowercase mark the members lowercase
   * @throws IllegalArgumentException if the ring is not part of the molecule
   */
  public void aromaticifyRing(int ringId, boolean lowercase) {
    Ring ring = getRing(ringId);
    ring.setAromatic(true);
    forEachRingBond(ring, bond -> bond.setType(BondType.AROMATIC));
    for (int member : ring.getMembers()) {
      AtomGroup group = getGroup(member);
      if (lowercase) {
        group.setLowercase(true);
      }
      List<TouchingBond> bonds = getAllBonds(member);
      if (bonds.size() >= 4) {
        bonds.stream()
            .map(TouchingBond::neighbor)
            .filter(neighbor -> getGroup(neighbor).isElement("H"))
            .findFirst()
            .ifPresent(hydrogen -> {
              severBond(member, hydrogen);
              groups.remove(hydrogen);
            });
      }
    }
  }

  /**
   * Reduces an aromatic ring: every ring bond becomes {@link BondType#SINGLE}, members turn uppercase and each gets
   * one more hydrogen.
   *
   * @param ringId     the ring
   * @param implicitHs flag the added hydrogens implicit
   * @return the added hydrogens
   * @throws IllegalArgumentException if the ring is not part of the molecule
   */
  public List<AtomGroup> deAromaticifyRing(int ringId, boolean implicitHs) {
    Ring ring = getRing(ringId);
    ring.setAromatic(false);
    forEachRingBond(ring, bond -> bond.setType(BondType.SINGLE));
    List<AtomGroup> added = new ArrayList<>();
    for (int member : ring.getMembers()) {
      AtomGroup group = getGroup(member);
      group.setLowercase(false);
      AtomGroup hydrogen = new AtomGroup(ids.nextAtomId(), group.getChainDepth() + 1).addElement("H");
      hydrogen.setImplicit(implicitHs);
      hydrogen.setPosition(group.getPosition());
      group.addBond(BondType.SINGLE, hydrogen);
      addGroup(hydrogen);
      added.add(hydrogen);
    }
    return added;
  }

  private Ring getRing(int ringId) {
    return rings.stream()
        .filter(ring -> ring.getId() == ringId)
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Ring " + ringId + " is not part of the molecule"));
  }

  private void forEachRingBond(Ring ring, Consumer<Bond> action) {
    List<Integer> members = ring.getMembers();
    for (int i = 0; i < members.size(); i++) {
      int from = members.get(i);
      int to = members.get((i + 1) % members.size());
      action.accept(getBond(from, to)
          .orElseThrow(() -> new IllegalStateException("Ring " + ring.getId() + " members are not bonded")));
    }
  }

  /**
   * Matches a tree shaped pattern rooted at every atom.
   *
   * @param pattern   the pattern
   * @param matchMany report all matches, otherwise stop at the first one
   * @return the matches
   */
  public List<SubstructureMatch> matchMolecule(MatchAtom pattern, boolean matchMany) {
    SubstructureMatcher matcher = new SubstructureMatcher(this);
    List<SubstructureMatch> matches = new ArrayList<>();
    for (int id : groups.keySet()) {
      Map<String, Integer> record = new LinkedHashMap<>();
      if (matcher.match(id, pattern, null, new HashSet<>(), record)) {
        matches.add(new SubstructureMatch(record, null));
        if (!matchMany) {
          break;
        }
      }
    }
    return matches;
  }

  /**
   * Scans rings with the given members, in ring order and in any rotation. The bond of member {@code k} describes
   * the bond from member {@code k - 1}; ring members are never used for the {@code bondedTo} patterns.
   *
   * @param ringMembers patterns of the ring members
   * @param aromatic    required aromaticity of the ring
   * @param matchMany   report all matches, otherwise stop at the first one
   * @return the matches, each carrying the matched ring
   */
  public List<SubstructureMatch> matchRing(List<MatchAtom> ringMembers, boolean aromatic, boolean matchMany) {
    SubstructureMatcher matcher = new SubstructureMatcher(this);
    List<SubstructureMatch> matches = new ArrayList<>();
    for (Ring ring : rings) {
      if (ring.size() != ringMembers.size() || ring.isAromatic() != aromatic) {
        continue;
      }
      Optional<Map<String, Integer>> record = matcher.matchRing(ring, ringMembers);
      if (record.isPresent()) {
        matches.add(new SubstructureMatch(record.get(), ring.getId()));
        if (!matchMany) {
          break;
        }
      }
    }
    return matches;
  }

  /**
   * Matches benzene rings with one substituted carbon, the other five carrying hydrogens. Ring carbons are labeled
   * {@code 0} to {@code 5}, {@code 0} being the carbon bonded to the substituent.
   *
   * @param substituent pattern of the substituent, a hydrogen if {@code null}
   * @param matchMany   report all matches, otherwise stop at the first one
   * @return the matches
   */
  public List<SubstructureMatch> matchBenzene(MatchAtom substituent, boolean matchMany) {
    MatchAtom pattern = substituent == null ? MatchAtom.of("H") : substituent;
    SubstructureMatcher matcher = new SubstructureMatcher(this);
    List<SubstructureMatch> matches = new ArrayList<>();
    for (Ring ring : rings) {
      if (!ring.isAromatic() || ring.size() != 6) {
        continue;
      }
      Optional<Map<String, Integer>> record = matcher.matchBenzene(ring, pattern);
      if (record.isPresent()) {
        matches.add(new SubstructureMatch(record.get(), ring.getId()));
        if (!matchMany) {
          break;
        }
      }
    }
    return matches;
  }

  /**
   * Counts atoms, either per group or per element, tagged by the charge of their group.
   *
   * @param options counting options
   * @return the counts, in Hill order if requested
   */
  public List<AtomCount> countAtoms(CountAtomsOptions options) {
    Map<String, AtomCount> counts = new LinkedHashMap<>();
    for (AtomGroup group : groups.values()) {
      if (options.isSplitGroups()) {
        group.getElements().forEach((element, count) -> counts.merge(
            element, new AtomCount(element, null, count), (a, b) -> a.add(b.count())));
      } else {
        int charge = options.isIgnoreCharge() ? 0 : group.getCharge();
        String atom = group.getElementString();
        counts.merge(atom + '{' + charge + '}', new AtomCount(atom, charge, 1), (a, b) -> a.add(1));
      }
    }
    List<AtomCount> atoms = new ArrayList<>(counts.values());
    if (options.isHillSystemOrder()) {
      atoms.sort(Comparator.comparingInt(Molecule::hillRank)
          .thenComparing(count -> hillRank(count) == 2 ? count.atom() : "")
          .thenComparingInt(AtomCount::chargeOrZero));
    }
    return atoms;
  }

  /**
   * Counts neighbors of an atom that are one of the given elements.
   */
  public int countBondedElements(int id, Collection<String> elements, boolean includeImplicit) {
    String[] symbols = elements.toArray(new String[0]);
    return (int) getAllBonds(id).stream()
        .map(bond -> getGroup(bond.neighbor()))
        .filter(group -> includeImplicit || !group.isImplicit())
        .filter(group -> group.isElement(symbols))
        .count();
  }

  /**
   * Generates the molecular formula, e.g. {@code C2H4O2}. Charges are ignored, bracket groups kept whole.
   */
  public String generateMolecularFormula(CountAtomsOptions options, boolean html) {
    return FormulaUtilities.assembleMolecularFormula(countAtoms(options.toBuilder().ignoreCharge(true).build()), html);
  }

  public String generateMolecularFormula() {
    return generateMolecularFormula(CountAtomsOptions.defaults(), false);
  }

  /**
   * Generates the empirical formula, e.g. {@code CH2O} for {@code C2H4O2}.
   */
  public String generateEmpiricalFormula(boolean html, boolean useHillSystem) {
    CountAtomsOptions options = CountAtomsOptions.builder().splitGroups(true).hillSystemOrder(useHillSystem).build();
    return FormulaUtilities.assembleEmpiricalFormula(countAtoms(options), html);
  }

  /**
   * Generates the condensed formula, e.g. {@code CH3COOH}. Each atom absorbs its neighbors that have no other bonds.
   *
   * @param html                    mark counts up as subscripts
   * @param collapseSuccessiveUnits write repeated units once with a count, e.g. {@code CH3(CH2)2CH3}
   * @return the condensed formula
   */
  public String generateCondensedFormula(boolean html, boolean collapseSuccessiveUnits) {
    if (groups.isEmpty()) {
      return "";
    }
    List<Map<String, Integer>> units = new ArrayList<>();
    Set<Integer> done = new HashSet<>();
    Deque<Integer> stack = new ArrayDeque<>();
    stack.push(groups.keySet().iterator().next());
    while (!stack.isEmpty()) {
      int id = stack.pop();
      if (!done.add(id)) {
        continue;
      }
      Map<String, Integer> unit = new LinkedHashMap<>();
      unit.put(getGroup(id).toFormulaString(html), 1);
      List<TouchingBond> bonds = getAllBonds(id);
      for (TouchingBond bond : bonds) {
        int neighbor = bond.neighbor();
        if (!done.contains(neighbor) && getAllBonds(neighbor).size() == 1) {
          unit.merge(getGroup(neighbor).toFormulaString(html), 1, Integer::sum);
          done.add(neighbor);
        }
      }
      for (int i = bonds.size() - 1; i >= 0; i--) {
        if (!done.contains(bonds.get(i).neighbor())) {
          stack.push(bonds.get(i).neighbor());
        }
      }
      units.add(unit);
    }
    List<String> segments = units.stream().map(unit -> FormulaUtilities.condensedUnit(unit, html)).toList();
    return collapseSuccessiveUnits
        ? FormulaUtilities.collapseRepeats(segments, html)
        : String.join("", segments);
  }

  /**
   * Writes the molecule as SMILES.
   *
   * @param showImplicits include atoms flagged implicit
   * @return SMILES text, not necessarily equal to any original input
   */
  public String generateSmiles(boolean showImplicits) {
    return new SmilesWriter(this, showImplicits).write();
  }

  /**
   * Enumerates simple paths between two atoms.
   * <p>
   * Each path is the sequence of indexes into {@link #getAllBonds(int)} of the atom the step starts from, so callers
   * can replay the exact bonds; see {@link #traceBondPath(int, List)}.
   *
   * @param startId the first atom
   * @param endId   the last atom
   * @param allowed atoms a path may visit, any atom if {@code null}
   * @param limit   the largest number of paths to collect, unlimited if not positive
   * @return the paths
   * @throws PathLimitExceededException if more than {@code limit} paths exist
   */
  public List<List<Integer>> pathfind(int startId, int endId, Collection<Integer> allowed, int limit) {
    Set<Integer> allowedSet = allowed == null ? null : new HashSet<>(allowed);
    Map<Integer, List<TouchingBond>> allBonds = new HashMap<>();
    List<List<Integer>> paths = new ArrayList<>();
    List<Integer> current = new ArrayList<>();
    Set<Integer> onPath = new HashSet<>();
    // frame: atom, index of the next bond to explore
    Deque<int[]> frames = new ArrayDeque<>();
    frames.push(new int[] {startId, 0});
    onPath.add(startId);

    while (!frames.isEmpty()) {
      int[] frame = frames.peek();
      if (frame[0] == endId) {
        paths.add(List.copyOf(current));
        if (limit > 0 && paths.size() > limit) {
          throw new PathLimitExceededException(startId, endId, limit);
        }
        backtrack(frames, onPath, current);
        continue;
      }
      List<TouchingBond> bonds = allBonds.computeIfAbsent(frame[0], this::getAllBonds);
      if (frame[1] < bonds.size()) {
        int index = frame[1]++;
        int next = bonds.get(index).neighbor();
        if (onPath.contains(next) || !groups.containsKey(next)
            || (allowedSet != null && !allowedSet.contains(next))) {
          continue;
        }
        current.add(index);
        onPath.add(next);
        frames.push(new int[] {next, 0});
      } else {
        backtrack(frames, onPath, current);
      }
    }
    return paths;
  }

  /**
   * Replays a path found by {@link #pathfind(int, int, Collection, int)}.
   *
   * @return the visited atoms, starting with {@code startId}
   */
  public List<Integer> traceBondPath(int startId, List<Integer> path) {
    List<Integer> atoms = new ArrayList<>(path.size() + 1);
    atoms.add(startId);
    int current = startId;
    for (int index : path) {
      current = getAllBonds(current).get(index).neighbor();
      atoms.add(current);
    }
    return atoms;
  }

  @Override
  public String toString() {
    return groups.values().stream().map(AtomGroup::toString).collect(Collectors.joining(",", "Molecule[", "]"));
  }

  private static void backtrack(Deque<int[]> frames, Set<Integer> onPath, List<Integer> current) {
    onPath.remove(frames.pop()[0]);
    if (!current.isEmpty()) {
      current.remove(current.size() - 1);
    }
  }

  private static int hillRank(AtomCount count) {
    if ("C".equals(count.atom())) {
      return 0;
    }
    return "H".equals(count.atom()) ? 1 : 2;
  }

  private static OptionalTarget smallestValenceAtLeast(int[] valences, int bonds) {
    for (int valence : valences) {
      if (valence >= bonds) {
        return new OptionalTarget(true, valence);
      }
    }
    return new OptionalTarget(false, 0);
  }

  private record OptionalTarget(boolean found, int valence) {
  }
}
