package com.quantori.csp.api.model;

import com.quantori.csp.api.layout.MoleculeLayout;
import com.quantori.csp.api.layout.PositionData;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Result of parsing one input: the molecules, all rings, a lookup of atoms across molecules and the positions of
 * reaction arrows.
 * <p>
 * A reaction arrow {@code >} records the index of the molecule preceding it; an empty agent zone ({@code >>})
 * records the same index twice.
 */
@Getter
public class ParseResult {
  private final String smiles;
  private final ParseOptions options;
  private final IdentitySource ids = new IdentitySource();
  private final List<Molecule> molecules = new ArrayList<>();
  private final List<Ring> rings = new ArrayList<>();
  private final Map<Integer, AtomGroup> groupMap = new TreeMap<>();
  private final List<Integer> reactionIndexes = new ArrayList<>();

  public ParseResult(String smiles, ParseOptions options) {
    this.smiles = Objects.requireNonNull(smiles, "smiles");
    this.options = Objects.requireNonNull(options, "options");
    molecules.add(new Molecule(ids));
  }

  public List<Molecule> getMolecules() {
    return Collections.unmodifiableList(molecules);
  }

  public List<Ring> getRings() {
    return Collections.unmodifiableList(rings);
  }

  public Map<Integer, AtomGroup> getGroupMap() {
    return Collections.unmodifiableMap(groupMap);
  }

  public List<Integer> getReactionIndexes() {
    return Collections.unmodifiableList(reactionIndexes);
  }

  public Molecule currentMolecule() {
    return molecules.get(molecules.size() - 1);
  }

  public Molecule startMolecule() {
    Molecule molecule = new Molecule(ids);
    molecules.add(molecule);
    return molecule;
  }

  public AtomGroup createGroup(int chainDepth) {
    return new AtomGroup(ids.nextAtomId(), chainDepth);
  }

  public Ring createRing(int digit, int start) {
    return new Ring(ids.nextRingId(), digit, start);
  }

  public void registerGroup(Molecule molecule, AtomGroup group) {
    molecule.addGroup(group);
    groupMap.put(group.getId(), group);
  }

  public void registerRing(Ring ring) {
    rings.add(ring);
  }

  public void addReactionIndex(int index) {
    reactionIndexes.add(index);
  }

  public AtomGroup getGroup(int id) {
    AtomGroup group = groupMap.get(id);
    if (group == null) {
      throw new IllegalArgumentException("Atom " + id + " is not part of the result");
    }
    return group;
  }

  /**
   * Finds the molecule owning an atom.
   *
   * @param id the atom
   * @return the owning molecule, {@code null} if no molecule owns it
   */
  public Molecule findMolecule(int id) {
    return molecules.stream().filter(molecule -> molecule.containsGroup(id)).findFirst().orElse(null);
  }

  /**
   * Inserts a molecule. Reaction arrows after the insertion point move with the molecules they follow.
   *
   * @param molecule the molecule, with atoms and rings not yet part of this result
   * @param position index to insert at
   */
  public void addMolecule(Molecule molecule, int position) {
    if (position < 0 || position > molecules.size()) {
      throw new IllegalArgumentException("Position " + position + " is outside of 0.." + molecules.size());
    }
    reactionIndexes.replaceAll(index -> index >= position ? index + 1 : index);
    molecules.add(position, molecule);
    groupMap.putAll(molecule.getGroups());
    rings.addAll(molecule.getRings());
  }

  /**
   * Removes a molecule together with its atoms and rings. Reaction arrows after it move one molecule back.
   *
   * @param molecule the molecule to remove
   * @return false if the molecule is not part of this result
   */
  public boolean removeMolecule(Molecule molecule) {
    int position = molecules.indexOf(molecule);
    if (position < 0) {
      return false;
    }
    molecules.remove(position);
    reactionIndexes.replaceAll(index -> index >= position && index > 0 ? index - 1 : index);
    rings.removeAll(molecule.getRings());
    molecule.getGroups().keySet().forEach(groupMap::remove);
    return true;
  }

  /**
   * Adds implicit hydrogens to every molecule.
   *
   * @return the added hydrogens
   */
  public List<AtomGroup> addImplicitHydrogens() {
    List<AtomGroup> added = new ArrayList<>();
    for (Molecule molecule : molecules) {
      for (AtomGroup hydrogen : molecule.addImplicitHydrogens()) {
        groupMap.put(hydrogen.getId(), hydrogen);
        added.add(hydrogen);
      }
    }
    return added;
  }

  public double calculateMr() {
    return molecules.stream().mapToDouble(Molecule::calculateMr).sum();
  }

  public String generateMolecularFormula(CountAtomsOptions options, boolean html) {
    return joinMolecules(molecule -> molecule.generateMolecularFormula(options, html));
  }

  public String generateMolecularFormula() {
    return generateMolecularFormula(CountAtomsOptions.defaults(), false);
  }

  public String generateEmpiricalFormula(boolean html, boolean useHillSystem) {
    return joinMolecules(molecule -> molecule.generateEmpiricalFormula(html, useHillSystem));
  }

  public String generateCondensedFormula(boolean html, boolean collapseSuccessiveUnits) {
    return joinMolecules(molecule -> molecule.generateCondensedFormula(html, collapseSuccessiveUnits));
  }

  /**
   * Matches a pattern in every molecule.
   *
   * @return matches of all molecules, in molecule order
   */
  public List<SubstructureMatch> matchMolecule(MatchAtom pattern, boolean matchMany) {
    List<SubstructureMatch> matches = new ArrayList<>();
    for (Molecule molecule : molecules) {
      matches.addAll(molecule.matchMolecule(pattern, matchMany));
      if (!matchMany && !matches.isEmpty()) {
        break;
      }
    }
    return matches;
  }

  /**
   * Writes all molecules as SMILES, separated by {@code .} or by the recorded reaction arrows.
   *
   * @param showImplicits include implicit atoms
   * @return the SMILES text
   */
  public String generateSmiles(boolean showImplicits) {
    StringBuilder smiles = new StringBuilder();
    int arrow = 0;
    for (int i = 0; i < molecules.size(); i++) {
      smiles.append(molecules.get(i).generateSmiles(showImplicits));
      if (i == molecules.size() - 1) {
        break;
      }
      if (arrow < reactionIndexes.size() && reactionIndexes.get(arrow) == i) {
        smiles.append('>');
        arrow++;
        if (arrow < reactionIndexes.size() && reactionIndexes.get(arrow) == i) {
          smiles.append('>');
          arrow++;
        }
      } else {
        smiles.append('.');
      }
    }
    return smiles.toString();
  }

  /**
   * Lays out every molecule.
   *
   * @param layout the layout collaborator
   * @return one geometry record per molecule, in molecule order
   */
  public List<PositionData> getPositionData(MoleculeLayout layout) {
    return molecules.stream().map(layout::layout).collect(Collectors.toList());
  }

  private String joinMolecules(Function<Molecule, String> formula) {
    return molecules.stream().map(formula).collect(Collectors.joining("."));
  }
}
