package com.quantori.csp.api.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.containsInAnyOrder;

import com.quantori.csp.api.PathLimitExceededException;
import org.apache.commons.lang3.StringUtils;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

class MoleculeTest {

  private static Molecule ethanol() {
    return new MoleculeBuilder().chain(BondType.DEFAULT, "C", "C", "O").build();
  }

  private static Molecule cyclopropane() {
    return new MoleculeBuilder()
        .chain(BondType.DEFAULT, "C", "C", "C")
        .bond(0, 2, BondType.SINGLE)
        .ring(false, 0, 1, 2)
        .build();
  }

  @Test
  void testAllBondsSeeBothDirections() {
    Molecule molecule = ethanol();
    List<Integer> neighbors = molecule.getAllBonds(1).stream().map(TouchingBond::neighbor).toList();
    Assertions.assertAll(
        () -> assertThat(neighbors).containsExactly(2, 0),
        () -> assertThat(molecule.getBond(1, 0)).isPresent(),
        () -> assertThat(molecule.getBond(0, 2)).isEmpty(),
        () -> Assertions.assertEquals(2.0, molecule.getBondCount(1))
    );
  }

  @Test
  void testUnknownAtomIsRejected() {
    Molecule molecule = ethanol();
    assertThatThrownBy(() -> molecule.getGroup(42)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void testImplicitHydrogensOfEthanol() {
    Molecule molecule = ethanol();
    List<AtomGroup> added = molecule.addImplicitHydrogens();
    Assertions.assertAll(
        () -> assertThat(added).hasSize(6).allMatch(AtomGroup::isImplicit),
        () -> assertThat(molecule.generateMolecularFormula()).isEqualTo("C2H6O"),
        () -> assertThat(molecule.checkBondCounts()).isEmpty(),
        () -> assertThat(molecule.generateSmiles(false)).isEqualTo("CCO"),
        () -> Assertions.assertEquals(6, StringUtils.countMatches(molecule.generateSmiles(true), "[H]"))
    );
  }

  @Test
  void testRadicalAndChargedAtomsGetNoHydrogens() {
    MoleculeBuilder builder = new MoleculeBuilder().atom("C").atom("N");
    builder.get(0).setRadical(true);
    builder.get(1).setCharge(1);
    assertThat(builder.build().addImplicitHydrogens()).isEmpty();
  }

  @Test
  void testBondCountViolation() {
    MoleculeBuilder builder = new MoleculeBuilder().atom("C");
    for (int i = 1; i <= 5; i++) {
      builder.atom("Cl").bond(0, i, BondType.DEFAULT);
    }
    Optional<BondCountViolation> violation = builder.build().checkBondCounts();
    assertThat(violation).isPresent();
    Assertions.assertAll(
        () -> Assertions.assertEquals(0, violation.get().atomId()),
        () -> Assertions.assertEquals(5, violation.get().bondCount()),
        () -> assertThat(violation.get().describe())
            .isEqualTo("invalid bond count for organic atom 'C': 5. Expected 4.")
    );
  }

  @Test
  void testAromaticBondsCountOneAndAHalf() {
    Molecule benzene = MoleculeBuilder.benzene();
    Assertions.assertEquals(3.0, benzene.getBondCount(0));
    benzene.addImplicitHydrogens();
    Assertions.assertAll(
        () -> assertThat(benzene.generateMolecularFormula()).isEqualTo("C6H6"),
        () -> assertThat(benzene.checkBondCounts()).isEmpty(),
        () -> assertThat(benzene.generateSmiles(false)).isEqualTo("c1ccccc1")
    );
  }

  @Test
  void testDeAromaticifyRing() {
    Molecule benzene = MoleculeBuilder.benzene();
    benzene.addImplicitHydrogens();
    List<AtomGroup> added = benzene.deAromaticifyRing(0, true);
    Ring ring = benzene.getRings().get(0);
    Assertions.assertAll(
        () -> assertThat(added).hasSize(6).allMatch(AtomGroup::isImplicit),
        () -> assertThat(ring.isAromatic()).isFalse(),
        () -> assertThat(benzene.getGroup(0).isLowercase()).isFalse(),
        () -> assertThat(benzene.getBond(5, 0)).map(Bond::getType).contains(BondType.SINGLE),
        () -> assertThat(benzene.generateMolecularFormula()).isEqualTo("C6H12"),
        () -> assertThat(benzene.checkBondCounts()).isEmpty()
    );
  }

  @Test
  void testAromaticifyRingDropsSurplusHydrogens() {
    Molecule benzene = MoleculeBuilder.benzene();
    benzene.addImplicitHydrogens();
    benzene.deAromaticifyRing(0, true);
    benzene.aromaticifyRing(0, true);
    Assertions.assertAll(
        () -> assertThat(benzene.getRings().get(0).isAromatic()).isTrue(),
        () -> assertThat(benzene.getBond(2, 3)).map(Bond::getType).contains(BondType.AROMATIC),
        () -> assertThat(benzene.generateMolecularFormula()).isEqualTo("C6H6"),
        () -> assertThat(benzene.checkBondCounts()).isEmpty(),
        () -> assertThat(benzene.generateSmiles(false)).isEqualTo("c1ccccc1")
    );
  }

  @Test
  void testUnknownRingIsRejected() {
    Molecule benzene = MoleculeBuilder.benzene();
    assertThatThrownBy(() -> benzene.aromaticifyRing(7, true))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Ring 7");
  }

  @Test
  void testPathfindReturnsBondIndexes() {
    Molecule molecule = cyclopropane();
    List<List<Integer>> paths = molecule.pathfind(0, 2, null, 0);
    assertThat(paths, containsInAnyOrder(List.of(0, 0), List.of(1)));
    assertThat(molecule.traceBondPath(0, List.of(0, 0))).containsExactly(0, 1, 2);
  }

  @Test
  void testPathfindRespectsAllowedAtoms() {
    Molecule molecule = cyclopropane();
    assertThat(molecule.pathfind(0, 2, List.of(0, 2), 0)).containsExactly(List.of(1));
  }

  @Test
  void testPathfindLimit() {
    Molecule molecule = cyclopropane();
    assertThatThrownBy(() -> molecule.pathfind(0, 2, null, 1))
        .isInstanceOf(PathLimitExceededException.class)
        .hasMessageContaining("more than 1 paths");
  }

  @Test
  void testRingIsWrittenWithClosureDigit() {
    assertThat(cyclopropane().generateSmiles(false)).isEqualTo("C1CC1");
  }

  @Test
  void testMultipleBondIsWrittenAsBranch() {
    Molecule molecule = new MoleculeBuilder()
        .chain(BondType.DEFAULT, "C", "C", "O")
        .atom("O").bond(1, 3, BondType.DOUBLE)
        .build();
    assertThat(molecule.generateSmiles(false)).isEqualTo("CC(=O)O");
  }

  @Test
  void testDisconnectedPartsAreSeparated() {
    Molecule molecule = new MoleculeBuilder().atom("C").atom("O").build();
    assertThat(molecule.generateSmiles(false)).isEqualTo("C.O");
  }

  @Test
  void testSevering() {
    Molecule molecule = ethanol();
    Optional<Molecule> split = molecule.severAndSplit(1, 2);
    assertThat(split).isPresent();
    Assertions.assertAll(
        () -> assertThat(molecule.getGroups().keySet()).containsExactly(0, 1),
        () -> assertThat(split.get().getGroups().keySet()).containsExactly(2),
        () -> assertThat(molecule.severBond(1, 2)).isFalse()
    );
  }

  @Test
  void testSeveringRingBondKeepsMoleculeWhole() {
    Molecule molecule = cyclopropane();
    Assertions.assertAll(
        () -> assertThat(molecule.severAndSplit(0, 1)).isEmpty(),
        () -> assertThat(molecule.getGroups()).hasSize(3),
        () -> assertThat(molecule.getBond(0, 1)).isEmpty()
    );
  }

  @Test
  void testSplitMovesContainedRings() {
    Molecule molecule = new MoleculeBuilder()
        .chain(BondType.DEFAULT, "O", "C", "C", "C")
        .bond(1, 3, BondType.SINGLE)
        .ring(false, 1, 2, 3)
        .build();
    Molecule split = molecule.severAndSplit(0, 1).orElseThrow();
    Assertions.assertAll(
        () -> assertThat(molecule.getRings()).isEmpty(),
        () -> assertThat(split.getRings()).hasSize(1),
        () -> assertThat(split.generateSmiles(false)).isEqualTo("C1CC1")
    );
  }

  @Test
  void testRemoveUnbondedGroups() {
    Molecule molecule = new MoleculeBuilder().chain(BondType.DEFAULT, "C", "C").atom("N").build();
    Map<Integer, AtomGroup> discarded = molecule.removeUnbondedGroups(0);
    Assertions.assertAll(
        () -> assertThat(discarded.keySet()).containsExactly(2),
        () -> assertThat(molecule.getGroups().keySet()).containsExactly(0, 1)
    );
  }

  @Test
  void testHillOrder() {
    Molecule molecule = new MoleculeBuilder().atom("O").atom("C").atom("H").atom("Br").atom("C").build();
    assertThat(molecule.countAtoms(CountAtomsOptions.defaults())).containsExactly(
        new AtomCount("C", 0, 2), new AtomCount("H", 0, 1), new AtomCount("Br", 0, 1), new AtomCount("O", 0, 1));
  }

  @Test
  void testCountsAreTaggedByCharge() {
    MoleculeBuilder builder = new MoleculeBuilder().atom("N").atom("N").atom("N");
    builder.get(0).setCharge(1);
    builder.get(2).setCharge(-1);
    Molecule molecule = builder.build();
    Assertions.assertAll(
        () -> assertThat(molecule.countAtoms(CountAtomsOptions.defaults())).containsExactly(
            new AtomCount("N", -1, 1), new AtomCount("N", 0, 1), new AtomCount("N", 1, 1)),
        () -> assertThat(molecule.countAtoms(CountAtomsOptions.builder().ignoreCharge(true).build()))
            .containsExactly(new AtomCount("N", 0, 3))
    );
  }

  @Test
  void testSplitGroupsCountsElements() {
    MoleculeBuilder builder = new MoleculeBuilder().atom("N").atom("Cl");
    builder.get(0).addElement("H", 4);
    Molecule molecule = builder.build();
    List<AtomCount> counts = molecule.countAtoms(CountAtomsOptions.builder().splitGroups(true).build());
    Assertions.assertAll(
        () -> assertThat(counts).containsExactly(
            new AtomCount("H", null, 4), new AtomCount("Cl", null, 1), new AtomCount("N", null, 1)),
        () -> assertThat(molecule.generateMolecularFormula()).isEqualTo("ClNH4")
    );
  }

  @Test
  void testEmpiricalFormula() {
    Molecule molecule = new MoleculeBuilder()
        .chain(BondType.DEFAULT, "C", "C", "O").atom("O").bond(1, 3, BondType.DOUBLE)
        .build();
    molecule.addImplicitHydrogens();
    Assertions.assertAll(
        () -> assertThat(molecule.generateMolecularFormula()).isEqualTo("C2H4O2"),
        () -> assertThat(molecule.generateEmpiricalFormula(false, true)).isEqualTo("CH2O"),
        () -> assertThat(molecule.generateEmpiricalFormula(true, true)).isEqualTo("CH<sub>2</sub>O")
    );
  }

  @Test
  void testCondensedFormula() {
    Molecule ethanol = ethanol();
    ethanol.addImplicitHydrogens();
    Molecule butane = new MoleculeBuilder().chain(BondType.DEFAULT, "C", "C", "C", "C").build();
    butane.addImplicitHydrogens();
    Assertions.assertAll(
        () -> assertThat(ethanol.generateCondensedFormula(false, true)).isEqualTo("CH3CH2OH"),
        () -> assertThat(butane.generateCondensedFormula(false, false)).isEqualTo("CH3CH2CH2CH3"),
        () -> assertThat(butane.generateCondensedFormula(false, true)).isEqualTo("CH3(CH2)2CH3"),
        () -> assertThat(butane.generateCondensedFormula(true, true))
            .isEqualTo("CH<sub>3</sub>(CH<sub>2</sub>)<sub>2</sub>CH<sub>3</sub>")
    );
  }

  @Test
  void testRelativeMass() {
    Molecule water = new MoleculeBuilder().atom("O").build();
    water.addImplicitHydrogens();
    assertThat(water.calculateMr(), closeTo(18.015, 1e-9));
  }

  @Test
  void testCountBondedElements() {
    Molecule molecule = ethanol();
    molecule.addImplicitHydrogens();
    Assertions.assertAll(
        () -> Assertions.assertEquals(2, molecule.countBondedElements(1, List.of("C", "O"), false)),
        () -> Assertions.assertEquals(0, molecule.countBondedElements(1, List.of("H"), false)),
        () -> Assertions.assertEquals(2, molecule.countBondedElements(1, List.of("H"), true))
    );
  }

  @Test
  void testImplicitHydrogensAreBondedToTheirAtom() {
    Molecule molecule = ethanol();
    molecule.addImplicitHydrogens();
    Map<Integer, Long> hydrogensPerAtom = molecule.getGroups().values().stream()
        .filter(AtomGroup::isImplicit)
        .collect(Collectors.groupingBy(
            hydrogen -> molecule.getAllBonds(hydrogen.getId()).get(0).neighbor(), Collectors.counting()));
    assertThat(hydrogensPerAtom).containsEntry(0, 3L).containsEntry(1, 2L).containsEntry(2, 1L);
  }
}
