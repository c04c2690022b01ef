package com.quantori.csp.api.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

class SubstructureMatchTest {

  private static Molecule aceticAcid() {
    Molecule molecule = new MoleculeBuilder()
        .chain(BondType.DEFAULT, "C", "C", "O").atom("O").bond(1, 3, BondType.DOUBLE)
        .build();
    molecule.addImplicitHydrogens();
    return molecule;
  }

  private static MatchAtom carboxyl() {
    return MatchAtom.builder().atom("C").label("C")
        .bondedTo(MatchAtom.builder().atom("O").label("O1").bond(BondType.DOUBLE).build())
        .bondedTo(MatchAtom.builder().atom("O").label("O2").bond(BondType.SINGLE).build())
        .build();
  }

  @Test
  void testMatchMoleculeBacktracks() {
    List<SubstructureMatch> matches = aceticAcid().matchMolecule(carboxyl(), true);
    assertThat(matches).hasSize(1);
    Assertions.assertAll(
        () -> assertThat(matches.get(0).atoms()).containsExactlyInAnyOrderEntriesOf(Map.of("C", 1, "O1", 3, "O2", 2)),
        () -> assertThat(matches.get(0).ringId()).isNull()
    );
  }

  @Test
  void testMatchManyOrFirst() {
    MatchAtom methyl = MatchAtom.builder().atom("C").label("C")
        .bondedTo(MatchAtom.of("H")).bondedTo(MatchAtom.of("H")).bondedTo(MatchAtom.of("H"))
        .build();
    Molecule ethane = new MoleculeBuilder().chain(BondType.DEFAULT, "C", "C").build();
    ethane.addImplicitHydrogens();
    Assertions.assertAll(
        () -> assertThat(ethane.matchMolecule(methyl, true)).hasSize(2),
        () -> assertThat(ethane.matchMolecule(methyl, false)).hasSize(1)
    );
  }

  @Test
  void testNoMatchForMissingNeighbor() {
    Molecule ethanol = new MoleculeBuilder().chain(BondType.DEFAULT, "C", "C", "O").build();
    assertThat(ethanol.matchMolecule(carboxyl(), true)).isEmpty();
  }

  @Test
  void testChargeIsCompared() {
    MoleculeBuilder builder = new MoleculeBuilder().atom("N");
    builder.get(0).setCharge(1);
    Molecule molecule = builder.build();
    Assertions.assertAll(
        () -> assertThat(molecule.matchMolecule(MatchAtom.builder().atom("N").charge(1).build(), true)).hasSize(1),
        () -> assertThat(molecule.matchMolecule(MatchAtom.builder().atom("N").charge(0).build(), true)).isEmpty()
    );
  }

  @Test
  void testMatchRing() {
    Molecule cyclopropene = new MoleculeBuilder()
        .chain(BondType.DOUBLE, "C", "C")
        .atom("C").bond(1, 2, BondType.DEFAULT).bond(0, 2, BondType.SINGLE)
        .ring(false, 0, 1, 2)
        .build();
    List<MatchAtom> members = List.of(
        MatchAtom.of("C"), MatchAtom.builder().atom("C").label("a").bond(BondType.DOUBLE).build(), MatchAtom.of("C"));
    List<SubstructureMatch> matches = cyclopropene.matchRing(members, false, true);
    Assertions.assertAll(
        () -> assertThat(matches).hasSize(1),
        () -> assertThat(matches.get(0).atom("a")).isEqualTo(1),
        () -> assertThat(matches.get(0).ringId()).isEqualTo(0),
        () -> assertThat(cyclopropene.matchRing(members, true, true)).isEmpty(),
        () -> assertThat(cyclopropene.matchRing(List.of(MatchAtom.of("C"), MatchAtom.of("C")), false, true)).isEmpty()
    );
  }

  @Test
  void testMatchBenzene() {
    Molecule benzene = MoleculeBuilder.benzene();
    benzene.addImplicitHydrogens();
    List<SubstructureMatch> matches = benzene.matchBenzene(null, true);
    assertThat(matches).hasSize(1);
    assertThat(matches.get(0).atoms()).containsEntry("0", 0).containsEntry("5", 5);
  }

  @Test
  void testMatchSubstitutedBenzene() {
    Molecule chlorobenzene = new MoleculeBuilder()
        .aromatic("C").aromatic("C").aromatic("C").aromatic("C").aromatic("C").aromatic("C")
        .bond(0, 1, BondType.AROMATIC).bond(1, 2, BondType.AROMATIC).bond(2, 3, BondType.AROMATIC)
        .bond(3, 4, BondType.AROMATIC).bond(4, 5, BondType.AROMATIC).bond(0, 5, BondType.AROMATIC)
        .ring(true, 0, 1, 2, 3, 4, 5)
        .atom("Cl").bond(3, 6, BondType.DEFAULT)
        .build();
    chlorobenzene.addImplicitHydrogens();
    List<SubstructureMatch> matches = chlorobenzene.matchBenzene(MatchAtom.of("Cl", "X"), false);
    assertThat(matches).hasSize(1);
    Assertions.assertAll(
        () -> assertThat(matches.get(0).atom("0")).isEqualTo(3),
        () -> assertThat(matches.get(0).atom("1")).isEqualTo(4),
        () -> assertThat(matches.get(0).atom("3")).isEqualTo(0),
        () -> assertThat(matches.get(0).atom("X")).isEqualTo(6),
        () -> assertThat(chlorobenzene.matchBenzene(MatchAtom.of("Br"), false)).isEmpty()
    );
  }
}
