package com.quantori.csp.api.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ParseResultTest {
  private ParseResult result;

  private void addChain(Molecule molecule, String... elements) {
    AtomGroup previous = null;
    for (String element : elements) {
      AtomGroup group = result.createGroup(0).addElement(element);
      result.registerGroup(molecule, group);
      if (previous != null) {
        previous.addBond(BondType.DEFAULT, group);
      }
      previous = group;
    }
  }

  @BeforeEach
  void setUp() {
    result = new ParseResult("CC>>CCO", ParseOptions.defaults());
    addChain(result.currentMolecule(), "C", "C");
    result.addReactionIndex(0);
    result.addReactionIndex(0);
    addChain(result.startMolecule(), "C", "C", "O");
  }

  @Test
  void testReactionIsWrittenBack() {
    Assertions.assertAll(
        () -> assertThat(result.generateSmiles(false)).isEqualTo("CC>>CCO"),
        () -> assertThat(result.getGroupMap()).hasSize(5),
        () -> assertThat(result.findMolecule(4)).isSameAs(result.getMolecules().get(1))
    );
  }

  @Test
  void testAddMoleculeShiftsReactionIndexes() {
    Molecule water = new Molecule(result.getIds());
    water.addGroup(result.createGroup(0).addElement("O"));
    result.addMolecule(water, 0);
    Assertions.assertAll(
        () -> assertThat(result.getReactionIndexes()).containsExactly(1, 1),
        () -> assertThat(result.generateSmiles(false)).isEqualTo("O.CC>>CCO"),
        () -> assertThat(result.getGroupMap()).hasSize(6)
    );

    assertThat(result.removeMolecule(water)).isTrue();
    Assertions.assertAll(
        () -> assertThat(result.getReactionIndexes()).containsExactly(0, 0),
        () -> assertThat(result.generateSmiles(false)).isEqualTo("CC>>CCO"),
        () -> assertThat(result.getGroupMap()).hasSize(5),
        () -> assertThat(result.removeMolecule(water)).isFalse()
    );
  }

  @Test
  void testAddMoleculeAtEnd() {
    Molecule water = new Molecule(result.getIds());
    water.addGroup(result.createGroup(0).addElement("O"));
    result.addMolecule(water, 2);
    Assertions.assertAll(
        () -> assertThat(result.getReactionIndexes()).containsExactly(0, 0),
        () -> assertThat(result.generateSmiles(false)).isEqualTo("CC>>CCO.O")
    );
  }

  @Test
  void testAddMoleculeOutsideOfRange() {
    assertThatThrownBy(() -> result.addMolecule(new Molecule(result.getIds()), 5))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void testFormulasAreJoinedPerMolecule() {
    result.addImplicitHydrogens();
    Assertions.assertAll(
        () -> assertThat(result.generateMolecularFormula()).isEqualTo("C2H6.C2H6O"),
        () -> assertThat(result.generateCondensedFormula(false, false)).isEqualTo("CH3CH3.CH3CH2OH"),
        () -> assertThat(result.getGroupMap()).hasSize(17),
        () -> assertThat(result.calculateMr()).isCloseTo(30.07 + 46.069, within(0.01))
    );
  }
}
