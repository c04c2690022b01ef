package com.quantori.csp.core.layout;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;

import com.quantori.csp.api.layout.PositionData;
import com.quantori.csp.api.layout.PositionData.AtomPosition;
import com.quantori.csp.api.layout.PositionData.RingBounds;
import com.quantori.csp.api.model.ParseOptions;
import com.quantori.csp.api.model.ParseResult;
import com.quantori.csp.core.parser.SmilesParser;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

class SimpleMoleculeLayoutTest {
  private final SmilesParser parser = new SmilesParser(ParseOptions.defaults());
  private final SimpleMoleculeLayout layout = new SimpleMoleculeLayout();

  @Test
  void testChainIsLaidOutInsideTheBox() {
    PositionData data = parser.parse("CCO").getPositionData(layout).get(0);
    Assertions.assertAll(
        () -> assertThat(data.atoms()).containsOnlyKeys(0, 1, 2),
        () -> assertThat(data.atoms().values()).allMatch(atom -> atom.x() - atom.width() / 2 >= 0
            && atom.y() - atom.height() / 2 >= 0
            && atom.x() + atom.width() / 2 <= data.width()
            && atom.y() + atom.height() / 2 <= data.height()),
        () -> assertThat(data.rings()).isEmpty()
    );
  }

  @Test
  void testBondedAtomsAreOneBondLengthApart() {
    PositionData data = parser.parse("CC").getPositionData(layout).get(0);
    AtomPosition first = data.atoms().get(0);
    AtomPosition second = data.atoms().get(1);
    double distance = Math.hypot(first.x() - second.x(), first.y() - second.y());
    assertThat(distance, closeTo(SimpleMoleculeLayout.DEFAULT_BOND_LENGTH, 1e-9));
  }

  @Test
  void testLabelsAreMeasured() {
    SimpleMoleculeLayout wide = new SimpleMoleculeLayout(TextMeasurer.monospace(10, 20), 40, 0, false);
    PositionData data = parser.parse("C[NH4+]").getPositionData(wide).get(0);
    Assertions.assertAll(
        () -> Assertions.assertEquals(10, data.atoms().get(0).width()),
        () -> Assertions.assertEquals(40, data.atoms().get(1).width()),
        () -> Assertions.assertEquals(20, data.atoms().get(1).height())
    );
  }

  @Test
  void testRingBounds() {
    PositionData data = parser.parse("c1ccccc1").getPositionData(layout).get(0);
    RingBounds bounds = data.rings().get(0);
    Assertions.assertAll(
        () -> assertThat(data.atoms()).hasSize(6),
        () -> assertThat(bounds.maxX() - bounds.minX(), closeTo(2 * SimpleMoleculeLayout.DEFAULT_BOND_LENGTH, 1e-6)),
        () -> assertThat(data.atoms().values()).allMatch(atom -> atom.x() >= bounds.minX() - 1e-9
            && atom.x() <= bounds.maxX() + 1e-9)
    );
  }

  @Test
  void testImplicitAtomsCanBeShown() {
    SimpleMoleculeLayout withImplicits =
        new SimpleMoleculeLayout(TextMeasurer.monospace(7, 12), 30, 4, true);
    PositionData data = parser.parse("O").getPositionData(withImplicits).get(0);
    assertThat(data.atoms()).hasSize(3);
  }

  @Test
  void testOneRecordPerMolecule() {
    ParseResult result = parser.parse("C.O");
    List<PositionData> data = result.getPositionData(layout);
    Assertions.assertAll(
        () -> assertThat(data).hasSize(2),
        () -> assertThat(data.get(0).atoms()).containsOnlyKeys(0),
        () -> assertThat(data.get(1).atoms()).containsOnlyKeys(1)
    );
  }

  @Test
  void testEmptyMolecule() {
    PositionData data = layout.layout(new ParseResult("", ParseOptions.defaults()).currentMolecule());
    Assertions.assertAll(
        () -> assertThat(data.atoms()).isEmpty(),
        () -> Assertions.assertEquals(0, data.width())
    );
  }
}
