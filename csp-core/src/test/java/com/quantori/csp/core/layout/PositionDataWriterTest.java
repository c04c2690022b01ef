package com.quantori.csp.core.layout;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.quantori.csp.api.layout.PositionData;
import com.quantori.csp.api.layout.PositionData.AtomPosition;
import com.quantori.csp.api.layout.PositionData.RingBounds;
import com.quantori.csp.api.model.ParseOptions;
import com.quantori.csp.core.parser.SmilesParser;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

class PositionDataWriterTest {

  @Test
  void testJsonShape() throws JsonProcessingException {
    PositionData data = new PositionData(Map.of(0, new AtomPosition(1.5, 2, 7, 12)),
        Map.of(3, new RingBounds(0, 1, 2, 3)), 10, 20);
    String json = PositionDataWriter.toJsonString(data);
    Assertions.assertAll(
        () -> assertThat(json).contains("\"atoms\":{\"0\":{", "\"x\":1.5", "\"height\":12.0"),
        () -> assertThat(json).contains("\"rings\":{\"3\":{", "\"maxY\":3.0", "\"width\":10.0"),
        () -> assertThat(PositionDataWriter.toPositionData(json)).isEqualTo(data)
    );
  }

  @Test
  void testLayoutOfReactionIsExported() throws JsonProcessingException {
    List<PositionData> data = new SmilesParser(ParseOptions.defaults()).parse("CC>>CCO")
        .getPositionData(new SimpleMoleculeLayout());
    List<PositionData> read = PositionDataWriter.toPositionDataList(PositionDataWriter.toJsonString(data));
    Assertions.assertAll(
        () -> assertThat(read).hasSize(2),
        () -> assertThat(read.get(1).atoms()).containsOnlyKeys(2, 3, 4)
    );
  }
}
