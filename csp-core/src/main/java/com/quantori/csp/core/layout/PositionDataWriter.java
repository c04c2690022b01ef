package com.quantori.csp.core.layout;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantori.csp.api.layout.PositionData;
import lombok.experimental.UtilityClass;

import java.util.List;

/**
 * JSON export of layout geometry for external renderers.
 */
@UtilityClass
public class PositionDataWriter {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  public static String toJsonString(PositionData positionData) throws JsonProcessingException {
    return OBJECT_MAPPER.writeValueAsString(positionData);
  }

  public static String toJsonString(List<PositionData> positionData) throws JsonProcessingException {
    return OBJECT_MAPPER.writeValueAsString(positionData);
  }

  public static PositionData toPositionData(String json) throws JsonProcessingException {
    return OBJECT_MAPPER.readValue(json, PositionData.class);
  }

  public static List<PositionData> toPositionDataList(String json) throws JsonProcessingException {
    return OBJECT_MAPPER.readValue(json, new TypeReference<List<PositionData>>() {
    });
  }
}
