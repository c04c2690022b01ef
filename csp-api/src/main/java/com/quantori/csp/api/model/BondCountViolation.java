package com.quantori.csp.api.model;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * An atom whose bond count is not one of the allowed valences of its element.
 *
 * @param atomId    the atom identity
 * @param element   the element symbol
 * @param position  the atom's offset in the input
 * @param bondCount the counted bonds
 * @param valences  the allowed valences
 */
public record BondCountViolation(int atomId, String element, int position, int bondCount, int[] valences) {

  public String describe() {
    String expected = Arrays.stream(valences).mapToObj(String::valueOf).collect(Collectors.joining(" or "));
    return String.format("invalid bond count for organic atom '%s': %d. Expected %s.", element, bondCount, expected);
  }
}
