package com.quantori.csp.api.layout;

import java.util.Map;

/**
 * Layout of one molecule.
 *
 * @param atoms  atom boxes keyed by atom identity
 * @param rings  ring bounds keyed by ring identity
 * @param width  width of the whole drawing
 * @param height height of the whole drawing
 */
public record PositionData(Map<Integer, AtomPosition> atoms, Map<Integer, RingBounds> rings, double width,
                           double height) {

  public PositionData {
    atoms = Map.copyOf(atoms);
    rings = Map.copyOf(rings);
  }

  /**
   * Box of an atom label, {@code x} and {@code y} being its center.
   */
  public record AtomPosition(double x, double y, double width, double height) {
  }

  public record RingBounds(double minX, double maxX, double minY, double maxY) {
  }
}
