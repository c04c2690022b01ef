package com.quantori.csp.core.parser;

import com.quantori.csp.api.model.Ring;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rings whose digit has been read once and not yet a second time.
 */
class RingRegistry {
  private final Map<Integer, Ring> openRings = new LinkedHashMap<>();

  boolean isEmpty() {
    return openRings.isEmpty();
  }

  boolean isOpen(int digit) {
    return openRings.containsKey(digit);
  }

  void open(Ring ring) {
    openRings.put(ring.getDigit(), ring);
  }

  /**
   * Closes a ring at the given atom.
   *
   * @return the closed ring
   */
  Ring close(int digit, int atomId) {
    Ring ring = openRings.remove(digit);
    ring.setEnd(atomId);
    return ring;
  }

  Collection<Ring> openRings() {
    return Collections.unmodifiableCollection(openRings.values());
  }

  /**
   * Adds an atom to every open ring. Rings still of unknown aromaticity become non aromatic.
   */
  void appendAtom(int atomId) {
    for (Ring ring : openRings.values()) {
      if (ring.getAromatic() == null) {
        ring.setAromatic(false);
      }
      ring.getMembers().add(atomId);
    }
  }
}
