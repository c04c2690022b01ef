package com.quantori.csp.api.layout;

import com.quantori.csp.api.model.Molecule;

/**
 * Computes 2D coordinates of the atoms of a molecule for rendering.
 */
public interface MoleculeLayout {

  /**
   * Lay out a molecule.
   *
   * @param molecule the molecule
   * @return positions of its atoms and the bounds of its rings
   */
  PositionData layout(Molecule molecule);
}
