package com.quantori.cnp.core.candidate;

import com.quantori.cnp.api.model.BondOrder;
import com.quantori.cnp.api.model.Molecule;
import java.util.List;

/**
 * Decides whether a ring is aromatic from the aromatic flags of its atoms and the orders of its bonds.
 * <p>
 * This is a threshold test rather than a Hückel check: a ring counts as aromatic when at least half of its bonds are
 * aromatic or double and most of its atoms are flagged aromatic.
 */
public class AromaticityClassifier {

  private final double likeBondAtomFraction;
  private final double aromaticBondAtomFraction;

  public AromaticityClassifier() {
    this(0.6, 0.5);
  }

  /**
   * Creates a classifier with custom thresholds.
   *
   * @param likeBondAtomFraction     aromatic atom fraction required when aromatic and double bonds are counted
   *                                 together
   * @param aromaticBondAtomFraction aromatic atom fraction required when only aromatic bonds are counted
   */
  public AromaticityClassifier(double likeBondAtomFraction, double aromaticBondAtomFraction) {
    this.likeBondAtomFraction = likeBondAtomFraction;
    this.aromaticBondAtomFraction = aromaticBondAtomFraction;
  }

  /**
   * Classifies one ring.
   *
   * @param ring     ring atoms in ring order
   * @param molecule molecule graph
   * @return true when the ring is aromatic
   */
  public boolean isAromatic(List<Integer> ring, Molecule molecule) {
    int size = ring.size();
    if (size < 3) {
      return false;
    }
    int aromaticBonds = 0;
    int doubleBonds = 0;
    for (int i = 0; i < size; i++) {
      BondOrder order = molecule.bondOrder(ring.get(i), ring.get((i + 1) % size));
      if (order == BondOrder.AROMATIC) {
        aromaticBonds++;
      } else if (order == BondOrder.DOUBLE) {
        doubleBonds++;
      }
    }
    long aromaticAtoms = ring.stream().filter(id -> molecule.atom(id).isAromatic()).count();
    double atomFraction = (double) aromaticAtoms / size;
    int half = (size + 1) / 2;

    return (aromaticBonds + doubleBonds >= half && atomFraction >= likeBondAtomFraction)
        || (aromaticBonds >= half && atomFraction >= aromaticBondAtomFraction);
  }
}
