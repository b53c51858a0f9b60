package com.quantori.cnp.api.model;

import lombok.Builder;
import lombok.Value;

/**
 * An atom of a molecule graph. Hydrogens are implicit and only counted.
 */
@Value
@Builder(toBuilder = true)
public class Atom {

  /**
   * Marks an implicit hydrogen count that has to be derived from the standard valence.
   */
  public static final int UNKNOWN_HYDROGENS = -1;

  int id;
  String symbol;
  boolean aromatic;
  @Builder.Default
  int implicitHydrogens = UNKNOWN_HYDROGENS;
  boolean inRing;

  public static Atom of(int id, String symbol) {
    return Atom.builder().id(id).symbol(symbol).build();
  }

  public boolean isCarbon() {
    return "C".equals(symbol);
  }

  public boolean isHalogen() {
    return "F".equals(symbol) || "Cl".equals(symbol) || "Br".equals(symbol) || "I".equals(symbol);
  }
}
