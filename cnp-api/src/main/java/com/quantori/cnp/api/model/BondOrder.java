package com.quantori.cnp.api.model;

import lombok.Getter;

/**
 * Order of a bond between two atoms.
 */
@Getter
public enum BondOrder {
  SINGLE(1),
  DOUBLE(2),
  TRIPLE(3),
  /**
   * Delocalized bond of an aromatic ring, contributes one to the valence of each atom
   */
  AROMATIC(1);

  private final int valence;

  BondOrder(int valence) {
    this.valence = valence;
  }

  /**
   * Multiple bonds are the ones cited by "ene" and "yne" endings.
   *
   * @return true for double and triple bonds
   */
  public boolean isMultiple() {
    return this == DOUBLE || this == TRIPLE;
  }

  /**
   * Maps a numeric bond order as reported by cheminformatics toolkits (4 stands for aromatic).
   *
   * @param order numeric bond order
   * @return bond order
   */
  public static BondOrder of(int order) {
    return switch (order) {
      case 1 -> SINGLE;
      case 2 -> DOUBLE;
      case 3 -> TRIPLE;
      case 4 -> AROMATIC;
      default -> throw new IllegalArgumentException("Unsupported bond order " + order);
    };
  }
}
