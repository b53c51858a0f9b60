package com.quantori.cnp.api.model;

import lombok.Value;

/**
 * A bond between two atoms referenced by their ids.
 */
@Value
public class Bond {
  int source;
  int target;
  BondOrder order;

  public boolean connects(int first, int second) {
    return (source == first && target == second) || (source == second && target == first);
  }

  public boolean contains(int atomId) {
    return source == atomId || target == atomId;
  }

  /**
   * Gets the opposite end of this bond.
   *
   * @param atomId one end of the bond
   * @return the other end
   */
  public int other(int atomId) {
    if (source == atomId) {
      return target;
    }
    if (target == atomId) {
      return source;
    }
    throw new IllegalArgumentException("Atom " + atomId + " is not part of bond " + this);
  }
}
