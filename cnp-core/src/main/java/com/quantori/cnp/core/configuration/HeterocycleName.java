package com.quantori.cnp.core.configuration;

import lombok.Value;

/**
 * A retained or Hantzsch-Widman name of a monocyclic heterocycle.
 */
@Value
public class HeterocycleName {
  int size;
  boolean aromatic;
  /**
   * Heteroatom symbols sorted alphabetically and concatenated, i.e. "NO" for an oxazole
   */
  String heteroatoms;
  /**
   * Ring distance between the first two heteroatoms, 0 when it does not matter
   */
  int spacing;
  String name;

  public boolean matches(int size, boolean aromatic, String heteroatoms, int spacing) {
    return this.size == size && this.aromatic == aromatic && this.heteroatoms.equals(heteroatoms)
        && (this.spacing == 0 || this.spacing == spacing);
  }
}
