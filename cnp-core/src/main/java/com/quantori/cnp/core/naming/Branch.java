package com.quantori.cnp.core.naming;

import java.util.List;

/**
 * A group of atoms hanging off a parent atom.
 *
 * @param attachment parent atom carrying the branch
 * @param root       branch atom bonded to the parent atom
 * @param atoms      all atoms of the branch, root first
 */
public record Branch(int attachment, int root, List<Integer> atoms) {

  public Branch {
    atoms = List.copyOf(atoms);
  }
}
