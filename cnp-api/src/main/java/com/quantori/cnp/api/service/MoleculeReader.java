package com.quantori.cnp.api.service;

import com.quantori.cnp.api.model.Molecule;

/**
 * Converts a textual structure representation into a molecule graph.
 */
public interface MoleculeReader {

  /**
   * Parses a structure.
   *
   * @param structure structure text, i.e. SMILES
   * @return molecule graph with ring lists
   * @throws com.quantori.cnp.api.MoleculeFormatException if the structure cannot be parsed
   */
  Molecule read(String structure);
}
