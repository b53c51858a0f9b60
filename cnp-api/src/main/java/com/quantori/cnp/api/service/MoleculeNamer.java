package com.quantori.cnp.api.service;

import com.quantori.cnp.api.model.Molecule;
import com.quantori.cnp.api.model.NamingResult;

/**
 * Derives a systematic name for a molecule graph.
 */
public interface MoleculeNamer {

  /**
   * Names a molecule. Implementations never throw for chemically unusual input, problems are reported as conflicts
   * of the result.
   *
   * @param molecule a validated molecule graph
   * @return the name, its confidence, the conflicts and the audit log of applied rules
   */
  NamingResult run(Molecule molecule);
}
