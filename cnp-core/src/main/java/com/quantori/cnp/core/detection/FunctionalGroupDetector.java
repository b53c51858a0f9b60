package com.quantori.cnp.core.detection;

import com.quantori.cnp.api.model.Molecule;
import com.quantori.cnp.core.model.FunctionalGroup;
import java.util.List;

/**
 * Finds the characteristic groups of a molecule.
 */
public interface FunctionalGroupDetector {

  /**
   * Detects groups.
   *
   * @param molecule molecule to inspect
   * @return groups sorted by ascending priority, no two groups share a core atom
   */
  List<FunctionalGroup> detect(Molecule molecule);
}
