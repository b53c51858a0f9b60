package com.quantori.cnp.api.service;

import com.quantori.cnp.api.model.Molecule;
import java.util.List;

/**
 * Finds occurrences of a substructure pattern in a molecule.
 */
public interface PatternMatcher {

  /**
   * Matches a pattern against a molecule.
   *
   * @param pattern  substructure pattern, i.e. SMARTS
   * @param molecule target molecule
   * @return one list per match holding the ids of the matched atoms in pattern atom order
   */
  List<List<Integer>> match(String pattern, Molecule molecule);
}
