package com.quantori.cnp.api.model;

import java.util.Map;
import lombok.experimental.UtilityClass;

/**
 * Default valences of the main group elements, used to fill implicit hydrogen counts that the input did not provide.
 */
@UtilityClass
public class StandardValence {

  private static final Map<String, Integer> VALENCES = Map.ofEntries(
      Map.entry("B", 3),
      Map.entry("C", 4),
      Map.entry("N", 3),
      Map.entry("O", 2),
      Map.entry("F", 1),
      Map.entry("Si", 4),
      Map.entry("P", 3),
      Map.entry("S", 2),
      Map.entry("Cl", 1),
      Map.entry("Ge", 4),
      Map.entry("As", 3),
      Map.entry("Se", 2),
      Map.entry("Br", 1),
      Map.entry("Sn", 4),
      Map.entry("Sb", 3),
      Map.entry("Te", 2),
      Map.entry("I", 1),
      Map.entry("Pb", 4),
      Map.entry("Bi", 3)
  );

  /**
   * Gets the standard valence of an element.
   *
   * @param symbol element symbol
   * @return valence or 0 when the element has none registered
   */
  public static int valence(String symbol) {
    return VALENCES.getOrDefault(symbol, 0);
  }

  /**
   * Computes the number of implicit hydrogens an atom carries at its standard valence.
   *
   * @param symbol       element symbol
   * @param bondValence  sum of the valence contributions of the atom's bonds
   * @param aromatic     whether the atom takes part in an aromatic ring
   * @return hydrogen count, never negative
   */
  public static int implicitHydrogens(String symbol, int bondValence, boolean aromatic) {
    int used = aromatic ? bondValence + 1 : bondValence;
    return Math.max(0, valence(symbol) - used);
  }
}
