package com.quantori.cnp.core.numbering;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One admissible numbering of a parent structure: the atom at index {@code i} gets locant {@code i + 1}.
 *
 * @param order  parent atoms in locant order
 * @param labels display labels of locants that are not plain numbers
 */
public record NumberingScheme(List<Integer> order, Map<Integer, String> labels) {

  public NumberingScheme {
    order = List.copyOf(order);
    labels = Map.copyOf(labels);
  }

  public static NumberingScheme of(List<Integer> order) {
    return new NumberingScheme(order, Map.of());
  }

  public Map<Integer, Integer> locantsByAtom() {
    Map<Integer, Integer> locants = new HashMap<>();
    for (int i = 0; i < order.size(); i++) {
      locants.put(order.get(i), i + 1);
    }
    return locants;
  }
}
