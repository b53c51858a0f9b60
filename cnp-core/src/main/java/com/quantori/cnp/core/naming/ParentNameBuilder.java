package com.quantori.cnp.core.naming;

import com.quantori.cnp.core.model.MultipleBond;
import com.quantori.cnp.core.model.ParentStructure;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.experimental.UtilityClass;

/**
 * Builds hydride names with their unsaturation endings, i.e. "pentane", "but-2-ene", "buta-1,3-diene" or
 * "pent-1-en-4-yne".
 */
@UtilityClass
public class ParentNameBuilder {

  /**
   * Names an acyclic chain. Bond locants are cited for chains of three or more atoms.
   *
   * @param length         number of chain atoms
   * @param doubleLocants  locants of double bonds
   * @param tripleLocants  locants of triple bonds
   * @return chain name
   */
  public static String chain(int length, List<Integer> doubleLocants, List<Integer> tripleLocants) {
    return hydride(Vocabulary.stem(length), doubleLocants, tripleLocants, length > 2);
  }

  public static String chain(ParentStructure parent) {
    return chain(parent.size(), bondLocants(parent, true), bondLocants(parent, false));
  }

  /**
   * Appends the saturation ending to a stem.
   *
   * @param stem          stem, i.e. "but" or "cyclohex"
   * @param doubleLocants locants of double bonds
   * @param tripleLocants locants of triple bonds
   * @param showLocants   cite the bond locants
   * @return hydride name
   */
  public static String hydride(String stem, List<Integer> doubleLocants, List<Integer> tripleLocants,
                               boolean showLocants) {
    if (doubleLocants.isEmpty() && tripleLocants.isEmpty()) {
      return stem + "ane";
    }
    List<Integer> enes = doubleLocants.stream().sorted().toList();
    List<Integer> ynes = tripleLocants.stream().sorted().toList();
    int firstCount = enes.isEmpty() ? ynes.size() : enes.size();

    StringBuilder name = new StringBuilder(stem);
    if (firstCount > 1) {
      name.append('a');
    }
    if (!enes.isEmpty()) {
      name.append(locants(enes, showLocants)).append(Vocabulary.simpleMultiplier(enes.size()));
      name.append(ynes.size() == 1 ? "en" : "ene");
    }
    if (!ynes.isEmpty()) {
      name.append(locants(ynes, showLocants)).append(Vocabulary.simpleMultiplier(ynes.size())).append("yne");
    }
    return name.toString();
  }

  /**
   * Collects the locants of the double or the triple bonds of a numbered parent.
   *
   * @param parent  parent structure
   * @param doubles double bonds when true, triple bonds otherwise
   * @return sorted locants
   */
  public static List<Integer> bondLocants(ParentStructure parent, boolean doubles) {
    List<Integer> locants = new ArrayList<>();
    for (MultipleBond bond : parent.getMultipleBonds()) {
      if (bond.isDouble() == doubles) {
        locants.add(parent.locantOf(bond));
      }
    }
    locants.sort(Integer::compare);
    return locants;
  }

  private static String locants(List<Integer> locants, boolean show) {
    if (!show) {
      return "";
    }
    return "-" + locants.stream().map(String::valueOf).collect(Collectors.joining(",")) + "-";
  }
}
