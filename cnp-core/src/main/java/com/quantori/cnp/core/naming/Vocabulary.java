package com.quantori.cnp.core.naming;

import java.util.List;
import java.util.Map;
import lombok.experimental.UtilityClass;

/**
 * Fixed nomenclature vocabulary: numerical terms, multiplying prefixes, replacement prefixes and heteroatom
 * seniority.
 */
@UtilityClass
public class Vocabulary {

  private static final List<String> STEMS = List.of("", "meth", "eth", "prop", "but", "pent", "hex", "hept", "oct",
      "non", "dec");
  private static final List<String> UNITS = List.of("", "hen", "do", "tri", "tetra", "penta", "hexa", "hepta", "octa",
      "nona");
  private static final List<String> TENS = List.of("", "dec", "cos", "triacont", "tetracont", "pentacont", "hexacont",
      "heptacont", "octacont", "nonacont");
  private static final List<String> SIMPLE_MULTIPLIERS = List.of("", "", "di", "tri", "tetra", "penta", "hexa",
      "hepta", "octa", "nona", "deca", "undeca", "dodeca");
  private static final List<String> COMPLEX_MULTIPLIERS = List.of("", "", "bis", "tris", "tetrakis", "pentakis",
      "hexakis", "heptakis", "octakis", "nonakis", "decakis");

  /**
   * Seniority of heteroatoms, most senior first.
   */
  public static final List<String> HETEROATOM_SENIORITY = List.of("O", "S", "Se", "Te", "N", "P", "As", "Sb", "Bi",
      "Si", "Ge", "Sn", "Pb", "B");

  private static final Map<String, String> REPLACEMENT_PREFIXES = Map.ofEntries(
      Map.entry("O", "oxa"), Map.entry("S", "thia"), Map.entry("Se", "selena"), Map.entry("Te", "tellura"),
      Map.entry("N", "aza"), Map.entry("P", "phospha"), Map.entry("As", "arsa"), Map.entry("Sb", "stiba"),
      Map.entry("Bi", "bisma"), Map.entry("Si", "sila"), Map.entry("Ge", "germa"), Map.entry("Sn", "stanna"),
      Map.entry("Pb", "plumba"), Map.entry("B", "bora"));

  private static final Map<String, String> HALOGEN_PREFIXES = Map.of(
      "F", "fluoro", "Cl", "chloro", "Br", "bromo", "I", "iodo");

  private static final Map<String, String> MONONUCLEAR_HYDRIDES = Map.ofEntries(
      Map.entry("O", "oxidane"), Map.entry("N", "azane"), Map.entry("S", "sulfane"), Map.entry("Se", "selane"),
      Map.entry("Te", "tellane"), Map.entry("F", "fluorane"), Map.entry("Cl", "chlorane"),
      Map.entry("Br", "bromane"), Map.entry("I", "iodane"), Map.entry("C", "methane"));

  /**
   * Numerical term of a carbon count as used in alkane names, i.e. "but" for 4 or "henicos" for 21.
   *
   * @param count number of skeletal atoms, 1 to 99
   * @return stem
   */
  public static String stem(int count) {
    if (count < 1 || count > 99) {
      throw new IllegalArgumentException("Unsupported chain length " + count);
    }
    if (count <= 10) {
      return STEMS.get(count);
    }
    if (count == 11) {
      return "undec";
    }
    if (count == 20) {
      return "icos";
    }
    int units = count % 10;
    int tens = count / 10;
    if (tens == 2 && units == 1) {
      return "henicos";
    }
    return UNITS.get(units) + TENS.get(tens);
  }

  public static String alkane(int count) {
    return stem(count) + "ane";
  }

  public static String alkyl(int count) {
    return stem(count) + "yl";
  }

  public static String simpleMultiplier(int count) {
    return count < SIMPLE_MULTIPLIERS.size() ? SIMPLE_MULTIPLIERS.get(count) : count + "-";
  }

  public static String complexMultiplier(int count) {
    return count < COMPLEX_MULTIPLIERS.size() ? COMPLEX_MULTIPLIERS.get(count) : count + "-kis";
  }

  public static String replacementPrefix(String symbol) {
    return REPLACEMENT_PREFIXES.getOrDefault(symbol, symbol.toLowerCase() + "a");
  }

  public static String halogenPrefix(String symbol) {
    return HALOGEN_PREFIXES.get(symbol);
  }

  public static String mononuclearHydride(String symbol) {
    return MONONUCLEAR_HYDRIDES.get(symbol);
  }

  /**
   * Rank of a heteroatom, lower is more senior. Unknown elements rank last.
   *
   * @param symbol element symbol
   * @return rank
   */
  public static int heteroatomSeniority(String symbol) {
    int index = HETEROATOM_SENIORITY.indexOf(symbol);
    return index < 0 ? HETEROATOM_SENIORITY.size() : index;
  }

  public static boolean startsWithVowel(String text) {
    return !text.isEmpty() && "aeiouy".indexOf(Character.toLowerCase(text.charAt(0))) >= 0;
  }
}
