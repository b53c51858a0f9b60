package com.quantori.cnp.core.naming;

import java.util.regex.Pattern;
import lombok.experimental.UtilityClass;

/**
 * Final typographic clean-up of an assembled name.
 */
@UtilityClass
public class NameFormatter {

  private static final Pattern REPEATED_HYPHENS = Pattern.compile("-{2,}");
  private static final Pattern MISSING_LOCANT_HYPHEN = Pattern.compile("(\\d)([a-z]{2,})");

  public static String format(String name) {
    String result = REPEATED_HYPHENS.matcher(name.trim()).replaceAll("-");
    result = result.replace("-,", ",");
    result = MISSING_LOCANT_HYPHEN.matcher(result).replaceAll("$1-$2");
    while (result.startsWith("-")) {
      result = result.substring(1);
    }
    if (result.isEmpty() || result.startsWith("N-") || result.startsWith("N,")) {
      return result;
    }
    return Character.toLowerCase(result.charAt(0)) + result.substring(1);
  }
}
