package com.quantori.cnp.core.naming;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.experimental.UtilityClass;

/**
 * Turns prefix occurrences into the alphanumerically ordered prefix part of a name, i.e. "2-chloro-1,1-dimethyl".
 * <p>
 * Occurrences with the same name are merged and multiplied: di, tri, ... for simple prefixes, bis, tris, ... for
 * compound prefixes. Compound prefixes are enclosed in parentheses, prefixes already holding parentheses in square
 * brackets.
 */
@UtilityClass
public class FragmentFormatter {

  private static final Pattern LEADING_LOCANTS = Pattern.compile(
      "^(?:\\d+[a-z]?'*|N)(?:,(?:\\d+[a-z]?'*|N))*-");
  private static final Pattern NUMERIC_LABEL = Pattern.compile("^(\\d+)(.*)$");

  /**
   * Formats prefixes.
   *
   * @param fragments   prefix occurrences
   * @param showLocants cite numeric locants, letter locants such as N are cited unless {@code showHeteroLocants} is
   *                    false
   * @param showHeteroLocants cite letter locants
   * @return prefix text, empty when there is nothing to cite
   */
  public static String format(List<Fragment> fragments, boolean showLocants, boolean showHeteroLocants) {
    Map<String, List<Fragment>> byName = new LinkedHashMap<>();
    for (Fragment fragment : fragments) {
      byName.computeIfAbsent(fragment.name(), name -> new ArrayList<>()).add(fragment);
    }

    List<String> names = new ArrayList<>(byName.keySet());
    names.sort(Comparator.comparing(FragmentFormatter::alphaKey).thenComparing(Comparator.naturalOrder()));

    List<String> parts = new ArrayList<>();
    boolean anyLocant = false;
    for (String name : names) {
      List<Fragment> occurrences = byName.get(name);
      boolean compound = occurrences.stream().anyMatch(Fragment::compound) || name.indexOf('(') >= 0;
      List<String> locants = occurrences.stream()
          .map(Fragment::locant)
          .sorted(FragmentFormatter::compareLocants)
          .toList();
      boolean hetero = occurrences.stream().anyMatch(Fragment::isHeteroLocant);
      boolean cite = hetero ? showHeteroLocants : showLocants;

      StringBuilder part = new StringBuilder();
      if (cite) {
        part.append(String.join(",", locants)).append('-');
        anyLocant = true;
      }
      int count = occurrences.size();
      part.append(compound ? Vocabulary.complexMultiplier(count) : Vocabulary.simpleMultiplier(count));
      part.append(enclose(name, compound));
      parts.add(part.toString());
    }
    return String.join(anyLocant ? "-" : "", parts);
  }

  static String enclose(String name, boolean compound) {
    if (name.indexOf('(') >= 0) {
      return "[" + name + "]";
    }
    if (compound) {
      return "(" + name + ")";
    }
    return name;
  }

  /**
   * Sorting key of a prefix: letters of the name with leading locants removed, taken from the first enclosed part for
   * enclosed names.
   *
   * @param name prefix name
   * @return lower case letters
   */
  public static String alphaKey(String name) {
    String text = name;
    if (text.startsWith("(") || text.startsWith("[")) {
      int end = matchingBracket(text);
      text = text.substring(1, end > 0 ? end : text.length());
    }
    Matcher matcher = LEADING_LOCANTS.matcher(text);
    if (matcher.find()) {
      text = text.substring(matcher.end());
    }
    if (text.startsWith("(") || text.startsWith("[")) {
      return alphaKey(text);
    }
    return text.replaceAll("[^a-zA-Z]", "").toLowerCase();
  }

  /**
   * Orders locant labels: letter locants first, then numbers with their letter suffixes.
   *
   * @param first  first label
   * @param second second label
   * @return comparison result
   */
  public static int compareLocants(String first, String second) {
    Matcher firstMatcher = NUMERIC_LABEL.matcher(first);
    Matcher secondMatcher = NUMERIC_LABEL.matcher(second);
    boolean firstNumeric = firstMatcher.matches();
    boolean secondNumeric = secondMatcher.matches();
    if (firstNumeric && secondNumeric) {
      int comparison = Integer.compare(Integer.parseInt(firstMatcher.group(1)),
          Integer.parseInt(secondMatcher.group(1)));
      return comparison != 0 ? comparison : firstMatcher.group(2).compareTo(secondMatcher.group(2));
    }
    if (firstNumeric != secondNumeric) {
      return firstNumeric ? 1 : -1;
    }
    return first.compareTo(second);
  }

  private static int matchingBracket(String text) {
    int depth = 0;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '(' || c == '[') {
        depth++;
      } else if (c == ')' || c == ']') {
        depth--;
        if (depth == 0) {
          return i;
        }
      }
    }
    return -1;
  }
}
