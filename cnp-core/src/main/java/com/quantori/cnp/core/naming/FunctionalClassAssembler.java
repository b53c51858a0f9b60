package com.quantori.cnp.core.naming;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.experimental.UtilityClass;

/**
 * Functional class names of esters: the alcohol components as separate words before the anion name, i.e.
 * "methyl acetate" or "diethyl butanedioate".
 */
@UtilityClass
public class FunctionalClassAssembler {

  public static String assemble(List<String> alkylComponents, String anion) {
    if (alkylComponents.isEmpty()) {
      return anion;
    }
    Map<String, Long> counts = alkylComponents.stream()
        .collect(Collectors.groupingBy(Function.identity(), TreeMap::new, Collectors.counting()));
    String alkyl;
    if (counts.size() == 1) {
      Map.Entry<String, Long> entry = counts.entrySet().iterator().next();
      alkyl = Vocabulary.simpleMultiplier(entry.getValue().intValue()) + entry.getKey();
    } else {
      alkyl = counts.keySet().stream()
          .sorted(Comparator.comparing(FragmentFormatter::alphaKey))
          .collect(Collectors.joining(" "));
    }
    return alkyl + " " + anion;
  }
}
