package com.quantori.cnp.core.numbering;

import com.quantori.cnp.api.model.Molecule;
import com.quantori.cnp.core.model.FunctionalGroup;
import com.quantori.cnp.core.model.MultipleBond;
import com.quantori.cnp.core.model.ParentStructure;
import com.quantori.cnp.core.model.Substituent;
import com.quantori.cnp.core.naming.FragmentFormatter;
import com.quantori.cnp.core.naming.Vocabulary;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Chooses the numbering of a parent structure that gives the lowest locants.
 * <p>
 * Every admissible scheme is ranked by a sequence of locant vectors, compared in this order:
 * <ol>
 *   <li>heteroatom locants</li>
 *   <li>heteroatom locants taken in heteroatom seniority order</li>
 *   <li>principal group locants</li>
 *   <li>multiple bond locants</li>
 *   <li>double bond locants</li>
 *   <li>all principal group, substituent and otherwise uncited group locants together</li>
 *   <li>substituent locants in alphanumerical order of citation</li>
 * </ol>
 * The first scheme reaching the lowest ranking wins.
 */
public class LocantOptimizer {

  private final SchemeGenerator schemeGenerator;

  public LocantOptimizer() {
    this(new SchemeGenerator());
  }

  public LocantOptimizer(SchemeGenerator schemeGenerator) {
    this.schemeGenerator = schemeGenerator;
  }

  public NumberingResult optimize(ParentStructure parent, List<FunctionalGroup> groups, Molecule molecule) {
    List<NumberingScheme> schemes = schemeGenerator.generate(parent, molecule);
    NumberingScheme best = null;
    List<List<Integer>> bestRank = null;
    Map<String, List<Integer>> bestPlacement = null;
    boolean ambiguous = false;

    for (NumberingScheme scheme : schemes) {
      Map<Integer, Integer> locants = scheme.locantsByAtom();
      List<List<Integer>> rank = rank(parent, groups, molecule, locants);
      if (best == null) {
        best = scheme;
        bestRank = rank;
        bestPlacement = placement(parent.getSubstituents(), locants);
        continue;
      }
      int comparison = compare(rank, bestRank);
      if (comparison < 0) {
        best = scheme;
        bestRank = rank;
        bestPlacement = placement(parent.getSubstituents(), locants);
        ambiguous = false;
      } else if (comparison == 0 && !placement(parent.getSubstituents(), locants).equals(bestPlacement)) {
        ambiguous = true;
      }
    }
    return apply(parent, groups, best, ambiguous);
  }

  /**
   * Compares two rankings tier by tier.
   *
   * @param first  first ranking
   * @param second second ranking
   * @return negative when {@code first} gives lower locants
   */
  static int compare(List<List<Integer>> first, List<List<Integer>> second) {
    for (int tier = 0; tier < Math.min(first.size(), second.size()); tier++) {
      int comparison = compareVectors(first.get(tier), second.get(tier));
      if (comparison != 0) {
        return comparison;
      }
    }
    return 0;
  }

  static int compareVectors(List<Integer> first, List<Integer> second) {
    for (int i = 0; i < Math.min(first.size(), second.size()); i++) {
      int comparison = Integer.compare(first.get(i), second.get(i));
      if (comparison != 0) {
        return comparison;
      }
    }
    return Integer.compare(first.size(), second.size());
  }

  List<List<Integer>> rank(ParentStructure parent, List<FunctionalGroup> groups, Molecule molecule,
                           Map<Integer, Integer> locants) {
    List<Integer> heteroatoms = new ArrayList<>();
    List<Integer> heteroatomsBySeniority = new ArrayList<>();
    if (parent.isRing()) {
      List<Integer> ringHeteroatoms = new ArrayList<>(parent.getRing().heteroatoms(molecule));
      ringHeteroatoms.forEach(id -> heteroatoms.add(locants.get(id)));
      ringHeteroatoms.sort(Comparator
          .comparingInt((Integer id) -> Vocabulary.heteroatomSeniority(molecule.atom(id).getSymbol()))
          .thenComparing(locants::get));
      ringHeteroatoms.forEach(id -> heteroatomsBySeniority.add(locants.get(id)));
    }

    List<Integer> principal = new ArrayList<>();
    List<Integer> uncited = new ArrayList<>();
    for (FunctionalGroup group : groups) {
      List<Integer> groupLocants = group.getLocantAtomIds().stream()
          .filter(locants::containsKey)
          .map(locants::get)
          .toList();
      if (group.isPrincipal()) {
        principal.addAll(groupLocants);
      } else if (group.getPrefix() != null && !group.isCitedBy(parent.getSubstituents())) {
        uncited.addAll(groupLocants);
      }
    }

    List<Integer> multiple = new ArrayList<>();
    List<Integer> doubles = new ArrayList<>();
    for (MultipleBond bond : parent.getMultipleBonds()) {
      int locant = bondLocant(parent, bond, locants);
      multiple.add(locant);
      if (bond.isDouble()) {
        doubles.add(locant);
      }
    }

    List<Integer> combined = new ArrayList<>(principal);
    combined.addAll(uncited);
    Map<String, List<Integer>> placement = placement(parent.getSubstituents(), locants);
    placement.values().forEach(combined::addAll);

    List<Integer> alphabetical = new ArrayList<>();
    placement.entrySet().stream()
        .sorted(Map.Entry.comparingByKey(Comparator.comparing(FragmentFormatter::alphaKey)))
        .forEach(entry -> alphabetical.addAll(entry.getValue()));

    return List.of(sorted(heteroatoms), heteroatomsBySeniority, sorted(principal), sorted(multiple),
        sorted(doubles), sorted(combined), alphabetical);
  }

  private static int bondLocant(ParentStructure parent, MultipleBond bond, Map<Integer, Integer> locants) {
    int first = locants.get(bond.getFirst());
    int second = locants.get(bond.getSecond());
    int low = Math.min(first, second);
    int high = Math.max(first, second);
    if (parent.isRing() && low == 1 && high == parent.size() && parent.size() > 2) {
      return high;
    }
    return low;
  }

  private static Map<String, List<Integer>> placement(List<Substituent> substituents, Map<Integer, Integer> locants) {
    Map<String, List<Integer>> placement = new TreeMap<>();
    for (Substituent substituent : substituents) {
      if (substituent.getHeteroLocant() != null || !locants.containsKey(substituent.getAttachmentAtomId())) {
        continue;
      }
      placement.computeIfAbsent(substituent.getName(), name -> new ArrayList<>())
          .add(locants.get(substituent.getAttachmentAtomId()));
    }
    placement.values().forEach(list -> list.sort(Integer::compare));
    return placement;
  }

  private static List<Integer> sorted(List<Integer> locants) {
    return locants.stream().sorted().toList();
  }

  private static NumberingResult apply(ParentStructure parent, List<FunctionalGroup> groups, NumberingScheme scheme,
                                       boolean ambiguous) {
    Map<Integer, Integer> locants = scheme.locantsByAtom();

    List<Integer> order = new ArrayList<>();
    for (int i = 0; i < scheme.order().size(); i++) {
      order.add(i + 1);
    }
    List<Substituent> substituents = parent.getSubstituents().stream()
        .map(substituent -> substituent.toBuilder()
            .locant(locants.getOrDefault(substituent.getAttachmentAtomId(), 0))
            .build())
        .toList();
    ParentStructure numbered = parent.toBuilder()
        .clearPositions().positions(scheme.order())
        .clearLocants().locants(order)
        .clearLocantLabels().locantLabels(scheme.labels())
        .clearSubstituents().substituents(substituents)
        .numbered(true)
        .build();

    List<FunctionalGroup> numberedGroups = groups.stream()
        .map(group -> group.toBuilder()
            .clearLocants()
            .locants(group.getLocantAtomIds().stream()
                .filter(locants::containsKey)
                .map(locants::get)
                .sorted()
                .toList())
            .build())
        .toList();
    return new NumberingResult(numbered, numberedGroups, ambiguous);
  }
}
