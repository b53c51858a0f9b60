package com.quantori.cnp.core.numbering;

import com.quantori.cnp.api.model.Molecule;
import com.quantori.cnp.core.model.RingSystem;
import com.quantori.cnp.core.model.RingTopology;
import com.quantori.cnp.core.naming.Vocabulary;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ortho-fused aromatic systems with retained names and fixed peripheral numbering.
 * <p>
 * A system matches a template when its member ring sizes are the template's and the fusion atoms met on a walk
 * around the periphery sit where the template's lettered locants ("4a", "8a") are. Fusion atoms are numbered after
 * the peripheral atoms, so naphthalene gets locants 9 and 10 labelled "4a" and "8a".
 * <p>
 * Heteroatom variants are looked up by the heteroatom locants of the numbering that gives them the lowest locants,
 * i.e. "N1" for quinoline or "O1,N3" for 1,3-benzoxazole.
 */
public enum FusedRingTemplate {

  NAPHTHALENE(List.of(6, 6), List.of("1", "2", "3", "4", "4a", "5", "6", "7", "8", "8a"), Map.ofEntries(
      Map.entry("", "naphthalene"),
      Map.entry("N1", "quinoline"),
      Map.entry("N2", "isoquinoline"),
      Map.entry("N1,N2", "cinnoline"),
      Map.entry("N1,N3", "quinazoline"),
      Map.entry("N1,N4", "quinoxaline"),
      Map.entry("N2,N3", "phthalazine"),
      Map.entry("N1,N5", "1,5-naphthyridine"),
      Map.entry("N1,N6", "1,6-naphthyridine"),
      Map.entry("N1,N7", "1,7-naphthyridine"),
      Map.entry("N1,N8", "1,8-naphthyridine"),
      Map.entry("N2,N6", "2,6-naphthyridine"),
      Map.entry("N2,N7", "2,7-naphthyridine"))),
  INDENE(List.of(5, 6), List.of("1", "2", "3", "3a", "4", "5", "6", "7", "7a"), Map.ofEntries(
      Map.entry("N1", "1H-indole"),
      Map.entry("N2", "2H-isoindole"),
      Map.entry("O1", "1-benzofuran"),
      Map.entry("O2", "2-benzofuran"),
      Map.entry("S1", "1-benzothiophene"),
      Map.entry("S2", "2-benzothiophene"),
      Map.entry("N1,N2", "1H-indazole"),
      Map.entry("N1,N3", "1H-benzimidazole"),
      Map.entry("O1,N2", "1,2-benzoxazole"),
      Map.entry("O1,N3", "1,3-benzoxazole"),
      Map.entry("S1,N2", "1,2-benzothiazole"),
      Map.entry("S1,N3", "1,3-benzothiazole"))),
  ANTHRACENE(List.of(6, 6, 6),
      List.of("1", "2", "3", "4", "4a", "10", "10a", "5", "6", "7", "8", "8a", "9", "9a"),
      Map.of("", "anthracene")),
  PHENANTHRENE(List.of(6, 6, 6),
      List.of("1", "2", "3", "4", "4a", "4b", "5", "6", "7", "8", "8a", "9", "10", "10a"),
      Map.of("", "phenanthrene"));

  private final List<Integer> ringSizes;
  private final List<String> periphery;
  private final Map<String, String> names;
  private final int peripheralCount;

  FusedRingTemplate(List<Integer> ringSizes, List<String> periphery, Map<String, String> names) {
    this.ringSizes = ringSizes;
    this.periphery = periphery;
    this.names = names;
    this.peripheralCount = (int) periphery.stream().filter(FusedRingTemplate::isPeripheral).count();
  }

  /**
   * Finds the template of an aromatic ortho-fused ring system.
   *
   * @param ring     ring system
   * @param molecule molecule graph
   * @return matching template and its numberings
   */
  public static Optional<Match> match(RingSystem ring, Molecule molecule) {
    if (!ring.isAromatic()
        || (ring.getTopology() != RingTopology.FUSED && ring.getTopology() != RingTopology.POLYCYCLIC)) {
      return Optional.empty();
    }
    List<Integer> walk = peripheryWalk(ring, molecule);
    if (walk.size() != ring.size()) {
      return Optional.empty();
    }
    List<Integer> sizes = ring.getRings().stream().map(List::size).sorted().toList();
    Set<Integer> fusion = fusionAtoms(ring);
    for (FusedRingTemplate template : values()) {
      if (!template.ringSizes.equals(sizes) || template.periphery.size() != walk.size()) {
        continue;
      }
      List<NumberingScheme> schemes = template.schemes(walk, fusion);
      if (!schemes.isEmpty()) {
        return Optional.of(new Match(template, schemes));
      }
    }
    return Optional.empty();
  }

  /**
   * Retained name of a ring system, empty when no template matches or the heteroatom pattern has no name.
   *
   * @param ring     ring system
   * @param molecule molecule graph
   * @return retained name
   */
  public static Optional<String> nameOf(RingSystem ring, Molecule molecule) {
    return match(ring, molecule).flatMap(found -> found.name(ring, molecule));
  }

  private List<NumberingScheme> schemes(List<Integer> walk, Set<Integer> fusion) {
    int size = walk.size();
    Set<NumberingScheme> schemes = new LinkedHashSet<>();
    for (boolean forward : new boolean[] {true, false}) {
      for (int start : walk) {
        List<Integer> rotated = RingGeometry.rotate(walk, start, forward);
        boolean fits = true;
        for (int i = 0; i < size && fits; i++) {
          fits = fusion.contains(rotated.get(i)) != isPeripheral(periphery.get(i));
        }
        if (fits) {
          schemes.add(toScheme(rotated));
        }
      }
    }
    return List.copyOf(schemes);
  }

  private NumberingScheme toScheme(List<Integer> rotated) {
    Integer[] order = new Integer[rotated.size()];
    Map<Integer, String> labels = new HashMap<>();
    int next = peripheralCount;
    for (int i = 0; i < rotated.size(); i++) {
      String label = periphery.get(i);
      if (isPeripheral(label)) {
        order[Integer.parseInt(label) - 1] = rotated.get(i);
      } else {
        order[next] = rotated.get(i);
        labels.put(next + 1, label);
        next++;
      }
    }
    return new NumberingScheme(Arrays.asList(order), labels);
  }

  private static boolean isPeripheral(String label) {
    return label.chars().allMatch(Character::isDigit);
  }

  private static Set<Integer> fusionAtoms(RingSystem ring) {
    Map<Integer, Integer> memberships = new HashMap<>();
    ring.getRings().forEach(member -> member.forEach(atom -> memberships.merge(atom, 1, Integer::sum)));
    return memberships.entrySet().stream()
        .filter(entry -> entry.getValue() > 1)
        .map(Map.Entry::getKey)
        .collect(Collectors.toSet());
  }

  /**
   * Walks the bonds that belong to exactly one member ring. The walk is shorter than the system when an atom is
   * not on the periphery.
   */
  private static List<Integer> peripheryWalk(RingSystem ring, Molecule molecule) {
    Map<Integer, List<Integer>> neighbors = new HashMap<>();
    for (int atom : ring.getAtomIds()) {
      for (int next : molecule.neighbors(atom)) {
        if (!ring.contains(next)) {
          continue;
        }
        long shared = ring.getRings().stream().filter(member -> member.contains(atom) && member.contains(next))
            .count();
        if (shared == 1) {
          neighbors.computeIfAbsent(atom, key -> new ArrayList<>()).add(next);
        }
      }
    }
    if (neighbors.values().stream().anyMatch(list -> list.size() != 2)) {
      return List.of();
    }
    int start = ring.getAtomIds().get(0);
    if (!neighbors.containsKey(start)) {
      return List.of();
    }
    List<Integer> walk = new ArrayList<>();
    int previous = -1;
    int current = start;
    do {
      walk.add(current);
      List<Integer> options = neighbors.get(current);
      int next = options.get(0) != previous ? options.get(0) : options.get(1);
      previous = current;
      current = next;
    } while (current != start && walk.size() <= ring.size());
    return walk;
  }

  /**
   * A matched template with every numbering its periphery allows.
   *
   * @param template matched template
   * @param schemes  admissible numberings
   */
  public record Match(FusedRingTemplate template, List<NumberingScheme> schemes) {

    /**
     * Names the system after the numbering that gives the heteroatoms the lowest locants, senior heteroatoms first on
     * a tie.
     *
     * @param ring     ring system
     * @param molecule molecule graph
     * @return retained name
     */
    public Optional<String> name(RingSystem ring, Molecule molecule) {
      List<Integer> heteroatoms = ring.heteroatoms(molecule);
      NumberingScheme best = schemes.stream()
          .min(Comparator.<NumberingScheme, List<Integer>>comparing(
                  scheme -> heteroatomLocants(scheme, heteroatoms), LocantOptimizer::compareVectors)
              .thenComparing(scheme -> seniorityByLocant(scheme, heteroatoms, molecule),
                  LocantOptimizer::compareVectors))
          .orElseThrow();
      Map<Integer, Integer> locants = best.locantsByAtom();
      String key = heteroatoms.stream()
          .sorted(Comparator.comparing(locants::get))
          .map(id -> molecule.atom(id).getSymbol() + label(best, locants.get(id)))
          .collect(Collectors.joining(","));
      return Optional.ofNullable(template.names.get(key));
    }

    private static List<Integer> heteroatomLocants(NumberingScheme scheme, List<Integer> heteroatoms) {
      Map<Integer, Integer> locants = scheme.locantsByAtom();
      return heteroatoms.stream().map(locants::get).sorted().toList();
    }

    private static List<Integer> seniorityByLocant(NumberingScheme scheme, List<Integer> heteroatoms,
                                                   Molecule molecule) {
      Map<Integer, Integer> locants = scheme.locantsByAtom();
      return heteroatoms.stream()
          .sorted(Comparator.comparing(locants::get))
          .map(id -> Vocabulary.heteroatomSeniority(molecule.atom(id).getSymbol()))
          .toList();
    }

    private static String label(NumberingScheme scheme, int locant) {
      return scheme.labels().getOrDefault(locant, String.valueOf(locant));
    }
  }
}
