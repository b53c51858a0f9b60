package com.quantori.cnp.core.candidate;

import com.quantori.cnp.api.model.BondOrder;
import com.quantori.cnp.api.model.Molecule;
import com.quantori.cnp.core.model.MultipleBond;
import com.quantori.cnp.core.model.RingSystem;
import com.quantori.cnp.core.model.RingTopology;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups the rings of a molecule into ring systems, rings sharing at least one atom belong to the same system.
 */
public class RingSystemFinder {

  private final AromaticityClassifier aromaticityClassifier;

  public RingSystemFinder(AromaticityClassifier aromaticityClassifier) {
    this.aromaticityClassifier = aromaticityClassifier;
  }

  public List<RingSystem> find(Molecule molecule) {
    List<List<Integer>> rings = new ArrayList<>();
    for (List<Integer> ring : molecule.getRings()) {
      rings.add(ringOrder(ring, molecule));
    }

    int[] roots = new int[rings.size()];
    for (int i = 0; i < roots.length; i++) {
      roots[i] = i;
    }
    for (int i = 0; i < rings.size(); i++) {
      for (int j = i + 1; j < rings.size(); j++) {
        if (rings.get(i).stream().anyMatch(rings.get(j)::contains)) {
          union(roots, i, j);
        }
      }
    }

    Map<Integer, List<List<Integer>>> groups = new LinkedHashMap<>();
    for (int i = 0; i < rings.size(); i++) {
      groups.computeIfAbsent(find(roots, i), key -> new ArrayList<>()).add(rings.get(i));
    }

    List<RingSystem> systems = new ArrayList<>();
    for (List<List<Integer>> members : groups.values()) {
      systems.add(toSystem(members, molecule));
    }
    return systems;
  }

  private RingSystem toSystem(List<List<Integer>> members, Molecule molecule) {
    Set<Integer> atoms = new LinkedHashSet<>();
    members.forEach(atoms::addAll);

    RingSystem.RingSystemBuilder builder = RingSystem.builder()
        .atomIds(atoms)
        .rings(members)
        .topology(topology(members, molecule))
        .aromatic(members.stream().allMatch(ring -> aromaticityClassifier.isAromatic(ring, molecule)));

    Set<String> seen = new HashSet<>();
    for (List<Integer> ring : members) {
      for (int i = 0; i < ring.size(); i++) {
        int first = ring.get(i);
        int second = ring.get((i + 1) % ring.size());
        BondOrder order = molecule.bondOrder(first, second);
        String key = Math.min(first, second) + "-" + Math.max(first, second);
        if (order != null && order.isMultiple() && seen.add(key)) {
          builder.multipleBond(new MultipleBond(first, second, order));
        }
      }
    }
    return builder.build();
  }

  private static RingTopology topology(List<List<Integer>> members, Molecule molecule) {
    if (members.size() == 1) {
      return RingTopology.MONOCYCLIC;
    }
    if (members.size() > 2) {
      return RingTopology.POLYCYCLIC;
    }
    List<Integer> shared = members.get(0).stream().filter(members.get(1)::contains).toList();
    if (shared.size() == 1) {
      return RingTopology.SPIRO;
    }
    if (shared.size() == 2 && molecule.bond(shared.get(0), shared.get(1)) != null) {
      return RingTopology.FUSED;
    }
    return RingTopology.BRIDGED;
  }

  /**
   * Orders ring atoms so that consecutive atoms are bonded.
   *
   * @param ring     ring atoms in any order
   * @param molecule molecule graph
   * @return atoms in ring order, or the input order when no cycle through all atoms exists
   */
  static List<Integer> ringOrder(List<Integer> ring, Molecule molecule) {
    if (ring.size() < 3) {
      return List.copyOf(ring);
    }
    Set<Integer> members = new HashSet<>(ring);
    List<Integer> path = new ArrayList<>();
    path.add(ring.get(0));
    if (extend(path, members, molecule)) {
      return List.copyOf(path);
    }
    return List.copyOf(ring);
  }

  private static boolean extend(List<Integer> path, Set<Integer> members, Molecule molecule) {
    int current = path.get(path.size() - 1);
    if (path.size() == members.size()) {
      return molecule.bond(current, path.get(0)) != null;
    }
    for (int next : molecule.neighbors(current)) {
      if (members.contains(next) && !path.contains(next)) {
        path.add(next);
        if (extend(path, members, molecule)) {
          return true;
        }
        path.remove(path.size() - 1);
      }
    }
    return false;
  }

  private static int find(int[] roots, int index) {
    while (roots[index] != index) {
      roots[index] = roots[roots[index]];
      index = roots[index];
    }
    return index;
  }

  private static void union(int[] roots, int first, int second) {
    roots[find(roots, second)] = find(roots, first);
  }
}
