package com.quantori.cnp.core.numbering;

import com.quantori.cnp.api.model.Molecule;
import com.quantori.cnp.core.model.RingSystem;
import com.quantori.cnp.core.model.RingTopology;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.experimental.UtilityClass;

/**
 * Walks and bridge analysis of ring systems, shared by numbering and ring naming.
 */
@UtilityClass
public class RingGeometry {

  /**
   * Two bridgeheads joined by three bridges.
   *
   * @param first   first bridgehead in ring system order
   * @param second  second bridgehead
   * @param bridges interior atoms of each bridge walked from {@code first} to {@code second}, longest bridge first
   */
  public record Bicycle(int first, int second, List<List<Integer>> bridges) {

    public int totalSize() {
      return 2 + bridges.stream().mapToInt(List::size).sum();
    }
  }

  /**
   * Two rings sharing exactly one atom.
   *
   * @param center     the spiro atom
   * @param smallRing  atoms of the smaller ring without the spiro atom, walked from a neighbour of the spiro atom
   * @param largeRing  atoms of the larger ring without the spiro atom, walked the same way
   */
  public record Spiro(int center, List<Integer> smallRing, List<Integer> largeRing) {
  }

  /**
   * Rotates a ring so that it starts at the given atom.
   *
   * @param ring    atoms in ring order
   * @param start   first atom of the result
   * @param forward keep the ring direction, otherwise walk it backwards
   * @return ring atoms starting at {@code start}
   */
  public static List<Integer> rotate(List<Integer> ring, int start, boolean forward) {
    int size = ring.size();
    int offset = ring.indexOf(start);
    List<Integer> result = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      int index = forward ? offset + i : offset - i;
      result.add(ring.get(Math.floorMod(index, size)));
    }
    return result;
  }

  /**
   * Walks a ring from one atom in the direction that does not immediately visit {@code avoid}.
   *
   * @param ring  atoms in ring order
   * @param start first atom
   * @param avoid neighbour of {@code start} that has to come last
   * @return ring atoms starting at {@code start}
   */
  public static List<Integer> walkAway(List<Integer> ring, int start, int avoid) {
    List<Integer> forward = rotate(ring, start, true);
    if (forward.size() > 1 && forward.get(1) == avoid) {
      return rotate(ring, start, false);
    }
    return forward;
  }

  public static Optional<Bicycle> bicycle(RingSystem system, Molecule molecule) {
    if (system.getTopology() != RingTopology.FUSED && system.getTopology() != RingTopology.BRIDGED) {
      return Optional.empty();
    }
    Set<Integer> atoms = system.atomSet();
    List<Integer> bridgeheads = system.getAtomIds().stream()
        .filter(id -> molecule.neighbors(id).stream().filter(atoms::contains).count() >= 3)
        .toList();
    if (bridgeheads.size() != 2) {
      return Optional.empty();
    }
    int first = bridgeheads.get(0);
    int second = bridgeheads.get(1);

    List<List<Integer>> bridges = new ArrayList<>();
    for (int next : molecule.neighbors(first)) {
      if (!atoms.contains(next)) {
        continue;
      }
      if (next == second) {
        bridges.add(List.of());
        continue;
      }
      List<Integer> bridge = new ArrayList<>();
      int previous = first;
      int current = next;
      while (current != second) {
        bridge.add(current);
        int from = previous;
        int at = current;
        Optional<Integer> step = molecule.neighbors(at).stream()
            .filter(id -> atoms.contains(id) && id != from)
            .findFirst();
        if (step.isEmpty() || bridge.size() > atoms.size()) {
          return Optional.empty();
        }
        previous = current;
        current = step.get();
      }
      bridges.add(List.copyOf(bridge));
    }
    if (bridges.size() != 3) {
      return Optional.empty();
    }
    bridges.sort(Comparator.comparingInt((List<Integer> bridge) -> bridge.size()).reversed());
    return Optional.of(new Bicycle(first, second, List.copyOf(bridges)));
  }

  public static Optional<Spiro> spiro(RingSystem system) {
    if (system.getTopology() != RingTopology.SPIRO || system.getRings().size() != 2) {
      return Optional.empty();
    }
    List<Integer> ringA = system.getRings().get(0);
    List<Integer> ringB = system.getRings().get(1);
    List<Integer> shared = ringA.stream().filter(ringB::contains).toList();
    if (shared.size() != 1) {
      return Optional.empty();
    }
    int center = shared.get(0);
    List<Integer> small = ringA.size() <= ringB.size() ? ringA : ringB;
    List<Integer> large = small == ringA ? ringB : ringA;
    return Optional.of(new Spiro(center, withoutStart(rotate(small, center, true)),
        withoutStart(rotate(large, center, true))));
  }

  static List<Integer> reversed(List<Integer> atoms) {
    List<Integer> copy = new ArrayList<>(atoms);
    Collections.reverse(copy);
    return copy;
  }

  private static List<Integer> withoutStart(List<Integer> walk) {
    return List.copyOf(walk.subList(1, walk.size()));
  }
}
