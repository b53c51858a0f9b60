package com.quantori.cnp.core.numbering;

import com.quantori.cnp.api.model.Molecule;
import com.quantori.cnp.core.model.ParentStructure;
import com.quantori.cnp.core.model.RingSystem;
import com.quantori.cnp.core.model.RingTopology;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Enumerates the admissible numberings of a parent structure.
 * <ul>
 *   <li>chain: both directions</li>
 *   <li>monocycle: every start atom in both directions, restricted to the heteroatoms or the fixed anchor when
 *   present</li>
 *   <li>aromatic fused systems with a {@link FusedRingTemplate}: the peripheral numberings of the template, fusion
 *   atoms labelled 4a, 8a and so on</li>
 *   <li>von Baeyer bicycle: main bridgehead first, main bridge, second bridgehead, second bridge, smallest bridge</li>
 *   <li>spiro: smaller ring first, then the spiro atom, then the larger ring</li>
 * </ul>
 */
public class SchemeGenerator {

  public List<NumberingScheme> generate(ParentStructure parent, Molecule molecule) {
    List<Integer> positions = parent.getPositions();
    if (parent.isHeteroatom() || positions.size() < 2) {
      return List.of(NumberingScheme.of(positions));
    }
    if (parent.isChain()) {
      return distinct(List.of(positions, RingGeometry.reversed(positions)));
    }

    RingSystem ring = parent.getRing();
    Optional<FusedRingTemplate.Match> template = FusedRingTemplate.match(ring, molecule);
    if (template.isPresent()) {
      return template.get().schemes();
    }
    List<List<Integer>> orders;
    if (ring.getTopology() == RingTopology.MONOCYCLIC) {
      orders = monocycle(ring, parent.getFixedAnchorAtomId(), molecule);
    } else {
      orders = RingGeometry.bicycle(ring, molecule).map(SchemeGenerator::vonBaeyer)
          .or(() -> RingGeometry.spiro(ring).map(SchemeGenerator::spiro))
          .orElseGet(() -> List.of(positions, RingGeometry.reversed(positions)));
    }

    List<NumberingScheme> schemes = new ArrayList<>();
    for (List<Integer> order : new LinkedHashSet<>(orders)) {
      schemes.add(NumberingScheme.of(order));
    }
    return schemes;
  }

  private static List<List<Integer>> monocycle(RingSystem ring, Integer anchor, Molecule molecule) {
    List<Integer> atoms = ring.getAtomIds();
    List<Integer> starts;
    if (anchor != null && ring.contains(anchor)) {
      starts = List.of(anchor);
    } else {
      List<Integer> heteroatoms = ring.heteroatoms(molecule);
      starts = heteroatoms.isEmpty() ? atoms : heteroatoms;
    }
    List<List<Integer>> orders = new ArrayList<>();
    for (int start : starts) {
      orders.add(RingGeometry.rotate(atoms, start, true));
      orders.add(RingGeometry.rotate(atoms, start, false));
    }
    return orders;
  }

  private static List<List<Integer>> vonBaeyer(RingGeometry.Bicycle bicycle) {
    List<List<Integer>> orders = new ArrayList<>();
    for (boolean fromFirst : new boolean[] {true, false}) {
      int start = fromFirst ? bicycle.first() : bicycle.second();
      int end = fromFirst ? bicycle.second() : bicycle.first();
      List<List<Integer>> bridges = new ArrayList<>();
      for (List<Integer> bridge : bicycle.bridges()) {
        bridges.add(fromFirst ? bridge : RingGeometry.reversed(bridge));
      }
      for (List<List<Integer>> permutation : sizeOrderedPermutations(bridges)) {
        List<Integer> order = new ArrayList<>();
        order.add(start);
        order.addAll(permutation.get(0));
        order.add(end);
        order.addAll(RingGeometry.reversed(permutation.get(1)));
        order.addAll(permutation.get(2));
        orders.add(order);
      }
    }
    return orders;
  }

  private static List<List<List<Integer>>> sizeOrderedPermutations(List<List<Integer>> bridges) {
    int[][] permutations = {{0, 1, 2}, {1, 0, 2}, {0, 2, 1}, {1, 2, 0}, {2, 0, 1}, {2, 1, 0}};
    List<List<List<Integer>>> result = new ArrayList<>();
    for (int[] permutation : permutations) {
      List<List<Integer>> ordered = List.of(
          bridges.get(permutation[0]), bridges.get(permutation[1]), bridges.get(permutation[2]));
      if (ordered.get(0).size() >= ordered.get(1).size() && ordered.get(1).size() >= ordered.get(2).size()) {
        result.add(ordered);
      }
    }
    return result;
  }

  private static List<List<Integer>> spiro(RingGeometry.Spiro spiro) {
    List<List<Integer>> orders = new ArrayList<>();
    List<List<Integer>> smallRings = List.of(spiro.smallRing(), spiro.largeRing());
    int candidates = spiro.smallRing().size() == spiro.largeRing().size() ? 2 : 1;
    for (int i = 0; i < candidates; i++) {
      List<Integer> small = smallRings.get(i);
      List<Integer> large = smallRings.get(1 - i);
      for (List<Integer> smallWalk : List.of(small, RingGeometry.reversed(small))) {
        for (List<Integer> largeWalk : List.of(large, RingGeometry.reversed(large))) {
          List<Integer> order = new ArrayList<>(smallWalk);
          order.add(spiro.center());
          order.addAll(largeWalk);
          orders.add(order);
        }
      }
    }
    return orders;
  }

  private static List<NumberingScheme> distinct(List<List<Integer>> orders) {
    Set<List<Integer>> unique = new LinkedHashSet<>(orders);
    return unique.stream().map(NumberingScheme::of).toList();
  }
}
