package com.quantori.cnp.core.candidate;

import com.quantori.cnp.api.model.Atom;
import com.quantori.cnp.api.model.BondOrder;
import com.quantori.cnp.api.model.Molecule;
import com.quantori.cnp.core.model.Chain;
import com.quantori.cnp.core.model.MultipleBond;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Enumerates the acyclic carbon paths running between two terminal carbons.
 * <p>
 * Carbons outside rings form a forest, so every pair of terminal carbons of a tree is joined by exactly one path and
 * every other path is a part of one of those. A lone carbon yields a one-atom chain.
 */
public class ChainFinder {

  public List<Chain> find(Molecule molecule) {
    Set<Integer> carbons = new LinkedHashSet<>();
    for (Atom atom : molecule.getAtoms()) {
      if (atom.isCarbon() && !atom.isInRing()) {
        carbons.add(atom.getId());
      }
    }

    List<Chain> chains = new ArrayList<>();
    Set<Integer> visited = new LinkedHashSet<>();
    for (int start : carbons) {
      if (visited.contains(start)) {
        continue;
      }
      List<Integer> component = component(start, carbons, molecule);
      visited.addAll(component);
      if (component.size() == 1) {
        chains.add(toChain(component, molecule));
        continue;
      }
      List<Integer> terminals = component.stream()
          .filter(id -> carbonNeighbors(id, carbons, molecule).size() == 1)
          .sorted()
          .toList();
      for (int i = 0; i < terminals.size(); i++) {
        for (int j = i + 1; j < terminals.size(); j++) {
          chains.add(toChain(path(terminals.get(i), terminals.get(j), carbons, molecule), molecule));
        }
      }
    }
    return chains;
  }

  private static List<Integer> component(int start, Set<Integer> carbons, Molecule molecule) {
    List<Integer> order = new ArrayList<>();
    Set<Integer> seen = new LinkedHashSet<>();
    seen.add(start);
    order.add(start);
    for (int i = 0; i < order.size(); i++) {
      for (int next : carbonNeighbors(order.get(i), carbons, molecule)) {
        if (seen.add(next)) {
          order.add(next);
        }
      }
    }
    return order;
  }

  private static List<Integer> carbonNeighbors(int atomId, Set<Integer> carbons, Molecule molecule) {
    return molecule.neighbors(atomId).stream().filter(carbons::contains).toList();
  }

  private static List<Integer> path(int from, int to, Set<Integer> carbons, Molecule molecule) {
    Map<Integer, Integer> previous = new HashMap<>();
    Deque<Integer> queue = new ArrayDeque<>();
    queue.add(from);
    previous.put(from, from);
    while (!queue.isEmpty()) {
      int current = queue.poll();
      if (current == to) {
        break;
      }
      for (int next : carbonNeighbors(current, carbons, molecule)) {
        if (!previous.containsKey(next)) {
          previous.put(next, current);
          queue.add(next);
        }
      }
    }
    List<Integer> path = new ArrayList<>();
    for (int current = to; current != from; current = previous.get(current)) {
      path.add(current);
    }
    path.add(from);
    Collections.reverse(path);
    return path;
  }

  static Chain toChain(List<Integer> atoms, Molecule molecule) {
    Chain.ChainBuilder builder = Chain.builder().atomIds(atoms);
    for (int i = 0; i + 1 < atoms.size(); i++) {
      BondOrder order = molecule.bondOrder(atoms.get(i), atoms.get(i + 1));
      if (order != null && order.isMultiple()) {
        builder.multipleBond(new MultipleBond(atoms.get(i), atoms.get(i + 1), order));
      }
    }
    return builder.build();
  }
}
