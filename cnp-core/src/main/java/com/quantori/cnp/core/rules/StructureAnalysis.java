package com.quantori.cnp.core.rules;

import com.quantori.cnp.api.model.Atom;
import com.quantori.cnp.api.model.Molecule;
import com.quantori.cnp.core.model.FunctionalGroup;
import com.quantori.cnp.core.naming.Branch;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.experimental.UtilityClass;

/**
 * Graph questions asked by several rules.
 */
@UtilityClass
class StructureAnalysis {

  /**
   * Counts the principal groups a candidate parent can express as suffixes. A group counts when one of its core atoms
   * is a candidate atom or when it {@link #canAttach can be attached} to the candidate.
   *
   * @param atoms      candidate atoms
   * @param ring       the candidate is a ring system
   * @param principals principal groups
   * @param molecule   molecule graph
   * @return number of principal groups
   */
  static int principalCount(Set<Integer> atoms, boolean ring, List<FunctionalGroup> principals, Molecule molecule) {
    int count = 0;
    for (FunctionalGroup group : principals) {
      boolean inside = group.getAtomIds().stream().anyMatch(atoms::contains);
      if (inside || canAttach(group, atoms, ring, molecule)) {
        count++;
      }
    }
    return count;
  }

  /**
   * Groups without a carbon atom (hydroxy, amino, sulfanyl) attach to any parent they are bonded to. Carbon groups
   * attach only to a ring, only when their carbon is bonded to it and only when they have an attached suffix form
   * (carboxylic acid, carbaldehyde). A ketone or an ester bonded through its oxygen never attaches.
   */
  static boolean canAttach(FunctionalGroup group, Set<Integer> atoms, boolean ring, Molecule molecule) {
    if (isHeteroOnly(group, molecule)) {
      return isAttached(group, atoms, molecule);
    }
    if (!ring || group.getAttachedSuffix() == null) {
      return false;
    }
    return group.getAtomIds().stream()
        .filter(id -> molecule.atom(id).isCarbon())
        .flatMap(id -> molecule.neighbors(id).stream())
        .anyMatch(atoms::contains);
  }

  static boolean isHeteroOnly(FunctionalGroup group, Molecule molecule) {
    return group.getAtomIds().stream().map(molecule::atom).noneMatch(Atom::isCarbon);
  }

  static boolean isAttached(FunctionalGroup group, Set<Integer> atoms, Molecule molecule) {
    return group.getAtomIds().stream()
        .flatMap(id -> molecule.neighbors(id).stream())
        .anyMatch(atoms::contains);
  }

  /**
   * Splits everything outside the parent atoms into branches.
   *
   * @param positions parent atoms in order
   * @param blocked   atoms no branch may contain, the parent atoms included
   * @param molecule  molecule graph
   * @return branches by parent atom order, every atom belongs to at most one branch
   */
  static List<Branch> branches(List<Integer> positions, Set<Integer> blocked, Molecule molecule) {
    List<Branch> branches = new ArrayList<>();
    Set<Integer> seen = new HashSet<>();
    for (int atom : positions) {
      for (int next : molecule.neighbors(atom)) {
        if (blocked.contains(next) || seen.contains(next)) {
          continue;
        }
        List<Integer> atoms = molecule.reachable(next, blocked);
        seen.addAll(atoms);
        branches.add(new Branch(atom, next, atoms));
      }
    }
    return branches;
  }

  /**
   * Connected components of the molecule graph.
   *
   * @param molecule molecule graph
   * @return atom id sets in order of their first atom
   */
  static List<Set<Integer>> components(Molecule molecule) {
    List<Set<Integer>> components = new ArrayList<>();
    Set<Integer> seen = new HashSet<>();
    for (Atom atom : molecule.getAtoms()) {
      if (seen.contains(atom.getId())) {
        continue;
      }
      Set<Integer> component = new HashSet<>(molecule.reachable(atom.getId(), Set.of()));
      seen.addAll(component);
      components.add(component);
    }
    return components;
  }
}
