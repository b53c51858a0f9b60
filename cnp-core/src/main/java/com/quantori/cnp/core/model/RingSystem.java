package com.quantori.cnp.core.model;

import com.quantori.cnp.api.model.Molecule;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A set of rings connected through shared atoms. For a single ring the atoms are listed in ring order.
 */
@Value
@Builder(toBuilder = true)
public class RingSystem {
  @Singular
  List<Integer> atomIds;
  /**
   * Member rings, each in ring order
   */
  @Singular
  List<List<Integer>> rings;
  @Singular
  List<MultipleBond> multipleBonds;
  boolean aromatic;
  RingTopology topology;

  public int size() {
    return atomIds.size();
  }

  public Set<Integer> atomSet() {
    return new HashSet<>(atomIds);
  }

  public boolean contains(int atomId) {
    return atomIds.contains(atomId);
  }

  public List<Integer> heteroatoms(Molecule molecule) {
    return atomIds.stream().filter(id -> !molecule.atom(id).isCarbon()).toList();
  }

  /**
   * A carbocycle without heteroatoms whose positions are all equivalent: benzene or a saturated cycloalkane.
   *
   * @param molecule molecule the ring belongs to
   * @return true for symmetric monocycles
   */
  public boolean isSymmetric(Molecule molecule) {
    if (topology != RingTopology.MONOCYCLIC || !heteroatoms(molecule).isEmpty()) {
      return false;
    }
    return aromatic ? size() == 6 : multipleBonds.isEmpty();
  }
}
