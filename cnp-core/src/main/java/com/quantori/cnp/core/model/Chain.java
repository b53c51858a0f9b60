package com.quantori.cnp.core.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * An acyclic carbon path, ordered from one terminal atom to the other.
 */
@Value
@Builder(toBuilder = true)
public class Chain {
  @Singular
  List<Integer> atomIds;
  @Singular
  List<MultipleBond> multipleBonds;

  public int length() {
    return atomIds.size();
  }

  public Set<Integer> atomSet() {
    return new HashSet<>(atomIds);
  }

  public long doubleBondCount() {
    return multipleBonds.stream().filter(MultipleBond::isDouble).count();
  }
}
