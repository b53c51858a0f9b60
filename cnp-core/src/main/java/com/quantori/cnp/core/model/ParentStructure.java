package com.quantori.cnp.core.model;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * The parent hydride a name is built around: a chain, a ring system or a single heteroatom.
 * <p>
 * {@link #positions} lists the parent atoms and {@link #locants} holds the locant of each of them. Before numbering
 * the locants simply follow the candidate order, after numbering positions are sorted by locant.
 */
@Value
@Builder(toBuilder = true)
public class ParentStructure {
  ParentKind kind;
  /**
   * Base name without prefixes and suffixes, i.e. "pent-2-ene"
   */
  String name;
  Chain chain;
  RingSystem ring;
  @Singular
  List<Integer> positions;
  @Singular
  List<Integer> locants;
  /**
   * Display labels of locants that are not plain numbers, i.e. 9 shown as "4a" in naphthalene
   */
  @Singular
  Map<Integer, String> locantLabels;
  @Singular
  List<MultipleBond> multipleBonds;
  @Singular
  List<Substituent> substituents;
  boolean substituentsResolved;
  boolean numbered;
  /**
   * Parent atom fixed at locant 1 by a retained name
   */
  Integer fixedAnchorAtomId;
  /**
   * Retained name replacing the parent and principal suffix, i.e. "phenol"
   */
  String retainedName;
  /**
   * All positions are equivalent, a lone substituent needs no locant
   */
  boolean symmetric;
  /**
   * Final name, set during assembly only
   */
  String assembledName;

  public int size() {
    return positions.size();
  }

  public boolean isChain() {
    return kind == ParentKind.CHAIN;
  }

  public boolean isRing() {
    return kind == ParentKind.RING;
  }

  public boolean isHeteroatom() {
    return kind == ParentKind.HETEROATOM;
  }

  public boolean contains(int atomId) {
    return positions.contains(atomId);
  }

  public Set<Integer> atomSet() {
    return new HashSet<>(positions);
  }

  /**
   * Gets the locant of a parent atom.
   *
   * @param atomId atom id
   * @return locant or null when the atom is not part of the parent
   */
  public Integer locantOf(int atomId) {
    int index = positions.indexOf(atomId);
    return index < 0 ? null : locants.get(index);
  }

  public String label(int locant) {
    return locantLabels.getOrDefault(locant, String.valueOf(locant));
  }

  /**
   * Locant of a multiple bond: the lower locant of its atoms, or the higher one for the bond closing a ring.
   *
   * @param bond multiple bond of this parent
   * @return bond locant
   */
  public int locantOf(MultipleBond bond) {
    int first = locantOf(bond.getFirst());
    int second = locantOf(bond.getSecond());
    int low = Math.min(first, second);
    int high = Math.max(first, second);
    if (isRing() && low == 1 && high == size() && size() > 2) {
      return high;
    }
    return low;
  }
}
