package com.quantori.cnp.core.model;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A detected characteristic group.
 * <p>
 * Locants are expressed through {@link #locantAtomIds} until the numbering phase resolves them into
 * {@link #locants}.
 */
@Value
@Builder(toBuilder = true)
public class FunctionalGroup {
  String type;
  String prefix;
  String suffix;
  String attachedSuffix;
  int priority;
  /**
   * Atoms of the group core
   */
  @Singular
  List<Integer> atomIds;
  /**
   * Parent atoms carrying the group, one per aggregated instance
   */
  @Singular
  List<Integer> locantAtomIds;
  @Singular
  List<Integer> locants;
  boolean principal;
  boolean canBePrincipal;
  /**
   * Group atom is itself part of the parent skeleton, i.e. the carbon of an acid in a chain
   */
  boolean incorporated;
  boolean terminal;
  boolean nitrogenLocant;
  @Builder.Default
  int multiplicity = 1;
  /**
   * Alcohol components of an ester cited in functional class names
   */
  @Singular
  List<String> alkylComponents;

  public String principalSuffix() {
    if (incorporated || attachedSuffix == null) {
      return suffix;
    }
    return attachedSuffix;
  }

  public boolean overlaps(FunctionalGroup other) {
    return atomIds.stream().anyMatch(other.atomIds::contains);
  }

  /**
   * Checks whether one of the substituents already covers this group, i.e. the "hydroxy" branch of an alcohol.
   *
   * @param substituents substituents of the parent
   * @return true when a substituent holds one of the group atoms
   */
  public boolean isCitedBy(List<Substituent> substituents) {
    return substituents.stream()
        .anyMatch(substituent -> substituent.getAtomIds().stream().anyMatch(atomIds::contains));
  }
}
