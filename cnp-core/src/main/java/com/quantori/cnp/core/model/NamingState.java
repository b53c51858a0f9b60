package com.quantori.cnp.core.model;

import com.quantori.cnp.api.model.Conflict;
import com.quantori.cnp.api.model.Molecule;
import com.quantori.cnp.api.model.NamingPhase;
import com.quantori.cnp.api.model.RuleApplication;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable snapshot threaded through the rule engine. Rules never modify a state, they derive a new one.
 */
@Value
@Builder(toBuilder = true)
public class NamingState {
  Molecule molecule;
  @Builder.Default
  List<Chain> candidateChains = List.of();
  @Builder.Default
  List<RingSystem> candidateRings = List.of();
  /**
   * Every ring system of the molecule, independent of parent selection
   */
  @Builder.Default
  List<RingSystem> ringSystems = List.of();
  @Builder.Default
  List<FunctionalGroup> functionalGroups = List.of();
  String principalType;
  @Builder.Default
  NomenclatureMode mode = NomenclatureMode.SUBSTITUTIVE;
  ParentStructure parent;
  NamingPhase phase;
  @Builder.Default
  List<RuleApplication> history = List.of();
  @Builder.Default
  List<Conflict> conflicts = List.of();
  String finalName;
  @Builder.Default
  double confidence = 1.0;

  public boolean hasParent() {
    return parent != null;
  }

  public List<FunctionalGroup> principalGroups() {
    return functionalGroups.stream().filter(FunctionalGroup::isPrincipal).toList();
  }

  public NamingState withParent(ParentStructure parent) {
    return toBuilder().parent(parent).build();
  }

  public NamingState withFunctionalGroups(List<FunctionalGroup> groups) {
    return toBuilder().functionalGroups(List.copyOf(groups)).build();
  }

  public NamingState withCandidateChains(List<Chain> chains) {
    return toBuilder().candidateChains(List.copyOf(chains)).build();
  }

  public NamingState withCandidateRings(List<RingSystem> rings) {
    return toBuilder().candidateRings(List.copyOf(rings)).build();
  }

  public NamingState withPhase(NamingPhase phase) {
    return toBuilder().phase(phase).build();
  }

  public NamingState withConflict(Conflict conflict) {
    List<Conflict> updated = new ArrayList<>(conflicts);
    updated.add(conflict);
    return toBuilder().conflicts(List.copyOf(updated)).build();
  }

  public NamingState withApplication(RuleApplication application) {
    List<RuleApplication> updated = new ArrayList<>(history);
    updated.add(application);
    return toBuilder().history(List.copyOf(updated)).build();
  }
}
