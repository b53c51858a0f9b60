package com.quantori.cnp.core.rules;

import com.quantori.cnp.api.model.Conflict;
import com.quantori.cnp.api.model.ConflictType;
import com.quantori.cnp.api.model.NamingPhase;
import com.quantori.cnp.core.engine.NamingRule;
import com.quantori.cnp.core.model.FunctionalGroup;
import com.quantori.cnp.core.model.NamingState;
import com.quantori.cnp.core.model.ParentStructure;
import com.quantori.cnp.core.naming.NameAssembler;
import com.quantori.cnp.core.naming.ParentNameBuilder;
import com.quantori.cnp.core.naming.RingNamer;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Rules of the ASSEMBLY phase: final parent name, name assembly, validation and confidence.
 */
public class AssemblyRules {

  static final int MAX_NAME_LENGTH = 200;

  private final RingNamer ringNamer;
  private final NameAssembler nameAssembler;

  public AssemblyRules(RingNamer ringNamer, NameAssembler nameAssembler) {
    this.ringNamer = ringNamer;
    this.nameAssembler = nameAssembler;
  }

  public List<NamingRule> rules() {
    return List.of(
        rule("parent-required", "A parent structure is required for assembly", "P-2", 500,
            state -> !state.hasParent() && state.getFinalName() == null,
            state -> state.toBuilder().finalName("").build()
                .withConflict(Conflict.of(ConflictType.RULE_CONFLICT, "parent-required",
                    "Assembly reached without a parent structure"))),
        rule("multiply-principal-groups", "Combine identical principal groups under a multiplying prefix",
            "P-16.9", 400,
            state -> state.principalGroups().size() > 1,
            this::aggregatePrincipalGroups),
        rule("parent-name", "Name the numbered parent hydride", "P-31.1.4.2", 300,
            state -> state.hasParent() && state.getParent().isNumbered() && !state.getParent().isHeteroatom()
                && state.getFinalName() == null,
            this::renameParent),
        rule("assemble-name", "Assemble prefixes, parent and suffix", "P-59", 200,
            state -> state.hasParent() && state.getFinalName() == null,
            this::assemble),
        rule("name-validation", "Check the assembled name", "P-59.1", 100,
            state -> state.getFinalName() != null,
            AssemblyRules::validate),
        rule("confidence", "Score the confidence of the name", "P-59.2", 50,
            state -> true,
            state -> state.toBuilder().confidence(confidence(state)).build())
    );
  }

  private NamingState aggregatePrincipalGroups(NamingState state) {
    List<FunctionalGroup> principals = state.principalGroups();
    FunctionalGroup first = principals.get(0);
    Set<Integer> atomIds = new LinkedHashSet<>();
    List<Integer> locantAtomIds = new ArrayList<>();
    List<Integer> locants = new ArrayList<>();
    List<String> alkylComponents = new ArrayList<>();
    for (FunctionalGroup group : principals) {
      atomIds.addAll(group.getAtomIds());
      locantAtomIds.addAll(group.getLocantAtomIds());
      locants.addAll(group.getLocants());
      alkylComponents.addAll(group.getAlkylComponents());
    }
    locants.sort(Integer::compare);
    FunctionalGroup aggregated = first.toBuilder()
        .multiplicity(principals.size())
        .clearAtomIds().atomIds(atomIds)
        .clearLocantAtomIds().locantAtomIds(locantAtomIds)
        .clearLocants().locants(locants)
        .clearAlkylComponents().alkylComponents(alkylComponents)
        .build();

    List<FunctionalGroup> groups = new ArrayList<>();
    for (FunctionalGroup group : state.getFunctionalGroups()) {
      if (group == first) {
        groups.add(aggregated);
      } else if (!group.isPrincipal()) {
        groups.add(group);
      }
    }
    return state.withFunctionalGroups(groups);
  }

  private NamingState renameParent(NamingState state) {
    ParentStructure parent = state.getParent();
    String name;
    if (parent.isChain()) {
      name = ParentNameBuilder.chain(parent);
    } else {
      boolean implied = parent.getMultipleBonds().size() == 1 && parent.getMultipleBonds().get(0).isDouble()
          && parent.getSubstituents().isEmpty() && state.principalGroups().isEmpty();
      name = ringNamer.name(parent, state.getMolecule(), !implied);
    }
    if (name.equals(parent.getName())) {
      return state;
    }
    return state.withParent(parent.toBuilder().name(name).build());
  }

  private NamingState assemble(NamingState state) {
    String name = nameAssembler.assemble(state.getParent(), state.getFunctionalGroups(), state.getMode());
    return state.withParent(state.getParent().toBuilder().assembledName(name).build())
        .toBuilder()
        .finalName(name)
        .build();
  }

  private static NamingState validate(NamingState state) {
    String name = state.getFinalName();
    String problem = null;
    if (name.isBlank()) {
      problem = "Name is empty";
    } else if (name.chars().noneMatch(Character::isLetter)) {
      problem = "Name contains no letters";
    } else if (name.length() > MAX_NAME_LENGTH) {
      problem = "Name is longer than " + MAX_NAME_LENGTH + " characters";
    }
    if (problem == null) {
      return state;
    }
    return state.withConflict(Conflict.of(ConflictType.VALIDATION_FAILURE, "name-validation", problem));
  }

  /**
   * Starts from 1.0, takes 0.3 off without a proper parent, 0.1 per other penalized conflict and 0.2 for a failed
   * validation. The result stays within [0.1, 1.0].
   */
  static double confidence(NamingState state) {
    double confidence = 1.0;
    boolean noParent = !state.hasParent();
    boolean invalid = false;
    for (Conflict conflict : state.getConflicts()) {
      switch (conflict.getType()) {
        case STRUCTURE_NOT_FOUND -> noParent = true;
        case VALIDATION_FAILURE -> invalid = true;
        default -> {
          if (conflict.getType().isPenalized()) {
            confidence -= 0.1;
          }
        }
      }
    }
    if (noParent) {
      confidence -= 0.3;
    }
    if (invalid) {
      confidence -= 0.2;
    }
    return Math.max(0.1, Math.min(1.0, confidence));
  }

  private static NamingRule rule(String id, String name, String reference, int priority,
                                 Predicate<NamingState> condition, UnaryOperator<NamingState> action) {
    return NamingRule.builder()
        .id(id)
        .name(name)
        .reference(reference)
        .priority(priority)
        .phase(NamingPhase.ASSEMBLY)
        .condition(condition)
        .action(action)
        .build();
  }
}
