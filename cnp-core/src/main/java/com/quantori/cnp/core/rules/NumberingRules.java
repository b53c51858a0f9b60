package com.quantori.cnp.core.rules;

import static com.quantori.cnp.core.configuration.DefaultNomenclatureTables.ALCOHOL;
import static com.quantori.cnp.core.configuration.DefaultNomenclatureTables.ALDEHYDE;
import static com.quantori.cnp.core.configuration.DefaultNomenclatureTables.AMIDE;
import static com.quantori.cnp.core.configuration.DefaultNomenclatureTables.AMINE;
import static com.quantori.cnp.core.configuration.DefaultNomenclatureTables.CARBOXYLIC_ACID;
import static com.quantori.cnp.core.configuration.DefaultNomenclatureTables.ESTER;
import static com.quantori.cnp.core.configuration.DefaultNomenclatureTables.NITRILE;

import com.quantori.cnp.api.model.Conflict;
import com.quantori.cnp.api.model.ConflictType;
import com.quantori.cnp.api.model.NamingPhase;
import com.quantori.cnp.core.engine.NamingRule;
import com.quantori.cnp.core.model.FunctionalGroup;
import com.quantori.cnp.core.model.NamingState;
import com.quantori.cnp.core.model.ParentStructure;
import com.quantori.cnp.core.model.RingSystem;
import com.quantori.cnp.core.model.RingTopology;
import com.quantori.cnp.core.model.Substituent;
import com.quantori.cnp.core.numbering.LocantOptimizer;
import com.quantori.cnp.core.numbering.NumberingResult;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.IntStream;

/**
 * Rules of the NUMBERING phase.
 */
public class NumberingRules {

  private static final Map<String, String> RETAINED_BENZENES = Map.of(
      ALCOHOL, "phenol",
      AMINE, "aniline",
      CARBOXYLIC_ACID, "benzoic acid",
      ALDEHYDE, "benzaldehyde",
      NITRILE, "benzonitrile",
      AMIDE, "benzamide",
      ESTER, "benzoate");

  private final LocantOptimizer locantOptimizer;

  public NumberingRules(LocantOptimizer locantOptimizer) {
    this.locantOptimizer = locantOptimizer;
  }

  public List<NamingRule> rules() {
    return List.of(
        rule("retained-benzene", "Use a retained name for a monosubstituted benzene parent", "P-34.1.1", 300,
            this::isRetainedBenzene,
            this::retainBenzene),
        rule("lowest-locants", "Number the parent for lowest locants", "P-31.1.4", 200,
            state -> state.hasParent() && state.getParent().isSubstituentsResolved()
                && !state.getParent().isNumbered(),
            this::number),
        rule("locant-validation", "Check that the numbering is complete and in range", "P-31.1", 100,
            state -> state.hasParent() && state.getParent().isNumbered(),
            this::validate)
    );
  }

  private boolean isRetainedBenzene(NamingState state) {
    if (!state.hasParent() || !state.getParent().isRing() || state.getParent().getFixedAnchorAtomId() != null) {
      return false;
    }
    RingSystem ring = state.getParent().getRing();
    if (ring.getTopology() != RingTopology.MONOCYCLIC || !ring.isAromatic() || ring.size() != 6
        || !ring.heteroatoms(state.getMolecule()).isEmpty()) {
      return false;
    }
    List<FunctionalGroup> principals = state.principalGroups();
    if (principals.size() != 1) {
      return false;
    }
    FunctionalGroup principal = principals.get(0);
    return RETAINED_BENZENES.containsKey(principal.getType()) && !principal.isIncorporated()
        && principal.getLocantAtomIds().size() == 1;
  }

  private NamingState retainBenzene(NamingState state) {
    FunctionalGroup principal = state.principalGroups().get(0);
    ParentStructure parent = state.getParent().toBuilder()
        .fixedAnchorAtomId(principal.getLocantAtomIds().get(0))
        .retainedName(RETAINED_BENZENES.get(principal.getType()))
        .build();
    return state.withParent(parent);
  }

  private NamingState number(NamingState state) {
    NumberingResult result = locantOptimizer.optimize(state.getParent(), state.getFunctionalGroups(),
        state.getMolecule());
    NamingState numbered = state.withParent(result.parent()).withFunctionalGroups(result.groups());
    if (result.ambiguous()) {
      numbered = numbered.withConflict(Conflict.of(ConflictType.LOCANT_AMBIGUITY, "lowest-locants",
          "Equally ranked numberings place the substituents differently"));
    }
    return numbered;
  }

  private NamingState validate(NamingState state) {
    ParentStructure parent = state.getParent();
    int size = parent.size();
    List<Integer> expected = IntStream.rangeClosed(1, size).boxed().toList();
    if (!parent.getLocants().stream().sorted().toList().equals(expected)) {
      return invalid(state, "Parent locants are not a permutation of 1.." + size);
    }
    Predicate<Integer> inRange = locant -> locant >= 1 && locant <= size;
    for (FunctionalGroup group : state.getFunctionalGroups()) {
      if (!group.getLocants().stream().allMatch(inRange)) {
        return invalid(state, "Locant of " + group.getType() + " out of range");
      }
    }
    for (Substituent substituent : parent.getSubstituents()) {
      if (substituent.getHeteroLocant() == null && !inRange.test(substituent.getLocant())) {
        return invalid(state, "Locant of " + substituent.getName() + " out of range");
      }
    }
    return state;
  }

  private static NamingState invalid(NamingState state, String message) {
    return state.withConflict(Conflict.of(ConflictType.RULE_CONFLICT, "locant-validation", message));
  }

  private static NamingRule rule(String id, String name, String reference, int priority,
                                 Predicate<NamingState> condition, UnaryOperator<NamingState> action) {
    return NamingRule.builder()
        .id(id)
        .name(name)
        .reference(reference)
        .priority(priority)
        .phase(NamingPhase.NUMBERING)
        .condition(condition)
        .action(action)
        .build();
  }
}
