package com.quantori.cnp.core.engine;

import com.quantori.cnp.api.model.Conflict;
import com.quantori.cnp.api.model.ConflictType;
import com.quantori.cnp.api.model.NamingPhase;
import com.quantori.cnp.api.model.RuleApplication;
import com.quantori.cnp.core.model.NamingState;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.Getter;

/**
 * Runs the rules of one phase in a single pass.
 * <p>
 * Rules are sorted once by descending priority, rules of equal priority keep their registration order. Every rule is
 * evaluated against the current state exactly once. A rule that changes the state gets a provenance record, a rule
 * whose transform fails is recorded as a conflict and leaves the state as it was.
 */
public class PhaseController {

  @Getter
  private final NamingPhase phase;
  @Getter
  private final List<Rule<NamingState>> rules;
  private final NamingTracer tracer;

  public PhaseController(NamingPhase phase, List<? extends Rule<NamingState>> rules, NamingTracer tracer) {
    this.phase = phase;
    List<Rule<NamingState>> sorted = new ArrayList<>(rules);
    sorted.sort(Comparator.comparingInt((Rule<NamingState> rule) -> rule.getPriority()).reversed());
    this.rules = List.copyOf(sorted);
    this.tracer = tracer;
  }

  public NamingState execute(NamingState input) {
    NamingState state = input.withPhase(phase);
    for (Rule<NamingState> rule : rules) {
      boolean applicable;
      try {
        applicable = rule.isApplicable(state);
      } catch (RuntimeException e) {
        tracer.warn("Condition of rule {} failed: {}", rule.getId(), e.getMessage());
        state = state.withConflict(Conflict.of(ConflictType.RULE_CONFLICT, rule.getId(),
            "Condition failed: " + e.getMessage()));
        continue;
      }
      if (!applicable) {
        tracer.debug("[{}] {} not applicable", phase, rule.getId());
        continue;
      }

      NamingState next;
      try {
        next = rule.apply(state);
      } catch (RuntimeException e) {
        tracer.warn("Rule {} failed: {}", rule.getId(), e.getMessage());
        state = state.withConflict(Conflict.of(ConflictType.RULE_CONFLICT, rule.getId(),
            "Rule failed: " + e.getMessage()));
        continue;
      }
      if (next == null || next == state || next.equals(state)) {
        tracer.debug("[{}] {} declined", phase, rule.getId());
        continue;
      }
      state = next.withApplication(
          new RuleApplication(next.getHistory().size() + 1, rule.getId(), phase, rule.getName()));
      tracer.debug("[{}] applied {} ({})", phase, rule.getId(), rule.getName());
    }
    return state;
  }
}
