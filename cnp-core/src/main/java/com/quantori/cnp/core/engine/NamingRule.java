package com.quantori.cnp.core.engine;

import com.quantori.cnp.api.model.NamingPhase;
import com.quantori.cnp.core.model.NamingState;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A rule assembled from a predicate and a transform.
 */
@Value
@Builder
public class NamingRule implements Rule<NamingState> {
  @NonNull
  String id;
  @NonNull
  String name;
  String reference;
  int priority;
  @NonNull
  NamingPhase phase;
  @NonNull
  Predicate<NamingState> condition;
  @NonNull
  UnaryOperator<NamingState> action;

  @Override
  public boolean isApplicable(NamingState state) {
    return condition.test(state);
  }

  @Override
  public NamingState apply(NamingState state) {
    return action.apply(state);
  }
}
