package com.quantori.cnp.core.engine;

import com.quantori.cnp.api.model.NamingPhase;

/**
 * A guarded transformation of a naming state.
 *
 * @param <S> state type the rule operates on
 */
public interface Rule<S> {

  /**
   * Stable identifier of the rule.
   *
   * @return rule id
   */
  String getId();

  String getName();

  String getReference();

  /**
   * Rules of a phase run in descending priority order.
   *
   * @return priority
   */
  int getPriority();

  NamingPhase getPhase();

  /**
   * Checks whether the rule applies. Must not modify anything.
   *
   * @param state current state
   * @return true to run {@link #apply(Object)}
   */
  boolean isApplicable(S state);

  /**
   * Derives the next state. Returning the given state means the rule declined to change anything.
   *
   * @param state current state
   * @return next state
   */
  S apply(S state);
}
