package com.quantori.cnp.api.model;

/**
 * Provenance record of a rule that changed the naming state.
 *
 * @param ordinal     position of the application within the run, starting from 1
 * @param ruleId      rule identifier, usually a Blue Book reference
 * @param phase       phase the rule belongs to
 * @param description human readable rule description
 */
public record RuleApplication(int ordinal, String ruleId, NamingPhase phase, String description) {
}
