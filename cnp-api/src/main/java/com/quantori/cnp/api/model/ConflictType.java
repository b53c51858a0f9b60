package com.quantori.cnp.api.model;

/**
 * Type of non-fatal problem detected while a name was being built.
 */
public enum ConflictType {
  /**
   * No parent chain, ring or hydride could be derived
   */
  STRUCTURE_NOT_FOUND,
  /**
   * Several numberings were equally good, the first one was kept
   */
  LOCANT_AMBIGUITY,
  /**
   * A rule found an inconsistent state or failed
   */
  RULE_CONFLICT,
  /**
   * The final name failed a sanity check
   */
  VALIDATION_FAILURE;

  /**
   * Informational conflicts are reported but do not lower the confidence of a name.
   *
   * @return true when the conflict counts against confidence
   */
  public boolean isPenalized() {
    return this != LOCANT_AMBIGUITY;
  }
}
