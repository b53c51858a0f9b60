package com.quantori.cnp.api.model;

/**
 * Ordered phases of the naming pipeline.
 */
public enum NamingPhase {
  /**
   * Selection of the parent hydride and the principal characteristic group
   */
  PARENT_STRUCTURE,
  /**
   * Assignment of lowest locants
   */
  NUMBERING,
  /**
   * Construction of the name text
   */
  ASSEMBLY
}
