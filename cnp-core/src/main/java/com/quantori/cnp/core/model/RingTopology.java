package com.quantori.cnp.core.model;

/**
 * How the rings of a ring system are joined.
 */
public enum RingTopology {
  MONOCYCLIC,
  /**
   * Two rings sharing one bond
   */
  FUSED,
  /**
   * Two rings sharing more than one bond
   */
  BRIDGED,
  /**
   * Two rings sharing one atom
   */
  SPIRO,
  /**
   * Three or more rings
   */
  POLYCYCLIC
}
