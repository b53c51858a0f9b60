package com.quantori.cnp.core.model;

/**
 * Nomenclature operation used to build the name.
 */
public enum NomenclatureMode {
  /**
   * Prefixes and suffixes around a parent hydride, i.e. 2-methylpropan-1-ol
   */
  SUBSTITUTIVE,
  /**
   * Separate words for the components, i.e. methyl acetate
   */
  FUNCTIONAL_CLASS
}
