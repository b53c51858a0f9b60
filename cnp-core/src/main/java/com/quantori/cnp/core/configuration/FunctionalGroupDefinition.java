package com.quantori.cnp.core.configuration;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * A characteristic group known to the detector and the way it is cited in a name.
 */
@Value
@Builder(toBuilder = true)
public class FunctionalGroupDefinition {

  /**
   * Stable type tag, i.e. {@code carboxylic_acid}
   */
  String type;
  /**
   * Human readable name
   */
  String name;
  /**
   * SMARTS pattern handed to the pattern matcher
   */
  String pattern;
  /**
   * Indexes of the pattern atoms that belong to the group itself, the other pattern atoms are context
   */
  List<Integer> coreIndexes;
  /**
   * Substituent form, i.e. "hydroxy"
   */
  String prefix;
  /**
   * Principal form when the group carbon is part of the parent, i.e. "oic acid"
   */
  String suffix;
  /**
   * Principal form when the group is attached to the parent, i.e. "carboxylic acid"
   */
  String attachedSuffix;
  /**
   * Seniority, lower is more senior
   */
  int priority;
  boolean principal;
  /**
   * Principal form never needs a locant at a chain terminus
   */
  boolean terminal;
  /**
   * Substituents on the group nitrogen are cited with locant N
   */
  boolean nitrogenLocant;
}
