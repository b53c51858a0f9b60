package com.quantori.cnp.core.configuration;

import lombok.Value;

/**
 * Mononuclear parent hydride of a heteroatom, i.e. silane.
 */
@Value
public class HydrideName {
  String symbol;
  int valence;
  String name;
  /**
   * Substituent form, i.e. "silyl"
   */
  String substituentName;
}
