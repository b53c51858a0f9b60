package com.quantori.cnp.core.naming;

/**
 * One cited prefix occurrence.
 *
 * @param name     prefix text without locant or multiplier
 * @param locant   locant label, i.e. "2", "4a" or "N"
 * @param compound the prefix is itself substituted and is enclosed in parentheses
 */
public record Fragment(String name, String locant, boolean compound) {

  public boolean isHeteroLocant() {
    return !locant.isEmpty() && !Character.isDigit(locant.charAt(0));
  }
}
