package com.quantori.cnp.core.naming;

/**
 * Prefix name of a branch.
 *
 * @param name     prefix, i.e. "methyl" or "1-methylethyl"
 * @param compound the prefix is itself substituted and is enclosed when cited
 */
public record SubstituentName(String name, boolean compound) {

  static SubstituentName simple(String name) {
    return new SubstituentName(name, false);
  }

  static SubstituentName compound(String name) {
    return new SubstituentName(name, true);
  }
}
