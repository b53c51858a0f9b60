package com.quantori.cnp.core.model;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * One branch attached to the parent structure, cited as a prefix.
 */
@Value
@Builder(toBuilder = true)
public class Substituent {
  String name;
  /**
   * Parent atom the branch is attached to
   */
  int attachmentAtomId;
  /**
   * Atoms of the branch itself
   */
  @Singular
  List<Integer> atomIds;
  /**
   * Resolved locant, 0 until numbering
   */
  int locant;
  /**
   * Letter locant for branches on a heteroatom of the principal group, i.e. "N"
   */
  String heteroLocant;
  /**
   * Compound prefixes are enclosed in parentheses and multiplied by bis, tris, ...
   */
  boolean compound;

  public boolean isNested() {
    return name.indexOf('(') >= 0 || name.indexOf('[') >= 0;
  }

  public String locantLabel() {
    return heteroLocant != null ? heteroLocant : String.valueOf(locant);
  }
}
