package com.quantori.cnp.core.numbering;

import com.quantori.cnp.core.model.FunctionalGroup;
import com.quantori.cnp.core.model.ParentStructure;
import java.util.List;

/**
 * Outcome of a numbering search.
 *
 * @param parent    renumbered parent, positions sorted by locant and substituent locants resolved
 * @param groups    groups with their locants resolved
 * @param ambiguous equally ranked numberings place the substituents differently
 */
public record NumberingResult(ParentStructure parent, List<FunctionalGroup> groups, boolean ambiguous) {

  public NumberingResult {
    groups = List.copyOf(groups);
  }
}
