package com.quantori.cnp.core.candidate;

import com.quantori.cnp.core.model.Chain;
import com.quantori.cnp.core.model.RingSystem;
import java.util.List;

/**
 * Parent candidates derived from a molecule graph.
 *
 * @param chains acyclic carbon chains between terminal carbons
 * @param rings  ring systems
 */
public record StructureCandidates(List<Chain> chains, List<RingSystem> rings) {

  public StructureCandidates {
    chains = List.copyOf(chains);
    rings = List.copyOf(rings);
  }
}
