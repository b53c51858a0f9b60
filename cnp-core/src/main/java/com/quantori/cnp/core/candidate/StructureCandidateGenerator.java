package com.quantori.cnp.core.candidate;

import com.quantori.cnp.api.model.Molecule;

/**
 * Derives candidate parent chains and ring systems from a molecule graph.
 */
public interface StructureCandidateGenerator {

  StructureCandidates generate(Molecule molecule);
}
