package com.quantori.cnp.core.candidate;

import com.quantori.cnp.api.model.Molecule;

public class DefaultStructureCandidateGenerator implements StructureCandidateGenerator {

  private final ChainFinder chainFinder;
  private final RingSystemFinder ringSystemFinder;

  public DefaultStructureCandidateGenerator() {
    this(new ChainFinder(), new RingSystemFinder(new AromaticityClassifier()));
  }

  public DefaultStructureCandidateGenerator(ChainFinder chainFinder, RingSystemFinder ringSystemFinder) {
    this.chainFinder = chainFinder;
    this.ringSystemFinder = ringSystemFinder;
  }

  @Override
  public StructureCandidates generate(Molecule molecule) {
    return new StructureCandidates(chainFinder.find(molecule), ringSystemFinder.find(molecule));
  }
}
