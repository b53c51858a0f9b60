package com.quantori.cnp.core.candidate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.quantori.cnp.api.model.BondOrder;
import com.quantori.cnp.api.model.Molecule;
import com.quantori.cnp.core.TestMolecules;
import com.quantori.cnp.core.model.Chain;
import com.quantori.cnp.core.model.MultipleBond;
import java.util.List;
import org.junit.jupiter.api.Test;

class ChainFinderTest {

  private final ChainFinder chainFinder = new ChainFinder();

  @Test
  void linearChainHasOneCandidate() {
    List<Chain> chains = chainFinder.find(TestMolecules.carbonChain(4));

    assertThat(chains).singleElement()
        .extracting(Chain::getAtomIds)
        .isEqualTo(List.of(0, 1, 2, 3));
  }

  @Test
  void branchedChainGivesOnePathPerPairOfEnds() {
    Molecule isobutane = Molecule.builder()
        .atom("C")
        .atom("C")
        .atom("C")
        .atom("C")
        .bond(0, 1)
        .bond(1, 2)
        .bond(1, 3)
        .build();

    List<Chain> chains = chainFinder.find(isobutane);

    assertThat(chains).extracting(Chain::getAtomIds)
        .containsExactly(List.of(0, 1, 2), List.of(0, 1, 3), List.of(2, 1, 3));
  }

  @Test
  void ringCarbonsAreNotChainAtoms() {
    List<Chain> chains = chainFinder.find(TestMolecules.smiles("C1CCCCC1C"));

    assertThat(chains).singleElement()
        .extracting(Chain::getAtomIds)
        .isEqualTo(List.of(6));
  }

  @Test
  void heteroatomsSplitChains() {
    List<Chain> chains = chainFinder.find(TestMolecules.smiles("CCOCCC"));

    assertThat(chains).extracting(Chain::length).containsExactly(2, 3);
  }

  @Test
  void multipleBondsAreRecorded() {
    Chain chain = chainFinder.find(TestMolecules.smiles("CC=CC#C")).get(0);

    assertEquals(5, chain.length());
    assertThat(chain.getMultipleBonds()).extracting(MultipleBond::getOrder)
        .containsExactly(BondOrder.DOUBLE, BondOrder.TRIPLE);
    assertEquals(1, chain.doubleBondCount());
  }
}
