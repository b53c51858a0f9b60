package com.quantori.cnp.core.numbering;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.quantori.cnp.api.model.Molecule;
import com.quantori.cnp.core.TestMolecules;
import com.quantori.cnp.core.candidate.AromaticityClassifier;
import com.quantori.cnp.core.candidate.RingSystemFinder;
import com.quantori.cnp.core.model.ParentKind;
import com.quantori.cnp.core.model.ParentStructure;
import com.quantori.cnp.core.model.RingSystem;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class SchemeGeneratorTest {

  private final SchemeGenerator generator = new SchemeGenerator();

  @Test
  void chainIsNumberedFromEitherEnd() {
    ParentStructure parent = ParentStructure.builder()
        .kind(ParentKind.CHAIN)
        .positions(List.of(0, 1, 2))
        .locants(List.of(1, 2, 3))
        .build();

    List<NumberingScheme> schemes = generator.generate(parent, TestMolecules.carbonChain(3));

    assertThat(schemes).extracting(NumberingScheme::order)
        .containsExactly(List.of(0, 1, 2), List.of(2, 1, 0));
  }

  @Test
  void carbocycleStartsAnywhereInBothDirections() {
    List<NumberingScheme> schemes = generator.generate(ringParent(TestMolecules.carbocycle(5)),
        TestMolecules.carbocycle(5));

    assertEquals(10, schemes.size());
  }

  @Test
  void heterocycleStartsAtTheHeteroatom() {
    Molecule oxolane = TestMolecules.smiles("C1CCOC1");
    int oxygen = 3;

    List<NumberingScheme> schemes = generator.generate(ringParent(oxolane), oxolane);

    assertThat(schemes).hasSize(2).allMatch(scheme -> scheme.order().get(0) == oxygen);
  }

  @Test
  void naphthaleneUsesFusionLabels() {
    Molecule naphthalene = TestMolecules.smiles("c1ccc2ccccc2c1");
    ParentStructure parent = ringParent(naphthalene);

    List<NumberingScheme> schemes = generator.generate(parent, naphthalene);

    assertEquals(4, schemes.size());
    for (NumberingScheme scheme : schemes) {
      assertEquals("4a", scheme.labels().get(9));
      assertEquals("8a", scheme.labels().get(10));
      Set<Integer> fusion = Set.of(scheme.order().get(8), scheme.order().get(9));
      assertThat(fusion).allMatch(atom -> naphthalene.degree(atom) == 3);
    }
  }

  @Test
  void indoleFusionAtomsAreLabelledAfterThePeriphery() {
    Molecule indole = TestMolecules.smiles("c1ccc2[nH]ccc2c1");

    List<NumberingScheme> schemes = generator.generate(ringParent(indole), indole);

    assertEquals(2, schemes.size());
    for (NumberingScheme scheme : schemes) {
      assertEquals("3a", scheme.labels().get(8));
      assertEquals("7a", scheme.labels().get(9));
      assertEquals(9, Set.copyOf(scheme.order()).size());
    }
    assertThat(schemes).anyMatch(scheme -> "N".equals(indole.atom(scheme.order().get(0)).getSymbol()));
  }

  @Test
  void vonBaeyerNumberingStartsAtABridgehead() {
    Molecule norbornane = TestMolecules.smiles("C1CC2CCC1C2");
    List<NumberingScheme> schemes = generator.generate(ringParent(norbornane), norbornane);

    assertThat(schemes).isNotEmpty();
    for (NumberingScheme scheme : schemes) {
      assertEquals(3, norbornane.degree(scheme.order().get(0)));
      assertEquals(3, norbornane.degree(scheme.order().get(3)));
      assertEquals(7, scheme.order().stream().collect(Collectors.toSet()).size());
    }
  }

  private static ParentStructure ringParent(Molecule molecule) {
    RingSystem ring = new RingSystemFinder(new AromaticityClassifier()).find(molecule).get(0);
    return ParentStructure.builder()
        .kind(ParentKind.RING)
        .ring(ring)
        .positions(ring.getAtomIds())
        .locants(IntStream.rangeClosed(1, ring.size()).boxed().toList())
        .build();
  }
}
