package com.quantori.cnp.core.numbering;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.quantori.cnp.api.model.Molecule;
import com.quantori.cnp.core.TestMolecules;
import com.quantori.cnp.core.candidate.AromaticityClassifier;
import com.quantori.cnp.core.candidate.RingSystemFinder;
import com.quantori.cnp.core.model.FunctionalGroup;
import com.quantori.cnp.core.model.ParentKind;
import com.quantori.cnp.core.model.ParentStructure;
import com.quantori.cnp.core.model.RingSystem;
import com.quantori.cnp.core.model.Substituent;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class LocantOptimizerTest {

  private final LocantOptimizer optimizer = new LocantOptimizer();

  @Test
  void principalGroupGetsTheLowestLocant() {
    Molecule butanone = TestMolecules.butanone();
    ParentStructure parent = chain(List.of(4, 3, 1, 0)).build();
    FunctionalGroup ketone = FunctionalGroup.builder()
        .type("ketone")
        .suffix("one")
        .atomId(1)
        .atomId(2)
        .locantAtomId(1)
        .principal(true)
        .incorporated(true)
        .build();

    NumberingResult result = optimizer.optimize(parent, List.of(ketone), butanone);

    assertThat(result.parent().getPositions()).containsExactly(0, 1, 3, 4);
    assertThat(result.parent().getLocants()).containsExactly(1, 2, 3, 4);
    assertTrue(result.parent().isNumbered());
    assertThat(result.groups()).singleElement()
        .extracting(FunctionalGroup::getLocants)
        .isEqualTo(List.of(2));
    assertFalse(result.ambiguous());
  }

  @Test
  void substituentsDecideTheDirectionOfAChain() {
    Molecule molecule = TestMolecules.carbonChain(5);
    ParentStructure parent = chain(List.of(0, 1, 2, 3))
        .substituent(substituent("methyl", 2))
        .build();

    NumberingResult result = optimizer.optimize(parent, List.of(), molecule);

    assertThat(result.parent().getPositions()).containsExactly(3, 2, 1, 0);
    assertEquals(2, result.parent().getSubstituents().get(0).getLocant());
  }

  @Test
  void firstCitedPrefixBreaksTies() {
    Molecule molecule = TestMolecules.carbonChain(5);
    ParentStructure parent = chain(List.of(0, 1, 2, 3, 4))
        .substituent(substituent("methyl", 1))
        .substituent(substituent("chloro", 3))
        .build();

    NumberingResult result = optimizer.optimize(parent, List.of(), molecule);

    assertThat(result.parent().getSubstituents())
        .extracting(Substituent::getName, Substituent::getLocant)
        .containsExactly(
            tuple("methyl", 4),
            tuple("chloro", 2));
    assertFalse(result.ambiguous());
  }

  @Test
  void fixedAnchorStaysAtLocantOne() {
    Molecule benzene = TestMolecules.benzene();
    RingSystem ring = new RingSystemFinder(new AromaticityClassifier()).find(benzene).get(0);
    ParentStructure parent = ParentStructure.builder()
        .kind(ParentKind.RING)
        .ring(ring)
        .positions(ring.getAtomIds())
        .locants(IntStream.rangeClosed(1, 6).boxed().toList())
        .fixedAnchorAtomId(3)
        .substituent(substituent("methyl", 5))
        .build();

    NumberingResult result = optimizer.optimize(parent, List.of(), benzene);

    assertEquals(3, result.parent().getPositions().get(0));
    assertEquals(3, result.parent().getSubstituents().get(0).getLocant());
  }

  @Test
  void vectorsCompareTermByTerm() {
    assertThat(LocantOptimizer.compareVectors(List.of(1, 2), List.of(1, 3))).isNegative();
    assertThat(LocantOptimizer.compareVectors(List.of(2, 2), List.of(1, 3))).isPositive();
    assertThat(LocantOptimizer.compareVectors(List.of(1), List.of(1, 2))).isNegative();
    assertEquals(0, LocantOptimizer.compare(List.of(List.of(1), List.of(2)), List.of(List.of(1), List.of(2))));
  }

  private static ParentStructure.ParentStructureBuilder chain(List<Integer> atoms) {
    return ParentStructure.builder()
        .kind(ParentKind.CHAIN)
        .positions(atoms)
        .locants(IntStream.rangeClosed(1, atoms.size()).boxed().toList())
        .substituentsResolved(true);
  }

  private static Substituent substituent(String name, int attachment) {
    return Substituent.builder()
        .name(name)
        .attachmentAtomId(attachment)
        .atomId(100 + attachment)
        .build();
  }
}
