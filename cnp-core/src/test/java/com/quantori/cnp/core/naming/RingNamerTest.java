package com.quantori.cnp.core.naming;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.quantori.cnp.api.model.Molecule;
import com.quantori.cnp.core.TestMolecules;
import com.quantori.cnp.core.candidate.AromaticityClassifier;
import com.quantori.cnp.core.candidate.RingSystemFinder;
import com.quantori.cnp.core.configuration.NomenclatureConfiguration;
import com.quantori.cnp.core.model.ParentKind;
import com.quantori.cnp.core.model.ParentStructure;
import com.quantori.cnp.core.model.RingSystem;
import com.quantori.cnp.core.numbering.LocantOptimizer;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class RingNamerTest {

  private final RingNamer ringNamer = new RingNamer(NomenclatureConfiguration.load());
  private final LocantOptimizer locantOptimizer = new LocantOptimizer();

  @ParameterizedTest
  @CsvSource({
      "C1CCCCC1, cyclohexane",
      "c1ccccc1, benzene",
      "c1ccncc1, pyridine",
      "C1CCOC1, oxolane",
      "C1CC2CCC1C2, 'bicyclo[2.2.1]heptane'",
      "C1CC2CCC1O2, '7-oxabicyclo[2.2.1]heptane'",
      "C1CCC2(CC1)CCCC2, 'spiro[4.5]decane'",
      "c1ccc2ccccc2c1, naphthalene",
      "c1ccc2ncccc2c1, quinoline",
      "c1ccc2cnccc2c1, isoquinoline",
      "c1ccc2nccnc2c1, quinoxaline",
      "c1ccc2[nH]ccc2c1, 1H-indole",
      "c1ccc2occc2c1, 1-benzofuran",
      "c1ccc2sccc2c1, 1-benzothiophene",
      "c1ccc2[nH]cnc2c1, 1H-benzimidazole",
      "c1ccc2ocnc2c1, '1,3-benzoxazole'",
      "c1ccc2cc3ccccc3cc2c1, anthracene",
      "c1ccc2c(c1)ccc1ccccc12, phenanthrene"
  })
  void namesRing(String smiles, String expected) {
    Molecule molecule = TestMolecules.smiles(smiles);

    assertEquals(expected, ringNamer.name(numbered(molecule), molecule, true));
  }

  @Test
  void fusedHeterocycleWithoutRetainedNameUsesReplacementPrefixes() {
    Molecule molecule = TestMolecules.smiles("c1ccc2nncnc2c1");

    assertThat(ringNamer.name(numbered(molecule), molecule, true)).contains("triazabicyclo[4.4.0]dec");
  }

  @Test
  void spacingIsTheShortestRingDistance() {
    Molecule molecule = TestMolecules.smiles("C1COCCO1");
    RingSystem ring = new RingSystemFinder(new AromaticityClassifier()).find(molecule).get(0);

    assertEquals(3, RingNamer.spacing(ring, ring.heteroatoms(molecule)));
  }

  private ParentStructure numbered(Molecule molecule) {
    RingSystem ring = new RingSystemFinder(new AromaticityClassifier()).find(molecule).get(0);
    ParentStructure parent = ParentStructure.builder()
        .kind(ParentKind.RING)
        .ring(ring)
        .positions(ring.getAtomIds())
        .locants(IntStream.rangeClosed(1, ring.size()).boxed().toList())
        .multipleBonds(ring.getMultipleBonds())
        .build();
    return locantOptimizer.optimize(parent, List.of(), molecule).parent();
  }
}
