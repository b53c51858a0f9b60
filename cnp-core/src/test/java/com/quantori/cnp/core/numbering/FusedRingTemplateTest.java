package com.quantori.cnp.core.numbering;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;

import com.quantori.cnp.api.model.Molecule;
import com.quantori.cnp.core.TestMolecules;
import com.quantori.cnp.core.candidate.AromaticityClassifier;
import com.quantori.cnp.core.candidate.RingSystemFinder;
import com.quantori.cnp.core.model.RingSystem;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class FusedRingTemplateTest {

  @ParameterizedTest
  @CsvSource({
      "c1ccc2ccccc2c1, NAPHTHALENE, naphthalene",
      "c1ccc2ncccc2c1, NAPHTHALENE, quinoline",
      "c1ccc2cnccc2c1, NAPHTHALENE, isoquinoline",
      "c1ccc2ncncc2c1, NAPHTHALENE, quinazoline",
      "c1ccc2[nH]ccc2c1, INDENE, 1H-indole",
      "c1ccc2occc2c1, INDENE, 1-benzofuran",
      "c1ccc2scnc2c1, INDENE, '1,3-benzothiazole'",
      "c1ccc2cc3ccccc3cc2c1, ANTHRACENE, anthracene",
      "c1ccc2c(c1)ccc1ccccc12, PHENANTHRENE, phenanthrene"
  })
  void matchesRetainedSystems(String smiles, FusedRingTemplate template, String name) {
    Molecule molecule = TestMolecules.smiles(smiles);
    RingSystem ring = ring(molecule);

    assertThat(FusedRingTemplate.match(ring, molecule).map(FusedRingTemplate.Match::template),
        equalTo(Optional.of(template)));
    assertThat(FusedRingTemplate.nameOf(ring, molecule), equalTo(Optional.of(name)));
  }

  @Test
  void anthraceneFusionAtomsAreNumberedLast() {
    Molecule molecule = TestMolecules.smiles("c1ccc2cc3ccccc3cc2c1");

    FusedRingTemplate.Match match = FusedRingTemplate.match(ring(molecule), molecule).orElseThrow();

    assertThat(match.schemes(), hasSize(4));
    for (NumberingScheme scheme : match.schemes()) {
      assertThat(scheme.labels().values(), containsInAnyOrder("4a", "8a", "9a", "10a"));
      assertThat(scheme.labels().keySet(), everyItem(greaterThan(10)));
      assertThat(scheme.order().subList(10, 14).stream().allMatch(atom -> molecule.degree(atom) == 3), is(true));
    }
  }

  @Test
  void indoleHasOneNumberingPerDirection() {
    Molecule molecule = TestMolecules.smiles("c1ccc2[nH]ccc2c1");

    FusedRingTemplate.Match match = FusedRingTemplate.match(ring(molecule), molecule).orElseThrow();

    assertThat(match.schemes(), hasSize(2));
  }

  @Test
  void unnamedHeteroatomPatternMatchesWithoutName() {
    Molecule molecule = TestMolecules.smiles("c1ccc2nc3ccccc3cc2c1");
    RingSystem ring = ring(molecule);

    assertThat(FusedRingTemplate.match(ring, molecule).isPresent(), is(true));
    assertThat(FusedRingTemplate.nameOf(ring, molecule), equalTo(Optional.empty()));
  }

  @Test
  void saturatedFusedSystemHasNoTemplate() {
    Molecule molecule = TestMolecules.smiles("C1CCC2CCCCC2C1");

    assertThat(FusedRingTemplate.match(ring(molecule), molecule), equalTo(Optional.empty()));
  }

  @Test
  void bridgedSystemHasNoTemplate() {
    Molecule molecule = TestMolecules.smiles("C1CC2CCC1C2");

    assertThat(FusedRingTemplate.match(ring(molecule), molecule), equalTo(Optional.empty()));
  }

  private static RingSystem ring(Molecule molecule) {
    return new RingSystemFinder(new AromaticityClassifier()).find(molecule).get(0);
  }
}
