package com.quantori.cnp.core.detection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.quantori.cnp.api.model.Molecule;
import com.quantori.cnp.api.service.PatternMatcher;
import com.quantori.cnp.core.TestMolecules;
import com.quantori.cnp.core.configuration.DefaultNomenclatureTables;
import com.quantori.cnp.core.configuration.NomenclatureConfiguration;
import com.quantori.cnp.core.configuration.NomenclatureTables;
import com.quantori.cnp.core.model.FunctionalGroup;
import java.util.List;
import org.junit.jupiter.api.Test;

class PatternFunctionalGroupDetectorTest {

  private static final NomenclatureTables tables = NomenclatureConfiguration.load();

  private final PatternFunctionalGroupDetector detector =
      new PatternFunctionalGroupDetector(TestMolecules.patternMatcher(), tables);

  @Test
  void detectsAlcohol() {
    List<FunctionalGroup> groups = detector.detect(TestMolecules.ethanol());

    assertThat(groups).singleElement().satisfies(group -> {
      assertEquals(DefaultNomenclatureTables.ALCOHOL, group.getType());
      assertEquals(List.of(2), group.getAtomIds());
      assertEquals("hydroxy", group.getPrefix());
      assertEquals("ol", group.getSuffix());
      assertTrue(group.isCanBePrincipal());
      assertFalse(group.isPrincipal());
    });
  }

  @Test
  void acidHidesItsHydroxy() {
    List<FunctionalGroup> groups = detector.detect(TestMolecules.smiles("CC(=O)O"));

    assertThat(groups).extracting(FunctionalGroup::getType).containsExactly(DefaultNomenclatureTables.CARBOXYLIC_ACID);
    assertThat(groups.get(0).getAtomIds()).containsExactly(1, 2, 3);
  }

  @Test
  void esterHidesItsEtherOxygen() {
    List<FunctionalGroup> groups = detector.detect(TestMolecules.smiles("CC(=O)OC"));

    assertThat(groups).extracting(FunctionalGroup::getType).containsExactly(DefaultNomenclatureTables.ESTER);
  }

  @Test
  void ketoneIsReportedOnce() {
    List<FunctionalGroup> groups = detector.detect(TestMolecules.butanone());

    assertThat(groups).singleElement().satisfies(group -> {
      assertEquals(DefaultNomenclatureTables.KETONE, group.getType());
      assertThat(group.getAtomIds()).containsExactly(1, 2);
    });
  }

  @Test
  void ringEtherIsPartOfTheSkeleton() {
    assertThat(detector.detect(TestMolecules.smiles("C1CCOC1"))).isEmpty();
  }

  @Test
  void lactoneBecomesRingKetone() {
    List<FunctionalGroup> groups = detector.detect(TestMolecules.smiles("O=C1CCCO1"));

    assertThat(groups).singleElement().satisfies(group -> {
      assertEquals(DefaultNomenclatureTables.KETONE, group.getType());
      assertThat(group.getAtomIds()).containsExactly(1, 0);
    });
  }

  @Test
  void halogensAreNeverPrincipal() {
    List<FunctionalGroup> groups = detector.detect(TestMolecules.smiles("CCCl"));

    assertThat(groups).singleElement().satisfies(group -> {
      assertEquals("chloro", group.getPrefix());
      assertFalse(group.isCanBePrincipal());
    });
  }

  @Test
  void overlappingMatchesKeepTheSeniorGroup() {
    PatternMatcher patternMatcher = mock(PatternMatcher.class);
    when(patternMatcher.match(anyString(), any(Molecule.class))).thenReturn(List.of());
    when(patternMatcher.match(eq("[CX3](=O)[NX3]"), any(Molecule.class))).thenReturn(List.of(List.of(1, 2, 3)));
    when(patternMatcher.match(eq("[#6][NX3]"), any(Molecule.class))).thenReturn(List.of(List.of(1, 3)));

    List<FunctionalGroup> groups = new PatternFunctionalGroupDetector(patternMatcher, tables)
        .detect(TestMolecules.smiles("CC(=O)N"));

    assertThat(groups).extracting(FunctionalGroup::getType).containsExactly(DefaultNomenclatureTables.AMIDE);
  }

  @Test
  void configuredPatternsAreMatchedAsWritten() {
    NomenclatureTables respelled = tables.toBuilder()
        .clearFunctionalGroups()
        .functionalGroups(tables.getFunctionalGroups().stream()
            .map(definition -> DefaultNomenclatureTables.ALCOHOL.equals(definition.getType())
                ? definition.toBuilder().pattern("[OX2H][#6]").coreIndexes(List.of(0)).build()
                : definition)
            .toList())
        .build();

    List<FunctionalGroup> groups = new PatternFunctionalGroupDetector(TestMolecules.patternMatcher(), respelled)
        .detect(TestMolecules.ethanol());

    assertThat(groups).singleElement().satisfies(group -> {
      assertEquals(DefaultNomenclatureTables.ALCOHOL, group.getType());
      assertEquals(List.of(2), group.getAtomIds());
    });
  }
}
