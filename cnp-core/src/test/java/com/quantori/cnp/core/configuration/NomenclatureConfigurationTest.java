package com.quantori.cnp.core.configuration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class NomenclatureConfigurationTest {

  @Test
  void loadsBundledTables() {
    NomenclatureTables tables = NomenclatureConfiguration.load();

    assertEquals(14, tables.getFunctionalGroups().size());
    assertEquals(Optional.of("pyridine"), tables.heterocycle(6, true, "N", 0));
    assertEquals(Optional.of("morpholine"), tables.heterocycle(6, false, "NO", 3));
    assertEquals(Optional.of("silane"), tables.hydride("Si").map(HydrideName::getName));
  }

  @Test
  void groupsAreOrderedBySeniority() {
    List<String> types = NomenclatureConfiguration.load().functionalGroupsBySeniority().stream()
        .map(FunctionalGroupDefinition::getType)
        .limit(3)
        .toList();

    assertThat(types).containsExactly(DefaultNomenclatureTables.CARBOXYLIC_ACID, DefaultNomenclatureTables.ESTER,
        DefaultNomenclatureTables.AMIDE);
  }

  @Test
  void principalFlagDefaultsToHavingASuffix() {
    NomenclatureTables tables = NomenclatureConfiguration.load();

    assertTrue(tables.functionalGroup(DefaultNomenclatureTables.ALCOHOL).orElseThrow().isPrincipal());
    assertFalse(tables.functionalGroup(DefaultNomenclatureTables.ETHER).orElseThrow().isPrincipal());
    assertFalse(tables.functionalGroup("chloride").orElseThrow().isPrincipal());
    assertThat(tables.functionalGroup(DefaultNomenclatureTables.AMINE).orElseThrow().isNitrogenLocant()).isTrue();
  }

  @Test
  void spacingSelectsBetweenIsomericHeterocycles() {
    NomenclatureTables tables = NomenclatureConfiguration.load();

    assertEquals(Optional.of("pyrimidine"), tables.heterocycle(6, true, "NN", 2));
    assertEquals(Optional.of("pyrazine"), tables.heterocycle(6, true, "NN", 3));
    assertEquals(Optional.empty(), tables.heterocycle(9, false, "O", 0));
  }

  @Test
  void overridesAreLayeredOverTheDefaults() {
    Config override = ConfigFactory.parseMap(Map.of(
        "nomenclature.heterocycles", List.of(Map.of("size", 6, "heteroatoms", "N", "name", "azinane"))));

    NomenclatureTables tables = NomenclatureConfiguration.fromConfig(override);

    assertEquals(Optional.of("azinane"), tables.heterocycle(6, false, "N", 0));
    assertThat(tables.getHeterocycles()).hasSize(1);
    assertEquals(DefaultNomenclatureTables.functionalGroups(), tables.getFunctionalGroups());
    assertEquals(DefaultNomenclatureTables.hydrides(), tables.getHydrides());
  }

  @Test
  void missingResourceFallsBackToBuiltInTables() {
    NomenclatureTables tables = NomenclatureConfiguration.load("no-such-resource");

    assertThat(tables.getFunctionalGroups()).hasSize(9);
    assertThat(tables.heterocycle(5, true, "S", 0)).contains("thiophene");
  }
}
