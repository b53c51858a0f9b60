package com.quantori.cnp.core.configuration;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.util.ArrayList;
import java.util.List;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads {@link NomenclatureTables} from a HOCON resource.
 * <p>
 * Every section that the resource does not define is taken from {@link DefaultNomenclatureTables}, so a missing
 * resource yields the built-in tables.
 */
@Slf4j
@UtilityClass
public class NomenclatureConfiguration {

  public static final String DEFAULT_RESOURCE = "nomenclature";

  private static final String FUNCTIONAL_GROUPS = "nomenclature.functional-groups";
  private static final String HETEROCYCLES = "nomenclature.heterocycles";
  private static final String HYDRIDES = "nomenclature.hydrides";

  public static NomenclatureTables load() {
    return load(DEFAULT_RESOURCE);
  }

  public static NomenclatureTables load(String resource) {
    return fromConfig(ConfigFactory.parseResourcesAnySyntax(resource));
  }

  public static NomenclatureTables fromConfig(Config config) {
    NomenclatureTables.NomenclatureTablesBuilder builder = NomenclatureTables.builder();

    if (config.hasPath(FUNCTIONAL_GROUPS)) {
      builder.functionalGroups(functionalGroups(config.getConfigList(FUNCTIONAL_GROUPS)));
    } else {
      log.info("No functional group table configured, using {} built-in definitions",
          DefaultNomenclatureTables.functionalGroups().size());
      builder.functionalGroups(DefaultNomenclatureTables.functionalGroups());
    }

    if (config.hasPath(HETEROCYCLES)) {
      builder.heterocycles(heterocycles(config.getConfigList(HETEROCYCLES)));
    } else {
      builder.heterocycles(DefaultNomenclatureTables.heterocycles());
    }

    if (config.hasPath(HYDRIDES)) {
      builder.hydrides(hydrides(config.getConfigList(HYDRIDES)));
    } else {
      builder.hydrides(DefaultNomenclatureTables.hydrides());
    }
    return builder.build();
  }

  private static List<FunctionalGroupDefinition> functionalGroups(List<? extends Config> entries) {
    List<FunctionalGroupDefinition> result = new ArrayList<>();
    for (Config entry : entries) {
      String suffix = optional(entry, "suffix");
      result.add(FunctionalGroupDefinition.builder()
          .type(entry.getString("type"))
          .name(entry.hasPath("name") ? entry.getString("name") : entry.getString("type"))
          .pattern(entry.getString("pattern"))
          .coreIndexes(entry.getIntList("core"))
          .prefix(entry.getString("prefix"))
          .suffix(suffix)
          .attachedSuffix(optional(entry, "attached-suffix"))
          .priority(entry.getInt("priority"))
          .principal(entry.hasPath("principal") ? entry.getBoolean("principal") : suffix != null)
          .terminal(entry.hasPath("terminal") && entry.getBoolean("terminal"))
          .nitrogenLocant(entry.hasPath("nitrogen-locant") && entry.getBoolean("nitrogen-locant"))
          .build());
    }
    log.debug("Loaded {} functional group definitions", result.size());
    return result;
  }

  private static List<HeterocycleName> heterocycles(List<? extends Config> entries) {
    List<HeterocycleName> result = new ArrayList<>();
    for (Config entry : entries) {
      result.add(new HeterocycleName(
          entry.getInt("size"),
          entry.hasPath("aromatic") && entry.getBoolean("aromatic"),
          entry.getString("heteroatoms"),
          entry.hasPath("spacing") ? entry.getInt("spacing") : 0,
          entry.getString("name")));
    }
    return result;
  }

  private static List<HydrideName> hydrides(List<? extends Config> entries) {
    List<HydrideName> result = new ArrayList<>();
    for (Config entry : entries) {
      result.add(new HydrideName(
          entry.getString("symbol"),
          entry.getInt("valence"),
          entry.getString("name"),
          entry.getString("substituent")));
    }
    return result;
  }

  private static String optional(Config config, String path) {
    return config.hasPath(path) ? config.getString(path) : null;
  }
}
