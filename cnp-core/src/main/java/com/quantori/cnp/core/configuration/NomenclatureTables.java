package com.quantori.cnp.core.configuration;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Static rule data: characteristic groups, heterocycle names and heteroatom hydride names.
 */
@Value
@Builder(toBuilder = true)
public class NomenclatureTables {

  @Singular
  List<FunctionalGroupDefinition> functionalGroups;
  @Singular
  List<HeterocycleName> heterocycles;
  @Singular
  List<HydrideName> hydrides;

  /**
   * Gets the group definitions, most senior first.
   *
   * @return definitions sorted by ascending priority
   */
  public List<FunctionalGroupDefinition> functionalGroupsBySeniority() {
    return functionalGroups.stream()
        .sorted(Comparator.comparingInt(FunctionalGroupDefinition::getPriority))
        .toList();
  }

  public Optional<FunctionalGroupDefinition> functionalGroup(String type) {
    return functionalGroups.stream().filter(definition -> definition.getType().equals(type)).findFirst();
  }

  public Optional<String> heterocycle(int size, boolean aromatic, String heteroatoms, int spacing) {
    return heterocycles.stream()
        .filter(entry -> entry.matches(size, aromatic, heteroatoms, spacing))
        .sorted(Comparator.comparingInt(entry -> entry.getSpacing() == 0 ? 1 : 0))
        .map(HeterocycleName::getName)
        .findFirst();
  }

  public Optional<HydrideName> hydride(String symbol) {
    return hydrides.stream().filter(entry -> entry.getSymbol().equals(symbol)).findFirst();
  }
}
