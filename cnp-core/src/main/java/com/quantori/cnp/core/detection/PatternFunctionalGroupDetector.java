package com.quantori.cnp.core.detection;

import com.quantori.cnp.api.model.Molecule;
import com.quantori.cnp.api.service.PatternMatcher;
import com.quantori.cnp.core.configuration.DefaultNomenclatureTables;
import com.quantori.cnp.core.configuration.FunctionalGroupDefinition;
import com.quantori.cnp.core.configuration.NomenclatureTables;
import com.quantori.cnp.core.model.FunctionalGroup;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Detects characteristic groups by matching the patterns of the group catalogue.
 * <p>
 * Overlapping matches are resolved by seniority: groups are visited by ascending priority and a match is kept only
 * when none of its core atoms belongs to a group kept before. Esters and amides closed into a ring are reported as
 * ring ketones (lactones, lactams), other matches whose core holds a ring heteroatom are part of the skeleton and
 * skipped.
 */
@Slf4j
public class PatternFunctionalGroupDetector implements FunctionalGroupDetector {

  private final PatternMatcher patternMatcher;
  private final NomenclatureTables tables;

  public PatternFunctionalGroupDetector(PatternMatcher patternMatcher, NomenclatureTables tables) {
    this.patternMatcher = patternMatcher;
    this.tables = tables;
  }

  @Override
  public List<FunctionalGroup> detect(Molecule molecule) {
    List<FunctionalGroup> candidates = new ArrayList<>();
    for (FunctionalGroupDefinition definition : tables.functionalGroupsBySeniority()) {
      Set<Set<Integer>> seen = new HashSet<>();
      for (List<Integer> match : patternMatcher.match(definition.getPattern(), molecule)) {
        List<Integer> core = core(definition, match);
        if (core.isEmpty() || !seen.add(new HashSet<>(core))) {
          continue;
        }
        toGroup(definition, core, molecule).ifPresent(candidates::add);
      }
    }
    candidates.sort(Comparator.comparingInt(FunctionalGroup::getPriority));

    List<FunctionalGroup> accepted = new ArrayList<>();
    for (FunctionalGroup candidate : candidates) {
      if (accepted.stream().noneMatch(candidate::overlaps)) {
        accepted.add(candidate);
      }
    }
    log.debug("Detected {} functional groups out of {} matches", accepted.size(), candidates.size());
    return accepted;
  }

  private static List<Integer> core(FunctionalGroupDefinition definition, List<Integer> match) {
    List<Integer> core = new ArrayList<>();
    for (int index : definition.getCoreIndexes()) {
      if (index < match.size()) {
        core.add(match.get(index));
      }
    }
    return core;
  }

  private Optional<FunctionalGroup> toGroup(FunctionalGroupDefinition definition, List<Integer> core,
                                            Molecule molecule) {
    boolean ringHeteroatom = core.stream()
        .map(molecule::atom)
        .anyMatch(atom -> !atom.isCarbon() && atom.isInRing());
    if (!ringHeteroatom) {
      return Optional.of(fromDefinition(definition, core));
    }

    String type = definition.getType();
    boolean closedCarbonyl = (DefaultNomenclatureTables.ESTER.equals(type)
        || DefaultNomenclatureTables.AMIDE.equals(type))
        && core.size() >= 2
        && molecule.atom(core.get(0)).isInRing();
    if (!closedCarbonyl) {
      return Optional.empty();
    }
    return tables.functionalGroup(DefaultNomenclatureTables.KETONE)
        .map(ketone -> fromDefinition(ketone, List.of(core.get(0), core.get(1))));
  }

  private static FunctionalGroup fromDefinition(FunctionalGroupDefinition definition, List<Integer> core) {
    return FunctionalGroup.builder()
        .type(definition.getType())
        .prefix(definition.getPrefix())
        .suffix(definition.getSuffix())
        .attachedSuffix(definition.getAttachedSuffix())
        .priority(definition.getPriority())
        .atomIds(core)
        .canBePrincipal(definition.isPrincipal())
        .terminal(definition.isTerminal())
        .nitrogenLocant(definition.isNitrogenLocant())
        .build();
  }
}
