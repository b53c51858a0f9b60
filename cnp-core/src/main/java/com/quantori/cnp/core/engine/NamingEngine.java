package com.quantori.cnp.core.engine;

import com.quantori.cnp.api.InvalidMoleculeException;
import com.quantori.cnp.api.indigo.IndigoPatternMatcher;
import com.quantori.cnp.api.indigo.IndigoProvider;
import com.quantori.cnp.api.model.Conflict;
import com.quantori.cnp.api.model.ConflictType;
import com.quantori.cnp.api.model.Molecule;
import com.quantori.cnp.api.model.NamingResult;
import com.quantori.cnp.api.service.MoleculeNamer;
import com.quantori.cnp.core.candidate.DefaultStructureCandidateGenerator;
import com.quantori.cnp.core.candidate.StructureCandidateGenerator;
import com.quantori.cnp.core.candidate.StructureCandidates;
import com.quantori.cnp.core.configuration.NomenclatureConfiguration;
import com.quantori.cnp.core.configuration.NomenclatureTables;
import com.quantori.cnp.core.detection.FunctionalGroupDetector;
import com.quantori.cnp.core.detection.PatternFunctionalGroupDetector;
import com.quantori.cnp.core.model.FunctionalGroup;
import com.quantori.cnp.core.model.NamingState;
import com.quantori.cnp.core.rules.RuleCatalogue;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Names molecules by running the PARENT_STRUCTURE, NUMBERING and ASSEMBLY phases over an immutable
 * {@link NamingState}.
 * <p>
 * The engine holds no mutable state, one instance can name molecules from several threads.
 */
@Slf4j
public class NamingEngine implements MoleculeNamer {

  private static final int DEFAULT_INDIGO_POOL_SIZE = Runtime.getRuntime().availableProcessors();
  private static final int DEFAULT_INDIGO_TIMEOUT_SECONDS = 5;

  static final String CANDIDATE_GENERATION = "candidate-generation";
  static final String FUNCTIONAL_GROUP_DETECTION = "functional-group-detection";

  private final StructureCandidateGenerator candidateGenerator;
  private final FunctionalGroupDetector functionalGroupDetector;
  private final List<PhaseController> controllers;

  public NamingEngine(StructureCandidateGenerator candidateGenerator, FunctionalGroupDetector functionalGroupDetector,
                      RuleCatalogue ruleCatalogue, NamingTracer tracer) {
    this(candidateGenerator, functionalGroupDetector, ruleCatalogue.controllers(tracer));
  }

  public NamingEngine(StructureCandidateGenerator candidateGenerator, FunctionalGroupDetector functionalGroupDetector,
                      List<PhaseController> controllers) {
    this.candidateGenerator = candidateGenerator;
    this.functionalGroupDetector = functionalGroupDetector;
    this.controllers = List.copyOf(controllers);
  }

  /**
   * Creates an engine with the configured rule tables, Indigo SMARTS matching and SLF4J tracing.
   *
   * @return naming engine
   */
  public static NamingEngine createDefault() {
    return create(NomenclatureConfiguration.load());
  }

  public static NamingEngine create(NomenclatureTables tables) {
    return create(tables, new IndigoProvider(DEFAULT_INDIGO_POOL_SIZE, DEFAULT_INDIGO_TIMEOUT_SECONDS));
  }

  public static NamingEngine create(NomenclatureTables tables, IndigoProvider indigoProvider) {
    return new NamingEngine(
        new DefaultStructureCandidateGenerator(),
        new PatternFunctionalGroupDetector(new IndigoPatternMatcher(indigoProvider), tables),
        RuleCatalogue.create(tables),
        NamingTracer.slf4j(NamingEngine.class));
  }

  @Override
  public NamingResult run(Molecule molecule) {
    NamingState state = execute(molecule);
    return NamingResult.builder()
        .name(state.getFinalName() == null ? "" : state.getFinalName())
        .confidence(state.getConfidence())
        .conflicts(state.getConflicts())
        .auditLog(state.getHistory())
        .build();
  }

  /**
   * Runs all phases and returns the final state, including the parent structure and the resolved groups.
   *
   * @param molecule molecule graph
   * @return state after the ASSEMBLY phase
   */
  public NamingState execute(Molecule molecule) {
    if (molecule == null) {
      throw new InvalidMoleculeException("Molecule is required");
    }
    List<Conflict> conflicts = new ArrayList<>();
    StructureCandidates candidates;
    try {
      candidates = candidateGenerator.generate(molecule);
    } catch (RuntimeException e) {
      log.warn("Candidate generation failed for molecule of {} atoms", molecule.size(), e);
      conflicts.add(Conflict.of(ConflictType.STRUCTURE_NOT_FOUND, CANDIDATE_GENERATION,
          "Cannot enumerate parent candidates: " + e.getMessage()));
      candidates = new StructureCandidates(List.of(), List.of());
    }
    List<FunctionalGroup> groups;
    try {
      groups = functionalGroupDetector.detect(molecule);
    } catch (RuntimeException e) {
      log.warn("Functional group detection failed for molecule of {} atoms", molecule.size(), e);
      conflicts.add(Conflict.of(ConflictType.RULE_CONFLICT, FUNCTIONAL_GROUP_DETECTION,
          "Cannot detect functional groups: " + e.getMessage()));
      groups = List.of();
    }
    NamingState state = NamingState.builder()
        .molecule(molecule)
        .candidateChains(candidates.chains())
        .candidateRings(candidates.rings())
        .ringSystems(candidates.rings())
        .functionalGroups(groups)
        .build();
    for (Conflict conflict : conflicts) {
      state = state.withConflict(conflict);
    }
    log.debug("Naming molecule of {} atoms: {} candidate chains, {} ring systems, {} functional groups",
        molecule.size(), candidates.chains().size(), candidates.rings().size(), state.getFunctionalGroups().size());

    for (PhaseController controller : controllers) {
      state = controller.execute(state);
    }
    log.debug("Named molecule as '{}' with confidence {}", state.getFinalName(), state.getConfidence());
    return state;
  }
}
