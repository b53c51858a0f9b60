package com.quantori.cnp.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.quantori.cnp.api.InvalidMoleculeException;
import com.quantori.cnp.api.model.Conflict;
import com.quantori.cnp.api.model.ConflictType;
import com.quantori.cnp.api.model.Molecule;
import com.quantori.cnp.api.model.NamingPhase;
import com.quantori.cnp.api.model.NamingResult;
import com.quantori.cnp.api.model.RuleApplication;
import com.quantori.cnp.core.TestMolecules;
import com.quantori.cnp.core.candidate.DefaultStructureCandidateGenerator;
import com.quantori.cnp.core.candidate.StructureCandidateGenerator;
import com.quantori.cnp.core.configuration.NomenclatureConfiguration;
import com.quantori.cnp.core.detection.FunctionalGroupDetector;
import com.quantori.cnp.core.detection.PatternFunctionalGroupDetector;
import com.quantori.cnp.core.model.NamingState;
import com.quantori.cnp.core.model.NomenclatureMode;
import com.quantori.cnp.core.model.ParentStructure;
import com.quantori.cnp.core.naming.NameAssembler;
import com.quantori.cnp.core.rules.RuleCatalogue;
import java.util.List;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

class NamingEngineTest {

  private static final NamingEngine engine = NamingEngine.createDefault();

  static Stream<Arguments> names() {
    return Stream.of(
        Arguments.of("CCO", "ethanol"),
        Arguments.of("CC(=O)O", "acetic acid"),
        Arguments.of("CC(=O)CC", "butan-2-one"),
        Arguments.of("C1CCCCC1", "cyclohexane"),
        Arguments.of("c1ccccc1", "benzene"),
        Arguments.of("C1CCCCC1C", "methylcyclohexane"),
        Arguments.of("C1CCC(C)C1C", "1,2-dimethylcyclopentane"),
        Arguments.of("CCC", "propane"),
        Arguments.of("CC(O)C", "propan-2-ol"),
        Arguments.of("CC(C)C", "2-methylpropane"),
        Arguments.of("C=C", "ethene"),
        Arguments.of("CC=CC", "but-2-ene"),
        Arguments.of("C=CC=C", "buta-1,3-diene"),
        Arguments.of("CCCl", "chloroethane"),
        Arguments.of("ClCCCl", "1,2-dichloroethane"),
        Arguments.of("OCCO", "ethane-1,2-diol"),
        Arguments.of("CC(=O)OC", "methyl acetate"),
        Arguments.of("Oc1ccccc1", "phenol"),
        Arguments.of("C1CCOC1", "oxolane"),
        Arguments.of("C[SiH3]", "methylsilane"),
        Arguments.of("CCCC(=O)O", "butanoic acid"),
        Arguments.of("CC=O", "ethanal"),
        Arguments.of("CCN", "ethanamine"),
        Arguments.of("CC#N", "ethanenitrile"),
        Arguments.of("CC(=O)OCC", "ethyl acetate"),
        Arguments.of("OC(=O)c1ccccc1", "benzoic acid"),
        Arguments.of("Cc1ccccc1", "methylbenzene"),
        Arguments.of("Cc1ccc(C)cc1", "1,4-dimethylbenzene"),
        Arguments.of("CCN(C)C", "N,N-dimethylethanamine"),
        Arguments.of("CC(=O)NC", "N-methylethanamide"),
        Arguments.of("OCC1CCCCC1", "cyclohexylmethanol"),
        Arguments.of("c1ccncc1", "pyridine"),
        Arguments.of("Cc1ccncc1", "4-methylpyridine"),
        Arguments.of("O=C1CCCO1", "oxolan-2-one"),
        Arguments.of("CC(=O)c1ccccc1", "1-phenylethan-1-one"),
        Arguments.of("CCC(=O)c1ccccc1", "1-phenylpropan-1-one"),
        Arguments.of("CC(=O)OC1CCCCC1", "cyclohexyl acetate"),
        Arguments.of("CC(=O)C1CCCCC1", "1-cyclohexylethan-1-one"),
        Arguments.of("CC(C)OC(C)C", "2-(1-methylethoxy)propane"),
        Arguments.of("C1CC2CCC1C2", "bicyclo[2.2.1]heptane"),
        Arguments.of("C1CCC2(CC1)CCCC2", "spiro[4.5]decane"),
        Arguments.of("c1ccc2ccccc2c1", "naphthalene"),
        Arguments.of("c1ccc2ncccc2c1", "quinoline"),
        Arguments.of("c1ccc2[nH]ccc2c1", "1H-indole"),
        Arguments.of("c1ccc2cc3ccccc3cc2c1", "anthracene"),
        Arguments.of("c1ccc2c(c1)ccc1ccccc12", "phenanthrene")
    );
  }

  @ParameterizedTest
  @MethodSource("names")
  void namesMolecule(String smiles, String expected) {
    NamingResult result = engine.run(TestMolecules.smiles(smiles));

    assertEquals(expected, result.getName());
    assertThat(result.getConflicts()).isEmpty();
    assertEquals(1.0, result.getConfidence(), 1e-9);
  }

  @ParameterizedTest
  @ValueSource(strings = {"CC(=O)CC", "Cc1ccc(C)cc1", "CC(=O)OCC", "CCN(C)C", "Cc1ccncc1", "c1ccc2ccccc2c1"})
  void assemblingTheFinalStateAgainGivesTheSameName(String smiles) {
    NamingState state = engine.execute(TestMolecules.smiles(smiles));
    NameAssembler assembler = new NameAssembler();

    String again = assembler.assemble(state.getParent(), state.getFunctionalGroups(), state.getMode());

    assertEquals(state.getFinalName(), again);
    assertEquals(again, assembler.assemble(state.getParent(), state.getFunctionalGroups(), state.getMode()));
  }

  @ParameterizedTest
  @ValueSource(strings = {"CC1CCCC(O)C1", "Cc1ccncc1", "C1CC2CCC1C2", "C1CCC2(CC1)CCCC2", "Cc1cccc2ccccc12",
      "c1ccc2cc3ccccc3cc2c1"})
  void ringLocantsArePermutationsOfTheRingPositions(String smiles) {
    ParentStructure parent = engine.execute(TestMolecules.smiles(smiles)).getParent();

    assertThat(parent.getLocants())
        .hasSize(parent.size())
        .containsExactlyInAnyOrderElementsOf(IntStream.rangeClosed(1, parent.size()).boxed().toList());
    assertThat(parent.getPositions()).doesNotHaveDuplicates();
  }

  @Test
  void carbonSkeletonWithoutSupportedParentIsNotNamedAsMethane() {
    NamingResult result = engine.run(TestMolecules.smiles("C1C2CC3CC1CC(C2)C3"));

    assertEquals("", result.getName());
    assertThat(result.hasConflict(ConflictType.STRUCTURE_NOT_FOUND)).isTrue();
    assertThat(result.getConfidence()).isCloseTo(0.4, within(1e-9));
  }

  @Test
  void aromaticFusedSystemWithoutRetainedNameLowersConfidence() {
    NamingResult result = engine.run(TestMolecules.smiles("c1ccc2nncnc2c1"));

    assertThat(result.getName()).isNotEmpty();
    assertThat(result.hasConflict(ConflictType.RULE_CONFLICT)).isTrue();
    assertThat(result.getConfidence()).isCloseTo(0.9, within(1e-9));
  }

  @Test
  void failingDetectorIsRecordedAsConflict() {
    FunctionalGroupDetector detector = mock(FunctionalGroupDetector.class);
    when(detector.detect(any(Molecule.class))).thenThrow(new IllegalStateException("pattern failed"));
    NamingEngine failing = new NamingEngine(new DefaultStructureCandidateGenerator(), detector,
        RuleCatalogue.create(NomenclatureConfiguration.load()), NamingTracer.silent());

    NamingResult result = failing.run(TestMolecules.smiles("CCC"));

    assertEquals("propane", result.getName());
    assertThat(result.getConflicts()).extracting(Conflict::getType, Conflict::getRuleId)
        .containsExactly(tuple(ConflictType.RULE_CONFLICT, NamingEngine.FUNCTIONAL_GROUP_DETECTION));
    assertThat(result.getConfidence()).isCloseTo(0.9, within(1e-9));
  }

  @Test
  void failingCandidateGeneratorIsRecordedAsConflict() {
    StructureCandidateGenerator generator = mock(StructureCandidateGenerator.class);
    when(generator.generate(any(Molecule.class))).thenThrow(new IllegalStateException("ring perception failed"));
    NamingEngine failing = new NamingEngine(generator,
        new PatternFunctionalGroupDetector(TestMolecules.patternMatcher(), NomenclatureConfiguration.load()),
        RuleCatalogue.create(NomenclatureConfiguration.load()), NamingTracer.silent());

    NamingResult result = failing.run(TestMolecules.smiles("CCO"));

    assertThat(result.getConflicts()).extracting(Conflict::getRuleId)
        .contains(NamingEngine.CANDIDATE_GENERATION);
    assertThat(result.hasConflict(ConflictType.STRUCTURE_NOT_FOUND)).isTrue();
    assertThat(result.getConfidence()).isLessThan(1.0);
  }

  @Test
  void repeatedRunsGiveIdenticalResults() {
    Molecule molecule = TestMolecules.smiles("C1CCC(C)C1C");

    NamingResult first = engine.run(molecule);
    NamingResult second = engine.run(molecule);

    assertEquals(first, second);
  }

  @Test
  void auditLogRecordsRulesOfEveryPhaseInOrder() {
    NamingResult result = engine.run(TestMolecules.smiles("CC(=O)CC"));

    List<RuleApplication> auditLog = result.getAuditLog();
    assertThat(auditLog).extracting(RuleApplication::ordinal)
        .containsExactlyElementsOf(IntStream.rangeClosed(1, auditLog.size()).boxed().toList());
    assertThat(auditLog).extracting(RuleApplication::phase)
        .contains(NamingPhase.PARENT_STRUCTURE, NamingPhase.NUMBERING, NamingPhase.ASSEMBLY)
        .isSortedAccordingTo(NamingPhase::compareTo);
    assertThat(auditLog).extracting(RuleApplication::ruleId)
        .contains("principal-characteristic-group", "chain-parent", "lowest-locants", "assemble-name");
  }

  @Test
  void executeExposesTheFinalState() {
    NamingState state = engine.execute(TestMolecules.smiles("CC(=O)OC"));

    assertEquals(NomenclatureMode.FUNCTIONAL_CLASS, state.getMode());
    assertEquals("ester", state.getPrincipalType());
    assertEquals(NamingPhase.ASSEMBLY, state.getPhase());
    assertEquals("methyl acetate", state.getParent().getAssembledName());
    assertThat(state.getParent().isNumbered()).isTrue();
  }

  @Test
  void moleculeWithoutSkeletonGetsHydrideName() {
    NamingResult result = engine.run(TestMolecules.smiles("O"));

    assertEquals("oxidane", result.getName());
    assertThat(result.hasConflict(ConflictType.STRUCTURE_NOT_FOUND)).isTrue();
    assertThat(result.getConfidence()).isCloseTo(0.7, within(1e-9));
  }

  @Test
  void disconnectedFragmentsAreReported() {
    NamingResult result = engine.run(TestMolecules.smiles("CCO.C"));

    assertEquals("ethanol", result.getName());
    assertThat(result.hasConflict(ConflictType.RULE_CONFLICT)).isTrue();
    assertThat(result.getConfidence()).isCloseTo(0.9, within(1e-9));
  }

  @Test
  void emptyMoleculeGivesDegradedResult() {
    NamingResult result = engine.run(Molecule.builder().build());

    assertEquals("", result.getName());
    assertThat(result.hasConflict(ConflictType.RULE_CONFLICT)).isTrue();
    assertThat(result.hasConflict(ConflictType.VALIDATION_FAILURE)).isTrue();
    assertThat(result.getConfidence()).isCloseTo(0.4, within(1e-9));
  }

  @Test
  void nullMoleculeIsRejected() {
    assertThrows(InvalidMoleculeException.class, () -> engine.run(null));
  }
}
