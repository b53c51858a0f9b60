package com.quantori.cnp.core.rules;

import static com.quantori.cnp.core.configuration.DefaultNomenclatureTables.ESTER;

import com.quantori.cnp.api.model.Atom;
import com.quantori.cnp.api.model.Bond;
import com.quantori.cnp.api.model.Conflict;
import com.quantori.cnp.api.model.ConflictType;
import com.quantori.cnp.api.model.Molecule;
import com.quantori.cnp.api.model.NamingPhase;
import com.quantori.cnp.core.configuration.HydrideName;
import com.quantori.cnp.core.configuration.NomenclatureTables;
import com.quantori.cnp.core.engine.NamingRule;
import com.quantori.cnp.core.model.Chain;
import com.quantori.cnp.core.model.FunctionalGroup;
import com.quantori.cnp.core.model.NamingState;
import com.quantori.cnp.core.model.NomenclatureMode;
import com.quantori.cnp.core.model.ParentKind;
import com.quantori.cnp.core.model.ParentStructure;
import com.quantori.cnp.core.model.RingSystem;
import com.quantori.cnp.core.model.RingTopology;
import com.quantori.cnp.core.model.Substituent;
import com.quantori.cnp.core.naming.Branch;
import com.quantori.cnp.core.naming.ParentNameBuilder;
import com.quantori.cnp.core.naming.RingNamer;
import com.quantori.cnp.core.naming.SubstituentName;
import com.quantori.cnp.core.naming.SubstituentNamer;
import com.quantori.cnp.core.naming.Vocabulary;
import com.quantori.cnp.core.numbering.FusedRingTemplate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.IntStream;

/**
 * Rules of the PARENT_STRUCTURE phase: principal group, nomenclature mode and parent hydride selection, then
 * substituent identification on the chosen parent.
 */
public class ParentStructureRules {

  private final NomenclatureTables tables;
  private final RingNamer ringNamer;
  private final SubstituentNamer substituentNamer;

  public ParentStructureRules(NomenclatureTables tables, RingNamer ringNamer, SubstituentNamer substituentNamer) {
    this.tables = tables;
    this.ringNamer = ringNamer;
    this.substituentNamer = substituentNamer;
  }

  public List<NamingRule> rules() {
    return List.of(
        rule("disconnected-components", "Name the largest connected component", "P-10", 1010,
            state -> !state.hasParent() && StructureAnalysis.components(state.getMolecule()).size() > 1,
            this::keepLargestComponent),
        rule("principal-characteristic-group", "Select the principal characteristic group", "P-41", 1000,
            state -> state.getPrincipalType() == null
                && state.getFunctionalGroups().stream().anyMatch(FunctionalGroup::isCanBePrincipal),
            this::selectPrincipalGroup),
        rule("ester-functional-class", "Name esters by functional class nomenclature", "P-65.6.3.2", 990,
            state -> ESTER.equals(state.getPrincipalType()) && state.getMode() == NomenclatureMode.SUBSTITUTIVE,
            state -> state.toBuilder().mode(NomenclatureMode.FUNCTIONAL_CLASS).build()),
        rule("heteroatom-parent-hydride", "Select a mononuclear heteroatom parent hydride", "P-21.1", 950,
            state -> !state.hasParent() && heteroatomParent(state).isPresent(),
            this::buildHeteroatomParent),
        rule("polycyclic-ring-systems", "Skip ring systems of three or more rings without a retained name", "P-23",
            920,
            state -> state.getCandidateRings().stream()
                .anyMatch(ring -> isUnsupportedPolycycle(ring, state.getMolecule())),
            this::dropPolycyclicRings),
        rule("ring-or-chain", "Prefer a ring unless a chain carries more principal groups", "P-44.1.2.2", 900,
            state -> !state.hasParent() && !state.getCandidateRings().isEmpty()
                && !state.getCandidateChains().isEmpty(),
            this::chooseRingOrChain),
        rule("ring-seniority", "Select the senior ring system", "P-44.2", 850,
            state -> !state.hasParent() && !state.getCandidateRings().isEmpty(),
            this::buildRingParent),
        chainFilter("chain-principal-groups", "Most principal characteristic groups", "P-44.1.1", 840,
            (state, chain) -> -StructureAnalysis.principalCount(chain.atomSet(), false, state.principalGroups(),
                state.getMolecule())),
        chainFilter("chain-length", "Greatest number of skeletal atoms", "P-44.3", 830,
            (state, chain) -> -chain.length()),
        chainFilter("chain-multiple-bonds", "Greatest number of multiple bonds", "P-44.4.1.1", 820,
            (state, chain) -> -chain.getMultipleBonds().size()),
        chainFilter("chain-double-bonds", "Greatest number of double bonds", "P-44.4.1.2", 810,
            (state, chain) -> (int) -chain.doubleBondCount()),
        chainFilter("chain-substituents", "Greatest number of substituents", "P-45.1", 800,
            (state, chain) -> -branchLocants(chain, state, true).size()),
        lowestLocantFilter(),
        rule("chain-parent", "Build the parent chain", "P-44.3", 780,
            state -> !state.hasParent() && state.getCandidateRings().isEmpty()
                && !state.getCandidateChains().isEmpty(),
            this::buildChainParent),
        rule("substituents", "Identify substituents and place the characteristic groups", "P-29", 700,
            state -> state.hasParent() && !state.getParent().isSubstituentsResolved(),
            this::identifySubstituents),
        rule("structure-not-found", "Fall back to a mononuclear hydride name", "P-21", 600,
            state -> !state.hasParent() && !state.getMolecule().isEmpty(),
            this::fallbackParent)
    );
  }

  private NamingState keepLargestComponent(NamingState state) {
    List<Set<Integer>> components = StructureAnalysis.components(state.getMolecule());
    Set<Integer> largest = components.get(0);
    for (Set<Integer> component : components) {
      if (component.size() > largest.size()) {
        largest = component;
      }
    }
    Set<Integer> kept = largest;
    return state.toBuilder()
        .candidateChains(state.getCandidateChains().stream()
            .filter(chain -> kept.containsAll(chain.getAtomIds())).toList())
        .candidateRings(state.getCandidateRings().stream()
            .filter(ring -> kept.containsAll(ring.getAtomIds())).toList())
        .functionalGroups(state.getFunctionalGroups().stream()
            .filter(group -> kept.containsAll(group.getAtomIds())).toList())
        .build()
        .withConflict(Conflict.of(ConflictType.RULE_CONFLICT, "disconnected-components",
            "Ignored " + (components.size() - 1) + " disconnected fragment(s)"));
  }

  private NamingState selectPrincipalGroup(NamingState state) {
    Optional<FunctionalGroup> senior = state.getFunctionalGroups().stream()
        .filter(FunctionalGroup::isCanBePrincipal)
        .min(Comparator.comparingInt(FunctionalGroup::getPriority));
    if (senior.isEmpty()) {
      return state;
    }
    String type = senior.get().getType();
    List<FunctionalGroup> groups = state.getFunctionalGroups().stream()
        .map(group -> type.equals(group.getType()) ? group.toBuilder().principal(true).build() : group)
        .toList();
    return state.toBuilder().principalType(type).functionalGroups(groups).build();
  }

  private Optional<Atom> heteroatomParent(NamingState state) {
    if (!state.principalGroups().isEmpty()) {
      return Optional.empty();
    }
    Molecule molecule = state.getMolecule();
    List<Atom> candidates = molecule.getAtoms().stream()
        .filter(atom -> !atom.isInRing() && tables.hydride(atom.getSymbol()).isPresent())
        .toList();
    if (candidates.size() != 1) {
      return Optional.empty();
    }
    Atom atom = candidates.get(0);
    int valence = Math.max(0, atom.getImplicitHydrogens());
    for (Bond bond : molecule.bondsOf(atom.getId())) {
      valence += bond.getOrder().getValence();
    }
    int expected = tables.hydride(atom.getSymbol()).map(HydrideName::getValence).orElse(-1);
    return valence == expected ? Optional.of(atom) : Optional.empty();
  }

  private NamingState buildHeteroatomParent(NamingState state) {
    Optional<Atom> atom = heteroatomParent(state);
    if (atom.isEmpty()) {
      return state;
    }
    String name = tables.hydride(atom.get().getSymbol()).map(HydrideName::getName).orElseThrow();
    return state.withParent(ParentStructure.builder()
        .kind(ParentKind.HETEROATOM)
        .name(name)
        .position(atom.get().getId())
        .locant(1)
        .build());
  }

  private static boolean isUnsupportedPolycycle(RingSystem ring, Molecule molecule) {
    return ring.getTopology() == RingTopology.POLYCYCLIC && FusedRingTemplate.nameOf(ring, molecule).isEmpty();
  }

  private NamingState dropPolycyclicRings(NamingState state) {
    List<RingSystem> supported = state.getCandidateRings().stream()
        .filter(ring -> !isUnsupportedPolycycle(ring, state.getMolecule()))
        .toList();
    int dropped = state.getCandidateRings().size() - supported.size();
    return state.withCandidateRings(supported)
        .withConflict(Conflict.of(ConflictType.RULE_CONFLICT, "polycyclic-ring-systems",
            "Ring systems with three or more rings are not supported, skipped " + dropped));
  }

  private NamingState chooseRingOrChain(NamingState state) {
    Molecule molecule = state.getMolecule();
    List<FunctionalGroup> principals = state.principalGroups();
    int ringBest = state.getCandidateRings().stream()
        .mapToInt(ring -> StructureAnalysis.principalCount(ring.atomSet(), true, principals, molecule))
        .max().orElse(0);
    int chainBest = state.getCandidateChains().stream()
        .mapToInt(chain -> StructureAnalysis.principalCount(chain.atomSet(), false, principals, molecule))
        .max().orElse(0);
    if (chainBest > ringBest) {
      return state.withCandidateRings(List.of());
    }
    return state.withCandidateChains(List.of());
  }

  private NamingState buildRingParent(NamingState state) {
    Molecule molecule = state.getMolecule();
    List<FunctionalGroup> principals = state.principalGroups();
    Comparator<RingSystem> seniority = Comparator
        .comparingInt((RingSystem ring) -> StructureAnalysis.principalCount(ring.atomSet(), true, principals,
            molecule))
        .thenComparing(ring -> ring.heteroatoms(molecule).stream()
            .anyMatch(id -> "N".equals(molecule.atom(id).getSymbol())))
        .thenComparing(ring -> !ring.heteroatoms(molecule).isEmpty())
        .thenComparingInt(ring -> ring.getRings().size())
        .thenComparingInt(RingSystem::size)
        .thenComparingInt(ring -> ring.heteroatoms(molecule).size());
    RingSystem senior = state.getCandidateRings().get(0);
    for (RingSystem ring : state.getCandidateRings()) {
      if (seniority.compare(ring, senior) > 0) {
        senior = ring;
      }
    }

    ParentStructure parent = ParentStructure.builder()
        .kind(ParentKind.RING)
        .ring(senior)
        .positions(senior.getAtomIds())
        .locants(IntStream.rangeClosed(1, senior.size()).boxed().toList())
        .multipleBonds(senior.getMultipleBonds())
        .symmetric(senior.isSymmetric(molecule))
        .build();
    NamingState named = state.withParent(parent.toBuilder().name(ringNamer.name(parent, molecule, true)).build());
    if (senior.isAromatic() && senior.getTopology() != RingTopology.MONOCYCLIC
        && FusedRingTemplate.nameOf(senior, molecule).isEmpty()) {
      named = named.withConflict(Conflict.of(ConflictType.RULE_CONFLICT, "ring-seniority",
          "No retained name for the aromatic fused ring system, named as " + named.getParent().getName()));
    }
    return named;
  }

  private NamingRule chainFilter(String id, String name, String reference, int priority,
                                 ChainScore score) {
    return rule(id, name, reference, priority, this::hasCompetingChains,
        state -> {
          List<Chain> chains = state.getCandidateChains();
          int best = chains.stream().mapToInt(chain -> score.score(state, chain)).min().orElse(0);
          return state.withCandidateChains(chains.stream()
              .filter(chain -> score.score(state, chain) == best)
              .toList());
        });
  }

  private NamingRule lowestLocantFilter() {
    return rule("chain-substituent-locants", "Lowest locants for substituents", "P-45.2.2", 790,
        this::hasCompetingChains,
        state -> {
          List<Chain> chains = state.getCandidateChains();
          Comparator<List<Integer>> lexicographic = ParentStructureRules::compareLocants;
          List<Integer> best = chains.stream()
              .map(chain -> lowestBranchLocants(chain, state))
              .min(lexicographic)
              .orElse(List.of());
          return state.withCandidateChains(chains.stream()
              .filter(chain -> lowestBranchLocants(chain, state).equals(best))
              .toList());
        });
  }

  private boolean hasCompetingChains(NamingState state) {
    return !state.hasParent() && state.getCandidateRings().isEmpty() && state.getCandidateChains().size() > 1;
  }

  /**
   * Locants of the atoms bonded to a chain that are neither chain atoms nor core atoms of a principal group.
   *
   * @param chain   candidate chain
   * @param state   current state
   * @param forward number from the first chain atom, otherwise from the last
   * @return branch locants in ascending order
   */
  private static List<Integer> branchLocants(Chain chain, NamingState state, boolean forward) {
    Molecule molecule = state.getMolecule();
    Set<Integer> chainAtoms = chain.atomSet();
    Set<Integer> principalAtoms = new HashSet<>();
    state.principalGroups().forEach(group -> principalAtoms.addAll(group.getAtomIds()));
    List<Integer> locants = new ArrayList<>();
    List<Integer> atoms = chain.getAtomIds();
    for (int i = 0; i < atoms.size(); i++) {
      for (int next : molecule.neighbors(atoms.get(i))) {
        if (!chainAtoms.contains(next) && !principalAtoms.contains(next)) {
          locants.add(forward ? i + 1 : atoms.size() - i);
        }
      }
    }
    locants.sort(Integer::compare);
    return locants;
  }

  private static List<Integer> lowestBranchLocants(Chain chain, NamingState state) {
    List<Integer> forward = branchLocants(chain, state, true);
    List<Integer> reverse = branchLocants(chain, state, false);
    return compareLocants(reverse, forward) < 0 ? reverse : forward;
  }

  private static int compareLocants(List<Integer> first, List<Integer> second) {
    for (int i = 0; i < Math.min(first.size(), second.size()); i++) {
      int comparison = Integer.compare(first.get(i), second.get(i));
      if (comparison != 0) {
        return comparison;
      }
    }
    return Integer.compare(first.size(), second.size());
  }

  private NamingState buildChainParent(NamingState state) {
    Chain chain = state.getCandidateChains().get(0);
    ParentStructure parent = ParentStructure.builder()
        .kind(ParentKind.CHAIN)
        .chain(chain)
        .positions(chain.getAtomIds())
        .locants(IntStream.rangeClosed(1, chain.length()).boxed().toList())
        .multipleBonds(chain.getMultipleBonds())
        .build();
    return state.withParent(parent.toBuilder().name(ParentNameBuilder.chain(parent)).build());
  }

  private NamingState identifySubstituents(NamingState state) {
    Molecule molecule = state.getMolecule();
    ParentStructure parent = state.getParent();
    Set<Integer> parentAtoms = parent.atomSet();

    List<FunctionalGroup> groups = state.getFunctionalGroups().stream()
        .map(group -> placeOnParent(group, parent, molecule))
        .toList();

    Set<Integer> blocked = new HashSet<>(parentAtoms);
    for (FunctionalGroup group : groups) {
      if (group.isPrincipal()) {
        blocked.addAll(group.getAtomIds());
      }
    }

    List<Substituent> substituents = new ArrayList<>();
    for (Branch branch : StructureAnalysis.branches(parent.getPositions(), blocked, molecule)) {
      substituents.add(substituent(branch, branch.attachment(), null, state));
    }

    List<FunctionalGroup> placed = new ArrayList<>();
    for (FunctionalGroup group : groups) {
      if (!group.isPrincipal()) {
        placed.add(group);
        continue;
      }
      List<Integer> outside = group.getAtomIds().stream().filter(id -> !parentAtoms.contains(id)).toList();
      boolean functionalClass = ESTER.equals(group.getType())
          && state.getMode() == NomenclatureMode.FUNCTIONAL_CLASS;
      List<String> alkylComponents = new ArrayList<>();
      for (Branch branch : StructureAnalysis.branches(outside, blocked, molecule)) {
        if (functionalClass) {
          alkylComponents.add(substituentNamer.name(branch, molecule, state.getRingSystems()).name());
          continue;
        }
        boolean onNitrogen = group.isNitrogenLocant()
            && "N".equals(molecule.atom(branch.attachment()).getSymbol());
        substituents.add(substituent(branch, group.getLocantAtomIds().get(0), onNitrogen ? "N" : null, state));
      }
      placed.add(group.toBuilder().clearAlkylComponents().alkylComponents(alkylComponents).build());
    }

    ParentStructure resolved = parent.toBuilder()
        .clearSubstituents()
        .substituents(substituents)
        .substituentsResolved(true)
        .build();
    return state.withParent(resolved).withFunctionalGroups(placed);
  }

  /**
   * Resolves the parent atom carrying a group. Principal groups neither inside nor attachable to the parent lose their
   * principal status and are cited through the branch holding them.
   */
  private static FunctionalGroup placeOnParent(FunctionalGroup group, ParentStructure parent, Molecule molecule) {
    Optional<Integer> inside = group.getAtomIds().stream().filter(parent::contains).findFirst();
    FunctionalGroup.FunctionalGroupBuilder builder = group.toBuilder().clearLocantAtomIds();
    if (inside.isPresent()) {
      return builder.locantAtomId(inside.get()).incorporated(true).build();
    }
    boolean ring = parent.getKind() == ParentKind.RING;
    if (StructureAnalysis.canAttach(group, Set.copyOf(parent.getPositions()), ring, molecule)) {
      Set<Integer> core = new HashSet<>(group.getAtomIds());
      Optional<Integer> attached = parent.getPositions().stream()
          .filter(atom -> molecule.neighbors(atom).stream().anyMatch(core::contains))
          .findFirst();
      if (attached.isPresent()) {
        return builder.locantAtomId(attached.get()).incorporated(false).build();
      }
    }
    return builder.incorporated(false).principal(false).build();
  }

  private Substituent substituent(Branch branch, int attachment, String heteroLocant, NamingState state) {
    SubstituentName name = substituentNamer.name(branch, state.getMolecule(), state.getRingSystems());
    return Substituent.builder()
        .name(name.name())
        .attachmentAtomId(attachment)
        .atomIds(branch.atoms())
        .heteroLocant(heteroLocant)
        .compound(name.compound())
        .build();
  }

  /**
   * Names a molecule without carbon skeleton after a mononuclear hydride. A carbon skeleton that no chain or ring
   * rule could take is left unnamed.
   */
  private NamingState fallbackParent(NamingState state) {
    Molecule molecule = state.getMolecule();
    if (molecule.getAtoms().stream().anyMatch(Atom::isCarbon)) {
      return state.toBuilder().finalName("").build()
          .withConflict(Conflict.of(ConflictType.STRUCTURE_NOT_FOUND, "structure-not-found",
              "No supported parent chain or ring"));
    }
    Atom atom = molecule.getAtoms().stream()
        .filter(candidate -> !candidate.isCarbon())
        .filter(candidate -> Vocabulary.mononuclearHydride(candidate.getSymbol()) != null
            || tables.hydride(candidate.getSymbol()).isPresent())
        .findFirst()
        .orElse(molecule.getAtoms().get(0));
    String name = tables.hydride(atom.getSymbol())
        .map(HydrideName::getName)
        .orElseGet(() -> Optional.ofNullable(Vocabulary.mononuclearHydride(atom.getSymbol()))
            .orElse(atom.getSymbol()));

    ParentStructure parent = ParentStructure.builder()
        .kind(ParentKind.HETEROATOM)
        .name(name)
        .position(atom.getId())
        .locant(1)
        .substituentsResolved(true)
        .numbered(true)
        .build();
    return state.withParent(parent)
        .withConflict(Conflict.of(ConflictType.STRUCTURE_NOT_FOUND, "structure-not-found",
            "No parent chain or ring found, named as " + name));
  }

  static NamingRule rule(String id, String name, String reference, int priority, Predicate<NamingState> condition,
                         UnaryOperator<NamingState> action) {
    return NamingRule.builder()
        .id(id)
        .name(name)
        .reference(reference)
        .priority(priority)
        .phase(NamingPhase.PARENT_STRUCTURE)
        .condition(condition)
        .action(action)
        .build();
  }

  @FunctionalInterface
  private interface ChainScore {
    /**
     * Scores a chain, lower is better.
     */
    int score(NamingState state, Chain chain);
  }
}
