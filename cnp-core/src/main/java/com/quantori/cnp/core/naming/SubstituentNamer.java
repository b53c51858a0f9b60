package com.quantori.cnp.core.naming;

import com.quantori.cnp.api.model.Atom;
import com.quantori.cnp.api.model.BondOrder;
import com.quantori.cnp.api.model.Molecule;
import com.quantori.cnp.core.configuration.HydrideName;
import com.quantori.cnp.core.configuration.NomenclatureTables;
import com.quantori.cnp.core.model.FunctionalGroup;
import com.quantori.cnp.core.model.ParentKind;
import com.quantori.cnp.core.model.ParentStructure;
import com.quantori.cnp.core.model.RingSystem;
import com.quantori.cnp.core.model.RingTopology;
import com.quantori.cnp.core.model.Substituent;
import com.quantori.cnp.core.numbering.LocantOptimizer;
import com.quantori.cnp.core.numbering.NumberingResult;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Names branches as substituent prefixes.
 * <p>
 * Acyclic carbon branches are named from the longest carbon chain starting at the attachment atom, with their own
 * branches cited as prefixes ("1-methylethyl"). Ring branches are numbered with the free valence as the most senior
 * position ("4-methylphenyl", "pyridin-2-yl"). Heteroatom branches get their characteristic prefixes ("hydroxy",
 * "methoxy", "dimethylamino", "trimethylsilyl").
 */
public class SubstituentNamer {

  private static final String FREE_VALENCE = "free_valence";
  private static final List<String> SHORT_ALKOXY = List.of("methyl", "ethyl", "propyl", "butyl");

  private final NomenclatureTables tables;
  private final RingNamer ringNamer;
  private final LocantOptimizer locantOptimizer;

  public SubstituentNamer(NomenclatureTables tables, RingNamer ringNamer, LocantOptimizer locantOptimizer) {
    this.tables = tables;
    this.ringNamer = ringNamer;
    this.locantOptimizer = locantOptimizer;
  }

  /**
   * Names one branch.
   *
   * @param branch      branch to name
   * @param molecule    molecule graph
   * @param ringSystems all ring systems of the molecule
   * @return prefix name
   */
  public SubstituentName name(Branch branch, Molecule molecule, List<RingSystem> ringSystems) {
    Atom root = molecule.atom(branch.root());
    BondOrder toParent = molecule.bondOrder(branch.attachment(), branch.root());
    if (root.isHalogen()) {
      return SubstituentName.simple(Vocabulary.halogenPrefix(root.getSymbol()));
    }
    if (root.isCarbon()) {
      if (root.isInRing()) {
        return ringYl(branch, molecule, ringSystems);
      }
      return carbon(branch, molecule, ringSystems);
    }
    switch (root.getSymbol()) {
      case "O":
        return oxygen(branch, toParent, molecule, ringSystems);
      case "S":
        return sulfur(branch, toParent, molecule, ringSystems);
      case "N":
        return nitrogen(branch, toParent, molecule, ringSystems);
      default:
        return hydrideYl(branch, root, molecule, ringSystems);
    }
  }

  private SubstituentName oxygen(Branch branch, BondOrder toParent, Molecule molecule,
                                 List<RingSystem> ringSystems) {
    if (toParent == BondOrder.DOUBLE) {
      return SubstituentName.simple("oxo");
    }
    List<Branch> next = subBranches(branch.root(), branch, Set.of(branch.root()), molecule);
    if (next.isEmpty()) {
      return SubstituentName.simple("hydroxy");
    }
    Branch inner = next.get(0);
    Atom innerRoot = molecule.atom(inner.root());
    if (innerRoot.isCarbon() && !innerRoot.isInRing() && hasDoubleBondedOxygen(inner, molecule)) {
      return SubstituentName.compound(carbonyl(inner, molecule, ringSystems).name() + "oxy");
    }
    SubstituentName innerName = name(inner, molecule, ringSystems);
    if ("phenyl".equals(innerName.name())) {
      return SubstituentName.simple("phenoxy");
    }
    if (!innerRoot.isInRing() && SHORT_ALKOXY.stream().anyMatch(innerName.name()::endsWith)) {
      String stem = innerName.name().substring(0, innerName.name().length() - 2);
      return new SubstituentName(stem + "oxy", innerName.compound());
    }
    return SubstituentName.compound(enclosed(innerName) + "oxy");
  }

  private SubstituentName sulfur(Branch branch, BondOrder toParent, Molecule molecule,
                                 List<RingSystem> ringSystems) {
    if (toParent == BondOrder.DOUBLE) {
      return SubstituentName.simple("sulfanylidene");
    }
    List<Branch> next = subBranches(branch.root(), branch, Set.of(branch.root()), molecule);
    if (next.isEmpty()) {
      return SubstituentName.simple("sulfanyl");
    }
    return SubstituentName.compound(enclosed(name(next.get(0), molecule, ringSystems)) + "sulfanyl");
  }

  private SubstituentName nitrogen(Branch branch, BondOrder toParent, Molecule molecule,
                                   List<RingSystem> ringSystems) {
    if (toParent == BondOrder.TRIPLE) {
      return SubstituentName.simple("nitrilo");
    }
    String base = toParent == BondOrder.DOUBLE ? "imino" : "amino";
    List<Branch> next = subBranches(branch.root(), branch, Set.of(branch.root()), molecule);
    if (next.isEmpty()) {
      return SubstituentName.simple(base);
    }
    return SubstituentName.compound(substitutedHeteroatom(next, base, molecule, ringSystems));
  }

  private SubstituentName hydrideYl(Branch branch, Atom root, Molecule molecule, List<RingSystem> ringSystems) {
    String base = tables.hydride(root.getSymbol())
        .map(HydrideName::getSubstituentName)
        .orElseGet(() -> root.getSymbol().toLowerCase() + "yl");
    List<Branch> next = subBranches(branch.root(), branch, Set.of(branch.root()), molecule);
    if (next.isEmpty()) {
      return SubstituentName.simple(base);
    }
    return SubstituentName.compound(substitutedHeteroatom(next, base, molecule, ringSystems));
  }

  /**
   * Names a heteroatom carrying further branches, i.e. "dimethylamino" or "ethyl(methyl)amino".
   */
  private String substitutedHeteroatom(List<Branch> branches, String base, Molecule molecule,
                                       List<RingSystem> ringSystems) {
    List<SubstituentName> names = branches.stream()
        .map(inner -> name(inner, molecule, ringSystems))
        .sorted(Comparator.comparing((SubstituentName name) -> FragmentFormatter.alphaKey(name.name())))
        .toList();
    boolean identical = names.stream().map(SubstituentName::name).distinct().count() == 1;
    if (identical) {
      SubstituentName name = names.get(0);
      String multiplier = name.compound()
          ? Vocabulary.complexMultiplier(names.size())
          : Vocabulary.simpleMultiplier(names.size());
      return multiplier + FragmentFormatter.enclose(name.name(), name.compound()) + base;
    }
    StringBuilder text = new StringBuilder(FragmentFormatter.enclose(names.get(0).name(), names.get(0).compound()));
    for (SubstituentName name : names.subList(1, names.size())) {
      text.append('(').append(name.name()).append(')');
    }
    return text.append(base).toString();
  }

  private SubstituentName carbon(Branch branch, Molecule molecule, List<RingSystem> ringSystems) {
    int root = branch.root();
    List<Branch> next = subBranches(root, branch, Set.of(root), molecule);
    if (next.size() == 1 && branch.atoms().size() == 2
        && molecule.bondOrder(root, next.get(0).root()) == BondOrder.TRIPLE
        && "N".equals(molecule.atom(next.get(0).root()).getSymbol())) {
      return SubstituentName.simple("cyano");
    }
    if (hasDoubleBondedOxygen(branch, molecule)) {
      return carbonyl(branch, molecule, ringSystems);
    }
    SubstituentName alkyl = alkyl(branch, molecule, ringSystems, false);
    if (molecule.bondOrder(branch.attachment(), root) == BondOrder.DOUBLE && alkyl.name().endsWith("yl")) {
      return new SubstituentName(alkyl.name() + "idene", alkyl.compound());
    }
    return alkyl;
  }

  /**
   * Names a branch whose root is a carbonyl carbon: formyl, carboxy, carbamoyl, alkoxycarbonyl or acyl.
   */
  private SubstituentName carbonyl(Branch branch, Molecule molecule, List<RingSystem> ringSystems) {
    int root = branch.root();
    int oxygen = doubleBondedOxygen(branch, molecule);
    List<Branch> others = subBranches(root, branch, Set.of(root, oxygen), molecule).stream()
        .filter(inner -> inner.root() != oxygen)
        .toList();
    if (others.isEmpty()) {
      return SubstituentName.simple("formyl");
    }
    Branch other = others.get(0);
    Atom otherRoot = molecule.atom(other.root());
    if ("O".equals(otherRoot.getSymbol())) {
      if (other.atoms().size() == 1) {
        return SubstituentName.simple("carboxy");
      }
      return SubstituentName.compound(oxygen(other, BondOrder.SINGLE, molecule, ringSystems).name() + "carbonyl");
    }
    if ("N".equals(otherRoot.getSymbol())) {
      List<Branch> onNitrogen = subBranches(other.root(), other, Set.of(other.root()), molecule);
      if (onNitrogen.isEmpty()) {
        return SubstituentName.simple("carbamoyl");
      }
      return SubstituentName.compound(substitutedHeteroatom(onNitrogen, "carbamoyl", molecule, ringSystems));
    }
    if (otherRoot.isCarbon() && otherRoot.isInRing()) {
      SubstituentName ring = ringYl(other, molecule, ringSystems);
      if ("phenyl".equals(ring.name())) {
        return SubstituentName.simple("benzoyl");
      }
      return SubstituentName.compound(enclosed(ring) + "carbonyl");
    }
    return alkyl(branch, molecule, ringSystems, true);
  }

  /**
   * Names an acyclic carbon branch from its longest chain, or the acyl group built on that chain.
   */
  private SubstituentName alkyl(Branch branch, Molecule molecule, List<RingSystem> ringSystems, boolean acyl) {
    Set<Integer> allowed = new HashSet<>(branch.atoms());
    Set<Integer> excluded = new HashSet<>();
    if (acyl) {
      excluded.add(doubleBondedOxygen(branch, molecule));
    }
    List<Integer> chain = longestPath(branch.root(), allowed, molecule, new HashSet<>());
    Set<Integer> chainAtoms = new HashSet<>(chain);

    List<Fragment> fragments = new ArrayList<>();
    List<SubstituentName> names = new ArrayList<>();
    for (int i = 0; i < chain.size(); i++) {
      Set<Integer> stop = new HashSet<>(chainAtoms);
      stop.addAll(excluded);
      for (Branch inner : subBranches(chain.get(i), branch, stop, molecule)) {
        SubstituentName innerName = name(inner, molecule, ringSystems);
        names.add(innerName);
        fragments.add(new Fragment(innerName.name(), String.valueOf(i + 1), innerName.compound()));
      }
    }

    List<Integer> doubles = new ArrayList<>();
    List<Integer> triples = new ArrayList<>();
    for (int i = 0; i + 1 < chain.size(); i++) {
      BondOrder order = molecule.bondOrder(chain.get(i), chain.get(i + 1));
      if (order == BondOrder.DOUBLE) {
        doubles.add(i + 1);
      } else if (order == BondOrder.TRIPLE) {
        triples.add(i + 1);
      }
    }
    boolean unsaturated = !doubles.isEmpty() || !triples.isEmpty();

    if (!acyl && chain.size() == 1 && names.size() == 1 && "phenyl".equals(names.get(0).name())) {
      return SubstituentName.simple("benzyl");
    }
    if (acyl && chain.size() == 2 && fragments.isEmpty() && !unsaturated) {
      return SubstituentName.simple("acetyl");
    }

    String base;
    if (!unsaturated) {
      base = Vocabulary.stem(chain.size()) + (acyl ? "anoyl" : "yl");
    } else {
      String hydride = ParentNameBuilder.hydride(Vocabulary.stem(chain.size()), doubles, triples, chain.size() > 2);
      String stem = hydride.substring(0, hydride.length() - 1);
      if (acyl) {
        base = stem + "oyl";
      } else {
        base = chain.size() > 2 ? stem + "-1-yl" : stem + "yl";
      }
    }
    String name = FragmentFormatter.format(fragments, chain.size() > 1, true) + base;
    return new SubstituentName(name, !fragments.isEmpty() || (unsaturated && chain.size() > 2));
  }

  /**
   * Names a ring branch, numbering the ring with the attachment atom as the most senior position.
   */
  private SubstituentName ringYl(Branch branch, Molecule molecule, List<RingSystem> ringSystems) {
    int root = branch.root();
    Optional<RingSystem> found = ringSystems.stream().filter(system -> system.contains(root)).findFirst();
    if (found.isEmpty()) {
      return SubstituentName.simple("cyclyl");
    }
    RingSystem ring = found.get();
    Set<Integer> ringAtoms = ring.atomSet();

    List<Substituent> substituents = new ArrayList<>();
    for (int atom : ring.getAtomIds()) {
      for (Branch inner : subBranches(atom, branch, ringAtoms, molecule)) {
        SubstituentName innerName = name(inner, molecule, ringSystems);
        substituents.add(Substituent.builder()
            .name(innerName.name())
            .attachmentAtomId(atom)
            .atomIds(inner.atoms())
            .compound(innerName.compound())
            .build());
      }
    }

    ParentStructure parent = ParentStructure.builder()
        .kind(ParentKind.RING)
        .ring(ring)
        .positions(ring.getAtomIds())
        .locants(IntStream.rangeClosed(1, ring.size()).boxed().toList())
        .multipleBonds(ring.getMultipleBonds())
        .substituents(substituents)
        .substituentsResolved(true)
        .symmetric(ring.isSymmetric(molecule))
        .build();
    FunctionalGroup freeValence = FunctionalGroup.builder()
        .type(FREE_VALENCE)
        .principal(true)
        .locantAtomId(root)
        .build();
    NumberingResult numbering = locantOptimizer.optimize(parent, List.of(freeValence), molecule);
    ParentStructure numbered = numbering.parent();
    String attachmentLabel = numbered.label(numbered.locantOf(root));

    String ringName = ringNamer.name(numbered, molecule, true);
    String base;
    if ("benzene".equals(ringName)) {
      base = "phenyl";
    } else if (ring.getTopology() == RingTopology.MONOCYCLIC && ring.heteroatoms(molecule).isEmpty()
        && ring.getMultipleBonds().isEmpty()) {
      base = ringName.substring(0, ringName.length() - 3) + "yl";
    } else {
      String stem = ringName.endsWith("e") ? ringName.substring(0, ringName.length() - 1) : ringName;
      base = stem + "-" + attachmentLabel + "-yl";
    }

    List<Fragment> fragments = numbered.getSubstituents().stream()
        .map(substituent -> new Fragment(substituent.getName(), numbered.label(substituent.getLocant()),
            substituent.isCompound()))
        .toList();
    String name = FragmentFormatter.format(fragments, true, true) + base;
    boolean compound = !fragments.isEmpty() || base.contains("-");
    return new SubstituentName(name, compound);
  }

  /**
   * Splits the atoms hanging off one atom of a branch into sub-branches.
   *
   * @param from   atom the sub-branches are attached to
   * @param branch enclosing branch, sub-branches never leave it
   * @param stop   atoms that bound the sub-branches besides {@code from}
   * @param molecule molecule graph
   * @return sub-branches in neighbour order
   */
  private static List<Branch> subBranches(int from, Branch branch, Set<Integer> stop, Molecule molecule) {
    Set<Integer> allowed = new HashSet<>(branch.atoms());
    Set<Integer> blocked = new HashSet<>(stop);
    blocked.add(from);
    blocked.add(branch.attachment());
    List<Branch> result = new ArrayList<>();
    Set<Integer> seen = new HashSet<>();
    for (int next : molecule.neighbors(from)) {
      if (!allowed.contains(next) || blocked.contains(next) || seen.contains(next)) {
        continue;
      }
      List<Integer> atoms = molecule.reachable(next, blocked).stream().filter(allowed::contains).toList();
      seen.addAll(atoms);
      result.add(new Branch(from, next, atoms));
    }
    return result;
  }

  private static List<Integer> longestPath(int atom, Set<Integer> allowed, Molecule molecule, Set<Integer> visited) {
    visited.add(atom);
    List<Integer> best = List.of();
    for (int next : molecule.neighbors(atom)) {
      Atom candidate = molecule.atom(next);
      if (!allowed.contains(next) || visited.contains(next) || !candidate.isCarbon() || candidate.isInRing()) {
        continue;
      }
      List<Integer> path = longestPath(next, allowed, molecule, visited);
      if (path.size() > best.size()) {
        best = path;
      }
    }
    visited.remove(atom);
    List<Integer> result = new ArrayList<>();
    result.add(atom);
    result.addAll(best);
    return result;
  }

  private static boolean hasDoubleBondedOxygen(Branch branch, Molecule molecule) {
    return doubleBondedOxygen(branch, molecule) >= 0;
  }

  private static int doubleBondedOxygen(Branch branch, Molecule molecule) {
    for (int next : molecule.neighbors(branch.root())) {
      if (branch.atoms().contains(next) && "O".equals(molecule.atom(next).getSymbol())
          && molecule.bondOrder(branch.root(), next) == BondOrder.DOUBLE) {
        return next;
      }
    }
    return -1;
  }

  private static String enclosed(SubstituentName name) {
    return name.compound() ? "(" + name.name() + ")" : name.name();
  }
}
