package com.quantori.cnp.core.naming;

import com.quantori.cnp.api.model.Molecule;
import com.quantori.cnp.core.configuration.NomenclatureTables;
import com.quantori.cnp.core.model.ParentStructure;
import com.quantori.cnp.core.model.RingSystem;
import com.quantori.cnp.core.model.RingTopology;
import com.quantori.cnp.core.numbering.FusedRingTemplate;
import com.quantori.cnp.core.numbering.RingGeometry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Names ring parents: benzene, carbocycles, heterocycles from the name table, retained fused systems (naphthalene,
 * quinoline, indole, anthracene), von Baeyer bicycles and monospiro compounds. Heteroatoms without a table name are expressed by replacement prefixes, i.e.
 * "7-oxabicyclo[2.2.1]heptane".
 */
public class RingNamer {

  private final NomenclatureTables tables;

  public RingNamer(NomenclatureTables tables) {
    this.tables = tables;
  }

  /**
   * Names the ring of a parent structure using the parent's current locants.
   *
   * @param parent          ring parent
   * @param molecule        molecule graph
   * @param showBondLocants cite the locants of double and triple bonds
   * @return ring name
   */
  public String name(ParentStructure parent, Molecule molecule, boolean showBondLocants) {
    RingSystem ring = parent.getRing();
    List<Integer> enes = ParentNameBuilder.bondLocants(parent, true);
    List<Integer> ynes = ParentNameBuilder.bondLocants(parent, false);
    List<Integer> heteroatoms = ring.heteroatoms(molecule);

    if (ring.getTopology() == RingTopology.MONOCYCLIC) {
      if (heteroatoms.isEmpty()) {
        if (ring.isAromatic() && ring.size() == 6) {
          return "benzene";
        }
        return "cyclo" + ParentNameBuilder.hydride(Vocabulary.stem(ring.size()), enes, ynes, showBondLocants);
      }
      Optional<String> tableName = heterocycle(ring, heteroatoms, molecule);
      if (tableName.isPresent()) {
        return tableName.get();
      }
      return replacementPrefixes(parent, heteroatoms, molecule, heteroatoms.size() > 1)
          + "cyclo" + ParentNameBuilder.hydride(Vocabulary.stem(ring.size()), enes, ynes, showBondLocants);
    }

    Optional<String> retained = FusedRingTemplate.nameOf(ring, molecule);
    if (retained.isPresent()) {
      return retained.get();
    }
    Optional<RingGeometry.Bicycle> bicycle = RingGeometry.bicycle(ring, molecule);
    if (bicycle.isPresent()) {
      String descriptor = bicycle.get().bridges().stream()
          .map(bridge -> String.valueOf(bridge.size()))
          .collect(Collectors.joining(".", "bicyclo[", "]"));
      return replacementPrefixes(parent, heteroatoms, molecule, true) + descriptor
          + ParentNameBuilder.hydride(Vocabulary.stem(ring.size()), enes, ynes, showBondLocants);
    }
    Optional<RingGeometry.Spiro> spiro = RingGeometry.spiro(ring);
    if (spiro.isPresent()) {
      String descriptor = "spiro[" + spiro.get().smallRing().size() + "." + spiro.get().largeRing().size() + "]";
      return replacementPrefixes(parent, heteroatoms, molecule, true) + descriptor
          + ParentNameBuilder.hydride(Vocabulary.stem(ring.size()), enes, ynes, showBondLocants);
    }
    return replacementPrefixes(parent, heteroatoms, molecule, true) + "cyclo" + Vocabulary.alkane(ring.size());
  }

  private Optional<String> heterocycle(RingSystem ring, List<Integer> heteroatoms, Molecule molecule) {
    if (!ring.isAromatic() && !ring.getMultipleBonds().isEmpty()) {
      return Optional.empty();
    }
    String symbols = heteroatoms.stream()
        .map(id -> molecule.atom(id).getSymbol())
        .sorted()
        .collect(Collectors.joining());
    return tables.heterocycle(ring.size(), ring.isAromatic(), symbols, spacing(ring, heteroatoms));
  }

  /**
   * Ring distance between the first two heteroatoms.
   *
   * @param ring        monocycle in ring order
   * @param heteroatoms heteroatoms of the ring
   * @return shortest distance, 0 for a single heteroatom
   */
  static int spacing(RingSystem ring, List<Integer> heteroatoms) {
    if (heteroatoms.size() < 2) {
      return 0;
    }
    int distance = Math.abs(ring.getAtomIds().indexOf(heteroatoms.get(0))
        - ring.getAtomIds().indexOf(heteroatoms.get(1)));
    return Math.min(distance, ring.size() - distance);
  }

  private static String replacementPrefixes(ParentStructure parent, List<Integer> heteroatoms, Molecule molecule,
                                            boolean showLocants) {
    Map<String, List<Integer>> bySymbol = new LinkedHashMap<>();
    heteroatoms.stream()
        .sorted(Comparator.comparingInt((Integer id) -> Vocabulary.heteroatomSeniority(molecule.atom(id).getSymbol()))
            .thenComparing(id -> parent.locantOf(id)))
        .forEach(id -> bySymbol.computeIfAbsent(molecule.atom(id).getSymbol(), symbol -> new ArrayList<>())
            .add(parent.locantOf(id)));

    List<String> prefixes = new ArrayList<>();
    bySymbol.forEach((symbol, locants) -> {
      String locantText = locants.stream().sorted().map(parent::label).collect(Collectors.joining(","));
      prefixes.add((showLocants ? locantText + "-" : "") + Vocabulary.simpleMultiplier(locants.size())
          + Vocabulary.replacementPrefix(symbol));
    });
    return String.join("-", prefixes);
  }
}
