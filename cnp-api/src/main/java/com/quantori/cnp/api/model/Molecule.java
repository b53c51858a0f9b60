package com.quantori.cnp.api.model;

import com.quantori.cnp.api.InvalidMoleculeException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * An immutable molecule graph: atoms, bonds and the atom id lists of its smallest set of smallest rings.
 * <p>
 * Instances are created through {@link #builder()} which validates every reference before the graph becomes
 * visible to the naming engine.
 */
@Getter
@EqualsAndHashCode(of = {"atoms", "bonds", "rings"})
public final class Molecule {

  private final List<Atom> atoms;
  private final List<Bond> bonds;
  private final List<List<Integer>> rings;

  private final Map<Integer, Atom> atomsById;
  private final Map<Integer, List<Bond>> bondsByAtom;

  private Molecule(List<Atom> atoms, List<Bond> bonds, List<List<Integer>> rings) {
    this.atoms = List.copyOf(atoms);
    this.bonds = List.copyOf(bonds);
    List<List<Integer>> ringCopies = new ArrayList<>();
    for (List<Integer> ring : rings) {
      ringCopies.add(List.copyOf(ring));
    }
    this.rings = Collections.unmodifiableList(ringCopies);

    Map<Integer, Atom> byId = new LinkedHashMap<>();
    Map<Integer, List<Bond>> byAtom = new LinkedHashMap<>();
    for (Atom atom : this.atoms) {
      byId.put(atom.getId(), atom);
      byAtom.put(atom.getId(), new ArrayList<>());
    }
    for (Bond bond : this.bonds) {
      byAtom.get(bond.getSource()).add(bond);
      byAtom.get(bond.getTarget()).add(bond);
    }
    this.atomsById = Collections.unmodifiableMap(byId);
    Map<Integer, List<Bond>> frozen = new LinkedHashMap<>();
    byAtom.forEach((id, list) -> frozen.put(id, List.copyOf(list)));
    this.bondsByAtom = Collections.unmodifiableMap(frozen);
  }

  public static Builder builder() {
    return new Builder();
  }

  public int size() {
    return atoms.size();
  }

  public boolean isEmpty() {
    return atoms.isEmpty();
  }

  public boolean hasAtom(int id) {
    return atomsById.containsKey(id);
  }

  public Atom atom(int id) {
    Atom atom = atomsById.get(id);
    if (atom == null) {
      throw new IllegalArgumentException("No atom with id " + id);
    }
    return atom;
  }

  public List<Bond> bondsOf(int atomId) {
    return bondsByAtom.getOrDefault(atomId, List.of());
  }

  /**
   * Gets the ids of the neighbours of an atom in bond order of appearance.
   *
   * @param atomId atom id
   * @return neighbour ids
   */
  public List<Integer> neighbors(int atomId) {
    List<Integer> result = new ArrayList<>();
    for (Bond bond : bondsOf(atomId)) {
      result.add(bond.other(atomId));
    }
    return result;
  }

  public int degree(int atomId) {
    return bondsOf(atomId).size();
  }

  /**
   * Finds the bond between two atoms.
   *
   * @param first  first atom id
   * @param second second atom id
   * @return the bond or null when the atoms are not bonded
   */
  public Bond bond(int first, int second) {
    for (Bond bond : bondsOf(first)) {
      if (bond.connects(first, second)) {
        return bond;
      }
    }
    return null;
  }

  public BondOrder bondOrder(int first, int second) {
    Bond bond = bond(first, second);
    return bond == null ? null : bond.getOrder();
  }

  /**
   * Collects the atoms connected to the start atom without walking through any atom of the excluded set.
   *
   * @param start    first atom of the component
   * @param excluded atoms that bound the search
   * @return atom ids in breadth-first order, start included
   */
  public List<Integer> reachable(int start, Set<Integer> excluded) {
    List<Integer> order = new ArrayList<>();
    Set<Integer> seen = new HashSet<>(excluded);
    seen.add(start);
    order.add(start);
    for (int i = 0; i < order.size(); i++) {
      for (int next : neighbors(order.get(i))) {
        if (seen.add(next)) {
          order.add(next);
        }
      }
    }
    return order;
  }

  /**
   * Assembles a molecule from atoms, bonds and rings. Implicit hydrogen counts left as
   * {@link Atom#UNKNOWN_HYDROGENS} are filled from {@link StandardValence} and ring membership flags are derived from
   * the ring lists.
   */
  public static final class Builder {

    private final Map<Integer, Atom> atoms = new LinkedHashMap<>();
    private final List<AtomRef[]> bondRefs = new ArrayList<>();
    private final List<BondOrder> bondOrders = new ArrayList<>();
    private final List<List<AtomRef>> ringRefs = new ArrayList<>();

    private Builder() {
    }

    public Builder atom(Atom atom) {
      if (atoms.containsKey(atom.getId())) {
        throw new InvalidMoleculeException("Duplicate atom id " + atom.getId());
      }
      atoms.put(atom.getId(), atom);
      return this;
    }

    /**
     * Adds an atom with the next free id.
     *
     * @param symbol element symbol
     * @return this builder
     */
    public Builder atom(String symbol) {
      int id = atoms.keySet().stream().mapToInt(Integer::intValue).max().orElse(-1) + 1;
      return atom(Atom.of(id, symbol));
    }

    public Builder bond(AtomRef source, AtomRef target, BondOrder order) {
      bondRefs.add(new AtomRef[] {source, target});
      bondOrders.add(order);
      return this;
    }

    public Builder bond(int source, int target, BondOrder order) {
      return bond(AtomRef.byId(source), AtomRef.byId(target), order);
    }

    public Builder bond(int source, int target) {
      return bond(source, target, BondOrder.SINGLE);
    }

    public Builder ring(List<AtomRef> members) {
      ringRefs.add(List.copyOf(members));
      return this;
    }

    public Builder ring(int... members) {
      List<AtomRef> refs = new ArrayList<>();
      for (int member : members) {
        refs.add(AtomRef.byId(member));
      }
      return ring(refs);
    }

    public Molecule build() {
      List<Bond> bonds = new ArrayList<>();
      for (int i = 0; i < bondRefs.size(); i++) {
        int source = resolve(bondRefs.get(i)[0]);
        int target = resolve(bondRefs.get(i)[1]);
        if (source == target) {
          throw new InvalidMoleculeException("Bond connects atom " + source + " to itself");
        }
        bonds.add(new Bond(source, target, bondOrders.get(i)));
      }
      List<List<Integer>> rings = new ArrayList<>();
      Set<Integer> ringAtoms = new HashSet<>();
      for (List<AtomRef> refs : ringRefs) {
        List<Integer> ring = new ArrayList<>();
        for (AtomRef ref : refs) {
          ring.add(resolve(ref));
        }
        ringAtoms.addAll(ring);
        rings.add(ring);
      }

      Map<Integer, Integer> bondValence = new LinkedHashMap<>();
      Set<Integer> aromaticBonded = new HashSet<>();
      for (Bond bond : bonds) {
        bondValence.merge(bond.getSource(), bond.getOrder().getValence(), Integer::sum);
        bondValence.merge(bond.getTarget(), bond.getOrder().getValence(), Integer::sum);
        if (bond.getOrder() == BondOrder.AROMATIC) {
          aromaticBonded.add(bond.getSource());
          aromaticBonded.add(bond.getTarget());
        }
      }

      List<Atom> completed = new ArrayList<>();
      for (Atom atom : atoms.values()) {
        Atom.AtomBuilder builder = atom.toBuilder();
        boolean aromatic = atom.isAromatic() || aromaticBonded.contains(atom.getId());
        builder.aromatic(aromatic);
        builder.inRing(atom.isInRing() || ringAtoms.contains(atom.getId()));
        if (atom.getImplicitHydrogens() == Atom.UNKNOWN_HYDROGENS) {
          builder.implicitHydrogens(StandardValence.implicitHydrogens(
              atom.getSymbol(), bondValence.getOrDefault(atom.getId(), 0), aromaticBonded.contains(atom.getId())));
        }
        completed.add(builder.build());
      }
      return new Molecule(completed, bonds, rings);
    }

    private int resolve(AtomRef ref) {
      if (ref instanceof AtomRef.Inline inline) {
        Atom atom = inline.atom();
        Atom registered = atoms.get(atom.getId());
        if (registered == null) {
          atoms.put(atom.getId(), atom);
        } else if (!registered.equals(atom)) {
          throw new InvalidMoleculeException("Inline atom " + atom + " conflicts with registered atom " + registered);
        }
        return atom.getId();
      }
      int id = ref.canonicalId();
      if (!atoms.containsKey(id)) {
        throw new InvalidMoleculeException("Reference to nonexistent atom id " + id);
      }
      return id;
    }
  }
}
