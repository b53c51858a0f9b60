package com.quantori.cnp.api.model;

/**
 * A reference to an atom used while a molecule is being assembled. It is either a bare id of an atom registered
 * elsewhere or the atom itself. Both forms are resolved to a canonical id by {@link Molecule.Builder}.
 */
public interface AtomRef {

  int canonicalId();

  static AtomRef byId(int id) {
    return new ById(id);
  }

  static AtomRef inline(Atom atom) {
    return new Inline(atom);
  }

  record ById(int id) implements AtomRef {
    @Override
    public int canonicalId() {
      return id;
    }
  }

  record Inline(Atom atom) implements AtomRef {
    @Override
    public int canonicalId() {
      return atom.getId();
    }
  }
}
