package com.quantori.cnp.api.indigo;

import com.epam.indigo.Indigo;
import com.epam.indigo.IndigoObject;
import com.quantori.cnp.api.model.Atom;
import com.quantori.cnp.api.model.Bond;
import com.quantori.cnp.api.model.BondOrder;
import com.quantori.cnp.api.model.Molecule;
import com.quantori.cnp.api.service.PatternMatcher;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * An Indigo implementation of a SMARTS pattern matcher.
 * <p>
 * The molecule graph is rebuilt as an Indigo molecule with the same hydrogen counts, so hydrogen and connectivity
 * primitives of a pattern see exactly what the naming engine sees.
 */
public class IndigoPatternMatcher implements PatternMatcher {

  private static final int AROMATIC_ORDER = 4;

  private final IndigoProvider indigoProvider;

  public IndigoPatternMatcher(IndigoProvider indigoProvider) {

    this.indigoProvider = indigoProvider;
  }

  @Override
  public List<List<Integer>> match(String pattern, Molecule molecule) {

    return indigoProvider.apply(indigo -> {
      List<Integer> ids = new ArrayList<>();
      IndigoObject target = toIndigo(indigo, molecule, ids);
      try {
        IndigoObject query = indigo.loadSmarts(pattern);
        try {
          List<List<Integer>> matches = new ArrayList<>();
          IndigoObject matcher = indigo.substructureMatcher(target);
          for (IndigoObject match : matcher.iterateMatches(query)) {
            List<Integer> atoms = new ArrayList<>();
            for (IndigoObject queryAtom : query.iterateAtoms()) {
              IndigoObject mapped = match.mapAtom(queryAtom);
              if (mapped != null) {
                atoms.add(ids.get(mapped.index()));
              }
            }
            matches.add(atoms);
          }
          return matches;
        } finally {
          query.dispose();
        }
      } finally {
        target.dispose();
      }
    });
  }

  private static IndigoObject toIndigo(Indigo indigo, Molecule molecule, List<Integer> ids) {

    IndigoObject target = indigo.createMolecule();
    Map<Integer, IndigoObject> atoms = new HashMap<>();
    for (Atom atom : molecule.getAtoms()) {
      IndigoObject created = target.addAtom(atom.getSymbol());
      created.setImplicitHCount(atom.getImplicitHydrogens());
      atoms.put(atom.getId(), created);
      ids.add(atom.getId());
    }
    for (Bond bond : molecule.getBonds()) {
      int order = bond.getOrder() == BondOrder.AROMATIC ? AROMATIC_ORDER : bond.getOrder().getValence();
      atoms.get(bond.getSource()).addBond(atoms.get(bond.getTarget()), order);
    }
    return target;
  }
}
