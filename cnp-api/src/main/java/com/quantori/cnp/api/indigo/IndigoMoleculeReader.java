package com.quantori.cnp.api.indigo;

import com.epam.indigo.Indigo;
import com.epam.indigo.IndigoException;
import com.epam.indigo.IndigoObject;
import com.quantori.cnp.api.MoleculeFormatException;
import com.quantori.cnp.api.model.Atom;
import com.quantori.cnp.api.model.BondOrder;
import com.quantori.cnp.api.model.Molecule;
import com.quantori.cnp.api.service.MoleculeReader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * An Indigo implementation of a SMILES reader.
 * <p>
 * The structure is aromatized before conversion, so aromatic rings always arrive with aromatic bonds regardless of
 * the way they were written. Atom ids are Indigo atom indexes.
 */
@Slf4j
public class IndigoMoleculeReader implements MoleculeReader {

  private final IndigoProvider indigoProvider;

  public IndigoMoleculeReader(IndigoProvider indigoProvider) {

    this.indigoProvider = indigoProvider;
  }

  @Override
  public Molecule read(String smiles) {

    if (StringUtils.isBlank(smiles)) {
      throw new MoleculeFormatException("Empty structure", null);
    }
    Indigo indigo = indigoProvider.take();
    try {
      IndigoObject structure = indigo.loadMolecule(smiles);
      try {
        structure.foldHydrogens();
        structure.dearomatize();
        Map<Integer, Integer> hydrogens = implicitHydrogens(structure);
        structure.aromatize();
        return toMolecule(structure, hydrogens);
      } finally {
        dispose(structure);
      }
    } catch (IndigoException e) {
      log.debug("Indigo rejected structure {}", smiles, e);
      throw new MoleculeFormatException("Cannot read structure " + smiles + ": " + e.getMessage(), e);
    } finally {
      indigoProvider.offer(indigo);
    }
  }

  /**
   * Aromatic nitrogen has no defined implicit hydrogen count, so the counts are taken from the Kekule form.
   */
  private static Map<Integer, Integer> implicitHydrogens(IndigoObject structure) {
    Map<Integer, Integer> hydrogens = new HashMap<>();
    for (IndigoObject atom : structure.iterateAtoms()) {
      hydrogens.put(atom.index(), atom.countImplicitHydrogens());
    }
    return hydrogens;
  }

  private static Molecule toMolecule(IndigoObject structure, Map<Integer, Integer> hydrogens) {

    Molecule.Builder builder = Molecule.builder();
    for (IndigoObject atom : structure.iterateAtoms()) {
      builder.atom(Atom.builder()
          .id(atom.index())
          .symbol(atom.symbol())
          .implicitHydrogens(hydrogens.get(atom.index()))
          .build());
    }
    for (IndigoObject bond : structure.iterateBonds()) {
      builder.bond(bond.source().index(), bond.destination().index(), BondOrder.of(bond.bondOrder()));
    }
    for (IndigoObject ring : structure.iterateSSSR()) {
      List<Integer> members = new ArrayList<>();
      for (IndigoObject atom : ring.iterateAtoms()) {
        members.add(atom.index());
      }
      builder.ring(members.stream().mapToInt(Integer::intValue).toArray());
    }
    return builder.build();
  }

  private static void dispose(IndigoObject indigoObject) {
    if (indigoObject != null) {
      indigoObject.dispose();
    }
  }
}
