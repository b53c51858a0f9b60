package com.quantori.cnp.api.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.quantori.cnp.api.InvalidMoleculeException;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class MoleculeTest {

  @Test
  void buildFillsHydrogensFromStandardValence() {
    Molecule ethanol = Molecule.builder()
        .atom("C")
        .atom("C")
        .atom("O")
        .bond(0, 1)
        .bond(1, 2)
        .build();

    assertEquals(3, ethanol.atom(0).getImplicitHydrogens());
    assertEquals(2, ethanol.atom(1).getImplicitHydrogens());
    assertEquals(1, ethanol.atom(2).getImplicitHydrogens());
    assertThat(ethanol.neighbors(1)).containsExactly(0, 2);
  }

  @Test
  void aromaticBondsMarkAtomsAromaticAndRingMembers() {
    Molecule.Builder builder = Molecule.builder();
    for (int i = 0; i < 6; i++) {
      builder.atom("C");
    }
    for (int i = 0; i < 6; i++) {
      builder.bond(i, (i + 1) % 6, BondOrder.AROMATIC);
    }
    Molecule benzene = builder.ring(0, 1, 2, 3, 4, 5).build();

    assertThat(benzene.getAtoms()).allMatch(Atom::isAromatic).allMatch(Atom::isInRing);
    assertThat(benzene.getAtoms()).allMatch(atom -> atom.getImplicitHydrogens() == 1);
  }

  @Test
  void explicitHydrogenCountIsKept() {
    Molecule molecule = Molecule.builder()
        .atom(Atom.builder().id(7).symbol("N").implicitHydrogens(0).build())
        .build();

    assertEquals(0, molecule.atom(7).getImplicitHydrogens());
  }

  @Test
  void inlineReferencesRegisterAtoms() {
    Atom carbon = Atom.of(10, "C");
    Atom oxygen = Atom.of(11, "O");
    Molecule molecule = Molecule.builder()
        .bond(AtomRef.inline(carbon), AtomRef.inline(oxygen), BondOrder.DOUBLE)
        .build();

    assertEquals(2, molecule.size());
    assertEquals(BondOrder.DOUBLE, molecule.bondOrder(11, 10));
    assertEquals(2, molecule.atom(10).getImplicitHydrogens());
  }

  @Test
  void bondToUnknownAtomIsRejected() {
    Molecule.Builder builder = Molecule.builder().atom("C").bond(0, 5);

    assertThrows(InvalidMoleculeException.class, builder::build);
  }

  @Test
  void ringWithUnknownAtomIsRejected() {
    Molecule.Builder builder = Molecule.builder().atom("C").atom("C").bond(0, 1).ring(0, 1, 2);

    assertThrows(InvalidMoleculeException.class, builder::build);
  }

  @Test
  void conflictingInlineAtomIsRejected() {
    Molecule.Builder builder = Molecule.builder()
        .atom("C")
        .atom("C")
        .bond(AtomRef.byId(0), AtomRef.inline(Atom.of(1, "N")), BondOrder.SINGLE);

    assertThrows(InvalidMoleculeException.class, builder::build);
  }

  @Test
  void duplicateAtomIdIsRejected() {
    Molecule.Builder builder = Molecule.builder().atom(Atom.of(1, "C"));

    assertThrows(InvalidMoleculeException.class, () -> builder.atom(Atom.of(1, "O")));
  }

  @Test
  void reachableStopsAtExcludedAtoms() {
    Molecule propanol = Molecule.builder()
        .atom("C").atom("C").atom("C").atom("O")
        .bond(0, 1).bond(1, 2).bond(2, 3)
        .build();

    List<Integer> reached = propanol.reachable(2, Set.of(1));

    assertThat(reached).containsExactly(2, 3);
  }
}
