package com.quantori.cnp.core.naming;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class VocabularyTest {

  @ParameterizedTest
  @CsvSource({
      "1, methane",
      "4, butane",
      "10, decane",
      "11, undecane",
      "12, dodecane",
      "20, icosane",
      "21, henicosane",
      "22, docosane",
      "30, triacontane",
      "45, pentatetracontane"
  })
  void alkaneNames(int count, String expected) {
    assertEquals(expected, Vocabulary.alkane(count));
  }

  @Test
  void stemOutsideSupportedRangeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> Vocabulary.stem(0));
    assertThrows(IllegalArgumentException.class, () -> Vocabulary.stem(100));
  }

  @Test
  void multipliers() {
    assertEquals("", Vocabulary.simpleMultiplier(1));
    assertEquals("tri", Vocabulary.simpleMultiplier(3));
    assertEquals("bis", Vocabulary.complexMultiplier(2));
    assertEquals("tetrakis", Vocabulary.complexMultiplier(4));
  }

  @Test
  void heteroatomSeniorityPutsOxygenFirst() {
    assertTrue(Vocabulary.heteroatomSeniority("O") < Vocabulary.heteroatomSeniority("S"));
    assertTrue(Vocabulary.heteroatomSeniority("S") < Vocabulary.heteroatomSeniority("N"));
    assertTrue(Vocabulary.heteroatomSeniority("B") < Vocabulary.heteroatomSeniority("Xe"));
  }

  @Test
  void prefixesAndHydrides() {
    assertEquals("oxa", Vocabulary.replacementPrefix("O"));
    assertEquals("aza", Vocabulary.replacementPrefix("N"));
    assertEquals("bromo", Vocabulary.halogenPrefix("Br"));
    assertEquals("azane", Vocabulary.mononuclearHydride("N"));
    assertEquals("ethyl", Vocabulary.alkyl(2));
  }
}
