package com.quantori.cnp.core.naming;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class FragmentFormatterTest {

  @Test
  void nothingToCite() {
    assertEquals("", FragmentFormatter.format(List.of(), true, true));
  }

  @Test
  void identicalPrefixesAreMultiplied() {
    List<Fragment> fragments = List.of(new Fragment("methyl", "2", false), new Fragment("methyl", "1", false));

    assertEquals("1,2-dimethyl", FragmentFormatter.format(fragments, true, true));
    assertEquals("dimethyl", FragmentFormatter.format(fragments, false, true));
  }

  @Test
  void prefixesAreAlphabetizedIgnoringMultipliers() {
    List<Fragment> fragments = List.of(
        new Fragment("methyl", "2", false),
        new Fragment("methyl", "3", false),
        new Fragment("ethyl", "4", false),
        new Fragment("chloro", "1", false));

    assertEquals("1-chloro-4-ethyl-2,3-dimethyl", FragmentFormatter.format(fragments, true, true));
  }

  @Test
  void compoundPrefixesAreEnclosed() {
    List<Fragment> fragments = List.of(
        new Fragment("1-methylethyl", "2", true),
        new Fragment("1-methylethyl", "3", true));

    assertEquals("2,3-bis(1-methylethyl)", FragmentFormatter.format(fragments, true, true));
  }

  @Test
  void nestedPrefixesUseSquareBrackets() {
    assertEquals("[2-(methyl)ethyl]", FragmentFormatter.enclose("2-(methyl)ethyl", true));
    assertEquals("(dimethylamino)", FragmentFormatter.enclose("dimethylamino", true));
    assertEquals("methyl", FragmentFormatter.enclose("methyl", false));
  }

  @Test
  void letterLocantsFollowTheirOwnSwitch() {
    List<Fragment> fragments = List.of(new Fragment("methyl", "N", false), new Fragment("methyl", "N", false));

    assertEquals("N,N-dimethyl", FragmentFormatter.format(fragments, false, true));
    assertEquals("dimethyl", FragmentFormatter.format(fragments, true, false));
  }

  @Test
  void alphaKeyStripsLocantsAndEnclosures() {
    assertEquals("methylethyl", FragmentFormatter.alphaKey("1-methylethyl"));
    assertEquals("methylethyl", FragmentFormatter.alphaKey("(1-methylethyl)"));
    assertEquals("hydroxy", FragmentFormatter.alphaKey("hydroxy"));
    assertEquals("dimethylamino", FragmentFormatter.alphaKey("dimethylamino"));
  }

  @Test
  void letterLocantsSortBeforeNumbers() {
    List<String> locants = new ArrayList<>(List.of("4a", "2", "N", "10", "4"));
    locants.sort(FragmentFormatter::compareLocants);

    assertThat(locants).containsExactly("N", "2", "4", "4a", "10");
  }
}
