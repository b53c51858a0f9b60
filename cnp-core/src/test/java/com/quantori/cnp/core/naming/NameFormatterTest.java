package com.quantori.cnp.core.naming;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class NameFormatterTest {

  @ParameterizedTest
  @CsvSource(delimiter = '|', value = {
      "Ethanol|ethanol",
      "2--methylpropane|2-methylpropane",
      "-chloroethane|chloroethane",
      "N,N-dimethylethanamine|N,N-dimethylethanamine",
      "N-methylacetamide|N-methylacetamide",
      "1,2-dimethylcyclopentane|1,2-dimethylcyclopentane",
      "2methylpropane|2-methylpropane",
      "methyl acetate|methyl acetate"
  })
  void normalizes(String raw, String expected) {
    assertEquals(expected, NameFormatter.format(raw));
  }
}
