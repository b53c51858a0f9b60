package com.quantori.cnp.core.model;

import com.quantori.cnp.api.model.BondOrder;
import lombok.Value;

/**
 * A double or triple bond of a parent skeleton, cited by "ene" or "yne".
 */
@Value
public class MultipleBond {
  int first;
  int second;
  BondOrder order;

  public boolean isDouble() {
    return order == BondOrder.DOUBLE;
  }
}
