package com.quantori.cnp.api;

/**
 * Thrown when a molecule graph is malformed, i.e. a bond or a ring references an atom that does not exist.
 */
public class InvalidMoleculeException extends NomenclatureException {

  public InvalidMoleculeException(String message) {
    super(message);
  }
}
