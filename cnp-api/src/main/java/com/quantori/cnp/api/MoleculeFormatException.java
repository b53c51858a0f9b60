package com.quantori.cnp.api;

/**
 * Thrown by a {@link com.quantori.cnp.api.service.MoleculeReader} when a structure string cannot be parsed.
 */
public class MoleculeFormatException extends NomenclatureException {

  public MoleculeFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
