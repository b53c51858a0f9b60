package com.quantori.cnp.api.indigo.exception;

import com.quantori.cnp.api.NomenclatureException;

/**
 * Thrown when a pooled toolkit instance cannot be taken in time or is returned twice.
 */
public class ObjectPoolException extends NomenclatureException {

  public ObjectPoolException(String message) {

    super(message);
  }
}
