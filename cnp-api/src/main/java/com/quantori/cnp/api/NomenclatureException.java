package com.quantori.cnp.api;

/**
 * A generic error that might be thrown by a naming component indicating that a request cannot be processed at all.
 * <p>
 * Ordinary naming problems never surface as exceptions: they are reported as conflicts of a
 * {@link com.quantori.cnp.api.model.NamingResult}.
 */
public class NomenclatureException extends RuntimeException {
  /**
   * Constructs a {@code NomenclatureException} with the specified detail message.
   *
   * @param message the detail message, or null
   */
  public NomenclatureException(String message) {
    super(message);
  }

  /**
   * Constructs a {@code NomenclatureException} as a wrapper of original error.
   *
   * @param t original error
   */
  public NomenclatureException(Throwable t) {
    super(t);
  }

  /**
   * Constructs a {@code NomenclatureException} with the specified detail message and cause.
   *
   * @param message the detail message, or null
   * @param cause   the cause
   */
  public NomenclatureException(String message, Throwable cause) {
    super(message, cause);
  }
}
