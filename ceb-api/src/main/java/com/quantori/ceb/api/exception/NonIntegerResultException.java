package com.quantori.ceb.api.exception;

/**
 * Thrown when a rescaled coefficient is not an exact integer or does not fit into an {@code int}.
 */
public class NonIntegerResultException extends BalancingException {
  public NonIntegerResultException(String message) {
    super(message);
  }

  public NonIntegerResultException(String message, Throwable cause) {
    super(message, cause);
  }
}
