package com.quantori.ceb.api.exception;

/**
 * A generic error thrown by any stage of equation balancing indicating that the request cannot be processed.
 * Specific failures are reported by its subclasses, and callers may catch this type to handle all of them at once.
 */
public class BalancingException extends RuntimeException {
  /**
   * Constructs a {@code BalancingException} with the specified detail message.
   *
   * @param message the detail message, or null
   */
  public BalancingException(String message) {
    super(message);
  }

  /**
   * Constructs a {@code BalancingException} with the specified detail message and cause.
   *
   * @param message the detail message, or null
   * @param cause   the cause
   */
  public BalancingException(String message, Throwable cause) {
    super(message, cause);
  }
}
