package com.altivion.api.store;

/**
 * Raised when a write or read against the signal store fails.
 *
 * <p>Mapped to HTTP 502 by {@link com.altivion.api.api.ApiExceptionHandler}.
 */
public class StoreException extends RuntimeException {
  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
