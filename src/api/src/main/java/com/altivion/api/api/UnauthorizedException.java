package com.altivion.api.api;

/**
 * Domain-level exception used when the shared-secret credential is missing or wrong.
 *
 * <p>Mapped to HTTP 401 by {@link ApiExceptionHandler}.
 */
public class UnauthorizedException extends RuntimeException {
  /**
   * Creates an unauthorized exception with a client-facing message.
   *
   * @param message credential error description
   */
  public UnauthorizedException(String message) {
    super(message);
  }
}
