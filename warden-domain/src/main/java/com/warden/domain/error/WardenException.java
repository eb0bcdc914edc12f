package com.warden.domain.error;

/**
 * Base type for errors raised by dispatch and management operations.
 * The API layer maps each subtype to an HTTP status.
 */
public abstract class WardenException extends RuntimeException {

  protected WardenException(String message) {
    super(message);
  }

  protected WardenException(String message, Throwable cause) {
    super(message, cause);
  }

  /** Stable machine-readable reason rendered in error bodies. */
  public abstract String reason();
}
