package com.warden.domain.error;

/** Malformed request: missing fields, bad types, invalid config or bounds. */
public class ValidationException extends WardenException {

  public ValidationException(String message) {
    super(message);
  }

  public ValidationException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public String reason() {
    return "validation_error";
  }
}
