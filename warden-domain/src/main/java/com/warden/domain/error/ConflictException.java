package com.warden.domain.error;

/** Duplicate unique key or an operation that does not fit the entity's current state. */
public class ConflictException extends WardenException {

  public ConflictException(String message) {
    super(message);
  }

  @Override
  public String reason() {
    return "conflict";
  }
}
