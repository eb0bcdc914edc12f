package com.warden.domain.error;

public class NotFoundException extends WardenException {

  public NotFoundException(String message) {
    super(message);
  }

  public static NotFoundException of(String entity, Object id) {
    return new NotFoundException(entity + " not found: " + id);
  }

  @Override
  public String reason() {
    return "not_found";
  }
}
