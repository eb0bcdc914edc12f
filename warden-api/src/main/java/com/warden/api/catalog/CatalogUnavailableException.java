package com.warden.api.catalog;

import com.warden.domain.error.WardenException;

/** The remote integration catalog could not be fetched or parsed. */
public class CatalogUnavailableException extends WardenException {

  public CatalogUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public String reason() {
    return "catalog_unavailable";
  }
}
