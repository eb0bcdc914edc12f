package com.warden.api.catalog;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * @param url     raw URL of the integration catalog JSON (a list of integration entries)
 * @param timeout connect and read timeout for the catalog pull
 */
@ConfigurationProperties(prefix = "warden.catalog")
public record CatalogProperties(String url, Duration timeout) {

  public CatalogProperties {
    if (timeout == null || timeout.isZero() || timeout.isNegative()) timeout = Duration.ofSeconds(5);
  }
}
