package com.warden.api.security;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param token static bearer token for the management surface; blank rejects every management call
 */
@ConfigurationProperties(prefix = "warden.api")
public record ApiProperties(String token) {

  public ApiProperties {
    token = token == null ? "" : token.trim();
  }

  public boolean hasToken() {
    return !token.isEmpty();
  }
}
