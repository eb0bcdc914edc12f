package com.warden.scheduler.wiring;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * @param apiUrl      base URL of the Dispatch API
 * @param zone        zone cron expressions are evaluated in
 * @param httpTimeout connect and read timeout for Dispatch API calls
 */
@ConfigurationProperties(prefix = "warden.scheduler")
public record SchedulerProperties(String apiUrl, ZoneId zone, Duration httpTimeout) {

  public SchedulerProperties {
    if (apiUrl == null || apiUrl.isBlank()) apiUrl = "http://localhost:8080";
    if (zone == null) zone = ZoneOffset.UTC;
    if (httpTimeout == null || httpTimeout.isZero() || httpTimeout.isNegative()) httpTimeout = Duration.ofSeconds(10);
  }
}
