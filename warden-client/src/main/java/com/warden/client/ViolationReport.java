package com.warden.client;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Body of {@code POST /jobs/{id}/violations}. taskName, controlReferences and output are required;
 * the rest default server-side.
 */
public record ViolationReport(
    String taskName,
    JsonNode controlReferences,
    JsonNode output,
    String severity,
    String description,
    String violationType,
    String environment,
    JsonNode meta,
    Instant timestamp
) {

  public static ViolationReport of(String taskName, JsonNode controlReferences, JsonNode output) {
    return new ViolationReport(taskName, controlReferences, output, null, null, null, null, null, null);
  }
}
