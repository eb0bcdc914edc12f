package com.warden.api.dispatch;

import com.fasterxml.jackson.databind.JsonNode;

/** Body of {@code POST /jobs/{id}/violations}; {@code timestamp} goes through {@link TimeBounds}. */
public record ViolationRequest(
    String taskName,
    JsonNode controlReferences,
    JsonNode output,
    String severity,
    String description,
    String violationType,
    String environment,
    JsonNode meta,
    String timestamp
) {}
