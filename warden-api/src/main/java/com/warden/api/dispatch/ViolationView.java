package com.warden.api.dispatch;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record ViolationView(
    long id,
    long jobId,
    String integrationName,
    String taskName,
    JsonNode controlReferences,
    JsonNode output,
    String severity,
    String description,
    String violationType,
    String environment,
    JsonNode meta,
    Instant timestamp
) {}
