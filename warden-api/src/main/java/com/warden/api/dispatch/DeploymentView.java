package com.warden.api.dispatch;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record DeploymentView(
    long id,
    long integrationId,
    String integrationName,
    String tenantId,
    JsonNode config,
    String schedule,
    String queue,
    int timeout,
    boolean enabled,
    Instant lastScheduledAt,
    Instant createdAt,
    Instant updatedAt
) {}
