package com.warden.client;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/** Entry of {@code GET /deployments/scheduled} as the cron scheduler sees it. */
public record ScheduledDeployment(
    long id,
    Long integrationId,
    String integrationName,
    String tenantId,
    String schedule,
    String queue,
    Integer timeout,
    boolean enabled,
    Instant lastScheduledAt,
    JsonNode config
) {}
