package com.warden.client;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Job handed to a worker by {@code GET /jobs/next}.
 *
 * @param timeout execution budget in seconds, taken from the deployment
 */
public record ClaimedJob(
    long id,
    long deploymentId,
    String status,
    String integrationName,
    JsonNode config,
    String queue,
    Integer timeout,
    Instant createdAt,
    Instant startedAt
) {}
