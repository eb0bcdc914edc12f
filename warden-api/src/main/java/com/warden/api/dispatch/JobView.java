package com.warden.api.dispatch;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Read model of a job: stored columns plus what workers and operators need from its deployment.
 * Durations are whole seconds, null until both ends are known.
 */
public record JobView(
    long id,
    long deploymentId,
    String status,
    JsonNode result,
    Instant createdAt,
    Instant startedAt,
    Instant finishedAt,
    String integrationName,
    JsonNode config,
    String queue,
    Integer timeout,
    Long durationInQueue,
    Long durationInExecution,
    Long durationTotal
) {}
