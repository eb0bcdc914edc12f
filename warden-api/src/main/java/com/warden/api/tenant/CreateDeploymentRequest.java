package com.warden.api.tenant;

import com.fasterxml.jackson.databind.JsonNode;

public record CreateDeploymentRequest(
    Long integrationId,
    JsonNode config,
    String schedule,
    String queue,
    Integer timeout
) {}
