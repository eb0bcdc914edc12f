package com.warden.api.dispatch;

import com.fasterxml.jackson.annotation.JsonProperty;

public record EnqueueRequest(@JsonProperty("deployment_id") Long deploymentId) {}
