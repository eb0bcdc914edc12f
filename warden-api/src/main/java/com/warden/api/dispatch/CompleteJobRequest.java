package com.warden.api.dispatch;

import com.fasterxml.jackson.databind.JsonNode;

public record CompleteJobRequest(String status, JsonNode result) {}
