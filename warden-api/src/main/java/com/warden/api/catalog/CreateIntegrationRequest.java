package com.warden.api.catalog;

import com.fasterxml.jackson.databind.JsonNode;

public record CreateIntegrationRequest(String name, JsonNode schema, String title, String description) {}
