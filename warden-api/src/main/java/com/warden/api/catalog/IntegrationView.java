package com.warden.api.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.warden.infrastructure.catalog.IntegrationEntity;

import java.time.Instant;

public record IntegrationView(
    long id,
    String name,
    String title,
    String description,
    JsonNode schema,
    Instant createdAt,
    Instant updatedAt
) {

  static IntegrationView of(IntegrationEntity e) {
    return new IntegrationView(e.getId(), e.getName(), e.getTitle(), e.getDescription(), e.getSchema(),
        e.getCreatedAt(), e.getUpdatedAt());
  }
}
