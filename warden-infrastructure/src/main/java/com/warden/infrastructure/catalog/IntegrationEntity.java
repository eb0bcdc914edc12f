package com.warden.infrastructure.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.warden.infrastructure.json.JsonNodeConverter;
import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "integrations")
public class IntegrationEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(nullable = false, unique = true, length = 128)
  private String name;

  @Column(nullable = false, length = 256)
  private String title;

  @Column(name = "description")
  private String description;

  /** JSON Schema that deployment configs of this integration must satisfy. */
  @Convert(converter = JsonNodeConverter.class)
  @Column(name = "config_schema", nullable = false)
  private JsonNode schema;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  public IntegrationEntity() {}

  @PrePersist
  void prePersist() {
    Instant now = Instant.now();
    if (createdAt == null) createdAt = now;
    if (updatedAt == null) updatedAt = now;
    if (title == null || title.isBlank()) title = name;
    if (description == null) description = "Integration:" + name + " does not have a description";
  }

  @PreUpdate
  void preUpdate() {
    updatedAt = Instant.now();
  }

  public Long getId() { return id; }

  public String getName() { return name; }
  public void setName(String name) { this.name = name; }

  public String getTitle() { return title; }
  public void setTitle(String title) { this.title = title; }

  public String getDescription() { return description; }
  public void setDescription(String description) { this.description = description; }

  public JsonNode getSchema() { return schema; }
  public void setSchema(JsonNode schema) { this.schema = schema; }

  public Instant getCreatedAt() { return createdAt; }
  public Instant getUpdatedAt() { return updatedAt; }
}
