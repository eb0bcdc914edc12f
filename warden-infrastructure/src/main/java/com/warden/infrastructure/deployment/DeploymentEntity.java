package com.warden.infrastructure.deployment;

import com.fasterxml.jackson.databind.JsonNode;
import com.warden.infrastructure.json.JsonNodeConverter;
import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "deployments")
public class DeploymentEntity {

  public static final String DEFAULT_QUEUE = "default";
  public static final int DEFAULT_TIMEOUT_SECONDS = 3600;

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "integration_id", nullable = false)
  private Long integrationId;

  @Column(name = "tenant_id", nullable = false, length = 128)
  private String tenantId;

  @Convert(converter = JsonNodeConverter.class)
  @Column(name = "config", nullable = false)
  private JsonNode config;

  /** 5-field cron; null for on-demand deployments. */
  @Column(name = "schedule", length = 128)
  private String schedule;

  @Column(name = "queue", nullable = false, length = 128)
  private String queue;

  @Column(name = "timeout_seconds", nullable = false)
  private int timeoutSeconds;

  @Column(name = "enabled", nullable = false)
  private boolean enabled = true;

  @Column(name = "last_scheduled_at")
  private Instant lastScheduledAt;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  public DeploymentEntity() {}

  @PrePersist
  void prePersist() {
    Instant now = Instant.now();
    if (createdAt == null) createdAt = now;
    if (updatedAt == null) updatedAt = now;
    if (queue == null || queue.isBlank()) queue = DEFAULT_QUEUE;
    if (timeoutSeconds <= 0) timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
  }

  @PreUpdate
  void preUpdate() {
    updatedAt = Instant.now();
  }

  public Long getId() { return id; }

  public Long getIntegrationId() { return integrationId; }
  public void setIntegrationId(Long integrationId) { this.integrationId = integrationId; }

  public String getTenantId() { return tenantId; }
  public void setTenantId(String tenantId) { this.tenantId = tenantId; }

  public JsonNode getConfig() { return config; }
  public void setConfig(JsonNode config) { this.config = config; }

  public String getSchedule() { return schedule; }
  public void setSchedule(String schedule) { this.schedule = schedule; }

  public String getQueue() { return queue; }
  public void setQueue(String queue) { this.queue = queue; }

  public int getTimeoutSeconds() { return timeoutSeconds; }
  public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }

  public boolean isEnabled() { return enabled; }
  public void setEnabled(boolean enabled) { this.enabled = enabled; }

  public Instant getLastScheduledAt() { return lastScheduledAt; }
  public void setLastScheduledAt(Instant lastScheduledAt) { this.lastScheduledAt = lastScheduledAt; }

  public Instant getCreatedAt() { return createdAt; }
  public Instant getUpdatedAt() { return updatedAt; }
}
