package com.warden.infrastructure.violation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.warden.infrastructure.json.JsonNodeConverter;
import jakarta.persistence.*;
import java.time.Instant;

/**
 * A finding produced while executing a job. Written once, removed with its job.
 */
@Entity
@Table(name = "violations")
public class ViolationEntity {

  public static final String DEFAULT_SEVERITY = "medium";

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "job_id", nullable = false, updatable = false)
  private Long jobId;

  @Column(name = "task_name", nullable = false, updatable = false, length = 256)
  private String taskName;

  @Convert(converter = JsonNodeConverter.class)
  @Column(name = "control_references", nullable = false, updatable = false)
  private JsonNode controlReferences;

  @Convert(converter = JsonNodeConverter.class)
  @Column(name = "output", nullable = false, updatable = false)
  private JsonNode output;

  @Column(name = "severity", nullable = false, updatable = false, length = 32)
  private String severity;

  @Column(name = "description", updatable = false)
  private String description;

  @Column(name = "violation_type", updatable = false, length = 128)
  private String violationType;

  @Column(name = "environment", updatable = false, length = 128)
  private String environment;

  @Convert(converter = JsonNodeConverter.class)
  @Column(name = "meta", nullable = false, updatable = false)
  private JsonNode meta;

  @Column(name = "occurred_at", nullable = false, updatable = false)
  private Instant occurredAt;

  public ViolationEntity() {}

  @PrePersist
  void prePersist() {
    if (severity == null || severity.isBlank()) severity = DEFAULT_SEVERITY;
    if (meta == null || meta.isNull()) meta = JsonNodeFactory.instance.objectNode();
    if (occurredAt == null) occurredAt = Instant.now();
  }

  public Long getId() { return id; }

  public Long getJobId() { return jobId; }
  public void setJobId(Long jobId) { this.jobId = jobId; }

  public String getTaskName() { return taskName; }
  public void setTaskName(String taskName) { this.taskName = taskName; }

  public JsonNode getControlReferences() { return controlReferences; }
  public void setControlReferences(JsonNode controlReferences) { this.controlReferences = controlReferences; }

  public JsonNode getOutput() { return output; }
  public void setOutput(JsonNode output) { this.output = output; }

  public String getSeverity() { return severity; }
  public void setSeverity(String severity) { this.severity = severity; }

  public String getDescription() { return description; }
  public void setDescription(String description) { this.description = description; }

  public String getViolationType() { return violationType; }
  public void setViolationType(String violationType) { this.violationType = violationType; }

  public String getEnvironment() { return environment; }
  public void setEnvironment(String environment) { this.environment = environment; }

  public JsonNode getMeta() { return meta; }
  public void setMeta(JsonNode meta) { this.meta = meta; }

  public Instant getOccurredAt() { return occurredAt; }
  public void setOccurredAt(Instant occurredAt) { this.occurredAt = occurredAt; }
}
