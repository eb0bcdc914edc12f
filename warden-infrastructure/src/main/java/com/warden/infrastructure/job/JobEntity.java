package com.warden.infrastructure.job;

import com.fasterxml.jackson.databind.JsonNode;
import com.warden.domain.job.JobStatus;
import com.warden.infrastructure.json.JsonNodeConverter;
import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "jobs")
public class JobEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "deployment_id", nullable = false)
  private Long deploymentId;

  @Convert(converter = JobStatusConverter.class)
  @Column(nullable = false, length = 16)
  private JobStatus status;

  @Convert(converter = JsonNodeConverter.class)
  @Column(name = "result")
  private JsonNode result;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  /** Set once, by the claim. */
  @Column(name = "started_at")
  private Instant startedAt;

  /** Set on the first transition into a terminal status only. */
  @Column(name = "finished_at")
  private Instant finishedAt;

  public JobEntity() {}

  @PrePersist
  void prePersist() {
    if (createdAt == null) createdAt = Instant.now();
    if (status == null) status = JobStatus.QUEUED;
  }

  public Long getId() { return id; }

  public Long getDeploymentId() { return deploymentId; }
  public void setDeploymentId(Long deploymentId) { this.deploymentId = deploymentId; }

  public JobStatus getStatus() { return status; }
  public void setStatus(JobStatus status) { this.status = status; }

  public JsonNode getResult() { return result; }
  public void setResult(JsonNode result) { this.result = result; }

  public Instant getCreatedAt() { return createdAt; }
  public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

  public Instant getStartedAt() { return startedAt; }
  public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }

  public Instant getFinishedAt() { return finishedAt; }
  public void setFinishedAt(Instant finishedAt) { this.finishedAt = finishedAt; }
}
