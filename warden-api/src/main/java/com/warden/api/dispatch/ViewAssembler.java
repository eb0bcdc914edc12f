package com.warden.api.dispatch;

import com.warden.infrastructure.catalog.IntegrationEntity;
import com.warden.infrastructure.catalog.IntegrationRepository;
import com.warden.infrastructure.deployment.DeploymentEntity;
import com.warden.infrastructure.deployment.DeploymentRepository;
import com.warden.infrastructure.job.JobEntity;
import com.warden.infrastructure.job.JobRepository;
import com.warden.infrastructure.violation.ViolationEntity;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Joins store rows into read models. Lists resolve their deployments and integrations in one batch each.
 */
@Component
public class ViewAssembler {

  private final IntegrationRepository integrations;
  private final DeploymentRepository deployments;
  private final JobRepository jobs;

  public ViewAssembler(IntegrationRepository integrations, DeploymentRepository deployments, JobRepository jobs) {
    this.integrations = integrations;
    this.deployments = deployments;
    this.jobs = jobs;
  }

  public JobView job(JobEntity job) {
    return jobs(List.of(job)).get(0);
  }

  public List<JobView> jobs(List<JobEntity> rows) {
    Map<Long, DeploymentEntity> deps = deploymentsById(rows.stream().map(JobEntity::getDeploymentId).collect(Collectors.toSet()));
    Map<Long, String> names = integrationNames(deps.values());
    return rows.stream().map(j -> toView(j, deps.get(j.getDeploymentId()), names)).toList();
  }

  public DeploymentView deployment(DeploymentEntity d) {
    return deployments(List.of(d)).get(0);
  }

  public List<DeploymentView> deployments(List<DeploymentEntity> rows) {
    Map<Long, String> names = integrationNames(rows);
    return rows.stream().map(d -> new DeploymentView(
        d.getId(),
        d.getIntegrationId(),
        names.get(d.getIntegrationId()),
        d.getTenantId(),
        d.getConfig(),
        d.getSchedule(),
        d.getQueue(),
        d.getTimeoutSeconds(),
        d.isEnabled(),
        d.getLastScheduledAt(),
        d.getCreatedAt(),
        d.getUpdatedAt()
    )).toList();
  }

  public List<ViolationView> violations(List<ViolationEntity> rows) {
    Set<Long> jobIds = rows.stream().map(ViolationEntity::getJobId).collect(Collectors.toSet());
    Map<Long, Long> jobToDeployment = jobs.findAllById(jobIds).stream()
        .collect(Collectors.toMap(JobEntity::getId, JobEntity::getDeploymentId));
    Map<Long, DeploymentEntity> deps = deploymentsById(new HashSet<>(jobToDeployment.values()));
    Map<Long, String> names = integrationNames(deps.values());

    return rows.stream().map(v -> {
      DeploymentEntity d = deps.get(jobToDeployment.get(v.getJobId()));
      return new ViolationView(
          v.getId(),
          v.getJobId(),
          d == null ? null : names.get(d.getIntegrationId()),
          v.getTaskName(),
          v.getControlReferences(),
          v.getOutput(),
          v.getSeverity(),
          v.getDescription(),
          v.getViolationType(),
          v.getEnvironment(),
          v.getMeta(),
          v.getOccurredAt()
      );
    }).toList();
  }

  private JobView toView(JobEntity j, DeploymentEntity d, Map<Long, String> names) {
    return new JobView(
        j.getId(),
        j.getDeploymentId(),
        j.getStatus().wire(),
        j.getResult(),
        j.getCreatedAt(),
        j.getStartedAt(),
        j.getFinishedAt(),
        d == null ? null : names.get(d.getIntegrationId()),
        d == null ? null : d.getConfig(),
        d == null ? DeploymentEntity.DEFAULT_QUEUE : d.getQueue(),
        d == null ? null : d.getTimeoutSeconds(),
        seconds(j.getCreatedAt(), j.getStartedAt()),
        seconds(j.getStartedAt(), j.getFinishedAt()),
        seconds(j.getCreatedAt(), j.getFinishedAt())
    );
  }

  private Map<Long, DeploymentEntity> deploymentsById(Set<Long> ids) {
    return deployments.findAllById(ids).stream()
        .collect(Collectors.toMap(DeploymentEntity::getId, Function.identity()));
  }

  private Map<Long, String> integrationNames(Collection<DeploymentEntity> deps) {
    Set<Long> ids = deps.stream().map(DeploymentEntity::getIntegrationId).collect(Collectors.toSet());
    return integrations.findAllById(ids).stream()
        .collect(Collectors.toMap(IntegrationEntity::getId, IntegrationEntity::getName));
  }

  private static Long seconds(Instant from, Instant to) {
    if (from == null || to == null) return null;
    return Duration.between(from, to).getSeconds();
  }
}
