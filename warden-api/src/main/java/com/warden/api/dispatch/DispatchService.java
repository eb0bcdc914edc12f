package com.warden.api.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.warden.domain.error.ConflictException;
import com.warden.domain.error.NotFoundException;
import com.warden.domain.error.ValidationException;
import com.warden.domain.job.JobStatus;
import com.warden.infrastructure.deployment.DeploymentEntity;
import com.warden.infrastructure.deployment.DeploymentRepository;
import com.warden.infrastructure.job.JobEntity;
import com.warden.infrastructure.job.JobRepository;
import com.warden.infrastructure.violation.ViolationEntity;
import com.warden.infrastructure.violation.ViolationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Job store operations behind the Dispatch API: enqueue, claim, complete, retention and violations.
 */
@Service
public class DispatchService {

  private static final Logger log = LoggerFactory.getLogger(DispatchService.class);

  private final DeploymentRepository deployments;
  private final JobRepository jobs;
  private final ViolationRepository violations;
  private final ViewAssembler views;
  private final Clock clock;

  public DispatchService(
      DeploymentRepository deployments,
      JobRepository jobs,
      ViolationRepository violations,
      ViewAssembler views,
      Clock clock
  ) {
    this.deployments = deployments;
    this.jobs = jobs;
    this.violations = violations;
    this.views = views;
    this.clock = clock;
  }

  /** Creates a queued job and stamps the deployment's last_scheduled_at in the same transaction. */
  @Transactional
  public long enqueue(Long deploymentId) {
    if (deploymentId == null) throw new ValidationException("deployment_id is required");
    DeploymentEntity deployment = deployments.findById(deploymentId)
        .orElseThrow(() -> NotFoundException.of("Deployment", deploymentId));

    Instant now = clock.instant();
    JobEntity job = new JobEntity();
    job.setDeploymentId(deployment.getId());
    job.setStatus(JobStatus.QUEUED);
    job.setCreatedAt(now);
    jobs.save(job);

    deployments.markScheduled(deployment.getId(), now);

    log.info("[DISPATCH] action=ENQUEUE jobId={} deploymentId={} queue={}", job.getId(), deployment.getId(), deployment.getQueue());
    return job.getId();
  }

  @Transactional
  public Optional<JobView> claimNext(String queue) {
    String q = (queue == null || queue.isBlank()) ? DeploymentEntity.DEFAULT_QUEUE : queue.trim();
    Optional<Long> claimed = jobs.claimNext(q, clock.instant());
    if (claimed.isEmpty()) return Optional.empty();

    JobEntity job = jobs.findById(claimed.get())
        .orElseThrow(() -> new IllegalStateException("Claimed job vanished: " + claimed.get()));
    log.info("[DISPATCH] action=CLAIM jobId={} deploymentId={} queue={}", job.getId(), job.getDeploymentId(), q);
    return Optional.of(views.job(job));
  }

  /**
   * Records a terminal outcome.
   *
   * in-progress: status, result and finished_at are set.
   * done/error: status and result are overwritten, finished_at is kept.
   * queued: rejected, the job was never claimed.
   */
  @Transactional
  public void complete(long jobId, String rawStatus, JsonNode result) {
    JobStatus status = parseTerminal(rawStatus);
    JobEntity job = jobs.findById(jobId).orElseThrow(() -> NotFoundException.of("Job", jobId));

    JobStatus current = job.getStatus();
    if (!current.canTransitionTo(status)) {
      throw new ConflictException("Job " + jobId + " is " + current.wire() + " and cannot become " + status.wire());
    }

    job.setStatus(status);
    job.setResult(result == null || result.isNull() ? JsonNodeFactory.instance.objectNode() : result);
    if (job.getFinishedAt() == null) {
      job.setFinishedAt(clock.instant());
    }

    if (current.isTerminal()) {
      log.info("[DISPATCH] action=COMPLETE jobId={} status={} overwrite={}", jobId, status, current);
    } else {
      log.info("[DISPATCH] action=COMPLETE jobId={} status={}", jobId, status);
    }
  }

  /** Deletes finished jobs with {@code after <= finished_at <= before}; at least one bound is required. */
  @Transactional
  public int deleteRange(String before, String after) {
    Instant b = TimeBounds.parse("before", before);
    Instant a = TimeBounds.parse("after", after);
    if (a == null && b == null) {
      throw new ValidationException("At least one of 'before' or 'after' is required");
    }
    int deleted = jobs.deleteFinishedBetween(a, b);
    log.info("[DISPATCH] action=DELETE_RANGE after={} before={} deleted={}", a, b, deleted);
    return deleted;
  }

  @Transactional(readOnly = true)
  public List<DeploymentView> scheduledDeployments() {
    return views.deployments(deployments.findByEnabledTrueAndScheduleIsNotNullOrderByIdAsc());
  }

  @Transactional(readOnly = true)
  public JobView getJob(long jobId) {
    return views.job(jobs.findById(jobId).orElseThrow(() -> NotFoundException.of("Job", jobId)));
  }

  @Transactional
  public long recordViolation(long jobId, ViolationRequest req) {
    if (!jobs.existsById(jobId)) throw NotFoundException.of("Job", jobId);
    if (req == null) throw new ValidationException("Violation body is required");
    if (req.taskName() == null || req.taskName().isBlank()) {
      throw new ValidationException("task_name is required");
    }
    if (req.controlReferences() == null || !req.controlReferences().isArray()) {
      throw new ValidationException("control_references is required and must be a list");
    }
    if (req.output() == null || req.output().isNull()) {
      throw new ValidationException("output is required");
    }
    if (req.meta() != null && !req.meta().isNull() && !req.meta().isObject()) {
      throw new ValidationException("meta must be an object");
    }

    ViolationEntity v = new ViolationEntity();
    v.setJobId(jobId);
    v.setTaskName(req.taskName().trim());
    v.setControlReferences(req.controlReferences());
    v.setOutput(req.output());
    v.setSeverity(req.severity());
    v.setDescription(req.description());
    v.setViolationType(req.violationType());
    v.setEnvironment(req.environment());
    v.setMeta(req.meta());
    Instant ts = TimeBounds.parse("timestamp", req.timestamp());
    v.setOccurredAt(ts != null ? ts : clock.instant());
    violations.save(v);

    log.info("[DISPATCH] action=VIOLATION jobId={} task={} severity={}", jobId, v.getTaskName(), v.getSeverity());
    return v.getId();
  }

  private static JobStatus parseTerminal(String raw) {
    if (raw == null || raw.isBlank()) throw new ValidationException("status is required");
    JobStatus status;
    try {
      status = JobStatus.fromWire(raw);
    } catch (IllegalArgumentException e) {
      throw new ValidationException("status must be 'done' or 'error', got: " + raw, e);
    }
    if (!status.isTerminal()) {
      throw new ValidationException("status must be 'done' or 'error', got: " + raw);
    }
    return status;
  }
}
