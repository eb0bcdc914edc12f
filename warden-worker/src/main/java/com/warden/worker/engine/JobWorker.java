package com.warden.worker.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.warden.client.ClaimedJob;
import com.warden.client.DispatchClient;
import com.warden.domain.job.JobStatus;
import com.warden.worker.execution.BoundedExecution;
import com.warden.worker.execution.ExecutionFailure;
import com.warden.worker.execution.ExecutionProvider;
import com.warden.worker.execution.ExecutionTimeoutException;
import com.warden.worker.execution.ResultPayloads;
import com.warden.worker.metrics.WorkerMetrics;
import com.warden.worker.wiring.WorkerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

/**
 * One claim/execute/report iteration.
 *
 * Nothing here is retried: a failed claim counts as an empty queue, and a result that cannot be
 * reported is logged and dropped (the job stays in-progress on the server).
 */
@Component
public class JobWorker {

  private static final Logger log = LoggerFactory.getLogger(JobWorker.class);

  static final long DEFAULT_TIMEOUT_SECONDS = 3600;

  public enum Outcome { IDLE, DONE, ERROR }

  private final DispatchClient dispatch;
  private final ExecutionProvider provider;
  private final String queue;
  private final WorkerMetrics metrics;

  public JobWorker(DispatchClient dispatch, ExecutionProvider provider, WorkerProperties props, WorkerMetrics metrics) {
    this.dispatch = dispatch;
    this.provider = provider;
    this.queue = props.queue();
    this.metrics = metrics;
  }

  public Outcome runOnce() {
    Optional<ClaimedJob> claimed;
    try {
      claimed = dispatch.claimNext(queue);
    } catch (IOException e) {
      metrics.incFetchError();
      log.error("[WORKER] Failed to fetch job from queue '{}': {}", queue, e.getMessage());
      return Outcome.IDLE;
    }
    if (claimed.isEmpty()) {
      log.debug("[WORKER] No job on queue '{}'", queue);
      return Outcome.IDLE;
    }

    ClaimedJob job = claimed.get();
    MDC.put("jobId", Long.toString(job.id()));
    try {
      metrics.incClaimed();
      return execute(job);
    } finally {
      MDC.remove("jobId");
    }
  }

  private Outcome execute(ClaimedJob job) {
    String integration = job.integrationName();
    Duration timeout = Duration.ofSeconds(job.timeout() == null || job.timeout() <= 0
        ? DEFAULT_TIMEOUT_SECONDS
        : job.timeout());
    ObjectNode config = configWithJobId(job);

    log.info("[WORKER] action=RUN jobId={} deploymentId={} integration={} timeout={}s",
        job.id(), job.deploymentId(), integration, timeout.toSeconds());

    JobStatus status;
    JsonNode result;
    metrics.jobStarted();
    try {
      result = BoundedExecution.call(integration, timeout, () -> provider.execute(integration, config, timeout));
      status = JobStatus.DONE;
      metrics.incDone();
    } catch (ExecutionTimeoutException e) {
      result = ResultPayloads.timeout(integration, timeout);
      status = JobStatus.ERROR;
      metrics.incTimedOut();
      log.warn("[WORKER] {}", e.getMessage());
    } catch (ExecutionFailure e) {
      result = ResultPayloads.failure(e);
      status = JobStatus.ERROR;
      metrics.incFailed();
      log.error("[WORKER] Integration '{}' failed for job {}", integration, job.id(), e);
    } finally {
      metrics.jobEnded();
    }

    report(job.id(), status, result);
    return status == JobStatus.DONE ? Outcome.DONE : Outcome.ERROR;
  }

  private void report(long jobId, JobStatus status, JsonNode result) {
    try {
      dispatch.complete(jobId, status, result);
      log.info("[WORKER] action=COMPLETE jobId={} status={}", jobId, status.wire());
    } catch (IOException e) {
      metrics.incReportError();
      log.error("[WORKER] Failed to report result for job {} (status={}): {}", jobId, status.wire(), e.getMessage());
    }
  }

  private static ObjectNode configWithJobId(ClaimedJob job) {
    ObjectNode config;
    if (job.config() != null && job.config().isObject()) {
      config = ((ObjectNode) job.config()).deepCopy();
    } else {
      if (job.config() != null && !job.config().isNull()) {
        log.warn("[WORKER] Job {} has a non-object config ({}); running with job_id only",
            job.id(), job.config().getNodeType());
      }
      config = JsonNodeFactory.instance.objectNode();
    }
    config.put("job_id", job.id());
    return config;
  }
}
