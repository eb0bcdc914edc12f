package com.warden.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.warden.domain.job.JobStatus;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Dispatch API as used by the scheduler and workers.
 * Every method fails with {@link IOException} on transport errors and unexpected statuses.
 */
public interface DispatchClient {

  List<ScheduledDeployment> scheduledDeployments() throws IOException;

  /** Queues a job for the deployment; returns the new job id. */
  long enqueue(long deploymentId) throws IOException;

  /** Claims the next job on {@code queue}; empty when the queue has nothing claimable. */
  Optional<ClaimedJob> claimNext(String queue) throws IOException;

  void complete(long jobId, JobStatus status, JsonNode result) throws IOException;

  void reportViolation(long jobId, ViolationReport violation) throws IOException;
}
