package com.warden.infrastructure.job;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.time.Instant;
import java.util.Optional;

public interface JobRepositoryCustom {

  /**
   * Claims the oldest queued job on {@code queue}: moves it to in-progress with {@code started_at = now}.
   * Rows locked by concurrent claimants are skipped, never waited on.
   *
   * @return id of the claimed job, empty when nothing is claimable
   */
  Optional<Long> claimNext(String queue, Instant now);

  /**
   * Deletes jobs with {@code after <= finished_at <= before}; a null bound is open.
   * Unfinished jobs never match. Violations go with their job (FK cascade).
   */
  int deleteFinishedBetween(Instant after, Instant before);

  /** Newest-first page of a tenant's jobs, optionally narrowed by deployment and finished_at window. */
  Page<JobEntity> findTenantJobs(String tenantId, Long deploymentId, Instant after, Instant before, Pageable pageable);
}
