package com.warden.api.tenant;

import com.warden.api.dispatch.JobView;
import com.warden.api.dispatch.TimeBounds;
import com.warden.api.dispatch.ViewAssembler;
import com.warden.api.dispatch.ViolationView;
import com.warden.domain.error.NotFoundException;
import com.warden.infrastructure.deployment.DeploymentEntity;
import com.warden.infrastructure.job.JobEntity;
import com.warden.infrastructure.job.JobRepository;
import com.warden.infrastructure.violation.ViolationEntity;
import com.warden.infrastructure.violation.ViolationRepository;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read side of the management surface: a tenant's jobs and the violations they produced.
 */
@Service
public class TenantJobService {

  public static final int DEFAULT_PER_PAGE = 20;
  public static final int MAX_PER_PAGE = 100;

  private final JobRepository jobs;
  private final ViolationRepository violations;
  private final DeploymentService deployments;
  private final ViewAssembler views;

  public TenantJobService(JobRepository jobs, ViolationRepository violations, DeploymentService deployments, ViewAssembler views) {
    this.jobs = jobs;
    this.violations = violations;
    this.deployments = deployments;
    this.views = views;
  }

  /** Newest first. {@code before}/{@code after} bound finished_at inclusively. */
  @Transactional(readOnly = true)
  public JobPage list(String tenantId, Integer page, Integer perPage, String before, String after, Long deploymentId) {
    int p = page == null || page < 1 ? 1 : page;
    int size = perPage == null || perPage < 1 ? DEFAULT_PER_PAGE : Math.min(perPage, MAX_PER_PAGE);
    Instant b = TimeBounds.parse("before", before);
    Instant a = TimeBounds.parse("after", after);

    Page<JobEntity> rows = jobs.findTenantJobs(tenantId, deploymentId, a, b, PageRequest.of(p - 1, size));
    long total = rows.getTotalElements();
    return new JobPage(
        views.jobs(rows.getContent()),
        new JobPage.Pagination(p, size, total, (total + size - 1) / size)
    );
  }

  @Transactional(readOnly = true)
  public JobView get(String tenantId, long jobId) {
    return views.job(jobs.findForTenant(jobId, tenantId).orElseThrow(() -> NotFoundException.of("Job", jobId)));
  }

  @Transactional(readOnly = true)
  public List<ViolationView> violations(String tenantId) {
    return views.violations(violations.findByTenant(tenantId));
  }

  /** Jobs of one deployment, most recently finished first, each with its violations. */
  @Transactional(readOnly = true)
  public List<JobViolations> deploymentViolations(String tenantId, long deploymentId) {
    DeploymentEntity d = deployments.find(tenantId, deploymentId);
    List<JobEntity> rows = jobs.findByDeploymentRecentFirst(d.getId());
    if (rows.isEmpty()) return List.of();

    List<Long> ids = rows.stream().map(JobEntity::getId).toList();
    Map<Long, List<ViolationView>> byJob = views.violations(violations.findByJobIdInOrderByIdAsc(ids)).stream()
        .collect(Collectors.groupingBy(ViolationView::jobId));

    List<JobViolations> out = new ArrayList<>(rows.size());
    for (JobEntity j : rows) {
      out.add(new JobViolations(
          j.getId(),
          j.getStatus().wire(),
          j.getCreatedAt(),
          j.getFinishedAt(),
          byJob.getOrDefault(j.getId(), List.of())
      ));
    }
    return out;
  }
}
