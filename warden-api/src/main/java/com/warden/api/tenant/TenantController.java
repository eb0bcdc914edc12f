package com.warden.api.tenant;

import com.fasterxml.jackson.databind.JsonNode;
import com.warden.api.dispatch.DeploymentView;
import com.warden.api.dispatch.JobView;
import com.warden.api.dispatch.ViolationView;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/tenants/{tenantId}")
public class TenantController {

  private final DeploymentService deployments;
  private final TenantJobService jobs;

  public TenantController(DeploymentService deployments, TenantJobService jobs) {
    this.deployments = deployments;
    this.jobs = jobs;
  }

  @PostMapping("/deployments")
  public ResponseEntity<Map<String, Object>> create(
      @PathVariable("tenantId") String tenantId,
      @RequestBody CreateDeploymentRequest req
  ) {
    long id = deployments.create(tenantId, req);
    return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("deployment_id", id));
  }

  @GetMapping("/deployments")
  public List<DeploymentView> list(@PathVariable("tenantId") String tenantId) {
    return deployments.list(tenantId);
  }

  @GetMapping("/deployments/{id}")
  public DeploymentView get(@PathVariable("tenantId") String tenantId, @PathVariable("id") long id) {
    return deployments.get(tenantId, id);
  }

  @PutMapping("/deployments/{id}")
  public DeploymentView update(
      @PathVariable("tenantId") String tenantId,
      @PathVariable("id") long id,
      @RequestBody JsonNode patch
  ) {
    return deployments.update(tenantId, id, patch);
  }

  @DeleteMapping("/deployments/{id}")
  public Map<String, Object> delete(@PathVariable("tenantId") String tenantId, @PathVariable("id") long id) {
    deployments.delete(tenantId, id);
    return Map.of("message", "ok");
  }

  @GetMapping("/deployments/{id}/violations")
  public List<JobViolations> deploymentViolations(@PathVariable("tenantId") String tenantId, @PathVariable("id") long id) {
    return jobs.deploymentViolations(tenantId, id);
  }

  @GetMapping("/jobs")
  public JobPage jobs(
      @PathVariable("tenantId") String tenantId,
      @RequestParam(value = "page", required = false) Integer page,
      @RequestParam(value = "per_page", required = false) Integer perPage,
      @RequestParam(value = "before", required = false) String before,
      @RequestParam(value = "after", required = false) String after,
      @RequestParam(value = "deployment_id", required = false) Long deploymentId
  ) {
    return jobs.list(tenantId, page, perPage, before, after, deploymentId);
  }

  @GetMapping("/jobs/{jobId}")
  public JobView job(@PathVariable("tenantId") String tenantId, @PathVariable("jobId") long jobId) {
    return jobs.get(tenantId, jobId);
  }

  @GetMapping("/violations")
  public List<ViolationView> violations(@PathVariable("tenantId") String tenantId) {
    return jobs.violations(tenantId);
  }
}
