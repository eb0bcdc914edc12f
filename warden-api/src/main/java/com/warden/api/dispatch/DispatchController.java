package com.warden.api.dispatch;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Unauthenticated routes used by the cron scheduler and workers.
 */
@RestController
public class DispatchController {

  private final DispatchService dispatch;

  public DispatchController(DispatchService dispatch) {
    this.dispatch = dispatch;
  }

  @GetMapping({"/deployments/scheduled", "/api/deployments/scheduled"})
  public List<DeploymentView> scheduled() {
    return dispatch.scheduledDeployments();
  }

  @PostMapping("/jobs")
  public ResponseEntity<Map<String, Object>> enqueue(@RequestBody EnqueueRequest req) {
    long id = dispatch.enqueue(req == null ? null : req.deploymentId());
    return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("id", id));
  }

  @GetMapping("/jobs/next")
  public ResponseEntity<JobView> next(@RequestParam(value = "queue", defaultValue = "default") String queue) {
    return dispatch.claimNext(queue)
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.noContent().build());
  }

  @GetMapping("/jobs/{id}")
  public JobView get(@PathVariable("id") long id) {
    return dispatch.getJob(id);
  }

  @PostMapping("/jobs/{id}/complete")
  public Map<String, Object> complete(@PathVariable("id") long id, @RequestBody CompleteJobRequest req) {
    dispatch.complete(id, req == null ? null : req.status(), req == null ? null : req.result());
    return Map.of("message", "updated");
  }

  @DeleteMapping("/jobs")
  public Map<String, Object> deleteRange(
      @RequestParam(value = "before", required = false) String before,
      @RequestParam(value = "after", required = false) String after
  ) {
    return Map.of("deleted", dispatch.deleteRange(before, after));
  }

  @PostMapping("/jobs/{id}/violations")
  public Map<String, Object> violation(@PathVariable("id") long id, @RequestBody ViolationRequest req) {
    dispatch.recordViolation(id, req);
    return Map.of("message", "ok");
  }
}
