package com.warden.worker.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.warden.client.DispatchClient;
import com.warden.client.ViolationReport;

import java.io.IOException;

/**
 * What a running integration sees: its config (with {@code job_id} filled in) and a way to report violations.
 */
public class IntegrationContext {

  private final String integration;
  private final JsonNode config;
  private final DispatchClient dispatch;

  public IntegrationContext(String integration, JsonNode config, DispatchClient dispatch) {
    this.integration = integration;
    this.config = config;
    this.dispatch = dispatch;
  }

  public String integration() { return integration; }
  public JsonNode config() { return config; }

  /** @return the job id, or -1 when the config carries none */
  public long jobId() {
    JsonNode id = config.path("job_id");
    return id.canConvertToLong() ? id.asLong() : -1L;
  }

  public void report(ViolationReport violation) throws IOException {
    long jobId = jobId();
    if (jobId < 0) throw new IllegalStateException("No job_id in config for integration " + integration);
    dispatch.reportViolation(jobId, violation);
  }
}
