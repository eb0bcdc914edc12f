package com.warden.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.api.catalog.CreateIntegrationRequest;
import com.warden.api.catalog.IntegrationService;
import com.warden.api.tenant.CreateDeploymentRequest;
import com.warden.api.tenant.DeploymentService;
import com.warden.infrastructure.catalog.IntegrationRepository;
import org.springframework.stereotype.Component;

/** Seeds integrations and deployments through the services, and wipes the store between tests. */
@Component
public class StoreFixtures {

  public static final String TENANT = "acme";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final IntegrationService integrations;
  private final DeploymentService deployments;
  private final IntegrationRepository integrationRepo;

  public StoreFixtures(IntegrationService integrations, DeploymentService deployments, IntegrationRepository integrationRepo) {
    this.integrations = integrations;
    this.deployments = deployments;
    this.integrationRepo = integrationRepo;
  }

  /** Deleting integrations cascades to deployments, jobs and violations. */
  public void wipe() {
    integrationRepo.deleteAllInBatch();
  }

  public long integration(String name) {
    return integrations.create(new CreateIntegrationRequest(name, bucketSchema(), null, null));
  }

  public long deployment(long integrationId, String queue, String schedule) {
    return deployments.create(TENANT,
        new CreateDeploymentRequest(integrationId, json("{\"bucket\":\"logs\"}"), schedule, queue, 60));
  }

  public static JsonNode bucketSchema() {
    return json("""
        {"type": "object",
         "required": ["bucket"],
         "properties": {"bucket": {"type": "string"}}}
        """);
  }

  public static JsonNode json(String raw) {
    try {
      return MAPPER.readTree(raw);
    } catch (Exception e) {
      throw new IllegalArgumentException(e);
    }
  }
}
