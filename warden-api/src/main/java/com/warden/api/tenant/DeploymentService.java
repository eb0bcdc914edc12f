package com.warden.api.tenant;

import com.fasterxml.jackson.databind.JsonNode;
import com.warden.api.catalog.ConfigSchemaValidator;
import com.warden.api.dispatch.DeploymentView;
import com.warden.api.dispatch.ViewAssembler;
import com.warden.domain.error.NotFoundException;
import com.warden.domain.error.ValidationException;
import com.warden.domain.schedule.CronSchedule;
import com.warden.infrastructure.catalog.IntegrationEntity;
import com.warden.infrastructure.catalog.IntegrationRepository;
import com.warden.infrastructure.deployment.DeploymentEntity;
import com.warden.infrastructure.deployment.DeploymentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Tenant-scoped deployment management. Every write re-validates config against the integration schema
 * and the schedule as a cron expression.
 */
@Service
public class DeploymentService {

  private static final Logger log = LoggerFactory.getLogger(DeploymentService.class);

  private final DeploymentRepository deployments;
  private final IntegrationRepository integrations;
  private final ConfigSchemaValidator schemas;
  private final ViewAssembler views;

  public DeploymentService(
      DeploymentRepository deployments,
      IntegrationRepository integrations,
      ConfigSchemaValidator schemas,
      ViewAssembler views
  ) {
    this.deployments = deployments;
    this.integrations = integrations;
    this.schemas = schemas;
    this.views = views;
  }

  @Transactional
  public long create(String tenantId, CreateDeploymentRequest req) {
    if (req == null || req.integrationId() == null || req.config() == null) {
      throw new ValidationException("Missing required fields: 'integration_id' and 'config'");
    }
    IntegrationEntity integration = integrations.findById(req.integrationId())
        .orElseThrow(() -> NotFoundException.of("Integration", req.integrationId()));

    schemas.validate(integration.getSchema(), req.config());

    DeploymentEntity d = new DeploymentEntity();
    d.setIntegrationId(integration.getId());
    d.setTenantId(tenantId);
    d.setConfig(req.config());
    d.setSchedule(normalizeSchedule(req.schedule()));
    d.setQueue(normalizeQueue(req.queue()));
    d.setTimeoutSeconds(req.timeout() == null ? DeploymentEntity.DEFAULT_TIMEOUT_SECONDS : requirePositive(req.timeout()));
    d.setEnabled(true);
    deployments.save(d);

    log.info("[DEPLOYMENT] action=CREATE tenant={} deploymentId={} integration={} schedule={} queue={}",
        tenantId, d.getId(), integration.getName(), d.getSchedule(), d.getQueue());
    return d.getId();
  }

  /**
   * Partial update: only fields present in {@code patch} change. An explicit null schedule
   * turns the deployment into an on-demand one.
   */
  @Transactional
  public DeploymentView update(String tenantId, long id, JsonNode patch) {
    if (patch == null || !patch.isObject()) throw new ValidationException("Body must be a JSON object");
    DeploymentEntity d = find(tenantId, id);

    if (patch.has("config")) {
      IntegrationEntity integration = integrations.findById(d.getIntegrationId())
          .orElseThrow(() -> NotFoundException.of("Integration", d.getIntegrationId()));
      schemas.validate(integration.getSchema(), patch.get("config"));
      d.setConfig(patch.get("config"));
    }
    if (patch.has("enabled")) {
      JsonNode enabled = patch.get("enabled");
      if (!enabled.isBoolean()) throw new ValidationException("enabled must be a boolean");
      d.setEnabled(enabled.booleanValue());
    }
    if (patch.has("schedule")) {
      JsonNode schedule = patch.get("schedule");
      d.setSchedule(schedule.isNull() ? null : normalizeSchedule(schedule.asText()));
    }
    if (patch.has("queue")) {
      String queue = patch.get("queue").isNull() ? null : patch.get("queue").asText();
      if (queue == null || queue.isBlank()) throw new ValidationException("queue must not be empty");
      d.setQueue(queue.trim());
    }
    if (patch.has("timeout")) {
      JsonNode timeout = patch.get("timeout");
      if (!timeout.canConvertToInt() || !timeout.isIntegralNumber()) {
        throw new ValidationException("timeout must be a positive integer");
      }
      d.setTimeoutSeconds(requirePositive(timeout.intValue()));
    }
    deployments.saveAndFlush(d);

    log.info("[DEPLOYMENT] action=UPDATE tenant={} deploymentId={} fields={}", tenantId, id, fieldNames(patch));
    return views.deployment(d);
  }

  @Transactional(readOnly = true)
  public List<DeploymentView> list(String tenantId) {
    return views.deployments(deployments.findByTenantIdOrderByIdAsc(tenantId));
  }

  @Transactional(readOnly = true)
  public DeploymentView get(String tenantId, long id) {
    return views.deployment(find(tenantId, id));
  }

  /** Jobs and violations of the deployment go with it. */
  @Transactional
  public void delete(String tenantId, long id) {
    DeploymentEntity d = find(tenantId, id);
    deployments.delete(d);
    log.info("[DEPLOYMENT] action=DELETE tenant={} deploymentId={}", tenantId, id);
  }

  @Transactional(readOnly = true)
  public DeploymentEntity find(String tenantId, long id) {
    return deployments.findByIdAndTenantId(id, tenantId)
        .orElseThrow(() -> NotFoundException.of("Deployment", id));
  }

  private static String normalizeSchedule(String schedule) {
    if (schedule == null || schedule.isBlank()) return null;
    return CronSchedule.parse(schedule).expression();
  }

  private static String normalizeQueue(String queue) {
    return queue == null || queue.isBlank() ? DeploymentEntity.DEFAULT_QUEUE : queue.trim();
  }

  private static int requirePositive(int timeout) {
    if (timeout <= 0) throw new ValidationException("timeout must be > 0, got " + timeout);
    return timeout;
  }

  private static List<String> fieldNames(JsonNode patch) {
    List<String> names = new ArrayList<>();
    patch.fieldNames().forEachRemaining(names::add);
    return names;
  }
}
