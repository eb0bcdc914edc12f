package com.warden.api.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.warden.domain.error.ConflictException;
import com.warden.domain.error.NotFoundException;
import com.warden.domain.error.ValidationException;
import com.warden.infrastructure.catalog.IntegrationEntity;
import com.warden.infrastructure.catalog.IntegrationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@Service
public class IntegrationService {

  private static final Logger log = LoggerFactory.getLogger(IntegrationService.class);

  /** Result of a catalog pull: names created and names whose stored fields changed. */
  public record SyncResult(List<String> created, List<String> updated) {}

  private final IntegrationRepository integrations;
  private final ConfigSchemaValidator schemas;
  private final CatalogClient catalog;

  public IntegrationService(IntegrationRepository integrations, ConfigSchemaValidator schemas, CatalogClient catalog) {
    this.integrations = integrations;
    this.schemas = schemas;
    this.catalog = catalog;
  }

  @Transactional
  public long create(CreateIntegrationRequest req) {
    if (req == null || req.name() == null || req.name().isBlank() || req.schema() == null) {
      throw new ValidationException("Missing required fields: 'name' and 'schema'");
    }
    String name = req.name().trim();
    schemas.requireValidSchema(req.schema());
    if (integrations.existsByName(name)) {
      throw new ConflictException("Integration with that name already exists: " + name);
    }

    IntegrationEntity e = new IntegrationEntity();
    e.setName(name);
    e.setTitle(req.title());
    e.setDescription(req.description());
    e.setSchema(req.schema());
    integrations.save(e);

    log.info("[CATALOG] action=CREATE integrationId={} name={}", e.getId(), name);
    return e.getId();
  }

  @Transactional(readOnly = true)
  public List<IntegrationView> list() {
    return integrations.findAllByOrderByIdAsc().stream().map(IntegrationView::of).toList();
  }

  @Transactional(readOnly = true)
  public IntegrationView get(long id) {
    return integrations.findById(id).map(IntegrationView::of)
        .orElseThrow(() -> NotFoundException.of("Integration", id));
  }

  /** Removes every integration; deployments, jobs and violations go with them. */
  @Transactional
  public long deleteAll() {
    long count = integrations.count();
    integrations.deleteAllInBatch();
    log.warn("[CATALOG] action=DELETE_ALL deleted={}", count);
    return count;
  }

  /**
   * Creates catalog entries missing locally and refreshes title, description and schema of existing ones.
   * Only non-empty catalog values overwrite stored ones.
   */
  @Transactional
  public SyncResult pullCatalog() {
    List<JsonNode> entries;
    try {
      entries = catalog.fetchEnabled();
    } catch (IOException e) {
      throw new CatalogUnavailableException("Failed to fetch integrations from the catalog: " + e.getMessage(), e);
    }

    List<String> created = new ArrayList<>();
    List<String> updated = new ArrayList<>();
    for (JsonNode entry : entries) {
      String name = entry.path("name").asText().trim();
      if (name.isEmpty()) continue;
      String title = textOrNull(entry, "title");
      String description = textOrNull(entry, "description");
      JsonNode schema = entry.get("schema");
      boolean hasSchema = schema != null && schema.isObject() && !schema.isEmpty();

      var existing = integrations.findByName(name);
      if (existing.isEmpty()) {
        IntegrationEntity e = new IntegrationEntity();
        e.setName(name);
        e.setTitle(title);
        e.setDescription(description);
        e.setSchema(hasSchema ? schema : JsonNodeFactory.instance.objectNode());
        integrations.save(e);
        created.add(name);
        continue;
      }

      IntegrationEntity e = existing.get();
      boolean changed = false;
      if (title != null && !title.equals(e.getTitle())) {
        e.setTitle(title);
        changed = true;
      }
      if (description != null && !description.equals(e.getDescription())) {
        e.setDescription(description);
        changed = true;
      }
      if (hasSchema && !Objects.equals(schema, e.getSchema())) {
        e.setSchema(schema);
        changed = true;
      }
      if (changed) updated.add(name);
    }

    log.info("[CATALOG] action=PULL created={} updated={}", created, updated);
    return new SyncResult(created, updated);
  }

  private static String textOrNull(JsonNode entry, String field) {
    JsonNode n = entry.get(field);
    if (n == null || n.isNull()) return null;
    String v = n.asText();
    return v.isBlank() ? null : v;
  }
}
