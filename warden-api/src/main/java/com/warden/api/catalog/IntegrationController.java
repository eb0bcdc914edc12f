package com.warden.api.catalog;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
public class IntegrationController {

  private final IntegrationService integrations;

  public IntegrationController(IntegrationService integrations) {
    this.integrations = integrations;
  }

  @PostMapping("/integrations")
  public ResponseEntity<Map<String, Object>> create(@RequestBody CreateIntegrationRequest req) {
    return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("id", integrations.create(req)));
  }

  @GetMapping("/integrations")
  public List<IntegrationView> list() {
    return integrations.list();
  }

  @GetMapping("/integrations/{id}")
  public IntegrationView get(@PathVariable("id") long id) {
    return integrations.get(id);
  }

  @DeleteMapping("/integrations")
  public Map<String, Object> deleteAll() {
    long deleted = integrations.deleteAll();
    return Map.of("message", "All integrations deleted", "deleted", deleted);
  }

  @PostMapping("/init-integrations")
  public IntegrationService.SyncResult initIntegrations() {
    return integrations.pullCatalog();
  }
}
