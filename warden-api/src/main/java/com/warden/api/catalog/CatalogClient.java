package com.warden.api.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.client.http.HttpClient;
import okhttp3.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Pulls the integration catalog and keeps the entries flagged {@code enabled: true}.
 */
@Component
public class CatalogClient {

  private static final Logger log = LoggerFactory.getLogger(CatalogClient.class);

  private final HttpClient http;
  private final CatalogProperties props;
  private final ObjectMapper mapper;

  public CatalogClient(HttpClient catalogHttpClient, CatalogProperties props, ObjectMapper mapper) {
    this.http = catalogHttpClient;
    this.props = props;
    this.mapper = mapper;
  }

  public List<JsonNode> fetchEnabled() throws IOException {
    if (props.url() == null || props.url().isBlank()) {
      throw new IOException("warden.catalog.url is not configured");
    }
    String body = http.getOk(props.url(), new Headers.Builder().add("Accept", "application/json").build());
    JsonNode root = mapper.readTree(body);
    if (!root.isArray()) {
      throw new IOException("Catalog is not a JSON list");
    }
    List<JsonNode> enabled = new ArrayList<>();
    for (JsonNode entry : root) {
      if (entry.path("enabled").asBoolean(false) && entry.hasNonNull("name")) {
        enabled.add(entry);
      }
    }
    log.info("Catalog lists {} entries, {} enabled", root.size(), enabled.size());
    return enabled;
  }
}
