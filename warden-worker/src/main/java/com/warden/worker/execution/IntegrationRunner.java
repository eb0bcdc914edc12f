package com.warden.worker.execution;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * In-process integration, picked up by the registry provider when declared as a bean.
 * {@link #name()} must match the integration name in the catalog.
 */
public interface IntegrationRunner {

  String name();

  JsonNode run(IntegrationContext context) throws Exception;
}
