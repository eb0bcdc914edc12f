package com.warden.api.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaException;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.SpecVersionDetector;
import com.networknt.schema.ValidationMessage;
import com.warden.domain.error.ValidationException;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Validates deployment configs against their integration's JSON Schema.
 * Schemas without {@code $schema} are read as draft-07.
 */
@Component
public class ConfigSchemaValidator {

  public void requireValidSchema(JsonNode schema) {
    if (schema == null || !schema.isObject()) {
      throw new ValidationException("schema must be a JSON object");
    }
    compile(schema);
  }

  public void validate(JsonNode schema, JsonNode config) {
    if (config == null || config.isNull() || config.isMissingNode()) {
      throw new ValidationException("config is required");
    }
    Set<ValidationMessage> errors = compile(schema).validate(config);
    if (!errors.isEmpty()) {
      String detail = errors.stream()
          .map(ValidationMessage::getMessage)
          .sorted()
          .collect(Collectors.joining("; "));
      throw new ValidationException("Invalid config: " + detail);
    }
  }

  private static JsonSchema compile(JsonNode schema) {
    try {
      SpecVersion.VersionFlag version = schema.has("$schema")
          ? SpecVersionDetector.detect(schema)
          : SpecVersion.VersionFlag.V7;
      return JsonSchemaFactory.getInstance(version).getSchema(schema);
    } catch (JsonSchemaException e) {
      throw new ValidationException("Invalid JSON schema: " + e.getMessage(), e);
    }
  }
}
