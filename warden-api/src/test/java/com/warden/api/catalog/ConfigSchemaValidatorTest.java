package com.warden.api.catalog;

import com.warden.api.StoreFixtures;
import com.warden.domain.error.ValidationException;
import org.junit.jupiter.api.Test;

import static com.warden.api.StoreFixtures.json;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigSchemaValidatorTest {

  private final ConfigSchemaValidator validator = new ConfigSchemaValidator();

  @Test
  void acceptsMatchingConfig() {
    assertThatCode(() -> validator.validate(StoreFixtures.bucketSchema(), json("{\"bucket\": \"logs\"}")))
        .doesNotThrowAnyException();
  }

  @Test
  void rejectsMissingRequiredProperty() {
    assertThatThrownBy(() -> validator.validate(StoreFixtures.bucketSchema(), json("{\"region\": \"eu\"}")))
        .isInstanceOf(ValidationException.class)
        .hasMessageStartingWith("Invalid config:")
        .hasMessageContaining("bucket");
  }

  @Test
  void rejectsWrongType() {
    assertThatThrownBy(() -> validator.validate(StoreFixtures.bucketSchema(), json("{\"bucket\": 7}")))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void rejectsMissingConfigAndNonObjectSchema() {
    assertThatThrownBy(() -> validator.validate(StoreFixtures.bucketSchema(), null))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> validator.requireValidSchema(json("[1, 2]")))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void honoursDeclaredDraft() {
    var schema = json("""
        {"$schema": "https://json-schema.org/draft/2020-12/schema",
         "type": "object", "required": ["token"]}
        """);
    assertThatCode(() -> validator.validate(schema, json("{\"token\": \"x\"}"))).doesNotThrowAnyException();
    assertThatThrownBy(() -> validator.validate(schema, json("{}"))).isInstanceOf(ValidationException.class);
  }
}
