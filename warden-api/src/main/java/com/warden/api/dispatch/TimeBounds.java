package com.warden.api.dispatch;

import com.warden.domain.error.ValidationException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Function;

/**
 * ISO-8601 coercion for query bounds and violation timestamps.
 * Accepts an offset date-time, a local date-time (read as UTC) or a date (midnight UTC).
 */
public final class TimeBounds {

  private static final List<Function<String, Instant>> FORMS = List.of(
      v -> OffsetDateTime.parse(v).toInstant(),
      v -> LocalDateTime.parse(v).toInstant(ZoneOffset.UTC),
      v -> LocalDate.parse(v).atStartOfDay(ZoneOffset.UTC).toInstant()
  );

  private TimeBounds() {}

  /** Null or blank input yields null (open bound). */
  public static Instant parse(String name, String raw) {
    if (raw == null || raw.isBlank()) return null;
    String v = raw.trim();
    DateTimeParseException last = null;
    for (Function<String, Instant> form : FORMS) {
      try {
        return form.apply(v);
      } catch (DateTimeParseException e) {
        last = e;
      }
    }
    throw new ValidationException("'" + name + "' is not an ISO-8601 date or date-time: " + raw, last);
  }
}
