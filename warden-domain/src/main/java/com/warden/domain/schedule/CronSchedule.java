package com.warden.domain.schedule;

import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Standard 5-field cron schedule (minute hour day-of-month month day-of-week), minute resolution.
 *
 * Evaluated with Spring's {@link CronExpression}, which expects a leading seconds field:
 * a 5-field expression is pinned to second 0. Macros such as {@code @hourly} are passed through.
 *
 * When both day-of-month and day-of-week are restricted, a day matches if either one does
 * ({@code 0 0 1 * 1} is the 1st of the month and every Monday). Spring requires both, so such
 * an expression is split into a day-of-month half and a day-of-week half and the earlier
 * occurrence wins.
 */
public final class CronSchedule {

  private final String expression;
  private final CronExpression cron;
  private final CronExpression weekdays;

  private CronSchedule(String expression, CronExpression cron, CronExpression weekdays) {
    this.expression = expression;
    this.cron = cron;
    this.weekdays = weekdays;
  }

  public static CronSchedule parse(String expression) {
    if (expression == null || expression.isBlank()) {
      throw new InvalidScheduleException(String.valueOf(expression), null);
    }
    String trimmed = expression.trim();
    try {
      if (trimmed.startsWith("@")) {
        return new CronSchedule(trimmed, CronExpression.parse(trimmed), null);
      }
      String[] f = trimmed.split("\\s+");
      if (f.length != 5) {
        throw new InvalidScheduleException(expression, null);
      }
      if (restricted(f[2]) && restricted(f[4])) {
        CronExpression monthDays = CronExpression.parse(String.join(" ", "0", f[0], f[1], f[2], f[3], "*"));
        CronExpression weekdays = CronExpression.parse(String.join(" ", "0", f[0], f[1], "*", f[3], f[4]));
        return new CronSchedule(trimmed, monthDays, weekdays);
      }
      return new CronSchedule(trimmed, CronExpression.parse("0 " + String.join(" ", f)), null);
    } catch (IllegalArgumentException e) {
      throw new InvalidScheduleException(expression, e);
    }
  }

  /** A day field that starts with an asterisk (steps included) or is {@code ?} matches every day. */
  private static boolean restricted(String dayField) {
    return !(dayField.startsWith("*") || dayField.equals("?"));
  }

  public static boolean isValid(String expression) {
    try {
      parse(expression);
      return true;
    } catch (InvalidScheduleException e) {
      return false;
    }
  }

  /**
   * First occurrence strictly after {@code after}, evaluated in {@code zone}.
   * Returns null when the expression never fires again (e.g. Feb 30).
   */
  public Instant nextAfter(Instant after, ZoneId zone) {
    Objects.requireNonNull(after, "after");
    Objects.requireNonNull(zone, "zone");
    ZonedDateTime start = after.atZone(zone);
    ZonedDateTime next = cron.next(start);
    if (weekdays != null) {
      ZonedDateTime other = weekdays.next(start);
      if (next == null || (other != null && other.isBefore(next))) next = other;
    }
    return next == null ? null : next.toInstant();
  }

  public String expression() {
    return expression;
  }

  @Override
  public String toString() {
    return expression;
  }
}
