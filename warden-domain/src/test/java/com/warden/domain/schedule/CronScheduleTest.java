package com.warden.domain.schedule;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CronScheduleTest {

  private static final ZoneId UTC = ZoneOffset.UTC;

  @Test
  void hourlyFiresAtTopOfNextHour() {
    CronSchedule hourly = CronSchedule.parse("0 * * * *");

    assertThat(hourly.nextAfter(Instant.parse("2024-03-01T10:17:42Z"), UTC))
        .isEqualTo(Instant.parse("2024-03-01T11:00:00Z"));
    // strictly after: an exact match advances to the following hour
    assertThat(hourly.nextAfter(Instant.parse("2024-03-01T10:00:00Z"), UTC))
        .isEqualTo(Instant.parse("2024-03-01T11:00:00Z"));
  }

  @Test
  void everyFiveMinutesAndWeekdays() {
    assertThat(CronSchedule.parse("*/5 * * * *").nextAfter(Instant.parse("2024-03-01T10:02:00Z"), UTC))
        .isEqualTo(Instant.parse("2024-03-01T10:05:00Z"));

    // 2024-03-01 is a Friday
    assertThat(CronSchedule.parse("30 9 * * MON-FRI").nextAfter(Instant.parse("2024-03-01T10:00:00Z"), UTC))
        .isEqualTo(Instant.parse("2024-03-04T09:30:00Z"));
  }

  @Test
  void restrictedDayOfMonthAndDayOfWeekMatchEither() {
    CronSchedule firstOrMonday = CronSchedule.parse("0 0 1 * 1");

    // 2025-01-01 is a Wednesday; the next Monday comes before the next 1st
    assertThat(firstOrMonday.nextAfter(Instant.parse("2025-01-01T00:00:00Z"), UTC))
        .isEqualTo(Instant.parse("2025-01-06T00:00:00Z"));
    // Monday 2025-01-27: Saturday 2025-02-01 comes before Monday 2025-02-03
    assertThat(firstOrMonday.nextAfter(Instant.parse("2025-01-27T00:00:00Z"), UTC))
        .isEqualTo(Instant.parse("2025-02-01T00:00:00Z"));
  }

  @Test
  void unrestrictedDayFieldKeepsTheOtherOne() {
    // a star-prefixed day-of-month combines with day-of-week: Mondays on odd days
    assertThat(CronSchedule.parse("0 0 */2 * 1").nextAfter(Instant.parse("2025-01-01T00:00:00Z"), UTC))
        .isEqualTo(Instant.parse("2025-01-13T00:00:00Z"));
    assertThat(CronSchedule.parse("0 0 15 * *").nextAfter(Instant.parse("2025-01-01T00:00:00Z"), UTC))
        .isEqualTo(Instant.parse("2025-01-15T00:00:00Z"));
  }

  @Test
  void zoneShiftsOccurrence() {
    Instant next = CronSchedule.parse("0 9 * * *")
        .nextAfter(Instant.parse("2024-01-10T00:00:00Z"), ZoneId.of("Europe/Berlin"));
    assertThat(next).isEqualTo(Instant.parse("2024-01-10T08:00:00Z"));
  }

  @Test
  void macrosAreAccepted() {
    assertThat(CronSchedule.parse("@daily").nextAfter(Instant.parse("2024-03-01T10:00:00Z"), UTC))
        .isEqualTo(Instant.parse("2024-03-02T00:00:00Z"));
  }

  @Test
  void malformedExpressionsAreRejected() {
    assertThatThrownBy(() -> CronSchedule.parse("not a cron")).isInstanceOf(InvalidScheduleException.class);
    assertThatThrownBy(() -> CronSchedule.parse("0 * * *")).isInstanceOf(InvalidScheduleException.class);
    assertThatThrownBy(() -> CronSchedule.parse("61 * * * *")).isInstanceOf(InvalidScheduleException.class);
    assertThatThrownBy(() -> CronSchedule.parse("  ")).isInstanceOf(InvalidScheduleException.class);
    assertThat(CronSchedule.isValid("0 0 1 * *")).isTrue();
    assertThat(CronSchedule.isValid("0 0 1 * * *")).isFalse();
  }
}
