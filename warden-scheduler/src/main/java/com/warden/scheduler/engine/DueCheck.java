package com.warden.scheduler.engine;

import com.warden.domain.schedule.CronSchedule;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Decides whether a recurring deployment fires on this tick.
 *
 * Never scheduled: due. Otherwise due once {@code now} reaches the first occurrence after the last fire.
 * Fires are stamped with "now", so occurrences missed while down collapse into one.
 */
public final class DueCheck {

  private DueCheck() {}

  /**
   * @throws com.warden.domain.schedule.InvalidScheduleException if {@code schedule} does not parse
   */
  public static boolean shouldFire(String schedule, Instant lastScheduledAt, Instant now, ZoneId zone) {
    CronSchedule cron = CronSchedule.parse(schedule);
    if (lastScheduledAt == null) return true;
    Instant next = cron.nextAfter(lastScheduledAt, zone);
    return next != null && !now.isBefore(next);
  }
}
