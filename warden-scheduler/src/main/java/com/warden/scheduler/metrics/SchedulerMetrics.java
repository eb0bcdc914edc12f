package com.warden.scheduler.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Scheduler counters:
 * - warden.scheduler.ticks
 * - warden.scheduler.enqueued
 * - warden.scheduler.invalid_schedule
 * - warden.scheduler.errors (fetch and enqueue failures)
 */
@Component
public class SchedulerMetrics {

  private final Counter ticks;
  private final Counter enqueued;
  private final Counter invalidSchedule;
  private final Counter errors;

  public SchedulerMetrics(MeterRegistry registry) {
    this.ticks = Counter.builder("warden.scheduler.ticks")
        .description("Scheduler ticks run")
        .register(registry);
    this.enqueued = Counter.builder("warden.scheduler.enqueued")
        .description("Jobs enqueued for due deployments")
        .register(registry);
    this.invalidSchedule = Counter.builder("warden.scheduler.invalid_schedule")
        .description("Deployments skipped for an unparseable cron expression")
        .register(registry);
    this.errors = Counter.builder("warden.scheduler.errors")
        .description("Dispatch API calls that failed")
        .register(registry);
  }

  public void incTick() {
    ticks.increment();
  }

  public void incEnqueued() {
    enqueued.increment();
  }

  public void incInvalidSchedule() {
    invalidSchedule.increment();
  }

  public void incError() {
    errors.increment();
  }
}
