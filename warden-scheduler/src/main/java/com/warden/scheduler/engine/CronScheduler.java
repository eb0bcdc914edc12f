package com.warden.scheduler.engine;

import com.warden.client.DispatchClient;
import com.warden.client.ScheduledDeployment;
import com.warden.domain.schedule.InvalidScheduleException;
import com.warden.scheduler.metrics.SchedulerMetrics;
import com.warden.scheduler.wiring.SchedulerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

/**
 * Periodic cron evaluation:
 * - fetches enabled, scheduled deployments from the Dispatch API
 * - enqueues a job for each one that is due
 *
 * A failing fetch ends the tick; a bad schedule or a failing enqueue only skips that deployment.
 */
@Component
public class CronScheduler {

  private static final Logger log = LoggerFactory.getLogger(CronScheduler.class);

  private final DispatchClient dispatch;
  private final Clock clock;
  private final ZoneId zone;
  private final SchedulerMetrics metrics;

  public CronScheduler(DispatchClient dispatch, Clock clock, SchedulerProperties props, SchedulerMetrics metrics) {
    this.dispatch = dispatch;
    this.clock = clock;
    this.zone = props.zone();
    this.metrics = metrics;
  }

  @Scheduled(fixedDelayString = "${warden.scheduler.poll-ms:30000}")
  public void poll() {
    tick();
  }

  /** @return number of jobs enqueued on this tick */
  public int tick() {
    metrics.incTick();
    Instant now = clock.instant();

    List<ScheduledDeployment> deployments;
    try {
      deployments = dispatch.scheduledDeployments();
    } catch (IOException e) {
      metrics.incError();
      log.error("[SCHEDULER] Failed to fetch scheduled deployments: {}", e.getMessage());
      return 0;
    }
    log.debug("[SCHEDULER] Received {} scheduled deployments", deployments.size());

    int fired = 0;
    for (ScheduledDeployment d : deployments) {
      MDC.put("deploymentId", Long.toString(d.id()));
      try {
        if (!DueCheck.shouldFire(d.schedule(), d.lastScheduledAt(), now, zone)) continue;
        long jobId = dispatch.enqueue(d.id());
        metrics.incEnqueued();
        fired++;
        log.info("[SCHEDULER] action=ENQUEUE deploymentId={} jobId={} schedule='{}' last={}",
            d.id(), jobId, d.schedule(), d.lastScheduledAt());
      } catch (InvalidScheduleException e) {
        metrics.incInvalidSchedule();
        log.warn("[SCHEDULER] Skipping deployment {}: {}", d.id(), e.getMessage());
      } catch (IOException e) {
        metrics.incError();
        log.error("[SCHEDULER] Failed to enqueue deployment {}: {}", d.id(), e.getMessage());
      } finally {
        MDC.remove("deploymentId");
      }
    }
    return fired;
  }
}
