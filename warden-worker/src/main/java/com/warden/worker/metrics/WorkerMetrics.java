package com.warden.worker.metrics;

import com.warden.worker.engine.WorkerIdentity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker metrics.
 *
 * Exposes:
 * - warden.worker.jobs.running (gauge, tagged with the worker id)
 * - counters for claimed/done/failed/timed-out jobs
 * - warden.worker.fetch_errors and warden.worker.report_errors for Dispatch API failures
 * - warden.worker.sync.runs / warden.worker.sync.failures
 */
@Component
public class WorkerMetrics {

  private final AtomicInteger running = new AtomicInteger();
  private final Counter claimed;
  private final Counter done;
  private final Counter failed;
  private final Counter timedOut;
  private final Counter fetchErrors;
  private final Counter reportErrors;
  private final Counter syncRuns;
  private final Counter syncFailures;

  public WorkerMetrics(MeterRegistry registry, WorkerIdentity workerIdentity) {
    Gauge.builder("warden.worker.jobs.running", running, AtomicInteger::get)
        .description("Jobs currently executing in this process")
        .tag("worker", workerIdentity.id())
        .register(registry);

    this.claimed = Counter.builder("warden.worker.jobs.claimed")
        .description("Jobs claimed from the queue")
        .register(registry);
    this.done = Counter.builder("warden.worker.jobs.done")
        .description("Jobs that finished successfully")
        .register(registry);
    this.failed = Counter.builder("warden.worker.jobs.failed")
        .description("Jobs whose integration raised an error")
        .register(registry);
    this.timedOut = Counter.builder("warden.worker.jobs.timed_out")
        .description("Jobs stopped at their deadline")
        .register(registry);
    this.fetchErrors = Counter.builder("warden.worker.fetch_errors")
        .description("Failed claim calls")
        .register(registry);
    this.reportErrors = Counter.builder("warden.worker.report_errors")
        .description("Results that could not be reported")
        .register(registry);
    this.syncRuns = Counter.builder("warden.worker.sync.runs")
        .description("Integration checkout refreshes")
        .register(registry);
    this.syncFailures = Counter.builder("warden.worker.sync.failures")
        .description("Integration checkout refreshes that failed")
        .register(registry);
  }

  public void jobStarted() { running.incrementAndGet(); }
  public void jobEnded() { running.decrementAndGet(); }

  public void incClaimed() { claimed.increment(); }
  public void incDone() { done.increment(); }
  public void incFailed() { failed.increment(); }
  public void incTimedOut() { timedOut.increment(); }
  public void incFetchError() { fetchErrors.increment(); }
  public void incReportError() { reportErrors.increment(); }
  public void incSyncRun() { syncRuns.increment(); }
  public void incSyncFailure() { syncFailures.increment(); }
}
