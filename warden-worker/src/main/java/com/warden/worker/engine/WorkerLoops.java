package com.warden.worker.engine;

import com.warden.worker.sync.IntegrationSync;
import com.warden.worker.wiring.WorkerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Registers {@code concurrency} independent worker loops. Each loop is a trigger task, so an iteration
 * never overlaps the previous one of the same loop.
 *
 * When integration sync is enabled, the first refresh runs to completion before any loop is registered.
 */
@Component
public class WorkerLoops implements SchedulingConfigurer {

  private static final Logger log = LoggerFactory.getLogger(WorkerLoops.class);

  private final JobWorker worker;
  private final ThreadPoolTaskScheduler scheduler;
  private final WorkerProperties props;
  private final String workerId;
  private final Optional<IntegrationSync> sync;

  public WorkerLoops(JobWorker worker, ThreadPoolTaskScheduler workerTaskScheduler, WorkerProperties props,
                     WorkerIdentity identity, Optional<IntegrationSync> sync) {
    this.worker = worker;
    this.scheduler = workerTaskScheduler;
    this.props = props;
    this.workerId = identity.id();
    this.sync = sync;
  }

  @Override
  public void configureTasks(ScheduledTaskRegistrar registrar) {
    sync.ifPresent(s -> {
      log.info("[WORKER] Initial integration sync before polling");
      s.sync();
    });

    registrar.setScheduler(scheduler);
    for (int i = 0; i < props.concurrency(); i++) {
      registrar.addTriggerTask(worker::runOnce, new JitteredDelayTrigger(props.pollInterval()));
    }
    log.info("[WORKER] id={} queue={} loops={} interval={}s provider={}",
        workerId, props.queue(), props.concurrency(), props.pollInterval().toSeconds(), props.provider());
  }
}
