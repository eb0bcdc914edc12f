package com.warden.worker.engine;

import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.TriggerContext;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Fixed delay plus up to 50% random jitter, measured from the end of the previous run.
 * The first run fires immediately.
 */
public class JitteredDelayTrigger implements Trigger {

  private final Duration base;
  private final DoubleSupplier random;

  public JitteredDelayTrigger(Duration base) {
    this(base, () -> ThreadLocalRandom.current().nextDouble());
  }

  /** @param random values in [0, 1) */
  public JitteredDelayTrigger(Duration base, DoubleSupplier random) {
    this.base = base;
    this.random = random;
  }

  @Override
  public Instant nextExecution(TriggerContext ctx) {
    Instant last = ctx.lastCompletion();
    if (last == null) {
      return ctx.getClock().instant();
    }
    long jitterMs = (long) (base.toMillis() * 0.5 * random.getAsDouble());
    return last.plus(base).plusMillis(jitterMs);
  }
}
