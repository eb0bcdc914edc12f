package com.warden.worker.engine;

import org.junit.jupiter.api.Test;
import org.springframework.scheduling.support.SimpleTriggerContext;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class JitteredDelayTriggerTest {

  private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");
  private static final Duration BASE = Duration.ofSeconds(60);

  @Test
  void firstRunIsImmediate() {
    SimpleTriggerContext ctx = new SimpleTriggerContext(Clock.fixed(NOW, ZoneOffset.UTC));

    assertThat(new JitteredDelayTrigger(BASE, () -> 0.9).nextExecution(ctx)).isEqualTo(NOW);
  }

  @Test
  void delayIsBasePlusHalfBaseScaledByTheRandomDraw() {
    Instant completed = NOW.plusSeconds(5);
    SimpleTriggerContext ctx = new SimpleTriggerContext(Clock.fixed(NOW, ZoneOffset.UTC));
    ctx.update(NOW, NOW, completed);

    assertThat(new JitteredDelayTrigger(BASE, () -> 0.0).nextExecution(ctx))
        .isEqualTo(completed.plusSeconds(60));
    assertThat(new JitteredDelayTrigger(BASE, () -> 0.5).nextExecution(ctx))
        .isEqualTo(completed.plusSeconds(75));
  }

  @Test
  void jitterStaysBelowHalfTheBase() {
    Instant completed = NOW;
    SimpleTriggerContext ctx = new SimpleTriggerContext(Clock.fixed(NOW, ZoneOffset.UTC));
    ctx.update(NOW, NOW, completed);
    JitteredDelayTrigger trigger = new JitteredDelayTrigger(BASE);

    for (int i = 0; i < 200; i++) {
      Instant next = trigger.nextExecution(ctx);
      assertThat(next).isAfterOrEqualTo(completed.plus(BASE));
      assertThat(next).isBefore(completed.plus(BASE).plusSeconds(30));
    }
  }
}
