package com.warden.worker.sync;

import com.warden.worker.engine.WorkerIdentity;
import com.warden.worker.metrics.WorkerMetrics;
import com.warden.worker.wiring.WorkerProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class IntegrationSyncTest {

  @TempDir
  Path repo;

  @Test
  void failedRefreshIsContained() {
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    WorkerProperties props = new WorkerProperties("w", null, null, null, 1, null, null, null,
        new WorkerProperties.SyncSettings(true, repo.toString(), null, null, null));
    IntegrationSync sync = new IntegrationSync(props, new WorkerMetrics(registry, new WorkerIdentity(props)));

    assertThat(sync.sync()).isFalse();
    sync.poll();

    assertThat(registry.counter("warden.worker.sync.runs").count()).isEqualTo(2.0);
    assertThat(registry.counter("warden.worker.sync.failures").count()).isEqualTo(2.0);
  }
}
