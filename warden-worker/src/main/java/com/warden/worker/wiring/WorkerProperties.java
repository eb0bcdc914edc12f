package com.warden.worker.wiring;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * @param id           worker id for logs and metric tags; random when blank
 * @param apiUrl       base URL of the Dispatch API
 * @param queue        queue this worker claims from
 * @param pollInterval base delay between iterations of one loop (jitter is added on top)
 * @param concurrency  independent claim/execute loops in this process
 * @param provider     {@code process} (default) or {@code registry}
 */
@ConfigurationProperties(prefix = "warden.worker")
public record WorkerProperties(
    String id,
    String apiUrl,
    String queue,
    Duration pollInterval,
    int concurrency,
    Duration httpTimeout,
    String provider,
    ProcessSettings process,
    SyncSettings sync
) {

  public WorkerProperties {
    if (apiUrl == null || apiUrl.isBlank()) apiUrl = "http://localhost:8080";
    if (queue == null || queue.isBlank()) queue = "default";
    if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) pollInterval = Duration.ofSeconds(60);
    if (concurrency < 1) concurrency = 1;
    if (httpTimeout == null || httpTimeout.isNegative() || httpTimeout.isZero()) httpTimeout = Duration.ofSeconds(30);
    if (provider == null || provider.isBlank()) provider = "process";
    if (process == null) process = new ProcessSettings(null, null);
    if (sync == null) sync = new SyncSettings(false, null, null, null, null);
  }

  /**
   * Process provider settings. Command arguments may use the placeholders
   * {@code {config}}, {@code {result}}, {@code {integration}} and {@code {dir}}.
   *
   * @param integrationsDir directory holding one subdirectory per integration
   */
  public record ProcessSettings(List<String> command, String integrationsDir) {

    public ProcessSettings {
      if (command == null || command.isEmpty()) command = List.of("sh", "run.sh", "{config}", "{result}");
      if (integrationsDir == null || integrationsDir.isBlank()) integrationsDir = "integrations";
    }
  }

  /**
   * Git checkout refresh.
   *
   * @param repoDir        checkout to pull in
   * @param repoUrl        origin used when {@code repoDir} is not yet a checkout
   * @param commandTimeout deadline for each git command
   */
  public record SyncSettings(boolean enabled, String repoDir, String repoUrl, String branch, Duration commandTimeout) {

    public SyncSettings {
      if (repoDir == null || repoDir.isBlank()) repoDir = ".";
      if (branch == null || branch.isBlank()) branch = "main";
      if (commandTimeout == null || commandTimeout.isNegative() || commandTimeout.isZero()) {
        commandTimeout = Duration.ofMinutes(2);
      }
    }
  }
}
