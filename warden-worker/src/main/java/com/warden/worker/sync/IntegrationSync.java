package com.warden.worker.sync;

import com.warden.worker.execution.ChildProcess;
import com.warden.worker.metrics.WorkerMetrics;
import com.warden.worker.wiring.WorkerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Keeps the local integration checkout current with {@code git pull}, bootstrapping it from
 * {@code repo-url} when the directory is not a checkout yet.
 *
 * The first refresh is run by the worker loops before they start polling; after that it runs on its own
 * schedule, and a failed refresh is logged and leaves the loops alone.
 */
@Component
@ConditionalOnProperty(prefix = "warden.worker.sync", name = "enabled", havingValue = "true")
public class IntegrationSync {

  private static final Logger log = LoggerFactory.getLogger(IntegrationSync.class);

  private final Path repoDir;
  private final String repoUrl;
  private final String branch;
  private final Duration commandTimeout;
  private final WorkerMetrics metrics;

  public IntegrationSync(WorkerProperties props, WorkerMetrics metrics) {
    WorkerProperties.SyncSettings sync = props.sync();
    this.repoDir = Path.of(sync.repoDir()).toAbsolutePath().normalize();
    this.repoUrl = sync.repoUrl();
    this.branch = sync.branch();
    this.commandTimeout = sync.commandTimeout();
    this.metrics = metrics;
  }

  @Scheduled(
      initialDelayString = "${warden.worker.sync.interval-ms:300000}",
      fixedDelayString = "${warden.worker.sync.interval-ms:300000}"
  )
  public void poll() {
    sync();
  }

  /** @return true when the checkout was refreshed */
  public boolean sync() {
    metrics.incSyncRun();
    try {
      if (Files.isDirectory(repoDir.resolve(".git"))) {
        String out = git("pull", "--ff-only");
        log.info("[SYNC] action=PULL dir={} {}", repoDir, out);
      } else {
        bootstrap();
        log.info("[SYNC] action=CLONE dir={} url={} branch={}", repoDir, repoUrl, branch);
      }
      return true;
    } catch (IOException | TimeoutException e) {
      metrics.incSyncFailure();
      log.error("[SYNC] Refresh of {} failed: {}", repoDir, e.getMessage());
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      metrics.incSyncFailure();
      log.warn("[SYNC] Interrupted while refreshing {}", repoDir);
      return false;
    }
  }

  private void bootstrap() throws IOException, InterruptedException, TimeoutException {
    if (repoUrl == null || repoUrl.isBlank()) {
      throw new IOException(repoDir + " is not a git checkout and warden.worker.sync.repo-url is not set");
    }
    Files.createDirectories(repoDir);
    git("init");
    git("remote", "add", "origin", repoUrl);
    git("fetch", "origin");
    git("reset", "--hard", "origin/" + branch);
  }

  private String git(String... args) throws IOException, InterruptedException, TimeoutException {
    List<String> command = new ArrayList<>(args.length + 1);
    command.add("git");
    command.addAll(List.of(args));
    ChildProcess.Result run = ChildProcess.run(command, repoDir, Map.of(), commandTimeout);
    if (!run.succeeded()) {
      throw new IOException(String.join(" ", command) + " failed (exit " + run.exitCode() + "): " + run.output());
    }
    return run.output();
  }
}
