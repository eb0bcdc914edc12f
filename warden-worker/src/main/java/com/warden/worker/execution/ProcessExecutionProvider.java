package com.warden.worker.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Runs an integration as a child process inside its directory under {@code integrationsDir}.
 *
 * Contract with the child:
 * - the config is written as JSON to the file passed as {@code {config}}
 * - the child writes its JSON result to the file passed as {@code {result}}
 * - exit code 0 means success; anything else fails the job with the tail of the output
 *
 * {@code WARDEN_API_URL} and {@code WARDEN_INTEGRATION} are exported so the child can report violations.
 */
public class ProcessExecutionProvider implements ExecutionProvider {

  private static final Logger log = LoggerFactory.getLogger(ProcessExecutionProvider.class);

  private final Path integrationsDir;
  private final List<String> command;
  private final String apiUrl;
  private final ObjectMapper mapper;

  public ProcessExecutionProvider(Path integrationsDir, List<String> command, String apiUrl, ObjectMapper mapper) {
    this.integrationsDir = integrationsDir.toAbsolutePath().normalize();
    this.command = List.copyOf(command);
    this.apiUrl = apiUrl;
    this.mapper = mapper;
  }

  @Override
  public JsonNode execute(String integration, JsonNode config, Duration timeout) throws ExecutionFailure {
    Path dir = integrationsDir.resolve(integration).normalize();
    if (!dir.startsWith(integrationsDir) || dir.equals(integrationsDir) || !Files.isDirectory(dir)) {
      throw new ExecutionFailure("Integration '" + integration + "' not found at " + dir);
    }

    Path configFile = null;
    Path resultFile = null;
    try {
      configFile = Files.createTempFile("warden-config-", ".json");
      resultFile = Files.createTempFile("warden-result-", ".json");
      mapper.writeValue(configFile.toFile(), config);

      List<String> argv = expand(integration, dir, configFile, resultFile);
      log.info("[EXEC] action=START integration={} command={}", integration, argv);
      ChildProcess.Result run = ChildProcess.run(argv, dir,
          Map.of("WARDEN_API_URL", apiUrl, "WARDEN_INTEGRATION", integration), timeout);

      if (!run.succeeded()) {
        throw new ExecutionFailure("Integration '" + integration + "' exited with code " + run.exitCode()
            + (run.output().isEmpty() ? "" : ": " + run.output()));
      }
      if (Files.size(resultFile) == 0) {
        throw new ExecutionFailure("Integration '" + integration + "' exited without writing a result");
      }
      return mapper.readTree(resultFile.toFile());
    } catch (TimeoutException e) {
      throw new ExecutionTimeoutException(integration, timeout);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ExecutionFailure("Interrupted while running integration '" + integration + "'", e);
    } catch (IOException e) {
      throw new ExecutionFailure("Failed to run integration '" + integration + "': " + e.getMessage(), e);
    } finally {
      cleanup(configFile);
      cleanup(resultFile);
    }
  }

  private List<String> expand(String integration, Path dir, Path configFile, Path resultFile) {
    List<String> argv = new ArrayList<>(command.size());
    for (String arg : command) {
      argv.add(arg
          .replace("{config}", configFile.toString())
          .replace("{result}", resultFile.toString())
          .replace("{integration}", integration)
          .replace("{dir}", dir.toString()));
    }
    return argv;
  }

  private static void cleanup(Path file) {
    if (file == null) return;
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      log.warn("[EXEC] Could not delete temp file {}: {}", file, e.getMessage());
    }
  }
}
