package com.warden.worker.execution;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs an external command with a deadline. Output (stdout and stderr merged) goes to a temp file so a chatty
 * child cannot block on a full pipe; the child and its descendants are killed if it outlives the deadline
 * or the waiting thread is interrupted.
 */
public final class ChildProcess {

  private static final int OUTPUT_TAIL_CHARS = 2000;

  /** @param output last part of the merged output */
  public record Result(int exitCode, String output) {

    public boolean succeeded() {
      return exitCode == 0;
    }
  }

  private ChildProcess() {}

  public static Result run(List<String> command, Path dir, Map<String, String> env, Duration timeout)
      throws IOException, InterruptedException, TimeoutException {
    Path outputFile = Files.createTempFile("warden-output-", ".log");
    Process process = null;
    try {
      ProcessBuilder pb = new ProcessBuilder(command)
          .directory(dir.toFile())
          .redirectErrorStream(true)
          .redirectOutput(outputFile.toFile());
      pb.environment().putAll(env);
      process = pb.start();

      if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        throw new TimeoutException(String.join(" ", command) + " still running after " + timeout.toSeconds() + "s");
      }
      return new Result(process.exitValue(), tail(outputFile));
    } finally {
      if (process != null && process.isAlive()) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
      }
      Files.deleteIfExists(outputFile);
    }
  }

  private static String tail(Path file) throws IOException {
    String text = Files.readString(file, StandardCharsets.UTF_8).strip();
    return text.length() <= OUTPUT_TAIL_CHARS ? text : text.substring(text.length() - OUTPUT_TAIL_CHARS);
  }
}
