package com.warden.worker.execution;

import java.time.Duration;

public class ExecutionTimeoutException extends ExecutionFailure {

  private final String integration;
  private final Duration timeout;

  public ExecutionTimeoutException(String integration, Duration timeout) {
    super("Integration '" + integration + "' timed out after " + timeout.toSeconds() + "s");
    this.integration = integration;
    this.timeout = timeout;
  }

  public String integration() { return integration; }
  public Duration timeout() { return timeout; }
}
