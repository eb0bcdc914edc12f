package com.warden.worker.execution;

/**
 * An integration could not produce a result. The message ends up in the job's error payload.
 */
public class ExecutionFailure extends Exception {

  public ExecutionFailure(String message) {
    super(message);
  }

  public ExecutionFailure(String message, Throwable cause) {
    super(message, cause);
  }
}
