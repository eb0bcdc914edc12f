package com.warden.worker.execution;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;

/**
 * Turns an integration name into a run.
 *
 * Implementations may use {@code timeout} to bound work they hand off (a child process, say);
 * the caller enforces the deadline on the calling thread either way.
 */
public interface ExecutionProvider {

  JsonNode execute(String integration, JsonNode config, Duration timeout) throws ExecutionFailure;
}
