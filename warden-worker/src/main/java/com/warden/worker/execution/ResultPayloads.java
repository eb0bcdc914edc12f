package com.warden.worker.execution;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;

/** Result bodies reported for failed jobs. */
public final class ResultPayloads {

  private ResultPayloads() {}

  public static ObjectNode timeout(String integration, Duration timeout) {
    ObjectNode n = JsonNodeFactory.instance.objectNode();
    n.put("error", "timeout");
    n.put("message", "Integration '" + integration + "' timed out after " + timeout.toSeconds() + "s");
    n.put("timeout_seconds", timeout.toSeconds());
    return n;
  }

  /** {@code {"error": <message>, "trace": <stack trace>}}; the trace is the underlying cause's when there is one. */
  public static ObjectNode failure(ExecutionFailure failure) {
    Throwable source = failure.getCause() != null ? failure.getCause() : failure;
    ObjectNode n = JsonNodeFactory.instance.objectNode();
    n.put("error", failure.getMessage() == null ? failure.getClass().getSimpleName() : failure.getMessage());
    n.put("trace", stackTrace(source));
    return n;
  }

  private static String stackTrace(Throwable t) {
    StringWriter out = new StringWriter();
    t.printStackTrace(new PrintWriter(out));
    return out.toString();
  }
}
