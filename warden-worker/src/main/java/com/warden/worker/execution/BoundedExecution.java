package com.warden.worker.execution;

import org.slf4j.MDC;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one integration call on a dedicated daemon thread and stops waiting at the deadline.
 * The caller's MDC is carried over to that thread.
 *
 * On timeout the thread is interrupted and abandoned: work that ignores interrupts keeps running
 * in the background, but the caller moves on.
 */
public final class BoundedExecution {

  private static final AtomicInteger SEQ = new AtomicInteger();

  private BoundedExecution() {}

  public static <T> T call(String integration, Duration timeout, Callable<T> work) throws ExecutionFailure {
    ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
      Thread t = new Thread(r, "warden-exec-" + integration + "-" + SEQ.incrementAndGet());
      t.setDaemon(true);
      return t;
    });
    Map<String, String> mdc = MDC.getCopyOfContextMap();
    Future<T> future = executor.submit(() -> {
      if (mdc != null) MDC.setContextMap(mdc);
      try {
        return work.call();
      } finally {
        MDC.clear();
      }
    });
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new ExecutionTimeoutException(integration, timeout);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new ExecutionFailure("Interrupted while running integration '" + integration + "'", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof ExecutionFailure failure) throw failure;
      String msg = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
      throw new ExecutionFailure(msg, cause);
    } finally {
      executor.shutdownNow();
    }
  }
}
