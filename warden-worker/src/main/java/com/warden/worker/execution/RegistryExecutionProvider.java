package com.warden.worker.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.warden.client.DispatchClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs {@link IntegrationRunner} beans in-process, looked up by name.
 */
public class RegistryExecutionProvider implements ExecutionProvider {

  private static final Logger log = LoggerFactory.getLogger(RegistryExecutionProvider.class);

  private final Map<String, IntegrationRunner> runners = new LinkedHashMap<>();
  private final DispatchClient dispatch;

  public RegistryExecutionProvider(List<IntegrationRunner> runners, DispatchClient dispatch) {
    for (IntegrationRunner r : runners) {
      IntegrationRunner prev = this.runners.putIfAbsent(r.name(), r);
      if (prev != null) {
        throw new IllegalStateException("Two runners registered for integration '" + r.name() + "': "
            + prev.getClass().getName() + ", " + r.getClass().getName());
      }
    }
    this.dispatch = dispatch;
    if (this.runners.isEmpty()) {
      log.warn("[EXEC] Registry provider has no IntegrationRunner beans; every claimed job will fail as not found");
    } else {
      log.info("[EXEC] Registry provider serving {}", this.runners.keySet());
    }
  }

  public Set<String> integrations() {
    return runners.keySet();
  }

  @Override
  public JsonNode execute(String integration, JsonNode config, Duration timeout) throws ExecutionFailure {
    IntegrationRunner runner = runners.get(integration);
    if (runner == null) {
      throw new ExecutionFailure("Integration '" + integration + "' not found");
    }
    JsonNode result;
    try {
      result = runner.run(new IntegrationContext(integration, config, dispatch));
    } catch (ExecutionFailure e) {
      throw e;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ExecutionFailure("Integration '" + integration + "' was interrupted", e);
    } catch (Exception e) {
      String msg = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
      throw new ExecutionFailure(msg, e);
    }
    return result == null ? JsonNodeFactory.instance.objectNode() : result;
  }
}
