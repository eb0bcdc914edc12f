package com.warden.worker.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessExecutionProviderTest {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final Duration TIMEOUT = Duration.ofSeconds(20);

  @TempDir
  Path integrations;

  private ProcessExecutionProvider provider;

  @BeforeEach
  void setUp() {
    provider = new ProcessExecutionProvider(integrations, List.of("sh", "run.sh", "{config}", "{result}"),
        "http://api.test", MAPPER);
  }

  @Test
  void childReceivesConfigAndWritesTheResult() throws Exception {
    script("echo", "cat \"$1\" > \"$2\"");

    JsonNode result = provider.execute("echo", MAPPER.readTree("{\"bucket\":\"logs\",\"job_id\":4}"), TIMEOUT);

    assertThat(result.path("bucket").asText()).isEqualTo("logs");
    assertThat(result.path("job_id").asLong()).isEqualTo(4L);
  }

  @Test
  void childSeesTheApiUrl() throws Exception {
    script("env", "printf '{\"api\":\"%s\",\"name\":\"%s\"}' \"$WARDEN_API_URL\" \"$WARDEN_INTEGRATION\" > \"$2\"");

    JsonNode result = provider.execute("env", MAPPER.createObjectNode(), TIMEOUT);

    assertThat(result.path("api").asText()).isEqualTo("http://api.test");
    assertThat(result.path("name").asText()).isEqualTo("env");
  }

  @Test
  void nonZeroExitFailsWithTheOutputTail() throws Exception {
    script("boom", "echo 'credentials expired' >&2\nexit 3");

    assertThatThrownBy(() -> provider.execute("boom", MAPPER.createObjectNode(), TIMEOUT))
        .isInstanceOf(ExecutionFailure.class)
        .hasMessageContaining("exited with code 3")
        .hasMessageContaining("credentials expired");
  }

  @Test
  void missingResultFails() throws Exception {
    script("silent", "true");

    assertThatThrownBy(() -> provider.execute("silent", MAPPER.createObjectNode(), TIMEOUT))
        .isInstanceOf(ExecutionFailure.class)
        .hasMessageContaining("without writing a result");
  }

  @Test
  void childIsKilledAtTheDeadline() throws Exception {
    script("hang", "sleep 30");

    long started = System.nanoTime();
    assertThatThrownBy(() -> provider.execute("hang", MAPPER.createObjectNode(), Duration.ofMillis(500)))
        .isInstanceOf(ExecutionTimeoutException.class);

    assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(10));
  }

  @Test
  void unknownOrEscapingIntegrationIsNotFound() {
    assertThatThrownBy(() -> provider.execute("ghost", MAPPER.createObjectNode(), TIMEOUT))
        .isInstanceOf(ExecutionFailure.class)
        .hasMessageContaining("not found");
    assertThatThrownBy(() -> provider.execute("../", MAPPER.createObjectNode(), TIMEOUT))
        .isInstanceOf(ExecutionFailure.class)
        .hasMessageContaining("not found");
  }

  private void script(String integration, String body) throws IOException {
    Path dir = Files.createDirectories(integrations.resolve(integration));
    Files.writeString(dir.resolve("run.sh"), body + "\n");
  }
}
