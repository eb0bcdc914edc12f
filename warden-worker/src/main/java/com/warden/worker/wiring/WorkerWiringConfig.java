package com.warden.worker.wiring;

import com.warden.client.DispatchClient;
import com.warden.client.DispatchJson;
import com.warden.client.HttpDispatchClient;
import com.warden.client.http.HttpClient;
import com.warden.worker.execution.ExecutionProvider;
import com.warden.worker.execution.IntegrationRunner;
import com.warden.worker.execution.ProcessExecutionProvider;
import com.warden.worker.execution.RegistryExecutionProvider;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.nio.file.Path;

@Configuration
public class WorkerWiringConfig {

  @Bean
  public DispatchClient dispatchClient(WorkerProperties props) {
    HttpClient http = new HttpClient(props.httpTimeout(), props.httpTimeout());
    return new HttpDispatchClient(props.apiUrl(), http);
  }

  /** One thread per worker loop plus one for the integration sync. */
  @Bean
  public ThreadPoolTaskScheduler workerTaskScheduler(WorkerProperties props) {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(props.concurrency() + 1);
    scheduler.setThreadNamePrefix("warden-worker-");
    scheduler.setWaitForTasksToCompleteOnShutdown(false);
    return scheduler;
  }

  @Bean
  @ConditionalOnProperty(prefix = "warden.worker", name = "provider", havingValue = "registry")
  public ExecutionProvider registryExecutionProvider(ObjectProvider<IntegrationRunner> runners, DispatchClient dispatch) {
    return new RegistryExecutionProvider(runners.orderedStream().toList(), dispatch);
  }

  @Bean
  @ConditionalOnProperty(prefix = "warden.worker", name = "provider", havingValue = "process", matchIfMissing = true)
  public ExecutionProvider processExecutionProvider(WorkerProperties props) {
    WorkerProperties.ProcessSettings process = props.process();
    return new ProcessExecutionProvider(Path.of(process.integrationsDir()), process.command(), props.apiUrl(),
        DispatchJson.newMapper());
  }
}
