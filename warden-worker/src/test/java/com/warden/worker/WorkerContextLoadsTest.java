package com.warden.worker;

import com.warden.worker.execution.ExecutionProvider;
import com.warden.worker.execution.ProcessExecutionProvider;
import com.warden.worker.sync.IntegrationSync;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
    "warden.worker.api-url=http://localhost:1",
    "warden.worker.poll-interval=1h",
    "warden.worker.concurrency=2"
})
class WorkerContextLoadsTest {

  @Autowired
  ApplicationContext context;

  @Test
  void processProviderIsTheDefaultAndSyncIsOff() {
    assertThat(context.getBean(ExecutionProvider.class)).isInstanceOf(ProcessExecutionProvider.class);
    assertThat(context.getBeansOfType(IntegrationSync.class)).isEmpty();
  }
}
