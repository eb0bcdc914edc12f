package com.warden.scheduler;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;

/**
 * The scheduler starts without reaching the API: the first tick is pushed out of the test's lifetime.
 */
@SpringBootTest(properties = {
    "warden.scheduler.poll-ms=3600000",
    "warden.scheduler.api-url=http://localhost:1"
})
class SchedulerContextLoadsTest {

  @Test
  void contextLoads() {
    // no-op
  }
}
