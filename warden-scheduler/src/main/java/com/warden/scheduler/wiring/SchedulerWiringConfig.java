package com.warden.scheduler.wiring;

import com.warden.client.DispatchClient;
import com.warden.client.HttpDispatchClient;
import com.warden.client.http.HttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class SchedulerWiringConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public DispatchClient dispatchClient(SchedulerProperties props) {
    HttpClient http = new HttpClient(props.httpTimeout(), props.httpTimeout());
    return new HttpDispatchClient(props.apiUrl(), http);
  }
}
