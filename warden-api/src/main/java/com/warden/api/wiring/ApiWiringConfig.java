package com.warden.api.wiring;

import com.warden.api.catalog.CatalogProperties;
import com.warden.client.http.HttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ApiWiringConfig {

  /** Store timestamps are UTC instants. */
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public HttpClient catalogHttpClient(CatalogProperties props) {
    return new HttpClient(props.timeout(), props.timeout());
  }
}
