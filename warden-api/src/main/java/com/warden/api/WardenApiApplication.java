package com.warden.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.warden")
@EnableJpaRepositories(basePackages = "com.warden.infrastructure")
@EntityScan(basePackages = "com.warden.infrastructure")
@ConfigurationPropertiesScan(basePackages = "com.warden.api")
public class WardenApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(WardenApiApplication.class, args);
  }
}
