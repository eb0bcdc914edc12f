package com.warden.api.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.api.common.ApiExceptionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;

/**
 * Security configuration for the Warden API.
 *
 * - Stateless, no sessions, no CSRF
 * - Dispatch routes (scheduler and workers) and health are public
 * - Everything else requires the management bearer token
 */
@Configuration
public class SecurityConfig {

  private static final Logger log = LoggerFactory.getLogger(SecurityConfig.class);

  static final String[] DISPATCH_PATHS = {
      "/deployments/scheduled",
      "/api/deployments/scheduled",
      "/jobs",
      "/jobs/**"
  };

  @Bean
  SecurityFilterChain apiChain(HttpSecurity http, ApiProperties props, ObjectMapper mapper) throws Exception {
    if (!props.hasToken()) {
      log.warn("warden.api.token is not set: management endpoints will reject every request");
    }
    return http
        .csrf(csrf -> csrf.disable())
        .httpBasic(b -> b.disable())
        .formLogin(f -> f.disable())
        .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .addFilterBefore(new ManagementTokenFilter(props), AnonymousAuthenticationFilter.class)
        .authorizeHttpRequests(auth -> auth
            .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
            .requestMatchers("/actuator/health", "/actuator/health/**", "/error").permitAll()
            .requestMatchers(DISPATCH_PATHS).permitAll()
            .anyRequest().hasRole(ManagementTokenFilter.ROLE)
        )
        .exceptionHandling(ex -> ex.authenticationEntryPoint(unauthorized(mapper)))
        .build();
  }

  private static AuthenticationEntryPoint unauthorized(ObjectMapper mapper) {
    return (request, response, authException) -> {
      Object reason = request.getAttribute(ManagementTokenFilter.ATTR_AUTH_ERROR);
      String message = reason == null ? ManagementTokenFilter.MISSING : reason.toString();
      response.setStatus(401);
      response.setContentType(MediaType.APPLICATION_JSON_VALUE);
      mapper.writeValue(response.getOutputStream(), ApiExceptionHandler.errorBody("unauthorized", message));
    };
  }
}
