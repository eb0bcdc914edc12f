package com.warden.api.security;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ManagementAuthTest {

  @Autowired MockMvc mvc;

  @Test
  void managementRequiresBearerToken() throws Exception {
    mvc.perform(get("/integrations"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.reason").value("unauthorized"))
        .andExpect(jsonPath("$.message").value("Missing bearer token"));

    mvc.perform(get("/tenants/acme/deployments").header("Authorization", "Basic abc"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.message").value("Missing bearer token"));
  }

  @Test
  void wrongTokenIsRejected() throws Exception {
    mvc.perform(get("/integrations").header("Authorization", "Bearer nope"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.message").value("Invalid token"));
  }

  @Test
  void rightTokenIsAccepted() throws Exception {
    mvc.perform(get("/integrations").header("Authorization", "Bearer test-token"))
        .andExpect(status().isOk());
  }

  @Test
  void dispatchRoutesIgnoreCredentials() throws Exception {
    mvc.perform(get("/deployments/scheduled").header("Authorization", "Bearer nope"))
        .andExpect(status().isOk());
    mvc.perform(get("/actuator/health"))
        .andExpect(status().isOk());
  }
}
