package com.warden.api.dispatch;

import com.warden.api.StoreFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.notNullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Dispatch routes over HTTP, without credentials.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class DispatchControllerTest {

  @Autowired MockMvc mvc;
  @Autowired StoreFixtures fixtures;
  @Autowired DispatchService dispatch;

  private long deploymentId;

  @BeforeEach
  void setUp() {
    fixtures.wipe();
    deploymentId = fixtures.deployment(fixtures.integration("aws-s3"), "default", "0 * * * *");
  }

  @Test
  void enqueueClaimCompleteRoundTrip() throws Exception {
    mvc.perform(post("/jobs").contentType(MediaType.APPLICATION_JSON)
            .content("{\"deployment_id\": " + deploymentId + "}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.id").value(notNullValue()));

    String body = mvc.perform(get("/jobs/next").param("queue", "default"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("in-progress"))
        .andExpect(jsonPath("$.integration_name").value("aws-s3"))
        .andExpect(jsonPath("$.deployment_id").value(deploymentId))
        .andExpect(jsonPath("$.config.bucket").value("logs"))
        .andExpect(jsonPath("$.started_at").value(notNullValue()))
        .andReturn().getResponse().getContentAsString();
    long jobId = StoreFixtures.json(body).path("id").asLong();

    mvc.perform(get("/jobs/next"))
        .andExpect(status().isNoContent());

    mvc.perform(post("/jobs/" + jobId + "/complete").contentType(MediaType.APPLICATION_JSON)
            .content("{\"status\": \"done\", \"result\": {\"ok\": true}}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.message").value("updated"));

    mvc.perform(get("/jobs/" + jobId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("done"))
        .andExpect(jsonPath("$.result.ok").value(true))
        .andExpect(jsonPath("$.duration_total").value(notNullValue()));
  }

  @Test
  void enqueueValidation() throws Exception {
    mvc.perform(post("/jobs").contentType(MediaType.APPLICATION_JSON).content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.reason").value("validation_error"));

    mvc.perform(post("/jobs").contentType(MediaType.APPLICATION_JSON).content("{\"deployment_id\": 987654}"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.status").value("error"))
        .andExpect(jsonPath("$.reason").value("not_found"));

    mvc.perform(post("/jobs").contentType(MediaType.APPLICATION_JSON).content("{not json"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void completeOfQueuedJobConflicts() throws Exception {
    long jobId = dispatch.enqueue(deploymentId);

    mvc.perform(post("/jobs/" + jobId + "/complete").contentType(MediaType.APPLICATION_JSON)
            .content("{\"status\": \"done\", \"result\": {}}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.reason").value("conflict"));

    mvc.perform(post("/jobs/" + jobId + "/complete").contentType(MediaType.APPLICATION_JSON)
            .content("{\"status\": \"running\"}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void unknownJobIs404() throws Exception {
    mvc.perform(get("/jobs/987654")).andExpect(status().isNotFound());
    mvc.perform(post("/jobs/987654/complete").contentType(MediaType.APPLICATION_JSON)
            .content("{\"status\": \"done\"}"))
        .andExpect(status().isNotFound());
  }

  @Test
  void deleteRequiresABound() throws Exception {
    mvc.perform(delete("/jobs"))
        .andExpect(status().isBadRequest());

    mvc.perform(delete("/jobs").param("before", "2000-01-01"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.deleted").value(0));
  }

  @Test
  void scheduledDeploymentsAreServedOnBothPaths() throws Exception {
    mvc.perform(get("/deployments/scheduled"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(1)))
        .andExpect(jsonPath("$[0].id").value(deploymentId))
        .andExpect(jsonPath("$[0].schedule").value("0 * * * *"))
        .andExpect(jsonPath("$[0].timeout").value(60));

    mvc.perform(get("/api/deployments/scheduled"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(1)));
  }

  @Test
  void violationIsRecorded() throws Exception {
    long jobId = dispatch.enqueue(deploymentId);

    mvc.perform(post("/jobs/" + jobId + "/violations").contentType(MediaType.APPLICATION_JSON)
            .content("""
                {"task_name": "check-mfa", "control_references": [{"id": "AC-2"}], "output": {"users": 2},
                 "severity": "high", "timestamp": "2024-02-01T10:00:00Z"}
                """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.message").value("ok"));

    mvc.perform(post("/jobs/" + jobId + "/violations").contentType(MediaType.APPLICATION_JSON)
            .content("{\"control_references\": [], \"output\": {}}"))
        .andExpect(status().isBadRequest());

    mvc.perform(post("/jobs/987654/violations").contentType(MediaType.APPLICATION_JSON)
            .content("{\"task_name\": \"x\", \"control_references\": [], \"output\": {}}"))
        .andExpect(status().isNotFound());
  }
}
