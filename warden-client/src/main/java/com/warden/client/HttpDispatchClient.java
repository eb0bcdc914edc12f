package com.warden.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.warden.client.http.HttpClient;
import com.warden.domain.job.JobStatus;
import okhttp3.Headers;
import okhttp3.HttpUrl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public class HttpDispatchClient implements DispatchClient {

  private static final Logger log = LoggerFactory.getLogger(HttpDispatchClient.class);

  private static final TypeReference<List<ScheduledDeployment>> DEPLOYMENT_LIST = new TypeReference<>() {};

  private final HttpUrl baseUrl;
  private final HttpClient http;
  private final ObjectMapper mapper;
  private final Headers headers;

  public HttpDispatchClient(String baseUrl, HttpClient http) {
    this(baseUrl, http, DispatchJson.newMapper());
  }

  public HttpDispatchClient(String baseUrl, HttpClient http, ObjectMapper mapper) {
    HttpUrl parsed = HttpUrl.parse(Objects.requireNonNull(baseUrl, "baseUrl"));
    if (parsed == null) throw new IllegalArgumentException("Invalid base url: " + baseUrl);
    this.baseUrl = parsed;
    this.http = http;
    this.mapper = mapper;
    this.headers = new Headers.Builder().add("Accept", "application/json").build();
  }

  @Override
  public List<ScheduledDeployment> scheduledDeployments() throws IOException {
    String url = url("deployments", "scheduled").toString();
    return mapper.readValue(http.getOk(url, headers), DEPLOYMENT_LIST);
  }

  @Override
  public long enqueue(long deploymentId) throws IOException {
    String url = url("jobs").toString();
    ObjectNode body = mapper.createObjectNode().put("deployment_id", deploymentId);
    HttpClient.Reply reply = http.post(url, mapper.writeValueAsString(body), headers);
    if (reply.code() != 201 && reply.code() != 200) throw reply.toException("POST", url);
    return mapper.readTree(reply.body()).path("id").asLong();
  }

  @Override
  public Optional<ClaimedJob> claimNext(String queue) throws IOException {
    String url = url("jobs", "next").newBuilder().addQueryParameter("queue", queue).build().toString();
    HttpClient.Reply reply = http.get(url, headers);
    if (reply.code() == 204) return Optional.empty();
    if (reply.code() != 200) throw reply.toException("GET", url);
    return Optional.of(mapper.readValue(reply.body(), ClaimedJob.class));
  }

  @Override
  public void complete(long jobId, JobStatus status, JsonNode result) throws IOException {
    String url = url("jobs", Long.toString(jobId), "complete").toString();
    ObjectNode body = mapper.createObjectNode().put("status", status.wire());
    body.set("result", result);
    HttpClient.Reply reply = http.post(url, mapper.writeValueAsString(body), headers);
    if (!reply.isSuccessful()) throw reply.toException("POST", url);
    log.debug("Reported job {} as {}", jobId, status);
  }

  @Override
  public void reportViolation(long jobId, ViolationReport violation) throws IOException {
    String url = url("jobs", Long.toString(jobId), "violations").toString();
    HttpClient.Reply reply = http.post(url, mapper.writeValueAsString(violation), headers);
    if (!reply.isSuccessful()) throw reply.toException("POST", url);
  }

  private HttpUrl url(String... segments) {
    HttpUrl.Builder b = baseUrl.newBuilder();
    for (String s : segments) b.addPathSegment(s);
    return b.build();
  }
}
