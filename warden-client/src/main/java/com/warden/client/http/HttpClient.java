package com.warden.client.http;

import okhttp3.*;

import java.io.IOException;
import java.time.Duration;

/**
 * Thin OkHttp wrapper for JSON calls against Warden and the integration catalog.
 * Status handling is left to callers: 204 and 404 carry meaning for the dispatch protocol.
 */
public class HttpClient {

  public static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  /** Status code plus body text (empty when the response had none). */
  public record Reply(int code, String body) {

    public boolean isSuccessful() {
      return code >= 200 && code < 300;
    }

    public IOException toException(String method, String url) {
      return new IOException(method + " " + url + " => HTTP " + code + (body.isEmpty() ? "" : " " + body));
    }
  }

  private final OkHttpClient client;

  public HttpClient(Duration connectTimeout, Duration readTimeout) {
    this(new OkHttpClient.Builder()
        .connectTimeout(connectTimeout)
        .readTimeout(readTimeout)
        .build());
  }

  public HttpClient(OkHttpClient client) {
    this.client = client;
  }

  public Reply get(String url, Headers headers) throws IOException {
    Request req = new Request.Builder()
        .url(url)
        .headers(headers)
        .get()
        .build();
    return execute(req);
  }

  public Reply post(String url, String json, Headers headers) throws IOException {
    Request req = new Request.Builder()
        .url(url)
        .headers(headers)
        .post(RequestBody.create(json, JSON))
        .build();
    return execute(req);
  }

  /** GET that treats anything but 2xx as a failure. */
  public String getOk(String url, Headers headers) throws IOException {
    Reply reply = get(url, headers);
    if (!reply.isSuccessful()) throw reply.toException("GET", url);
    return reply.body();
  }

  private Reply execute(Request req) throws IOException {
    try (Response resp = client.newCall(req).execute()) {
      ResponseBody body = resp.body();
      return new Reply(resp.code(), body != null ? body.string() : "");
    }
  }
}
