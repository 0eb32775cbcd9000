package com.polybot.copytrader.polymarket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * JSON GET against the public Polymarket APIs with retry and backoff.
 *
 * HTTP 429 and 5xx responses, timeouts and I/O errors are retried. Other 4xx responses fail immediately.
 */
@Slf4j
public class PolymarketHttpClient {

  private static final String USER_AGENT = "PolybotCopyTrader/1.0";

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final RetryPolicy retryPolicy;
  private final Sleeper sleeper;

  public PolymarketHttpClient(@NonNull HttpClient httpClient, @NonNull ObjectMapper objectMapper,
                              @NonNull RetryPolicy retryPolicy) {
    this(httpClient, objectMapper, retryPolicy, Sleeper.THREAD);
  }

  PolymarketHttpClient(@NonNull HttpClient httpClient, @NonNull ObjectMapper objectMapper,
                       @NonNull RetryPolicy retryPolicy, @NonNull Sleeper sleeper) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.retryPolicy = retryPolicy;
    this.sleeper = sleeper;
  }

  public static URI uri(String baseUrl, String path, Map<String, String> query) {
    String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    if (query == null || query.isEmpty()) {
      return URI.create(base + path);
    }
    String qs = query.entrySet().stream()
        .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
        .collect(Collectors.joining("&"));
    return URI.create(base + path + "?" + qs);
  }

  public JsonNode getJson(@NonNull URI uri) {
    HttpRequest request = HttpRequest.newBuilder(uri)
        .GET()
        .timeout(retryPolicy.requestTimeout())
        .header("Accept", "application/json")
        .header("User-Agent", USER_AGENT)
        .build();

    Duration delay = retryPolicy.initialDelay();
    int lastStatus = -1;
    Exception lastError = null;
    int maxAttempts = retryPolicy.maxAttempts();
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      log.debug("GET {} (attempt {}/{})", uri, attempt, maxAttempts);
      try {
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        lastStatus = response.statusCode();
        lastError = null;
        if (lastStatus >= 200 && lastStatus < 300) {
          return objectMapper.readTree(response.body());
        }
        if (lastStatus == 429) {
          log.warn("rate limited by {}, retrying in {} ms", uri.getHost(), delay.toMillis());
        } else if (lastStatus >= 500) {
          log.warn("{} returned HTTP {} (attempt {}/{})", uri.getHost(), lastStatus, attempt, maxAttempts);
        } else {
          throw new PolymarketApiException("GET " + uri.getPath() + " failed: HTTP " + lastStatus, lastStatus);
        }
      } catch (JsonProcessingException e) {
        throw new PolymarketApiException("GET " + uri.getPath() + " returned invalid JSON", e);
      } catch (IOException e) {
        lastError = e;
        lastStatus = -1;
        log.warn("GET {} failed (attempt {}/{}): {}", uri.getPath(), attempt, maxAttempts, e.toString());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new PolymarketApiException("interrupted while calling " + uri.getPath(), e);
      }

      if (attempt < maxAttempts) {
        pause(delay, uri);
        delay = retryPolicy.next(delay);
      }
    }

    if (lastError != null) {
      throw new PolymarketApiException("GET " + uri.getPath() + " failed after " + maxAttempts + " attempts", lastError);
    }
    throw new PolymarketApiException("GET " + uri.getPath() + " failed after " + maxAttempts
        + " attempts: HTTP " + lastStatus, lastStatus);
  }

  private void pause(Duration delay, URI uri) {
    try {
      sleeper.sleep(delay);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PolymarketApiException("interrupted while backing off from " + uri.getPath(), e);
    }
  }

  private static String encode(String value) {
    return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
  }

  @FunctionalInterface
  interface Sleeper {
    Sleeper THREAD = d -> Thread.sleep(d.toMillis());

    void sleep(Duration duration) throws InterruptedException;
  }
}
