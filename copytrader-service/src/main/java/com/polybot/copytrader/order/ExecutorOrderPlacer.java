package com.polybot.copytrader.order;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Live orders go to the executor service, which owns the signing key and talks to the CLOB.
 */
@Slf4j
public class ExecutorOrderPlacer implements OrderPlacer {

  static final String LIMIT_ORDER_PATH = "/api/polymarket/orders/limit";
  private static final Duration HTTP_TIMEOUT = Duration.ofSeconds(10);

  private final URI endpoint;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;

  public ExecutorOrderPlacer(@NonNull String executorBaseUrl, @NonNull HttpClient httpClient,
                             @NonNull ObjectMapper objectMapper) {
    String base = executorBaseUrl.endsWith("/")
        ? executorBaseUrl.substring(0, executorBaseUrl.length() - 1)
        : executorBaseUrl;
    this.endpoint = URI.create(base + LIMIT_ORDER_PATH);
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
  }

  @Override
  public OrderResult place(@NonNull CopyOrder order) {
    log.info("placing order: {} {} @ {} ({} USDC)", order.side(), String.format("%.2f", order.size()),
        String.format("%.4f", order.price()), String.format("%.2f", order.usdcValue()));
    try {
      HttpRequest request = HttpRequest.newBuilder(endpoint)
          .timeout(HTTP_TIMEOUT)
          .header("Content-Type", "application/json")
          .header("Accept", "application/json")
          .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body(order))))
          .build();
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      if (response.statusCode() < 200 || response.statusCode() >= 300) {
        return failed(order, "HTTP " + response.statusCode() + ": " + response.body());
      }
      String orderId = resolveOrderId(objectMapper.readTree(response.body()));
      log.info("order placed: {}", orderId);
      return OrderResult.submitted(orderId);
    } catch (IOException e) {
      return failed(order, e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return failed(order, "interrupted");
    }
  }

  ObjectNode body(CopyOrder order) {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("tokenId", order.tokenId());
    body.put("side", order.side().name());
    body.put("price", order.price());
    body.put("size", order.size());
    body.put("orderType", "GTC");
    return body;
  }

  static String resolveOrderId(JsonNode response) {
    if (response == null) {
      return "unknown";
    }
    JsonNode clob = response.has("clobResponse") ? response.get("clobResponse") : response;
    if (clob.hasNonNull("orderID")) {
      return clob.get("orderID").asText();
    }
    if (clob.hasNonNull("orderId")) {
      return clob.get("orderId").asText();
    }
    return "unknown";
  }

  private static OrderResult failed(CopyOrder order, String message) {
    OrderResult result = OrderResult.failed(message);
    switch (result.failureKind()) {
      case INSUFFICIENT_BALANCE -> log.error("insufficient balance (need ~${} USDC)",
          String.format("%.2f", order.usdcValue()));
      case INSUFFICIENT_ALLOWANCE -> log.error("insufficient USDC allowance for the exchange contract");
      default -> log.error("order failed: {}", message);
    }
    return result;
  }
}
