package com.polybot.copytrader.polymarket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Market state from the Gamma API: whether a market has closed and what its outcomes are priced at.
 */
@Slf4j
public class GammaMarketClient {

  private final String gammaUrl;
  private final PolymarketHttpClient http;
  private final ObjectMapper objectMapper;

  public GammaMarketClient(@NonNull String gammaUrl, @NonNull PolymarketHttpClient http,
                           @NonNull ObjectMapper objectMapper) {
    this.gammaUrl = gammaUrl;
    this.http = http;
    this.objectMapper = objectMapper;
  }

  public Optional<GammaMarket> market(@NonNull String conditionId) {
    JsonNode body = http.getJson(PolymarketHttpClient.uri(gammaUrl, "/markets", Map.of("condition_ids", conditionId)));
    JsonNode first = body != null && body.isArray() && body.size() > 0 ? body.get(0) : body;
    if (first == null || first.isMissingNode() || first.isNull() || first.isArray()) {
      return Optional.empty();
    }
    return Optional.of(parseMarket(first, objectMapper));
  }

  public static GammaMarket parseMarket(JsonNode market, ObjectMapper objectMapper) {
    List<String> outcomes = parseStringArray(market.path("outcomes"), objectMapper);
    List<Double> prices = new ArrayList<>();
    for (String raw : parseStringArray(market.path("outcomePrices"), objectMapper)) {
      try {
        prices.add(Double.parseDouble(raw));
      } catch (NumberFormatException e) {
        prices.add(Double.NaN);
      }
    }
    return new GammaMarket(
        market.path("conditionId").asText(""),
        market.path("question").asText(""),
        market.path("closed").asBoolean(false),
        outcomes,
        prices,
        parseInstant(market.path("closedTime").asText(null)),
        parseInstant(market.path("endDate").asText(null))
    );
  }

  /**
   * Gamma returns some list fields as real JSON arrays and others as a string holding a JSON array.
   */
  static List<String> parseStringArray(JsonNode node, ObjectMapper objectMapper) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return List.of();
    }
    if (node.isArray()) {
      List<String> result = new ArrayList<>(node.size());
      for (JsonNode n : node) {
        if (n != null && !n.isNull()) {
          result.add(n.asText());
        }
      }
      return result;
    }
    if (node.isTextual()) {
      String raw = node.asText();
      if (raw.isBlank()) {
        return List.of();
      }
      try {
        return parseStringArray(objectMapper.readTree(raw), objectMapper);
      } catch (Exception e) {
        log.debug("not a JSON array: {}", raw);
        return List.of();
      }
    }
    return List.of();
  }

  private static Instant parseInstant(String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    String s = raw.trim();
    // closedTime comes as "2024-01-15 10:15:00+00"
    if (s.length() > 10 && s.charAt(10) == ' ') {
      s = s.substring(0, 10) + "T" + s.substring(11);
    }
    if (s.endsWith("+00")) {
      s = s.substring(0, s.length() - 3) + "Z";
    }
    try {
      return Instant.parse(s);
    } catch (DateTimeParseException e) {
      log.debug("unreadable timestamp '{}'", raw);
      return null;
    }
  }

  public record GammaMarket(
      String conditionId,
      String question,
      boolean closed,
      List<String> outcomes,
      List<Double> outcomePrices,
      Instant closedTime,
      Instant endDate
  ) {
  }
}
