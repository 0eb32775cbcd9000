package com.polybot.copytrader.polymarket;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Midpoint prices from the CLOB, used to mark open positions.
 */
@Slf4j
public class ClobPriceClient {

  private final String clobRestUrl;
  private final PolymarketHttpClient http;

  public ClobPriceClient(@NonNull String clobRestUrl, @NonNull PolymarketHttpClient http) {
    this.clobRestUrl = clobRestUrl;
    this.http = http;
  }

  public Optional<Double> midpoint(@NonNull String tokenId) {
    JsonNode body = http.getJson(PolymarketHttpClient.uri(clobRestUrl, "/midpoint", Map.of("token_id", tokenId)));
    return parseMidpoint(body);
  }

  /**
   * Midpoints for every token that has one. Tokens whose lookup fails are left out of the map.
   */
  public Map<String, Double> midpoints(@NonNull Collection<String> tokenIds) {
    Map<String, Double> prices = new LinkedHashMap<>();
    for (String tokenId : tokenIds) {
      try {
        midpoint(tokenId).ifPresent(price -> prices.put(tokenId, price));
      } catch (PolymarketApiException e) {
        log.warn("no midpoint for token {}: {}", tokenId, e.getMessage());
      }
    }
    return prices;
  }

  static Optional<Double> parseMidpoint(JsonNode body) {
    if (body == null) {
      return Optional.empty();
    }
    JsonNode mid = body.path("mid");
    if (mid.isNumber()) {
      return Optional.of(mid.asDouble());
    }
    if (mid.isTextual()) {
      try {
        return Optional.of(Double.parseDouble(mid.asText()));
      } catch (NumberFormatException e) {
        log.debug("unreadable midpoint '{}'", mid.asText());
      }
    }
    return Optional.empty();
  }
}
