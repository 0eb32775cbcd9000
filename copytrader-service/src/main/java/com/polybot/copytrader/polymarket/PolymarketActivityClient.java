package com.polybot.copytrader.polymarket;

import com.fasterxml.jackson.databind.JsonNode;
import com.polybot.copytrader.domain.ObservedTrade;
import com.polybot.copytrader.domain.TradeSide;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a wallet's trades from the data-api {@code /activity} endpoint.
 */
@Slf4j
public class PolymarketActivityClient {

  private final String dataApiUrl;
  private final PolymarketHttpClient http;

  public PolymarketActivityClient(@NonNull String dataApiUrl, @NonNull PolymarketHttpClient http) {
    this.dataApiUrl = dataApiUrl;
    this.http = http;
  }

  /**
   * Trades made by {@code wallet} at or after {@code start}, newest first as the API returns them.
   */
  public List<ObservedTrade> fetchTradesSince(@NonNull String wallet, @NonNull Instant start) {
    String user = wallet.toLowerCase(Locale.ROOT);
    Map<String, String> query = new LinkedHashMap<>();
    query.put("user", user);
    query.put("type", "TRADE");
    query.put("start", Long.toString(start.getEpochSecond()));
    query.put("sortBy", "TIMESTAMP");
    query.put("sortDirection", "DESC");

    JsonNode body = http.getJson(PolymarketHttpClient.uri(dataApiUrl, "/activity", query));
    List<ObservedTrade> trades = parseActivities(body, user);
    if (!trades.isEmpty()) {
      log.info("fetched {} trade(s) for {}", trades.size(), user);
    }
    return trades;
  }

  /**
   * Turns an activity array into trades. Rows without a transaction hash, rows for another wallet and rows
   * that cannot be read are dropped.
   */
  public static List<ObservedTrade> parseActivities(JsonNode body, String wallet) {
    if (body == null || !body.isArray()) {
      return List.of();
    }
    String expected = wallet == null ? "" : wallet.toLowerCase(Locale.ROOT);
    List<ObservedTrade> trades = new ArrayList<>(body.size());
    for (JsonNode row : body) {
      String txHash = row.path("transactionHash").asText("");
      if (txHash.isBlank()) {
        continue;
      }
      try {
        ObservedTrade trade = parseActivity(row);
        String proxy = trade.proxyWallet() == null ? "" : trade.proxyWallet();
        if (!expected.isEmpty() && !expected.equals(proxy)) {
          log.debug("skipping activity {} for wallet {}", trade.shortHash(), proxy);
          continue;
        }
        trades.add(trade);
      } catch (IllegalArgumentException e) {
        log.warn("failed to parse activity {}: {}", txHash, e.getMessage());
      }
    }
    return trades;
  }

  static ObservedTrade parseActivity(JsonNode row) {
    String proxy = text(row, "proxyWallet");
    if (proxy.isEmpty()) {
      proxy = text(row, "user");
    }
    String market = text(row, "conditionId");
    if (market.isEmpty()) {
      market = text(row, "market");
    }
    return new ObservedTrade(
        text(row, "transactionHash"),
        Instant.ofEpochSecond((long) number(row, "timestamp")),
        market,
        text(row, "asset"),
        text(row, "outcome"),
        TradeSide.parse(text(row, "side")),
        number(row, "size"),
        number(row, "price"),
        text(row, "title"),
        proxy.toLowerCase(Locale.ROOT)
    );
  }

  private static String text(JsonNode row, String field) {
    JsonNode n = row.get(field);
    return n == null || n.isNull() ? "" : n.asText("").trim();
  }

  private static double number(JsonNode row, String field) {
    JsonNode n = row.get(field);
    if (n == null || n.isNull()) {
      throw new IllegalArgumentException("missing " + field);
    }
    if (n.isNumber()) {
      return n.asDouble();
    }
    try {
      return Double.parseDouble(n.asText());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("bad " + field + ": " + n.asText());
    }
  }
}
