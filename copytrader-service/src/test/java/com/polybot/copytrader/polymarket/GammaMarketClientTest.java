package com.polybot.copytrader.polymarket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polybot.copytrader.polymarket.GammaMarketClient.GammaMarket;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GammaMarketClientTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void readsJsonStringFields() throws Exception {
    GammaMarket market = GammaMarketClient.parseMarket(objectMapper.readTree("""
        {
          "conditionId": "0xabc",
          "question": "Bitcoin Up or Down - January 15, 10AM ET",
          "closed": true,
          "outcomes": "[\\"Up\\", \\"Down\\"]",
          "outcomePrices": "[\\"1\\", \\"0\\"]",
          "closedTime": "2024-01-15 15:05:12+00",
          "endDate": "2024-01-15T15:00:00Z"
        }
        """), objectMapper);

    assertThat(market.conditionId()).isEqualTo("0xabc");
    assertThat(market.closed()).isTrue();
    assertThat(market.outcomes()).containsExactly("Up", "Down");
    assertThat(market.outcomePrices()).containsExactly(1.0, 0.0);
    assertThat(market.closedTime()).isEqualTo(Instant.parse("2024-01-15T15:05:12Z"));
    assertThat(market.endDate()).isEqualTo(Instant.parse("2024-01-15T15:00:00Z"));
  }

  @Test
  void readsRealArraysAndToleratesMissingFields() throws Exception {
    GammaMarket market = GammaMarketClient.parseMarket(objectMapper.readTree("""
        {"conditionId": "0xdef", "outcomes": ["Yes", "No"], "outcomePrices": [0.42, "n/a"]}
        """), objectMapper);

    assertThat(market.closed()).isFalse();
    assertThat(market.outcomes()).containsExactly("Yes", "No");
    assertThat(market.outcomePrices().get(0)).isEqualTo(0.42);
    assertThat(market.outcomePrices().get(1)).isNaN();
    assertThat(market.closedTime()).isNull();
  }

  @Test
  void queriesByConditionIdAndTakesTheFirstMarket() throws Exception {
    PolymarketHttpClient http = mock(PolymarketHttpClient.class);
    when(http.getJson(any(URI.class))).thenReturn(objectMapper.readTree("""
        [{"conditionId": "0xabc", "closed": false, "outcomes": "[]", "outcomePrices": "[]"}]
        """));
    GammaMarketClient client = new GammaMarketClient("https://gamma-api.polymarket.com", http, objectMapper);

    assertThat(client.market("0xabc")).hasValueSatisfying(m -> assertThat(m.conditionId()).isEqualTo("0xabc"));
    verify(http).getJson(URI.create("https://gamma-api.polymarket.com/markets?condition_ids=0xabc"));
  }

  @Test
  void emptyResultMeansUnknownMarket() throws Exception {
    PolymarketHttpClient http = mock(PolymarketHttpClient.class);
    when(http.getJson(any(URI.class))).thenReturn(objectMapper.readTree("[]"));
    GammaMarketClient client = new GammaMarketClient("https://gamma-api.polymarket.com", http, objectMapper);

    assertThat(client.market("0xabc")).isEmpty();
  }
}
