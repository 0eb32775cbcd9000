package com.polybot.copytrader.sizing;

import com.polybot.copytrader.domain.ObservedTrade;
import lombok.extern.slf4j.Slf4j;

/**
 * Filters watched trades and sizes the copy: the watched size times the risk multiplier, capped so the copy is
 * worth at most {@code maxTradeUsdc}.
 */
@Slf4j
public class TradeSizer {

  private final double riskMultiplier;
  private final double maxTradeUsdc;

  public TradeSizer(double riskMultiplier, double maxTradeUsdc) {
    if (!(riskMultiplier > 0)) {
      throw new IllegalArgumentException("riskMultiplier must be > 0");
    }
    if (!(maxTradeUsdc > 0)) {
      throw new IllegalArgumentException("maxTradeUsdc must be > 0");
    }
    this.riskMultiplier = riskMultiplier;
    this.maxTradeUsdc = maxTradeUsdc;
  }

  public boolean shouldCopy(ObservedTrade trade) {
    if (!(trade.size() > 0) || !(trade.price() > 0)) {
      log.warn("invalid trade size/price: {}", trade);
      return false;
    }
    if (isBlank(trade.marketId()) || isBlank(trade.tokenId())) {
      log.warn("missing market/token id: {}", trade);
      return false;
    }
    return true;
  }

  public SizingDecision size(ObservedTrade trade) {
    double desired = trade.size() * riskMultiplier;
    double value = desired * trade.price();
    if (value > maxTradeUsdc) {
      double capped = maxTradeUsdc / trade.price();
      log.info("capping size from {} to {} (max ${} USDC)",
          String.format("%.2f", desired), String.format("%.2f", capped), maxTradeUsdc);
      return new SizingDecision(desired, capped, trade.price(), true);
    }
    return new SizingDecision(desired, desired, trade.price(), false);
  }

  public double riskMultiplier() {
    return riskMultiplier;
  }

  public double maxTradeUsdc() {
    return maxTradeUsdc;
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
