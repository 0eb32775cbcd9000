package com.polybot.copytrader.domain;

public enum TradeSide {
  BUY,
  SELL;

  public static TradeSide parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("side must not be blank");
    }
    return TradeSide.valueOf(raw.trim().toUpperCase(java.util.Locale.ROOT));
  }

  public double sign() {
    return this == BUY ? 1.0 : -1.0;
  }
}
