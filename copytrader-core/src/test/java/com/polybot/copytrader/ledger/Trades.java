package com.polybot.copytrader.ledger;

import com.polybot.copytrader.domain.ObservedTrade;
import com.polybot.copytrader.domain.TradeSide;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builders for observed trades in tests.
 */
public final class Trades {

  private static final AtomicLong SEQ = new AtomicLong();

  private Trades() {
  }

  public static ObservedTrade buy(String tokenId, String marketId, String outcome, double size, double price, long ts) {
    return trade(tokenId, marketId, outcome, TradeSide.BUY, size, price, ts);
  }

  public static ObservedTrade sell(String tokenId, String marketId, String outcome, double size, double price, long ts) {
    return trade(tokenId, marketId, outcome, TradeSide.SELL, size, price, ts);
  }

  public static ObservedTrade trade(String tokenId, String marketId, String outcome, TradeSide side,
                                    double size, double price, long ts) {
    return new ObservedTrade(
        "0xtx" + SEQ.incrementAndGet(),
        Instant.ofEpochSecond(ts),
        marketId,
        tokenId,
        outcome,
        side,
        size,
        price,
        "BTC Up or Down",
        "0xwatched"
    );
  }
}
