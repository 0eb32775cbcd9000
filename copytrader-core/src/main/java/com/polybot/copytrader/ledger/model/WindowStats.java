package com.polybot.copytrader.ledger.model;

import java.time.Instant;

/**
 * Copy-trade analytics over {@code [start, end)}.
 *
 * @param maxTrade the trade with the largest copy notional, {@code null} for an empty window
 * @param pnl      realized P&L of closes inside the window; resolution payouts are not included
 */
public record WindowStats(
    Instant start,
    Instant end,
    double volume,
    double maxValue,
    TradeHistoryRecord maxTrade,
    int tradeCount,
    double peakExposure,
    double pnl
) {
}
