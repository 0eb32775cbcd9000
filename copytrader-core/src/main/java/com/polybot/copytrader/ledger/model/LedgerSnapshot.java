package com.polybot.copytrader.ledger.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persisted form of one account's ledger.
 */
public record LedgerSnapshot(
    Map<String, Position> openPositions,
    List<ClosedPositionRecord> closedPositions,
    List<ResolvedPositionRecord> resolvedPositions,
    List<TradeHistoryRecord> tradeHistory,
    double realizedPnL,
    double evictedRealizedPnL
) {

  public LedgerSnapshot {
    openPositions = openPositions == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(openPositions));
    closedPositions = closedPositions == null ? List.of() : List.copyOf(closedPositions);
    resolvedPositions = resolvedPositions == null ? List.of() : List.copyOf(resolvedPositions);
    tradeHistory = tradeHistory == null ? List.of() : List.copyOf(tradeHistory);
  }

  public static LedgerSnapshot empty() {
    return new LedgerSnapshot(Map.of(), List.of(), List.of(), List.of(), 0.0, 0.0);
  }
}
