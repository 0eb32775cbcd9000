package com.polybot.copytrader.ledger.model;

/**
 * Lifecycle event returned by the ledger for the notifier.
 *
 * @param position       the position after the change, absent when it was closed
 * @param closedPosition the closed record appended by this change, absent for opens and increases
 */
public record PositionEvent(
    PositionEventKind kind,
    String message,
    Position position,
    ClosedPositionRecord closedPosition,
    double realizedPnLDelta
) {
}
