package com.polybot.copytrader.ledger;

import com.polybot.copytrader.ledger.model.PositionEvent;

import java.util.List;

/**
 * A ledger could not be written to (or read from) its store.
 *
 * The in-memory ledger is left as it was after the mutation; {@link #pendingEvents()} carries the events that
 * mutation produced so callers can still forward them.
 */
public class LedgerPersistenceException extends RuntimeException {

  private final String accountKey;
  private final List<PositionEvent> pendingEvents;

  public LedgerPersistenceException(String accountKey, String message, Throwable cause) {
    this(accountKey, message, cause, List.of());
  }

  public LedgerPersistenceException(String accountKey, String message, Throwable cause,
                                    List<PositionEvent> pendingEvents) {
    super(message, cause);
    this.accountKey = accountKey;
    this.pendingEvents = pendingEvents == null ? List.of() : List.copyOf(pendingEvents);
  }

  public String accountKey() {
    return accountKey;
  }

  public List<PositionEvent> pendingEvents() {
    return pendingEvents;
  }

  LedgerPersistenceException withPendingEvents(List<PositionEvent> events) {
    return new LedgerPersistenceException(accountKey, getMessage(), getCause(), events);
  }
}
