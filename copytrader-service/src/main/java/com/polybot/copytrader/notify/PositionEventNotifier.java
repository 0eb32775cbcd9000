package com.polybot.copytrader.notify;

import com.polybot.copytrader.ledger.model.PositionEvent;

import java.util.List;

/**
 * Receives ledger events for one account after each copied trade.
 */
public interface PositionEventNotifier {

  void notify(String accountKey, List<PositionEvent> events);
}
