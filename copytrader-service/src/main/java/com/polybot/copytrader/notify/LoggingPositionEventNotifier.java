package com.polybot.copytrader.notify;

import com.polybot.copytrader.ledger.model.PositionEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

@Slf4j
public class LoggingPositionEventNotifier implements PositionEventNotifier {

  @Override
  public void notify(String accountKey, List<PositionEvent> events) {
    for (PositionEvent event : events) {
      if (event.realizedPnLDelta() != 0.0) {
        log.info("[{}] {} (realized {})", accountKey, event.message(), String.format("%+.4f", event.realizedPnLDelta()));
      } else {
        log.info("[{}] {}", accountKey, event.message());
      }
    }
  }
}
