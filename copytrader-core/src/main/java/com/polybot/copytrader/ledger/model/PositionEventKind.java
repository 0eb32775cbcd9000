package com.polybot.copytrader.ledger.model;

public enum PositionEventKind {
  OPENED,
  INCREASED,
  PARTIAL_CLOSE,
  FULL_CLOSE,
  HEDGE_CLOSE,
  PARTIAL_HEDGE;

  public static PositionEventKind of(CloseKind kind) {
    return switch (kind) {
      case FULL_CLOSE -> FULL_CLOSE;
      case PARTIAL_CLOSE -> PARTIAL_CLOSE;
      case HEDGE_CLOSE -> HEDGE_CLOSE;
      case PARTIAL_HEDGE -> PARTIAL_HEDGE;
    };
  }
}
