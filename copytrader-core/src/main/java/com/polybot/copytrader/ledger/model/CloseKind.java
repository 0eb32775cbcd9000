package com.polybot.copytrader.ledger.model;

public enum CloseKind {
  FULL_CLOSE,
  PARTIAL_CLOSE,
  HEDGE_CLOSE,
  PARTIAL_HEDGE
}
