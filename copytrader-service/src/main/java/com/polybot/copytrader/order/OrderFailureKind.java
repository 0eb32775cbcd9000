package com.polybot.copytrader.order;

import java.util.Locale;

public enum OrderFailureKind {
  INSUFFICIENT_BALANCE,
  INSUFFICIENT_ALLOWANCE,
  OTHER;

  public static OrderFailureKind classify(String error) {
    if (error == null) {
      return OTHER;
    }
    String lower = error.toLowerCase(Locale.ROOT);
    if (lower.contains("insufficient balance") || lower.contains("insufficient funds")
        || lower.contains("not enough balance")) {
      return INSUFFICIENT_BALANCE;
    }
    if (lower.contains("allowance")) {
      return INSUFFICIENT_ALLOWANCE;
    }
    return OTHER;
  }
}
