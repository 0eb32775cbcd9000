package com.polybot.copytrader.order;

public record OrderResult(Status status, String orderId, OrderFailureKind failureKind, String message) {

  public enum Status {
    SUBMITTED,
    DRY_RUN,
    FAILED
  }

  public static OrderResult submitted(String orderId) {
    return new OrderResult(Status.SUBMITTED, orderId, null, null);
  }

  public static OrderResult dryRun() {
    return new OrderResult(Status.DRY_RUN, null, null, "dry run");
  }

  public static OrderResult failed(String message) {
    return new OrderResult(Status.FAILED, null, OrderFailureKind.classify(message), message);
  }

  public boolean isFailure() {
    return status == Status.FAILED;
  }
}
