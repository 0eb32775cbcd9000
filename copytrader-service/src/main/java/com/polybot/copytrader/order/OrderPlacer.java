package com.polybot.copytrader.order;

/**
 * Sends copy orders somewhere. Implementations report failures in the returned {@link OrderResult} and do not
 * throw.
 */
public interface OrderPlacer {

  OrderResult place(CopyOrder order);
}
