package com.polybot.copytrader.sizing;

/**
 * How much of a watched trade to copy.
 *
 * @param desiredSize size after the risk multiplier, before the cap
 * @param copySize    size to actually trade
 * @param capped      whether the per-trade USDC cap reduced the size
 */
public record SizingDecision(double desiredSize, double copySize, double price, boolean capped) {

  public double copyValue() {
    return copySize * price;
  }
}
