package com.polybot.copytrader.order;

import lombok.extern.slf4j.Slf4j;

/**
 * Dry run: logs the order it would have placed.
 */
@Slf4j
public class PaperOrderPlacer implements OrderPlacer {

  @Override
  public OrderResult place(CopyOrder order) {
    log.info("DRY RUN: not placing {} {} @ {} ({} USDC) for token {}",
        order.side(), fmt(order.size()), String.format("%.4f", order.price()), fmt(order.usdcValue()), order.tokenId());
    return OrderResult.dryRun();
  }

  private static String fmt(double v) {
    return String.format("%.2f", v);
  }
}
