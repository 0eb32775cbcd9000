package com.polybot.copytrader.resolution;

import com.polybot.copytrader.domain.ResolutionEvent;
import com.polybot.copytrader.ledger.LedgerPersistenceException;
import com.polybot.copytrader.ledger.LedgerRegistry;
import com.polybot.copytrader.polymarket.GammaMarketClient;
import com.polybot.copytrader.polymarket.GammaMarketClient.GammaMarket;
import com.polybot.copytrader.polymarket.PolymarketApiException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Watches the markets any account still holds and settles them once Gamma reports them closed with a clear
 * winner.
 */
@Slf4j
public class GammaResolutionDetector {

  private final GammaMarketClient gamma;
  private final LedgerRegistry ledgers;
  private final double winningPriceThreshold;
  private final Clock clock;

  public GammaResolutionDetector(@NonNull GammaMarketClient gamma, @NonNull LedgerRegistry ledgers,
                                 double winningPriceThreshold, @NonNull Clock clock) {
    this.gamma = gamma;
    this.ledgers = ledgers;
    this.winningPriceThreshold = winningPriceThreshold;
    this.clock = clock;
  }

  /**
   * @return resolutions found and applied in this pass
   */
  public List<ResolutionEvent> detectAndApply() {
    List<ResolutionEvent> applied = new ArrayList<>();
    for (String marketId : ledgers.openMarketIds()) {
      Optional<ResolutionEvent> resolution;
      try {
        resolution = gamma.market(marketId)
            .flatMap(market -> toResolution(marketId, market, winningPriceThreshold, clock.instant()));
      } catch (PolymarketApiException e) {
        log.warn("could not check market {}: {}", marketId, e.getMessage());
        continue;
      }
      resolution.ifPresent(event -> {
        apply(event);
        applied.add(event);
      });
    }
    return applied;
  }

  private void apply(ResolutionEvent event) {
    log.info("market {} resolved: winner={} price={} at {}",
        event.marketId(), event.winningOutcome(), event.resolvedPrice(), event.resolvedAt());
    try {
      Map<String, Double> pnl = ledgers.applyResolutionToAll(event);
      pnl.forEach((account, value) ->
          log.info("[{}] resolution P&L for {}: {}", account, event.marketId(), String.format("%+.4f", value)));
    } catch (LedgerPersistenceException e) {
      log.error("resolution of {} applied but not saved for {}: {}", event.marketId(), e.accountKey(), e.getMessage());
    }
  }

  /**
   * A closed market whose best outcome trades at or above the threshold. The settlement time is the market's
   * close time, falling back to its end date and then to {@code now}.
   */
  public static Optional<ResolutionEvent> toResolution(String marketId, GammaMarket market, double threshold,
                                                       Instant now) {
    if (!market.closed()) {
      return Optional.empty();
    }
    int best = -1;
    double bestPrice = Double.NEGATIVE_INFINITY;
    int n = Math.min(market.outcomes().size(), market.outcomePrices().size());
    for (int i = 0; i < n; i++) {
      double price = market.outcomePrices().get(i);
      if (!Double.isNaN(price) && price > bestPrice) {
        bestPrice = price;
        best = i;
      }
    }
    if (best < 0 || bestPrice < threshold) {
      log.debug("market {} closed without a clear winner (best price {})", marketId, bestPrice);
      return Optional.empty();
    }
    Instant resolvedAt = market.closedTime() != null ? market.closedTime()
        : market.endDate() != null ? market.endDate() : now;
    return Optional.of(new ResolutionEvent(marketId, market.outcomes().get(best), resolvedAt, bestPrice));
  }
}
