package com.polybot.copytrader.web;

import com.polybot.copytrader.domain.ResolutionEvent;
import com.polybot.copytrader.ledger.LedgerRegistry;
import com.polybot.copytrader.ledger.PositionLedger;
import com.polybot.copytrader.ledger.model.ClosedPositionRecord;
import com.polybot.copytrader.ledger.model.Position;
import com.polybot.copytrader.ledger.model.ResolvedPositionRecord;
import com.polybot.copytrader.ledger.model.WindowStats;
import com.polybot.copytrader.polymarket.ClobPriceClient;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;

@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
@Slf4j
public class LedgerController {

  private static final Duration DEFAULT_WINDOW = Duration.ofHours(24);

  private final @NonNull LedgerRegistry ledgers;
  private final @NonNull ClobPriceClient prices;
  private final @NonNull Clock clock;

  @GetMapping("/accounts")
  public Set<String> accounts() {
    return ledgers.accountKeys();
  }

  @GetMapping("/{account}/summary")
  public ResponseEntity<LedgerSummaryResponse> summary(@PathVariable String account) {
    if (!ledgers.accountKeys().contains(account)) {
      return ResponseEntity.notFound().build();
    }
    PositionLedger ledger = ledgers.ledger(account);
    Map<String, Position> open = ledger.openPositions();
    Map<String, Double> marks = prices.midpoints(open.keySet());
    return ResponseEntity.ok(new LedgerSummaryResponse(
        account,
        open.size(),
        ledger.closedPositions().size(),
        ledger.resolvedPositions().size(),
        ledger.tradeHistory().size(),
        ledger.realizedPnL(),
        ledger.unrealizedPnL(marks),
        marks.size()
    ));
  }

  @GetMapping("/{account}/positions")
  public ResponseEntity<List<Position>> openPositions(@PathVariable String account) {
    if (!ledgers.accountKeys().contains(account)) {
      return ResponseEntity.notFound().build();
    }
    List<Position> positions = ledgers.ledger(account).openPositions().values().stream()
        .sorted(Comparator.comparing(Position::openedAt))
        .toList();
    return ResponseEntity.ok(positions);
  }

  @GetMapping("/{account}/closed")
  public ResponseEntity<List<ClosedPositionRecord>> closedPositions(@PathVariable String account,
                                                                    @RequestParam(defaultValue = "20") int limit) {
    if (!ledgers.accountKeys().contains(account)) {
      return ResponseEntity.notFound().build();
    }
    return ResponseEntity.ok(ledgers.ledger(account).recentClosedPositions(limit));
  }

  @GetMapping("/{account}/resolved")
  public ResponseEntity<List<ResolvedPositionRecord>> resolvedPositions(@PathVariable String account) {
    if (!ledgers.accountKeys().contains(account)) {
      return ResponseEntity.notFound().build();
    }
    return ResponseEntity.ok(ledgers.ledger(account).resolvedPositions());
  }

  /**
   * Realized P&L, total or, with {@code since}, from closes at or after that instant.
   */
  @GetMapping("/{account}/pnl/realized")
  public ResponseEntity<PnLResponse> realizedPnL(@PathVariable String account,
                                                 @RequestParam(required = false) Instant since) {
    if (!ledgers.accountKeys().contains(account)) {
      return ResponseEntity.notFound().build();
    }
    PositionLedger ledger = ledgers.ledger(account);
    double value = since == null ? ledger.realizedPnL() : ledger.realizedPnLSince(since);
    return ResponseEntity.ok(new PnLResponse(account, value, since));
  }

  @GetMapping("/{account}/pnl/unrealized")
  public ResponseEntity<PnLResponse> unrealizedPnL(@PathVariable String account) {
    if (!ledgers.accountKeys().contains(account)) {
      return ResponseEntity.notFound().build();
    }
    PositionLedger ledger = ledgers.ledger(account);
    Map<String, Double> marks = prices.midpoints(ledger.openPositions().keySet());
    return ResponseEntity.ok(new PnLResponse(account, ledger.unrealizedPnL(marks), null));
  }

  /**
   * Window analytics for {@code [start, end)}; defaults to the last 24 hours.
   */
  @GetMapping("/{account}/stats")
  public ResponseEntity<WindowStats> stats(@PathVariable String account,
                                           @RequestParam(required = false) Instant start,
                                           @RequestParam(required = false) Instant end) {
    if (!ledgers.accountKeys().contains(account)) {
      return ResponseEntity.notFound().build();
    }
    Instant to = end != null ? end : clock.instant();
    Instant from = start != null ? start : to.minus(DEFAULT_WINDOW);
    if (!from.isBefore(to)) {
      return ResponseEntity.badRequest().build();
    }
    return ResponseEntity.ok(ledgers.ledger(account).statsForWindow(from, to));
  }

  @PostMapping("/resolutions")
  public Map<String, Double> resolve(@Valid @RequestBody ResolutionRequest request) {
    ResolutionEvent event = new ResolutionEvent(
        request.marketId(),
        request.winningOutcome(),
        request.resolvedAt() != null ? request.resolvedAt() : clock.instant(),
        request.resolvedPrice()
    );
    log.info("manual resolution: {}", event);
    return ledgers.applyResolutionToAll(event);
  }

  @PostMapping("/{account}/reset")
  public ResponseEntity<Void> reset(@PathVariable String account) {
    if (!ledgers.accountKeys().contains(account)) {
      return ResponseEntity.notFound().build();
    }
    ledgers.reset(account);
    return ResponseEntity.noContent().build();
  }

  public record LedgerSummaryResponse(
      String account,
      int openPositions,
      int closedPositions,
      int resolvedPositions,
      int trades,
      double realizedPnL,
      double unrealizedPnL,
      int pricedPositions
  ) {
  }

  public record PnLResponse(String account, double pnl, Instant since) {
  }

  public record ResolutionRequest(
      @NotBlank String marketId,
      @NotBlank String winningOutcome,
      Instant resolvedAt,
      @NotNull @Positive Double resolvedPrice
  ) {
  }
}
