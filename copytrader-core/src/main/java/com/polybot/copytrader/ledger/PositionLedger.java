package com.polybot.copytrader.ledger;

import com.polybot.copytrader.domain.ObservedTrade;
import com.polybot.copytrader.domain.ResolutionEvent;
import com.polybot.copytrader.domain.TradeSide;
import com.polybot.copytrader.ledger.model.CloseKind;
import com.polybot.copytrader.ledger.model.ClosedPositionRecord;
import com.polybot.copytrader.ledger.model.LedgerSnapshot;
import com.polybot.copytrader.ledger.model.Position;
import com.polybot.copytrader.ledger.model.PositionEvent;
import com.polybot.copytrader.ledger.model.PositionEventKind;
import com.polybot.copytrader.ledger.model.ResolvedPositionRecord;
import com.polybot.copytrader.ledger.model.TradeHistoryRecord;
import com.polybot.copytrader.ledger.model.WindowStats;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Position ledger for a single account.
 *
 * Turns a stream of copy fills into net positions per outcome token, an append-only history of realized
 * closes, market-resolution settlements and windowed analytics.
 *
 * The closed and resolved logs are the source of truth for realized P&L. The {@code realizedPnL} field is a
 * running projection of them and is reconciled against the logs on every mutation and on every read of
 * {@link #realizedPnL()}.
 *
 * All access is serialized by one re-entrant lock. Nothing in here performs I/O.
 */
@Slf4j
public class PositionLedger {

  public static final double EPSILON = 1e-6;
  public static final int MAX_CLOSED_POSITIONS = 200;
  public static final int MAX_TRADE_HISTORY = 1000;

  private static final double DRIFT_TOLERANCE = 1e-6;

  private final ReentrantLock lock = new ReentrantLock();
  private final Clock clock;

  private final Map<String, Position> openPositions = new LinkedHashMap<>();
  private final Deque<ClosedPositionRecord> closedPositions = new ArrayDeque<>();
  private final List<ResolvedPositionRecord> resolvedPositions = new ArrayList<>();
  private final Deque<TradeHistoryRecord> tradeHistory = new ArrayDeque<>();

  private double realizedPnL;
  // realized P&L of closed records dropped by the MAX_CLOSED_POSITIONS bound
  private double evictedRealizedPnL;

  public PositionLedger(@NonNull Clock clock) {
    this.clock = clock;
  }

  public static PositionLedger restore(@NonNull LedgerSnapshot snapshot, @NonNull Clock clock) {
    PositionLedger ledger = new PositionLedger(clock);
    snapshot.openPositions().forEach((tokenId, position) -> {
      if (position != null && position.absSize() >= EPSILON) {
        ledger.openPositions.put(tokenId, position);
      }
    });
    snapshot.closedPositions().forEach(ledger::appendClosed);
    ledger.resolvedPositions.addAll(snapshot.resolvedPositions());
    snapshot.tradeHistory().forEach(ledger::appendHistory);
    ledger.evictedRealizedPnL += snapshot.evictedRealizedPnL();
    ledger.realizedPnL = snapshot.realizedPnL();
    ledger.reconcileRealizedPnL();
    return ledger;
  }

  // ========== Trades ==========

  /**
   * Apply one copy fill.
   *
   * @param trade    the observed trade; {@code price} must be positive
   * @param copySize the already-sized copy quantity
   * @return lifecycle events in the order they happened, empty when {@code copySize} is dust
   */
  public List<PositionEvent> applyTrade(@NonNull ObservedTrade trade, double copySize) {
    if (copySize <= EPSILON) {
      log.debug("ignoring dust copy size {} for trade {}", copySize, trade.shortHash());
      return List.of();
    }

    lock.lock();
    try {
      Instant now = clock.instant();
      appendHistory(TradeHistoryRecord.of(trade, copySize));

      List<PositionEvent> events = new ArrayList<>(2);
      if (trade.side() == TradeSide.BUY) {
        findHedgeCounterpart(trade)
            .ifPresent(opposite -> events.add(applyHedge(trade, opposite, copySize, now)));
      }
      applyNetting(trade, trade.side().sign() * copySize, now, events);

      reconcileRealizedPnL();
      return List.copyOf(events);
    } finally {
      lock.unlock();
    }
  }

  /**
   * A BUY while holding the other outcome of the same market long locks in a fixed payout of 1 per matched unit.
   */
  private Optional<Position> findHedgeCounterpart(ObservedTrade trade) {
    return openPositions.values().stream()
        .filter(p -> Objects.equals(p.marketId(), trade.marketId()))
        .filter(p -> !Objects.equals(p.tokenId(), trade.tokenId()))
        .filter(p -> !Objects.equals(p.outcome(), trade.outcome()))
        .filter(p -> p.netSize() > 0)
        .findFirst();
  }

  private PositionEvent applyHedge(ObservedTrade trade, Position opposite, double copySize, Instant now) {
    double closingSize = Math.min(opposite.absSize(), copySize);
    double pnl = closingSize * (1.0 - opposite.avgEntryPrice() - trade.price());
    double remaining = opposite.netSize() - closingSize;

    CloseKind kind;
    Position after;
    if (Math.abs(remaining) < EPSILON) {
      openPositions.remove(opposite.tokenId());
      kind = CloseKind.HEDGE_CLOSE;
      after = null;
    } else {
      after = opposite.withNetSize(remaining, now);
      openPositions.put(opposite.tokenId(), after);
      kind = CloseKind.PARTIAL_HEDGE;
    }

    ClosedPositionRecord record = new ClosedPositionRecord(
        opposite.tokenId(),
        opposite.marketId(),
        ClosedPositionRecord.hedgeOutcome(opposite.outcome(), trade.outcome()),
        closingSize,
        opposite.avgEntryPrice(),
        trade.price(),
        pnl,
        opposite.openedAt(),
        now,
        kind
    );
    appendClosed(record);
    realizedPnL += pnl;

    String message = fmt("%s %s: %.2f %s @ %.4f hedged with %s @ %.4f, locked P&L %+.4f",
        kind, label(opposite), closingSize, opposite.outcome(), opposite.avgEntryPrice(),
        trade.outcome(), trade.price(), pnl);
    log.info(message);
    return new PositionEvent(PositionEventKind.of(kind), message, after, record, pnl);
  }

  private void applyNetting(ObservedTrade trade, double signedSize, Instant now, List<PositionEvent> events) {
    Position current = openPositions.get(trade.tokenId());

    if (current == null || current.absSize() < EPSILON) {
      Position opened = Position.open(trade.tokenId(), trade.marketId(), trade.outcome(), signedSize,
          trade.price(), now, trade.title());
      openPositions.put(trade.tokenId(), opened);
      events.add(openedEvent(opened));
      return;
    }

    if (Math.signum(current.netSize()) == Math.signum(signedSize)) {
      Position increased = current.increase(signedSize, trade.price(), now);
      openPositions.put(trade.tokenId(), increased);
      String message = fmt("INCREASED %s %s: %.2f -> %.2f, avg %.4f -> %.4f",
          direction(increased), label(increased), current.netSize(), increased.netSize(),
          current.avgEntryPrice(), increased.avgEntryPrice());
      log.info(message);
      events.add(new PositionEvent(PositionEventKind.INCREASED, message, increased, null, 0.0));
      return;
    }

    double closingSize = Math.min(current.absSize(), Math.abs(signedSize));
    double pnl = closingSize * (trade.price() - current.avgEntryPrice()) * Math.signum(current.netSize());
    double remaining = current.netSize() + signedSize;
    realizedPnL += pnl;

    if (Math.abs(remaining) < EPSILON) {
      openPositions.remove(trade.tokenId());
      ClosedPositionRecord record = closeRecord(current, closingSize, trade.price(), pnl, now, CloseKind.FULL_CLOSE);
      events.add(closedEvent(current, record, null));
      return;
    }

    if (Math.signum(remaining) != Math.signum(current.netSize())) {
      // reversal: the old position is closed in full and a fresh one starts at the fill price
      ClosedPositionRecord record = closeRecord(current, closingSize, trade.price(), pnl, now, CloseKind.FULL_CLOSE);
      events.add(closedEvent(current, record, null));

      Position reversed = Position.open(trade.tokenId(), trade.marketId(), trade.outcome(), remaining,
          trade.price(), now, trade.title());
      openPositions.put(trade.tokenId(), reversed);
      events.add(openedEvent(reversed));
      return;
    }

    Position reduced = current.withNetSize(remaining, now);
    openPositions.put(trade.tokenId(), reduced);
    ClosedPositionRecord record = closeRecord(current, closingSize, trade.price(), pnl, now, CloseKind.PARTIAL_CLOSE);
    events.add(closedEvent(current, record, reduced));
  }

  private ClosedPositionRecord closeRecord(Position current, double closingSize, double exitPrice, double pnl,
                                           Instant now, CloseKind kind) {
    ClosedPositionRecord record = new ClosedPositionRecord(
        current.tokenId(),
        current.marketId(),
        current.outcome(),
        closingSize,
        current.avgEntryPrice(),
        exitPrice,
        pnl,
        current.openedAt(),
        now,
        kind
    );
    appendClosed(record);
    return record;
  }

  private PositionEvent openedEvent(Position opened) {
    String message = fmt("OPENED %s %s: %.2f @ %.4f",
        direction(opened), label(opened), opened.absSize(), opened.avgEntryPrice());
    log.info(message);
    return new PositionEvent(PositionEventKind.OPENED, message, opened, null, 0.0);
  }

  private PositionEvent closedEvent(Position before, ClosedPositionRecord record, Position after) {
    String message = fmt("%s %s %s: %.2f @ %.4f -> %.4f, P&L %+.4f",
        record.kind(), direction(before), label(before), record.size(), record.entryPrice(),
        record.exitPrice(), record.realizedPnL());
    log.info(message);
    return new PositionEvent(PositionEventKind.of(record.kind()), message, after, record, record.realizedPnL());
  }

  // ========== Resolution ==========

  public double applyResolution(@NonNull ResolutionEvent event) {
    return applyResolution(event.marketId(), event.winningOutcome(), event.resolvedAt(), event.resolvedPrice());
  }

  /**
   * Settle every open position in {@code marketId}.
   *
   * A winning position pays {@code size * resolvedPrice / entryPrice}; a losing one pays nothing. Repeating a
   * call with the same market and timestamp changes nothing.
   *
   * @return total realized P&L applied by this call
   */
  public double applyResolution(@NonNull String marketId, @NonNull String winningOutcome,
                                @NonNull Instant resolvedAt, double resolvedPrice) {
    lock.lock();
    try {
      double total = 0.0;
      Iterator<Position> it = openPositions.values().iterator();
      while (it.hasNext()) {
        Position position = it.next();
        if (!marketId.equals(position.marketId())) {
          continue;
        }
        if (isResolved(position.tokenId(), marketId, resolvedAt)) {
          log.debug("resolution already applied token={} market={} at={}", position.tokenId(), marketId, resolvedAt);
          continue;
        }

        double size = position.absSize();
        double entry = position.avgEntryPrice();
        double costBasis = size * entry;
        double payout = 0.0;
        if (winningOutcome.equals(position.outcome())) {
          payout = entry > 0 ? size * (resolvedPrice / entry) : size * resolvedPrice;
        }
        double pnl = payout - costBasis;

        it.remove();
        resolvedPositions.add(new ResolvedPositionRecord(
            marketId,
            position.tokenId(),
            position.outcome(),
            winningOutcome,
            size,
            entry,
            resolvedPrice,
            costBasis,
            payout,
            pnl,
            resolvedAt
        ));
        realizedPnL += pnl;
        total += pnl;

        log.info(fmt("RESOLVED %s: %.2f @ %.4f, winner=%s, payout %.4f, P&L %+.4f",
            label(position), size, entry, winningOutcome, payout, pnl));
      }
      reconcileRealizedPnL();
      return total;
    } finally {
      lock.unlock();
    }
  }

  private boolean isResolved(String tokenId, String marketId, Instant resolvedAt) {
    for (ResolvedPositionRecord r : resolvedPositions) {
      if (r.sameResolution(tokenId, marketId, resolvedAt)) {
        return true;
      }
    }
    return false;
  }

  // ========== P&L ==========

  /**
   * Aggregate realized P&L, corrected in place when it has drifted from the closed and resolved logs.
   */
  public double realizedPnL() {
    lock.lock();
    try {
      reconcileRealizedPnL();
      return realizedPnL;
    } finally {
      lock.unlock();
    }
  }

  public double realizedPnLSince(@NonNull Instant start) {
    lock.lock();
    try {
      double sum = 0.0;
      for (ClosedPositionRecord c : closedPositions) {
        if (!c.closedAt().isBefore(start)) {
          sum += c.realizedPnL();
        }
      }
      return sum;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Mark-to-market P&L of open positions. Positions without a price in {@code currentPrices} are skipped.
   */
  public double unrealizedPnL(@NonNull Map<String, Double> currentPrices) {
    lock.lock();
    try {
      double sum = 0.0;
      for (Position p : openPositions.values()) {
        Double price = currentPrices.get(p.tokenId());
        if (price == null) {
          continue;
        }
        sum += p.unrealizedPnL(price);
      }
      return sum;
    } finally {
      lock.unlock();
    }
  }

  private void reconcileRealizedPnL() {
    double expected = recomputeRealizedPnL();
    if (Math.abs(expected - realizedPnL) > DRIFT_TOLERANCE) {
      log.warn("realized P&L drifted from closed/resolved logs: cached={} recomputed={} (corrected)",
          realizedPnL, expected);
      realizedPnL = expected;
    }
  }

  private double recomputeRealizedPnL() {
    double sum = evictedRealizedPnL;
    for (ClosedPositionRecord c : closedPositions) {
      sum += c.realizedPnL();
    }
    for (ResolvedPositionRecord r : resolvedPositions) {
      sum += r.realizedPnL();
    }
    return sum;
  }

  // ========== Analytics ==========

  /**
   * Copy-trade analytics for {@code [start, end)}.
   */
  public WindowStats statsForWindow(@NonNull Instant start, @NonNull Instant end) {
    lock.lock();
    try {
      List<TradeHistoryRecord> window = tradeHistory.stream()
          .filter(t -> !t.timestamp().isBefore(start) && t.timestamp().isBefore(end))
          .sorted(Comparator.comparing(TradeHistoryRecord::timestamp))
          .toList();

      double volume = 0.0;
      double maxValue = 0.0;
      TradeHistoryRecord maxTrade = null;
      for (TradeHistoryRecord t : window) {
        volume += t.copyValue();
        if (maxTrade == null || t.copyValue() > maxValue) {
          maxValue = t.copyValue();
          maxTrade = t;
        }
      }

      double pnl = 0.0;
      for (ClosedPositionRecord c : closedPositions) {
        if (!c.closedAt().isBefore(start) && c.closedAt().isBefore(end)) {
          pnl += c.realizedPnL();
        }
      }

      return new WindowStats(start, end, volume, maxValue, maxTrade, window.size(),
          peakExposure(start, end), pnl);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Replays retained trades and resolutions before {@code end}, in trade time, over a scratch book of notional
   * per market outcome. The book as it stands at {@code start} seeds the window; the result is the largest total
   * seen from there on. Positions opened before the oldest retained trade are not part of the seed.
   */
  private double peakExposure(Instant start, Instant end) {
    List<ExposureStep> steps = new ArrayList<>();
    for (TradeHistoryRecord t : tradeHistory) {
      if (t.timestamp().isBefore(end)) {
        steps.add(new ExposureStep(t.timestamp(), t, null));
      }
    }
    for (ResolvedPositionRecord r : resolvedPositions) {
      if (r.resolvedAt().isBefore(end)) {
        steps.add(new ExposureStep(r.resolvedAt(), null, r));
      }
    }
    // stable: a trade and a resolution at the same instant keep trade-first order
    steps.sort(Comparator.comparing(ExposureStep::at));

    Map<ExposureKey, Double> book = new LinkedHashMap<>();
    Double peak = null;
    for (ExposureStep step : steps) {
      if (peak == null && !step.at().isBefore(start)) {
        peak = total(book);
      }
      if (step.trade() != null) {
        replayTrade(book, step.trade());
      } else {
        book.remove(new ExposureKey(step.resolution().marketId(), step.resolution().outcome()));
      }
      if (peak != null) {
        peak = Math.max(peak, total(book));
      }
    }
    return peak != null ? peak : total(book);
  }

  private static void replayTrade(Map<ExposureKey, Double> book, TradeHistoryRecord t) {
    ExposureKey key = new ExposureKey(t.marketId(), t.outcome());
    double notional = t.copyValue();
    if (t.side() == TradeSide.BUY) {
      ExposureKey opposite = findOpposite(book, key);
      if (opposite != null) {
        double reduce = Math.min(book.get(opposite), notional);
        reduceExposure(book, opposite, reduce);
        notional -= reduce;
      }
      if (notional > EPSILON) {
        book.merge(key, notional, Double::sum);
      }
    } else {
      Double held = book.get(key);
      if (held != null) {
        reduceExposure(book, key, Math.min(held, notional));
      }
    }
  }

  private static ExposureKey findOpposite(Map<ExposureKey, Double> book, ExposureKey key) {
    for (Map.Entry<ExposureKey, Double> e : book.entrySet()) {
      ExposureKey k = e.getKey();
      if (Objects.equals(k.marketId(), key.marketId())
          && !Objects.equals(k.outcome(), key.outcome())
          && e.getValue() > EPSILON) {
        return k;
      }
    }
    return null;
  }

  private static void reduceExposure(Map<ExposureKey, Double> book, ExposureKey key, double amount) {
    double left = book.get(key) - amount;
    if (left <= EPSILON) {
      book.remove(key);
    } else {
      book.put(key, left);
    }
  }

  private static double total(Map<ExposureKey, Double> book) {
    double sum = 0.0;
    for (double v : book.values()) {
      sum += v;
    }
    return sum;
  }

  private record ExposureKey(String marketId, String outcome) {
  }

  private record ExposureStep(Instant at, TradeHistoryRecord trade, ResolvedPositionRecord resolution) {
  }

  // ========== Read-only views ==========

  public Map<String, Position> openPositions() {
    lock.lock();
    try {
      return Map.copyOf(openPositions);
    } finally {
      lock.unlock();
    }
  }

  public Optional<Position> position(String tokenId) {
    lock.lock();
    try {
      return Optional.ofNullable(openPositions.get(tokenId));
    } finally {
      lock.unlock();
    }
  }

  public Set<String> openMarketIds() {
    lock.lock();
    try {
      Set<String> ids = new LinkedHashSet<>();
      openPositions.values().forEach(p -> ids.add(p.marketId()));
      return Set.copyOf(ids);
    } finally {
      lock.unlock();
    }
  }

  public List<ClosedPositionRecord> closedPositions() {
    lock.lock();
    try {
      return List.copyOf(closedPositions);
    } finally {
      lock.unlock();
    }
  }

  /**
   * The last {@code count} closes, oldest first.
   */
  public List<ClosedPositionRecord> recentClosedPositions(int count) {
    lock.lock();
    try {
      List<ClosedPositionRecord> all = List.copyOf(closedPositions);
      int from = Math.max(0, all.size() - Math.max(0, count));
      return all.subList(from, all.size());
    } finally {
      lock.unlock();
    }
  }

  public List<ResolvedPositionRecord> resolvedPositions() {
    lock.lock();
    try {
      return List.copyOf(resolvedPositions);
    } finally {
      lock.unlock();
    }
  }

  public List<TradeHistoryRecord> tradeHistory() {
    lock.lock();
    try {
      return List.copyOf(tradeHistory);
    } finally {
      lock.unlock();
    }
  }

  /**
   * True when no open position is dust and the cached realized P&L matches the logs.
   */
  public boolean isConsistent() {
    lock.lock();
    try {
      boolean noDust = openPositions.values().stream().allMatch(p -> p.absSize() >= EPSILON);
      return noDust && Math.abs(recomputeRealizedPnL() - realizedPnL) <= DRIFT_TOLERANCE;
    } finally {
      lock.unlock();
    }
  }

  public LedgerSnapshot snapshot() {
    lock.lock();
    try {
      return new LedgerSnapshot(
          new LinkedHashMap<>(openPositions),
          List.copyOf(closedPositions),
          List.copyOf(resolvedPositions),
          List.copyOf(tradeHistory),
          realizedPnL,
          evictedRealizedPnL
      );
    } finally {
      lock.unlock();
    }
  }

  public void reset() {
    lock.lock();
    try {
      openPositions.clear();
      closedPositions.clear();
      resolvedPositions.clear();
      tradeHistory.clear();
      realizedPnL = 0.0;
      evictedRealizedPnL = 0.0;
    } finally {
      lock.unlock();
    }
  }

  // ========== Internals ==========

  private void appendClosed(ClosedPositionRecord record) {
    closedPositions.addLast(record);
    while (closedPositions.size() > MAX_CLOSED_POSITIONS) {
      evictedRealizedPnL += closedPositions.removeFirst().realizedPnL();
    }
  }

  private void appendHistory(TradeHistoryRecord record) {
    tradeHistory.addLast(record);
    while (tradeHistory.size() > MAX_TRADE_HISTORY) {
      tradeHistory.removeFirst();
    }
  }

  private static String direction(Position p) {
    return p.isLong() ? "LONG" : "SHORT";
  }

  private static String label(Position p) {
    return p.displayName() != null ? p.displayName() : p.tokenId();
  }

  private static String fmt(String pattern, Object... args) {
    return String.format(Locale.ROOT, pattern, args);
  }
}
