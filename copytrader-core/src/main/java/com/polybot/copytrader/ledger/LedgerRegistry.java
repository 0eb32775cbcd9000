package com.polybot.copytrader.ledger;

import com.polybot.copytrader.domain.ObservedTrade;
import com.polybot.copytrader.domain.ResolutionEvent;
import com.polybot.copytrader.ledger.model.LedgerSnapshot;
import com.polybot.copytrader.ledger.model.PositionEvent;
import com.polybot.copytrader.ledger.store.LedgerStore;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Maps account keys (chat or session ids) to their own {@link PositionLedger}.
 *
 * Ledgers are loaded lazily from the {@link LedgerStore} and written back after every mutating call. A failed
 * write is raised to the caller but leaves the in-memory ledger intact.
 *
 * Writes for one account are serialized, and each takes its snapshot only once it holds the account's write
 * lock, so the last write to finish always carries the newest state. The ledger's own lock is never held
 * while the store is doing I/O.
 */
@Slf4j
public class LedgerRegistry {

  private final LedgerStore store;
  private final Clock clock;
  private final Map<String, PositionLedger> ledgers = new ConcurrentHashMap<>();
  private final Map<String, ReentrantLock> writeLocks = new ConcurrentHashMap<>();

  public LedgerRegistry(@NonNull LedgerStore store, @NonNull Clock clock) {
    this.store = store;
    this.clock = clock;
  }

  /**
   * The ledger for {@code accountKey}, created empty on first reference.
   */
  public PositionLedger ledger(@NonNull String accountKey) {
    return ledgers.computeIfAbsent(accountKey, this::loadOrCreate);
  }

  public boolean isLoaded(String accountKey) {
    return ledgers.containsKey(accountKey);
  }

  /**
   * Every key known either in memory or in the store.
   */
  public Set<String> accountKeys() {
    Set<String> keys = new TreeSet<>(ledgers.keySet());
    try {
      keys.addAll(store.accountKeys());
    } catch (LedgerPersistenceException e) {
      log.warn("could not list stored ledgers: {}", e.getMessage());
    }
    return Set.copyOf(keys);
  }

  public Set<String> openMarketIds() {
    Set<String> ids = new TreeSet<>();
    for (String key : accountKeys()) {
      ids.addAll(ledger(key).openMarketIds());
    }
    return Set.copyOf(ids);
  }

  public List<PositionEvent> applyTrade(@NonNull String accountKey, @NonNull ObservedTrade trade, double copySize) {
    PositionLedger ledger = ledger(accountKey);
    List<PositionEvent> events = ledger.applyTrade(trade, copySize);
    if (events.isEmpty()) {
      return events;
    }
    try {
      persist(accountKey, ledger);
    } catch (LedgerPersistenceException e) {
      throw e.withPendingEvents(events);
    }
    return events;
  }

  public double applyResolution(@NonNull String accountKey, @NonNull ResolutionEvent event) {
    PositionLedger ledger = ledger(accountKey);
    if (!ledger.openMarketIds().contains(event.marketId())) {
      return 0.0;
    }
    double pnl = ledger.applyResolution(event);
    persist(accountKey, ledger);
    return pnl;
  }

  /**
   * Apply a resolution to every known account. Accounts whose write fails are still settled in memory; the first
   * failure is rethrown once all accounts were processed.
   *
   * @return realized P&L per account that held the market
   */
  public Map<String, Double> applyResolutionToAll(@NonNull ResolutionEvent event) {
    Map<String, Double> results = new LinkedHashMap<>();
    LedgerPersistenceException failure = null;
    for (String key : accountKeys()) {
      if (!ledger(key).openMarketIds().contains(event.marketId())) {
        continue;
      }
      try {
        results.put(key, applyResolution(key, event));
      } catch (LedgerPersistenceException e) {
        log.warn("resolution applied to {} but not persisted: {}", key, e.getMessage());
        if (failure == null) {
          failure = e;
        } else {
          failure.addSuppressed(e);
        }
      }
    }
    if (failure != null) {
      throw failure;
    }
    return results;
  }

  public void reset(@NonNull String accountKey) {
    PositionLedger ledger = ledger(accountKey);
    ledger.reset();
    log.info("ledger {} reset", accountKey);
    persist(accountKey, ledger);
  }

  public void persist(@NonNull String accountKey) {
    PositionLedger ledger = ledgers.get(accountKey);
    if (ledger != null) {
      persist(accountKey, ledger);
    }
  }

  private void persist(String accountKey, PositionLedger ledger) {
    ReentrantLock writeLock = writeLocks.computeIfAbsent(accountKey, key -> new ReentrantLock());
    writeLock.lock();
    try {
      store.save(accountKey, ledger.snapshot());
    } finally {
      writeLock.unlock();
    }
  }

  private PositionLedger loadOrCreate(String accountKey) {
    try {
      return store.load(accountKey)
          .map(snapshot -> restore(accountKey, snapshot))
          .orElseGet(() -> {
            log.info("creating empty ledger for {}", accountKey);
            return new PositionLedger(clock);
          });
    } catch (LedgerPersistenceException e) {
      log.warn("failed to load ledger {}: {}. Starting fresh.", accountKey, e.getMessage());
      return new PositionLedger(clock);
    }
  }

  private PositionLedger restore(String accountKey, LedgerSnapshot snapshot) {
    PositionLedger ledger = PositionLedger.restore(snapshot, clock);
    log.info("loaded ledger {}: {} open, {} closed, {} resolved, realized P&L {}",
        accountKey, snapshot.openPositions().size(), snapshot.closedPositions().size(),
        snapshot.resolvedPositions().size(), ledger.realizedPnL());
    return ledger;
  }
}
