package com.polybot.copytrader.ledger.store;

import com.polybot.copytrader.ledger.model.LedgerSnapshot;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryLedgerStore implements LedgerStore {

  private final Map<String, LedgerSnapshot> snapshots = new ConcurrentHashMap<>();

  @Override
  public Optional<LedgerSnapshot> load(String accountKey) {
    return Optional.ofNullable(snapshots.get(accountKey));
  }

  @Override
  public void save(String accountKey, LedgerSnapshot snapshot) {
    snapshots.put(accountKey, snapshot);
  }

  @Override
  public Set<String> accountKeys() {
    return Set.copyOf(snapshots.keySet());
  }
}
