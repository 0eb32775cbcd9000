package com.polybot.copytrader.ledger.store;

import com.polybot.copytrader.ledger.model.LedgerSnapshot;

import java.util.Optional;
import java.util.Set;

/**
 * Durable storage for ledger snapshots, one per account key.
 *
 * Implementations report failures as {@link com.polybot.copytrader.ledger.LedgerPersistenceException}.
 */
public interface LedgerStore {

  Optional<LedgerSnapshot> load(String accountKey);

  void save(String accountKey, LedgerSnapshot snapshot);

  Set<String> accountKeys();
}
