package com.polybot.copytrader.ledger.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.polybot.copytrader.ledger.LedgerPersistenceException;
import com.polybot.copytrader.ledger.model.LedgerSnapshot;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * One row per account key holding the snapshot as JSON text.
 */
@Slf4j
public class JdbcLedgerStore implements LedgerStore {

  private final JdbcTemplate jdbcTemplate;
  private final LedgerSnapshotCodec codec;
  private final Clock clock;
  private final String table;

  public JdbcLedgerStore(@NonNull JdbcTemplate jdbcTemplate, @NonNull LedgerSnapshotCodec codec,
                         @NonNull Clock clock, @NonNull String table) {
    if (!table.matches("[A-Za-z_][A-Za-z0-9_.]*")) {
      throw new IllegalArgumentException("invalid table name: " + table);
    }
    this.jdbcTemplate = jdbcTemplate;
    this.codec = codec;
    this.clock = clock;
    this.table = table;
  }

  public void createTableIfMissing() {
    jdbcTemplate.execute("""
        CREATE TABLE IF NOT EXISTS %s (
          account_key VARCHAR(255) PRIMARY KEY,
          snapshot CLOB NOT NULL,
          updated_at TIMESTAMP NOT NULL
        )
        """.formatted(table));
    log.info("ledger table {} ready", table);
  }

  @Override
  public Optional<LedgerSnapshot> load(String accountKey) {
    try {
      List<String> rows = jdbcTemplate.query(
          "SELECT snapshot FROM %s WHERE account_key = ?".formatted(table),
          (rs, rowNum) -> rs.getString("snapshot"),
          accountKey);
      if (rows.isEmpty()) {
        return Optional.empty();
      }
      return Optional.of(codec.read(rows.get(0)));
    } catch (DataAccessException | JsonProcessingException e) {
      throw new LedgerPersistenceException(accountKey, "Failed loading ledger row", e);
    }
  }

  @Override
  public void save(String accountKey, LedgerSnapshot snapshot) {
    try {
      String json = codec.write(snapshot);
      Timestamp now = Timestamp.from(clock.instant());
      int updated = jdbcTemplate.update(
          "UPDATE %s SET snapshot = ?, updated_at = ? WHERE account_key = ?".formatted(table),
          json, now, accountKey);
      if (updated == 0) {
        jdbcTemplate.update(
            "INSERT INTO %s (account_key, snapshot, updated_at) VALUES (?, ?, ?)".formatted(table),
            accountKey, json, now);
      }
    } catch (DataAccessException | JsonProcessingException e) {
      throw new LedgerPersistenceException(accountKey, "Failed saving ledger row", e);
    }
  }

  @Override
  public Set<String> accountKeys() {
    try {
      return Set.copyOf(jdbcTemplate.queryForList("SELECT account_key FROM %s".formatted(table), String.class));
    } catch (DataAccessException e) {
      throw new LedgerPersistenceException(null, "Failed listing ledger rows", e);
    }
  }
}
