package com.polybot.copytrader.ledger.store;

import com.polybot.copytrader.ledger.LedgerPersistenceException;
import com.polybot.copytrader.ledger.model.LedgerSnapshot;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * One pretty-printed JSON file per account key, named after the URL-encoded key.
 */
@Slf4j
public class JsonFileLedgerStore implements LedgerStore {

  private static final String SUFFIX = ".json";

  private final Path directory;
  private final LedgerSnapshotCodec codec;

  public JsonFileLedgerStore(@NonNull Path directory, @NonNull LedgerSnapshotCodec codec) {
    this.directory = directory;
    this.codec = codec;
  }

  @Override
  public Optional<LedgerSnapshot> load(String accountKey) {
    Path file = fileFor(accountKey);
    if (!Files.exists(file)) {
      return Optional.empty();
    }
    try {
      LedgerSnapshot snapshot = codec.read(Files.readString(file, StandardCharsets.UTF_8));
      log.debug("loaded ledger {} from {}", accountKey, file);
      return Optional.of(snapshot);
    } catch (IOException e) {
      throw new LedgerPersistenceException(accountKey, "Failed reading ledger file " + file, e);
    }
  }

  @Override
  public void save(String accountKey, LedgerSnapshot snapshot) {
    Path file = fileFor(accountKey);
    Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
    try {
      Files.createDirectories(directory);
      Files.writeString(tmp, codec.write(snapshot), StandardCharsets.UTF_8);
      try {
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      throw new LedgerPersistenceException(accountKey, "Failed writing ledger file " + file, e);
    }
  }

  @Override
  public Set<String> accountKeys() {
    if (!Files.isDirectory(directory)) {
      return Set.of();
    }
    Set<String> keys = new HashSet<>();
    try (Stream<Path> files = Files.list(directory)) {
      files.map(p -> p.getFileName().toString())
          .filter(name -> name.endsWith(SUFFIX))
          .map(name -> name.substring(0, name.length() - SUFFIX.length()))
          .map(name -> URLDecoder.decode(name, StandardCharsets.UTF_8))
          .forEach(keys::add);
    } catch (IOException e) {
      throw new LedgerPersistenceException(null, "Failed listing ledger directory " + directory, e);
    }
    return Set.copyOf(keys);
  }

  Path fileFor(String accountKey) {
    return directory.resolve(URLEncoder.encode(accountKey, StandardCharsets.UTF_8) + SUFFIX);
  }
}
