package com.polybot.copytrader.feed;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;

/**
 * Keeps the {@link FeedCursor} in a small JSON file so a restart does not copy the same trades twice.
 */
@Slf4j
public class FeedCursorStore {

  private final Path path;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public FeedCursorStore(@NonNull Path path, @NonNull ObjectMapper objectMapper, @NonNull Clock clock) {
    this.path = path;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  /**
   * The stored cursor, or a fresh one starting now when the file is missing or unreadable.
   */
  public FeedCursor load() {
    if (Files.exists(path)) {
      try {
        FeedCursor cursor = objectMapper.readValue(path.toFile(), FeedCursor.class);
        log.info("loaded feed cursor: {} transactions tracked, last seen {}",
            cursor.seenTransactionHashes().size(), cursor.lastSeenTimestamp());
        return cursor;
      } catch (IOException e) {
        log.warn("failed to load feed cursor {}: {}. Starting fresh.", path, e.getMessage());
      }
    }
    log.info("starting with a fresh feed cursor");
    return FeedCursor.startingAt(clock.instant().getEpochSecond());
  }

  public void save(@NonNull FeedCursor cursor) throws IOException {
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
    objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), cursor);
    try {
      Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
    }
    log.debug("feed cursor saved: {} transactions tracked", cursor.seenTransactionHashes().size());
  }

  public Path path() {
    return path;
  }
}
