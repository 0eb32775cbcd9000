package com.polybot.copytrader.feed;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Where the trade feed left off: the newest trade timestamp processed (epoch seconds) and the transaction hashes
 * already handled, oldest first.
 */
public record FeedCursor(
    @JsonProperty("last_seen_timestamp") long lastSeenTimestamp,
    @JsonProperty("seen_transaction_hashes") List<String> seenTransactionHashes
) {

  public FeedCursor {
    seenTransactionHashes = seenTransactionHashes == null ? List.of() : List.copyOf(seenTransactionHashes);
  }

  public static FeedCursor startingAt(long epochSecond) {
    return new FeedCursor(epochSecond, List.of());
  }
}
