package com.polybot.copytrader.feed;

import com.polybot.copytrader.copy.CopyTradeService;
import com.polybot.copytrader.domain.ObservedTrade;
import com.polybot.copytrader.polymarket.PolymarketActivityClient;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Polls the watched wallet's activity and hands every trade not seen before to the {@link CopyTradeService},
 * oldest first. The cursor is saved after each trade.
 */
@Slf4j
public class TradeFeedPoller {

  private final PolymarketActivityClient activityClient;
  private final CopyTradeService copyTradeService;
  private final FeedCursorStore cursorStore;
  private final String targetWallet;
  private final int seenCapacity;

  private final Object monitor = new Object();
  private final LinkedHashSet<String> seenHashes = new LinkedHashSet<>();
  private long lastSeenTimestamp;

  public TradeFeedPoller(
      @NonNull PolymarketActivityClient activityClient,
      @NonNull CopyTradeService copyTradeService,
      @NonNull FeedCursorStore cursorStore,
      @NonNull String targetWallet,
      int seenCapacity
  ) {
    this.activityClient = activityClient;
    this.copyTradeService = copyTradeService;
    this.cursorStore = cursorStore;
    this.targetWallet = targetWallet;
    this.seenCapacity = Math.max(1, seenCapacity);

    FeedCursor cursor = cursorStore.load();
    this.lastSeenTimestamp = cursor.lastSeenTimestamp();
    cursor.seenTransactionHashes().forEach(this::remember);
  }

  /**
   * One round trip to the activity feed.
   *
   * @return number of new trades handed on
   */
  public int poll() {
    synchronized (monitor) {
      List<ObservedTrade> fetched = activityClient.fetchTradesSince(targetWallet, Instant.ofEpochSecond(lastSeenTimestamp));

      List<ObservedTrade> fresh = new ArrayList<>();
      for (ObservedTrade trade : fetched) {
        if (!seenHashes.contains(trade.transactionHash())) {
          fresh.add(trade);
        }
      }
      fresh.sort(Comparator.comparing(ObservedTrade::timestamp));

      for (ObservedTrade trade : fresh) {
        if (!remember(trade.transactionHash())) {
          continue;
        }
        try {
          copyTradeService.process(trade);
        } catch (RuntimeException e) {
          log.error("failed to process trade {}: {}", trade.shortHash(), e.getMessage(), e);
        }
        long ts = trade.timestamp().getEpochSecond();
        if (ts > lastSeenTimestamp) {
          lastSeenTimestamp = ts;
        }
        saveCursor();
      }
      return fresh.size();
    }
  }

  public FeedCursor cursor() {
    synchronized (monitor) {
      return new FeedCursor(lastSeenTimestamp, List.copyOf(seenHashes));
    }
  }

  private boolean remember(String txHash) {
    if (!seenHashes.add(txHash)) {
      return false;
    }
    Iterator<String> it = seenHashes.iterator();
    while (seenHashes.size() > seenCapacity && it.hasNext()) {
      it.next();
      it.remove();
    }
    return true;
  }

  private void saveCursor() {
    try {
      cursorStore.save(cursor());
    } catch (IOException e) {
      log.error("failed to save feed cursor to {}: {}", cursorStore.path(), e.getMessage());
    }
  }
}
