package com.polybot.copytrader.ledger;

import com.polybot.copytrader.domain.TradeSide;
import com.polybot.copytrader.ledger.model.ClosedPositionRecord;
import com.polybot.copytrader.ledger.model.LedgerSnapshot;
import com.polybot.copytrader.ledger.model.Position;
import com.polybot.copytrader.ledger.model.ResolvedPositionRecord;
import com.polybot.copytrader.ledger.store.LedgerSnapshotCodec;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.polybot.copytrader.ledger.Trades.buy;
import static com.polybot.copytrader.ledger.Trades.sell;
import static com.polybot.copytrader.ledger.Trades.trade;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PositionLedgerInvariantTest {

  private static final String[][] TOKENS = {
      {"tok-m1-up", "m1", "Up"},
      {"tok-m1-down", "m1", "Down"},
      {"tok-m2-yes", "m2", "Yes"},
      {"tok-m2-no", "m2", "No"},
      {"tok-m3-up", "m3", "Up"},
  };

  @Test
  void realizedPnLAlwaysMatchesTheLogs() {
    MutableClock clock = MutableClock.atEpochSecond(1_000);
    PositionLedger ledger = new PositionLedger(clock);
    Random random = new Random(42);

    for (int i = 0; i < 2_000; i++) {
      clock.setEpochSecond(1_000 + i);
      if (random.nextInt(50) == 0) {
        String market = "m" + (1 + random.nextInt(3));
        ledger.applyResolution(market, random.nextBoolean() ? "Up" : "Yes", clock.instant(), 0.99);
      } else {
        String[] token = TOKENS[random.nextInt(TOKENS.length)];
        TradeSide side = random.nextBoolean() ? TradeSide.BUY : TradeSide.SELL;
        double size = 1 + random.nextInt(40) + (random.nextInt(4) / 4.0);
        double price = 0.05 + random.nextInt(90) / 100.0;
        ledger.applyTrade(trade(token[0], token[1], token[2], side, size, price, 1_000 + i), size);
      }

      assertThat(ledger.isConsistent()).as("consistent after step %d", i).isTrue();
      assertThat(ledger.openPositions().values())
          .allSatisfy(p -> assertThat(p.absSize()).isGreaterThanOrEqualTo(PositionLedger.EPSILON));
    }

    LedgerSnapshot snapshot = ledger.snapshot();
    double fromLogs = snapshot.evictedRealizedPnL()
        + snapshot.closedPositions().stream().mapToDouble(ClosedPositionRecord::realizedPnL).sum()
        + snapshot.resolvedPositions().stream().mapToDouble(ResolvedPositionRecord::realizedPnL).sum();
    assertThat(ledger.realizedPnL()).isCloseTo(fromLogs, within(1e-6));
    assertThat(snapshot.closedPositions()).hasSizeLessThanOrEqualTo(PositionLedger.MAX_CLOSED_POSITIONS);
    assertThat(snapshot.tradeHistory()).hasSizeLessThanOrEqualTo(PositionLedger.MAX_TRADE_HISTORY);
  }

  @Test
  void concurrentFillsOnOneLedgerAreSerialized() throws Exception {
    PositionLedger ledger = new PositionLedger(MutableClock.atEpochSecond(1_000));
    int threads = 4;
    int fillsPerThread = 250;
    ExecutorService pool = Executors.newFixedThreadPool(threads + 1);
    CountDownLatch go = new CountDownLatch(1);
    AtomicBoolean writing = new AtomicBoolean(true);
    try {
      List<Future<?>> writers = new ArrayList<>();
      for (int t = 0; t < threads; t++) {
        double price = 0.20 + 0.10 * t;
        writers.add(pool.submit(() -> {
          go.await();
          for (int i = 0; i < fillsPerThread; i++) {
            ledger.applyTrade(buy("tok-a", "m1", "Up", 1, price, 1_000 + i), 1);
          }
          return null;
        }));
      }
      Future<?> reader = pool.submit(() -> {
        go.await();
        while (writing.get()) {
          assertThat(ledger.isConsistent()).isTrue();
          ledger.statsForWindow(Instant.EPOCH, Instant.ofEpochSecond(5_000));
          ledger.snapshot();
        }
        return null;
      });

      go.countDown();
      for (Future<?> writer : writers) {
        writer.get(30, TimeUnit.SECONDS);
      }
      writing.set(false);
      reader.get(30, TimeUnit.SECONDS);
    } finally {
      pool.shutdownNow();
    }

    Position position = ledger.position("tok-a").orElseThrow();
    assertThat(position.netSize()).isCloseTo(1_000.0, within(1e-9));
    assertThat(position.avgEntryPrice()).isCloseTo(0.35, within(1e-9));
    assertThat(ledger.tradeHistory()).hasSize(threads * fillsPerThread);
    assertThat(ledger.isConsistent()).isTrue();
  }

  @Test
  void restoreCorrectsDriftedRealizedPnL() {
    PositionLedger ledger = new PositionLedger(MutableClock.atEpochSecond(1_000));
    ledger.applyTrade(buy("tok-a", "m1", "Up", 10, 0.40, 1_000), 10);
    ledger.applyTrade(sell("tok-a", "m1", "Up", 10, 0.50, 1_001), 10);
    LedgerSnapshot good = ledger.snapshot();
    LedgerSnapshot drifted = new LedgerSnapshot(good.openPositions(), good.closedPositions(),
        good.resolvedPositions(), good.tradeHistory(), 999.0, 0.0);

    PositionLedger restored = PositionLedger.restore(drifted, MutableClock.atEpochSecond(2_000));

    assertThat(restored.realizedPnL()).isCloseTo(1.0, within(1e-9));
    assertThat(restored.isConsistent()).isTrue();
  }

  @Test
  void restoreDropsDustPositions() {
    Instant t = Instant.ofEpochSecond(1_000);
    Position dust = new Position("tok-dust", "m1", "Up", 1e-9, 0.5, t, t, "BTC", "BTC [Up]");
    Position real = Position.open("tok-real", "m1", "Down", 3, 0.5, t, "BTC");
    LedgerSnapshot snapshot = new LedgerSnapshot(Map.of("tok-dust", dust, "tok-real", real),
        List.of(), List.of(), List.of(), 0.0, 0.0);

    PositionLedger restored = PositionLedger.restore(snapshot, MutableClock.atEpochSecond(1_000));

    assertThat(restored.openPositions()).containsOnlyKeys("tok-real");
  }

  @Test
  void snapshotSurvivesJsonRoundTrip() throws Exception {
    MutableClock clock = MutableClock.atEpochSecond(1_000);
    PositionLedger ledger = new PositionLedger(clock);
    ledger.applyTrade(buy("tok-up", "m1", "Up", 100, 0.50, 1_000), 100);
    clock.setEpochSecond(1_010);
    ledger.applyTrade(buy("tok-down", "m1", "Down", 40, 0.45, 1_010), 40);
    clock.setEpochSecond(1_020);
    ledger.applyTrade(sell("tok-x", "m2", "Yes", 25, 0.33, 1_020), 25);
    ledger.applyTrade(buy("tok-r", "m3", "Up", 20, 0.65, 1_020), 20);
    ledger.applyResolution("m3", "Up", Instant.ofEpochSecond(1_030), 0.99);
    LedgerSnapshot before = ledger.snapshot();

    LedgerSnapshotCodec codec = new LedgerSnapshotCodec();
    LedgerSnapshot after = codec.read(codec.write(before));

    assertThat(after).isEqualTo(before);
    PositionLedger restored = PositionLedger.restore(after, clock);
    assertThat(restored.openPositions()).isEqualTo(ledger.openPositions());
    assertThat(restored.realizedPnL()).isEqualTo(ledger.realizedPnL());
    assertThat(restored.snapshot()).isEqualTo(before);
  }
}
