package com.polybot.copytrader.copy;

import com.polybot.copytrader.domain.ObservedTrade;
import com.polybot.copytrader.domain.TradeSide;
import com.polybot.copytrader.ledger.LedgerPersistenceException;
import com.polybot.copytrader.ledger.LedgerRegistry;
import com.polybot.copytrader.ledger.model.LedgerSnapshot;
import com.polybot.copytrader.ledger.model.PositionEvent;
import com.polybot.copytrader.ledger.model.PositionEventKind;
import com.polybot.copytrader.ledger.store.InMemoryLedgerStore;
import com.polybot.copytrader.ledger.store.LedgerStore;
import com.polybot.copytrader.order.OrderFailureKind;
import com.polybot.copytrader.order.OrderResult;
import com.polybot.copytrader.sizing.TradeSizer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.polybot.copytrader.TradeFixtures.buy;
import static com.polybot.copytrader.TradeFixtures.sell;
import static com.polybot.copytrader.TradeFixtures.trade;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CopyTradeServiceTest {

  private final Clock clock = Clock.fixed(Instant.ofEpochSecond(1_000), ZoneOffset.UTC);

  private SimpleMeterRegistry meterRegistry;
  private RecordingOrderPlacer orderPlacer;
  private List<String> notified;
  private List<PositionEvent> notifiedEvents;
  private InMemoryLedgerStore store;
  private LedgerRegistry ledgers;
  private CopyTradeService service;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    orderPlacer = new RecordingOrderPlacer();
    notified = new ArrayList<>();
    notifiedEvents = new ArrayList<>();
    store = new InMemoryLedgerStore();
    ledgers = new LedgerRegistry(store, clock);
    service = newService(ledgers, List.of("chat-1", "chat-2"));
  }

  @Test
  void copiesIntoEveryAccountAndPlacesTheOrder() {
    Optional<OrderResult> result = service.process(buy("0xt1", 40, 0.50, 1_000));

    assertThat(result).contains(OrderResult.submitted("order-1"));
    assertThat(ledgers.ledger("chat-1").position("tok-up"))
        .hasValueSatisfying(p -> assertThat(p.netSize()).isCloseTo(40.0, within(1e-9)));
    assertThat(ledgers.ledger("chat-2").position("tok-up")).isPresent();
    assertThat(notified).containsExactly("chat-1", "chat-2");
    assertThat(notifiedEvents).extracting(PositionEvent::kind)
        .containsExactly(PositionEventKind.OPENED, PositionEventKind.OPENED);
    assertThat(orderPlacer.orders()).singleElement().satisfies(order -> {
      assertThat(order.tokenId()).isEqualTo("tok-up");
      assertThat(order.side()).isEqualTo(TradeSide.BUY);
      assertThat(order.price()).isEqualTo(0.50);
      assertThat(order.size()).isCloseTo(40.0, within(1e-9));
      assertThat(order.sourceTransactionHash()).isEqualTo("0xt1");
    });
    assertThat(meterRegistry.counter("copytrader.trades.copied").count()).isEqualTo(1.0);
  }

  @Test
  void filteredTradesTouchNothing() {
    ObservedTrade bad = trade("0xbad", TradeSide.BUY, "tok-up", "0xmarket", "Up", 10, 0.0, 1_000);

    assertThat(service.process(bad)).isEmpty();

    assertThat(ledgers.ledger("chat-1").tradeHistory()).isEmpty();
    assertThat(orderPlacer.orders()).isEmpty();
    assertThat(meterRegistry.counter("copytrader.trades.skipped").count()).isEqualTo(1.0);
  }

  @Test
  void ledgersRecordTheCappedSize() {
    service.process(buy("0xt1", 1_000, 0.40, 1_000));

    assertThat(ledgers.ledger("chat-1").position("tok-up"))
        .hasValueSatisfying(p -> assertThat(p.netSize()).isCloseTo(250.0, within(1e-9)));
    assertThat(orderPlacer.orders().get(0).size()).isCloseTo(250.0, within(1e-9));
  }

  @Test
  void failedOrdersLeaveTheLedgerUpdated() {
    orderPlacer.setNextResult(OrderResult.failed("not enough balance / allowance"));

    Optional<OrderResult> result = service.process(buy("0xt1", 10, 0.50, 1_000));

    assertThat(result).hasValueSatisfying(r -> assertThat(r.failureKind()).isEqualTo(OrderFailureKind.INSUFFICIENT_BALANCE));
    assertThat(ledgers.ledger("chat-1").position("tok-up")).isPresent();
    assertThat(meterRegistry.counter("copytrader.orders.failed").count()).isEqualTo(1.0);
  }

  @Test
  void closingTradeNotifiesRealizedPnL() {
    service.process(buy("0xt1", 10, 0.40, 1_000));
    notifiedEvents.clear();

    service.process(sell("0xt2", 10, 0.50, 1_010));

    assertThat(notifiedEvents).extracting(PositionEvent::kind)
        .containsOnly(PositionEventKind.FULL_CLOSE);
    assertThat(notifiedEvents.get(0).realizedPnLDelta()).isCloseTo(1.0, within(1e-9));
  }

  @Test
  void persistenceFailuresStillNotify() {
    LedgerStore failingStore = mock(LedgerStore.class);
    when(failingStore.load(anyString())).thenReturn(Optional.empty());
    when(failingStore.accountKeys()).thenReturn(Set.of());
    doThrow(new LedgerPersistenceException("chat-1", "disk full", new IOException("disk full")))
        .when(failingStore).save(anyString(), any(LedgerSnapshot.class));
    LedgerRegistry failingLedgers = new LedgerRegistry(failingStore, clock);
    CopyTradeService failing = newService(failingLedgers, List.of("chat-1"));

    failing.process(buy("0xt1", 10, 0.50, 1_000));

    assertThat(notifiedEvents).extracting(PositionEvent::kind).containsExactly(PositionEventKind.OPENED);
    assertThat(failingLedgers.ledger("chat-1").position("tok-up")).isPresent();
    assertThat(orderPlacer.orders()).hasSize(1);
    assertThat(meterRegistry.counter("copytrader.ledger.persistence.failures").count()).isEqualTo(1.0);
  }

  @Test
  void storedAccountsAreIncluded() {
    store.save("chat-9", LedgerSnapshot.empty());

    assertThat(service.accounts()).containsExactly("chat-1", "chat-2", "chat-9");
  }

  private CopyTradeService newService(LedgerRegistry registry, List<String> accounts) {
    return new CopyTradeService(
        new TradeSizer(1.0, 100.0),
        registry,
        orderPlacer,
        (account, events) -> {
          notified.add(account);
          notifiedEvents.addAll(events);
        },
        accounts,
        meterRegistry
    );
  }
}
