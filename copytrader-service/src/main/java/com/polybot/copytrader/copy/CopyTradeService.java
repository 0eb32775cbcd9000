package com.polybot.copytrader.copy;

import com.polybot.copytrader.domain.ObservedTrade;
import com.polybot.copytrader.ledger.LedgerPersistenceException;
import com.polybot.copytrader.ledger.LedgerRegistry;
import com.polybot.copytrader.ledger.model.PositionEvent;
import com.polybot.copytrader.notify.PositionEventNotifier;
import com.polybot.copytrader.order.CopyOrder;
import com.polybot.copytrader.order.OrderPlacer;
import com.polybot.copytrader.order.OrderResult;
import com.polybot.copytrader.sizing.SizingDecision;
import com.polybot.copytrader.sizing.TradeSizer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Copies one watched trade.
 *
 * Flow:
 * 1. Validate and size the trade
 * 2. Apply the copy to every account ledger and forward the resulting events
 * 3. Hand the order to the {@link OrderPlacer}
 *
 * The ledgers record the copy whether or not the order goes through.
 */
@Slf4j
public class CopyTradeService {

    private final TradeSizer sizer;
    private final LedgerRegistry ledgers;
    private final OrderPlacer orderPlacer;
    private final PositionEventNotifier notifier;
    private final Collection<String> configuredAccounts;

    private final Counter tradesCopiedCounter;
    private final Counter tradesSkippedCounter;
    private final Counter persistenceFailuresCounter;
    private final Counter ordersFailedCounter;

    public CopyTradeService(
            TradeSizer sizer,
            LedgerRegistry ledgers,
            OrderPlacer orderPlacer,
            PositionEventNotifier notifier,
            Collection<String> configuredAccounts,
            MeterRegistry meterRegistry
    ) {
        this.sizer = sizer;
        this.ledgers = ledgers;
        this.orderPlacer = orderPlacer;
        this.notifier = notifier;
        this.configuredAccounts = List.copyOf(configuredAccounts);

        this.tradesCopiedCounter = Counter.builder("copytrader.trades.copied")
                .description("Watched trades copied into the ledgers")
                .register(meterRegistry);
        this.tradesSkippedCounter = Counter.builder("copytrader.trades.skipped")
                .description("Watched trades rejected before sizing")
                .register(meterRegistry);
        this.persistenceFailuresCounter = Counter.builder("copytrader.ledger.persistence.failures")
                .description("Ledger writes that failed after a trade was applied")
                .register(meterRegistry);
        this.ordersFailedCounter = Counter.builder("copytrader.orders.failed")
                .description("Copy orders the placer reported as failed")
                .register(meterRegistry);
    }

    /**
     * @return the order outcome, empty when the trade was filtered out
     */
    public Optional<OrderResult> process(ObservedTrade trade) {
        log.info("new trade detected: {} market={} title='{}'", trade, trade.marketId(), trade.title());

        if (!sizer.shouldCopy(trade)) {
            log.warn("trade {} filtered out, not copying", trade.shortHash());
            tradesSkippedCounter.increment();
            return Optional.empty();
        }

        SizingDecision sizing = sizer.size(trade);
        log.info("our copy: {} shares ({} USDC, {}x multiplier)",
                String.format("%.2f", sizing.copySize()), String.format("%.2f", sizing.copyValue()),
                sizer.riskMultiplier());

        for (String account : accounts()) {
            applyToLedger(account, trade, sizing.copySize());
        }
        tradesCopiedCounter.increment();

        OrderResult result = orderPlacer.place(new CopyOrder(
                trade.tokenId(), trade.side(), trade.price(), sizing.copySize(), trade.transactionHash()));
        if (result.isFailure()) {
            ordersFailedCounter.increment();
            log.warn("failed to copy trade {}: {}", trade.shortHash(), result.failureKind());
        } else if (result.status() == OrderResult.Status.SUBMITTED) {
            log.info("copied trade {}, order {}", trade.shortHash(), result.orderId());
        }
        return Optional.of(result);
    }

    Set<String> accounts() {
        Set<String> accounts = new TreeSet<>(configuredAccounts);
        accounts.addAll(ledgers.accountKeys());
        return accounts;
    }

    private void applyToLedger(String account, ObservedTrade trade, double copySize) {
        List<PositionEvent> events;
        try {
            events = ledgers.applyTrade(account, trade, copySize);
        } catch (LedgerPersistenceException e) {
            persistenceFailuresCounter.increment();
            log.error("ledger {} updated but not saved: {}", account, e.getMessage());
            events = e.pendingEvents();
        }
        if (!events.isEmpty()) {
            notifier.notify(account, events);
        }
    }
}
