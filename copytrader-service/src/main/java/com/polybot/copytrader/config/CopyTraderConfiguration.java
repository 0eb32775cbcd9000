package com.polybot.copytrader.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polybot.copytrader.copy.CopyTradeService;
import com.polybot.copytrader.feed.FeedCursorStore;
import com.polybot.copytrader.feed.TradeFeedPoller;
import com.polybot.copytrader.ledger.LedgerRegistry;
import com.polybot.copytrader.ledger.store.InMemoryLedgerStore;
import com.polybot.copytrader.ledger.store.JdbcLedgerStore;
import com.polybot.copytrader.ledger.store.JsonFileLedgerStore;
import com.polybot.copytrader.ledger.store.LedgerSnapshotCodec;
import com.polybot.copytrader.ledger.store.LedgerStore;
import com.polybot.copytrader.notify.LoggingPositionEventNotifier;
import com.polybot.copytrader.notify.PositionEventNotifier;
import com.polybot.copytrader.order.ExecutorOrderPlacer;
import com.polybot.copytrader.order.OrderPlacer;
import com.polybot.copytrader.order.PaperOrderPlacer;
import com.polybot.copytrader.polymarket.ClobPriceClient;
import com.polybot.copytrader.polymarket.GammaMarketClient;
import com.polybot.copytrader.polymarket.PolymarketActivityClient;
import com.polybot.copytrader.polymarket.PolymarketHttpClient;
import com.polybot.copytrader.polymarket.RetryPolicy;
import com.polybot.copytrader.resolution.GammaResolutionDetector;
import com.polybot.copytrader.sizing.TradeSizer;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.annotation.Scheduled;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires up:
 * - Polymarket clients (activity feed, CLOB midpoints, Gamma markets) over one retrying HTTP client
 * - the ledger store selected by {@code copytrader.ledger.store} and the per-account registry
 * - sizing, order placement and the copy service
 * - scheduled trade polling and resolution detection
 */
@Slf4j
@Configuration
public class CopyTraderConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Bean
    public PolymarketHttpClient polymarketHttpClient(HttpClient httpClient, ObjectMapper objectMapper,
                                                     CopyTraderProperties properties) {
        CopyTraderProperties.Poll poll = properties.poll();
        RetryPolicy retryPolicy = new RetryPolicy(
                poll.maxRetries(),
                Duration.ofMillis(poll.initialRetryDelayMillis()),
                Duration.ofMillis(poll.maxRetryDelayMillis()),
                Duration.ofMillis(poll.requestTimeoutMillis())
        );
        return new PolymarketHttpClient(httpClient, objectMapper, retryPolicy);
    }

    @Bean
    public PolymarketActivityClient polymarketActivityClient(CopyTraderProperties properties,
                                                             PolymarketHttpClient http) {
        return new PolymarketActivityClient(properties.polymarket().dataApiUrl(), http);
    }

    @Bean
    public ClobPriceClient clobPriceClient(CopyTraderProperties properties, PolymarketHttpClient http) {
        return new ClobPriceClient(properties.polymarket().clobRestUrl(), http);
    }

    @Bean
    public GammaMarketClient gammaMarketClient(CopyTraderProperties properties, PolymarketHttpClient http,
                                               ObjectMapper objectMapper) {
        return new GammaMarketClient(properties.polymarket().gammaUrl(), http, objectMapper);
    }

    @Bean
    public LedgerSnapshotCodec ledgerSnapshotCodec() {
        return new LedgerSnapshotCodec();
    }

    @Bean
    @ConditionalOnMissingBean
    public LedgerStore ledgerStore(CopyTraderProperties properties, LedgerSnapshotCodec codec,
                                   ObjectProvider<JdbcTemplate> jdbcTemplate, Clock clock) {
        CopyTraderProperties.Ledger ledger = properties.ledger();
        switch (ledger.store()) {
            case MEMORY:
                log.warn("ledger store is MEMORY: ledgers are lost on restart");
                return new InMemoryLedgerStore();
            case JDBC:
                JdbcLedgerStore jdbc = new JdbcLedgerStore(jdbcTemplate.getObject(), codec, clock, ledger.table());
                jdbc.createTableIfMissing();
                return jdbc;
            case FILE:
            default:
                log.info("ledgers stored as JSON under {}", Path.of(ledger.directory()).toAbsolutePath());
                return new JsonFileLedgerStore(Path.of(ledger.directory()), codec);
        }
    }

    @Bean
    public LedgerRegistry ledgerRegistry(LedgerStore ledgerStore, Clock clock) {
        return new LedgerRegistry(ledgerStore, clock);
    }

    @Bean
    public TradeSizer tradeSizer(CopyTraderProperties properties) {
        return new TradeSizer(properties.sizing().riskMultiplier(), properties.sizing().maxTradeUsdc());
    }

    @Bean
    @ConditionalOnMissingBean
    public OrderPlacer orderPlacer(CopyTraderProperties properties, HttpClient httpClient, ObjectMapper objectMapper) {
        if (properties.dryRun()) {
            return new PaperOrderPlacer();
        }
        return new ExecutorOrderPlacer(properties.executor().baseUrl(), httpClient, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public PositionEventNotifier positionEventNotifier() {
        return new LoggingPositionEventNotifier();
    }

    @Bean
    public CopyTradeService copyTradeService(
            TradeSizer tradeSizer,
            LedgerRegistry ledgerRegistry,
            OrderPlacer orderPlacer,
            PositionEventNotifier notifier,
            CopyTraderProperties properties,
            MeterRegistry meterRegistry
    ) {
        return new CopyTradeService(tradeSizer, ledgerRegistry, orderPlacer, notifier, properties.accounts(),
                meterRegistry);
    }

    @Bean
    public GammaResolutionDetector gammaResolutionDetector(GammaMarketClient gamma, LedgerRegistry ledgerRegistry,
                                                           CopyTraderProperties properties, Clock clock) {
        return new GammaResolutionDetector(gamma, ledgerRegistry,
                properties.resolution().winningPriceThreshold(), clock);
    }

    @Bean
    public ApplicationRunner startupBanner(CopyTraderProperties properties) {
        return args -> {
            log.info("============================================================");
            log.info("   POLYMARKET COPY TRADER");
            log.info("============================================================");
            if (!properties.dryRun()) {
                log.warn("LIVE mode: copy orders are sent to the executor at {}", properties.executor().baseUrl());
            }
            log.info("target wallet: {}", properties.targetWallet());
            log.info("accounts: {}", properties.accounts());
            log.info("max trade size: ${} USDC, risk multiplier: {}x",
                    properties.sizing().maxTradeUsdc(), properties.sizing().riskMultiplier());
            log.info("poll interval: {} ms, dry run: {}", properties.poll().intervalMillis(), properties.dryRun());
            log.info("ledger store: {}", properties.ledger().store());
        };
    }

    @Bean
    @ConditionalOnProperty(prefix = "copytrader.poll", name = "enabled", havingValue = "true", matchIfMissing = true)
    public TradeFeedPoller tradeFeedPoller(
            PolymarketActivityClient activityClient,
            CopyTradeService copyTradeService,
            CopyTraderProperties properties,
            ObjectMapper objectMapper,
            Clock clock
    ) {
        if (properties.targetWallet().isBlank()) {
            throw new IllegalStateException("copytrader.target-wallet must be set when polling is enabled");
        }
        FeedCursorStore cursorStore = new FeedCursorStore(Path.of(properties.poll().cursorPath()), objectMapper, clock);
        return new TradeFeedPoller(activityClient, copyTradeService, cursorStore, properties.targetWallet(),
                properties.poll().seenCapacity());
    }

    /**
     * Separate bean so {@code @Scheduled} is picked up; the poller itself is built with {@code new}.
     */
    @Bean
    @ConditionalOnProperty(prefix = "copytrader.poll", name = "enabled", havingValue = "true", matchIfMissing = true)
    public TradeFeedSchedule tradeFeedSchedule(TradeFeedPoller poller) {
        return new TradeFeedSchedule(poller);
    }

    @Slf4j
    public static class TradeFeedSchedule {
        private final TradeFeedPoller poller;

        public TradeFeedSchedule(TradeFeedPoller poller) {
            this.poller = poller;
        }

        @Scheduled(fixedDelayString = "${copytrader.poll.interval-millis:2000}")
        public void poll() {
            try {
                poller.poll();
            } catch (Exception e) {
                log.warn("error polling for trades: {}", e.getMessage());
            }
        }
    }

    @Bean
    @ConditionalOnProperty(prefix = "copytrader.resolution", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ResolutionSchedule resolutionSchedule(GammaResolutionDetector detector) {
        return new ResolutionSchedule(detector);
    }

    @Slf4j
    public static class ResolutionSchedule {
        private final GammaResolutionDetector detector;

        public ResolutionSchedule(GammaResolutionDetector detector) {
            this.detector = detector;
        }

        @Scheduled(fixedDelayString = "${copytrader.resolution.poll-interval-millis:60000}",
                initialDelayString = "${copytrader.resolution.poll-interval-millis:60000}")
        public void detect() {
            try {
                detector.detectAndApply();
            } catch (Exception e) {
                log.warn("error checking market resolutions: {}", e.getMessage());
            }
        }
    }
}
