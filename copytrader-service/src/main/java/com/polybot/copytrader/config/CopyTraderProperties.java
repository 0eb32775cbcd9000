package com.polybot.copytrader.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

@Validated
@ConfigurationProperties(prefix = "copytrader")
public record CopyTraderProperties(
    TradingMode mode,
    String targetWallet,
    List<String> accounts,
    @Valid Polymarket polymarket,
    @Valid Executor executor,
    @Valid Sizing sizing,
    @Valid Poll poll,
    @Valid Ledger ledger,
    @Valid Resolution resolution
) {

  public static final String DEFAULT_ACCOUNT = "default";

  public CopyTraderProperties {
    if (mode == null) {
      mode = TradingMode.PAPER;
    }
    targetWallet = targetWallet == null ? "" : targetWallet.trim().toLowerCase(Locale.ROOT);
    accounts = sanitizeStringList(accounts);
    if (accounts.isEmpty()) {
      accounts = List.of(DEFAULT_ACCOUNT);
    }
    if (polymarket == null) {
      polymarket = new Polymarket(null, null, null);
    }
    if (executor == null) {
      executor = new Executor(null);
    }
    if (sizing == null) {
      sizing = new Sizing(null, null);
    }
    if (poll == null) {
      poll = new Poll(null, null, null, null, null, null, null, null);
    }
    if (ledger == null) {
      ledger = new Ledger(null, null, null);
    }
    if (resolution == null) {
      resolution = new Resolution(null, null, null);
    }
  }

  public boolean dryRun() {
    return mode != TradingMode.LIVE;
  }

  private static List<String> sanitizeStringList(List<String> values) {
    if (values == null || values.isEmpty()) {
      return List.of();
    }
    return values.stream()
        .filter(Objects::nonNull)
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .distinct()
        .toList();
  }

  public enum TradingMode {
    PAPER,
    LIVE,
  }

  public enum LedgerStoreType {
    MEMORY,
    FILE,
    JDBC
  }

  public record Polymarket(
      String dataApiUrl,
      String clobRestUrl,
      String gammaUrl
  ) {
    public Polymarket {
      if (dataApiUrl == null || dataApiUrl.isBlank()) {
        dataApiUrl = "https://data-api.polymarket.com";
      }
      if (clobRestUrl == null || clobRestUrl.isBlank()) {
        clobRestUrl = "https://clob.polymarket.com";
      }
      if (gammaUrl == null || gammaUrl.isBlank()) {
        gammaUrl = "https://gamma-api.polymarket.com";
      }
    }
  }

  public record Executor(String baseUrl) {
    public Executor {
      if (baseUrl == null || baseUrl.isBlank()) {
        baseUrl = "http://localhost:8080";
      }
    }
  }

  public record Sizing(
      /**
       * Copy size as a multiple of the watched trade's size. 1.0 copies the exact size.
       */
      @NotNull @Positive Double riskMultiplier,
      /**
       * Upper bound on the USDC value of a single copy.
       */
      @NotNull @Positive Double maxTradeUsdc
  ) {
    public Sizing {
      if (riskMultiplier == null) {
        riskMultiplier = 1.0;
      }
      if (maxTradeUsdc == null) {
        maxTradeUsdc = 100.0;
      }
    }
  }

  public record Poll(
      @NotNull Boolean enabled,
      @NotNull @Min(100) Long intervalMillis,
      @NotNull @Min(1) Integer maxRetries,
      @NotNull @Min(0) Long initialRetryDelayMillis,
      @NotNull @Min(0) Long maxRetryDelayMillis,
      @NotNull @Min(1) Long requestTimeoutMillis,
      /**
       * JSON file holding the last seen timestamp and the recently seen transaction hashes.
       */
      String cursorPath,
      @NotNull @Min(1) Integer seenCapacity
  ) {
    public Poll {
      if (enabled == null) {
        enabled = true;
      }
      if (intervalMillis == null) {
        intervalMillis = 2_000L;
      }
      if (maxRetries == null) {
        maxRetries = 3;
      }
      if (initialRetryDelayMillis == null) {
        initialRetryDelayMillis = 1_000L;
      }
      if (maxRetryDelayMillis == null) {
        maxRetryDelayMillis = 60_000L;
      }
      if (requestTimeoutMillis == null) {
        requestTimeoutMillis = 10_000L;
      }
      if (cursorPath == null || cursorPath.isBlank()) {
        cursorPath = "bot_state.json";
      }
      if (seenCapacity == null) {
        seenCapacity = 10_000;
      }
    }
  }

  public record Ledger(
      LedgerStoreType store,
      String directory,
      String table
  ) {
    public Ledger {
      if (store == null) {
        store = LedgerStoreType.FILE;
      }
      if (directory == null || directory.isBlank()) {
        directory = "ledgers";
      }
      if (table == null || table.isBlank()) {
        table = "copytrader_ledger";
      }
    }
  }

  public record Resolution(
      @NotNull Boolean enabled,
      @NotNull @Min(1_000) Long pollIntervalMillis,
      /**
       * An outcome priced at or above this on a closed market is taken as the winner.
       */
      @NotNull @DecimalMin("0.5") @DecimalMax("1.0") Double winningPriceThreshold
  ) {
    public Resolution {
      if (enabled == null) {
        enabled = true;
      }
      if (pollIntervalMillis == null) {
        pollIntervalMillis = 60_000L;
      }
      if (winningPriceThreshold == null) {
        winningPriceThreshold = 0.99;
      }
    }
  }
}
