package com.polybot.crypto.config;

import com.polybot.crypto.domain.CryptoAsset;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

@Validated
@ConfigurationProperties(prefix="crypto")
public record CryptoTraderProperties(
    @Valid Sizing sizing,
    @Valid Risk risk,
    @Valid Exit exit,
    @Valid Detection detection,
    @Valid Discovery discovery,
    @Valid Feed feed,
    @Valid PriceCache priceCache,
    @Valid Orchestrator orchestrator
) {

  public CryptoTraderProperties {
    if (sizing == null) {
      sizing = new Sizing(null, null, null, null);
    }
    if (risk == null) {
      risk = new Risk(null, null, null, null, null);
    }
    if (exit == null) {
      exit = new Exit(null, null, null, null);
    }
    if (detection == null) {
      detection = new Detection(null, null, null, null, null, null, null, null, null);
    }
    if (discovery == null) {
      discovery = new Discovery(null, null, null, null, null, null, null);
    }
    if (feed == null) {
      feed = new Feed(null, null, null, null, null, null, null, null, null, null);
    }
    if (priceCache == null) {
      priceCache = new PriceCache(null);
    }
    if (orchestrator == null) {
      orchestrator = new Orchestrator(null, null, null);
    }
  }

  public static CryptoTraderProperties defaults() {
    return new CryptoTraderProperties(null, null, null, null, null, null, null, null);
  }

  private static List<Tier> sortTiers(List<Tier> tiers, List<Tier> fallback) {
    if (tiers == null || tiers.isEmpty()) {
      return fallback;
    }
    return tiers.stream()
        .filter(Objects::nonNull)
        .sorted(Comparator.comparingDouble(Tier::threshold).reversed())
        .toList();
  }

  /**
   * A sizing tier: values at or above {@code threshold} scale the base size by {@code multiplier}.
   */
  public record Tier(
      @PositiveOrZero double threshold,
      @Positive double multiplier
  ) {
  }

  public record Sizing(
      @PositiveOrZero Double basePositionSize,
      @PositiveOrZero Double maxPositionSize,
      List<Tier> gapTiers,
      List<Tier> volumeTiers
  ) {
    public Sizing {
      if (basePositionSize == null) {
        basePositionSize = 200.0;
      }
      if (maxPositionSize == null) {
        maxPositionSize = 500.0;
      }
      gapTiers = sortTiers(gapTiers, List.of(
          new Tier(0.40, 1.5),
          new Tier(0.30, 1.25),
          new Tier(0.20, 1.0)
      ));
      volumeTiers = sortTiers(volumeTiers, List.of(
          new Tier(200_000, 1.2),
          new Tier(100_000, 1.1),
          new Tier(50_000, 1.0)
      ));
    }
  }

  public record Risk(
      @PositiveOrZero Double maxTotalExposure,
      @Min(1) Integer maxSimultaneousPositions,
      @PositiveOrZero Long cooldownMinutes,
      @PositiveOrZero Double dailyLossLimit,
      @Min(1) Integer maxDailyTrades
  ) {
    public Risk {
      if (maxTotalExposure == null) {
        maxTotalExposure = 1500.0;
      }
      if (maxSimultaneousPositions == null) {
        maxSimultaneousPositions = 3;
      }
      if (cooldownMinutes == null) {
        cooldownMinutes = 5L;
      }
      if (dailyLossLimit == null) {
        dailyLossLimit = 100.0;
      }
      if (maxDailyTrades == null) {
        maxDailyTrades = 20;
      }
    }
  }

  public record Exit(
      @Min(1) Long maxHoldTimeSeconds,
      @Positive Double profitTargetPct,
      @Positive @DecimalMax("1.0") Double stopLossPct,
      @Min(100) Long sweepIntervalMillis
  ) {
    public Exit {
      if (maxHoldTimeSeconds == null) {
        maxHoldTimeSeconds = 120L;
      }
      if (profitTargetPct == null) {
        profitTargetPct = 0.15;
      }
      if (stopLossPct == null) {
        stopLossPct = 0.05;
      }
      if (sweepIntervalMillis == null) {
        sweepIntervalMillis = 1_000L;
      }
    }
  }

  /**
   * Mispricing thresholds and the constants of the expected-probability curve.
   */
  public record Detection(
      @PositiveOrZero Double minGapPercent,
      @DecimalMax("1.0") Double baseHigh,
      @DecimalMax("1.0") Double capHigh,
      @PositiveOrZero Double kHigh,
      @PositiveOrZero Double bonusCap,
      @DecimalMax("1.0") Double baseLow,
      @PositiveOrZero Double capLow,
      @PositiveOrZero Double kLow,
      @PositiveOrZero Double penaltyCap
  ) {
    public Detection {
      if (minGapPercent == null) {
        minGapPercent = 0.20;
      }
      if (baseHigh == null) {
        baseHigh = 0.85;
      }
      if (capHigh == null) {
        capHigh = 0.98;
      }
      if (kHigh == null) {
        kHigh = 2.0;
      }
      if (bonusCap == null) {
        bonusCap = 0.13;
      }
      if (baseLow == null) {
        baseLow = 0.50;
      }
      if (capLow == null) {
        capLow = 0.05;
      }
      if (kLow == null) {
        kLow = 4.0;
      }
      if (penaltyCap == null) {
        penaltyCap = 0.45;
      }
    }
  }

  public record Discovery(
      @PositiveOrZero Double minVolume,
      @PositiveOrZero Double minResolutionHours,
      @Min(1) Long discoveryIntervalMinutes,
      String gammaBaseUrl,
      @Min(1) Integer pageSize,
      @Min(1) Integer maxPages,
      @Min(100) Long httpTimeoutMillis
  ) {
    public Discovery {
      if (minVolume == null) {
        minVolume = 50_000.0;
      }
      if (minResolutionHours == null) {
        minResolutionHours = 24.0;
      }
      if (discoveryIntervalMinutes == null) {
        discoveryIntervalMinutes = 5L;
      }
      if (gammaBaseUrl == null || gammaBaseUrl.isBlank()) {
        gammaBaseUrl = "https://gamma-api.polymarket.com";
      }
      if (pageSize == null) {
        pageSize = 500;
      }
      if (maxPages == null) {
        maxPages = 10;
      }
      if (httpTimeoutMillis == null) {
        httpTimeoutMillis = 10_000L;
      }
    }
  }

  public record Feed(
      String wsUrl,
      List<CryptoAsset> assets,
      @Positive Double significantMovePercent,
      @Min(1) Long reconnectDelayMillis,
      @Positive Double backoffMultiplier,
      @Min(0) Integer maxReconnectAttempts,
      @Min(1000) Long heartbeatIntervalMillis,
      @PositiveOrZero Long sampleIntervalMillis,
      @Min(1) Long retentionMinutes,
      @Min(1) Integer maxSamples
  ) {
    public Feed {
      if (wsUrl == null || wsUrl.isBlank()) {
        wsUrl = "wss://stream.binance.com:9443/ws";
      }
      assets = (assets == null || assets.isEmpty())
          ? List.of(CryptoAsset.BTC, CryptoAsset.ETH, CryptoAsset.SOL)
          : assets.stream().filter(Objects::nonNull).distinct().toList();
      if (significantMovePercent == null) {
        significantMovePercent = 0.01;
      }
      if (reconnectDelayMillis == null) {
        reconnectDelayMillis = 5_000L;
      }
      if (backoffMultiplier == null) {
        backoffMultiplier = 1.5;
      }
      if (maxReconnectAttempts == null) {
        maxReconnectAttempts = 10;
      }
      if (heartbeatIntervalMillis == null) {
        heartbeatIntervalMillis = 30_000L;
      }
      if (sampleIntervalMillis == null) {
        sampleIntervalMillis = 1_000L;
      }
      if (retentionMinutes == null) {
        retentionMinutes = 5L;
      }
      if (maxSamples == null) {
        maxSamples = 300;
      }
    }
  }

  public record PriceCache(
      @Min(0) Long ttlMillis
  ) {
    public PriceCache {
      if (ttlMillis == null) {
        ttlMillis = 10_000L;
      }
    }
  }

  public record Orchestrator(
      Boolean autoStart,
      @Min(1) Integer recentOpportunityLimit,
      @NotNull @Min(16) Integer channelCapacity
  ) {
    public Orchestrator {
      if (autoStart == null) {
        autoStart = true;
      }
      if (recentOpportunityLimit == null) {
        recentOpportunityLimit = 10;
      }
      if (channelCapacity == null) {
        channelCapacity = 1024;
      }
    }
  }
}
