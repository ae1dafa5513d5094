package com.polybot.crypto.config;

import com.polybot.crypto.domain.CryptoAsset;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

class CryptoTraderPropertiesBindingTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(TestConfig.class);

  @Test
  void bindsNestedRecordsFromRelaxedProperties() {
    runner.withPropertyValues(
            "crypto.risk.max-total-exposure=2000",
            "crypto.risk.cooldown-minutes=10",
            "crypto.exit.profit-target-pct=0.2",
            "crypto.feed.assets=BTC,ETH",
            "crypto.feed.significant-move-percent=0.02",
            "crypto.sizing.gap-tiers[0].threshold=0.3",
            "crypto.sizing.gap-tiers[0].multiplier=1.1",
            "crypto.sizing.gap-tiers[1].threshold=0.6",
            "crypto.sizing.gap-tiers[1].multiplier=2.0"
        )
        .run(context -> {
          CryptoTraderProperties properties = context.getBean(CryptoTraderProperties.class);

          assertThat(properties.risk().maxTotalExposure()).isEqualTo(2000.0);
          assertThat(properties.risk().cooldownMinutes()).isEqualTo(10L);
          assertThat(properties.risk().maxSimultaneousPositions()).isEqualTo(3);
          assertThat(properties.exit().profitTargetPct()).isEqualTo(0.2);
          assertThat(properties.feed().assets()).containsExactly(CryptoAsset.BTC, CryptoAsset.ETH);
          assertThat(properties.feed().significantMovePercent()).isEqualTo(0.02);

          // tiers are ordered highest threshold first
          assertThat(properties.sizing().gapTiers())
              .extracting(CryptoTraderProperties.Tier::threshold)
              .containsExactly(0.6, 0.3);
        });
  }

  @Test
  void fillsDefaultsWhenNothingConfigured() {
    runner.run(context -> {
      CryptoTraderProperties properties = context.getBean(CryptoTraderProperties.class);

      assertThat(properties.sizing().basePositionSize()).isEqualTo(200.0);
      assertThat(properties.sizing().maxPositionSize()).isEqualTo(500.0);
      assertThat(properties.sizing().volumeTiers()).hasSize(3);
      assertThat(properties.risk().dailyLossLimit()).isEqualTo(100.0);
      assertThat(properties.risk().maxDailyTrades()).isEqualTo(20);
      assertThat(properties.exit().maxHoldTimeSeconds()).isEqualTo(120L);
      assertThat(properties.detection().minGapPercent()).isEqualTo(0.20);
      assertThat(properties.discovery().minVolume()).isEqualTo(50_000.0);
      assertThat(properties.feed().wsUrl()).isEqualTo("wss://stream.binance.com:9443/ws");
      assertThat(properties.feed().assets()).containsExactly(CryptoAsset.BTC, CryptoAsset.ETH, CryptoAsset.SOL);
      assertThat(properties.feed().maxReconnectAttempts()).isEqualTo(10);
      assertThat(properties.priceCache().ttlMillis()).isEqualTo(10_000L);
    });
  }

  @Test
  void rejectsInvalidLimits() {
    runner.withPropertyValues("crypto.risk.max-simultaneous-positions=0")
        .run(context -> assertThat(context).hasFailed());
  }

  @Configuration(proxyBeanMethods=false)
  @EnableConfigurationProperties(CryptoTraderProperties.class)
  static class TestConfig {
  }
}
