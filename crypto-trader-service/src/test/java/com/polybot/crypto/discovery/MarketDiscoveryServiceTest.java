package com.polybot.crypto.discovery;

import com.polybot.crypto.config.CryptoTraderProperties;
import com.polybot.crypto.domain.CryptoAsset;
import com.polybot.crypto.domain.Direction;
import com.polybot.crypto.domain.MarketStatus;
import com.polybot.crypto.domain.ThresholdMarket;
import com.polybot.crypto.polymarket.discovery.ListingValidator;
import com.polybot.crypto.polymarket.discovery.MarketListing;
import com.polybot.crypto.polymarket.discovery.MarketListingException;
import com.polybot.crypto.repository.InMemoryCryptoTradingRepository;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for MarketDiscoveryService.
 */
class MarketDiscoveryServiceTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");
    private static final Instant IN_A_WEEK = NOW.plus(Duration.ofDays(7));

    private final Clock clock = Clock.fixed(NOW, ZoneId.of("UTC"));
    private final InMemoryCryptoTradingRepository repository = new InMemoryCryptoTradingRepository();
    private final List<MarketListing> listings = new ArrayList<>();
    private final MarketDiscoveryService service = new MarketDiscoveryService(
            () -> listings,
            new ListingValidator(CryptoTraderProperties.defaults().discovery(), clock),
            repository,
            clock);

    @Test
    void upsertsMatchedThresholdMarkets() {
        // Given
        listings.add(listing("m1", "Will Bitcoin be above $100,000 on January 31?", 120_000));
        listings.add(listing("m2", "Will ETH fall below $3K by Friday?", 80_000));

        // When
        DiscoveryResult result = service.discover();

        // Then
        assertThat(result.discovered()).isEqualTo(2);
        assertThat(result.matched()).isEqualTo(2);
        assertThat(result.hasErrors()).isFalse();
        ThresholdMarket btc = repository.findMarket("m1").orElseThrow();
        assertThat(btc.asset()).isEqualTo(CryptoAsset.BTC);
        assertThat(btc.threshold()).isEqualTo(100_000);
        assertThat(btc.direction()).isEqualTo(Direction.ABOVE);
        assertThat(btc.status()).isEqualTo(MarketStatus.ACTIVE);
        assertThat(btc.discoveredAt()).isEqualTo(NOW);
        assertThat(repository.findMarket("m2").orElseThrow().direction()).isEqualTo(Direction.BELOW);
    }

    @Test
    void countsExcludedAndRejectedListings() {
        listings.add(listing("excluded", "Will BTC tweet about $100K?", 500_000));
        listings.add(listing("thin", "Will Bitcoin be above $100,000 on January 31?", 1_000));
        listings.add(listing("unrelated", "Who will win the election?", 900_000));
        listings.add(new MarketListing("soon", "Will SOL be above $200 tomorrow?", 90_000,
                NOW.plus(Duration.ofHours(3)), true, false, 0.4, 0.6));

        DiscoveryResult result = service.discover();

        assertThat(result.discovered()).isEqualTo(4);
        assertThat(result.matched()).isZero();
        assertThat(result.excluded()).isEqualTo(1);
        assertThat(result.rejected()).isEqualTo(2);
        assertThat(repository.findActiveMarkets()).isEmpty();
    }

    @Test
    void exclusionKeywordsCountOnlyForThresholdCandidates() {
        listings.add(listing("excluded", "Will BTC tweet about $100K?", 500_000));
        listings.add(listing("news", "Will Trump announce a new tariff this month?", 900_000));
        listings.add(listing("sec", "Will the SEC sue Coinbase?", 400_000));

        DiscoveryResult result = service.discover();

        assertThat(result.discovered()).isEqualTo(3);
        assertThat(result.excluded()).isEqualTo(1);
        assertThat(result.matched()).isZero();
    }

    @Test
    void deactivatesMarketsMissingFromSuccessfulRun() {
        // Given
        listings.add(listing("m1", "Will Bitcoin be above $100,000 on January 31?", 120_000));
        listings.add(listing("m2", "Will ETH fall below $3K by Friday?", 80_000));
        service.discover();

        // When
        listings.remove(1);
        DiscoveryResult result = service.discover();

        // Then
        assertThat(result.deactivated()).isEqualTo(1);
        assertThat(repository.findMarket("m2").orElseThrow().status()).isEqualTo(MarketStatus.INACTIVE);
        assertThat(repository.findActiveMarkets()).extracting(ThresholdMarket::marketId).containsExactly("m1");
    }

    @Test
    void emptyRunDeactivatesNothing() {
        listings.add(listing("m1", "Will Bitcoin be above $100,000 on January 31?", 120_000));
        service.discover();
        listings.clear();

        DiscoveryResult result = service.discover();

        assertThat(result.deactivated()).isZero();
        assertThat(repository.findActiveMarkets()).hasSize(1);
    }

    @Test
    void fetchFailureIsReportedWithoutTouchingCatalog() {
        listings.add(listing("m1", "Will Bitcoin be above $100,000 on January 31?", 120_000));
        service.discover();
        MarketDiscoveryService failing = new MarketDiscoveryService(
                () -> {
                    throw new MarketListingException("HTTP 503");
                },
                new ListingValidator(CryptoTraderProperties.defaults().discovery(), clock),
                repository,
                clock);

        DiscoveryResult result = failing.discover();

        assertThat(result.errors()).containsExactly("HTTP 503");
        assertThat(repository.findActiveMarkets()).hasSize(1);
    }

    @Test
    void storeFailureOnOneListingDoesNotAbortRun() {
        InMemoryCryptoTradingRepository flaky = new InMemoryCryptoTradingRepository() {
            @Override
            public synchronized void upsertMarket(ThresholdMarket market) {
                if (market.marketId().equals("bad")) {
                    throw new IllegalStateException("constraint violation");
                }
                super.upsertMarket(market);
            }
        };
        MarketDiscoveryService flakyService = new MarketDiscoveryService(
                () -> listings,
                new ListingValidator(CryptoTraderProperties.defaults().discovery(), clock),
                flaky,
                clock);
        listings.add(listing("bad", "Will Bitcoin be above $100,000 on January 31?", 120_000));
        listings.add(listing("good", "Will Ethereum be above $4,000 on January 31?", 120_000));

        DiscoveryResult result = flakyService.discover();

        assertThat(result.matched()).isEqualTo(1);
        assertThat(result.errors()).singleElement().asString().startsWith("bad:");
        assertThat(flaky.findMarket("good")).isPresent();
    }

    private static MarketListing listing(String id, String question, double volume) {
        return new MarketListing(id, question, volume, IN_A_WEEK, true, false, 0.5, 0.5);
    }
}
