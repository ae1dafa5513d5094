package com.polybot.crypto.pricing;

import com.polybot.crypto.concurrent.SingleFlight;
import com.polybot.crypto.domain.MarketQuote;
import com.polybot.crypto.polymarket.discovery.MarketListing;
import com.polybot.crypto.polymarket.discovery.MarketListingSource;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Outcome prices for every open listing, refreshed in bulk at most once per TTL.
 *
 * <p>Reads never wait: they trigger a background refresh when the data is older than the TTL and
 * return whatever was loaded last. While a refresh is running further triggers are skipped.
 */
@Slf4j
public class MarketPriceCache {

    private final MarketListingSource listingSource;
    private final Executor refreshExecutor;
    private final Clock clock;
    private final Duration ttl;
    private final SingleFlight<Map<String, MarketQuote>> flight = new SingleFlight<>();

    private volatile Instant lastRefreshStartedAt;

    public MarketPriceCache(MarketListingSource listingSource, Executor refreshExecutor, Clock clock, Duration ttl) {
        this.listingSource = listingSource;
        this.refreshExecutor = refreshExecutor;
        this.clock = clock;
        this.ttl = ttl;
    }

    public Optional<MarketQuote> quote(String marketId) {
        refreshIfStale();
        return flight.latest().map(quotes -> quotes.get(marketId));
    }

    /**
     * Starts a refresh unless one is running or the last one started within the TTL.
     */
    public void refreshIfStale() {
        Instant last = lastRefreshStartedAt;
        if (last != null && Duration.between(last, clock.instant()).compareTo(ttl) < 0) {
            return;
        }
        refresh();
    }

    /**
     * Starts a refresh now unless one is already running, ignoring the TTL. Used for the start-up
     * warm-up; everything else goes through {@link #refreshIfStale()}.
     *
     * @return the running refresh
     */
    public CompletableFuture<Map<String, MarketQuote>> refresh() {
        if (!flight.isInFlight()) {
            lastRefreshStartedAt = clock.instant();
        }
        CompletableFuture<Map<String, MarketQuote>> future = flight.run(this::load, refreshExecutor);
        future.whenComplete((quotes, error) -> {
            if (error != null) {
                log.warn("PRICE CACHE: refresh failed, serving previous quotes: {}", error.getMessage());
            }
        });
        return future;
    }

    public int size() {
        return flight.latest().map(Map::size).orElse(0);
    }

    public Optional<Instant> lastRefreshStartedAt() {
        return Optional.ofNullable(lastRefreshStartedAt);
    }

    private Map<String, MarketQuote> load() {
        Instant now = clock.instant();
        Map<String, MarketQuote> quotes = new HashMap<>();
        for (MarketListing listing : listingSource.fetchOpenListings()) {
            if (listing.hasPrices()) {
                quotes.put(listing.id(), new MarketQuote(listing.id(), listing.yesPrice(), listing.noPrice(), now));
            }
        }
        log.debug("PRICE CACHE: refreshed {} quotes", quotes.size());
        return Map.copyOf(quotes);
    }
}
