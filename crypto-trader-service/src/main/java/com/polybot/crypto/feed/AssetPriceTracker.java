package com.polybot.crypto.feed;

import com.polybot.crypto.config.CryptoTraderProperties;
import com.polybot.crypto.domain.AssetPrice;
import com.polybot.crypto.domain.CryptoAsset;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the latest price and rolling history per tracked asset and turns ticks into feed events.
 */
@Slf4j
public class AssetPriceTracker {

    private static final Duration ONE_MINUTE = Duration.ofMinutes(1);
    private static final Duration FIVE_MINUTES = Duration.ofMinutes(5);

    private final CryptoTraderProperties.Feed feed;
    private final Map<CryptoAsset, PriceHistory> histories = new EnumMap<>(CryptoAsset.class);
    private final Map<CryptoAsset, AssetPrice> latest = new ConcurrentHashMap<>();

    public AssetPriceTracker(CryptoTraderProperties.Feed feed) {
        this.feed = feed;
        for (CryptoAsset asset : feed.assets()) {
            histories.put(asset, new PriceHistory(
                    Duration.ofMillis(feed.sampleIntervalMillis()),
                    Duration.ofMinutes(feed.retentionMinutes()),
                    feed.maxSamples()));
        }
    }

    /**
     * Applies a tick and returns the events it raises: always a price update, plus a significant
     * move when a previous price exists and the one-minute change reaches the threshold.
     * Ticks for untracked assets raise nothing.
     */
    public synchronized List<FeedEvent> onTick(CryptoAsset asset, double price, Instant now) {
        PriceHistory history = histories.get(asset);
        if (history == null || !(price > 0)) {
            return List.of();
        }
        AssetPrice previous = latest.get(asset);

        history.add(price, now);
        double change1m = history.changeOver(ONE_MINUTE, price, now);
        double change5m = history.changeOver(FIVE_MINUTES, price, now);
        AssetPrice current = new AssetPrice(asset, price, now, change1m, change5m);
        latest.put(asset, current);

        List<FeedEvent> events = new ArrayList<>(2);
        events.add(new FeedEvent.PriceUpdate(current));
        if (previous != null && Math.abs(change1m) >= feed.significantMovePercent()) {
            log.info("PRICE FEED: significant move {} {} -> {} ({}% 1m)",
                    asset, previous.price(), price, String.format("%.2f", change1m * 100));
            events.add(new FeedEvent.SignificantMove(asset, previous.price(), price, change1m, now));
        }
        return events;
    }

    public Optional<AssetPrice> latest(CryptoAsset asset) {
        return Optional.ofNullable(latest.get(asset));
    }

    public Map<CryptoAsset, AssetPrice> latestPrices() {
        return Map.copyOf(latest);
    }

    synchronized int sampleCount(CryptoAsset asset) {
        PriceHistory history = histories.get(asset);
        return history == null ? 0 : history.size();
    }
}
