package com.polybot.crypto.feed;

import com.polybot.crypto.domain.AssetPrice;
import com.polybot.crypto.domain.CryptoAsset;

import java.time.Instant;

/**
 * Events raised by the price feed. Each kind travels on its own channel in {@link FeedEventChannels}.
 */
public interface FeedEvent {

    /**
     * Raised on every accepted tick.
     */
    record PriceUpdate(AssetPrice price) implements FeedEvent {
    }

    /**
     * Raised when the one-minute change reaches the significant-move threshold.
     */
    record SignificantMove(
            CryptoAsset asset,
            double previousPrice,
            double currentPrice,
            double changePercent,
            Instant timestamp
    ) implements FeedEvent {
    }

    /**
     * Terminal: reconnection gave up after {@code attempts} tries. The feed stays down until restarted.
     */
    record FeedExhausted(int attempts, Instant timestamp) implements FeedEvent {
    }
}
