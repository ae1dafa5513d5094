package com.polybot.crypto.domain;

import java.time.Instant;

/**
 * Observed prices of both outcomes of a threshold market.
 */
public record MarketQuote(
    String marketId,
    double yesPrice,
    double noPrice,
    Instant observedAt
) {
}
