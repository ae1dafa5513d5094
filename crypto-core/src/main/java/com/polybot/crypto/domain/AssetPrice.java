package com.polybot.crypto.domain;

import java.time.Instant;

/**
 * Latest price of a tracked asset with its short-horizon changes as fractions (0.01 = 1%).
 */
public record AssetPrice(
    CryptoAsset asset,
    double price,
    Instant timestamp,
    double change1m,
    double change5m
) {
}
