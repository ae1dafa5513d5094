package com.polybot.crypto.domain;

import java.time.Instant;

public record ThresholdMarket(
    String marketId,
    String question,
    CryptoAsset asset,
    double threshold,
    Direction direction,
    Instant resolutionTime,
    double volume24h,
    boolean whitelisted,
    MarketStatus status,
    Instant discoveredAt
) {

  /**
   * Whether the asset price sits on the side of the threshold that resolves YES.
   */
  public boolean isYesSide(double assetPrice) {
    return direction == Direction.ABOVE ? assetPrice > threshold : assetPrice < threshold;
  }

  public ThresholdMarket withStatus(MarketStatus newStatus) {
    return new ThresholdMarket(marketId, question, asset, threshold, direction, resolutionTime,
        volume24h, whitelisted, newStatus, discoveredAt);
  }
}
