package com.polybot.crypto.model;

import com.polybot.crypto.config.CryptoTraderProperties;

import java.util.List;

/**
 * Scales the base position size by the first matching gap tier and the first matching volume
 * tier, capped at the maximum position size. Tiers are ordered from highest threshold down.
 */
public class PositionSizer {

  private final CryptoTraderProperties.Sizing sizing;

  public PositionSizer(CryptoTraderProperties.Sizing sizing) {
    this.sizing = sizing;
  }

  public double size(double gapPercent, double volume24h) {
    double size = sizing.basePositionSize()
        * multiplier(sizing.gapTiers(), gapPercent)
        * multiplier(sizing.volumeTiers(), volume24h);
    return Math.min(size, sizing.maxPositionSize());
  }

  static double multiplier(List<CryptoTraderProperties.Tier> tiers, double value) {
    for (CryptoTraderProperties.Tier tier : tiers) {
      if (value >= tier.threshold()) {
        return tier.multiplier();
      }
    }
    return 1.0;
  }
}
