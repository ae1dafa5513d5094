package com.polybot.crypto.model;

import com.polybot.crypto.config.CryptoTraderProperties;
import com.polybot.crypto.domain.AssetPrice;
import com.polybot.crypto.domain.Direction;
import com.polybot.crypto.domain.MarketQuote;
import com.polybot.crypto.domain.Opportunity;
import com.polybot.crypto.domain.OpportunityStatus;
import com.polybot.crypto.domain.OutcomeSide;
import com.polybot.crypto.domain.ThresholdMarket;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Maps the distance between an asset price and a market threshold to the probability the market
 * should be trading at, and compares it with the observed outcome prices.
 *
 * <p>The curve is piecewise linear and saturating: on the resolving side of the threshold it rises
 * from {@code baseHigh} towards {@code capHigh}; otherwise it falls from {@code baseLow} towards
 * {@code capLow}. A price exactly at the threshold takes the lower branch and yields {@code baseLow}.
 */
public class MispricingModel {

  private static final double PROXIMITY_DECAY = 10.0;

  private final CryptoTraderProperties.Detection detection;
  private final Supplier<String> idGenerator;

  public MispricingModel(CryptoTraderProperties.Detection detection) {
    this(detection, () -> UUID.randomUUID().toString());
  }

  public MispricingModel(CryptoTraderProperties.Detection detection, Supplier<String> idGenerator) {
    this.detection = Objects.requireNonNull(detection, "detection");
    this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
  }

  public double expectedProbability(double price, double threshold, Direction direction) {
    double distance = (price - threshold) / threshold;
    double towardsYes = direction == Direction.ABOVE ? distance : -distance;

    if (towardsYes > 0) {
      double bonus = Math.min(detection.bonusCap(), towardsYes * detection.kHigh());
      return Math.min(detection.capHigh(), detection.baseHigh() + bonus);
    }
    double penalty = Math.min(detection.penaltyCap(), Math.abs(towardsYes) * detection.kLow());
    return Math.max(detection.capLow(), detection.baseLow() - penalty);
  }

  /**
   * Compares the model price with both observed outcome prices and proposes buying the side with
   * the larger relative gap, provided that side is underpriced by at least the minimum gap.
   */
  public MispricingResult detectMispricing(ThresholdMarket market, AssetPrice assetPrice, MarketQuote quote, Instant now) {
    double expectedYes = expectedProbability(assetPrice.price(), market.threshold(), market.direction());
    double expectedNo = 1.0 - expectedYes;

    if (quote.yesPrice() <= 0 || quote.noPrice() <= 0) {
      return MispricingResult.none(expectedYes, 0, 0, "Invalid market prices");
    }

    double yesGap = (expectedYes - quote.yesPrice()) / quote.yesPrice();
    double noGap = (expectedNo - quote.noPrice()) / quote.noPrice();

    OutcomeSide side = Math.abs(yesGap) >= Math.abs(noGap) ? OutcomeSide.YES : OutcomeSide.NO;
    double gap = side == OutcomeSide.YES ? yesGap : noGap;

    if (Math.abs(gap) < detection.minGapPercent()) {
      return MispricingResult.none(expectedYes, yesGap, noGap,
          String.format("Gap too small: %.1f%% < %.1f%%", gap * 100, detection.minGapPercent() * 100));
    }
    if (gap < 0) {
      return MispricingResult.none(expectedYes, yesGap, noGap,
          String.format("%s overpriced by %.1f%%", side, -gap * 100));
    }

    Opportunity opportunity = new Opportunity(
        idGenerator.get(),
        market.marketId(),
        market.asset(),
        market.threshold(),
        assetPrice.price(),
        side == OutcomeSide.YES ? expectedYes : expectedNo,
        side.priceFrom(quote),
        gap,
        side,
        now,
        OpportunityStatus.DETECTED
    );
    return MispricingResult.found(opportunity, expectedYes, yesGap, noGap);
  }

  /**
   * Detects a move from one side of the threshold to the other between two prices.
   */
  public Optional<Crossing> checkThresholdCrossing(double previousPrice, double currentPrice, double threshold) {
    if (previousPrice <= threshold && currentPrice > threshold) {
      return Optional.of(Crossing.UP);
    }
    if (previousPrice >= threshold && currentPrice < threshold) {
      return Optional.of(Crossing.DOWN);
    }
    return Optional.empty();
  }

  /**
   * 1.0 at the threshold, decaying exponentially with relative distance.
   */
  public double thresholdProximity(double price, double threshold) {
    double distance = Math.abs(price - threshold) / threshold;
    return Math.exp(-PROXIMITY_DECAY * distance);
  }

  public enum Crossing {
    UP,
    DOWN
  }
}
