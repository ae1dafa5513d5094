package com.polybot.crypto.domain;

import java.time.Duration;
import java.time.Instant;

/**
 * A simulated position in one outcome of a threshold market.
 * Exit fields are null while the position is open.
 */
public record Position(
    String positionId,
    String marketId,
    CryptoAsset asset,
    OutcomeSide side,
    double entryPrice,
    double quantity,
    Instant entryTime,
    double assetPriceAtEntry,
    Double exitPrice,
    Instant exitTime,
    ExitReason exitReason,
    Double realizedPnl,
    PositionStatus status
) {

  public static Position open(
      String positionId,
      String marketId,
      CryptoAsset asset,
      OutcomeSide side,
      double entryPrice,
      double size,
      Instant entryTime,
      double assetPriceAtEntry
  ) {
    if (entryPrice <= 0) {
      throw new IllegalArgumentException("entryPrice must be positive: " + entryPrice);
    }
    return new Position(positionId, marketId, asset, side, entryPrice, size / entryPrice, entryTime,
        assetPriceAtEntry, null, null, null, null, PositionStatus.OPEN);
  }

  /**
   * Cost basis committed at entry.
   */
  public double costBasis() {
    return quantity * entryPrice;
  }

  public double pnlAt(double price) {
    return quantity * price - quantity * entryPrice;
  }

  public double returnAt(double price) {
    return (price - entryPrice) / entryPrice;
  }

  public Duration holdTime(Instant now) {
    return Duration.between(entryTime, now);
  }

  public Position closed(double price, Instant at, ExitReason reason) {
    if (status == PositionStatus.CLOSED) {
      throw new IllegalStateException("Position " + positionId + " already closed");
    }
    return new Position(positionId, marketId, asset, side, entryPrice, quantity, entryTime,
        assetPriceAtEntry, price, at, reason, pnlAt(price), PositionStatus.CLOSED);
  }
}
