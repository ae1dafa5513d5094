package com.polybot.crypto.domain;

import java.time.Instant;

/**
 * A detected mispricing. Only the status changes after creation, and it never returns to
 * {@link OpportunityStatus#DETECTED}.
 */
public record Opportunity(
    String id,
    String marketId,
    CryptoAsset asset,
    double threshold,
    double sourcePrice,
    double expectedPrice,
    double actualPrice,
    double gapPercent,
    OutcomeSide side,
    Instant detectedAt,
    OpportunityStatus status
) {

  public Opportunity withStatus(OpportunityStatus newStatus) {
    if (status.isTerminal() && newStatus != status) {
      throw new IllegalStateException("Opportunity " + id + " already " + status);
    }
    return new Opportunity(id, marketId, asset, threshold, sourcePrice, expectedPrice, actualPrice,
        gapPercent, side, detectedAt, newStatus);
  }
}
