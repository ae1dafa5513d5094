package com.polybot.crypto.model;

import com.polybot.crypto.domain.Opportunity;

/**
 * Result of one mispricing evaluation. {@code opportunity} is null when nothing tradeable was
 * found, in which case {@code reason} explains why.
 */
public record MispricingResult(
    Opportunity opportunity,
    double expectedYes,
    double yesGap,
    double noGap,
    String reason
) {

  static MispricingResult found(Opportunity opportunity, double expectedYes, double yesGap, double noGap) {
    return new MispricingResult(opportunity, expectedYes, yesGap, noGap, null);
  }

  static MispricingResult none(double expectedYes, double yesGap, double noGap, String reason) {
    return new MispricingResult(null, expectedYes, yesGap, noGap, reason);
  }

  public boolean found() {
    return opportunity != null;
  }
}
