package com.polybot.crypto.domain;

/**
 * Outcome of a risk check. A rejection carries its category and a readable reason.
 */
public record RiskDecision(
    boolean allowed,
    Rejection rejection,
    String reason
) {

  private static final RiskDecision ALLOW = new RiskDecision(true, null, null);

  public enum Rejection {
    DAILY_LOSS,
    DAILY_TRADES,
    POSITIONS,
    EXPOSURE,
    COOLDOWN
  }

  public static RiskDecision allow() {
    return ALLOW;
  }

  public static RiskDecision reject(Rejection rejection, String reason) {
    return new RiskDecision(false, rejection, reason);
  }
}
