package com.polybot.crypto.polymarket.discovery;

import java.time.Instant;

/**
 * One open market as returned by the listing source. Outcome prices are null when the source did
 * not report them.
 */
public record MarketListing(
    String id,
    String question,
    double volume24h,
    Instant endDate,
    boolean active,
    boolean closed,
    Double yesPrice,
    Double noPrice
) {

  public boolean hasPrices() {
    return yesPrice != null && noPrice != null;
  }
}
