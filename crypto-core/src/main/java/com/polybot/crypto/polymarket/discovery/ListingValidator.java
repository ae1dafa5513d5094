package com.polybot.crypto.polymarket.discovery;

import com.polybot.crypto.config.CryptoTraderProperties;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Checks that a listing is liquid, open, and far enough from resolution to trade.
 */
public class ListingValidator {

  private final CryptoTraderProperties.Discovery discovery;
  private final Clock clock;

  public ListingValidator(CryptoTraderProperties.Discovery discovery, Clock clock) {
    this.discovery = discovery;
    this.clock = clock;
  }

  /**
   * @return empty when the listing is acceptable, otherwise the rejection reason
   */
  public Optional<String> rejectionReason(MarketListing listing) {
    if (listing.volume24h() < discovery.minVolume()) {
      return Optional.of(String.format("volume %.0f below minimum %.0f", listing.volume24h(), discovery.minVolume()));
    }
    if (listing.endDate() != null) {
      Instant now = clock.instant();
      double hoursToEnd = Duration.between(now, listing.endDate()).toSeconds() / 3600.0;
      if (hoursToEnd < discovery.minResolutionHours()) {
        return Optional.of(String.format("resolves in %.1fh, minimum %.1fh", hoursToEnd, discovery.minResolutionHours()));
      }
    }
    if (listing.closed() || !listing.active()) {
      return Optional.of("market not open");
    }
    return Optional.empty();
  }
}
