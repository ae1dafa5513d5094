package com.polybot.crypto.polymarket.discovery;

import java.util.List;

/**
 * Pull interface over the venue's open market listings.
 */
public interface MarketListingSource {

  /**
   * @throws MarketListingException when the listings cannot be fetched
   */
  List<MarketListing> fetchOpenListings();
}
