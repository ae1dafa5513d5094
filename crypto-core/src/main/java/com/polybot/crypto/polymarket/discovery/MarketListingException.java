package com.polybot.crypto.polymarket.discovery;

public class MarketListingException extends RuntimeException {

  public MarketListingException(String message) {
    super(message);
  }

  public MarketListingException(String message, Throwable cause) {
    super(message, cause);
  }
}
