package com.polybot.crypto.domain;

public enum OutcomeSide {
  YES,
  NO;

  public double priceFrom(MarketQuote quote) {
    return this == YES ? quote.yesPrice() : quote.noPrice();
  }
}
