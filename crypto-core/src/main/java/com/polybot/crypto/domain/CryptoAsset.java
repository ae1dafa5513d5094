package com.polybot.crypto.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Assets whose threshold markets the trader follows. Declaration order is the matching priority
 * when a question mentions more than one asset.
 */
public enum CryptoAsset {
  BTC("BTCUSDT", Pattern.compile("\\b(BTC|Bitcoin)\\b", Pattern.CASE_INSENSITIVE), 10_000, 1_000_000),
  ETH("ETHUSDT", Pattern.compile("\\b(ETH|Ethereum|Ether)\\b", Pattern.CASE_INSENSITIVE), 500, 50_000),
  SOL("SOLUSDT", Pattern.compile("\\b(SOL|Solana)\\b", Pattern.CASE_INSENSITIVE), 10, 5_000);

  private final String binanceSymbol;
  private final Pattern questionPattern;
  private final double minThreshold;
  private final double maxThreshold;

  CryptoAsset(String binanceSymbol, Pattern questionPattern, double minThreshold, double maxThreshold) {
    this.binanceSymbol = binanceSymbol;
    this.questionPattern = questionPattern;
    this.minThreshold = minThreshold;
    this.maxThreshold = maxThreshold;
  }

  public String binanceSymbol() {
    return binanceSymbol;
  }

  /**
   * Lower-case ticker stream name, e.g. {@code btcusdt@ticker}.
   */
  public String tickerStream() {
    return binanceSymbol.toLowerCase(Locale.ROOT) + "@ticker";
  }

  public boolean mentionedIn(String question) {
    return question != null && questionPattern.matcher(question).find();
  }

  public boolean isSaneThreshold(double threshold) {
    return threshold >= minThreshold && threshold <= maxThreshold;
  }

  public static Optional<CryptoAsset> fromBinanceSymbol(String symbol) {
    if (symbol == null) {
      return Optional.empty();
    }
    return Arrays.stream(values())
        .filter(a -> a.binanceSymbol.equalsIgnoreCase(symbol))
        .findFirst();
  }
}
