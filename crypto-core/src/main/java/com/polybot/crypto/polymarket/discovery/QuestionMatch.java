package com.polybot.crypto.polymarket.discovery;

import com.polybot.crypto.domain.CryptoAsset;
import com.polybot.crypto.domain.Direction;

/**
 * Result of reading a market question. Asset, threshold and direction are only set when
 * {@code kind} is {@link Kind#MATCHED}.
 */
public record QuestionMatch(
    Kind kind,
    CryptoAsset asset,
    Double threshold,
    Direction direction,
    boolean whitelisted,
    String reason
) {

  public enum Kind {
    MATCHED,
    EXCLUDED,
    NO_MATCH
  }

  static QuestionMatch matched(CryptoAsset asset, double threshold, Direction direction, boolean whitelisted) {
    return new QuestionMatch(Kind.MATCHED, asset, threshold, direction, whitelisted, null);
  }

  static QuestionMatch excluded(String reason) {
    return new QuestionMatch(Kind.EXCLUDED, null, null, null, false, reason);
  }

  static QuestionMatch noMatch(String reason) {
    return new QuestionMatch(Kind.NO_MATCH, null, null, null, false, reason);
  }

  public boolean isMatched() {
    return kind == Kind.MATCHED;
  }
}
