package com.polybot.crypto.polymarket.discovery;

import com.polybot.crypto.domain.CryptoAsset;
import com.polybot.crypto.domain.Direction;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads "will BTC be above $100,000"-style questions into (asset, threshold, direction).
 *
 * <p>A question that yields a candidate but is about an event rather than a price (announcements,
 * named people, regulators, ETFs) is excluded. Exclusion keywords alone, with no tracked asset or
 * sane threshold, are a plain non-match.
 */
public final class ThresholdQuestionParser {

  private static final List<Pattern> THRESHOLD_PATTERNS = List.of(
      Pattern.compile("\\$(\\d{1,3}(?:,\\d{3})*(?:\\.\\d{2})?)"),
      Pattern.compile("\\$(\\d+(?:\\.\\d+)?)\\s*[kK]"),
      Pattern.compile("\\$(\\d+(?:\\.\\d+)?)\\s*[mM]"),
      Pattern.compile("(\\d{1,3}(?:,\\d{3})+)")
  );

  private static final Pattern BELOW_KEYWORDS =
      Pattern.compile("\\b(below|under|fall|drop|dip)\\b", Pattern.CASE_INSENSITIVE);

  private static final List<Pattern> EXCLUSIONS = compileAll(
      "tweet", "hack", "\\bsec\\b", "\\belon\\b", "\\btrump\\b", "\\bmusk\\b", "\\bban\\b",
      "\\bregulat", "\\bwhale\\b", "\\bpump\\b", "\\bdump\\b", "\\bsay\\b", "\\bannounce",
      "\\bconfirm", "\\breport", "\\bclaim", "\\blaunch", "\\blist", "\\bapprove", "\\betf\\b",
      "\\bhalving\\b"
  );

  private static final List<Pattern> WHITELIST = compileAll(
      "will\\s+(?:BTC|Bitcoin|ETH|Ethereum|SOL|Solana)\\s+(?:be\\s+)?(?:above|below|reach|hit)",
      "(?:BTC|Bitcoin|ETH|Ethereum|SOL|Solana)\\s+(?:price\\s+)?(?:above|below|over|under)\\s+\\$"
  );

  private ThresholdQuestionParser() {
  }

  public static QuestionMatch parse(String question) {
    if (question == null || question.isBlank()) {
      return QuestionMatch.noMatch("empty question");
    }
    CryptoAsset asset = detectAsset(question);
    if (asset == null) {
      return QuestionMatch.noMatch("no tracked asset");
    }

    OptionalDouble threshold = extractThreshold(question);
    if (threshold.isEmpty()) {
      return QuestionMatch.noMatch("no threshold");
    }
    if (!asset.isSaneThreshold(threshold.getAsDouble())) {
      return QuestionMatch.noMatch("threshold " + threshold.getAsDouble() + " out of range for " + asset);
    }
    for (Pattern exclusion : EXCLUSIONS) {
      if (exclusion.matcher(question).find()) {
        return QuestionMatch.excluded("matches exclusion '" + exclusion.pattern() + "'");
      }
    }

    return QuestionMatch.matched(asset, threshold.getAsDouble(), detectDirection(question), isWhitelisted(question));
  }

  static CryptoAsset detectAsset(String question) {
    for (CryptoAsset asset : CryptoAsset.values()) {
      if (asset.mentionedIn(question)) {
        return asset;
      }
    }
    return null;
  }

  /**
   * First matching pattern wins. A {@code k} or {@code m} in the match or within the two
   * characters after it scales the value by a thousand or a million.
   */
  static OptionalDouble extractThreshold(String question) {
    for (Pattern pattern : THRESHOLD_PATTERNS) {
      Matcher matcher = pattern.matcher(question);
      if (!matcher.find()) {
        continue;
      }
      double value;
      try {
        value = Double.parseDouble(matcher.group(1).replace(",", ""));
      } catch (NumberFormatException e) {
        continue;
      }
      int suffixEnd = Math.min(question.length(), matcher.end() + 2);
      String context = (matcher.group() + question.substring(matcher.end(), suffixEnd)).toLowerCase(Locale.ROOT);
      if (context.contains("k")) {
        value *= 1_000;
      } else if (context.contains("m")) {
        value *= 1_000_000;
      }
      return OptionalDouble.of(value);
    }
    return OptionalDouble.empty();
  }

  static Direction detectDirection(String question) {
    return BELOW_KEYWORDS.matcher(question).find() ? Direction.BELOW : Direction.ABOVE;
  }

  static boolean isWhitelisted(String question) {
    return WHITELIST.stream().anyMatch(p -> p.matcher(question).find());
  }

  private static List<Pattern> compileAll(String... regexes) {
    return Arrays.stream(regexes)
        .map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE))
        .toList();
  }
}
