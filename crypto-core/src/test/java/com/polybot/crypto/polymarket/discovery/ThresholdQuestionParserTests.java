package com.polybot.crypto.polymarket.discovery;

import com.polybot.crypto.domain.CryptoAsset;
import com.polybot.crypto.domain.Direction;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class ThresholdQuestionParserTests {

  @Test
  void parsesDollarAmountWithCommas() {
    QuestionMatch match = ThresholdQuestionParser.parse("Will Bitcoin be above $100,000 on December 31?");

    assertThat(match.isMatched()).isTrue();
    assertThat(match.asset()).isEqualTo(CryptoAsset.BTC);
    assertThat(match.threshold()).isEqualTo(100_000.0);
    assertThat(match.direction()).isEqualTo(Direction.ABOVE);
    assertThat(match.whitelisted()).isTrue();
  }

  @Test
  void parsesThousandsSuffixAndBelowDirection() {
    QuestionMatch match = ThresholdQuestionParser.parse("Will ETH fall below $3K by Friday?");

    assertThat(match.isMatched()).isTrue();
    assertThat(match.asset()).isEqualTo(CryptoAsset.ETH);
    assertThat(match.threshold()).isEqualTo(3_000.0);
    assertThat(match.direction()).isEqualTo(Direction.BELOW);
    assertThat(match.whitelisted()).isFalse();
  }

  @Test
  void parsesCommaGroupedNumberWithoutDollarSign() {
    QuestionMatch match = ThresholdQuestionParser.parse("Will ETH be under 2,500 in March?");

    assertThat(match.isMatched()).isTrue();
    assertThat(match.threshold()).isEqualTo(2_500.0);
    assertThat(match.direction()).isEqualTo(Direction.BELOW);
  }

  @Test
  void firstAssetInPriorityOrderWins() {
    QuestionMatch match = ThresholdQuestionParser.parse("Will Solana or Bitcoin reach $120K first?");

    assertThat(match.asset()).isEqualTo(CryptoAsset.BTC);
    assertThat(match.threshold()).isEqualTo(120_000.0);
  }

  @Test
  void exclusionWinsOverMatchingThreshold() {
    QuestionMatch match = ThresholdQuestionParser.parse("Will BTC tweet about $100K?");

    assertThat(match.kind()).isEqualTo(QuestionMatch.Kind.EXCLUDED);
    assertThat(match.asset()).isNull();
  }

  @Test
  void excludesRegulatoryQuestions() {
    assertThat(ThresholdQuestionParser.parse("Will the SEC approve a Bitcoin ETF above $50,000?").kind())
        .isEqualTo(QuestionMatch.Kind.EXCLUDED);
  }

  @Test
  void exclusionKeywordWithoutCandidateIsNoMatch() {
    assertThat(ThresholdQuestionParser.parse("Will Trump say the word crypto this week?").kind())
        .isEqualTo(QuestionMatch.Kind.NO_MATCH);
    assertThat(ThresholdQuestionParser.parse("Will the SEC sue Coinbase?").kind())
        .isEqualTo(QuestionMatch.Kind.NO_MATCH);
  }

  @Test
  void rejectsThresholdOutsideAssetRange() {
    QuestionMatch match = ThresholdQuestionParser.parse("Will BTC hit $5?");

    assertThat(match.kind()).isEqualTo(QuestionMatch.Kind.NO_MATCH);
    assertThat(match.reason()).contains("out of range");
  }

  @Test
  void ignoresUntrackedAssets() {
    assertThat(ThresholdQuestionParser.parse("Will Dogecoin reach $1?").kind())
        .isEqualTo(QuestionMatch.Kind.NO_MATCH);
  }

  @Test
  void millionSuffixScalesValue() {
    assertThat(ThresholdQuestionParser.extractThreshold("Will BTC hit $1.50M?")).hasValue(1_500_000.0);
  }
}
