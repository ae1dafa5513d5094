package com.polybot.crypto.polymarket.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Static helpers for reading Gamma API market payloads.
 */
public final class GammaMarketParser {

  private GammaMarketParser() {
  }

  /**
   * Accepts either a bare array of markets or an object wrapping them in {@code markets},
   * {@code data} or {@code events[].markets}.
   */
  public static List<JsonNode> extractMarkets(JsonNode root) {
    if (root == null || root.isNull() || root.isMissingNode()) {
      return List.of();
    }
    if (root.isArray()) {
      return toList(root);
    }
    if (root.path("markets").isArray()) {
      return toList(root.path("markets"));
    }
    if (root.path("data").isArray()) {
      return toList(root.path("data"));
    }
    if (root.path("events").isArray()) {
      List<JsonNode> markets = new ArrayList<>();
      for (JsonNode event : root.path("events")) {
        markets.addAll(toList(event.path("markets")));
      }
      return markets;
    }
    return List.of();
  }

  public static Optional<MarketListing> toListing(JsonNode market, ObjectMapper objectMapper) {
    String id = market.path("id").asText(null);
    String question = market.path("question").asText(null);
    if (id == null || id.isBlank() || question == null) {
      return Optional.empty();
    }

    double volume = market.path("volume24hr").asDouble(0.0);
    Instant endDate = parseInstant(market.path("endDate").asText(null));
    boolean active = market.path("active").asBoolean(false);
    boolean closed = market.path("closed").asBoolean(true);

    Double yes = null;
    Double no = null;
    List<String> outcomes = parseStringArray(market.path("outcomes"), objectMapper);
    List<String> prices = parseStringArray(market.path("outcomePrices"), objectMapper);
    if (prices.size() >= 2) {
      int yesIdx = indexOfIgnoreCase(outcomes, "yes", 0);
      int noIdx = indexOfIgnoreCase(outcomes, "no", 1);
      yes = yesIdx < prices.size() ? parseDouble(prices.get(yesIdx)) : null;
      no = noIdx < prices.size() ? parseDouble(prices.get(noIdx)) : null;
    }
    if (yes == null && market.hasNonNull("bestAsk")) {
      yes = market.path("bestAsk").asDouble();
    }
    if (no == null && market.hasNonNull("bestBid")) {
      no = 1.0 - market.path("bestBid").asDouble();
    }

    return Optional.of(new MarketListing(id, question, volume, endDate, active, closed, yes, no));
  }

  /**
   * Parse a JSON node that is either an array ({@code ["a","b"]}) or a string holding one
   * ({@code "[\"a\",\"b\"]"}).
   */
  public static List<String> parseStringArray(JsonNode node, ObjectMapper objectMapper) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return List.of();
    }
    if (node.isArray()) {
      List<String> result = new ArrayList<>(node.size());
      for (JsonNode n : node) {
        if (n != null && !n.isNull()) {
          result.add(n.asText());
        }
      }
      return result;
    }
    if (node.isTextual()) {
      String raw = node.asText();
      if (raw.isBlank()) {
        return List.of();
      }
      try {
        return parseStringArray(objectMapper.readTree(raw), objectMapper);
      } catch (Exception e) {
        return List.of();
      }
    }
    return List.of();
  }

  private static List<JsonNode> toList(JsonNode array) {
    List<JsonNode> out = new ArrayList<>(array.size());
    array.forEach(out::add);
    return out;
  }

  private static int indexOfIgnoreCase(List<String> values, String wanted, int fallback) {
    for (int i = 0; i < values.size(); i++) {
      if (values.get(i) != null && values.get(i).toLowerCase(Locale.ROOT).equals(wanted)) {
        return i;
      }
    }
    return fallback;
  }

  private static Double parseDouble(String raw) {
    if (raw == null) {
      return null;
    }
    try {
      return Double.parseDouble(raw.trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static Instant parseInstant(String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    try {
      return Instant.parse(raw);
    } catch (DateTimeParseException e) {
      return null;
    }
  }
}
