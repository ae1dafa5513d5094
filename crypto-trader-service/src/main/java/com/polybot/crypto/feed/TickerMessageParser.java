package com.polybot.crypto.feed;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polybot.crypto.domain.CryptoAsset;

import java.util.Optional;

/**
 * Reads Binance 24h ticker messages, either raw ({@code {"e":"24hrTicker","s":...,"c":...}}) or
 * wrapped by a combined stream ({@code {"stream":...,"data":{...}}}).
 */
final class TickerMessageParser {

    private static final String TICKER_EVENT = "24hrTicker";

    private TickerMessageParser() {
    }

    static Optional<Ticker> parse(String payload, ObjectMapper objectMapper) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (Exception e) {
            return Optional.empty();
        }
        JsonNode data = root.has("data") ? root.path("data") : root;
        if (!TICKER_EVENT.equals(data.path("e").asText(null))) {
            return Optional.empty();
        }
        Optional<CryptoAsset> asset = CryptoAsset.fromBinanceSymbol(data.path("s").asText(null));
        if (asset.isEmpty()) {
            return Optional.empty();
        }
        double price;
        try {
            price = Double.parseDouble(data.path("c").asText(""));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        return Optional.of(new Ticker(asset.get(), price));
    }

    record Ticker(CryptoAsset asset, double lastPrice) {
    }
}
