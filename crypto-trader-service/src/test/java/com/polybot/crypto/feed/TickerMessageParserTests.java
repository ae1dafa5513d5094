package com.polybot.crypto.feed;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polybot.crypto.domain.CryptoAsset;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TickerMessageParserTests {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void parsesRawTicker() {
        String payload = """
                {"e":"24hrTicker","E":1705312800000,"s":"BTCUSDT","c":"100250.50","P":"1.25"}
                """;

        assertThat(TickerMessageParser.parse(payload, objectMapper))
                .contains(new TickerMessageParser.Ticker(CryptoAsset.BTC, 100_250.50));
    }

    @Test
    void parsesCombinedStreamWrapper() {
        String payload = """
                {"stream":"ethusdt@ticker","data":{"e":"24hrTicker","s":"ETHUSDT","c":"3120.10"}}
                """;

        assertThat(TickerMessageParser.parse(payload, objectMapper))
                .contains(new TickerMessageParser.Ticker(CryptoAsset.ETH, 3_120.10));
    }

    @Test
    void ignoresOtherEventsAndSymbols() {
        assertThat(TickerMessageParser.parse("{\"e\":\"trade\",\"s\":\"BTCUSDT\",\"p\":\"1\"}", objectMapper)).isEmpty();
        assertThat(TickerMessageParser.parse("{\"e\":\"24hrTicker\",\"s\":\"DOGEUSDT\",\"c\":\"0.1\"}", objectMapper)).isEmpty();
    }

    @Test
    void ignoresMalformedPayloads() {
        assertThat(TickerMessageParser.parse("not json", objectMapper)).isEmpty();
        assertThat(TickerMessageParser.parse("{\"e\":\"24hrTicker\",\"s\":\"SOLUSDT\",\"c\":\"abc\"}", objectMapper)).isEmpty();
        assertThat(TickerMessageParser.parse("{\"e\":\"24hrTicker\",\"s\":\"SOLUSDT\"}", objectMapper)).isEmpty();
    }
}
