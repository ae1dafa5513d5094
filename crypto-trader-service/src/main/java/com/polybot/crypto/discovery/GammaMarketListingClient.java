package com.polybot.crypto.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polybot.crypto.config.CryptoTraderProperties;
import com.polybot.crypto.polymarket.discovery.GammaMarketParser;
import com.polybot.crypto.polymarket.discovery.MarketListing;
import com.polybot.crypto.polymarket.discovery.MarketListingException;
import com.polybot.crypto.polymarket.discovery.MarketListingSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Pages through open markets on the Polymarket Gamma API.
 */
@Slf4j
@RequiredArgsConstructor
public class GammaMarketListingClient implements MarketListingSource {

    private final CryptoTraderProperties.Discovery discovery;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Override
    public List<MarketListing> fetchOpenListings() {
        List<MarketListing> listings = new ArrayList<>();
        int pageSize = discovery.pageSize();
        for (int page = 0; page < discovery.maxPages(); page++) {
            List<JsonNode> markets = fetchPage(page * pageSize, pageSize);
            for (JsonNode market : markets) {
                GammaMarketParser.toListing(market, objectMapper).ifPresent(listings::add);
            }
            if (markets.size() < pageSize) {
                break;
            }
        }
        log.debug("GAMMA: fetched {} open listings", listings.size());
        return listings;
    }

    private List<JsonNode> fetchPage(int offset, int limit) {
        URI uri = URI.create(discovery.gammaBaseUrl()
                + "/markets?active=true&closed=false&limit=" + limit + "&offset=" + offset);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(Duration.ofMillis(discovery.httpTimeoutMillis()))
                .header("Accept", "application/json")
                .header("User-Agent", "polybot-crypto/1.0")
                .GET()
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                throw new MarketListingException("Gamma returned HTTP " + response.statusCode() + " for " + uri);
            }
            return GammaMarketParser.extractMarkets(objectMapper.readTree(response.body()));
        } catch (IOException e) {
            throw new MarketListingException("Gamma request failed for " + uri + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MarketListingException("Interrupted fetching " + uri, e);
        }
    }
}
