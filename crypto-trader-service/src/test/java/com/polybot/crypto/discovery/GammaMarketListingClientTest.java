package com.polybot.crypto.discovery;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polybot.crypto.config.CryptoTraderProperties;
import com.polybot.crypto.polymarket.discovery.MarketListing;
import com.polybot.crypto.polymarket.discovery.MarketListingException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for GammaMarketListingClient.
 */
@ExtendWith(MockitoExtension.class)
class GammaMarketListingClientTest {

    private static final String FULL_PAGE = """
            [
              {"id":"1","question":"Will Bitcoin be above $100,000 on March 31?","volume24hr":125000,
               "active":true,"closed":false,"outcomes":"[\\"Yes\\",\\"No\\"]","outcomePrices":"[\\"0.62\\",\\"0.38\\"]"},
              {"id":"2","question":"Will ETH be above $4,000 on March 31?","volume24hr":80000,
               "active":true,"closed":false,"outcomes":"[\\"Yes\\",\\"No\\"]","outcomePrices":"[\\"0.40\\",\\"0.60\\"]"}
            ]
            """;
    private static final String LAST_PAGE = """
            [{"id":"3","question":"Will SOL be above $200 on March 31?","active":true,"closed":false}]
            """;

    private final CryptoTraderProperties.Discovery discovery = new CryptoTraderProperties.Discovery(
            null, null, null, "https://gamma.example.test", 2, 5, 5_000L);

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<String> fullPage;

    @Mock
    private HttpResponse<String> lastPage;

    @Test
    void pagesUntilShortPage() throws Exception {
        // Given
        when(fullPage.statusCode()).thenReturn(200);
        when(fullPage.body()).thenReturn(FULL_PAGE);
        when(lastPage.statusCode()).thenReturn(200);
        when(lastPage.body()).thenReturn(LAST_PAGE);
        when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
                .thenReturn(fullPage, lastPage);
        GammaMarketListingClient client = new GammaMarketListingClient(discovery, httpClient, new ObjectMapper());

        // When
        List<MarketListing> listings = client.fetchOpenListings();

        // Then
        assertThat(listings).extracting(MarketListing::id).containsExactly("1", "2", "3");
        assertThat(listings.get(0).yesPrice()).isEqualTo(0.62);
        assertThat(listings.get(2).hasPrices()).isFalse();

        ArgumentCaptor<HttpRequest> requests = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient, times(2)).send(requests.capture(), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
        assertThat(requests.getAllValues()).extracting(r -> r.uri().toString()).containsExactly(
                "https://gamma.example.test/markets?active=true&closed=false&limit=2&offset=0",
                "https://gamma.example.test/markets?active=true&closed=false&limit=2&offset=2");
    }

    @Test
    void nonSuccessStatusRaisesListingException() throws Exception {
        when(fullPage.statusCode()).thenReturn(503);
        when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
                .thenReturn(fullPage);
        GammaMarketListingClient client = new GammaMarketListingClient(discovery, httpClient, new ObjectMapper());

        assertThatThrownBy(client::fetchOpenListings)
                .isInstanceOf(MarketListingException.class)
                .hasMessageContaining("HTTP 503");
    }

    @Test
    void transportFailureRaisesListingException() throws Exception {
        when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
                .thenThrow(new IOException("connection reset"));
        GammaMarketListingClient client = new GammaMarketListingClient(discovery, httpClient, new ObjectMapper());

        assertThatThrownBy(client::fetchOpenListings)
                .isInstanceOf(MarketListingException.class)
                .hasMessageContaining("connection reset")
                .hasCauseInstanceOf(IOException.class);
    }
}
