package com.polybot.crypto.feed;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polybot.crypto.config.CryptoTraderProperties;
import com.polybot.crypto.domain.AssetPrice;
import com.polybot.crypto.domain.CryptoAsset;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Binance 24h ticker stream for the tracked assets over a single combined-path WebSocket.
 *
 * <p>Reconnects are driven by {@link ReconnectStateMachine} on one scheduler thread, which also
 * sends the keep-alive pings.
 */
@Slf4j
public class BinancePriceFeed implements PriceFeed, AutoCloseable {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final byte[] PING_PAYLOAD = "ping".getBytes(StandardCharsets.UTF_8);

    private final CryptoTraderProperties.Feed feed;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final AssetPriceTracker tracker;
    private final FeedEventChannels channels;
    private final Clock clock;
    private final ReconnectStateMachine reconnect;
    private final ScheduledExecutorService scheduler;

    private final AtomicReference<WebSocket> socket = new AtomicReference<>();
    private final AtomicBoolean exhaustionReported = new AtomicBoolean();
    private volatile ScheduledFuture<?> heartbeat;

    public BinancePriceFeed(
            CryptoTraderProperties.Feed feed,
            HttpClient httpClient,
            ObjectMapper objectMapper,
            AssetPriceTracker tracker,
            FeedEventChannels channels,
            Clock clock
    ) {
        this.feed = feed;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.tracker = tracker;
        this.channels = channels;
        this.clock = clock;
        this.reconnect = new ReconnectStateMachine(
                feed.reconnectDelayMillis(), feed.backoffMultiplier(), feed.maxReconnectAttempts());
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "binance-price-feed");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void connect() {
        if (reconnect.beginConnect()) {
            exhaustionReported.set(false);
            openSocket();
        }
    }

    @Override
    public void disconnect() {
        reconnect.stop();
        stopHeartbeat();
        WebSocket ws = socket.getAndSet(null);
        if (ws != null) {
            ws.sendClose(WebSocket.NORMAL_CLOSURE, "shutdown")
                    .exceptionally(e -> {
                        ws.abort();
                        return null;
                    });
        }
        log.info("PRICE FEED: disconnected");
    }

    @Override
    public void close() {
        disconnect();
        scheduler.shutdownNow();
    }

    @Override
    public Optional<AssetPrice> latest(CryptoAsset asset) {
        return tracker.latest(asset);
    }

    @Override
    public Map<CryptoAsset, AssetPrice> latestPrices() {
        return tracker.latestPrices();
    }

    @Override
    public ReconnectStateMachine.Status connectionStatus() {
        return reconnect.status();
    }

    URI streamUri() {
        String streams = feed.assets().stream()
                .map(CryptoAsset::tickerStream)
                .collect(Collectors.joining("/"));
        String base = feed.wsUrl().endsWith("/") ? feed.wsUrl() : feed.wsUrl() + "/";
        return URI.create(base + streams);
    }

    void handleMessage(String payload) {
        TickerMessageParser.parse(payload, objectMapper).ifPresent(ticker ->
                tracker.onTick(ticker.asset(), ticker.lastPrice(), clock.instant()).forEach(channels::publish));
    }

    private void openSocket() {
        URI uri = streamUri();
        log.info("PRICE FEED: connecting to {}", uri);
        try {
            httpClient.newWebSocketBuilder()
                    .connectTimeout(CONNECT_TIMEOUT)
                    .buildAsync(uri, new TickerListener())
                    .whenComplete((ws, error) -> {
                        if (error != null) {
                            log.warn("PRICE FEED: connect failed: {}", error.getMessage());
                            handleConnectionLost(null);
                        }
                    });
        } catch (RuntimeException e) {
            log.warn("PRICE FEED: connect failed: {}", e.getMessage());
            handleConnectionLost(null);
        }
    }

    private void handleOpen(WebSocket ws) {
        reconnect.onConnected();
        if (!reconnect.status().connected()) {
            // stopped while the handshake was in flight
            ws.abort();
            return;
        }
        socket.set(ws);
        startHeartbeat();
        log.info("PRICE FEED: connected, streaming {}", feed.assets());
    }

    private void handleConnectionLost(WebSocket source) {
        if (source != null && !socket.compareAndSet(source, null)) {
            return;
        }
        stopHeartbeat();
        OptionalLong delay = reconnect.onConnectionLost();
        ReconnectStateMachine.Status status = reconnect.status();
        if (delay.isPresent()) {
            log.warn("PRICE FEED: reconnecting in {}ms (attempt {}/{})",
                    delay.getAsLong(), status.attempts(), feed.maxReconnectAttempts());
            scheduler.schedule(this::retry, delay.getAsLong(), TimeUnit.MILLISECONDS);
        } else if (status.exhausted() && exhaustionReported.compareAndSet(false, true)) {
            log.error("PRICE FEED: giving up after {} reconnect attempts", status.attempts());
            channels.publish(new FeedEvent.FeedExhausted(status.attempts(), clock.instant()));
        }
    }

    private void retry() {
        if (reconnect.beginConnect()) {
            openSocket();
        }
    }

    private void startHeartbeat() {
        stopHeartbeat();
        long interval = feed.heartbeatIntervalMillis();
        heartbeat = scheduler.scheduleAtFixedRate(this::sendPing, interval, interval, TimeUnit.MILLISECONDS);
    }

    private void stopHeartbeat() {
        ScheduledFuture<?> current = heartbeat;
        if (current != null) {
            current.cancel(false);
            heartbeat = null;
        }
    }

    private void sendPing() {
        WebSocket ws = socket.get();
        if (ws == null || ws.isOutputClosed()) {
            return;
        }
        ws.sendPing(ByteBuffer.wrap(PING_PAYLOAD)).exceptionally(e -> {
            log.debug("PRICE FEED: ping failed: {}", e.getMessage());
            return null;
        });
    }

    private final class TickerListener implements WebSocket.Listener {

        private final StringBuilder buffer = new StringBuilder();

        @Override
        public void onOpen(WebSocket webSocket) {
            handleOpen(webSocket);
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            buffer.append(data);
            if (last) {
                String message = buffer.toString();
                buffer.setLength(0);
                try {
                    handleMessage(message);
                } catch (RuntimeException e) {
                    log.warn("PRICE FEED: failed to handle message: {}", e.getMessage());
                }
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            log.warn("PRICE FEED: stream closed ({} {})", statusCode, reason);
            handleConnectionLost(webSocket);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            log.warn("PRICE FEED: stream error: {}", error.getMessage());
            handleConnectionLost(webSocket);
        }
    }
}
