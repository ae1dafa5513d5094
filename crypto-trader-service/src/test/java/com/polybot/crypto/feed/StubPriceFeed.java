package com.polybot.crypto.feed;

import com.polybot.crypto.domain.AssetPrice;
import com.polybot.crypto.domain.CryptoAsset;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Price feed for tests: prices are set by hand and connect/disconnect only flip the status.
 */
public class StubPriceFeed implements PriceFeed {

    private final Map<CryptoAsset, AssetPrice> prices = new EnumMap<>(CryptoAsset.class);
    private ConnectionState state = ConnectionState.DISCONNECTED;
    private int connectCalls;

    public synchronized void setPrice(CryptoAsset asset, double price, Instant at) {
        prices.put(asset, new AssetPrice(asset, price, at, 0, 0));
    }

    public synchronized int connectCalls() {
        return connectCalls;
    }

    @Override
    public synchronized void connect() {
        connectCalls++;
        state = ConnectionState.CONNECTED;
    }

    @Override
    public synchronized void disconnect() {
        state = ConnectionState.DISCONNECTED;
    }

    @Override
    public synchronized Optional<AssetPrice> latest(CryptoAsset asset) {
        return Optional.ofNullable(prices.get(asset));
    }

    @Override
    public synchronized Map<CryptoAsset, AssetPrice> latestPrices() {
        return Map.copyOf(prices);
    }

    @Override
    public synchronized ReconnectStateMachine.Status connectionStatus() {
        return new ReconnectStateMachine.Status(state, 0, 0, false);
    }
}
