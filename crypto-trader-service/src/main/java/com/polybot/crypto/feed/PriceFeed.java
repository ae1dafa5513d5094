package com.polybot.crypto.feed;

import com.polybot.crypto.domain.AssetPrice;
import com.polybot.crypto.domain.CryptoAsset;

import java.util.Map;
import java.util.Optional;

/**
 * Live prices for the tracked assets. Events go to the {@link FeedEventChannels} the feed was built with.
 */
public interface PriceFeed {

    void connect();

    void disconnect();

    Optional<AssetPrice> latest(CryptoAsset asset);

    Map<CryptoAsset, AssetPrice> latestPrices();

    ReconnectStateMachine.Status connectionStatus();
}
