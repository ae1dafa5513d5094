package com.polybot.crypto.discovery;

import com.polybot.crypto.domain.CryptoAsset;
import com.polybot.crypto.domain.ThresholdMarket;
import com.polybot.crypto.repository.CryptoTradingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * In-memory snapshot of the active threshold markets, swapped whole on each reload.
 */
@Slf4j
@RequiredArgsConstructor
public class MarketCatalog {

    private final CryptoTradingRepository repository;
    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>(Snapshot.EMPTY);

    /**
     * @return the number of markets loaded
     */
    public int reload() {
        List<ThresholdMarket> markets = repository.findActiveMarkets();
        Map<CryptoAsset, List<ThresholdMarket>> byAsset = new EnumMap<>(CryptoAsset.class);
        byAsset.putAll(markets.stream().collect(Collectors.groupingBy(ThresholdMarket::asset)));
        Map<String, ThresholdMarket> byId = markets.stream()
                .collect(Collectors.toMap(ThresholdMarket::marketId, Function.identity(), (a, b) -> b));
        snapshot.set(new Snapshot(byAsset, byId));
        log.info("CATALOG: loaded {} active markets {}", markets.size(), countsByAsset(byAsset));
        return markets.size();
    }

    public List<ThresholdMarket> marketsFor(CryptoAsset asset) {
        return snapshot.get().byAsset().getOrDefault(asset, List.of());
    }

    /**
     * Looks the market up in the snapshot, then in the store for markets no longer active.
     */
    public Optional<ThresholdMarket> find(String marketId) {
        ThresholdMarket cached = snapshot.get().byId().get(marketId);
        return cached != null ? Optional.of(cached) : repository.findMarket(marketId);
    }

    public int size() {
        return snapshot.get().byId().size();
    }

    private static Map<CryptoAsset, Integer> countsByAsset(Map<CryptoAsset, List<ThresholdMarket>> byAsset) {
        Map<CryptoAsset, Integer> counts = new EnumMap<>(CryptoAsset.class);
        byAsset.forEach((asset, markets) -> counts.put(asset, markets.size()));
        return counts;
    }

    private record Snapshot(Map<CryptoAsset, List<ThresholdMarket>> byAsset, Map<String, ThresholdMarket> byId) {
        static final Snapshot EMPTY = new Snapshot(Map.of(), Map.of());
    }
}
