package com.polybot.crypto.repository;

import com.polybot.crypto.domain.AssetPrice;
import com.polybot.crypto.domain.CryptoAsset;
import com.polybot.crypto.domain.MarketStatus;
import com.polybot.crypto.domain.Opportunity;
import com.polybot.crypto.domain.OpportunityStatus;
import com.polybot.crypto.domain.Position;
import com.polybot.crypto.domain.PositionStatus;
import com.polybot.crypto.domain.ThresholdMarket;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory repository for tests, with switches that make writes fail.
 */
public class InMemoryCryptoTradingRepository implements CryptoTradingRepository {

    private final Map<String, ThresholdMarket> markets = new LinkedHashMap<>();
    private final Map<String, Opportunity> opportunities = new LinkedHashMap<>();
    private final Map<String, Position> positions = new LinkedHashMap<>();
    private final List<AssetPrice> priceLog = new ArrayList<>();

    private boolean failOpen;
    private boolean failClose;
    private boolean failSaveOpportunity;

    public void setFailOpen(boolean failOpen) {
        this.failOpen = failOpen;
    }

    public void setFailClose(boolean failClose) {
        this.failClose = failClose;
    }

    public void setFailSaveOpportunity(boolean failSaveOpportunity) {
        this.failSaveOpportunity = failSaveOpportunity;
    }

    public Map<String, Opportunity> opportunities() {
        return opportunities;
    }

    public List<AssetPrice> priceLog() {
        return priceLog;
    }

    /**
     * Stores a position directly, bypassing the opportunity link.
     */
    public synchronized void putPosition(Position position) {
        positions.put(position.positionId(), position);
    }

    @Override
    public synchronized void upsertMarket(ThresholdMarket market) {
        ThresholdMarket existing = markets.get(market.marketId());
        if (existing != null) {
            market = new ThresholdMarket(market.marketId(), market.question(), market.asset(), market.threshold(),
                    market.direction(), market.resolutionTime(), market.volume24h(), market.whitelisted(),
                    market.status(), existing.discoveredAt());
        }
        markets.put(market.marketId(), market);
    }

    @Override
    public synchronized List<ThresholdMarket> findActiveMarkets() {
        return markets.values().stream().filter(m -> m.status() == MarketStatus.ACTIVE).toList();
    }

    @Override
    public synchronized List<ThresholdMarket> findActiveMarketsByAsset(CryptoAsset asset) {
        return findActiveMarkets().stream().filter(m -> m.asset() == asset).toList();
    }

    @Override
    public synchronized Optional<ThresholdMarket> findMarket(String marketId) {
        return Optional.ofNullable(markets.get(marketId));
    }

    @Override
    public synchronized int markMissingMarketsInactive(Collection<String> activeMarketIds) {
        int count = 0;
        for (ThresholdMarket market : List.copyOf(markets.values())) {
            if (market.status() == MarketStatus.ACTIVE && !activeMarketIds.contains(market.marketId())) {
                markets.put(market.marketId(), market.withStatus(MarketStatus.INACTIVE));
                count++;
            }
        }
        return count;
    }

    @Override
    public synchronized void saveOpportunity(Opportunity opportunity) {
        if (failSaveOpportunity) {
            throw new DataAccessResourceFailureException("database down");
        }
        opportunities.put(opportunity.id(), opportunity);
    }

    @Override
    public synchronized void updateOpportunityStatus(String opportunityId, OpportunityStatus status) {
        Opportunity existing = opportunities.get(opportunityId);
        if (existing != null) {
            opportunities.put(opportunityId, existing.withStatus(status));
        }
    }

    @Override
    public synchronized List<Opportunity> findRecentOpportunities(int limit) {
        return opportunities.values().stream()
                .sorted(Comparator.comparing(Opportunity::detectedAt).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public synchronized void openPosition(Position position, String opportunityId) {
        if (failOpen) {
            throw new DataAccessResourceFailureException("database down");
        }
        Opportunity opportunity = opportunities.get(opportunityId);
        if (opportunity == null) {
            throw new IllegalStateException("Opportunity " + opportunityId + " not found");
        }
        positions.put(position.positionId(), position);
        opportunities.put(opportunityId, opportunity.withStatus(OpportunityStatus.EXECUTED));
    }

    @Override
    public synchronized boolean closePosition(Position closed) {
        if (failClose) {
            throw new DataAccessResourceFailureException("database down");
        }
        Position current = positions.get(closed.positionId());
        if (current == null || current.status() != PositionStatus.OPEN) {
            return false;
        }
        positions.put(closed.positionId(), closed);
        return true;
    }

    @Override
    public synchronized List<Position> findOpenPositions() {
        return positions.values().stream().filter(p -> p.status() == PositionStatus.OPEN).toList();
    }

    @Override
    public synchronized Optional<Position> findPosition(String positionId) {
        return Optional.ofNullable(positions.get(positionId));
    }

    @Override
    public synchronized List<Position> findClosedPositions(int limit) {
        return positions.values().stream()
                .filter(p -> p.status() == PositionStatus.CLOSED)
                .sorted(Comparator.comparing(Position::exitTime).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public synchronized double openExposure() {
        return positions.values().stream()
                .filter(p -> p.status() != PositionStatus.CLOSED)
                .mapToDouble(Position::costBasis)
                .sum();
    }

    @Override
    public synchronized int openPositionCount() {
        return (int) positions.values().stream().filter(p -> p.status() != PositionStatus.CLOSED).count();
    }

    @Override
    public synchronized double realizedPnlSince(Instant since) {
        return positions.values().stream()
                .filter(p -> p.status() == PositionStatus.CLOSED && !p.exitTime().isBefore(since))
                .mapToDouble(Position::realizedPnl)
                .sum();
    }

    @Override
    public synchronized int tradeCountSince(Instant since) {
        return (int) positions.values().stream().filter(p -> !p.entryTime().isBefore(since)).count();
    }

    @Override
    public synchronized TradingStats tradingStats() {
        List<Position> closed = positions.values().stream().filter(p -> p.status() == PositionStatus.CLOSED).toList();
        int wins = (int) closed.stream().filter(p -> p.realizedPnl() > 0).count();
        int losses = (int) closed.stream().filter(p -> p.realizedPnl() < 0).count();
        double pnl = closed.stream().mapToDouble(Position::realizedPnl).sum();
        return new TradingStats(closed.size(), wins, losses, pnl);
    }

    @Override
    public synchronized void logPrice(AssetPrice price) {
        priceLog.add(price);
    }

    @Override
    public synchronized int pruneOldPriceLog(Instant before) {
        int size = priceLog.size();
        priceLog.removeIf(p -> p.timestamp().isBefore(before));
        return size - priceLog.size();
    }
}
