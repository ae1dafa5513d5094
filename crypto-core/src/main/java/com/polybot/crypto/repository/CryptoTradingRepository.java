package com.polybot.crypto.repository;

import com.polybot.crypto.domain.AssetPrice;
import com.polybot.crypto.domain.CryptoAsset;
import com.polybot.crypto.domain.Opportunity;
import com.polybot.crypto.domain.OpportunityStatus;
import com.polybot.crypto.domain.Position;
import com.polybot.crypto.domain.ThresholdMarket;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Storage for the threshold-market catalog, detected opportunities and simulated positions.
 *
 * <p>Implementations surface storage failures as unchecked exceptions. Writes that must land
 * together ({@link #openPosition} and {@link #closePosition}) are single transactions.
 */
public interface CryptoTradingRepository {

  /**
   * Inserts the market, or updates every mutable field when the id already exists.
   */
  void upsertMarket(ThresholdMarket market);

  List<ThresholdMarket> findActiveMarkets();

  List<ThresholdMarket> findActiveMarketsByAsset(CryptoAsset asset);

  Optional<ThresholdMarket> findMarket(String marketId);

  /**
   * Marks every ACTIVE market whose id is not in {@code activeMarketIds} as INACTIVE.
   *
   * @return the number of markets deactivated
   */
  int markMissingMarketsInactive(Collection<String> activeMarketIds);

  void saveOpportunity(Opportunity opportunity);

  void updateOpportunityStatus(String opportunityId, OpportunityStatus status);

  List<Opportunity> findRecentOpportunities(int limit);

  /**
   * Inserts the position and marks its opportunity EXECUTED in one transaction.
   */
  void openPosition(Position position, String opportunityId);

  /**
   * Moves the position from OPEN through CLOSING to CLOSED with the exit fields of {@code closed},
   * in one transaction.
   *
   * @return false when the position was no longer OPEN, meaning another close won
   */
  boolean closePosition(Position closed);

  List<Position> findOpenPositions();

  Optional<Position> findPosition(String positionId);

  List<Position> findClosedPositions(int limit);

  /**
   * Sum of {@code quantity * entry_price} over positions that are not closed.
   */
  double openExposure();

  int openPositionCount();

  double realizedPnlSince(Instant since);

  int tradeCountSince(Instant since);

  TradingStats tradingStats();

  void logPrice(AssetPrice price);

  int pruneOldPriceLog(Instant before);

  record TradingStats(
      int totalTrades,
      int wins,
      int losses,
      double totalPnl
  ) {
    public double winRate() {
      int decided = wins + losses;
      return decided == 0 ? 0.0 : (double) wins / decided;
    }
  }
}
