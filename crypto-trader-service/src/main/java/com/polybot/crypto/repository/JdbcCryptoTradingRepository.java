package com.polybot.crypto.repository;

import com.polybot.crypto.domain.AssetPrice;
import com.polybot.crypto.domain.CryptoAsset;
import com.polybot.crypto.domain.Direction;
import com.polybot.crypto.domain.ExitReason;
import com.polybot.crypto.domain.MarketStatus;
import com.polybot.crypto.domain.Opportunity;
import com.polybot.crypto.domain.OpportunityStatus;
import com.polybot.crypto.domain.OutcomeSide;
import com.polybot.crypto.domain.Position;
import com.polybot.crypto.domain.PositionStatus;
import com.polybot.crypto.domain.ThresholdMarket;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * {@link CryptoTradingRepository} on plain SQL that runs on PostgreSQL and on H2 in PostgreSQL mode.
 */
public class JdbcCryptoTradingRepository implements CryptoTradingRepository {

    private static final String NOT_CLOSED = "status <> 'CLOSED'";

    private static final RowMapper<ThresholdMarket> MARKET_MAPPER = (rs, rowNum) -> new ThresholdMarket(
            rs.getString("market_id"),
            rs.getString("question"),
            CryptoAsset.valueOf(rs.getString("asset")),
            rs.getDouble("threshold"),
            Direction.valueOf(rs.getString("direction")),
            instant(rs, "resolution_time"),
            rs.getDouble("volume_24h"),
            rs.getBoolean("whitelisted"),
            MarketStatus.valueOf(rs.getString("status")),
            instant(rs, "discovered_at")
    );

    private static final RowMapper<Opportunity> OPPORTUNITY_MAPPER = (rs, rowNum) -> new Opportunity(
            rs.getString("opportunity_id"),
            rs.getString("market_id"),
            CryptoAsset.valueOf(rs.getString("asset")),
            rs.getDouble("threshold"),
            rs.getDouble("source_price"),
            rs.getDouble("expected_price"),
            rs.getDouble("actual_price"),
            rs.getDouble("gap_percent"),
            OutcomeSide.valueOf(rs.getString("side")),
            instant(rs, "detected_at"),
            OpportunityStatus.valueOf(rs.getString("status"))
    );

    private static final RowMapper<Position> POSITION_MAPPER = (rs, rowNum) -> {
        String exitReason = rs.getString("exit_reason");
        return new Position(
                rs.getString("position_id"),
                rs.getString("market_id"),
                CryptoAsset.valueOf(rs.getString("asset")),
                OutcomeSide.valueOf(rs.getString("side")),
                rs.getDouble("entry_price"),
                rs.getDouble("quantity"),
                instant(rs, "entry_time"),
                rs.getDouble("asset_price_at_entry"),
                nullableDouble(rs, "exit_price"),
                instant(rs, "exit_time"),
                exitReason == null ? null : ExitReason.valueOf(exitReason),
                nullableDouble(rs, "realized_pnl"),
                PositionStatus.valueOf(rs.getString("status"))
        );
    };

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public JdbcCryptoTradingRepository(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    @Override
    public void upsertMarket(ThresholdMarket market) {
        Timestamp now = Timestamp.from(clock.instant());
        transactionTemplate.executeWithoutResult(status -> {
            int updated = jdbcTemplate.update("""
                    UPDATE crypto_markets
                       SET question = ?, asset = ?, threshold = ?, direction = ?, resolution_time = ?,
                           volume_24h = ?, whitelisted = ?, status = ?, updated_at = ?
                     WHERE market_id = ?
                    """,
                    market.question(), market.asset().name(), market.threshold(), market.direction().name(),
                    timestamp(market.resolutionTime()), market.volume24h(), market.whitelisted(),
                    market.status().name(), now, market.marketId());
            if (updated == 0) {
                jdbcTemplate.update("""
                        INSERT INTO crypto_markets (market_id, question, asset, threshold, direction, resolution_time,
                                                    volume_24h, whitelisted, status, discovered_at, updated_at)
                        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                        """,
                        market.marketId(), market.question(), market.asset().name(), market.threshold(),
                        market.direction().name(), timestamp(market.resolutionTime()), market.volume24h(),
                        market.whitelisted(), market.status().name(), timestamp(market.discoveredAt()), now);
            }
        });
    }

    @Override
    public List<ThresholdMarket> findActiveMarkets() {
        return jdbcTemplate.query(
                "SELECT * FROM crypto_markets WHERE status = 'ACTIVE' ORDER BY volume_24h DESC", MARKET_MAPPER);
    }

    @Override
    public List<ThresholdMarket> findActiveMarketsByAsset(CryptoAsset asset) {
        return jdbcTemplate.query(
                "SELECT * FROM crypto_markets WHERE status = 'ACTIVE' AND asset = ? ORDER BY volume_24h DESC",
                MARKET_MAPPER, asset.name());
    }

    @Override
    public Optional<ThresholdMarket> findMarket(String marketId) {
        return jdbcTemplate.query("SELECT * FROM crypto_markets WHERE market_id = ?", MARKET_MAPPER, marketId)
                .stream().findFirst();
    }

    @Override
    public int markMissingMarketsInactive(Collection<String> activeMarketIds) {
        Timestamp now = Timestamp.from(clock.instant());
        if (activeMarketIds.isEmpty()) {
            return jdbcTemplate.update(
                    "UPDATE crypto_markets SET status = 'INACTIVE', updated_at = ? WHERE status = 'ACTIVE'", now);
        }
        String placeholders = String.join(", ", Collections.nCopies(activeMarketIds.size(), "?"));
        Object[] args = new Object[activeMarketIds.size() + 1];
        args[0] = now;
        int i = 1;
        for (String id : activeMarketIds) {
            args[i++] = id;
        }
        return jdbcTemplate.update("UPDATE crypto_markets SET status = 'INACTIVE', updated_at = ? "
                + "WHERE status = 'ACTIVE' AND market_id NOT IN (" + placeholders + ")", args);
    }

    @Override
    public void saveOpportunity(Opportunity opportunity) {
        jdbcTemplate.update("""
                INSERT INTO crypto_opportunities (opportunity_id, market_id, asset, threshold, source_price,
                                                  expected_price, actual_price, gap_percent, side, status,
                                                  detected_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                opportunity.id(), opportunity.marketId(), opportunity.asset().name(), opportunity.threshold(),
                opportunity.sourcePrice(), opportunity.expectedPrice(), opportunity.actualPrice(),
                opportunity.gapPercent(), opportunity.side().name(), opportunity.status().name(),
                timestamp(opportunity.detectedAt()), Timestamp.from(clock.instant()));
    }

    @Override
    public void updateOpportunityStatus(String opportunityId, OpportunityStatus status) {
        jdbcTemplate.update("UPDATE crypto_opportunities SET status = ?, updated_at = ? WHERE opportunity_id = ?",
                status.name(), Timestamp.from(clock.instant()), opportunityId);
    }

    @Override
    public List<Opportunity> findRecentOpportunities(int limit) {
        return jdbcTemplate.query("SELECT * FROM crypto_opportunities ORDER BY detected_at DESC LIMIT ?",
                OPPORTUNITY_MAPPER, limit);
    }

    @Override
    public void openPosition(Position position, String opportunityId) {
        transactionTemplate.executeWithoutResult(status -> {
            jdbcTemplate.update("""
                    INSERT INTO crypto_positions (position_id, market_id, asset, side, entry_price, quantity,
                                                  entry_time, asset_price_at_entry, status)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                    """,
                    position.positionId(), position.marketId(), position.asset().name(), position.side().name(),
                    position.entryPrice(), position.quantity(), timestamp(position.entryTime()),
                    position.assetPriceAtEntry(), PositionStatus.OPEN.name());
            int updated = jdbcTemplate.update(
                    "UPDATE crypto_opportunities SET status = ?, updated_at = ? WHERE opportunity_id = ?",
                    OpportunityStatus.EXECUTED.name(), Timestamp.from(clock.instant()), opportunityId);
            if (updated != 1) {
                throw new IllegalStateException("Opportunity " + opportunityId + " not found");
            }
        });
    }

    @Override
    public boolean closePosition(Position closed) {
        Boolean won = transactionTemplate.execute(status -> {
            int claimed = jdbcTemplate.update(
                    "UPDATE crypto_positions SET status = 'CLOSING' WHERE position_id = ? AND status = 'OPEN'",
                    closed.positionId());
            if (claimed == 0) {
                return false;
            }
            jdbcTemplate.update("""
                    UPDATE crypto_positions
                       SET status = 'CLOSED', exit_price = ?, exit_time = ?, exit_reason = ?, realized_pnl = ?
                     WHERE position_id = ? AND status = 'CLOSING'
                    """,
                    closed.exitPrice(), timestamp(closed.exitTime()), closed.exitReason().name(),
                    closed.realizedPnl(), closed.positionId());
            return true;
        });
        return Boolean.TRUE.equals(won);
    }

    @Override
    public List<Position> findOpenPositions() {
        return jdbcTemplate.query(
                "SELECT * FROM crypto_positions WHERE status = 'OPEN' ORDER BY entry_time", POSITION_MAPPER);
    }

    @Override
    public Optional<Position> findPosition(String positionId) {
        return jdbcTemplate.query("SELECT * FROM crypto_positions WHERE position_id = ?", POSITION_MAPPER, positionId)
                .stream().findFirst();
    }

    @Override
    public List<Position> findClosedPositions(int limit) {
        return jdbcTemplate.query(
                "SELECT * FROM crypto_positions WHERE status = 'CLOSED' ORDER BY exit_time DESC LIMIT ?",
                POSITION_MAPPER, limit);
    }

    @Override
    public double openExposure() {
        Double exposure = jdbcTemplate.queryForObject(
                "SELECT COALESCE(SUM(quantity * entry_price), 0) FROM crypto_positions WHERE " + NOT_CLOSED,
                Double.class);
        return exposure == null ? 0.0 : exposure;
    }

    @Override
    public int openPositionCount() {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM crypto_positions WHERE " + NOT_CLOSED, Integer.class);
        return count == null ? 0 : count;
    }

    @Override
    public double realizedPnlSince(Instant since) {
        Double pnl = jdbcTemplate.queryForObject(
                "SELECT COALESCE(SUM(realized_pnl), 0) FROM crypto_positions WHERE status = 'CLOSED' AND exit_time >= ?",
                Double.class, Timestamp.from(since));
        return pnl == null ? 0.0 : pnl;
    }

    @Override
    public int tradeCountSince(Instant since) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM crypto_positions WHERE entry_time >= ?", Integer.class, Timestamp.from(since));
        return count == null ? 0 : count;
    }

    @Override
    public TradingStats tradingStats() {
        return jdbcTemplate.queryForObject("""
                SELECT COUNT(*) AS total,
                       COALESCE(SUM(CASE WHEN realized_pnl > 0 THEN 1 ELSE 0 END), 0) AS wins,
                       COALESCE(SUM(CASE WHEN realized_pnl < 0 THEN 1 ELSE 0 END), 0) AS losses,
                       COALESCE(SUM(realized_pnl), 0) AS pnl
                  FROM crypto_positions
                 WHERE status = 'CLOSED'
                """,
                (rs, rowNum) -> new TradingStats(rs.getInt("total"), rs.getInt("wins"), rs.getInt("losses"),
                        rs.getDouble("pnl")));
    }

    @Override
    public void logPrice(AssetPrice price) {
        jdbcTemplate.update(
                "INSERT INTO crypto_price_log (asset, price, change_1m, change_5m, logged_at) VALUES (?, ?, ?, ?, ?)",
                price.asset().name(), price.price(), price.change1m(), price.change5m(), timestamp(price.timestamp()));
    }

    @Override
    public int pruneOldPriceLog(Instant before) {
        return jdbcTemplate.update("DELETE FROM crypto_price_log WHERE logged_at < ?", Timestamp.from(before));
    }

    private static Timestamp timestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toInstant();
    }

    private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }
}
