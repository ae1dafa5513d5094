package com.polybot.crypto.execution;

import com.polybot.crypto.domain.ExitReason;
import com.polybot.crypto.domain.Opportunity;
import com.polybot.crypto.domain.OpportunityStatus;
import com.polybot.crypto.domain.Position;
import com.polybot.crypto.domain.RiskDecision;
import com.polybot.crypto.model.PositionSizer;
import com.polybot.crypto.repository.CryptoTradingRepository;
import com.polybot.crypto.risk.RiskLedger;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Opens and closes simulated positions. No orders leave the process; fills happen at the observed
 * outcome price.
 *
 * <p>The risk check and the commit of a new position run under one lock, as do closes, so two
 * opportunities detected back to back cannot both pass the exposure check before either is stored.
 */
@Slf4j
public class PaperTradeExecutor {

    private final PositionSizer sizer;
    private final RiskLedger riskLedger;
    private final CryptoTradingRepository repository;
    private final Clock clock;
    private final Supplier<String> positionIds;
    private final MeterRegistry meterRegistry;
    private final ReentrantLock tradeLock = new ReentrantLock();

    private final Counter executedCounter;
    private final Counter rejectedCounter;
    private final Counter failedCounter;

    public PaperTradeExecutor(
            PositionSizer sizer,
            RiskLedger riskLedger,
            CryptoTradingRepository repository,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this(sizer, riskLedger, repository, clock, meterRegistry, () -> UUID.randomUUID().toString());
    }

    PaperTradeExecutor(
            PositionSizer sizer,
            RiskLedger riskLedger,
            CryptoTradingRepository repository,
            Clock clock,
            MeterRegistry meterRegistry,
            Supplier<String> positionIds
    ) {
        this.sizer = sizer;
        this.riskLedger = riskLedger;
        this.repository = repository;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.positionIds = positionIds;

        this.executedCounter = Counter.builder("crypto.trades.executed")
                .description("Positions opened")
                .register(meterRegistry);
        this.rejectedCounter = Counter.builder("crypto.trades.rejected")
                .description("Opportunities skipped by the risk ledger")
                .register(meterRegistry);
        this.failedCounter = Counter.builder("crypto.trades.failed")
                .description("Opens or closes that failed to persist")
                .register(meterRegistry);
    }

    public double sizeFor(Opportunity opportunity, double marketVolume) {
        return sizer.size(opportunity.gapPercent(), marketVolume);
    }

    /**
     * Sizes the opportunity, asks the risk ledger, and on approval stores the position and marks
     * the opportunity EXECUTED in one transaction, then starts the market's cooldown.
     * The opportunity must already be stored.
     */
    public ExecutionResult executeTrade(Opportunity opportunity, double marketVolume) {
        double size = sizeFor(opportunity, marketVolume);

        tradeLock.lock();
        try {
            RiskDecision decision;
            try {
                decision = riskLedger.canTrade(opportunity, size);
            } catch (RuntimeException e) {
                failedCounter.increment();
                log.error("EXECUTION: risk state unavailable for {}: {}", opportunity.id(), e.getMessage());
                return ExecutionResult.failed(opportunity, "Risk state unavailable: " + e.getMessage());
            }

            if (!decision.allowed()) {
                rejectedCounter.increment();
                markSkipped(opportunity);
                return ExecutionResult.rejected(opportunity.withStatus(OpportunityStatus.SKIPPED), decision);
            }

            Instant now = clock.instant();
            Position position = Position.open(
                    positionIds.get(),
                    opportunity.marketId(),
                    opportunity.asset(),
                    opportunity.side(),
                    opportunity.actualPrice(),
                    size,
                    now,
                    opportunity.sourcePrice()
            );

            try {
                repository.openPosition(position, opportunity.id());
            } catch (RuntimeException e) {
                failedCounter.increment();
                log.error("EXECUTION: failed to store position for opportunity {}: {}", opportunity.id(), e.getMessage());
                return ExecutionResult.failed(opportunity, "Failed to store position: " + e.getMessage());
            }

            riskLedger.recordExecution(opportunity.marketId());
            executedCounter.increment();
            log.info("EXECUTION: opened {} {} {} @ {} qty {} (size ${}, gap {}%)",
                    position.positionId(), opportunity.asset(), opportunity.side(),
                    String.format("%.4f", position.entryPrice()), String.format("%.2f", position.quantity()),
                    String.format("%.2f", size), String.format("%.1f", opportunity.gapPercent() * 100));
            return ExecutionResult.executed(opportunity.withStatus(OpportunityStatus.EXECUTED), position);
        } finally {
            tradeLock.unlock();
        }
    }

    /**
     * Closes the position at {@code exitPrice}. Only one close of a position can succeed; later
     * attempts report {@link CloseResult.Outcome#ALREADY_CLOSED}.
     */
    public CloseResult closePosition(Position position, double exitPrice, ExitReason reason) {
        tradeLock.lock();
        try {
            Position closed = position.closed(exitPrice, clock.instant(), reason);
            boolean won;
            try {
                won = repository.closePosition(closed);
            } catch (RuntimeException e) {
                failedCounter.increment();
                log.error("EXECUTION: failed to close position {}: {}", position.positionId(), e.getMessage());
                return new CloseResult(CloseResult.Outcome.FAILED, position, e.getMessage());
            }
            if (!won) {
                log.debug("EXECUTION: position {} already closed elsewhere", position.positionId());
                return new CloseResult(CloseResult.Outcome.ALREADY_CLOSED, position, "Position no longer open");
            }

            riskLedger.clearCooldown(position.marketId());
            meterRegistry.counter("crypto.positions.closed", "reason", reason.name()).increment();
            log.info("EXECUTION: closed {} {} {} @ {} reason {} pnl ${}",
                    closed.positionId(), closed.asset(), closed.side(), String.format("%.4f", exitPrice),
                    reason, String.format("%.2f", closed.realizedPnl()));
            return new CloseResult(CloseResult.Outcome.CLOSED, closed, null);
        } finally {
            tradeLock.unlock();
        }
    }

    public TradingStats stats() {
        Instant startOfDay = clock.instant().truncatedTo(ChronoUnit.DAYS);
        CryptoTradingRepository.TradingStats allTime = repository.tradingStats();
        return new TradingStats(
                repository.openPositionCount(),
                repository.openExposure(),
                repository.realizedPnlSince(startOfDay),
                repository.tradeCountSince(startOfDay),
                allTime.totalTrades(),
                allTime.winRate(),
                allTime.totalPnl()
        );
    }

    private void markSkipped(Opportunity opportunity) {
        try {
            repository.updateOpportunityStatus(opportunity.id(), OpportunityStatus.SKIPPED);
        } catch (RuntimeException e) {
            log.warn("EXECUTION: failed to mark opportunity {} skipped: {}", opportunity.id(), e.getMessage());
        }
    }
}
