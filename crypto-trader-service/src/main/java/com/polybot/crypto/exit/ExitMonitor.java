package com.polybot.crypto.exit;

import com.polybot.crypto.concurrent.ExecutorShutdown;
import com.polybot.crypto.config.CryptoTraderProperties;
import com.polybot.crypto.discovery.MarketCatalog;
import com.polybot.crypto.domain.AssetPrice;
import com.polybot.crypto.domain.ExitReason;
import com.polybot.crypto.domain.Position;
import com.polybot.crypto.domain.PositionStatus;
import com.polybot.crypto.domain.ThresholdMarket;
import com.polybot.crypto.execution.CloseResult;
import com.polybot.crypto.execution.PaperTradeExecutor;
import com.polybot.crypto.feed.PriceFeed;
import com.polybot.crypto.pricing.MarketPriceCache;
import com.polybot.crypto.repository.CryptoTradingRepository;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Sweeps open positions on a fixed delay and closes those matching an exit rule.
 *
 * <p>Rules, first match wins: profit target, stop loss, max hold time, and reversal (the asset
 * is now on the other side of the market threshold than at entry).
 */
@Slf4j
public class ExitMonitor {

    private static final double NEAR_RATIO = 0.8;
    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    private final CryptoTraderProperties.Exit exit;
    private final CryptoTradingRepository repository;
    private final PaperTradeExecutor executor;
    private final MarketPriceCache priceCache;
    private final MarketCatalog catalog;
    private final PriceFeed priceFeed;
    private final Clock clock;

    private ScheduledExecutorService scheduler;

    public ExitMonitor(
            CryptoTraderProperties.Exit exit,
            CryptoTradingRepository repository,
            PaperTradeExecutor executor,
            MarketPriceCache priceCache,
            MarketCatalog catalog,
            PriceFeed priceFeed,
            Clock clock
    ) {
        this.exit = exit;
        this.repository = repository;
        this.executor = executor;
        this.priceCache = priceCache;
        this.catalog = catalog;
        this.priceFeed = priceFeed;
        this.clock = clock;
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "crypto-exit-monitor");
            t.setDaemon(true);
            return t;
        });
        long interval = exit.sweepIntervalMillis();
        scheduler.scheduleWithFixedDelay(this::safeSweep, interval, interval, TimeUnit.MILLISECONDS);
        log.info("EXIT: monitor started (every {}ms, target {}%, stop {}%, max hold {}s)",
                interval, exit.profitTargetPct() * 100, exit.stopLossPct() * 100, exit.maxHoldTimeSeconds());
    }

    /**
     * Cancels future sweeps. A sweep already running completes its closes before this returns.
     */
    public synchronized void stop() {
        if (scheduler != null) {
            if (!ExecutorShutdown.await(scheduler, SHUTDOWN_TIMEOUT)) {
                log.warn("EXIT: sweep did not finish in time, interrupted");
            }
            scheduler = null;
            log.info("EXIT: monitor stopped");
        }
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    public SweepResult sweep() {
        List<Position> open = repository.findOpenPositions();
        int closed = 0;
        for (Position position : open) {
            try {
                if (checkAndClose(position).isPresent()) {
                    closed++;
                }
            } catch (RuntimeException e) {
                log.warn("EXIT: failed to check position {}: {}", position.positionId(), e.getMessage());
            }
        }
        return new SweepResult(open.size(), closed);
    }

    /**
     * Evaluates one position immediately, outside the regular sweep.
     *
     * @return the exit reason when the position was closed
     */
    public Optional<ExitReason> forceCheck(String positionId) {
        return repository.findPosition(positionId)
                .filter(p -> p.status() == PositionStatus.OPEN)
                .flatMap(this::checkAndClose);
    }

    /**
     * First matching exit rule for {@code position} at {@code currentPrice}, or empty to keep holding.
     */
    public Optional<ExitReason> evaluate(Position position, double currentPrice, Instant now) {
        double pnlPct = position.returnAt(currentPrice);
        if (pnlPct >= exit.profitTargetPct()) {
            return Optional.of(ExitReason.PROFIT);
        }
        if (pnlPct <= -exit.stopLossPct()) {
            return Optional.of(ExitReason.STOP);
        }
        if (position.holdTime(now).toSeconds() >= exit.maxHoldTimeSeconds()) {
            return Optional.of(ExitReason.TIME);
        }
        if (hasReversed(position)) {
            return Optional.of(ExitReason.REVERSAL);
        }
        return Optional.empty();
    }

    public List<PositionSummary> positionSummaries() {
        Instant now = clock.instant();
        List<PositionSummary> summaries = new ArrayList<>();
        for (Position position : repository.findOpenPositions()) {
            double current = currentPrice(position);
            double pnlPct = position.returnAt(current);
            long holdSeconds = position.holdTime(now).toSeconds();
            summaries.add(new PositionSummary(
                    position.positionId(),
                    position.marketId(),
                    position.asset(),
                    position.side(),
                    position.entryPrice(),
                    current,
                    position.pnlAt(current),
                    pnlPct,
                    holdSeconds,
                    pnlPct >= exit.profitTargetPct() * NEAR_RATIO,
                    pnlPct <= -exit.stopLossPct() * NEAR_RATIO,
                    holdSeconds >= exit.maxHoldTimeSeconds() * NEAR_RATIO
            ));
        }
        return summaries;
    }

    private Optional<ExitReason> checkAndClose(Position position) {
        double current = currentPrice(position);
        Optional<ExitReason> reason = evaluate(position, current, clock.instant());
        if (reason.isEmpty()) {
            return Optional.empty();
        }
        log.info("EXIT: {} triggered for {} ({} {} entry {} now {})", reason.get(), position.positionId(),
                position.asset(), position.side(), position.entryPrice(), current);
        CloseResult result = executor.closePosition(position, current, reason.get());
        return result.success() ? reason : Optional.empty();
    }

    private double currentPrice(Position position) {
        return priceCache.quote(position.marketId())
                .map(position.side()::priceFrom)
                .orElse(position.entryPrice());
    }

    private boolean hasReversed(Position position) {
        Optional<ThresholdMarket> market = catalog.find(position.marketId());
        Optional<AssetPrice> price = priceFeed.latest(position.asset());
        if (market.isEmpty() || price.isEmpty()) {
            return false;
        }
        double threshold = market.get().threshold();
        boolean aboveAtEntry = position.assetPriceAtEntry() > threshold;
        boolean aboveNow = price.get().price() > threshold;
        return aboveAtEntry != aboveNow;
    }

    private void safeSweep() {
        try {
            SweepResult result = sweep();
            if (result.closed() > 0) {
                log.info("EXIT: sweep checked {} closed {}", result.checked(), result.closed());
            }
        } catch (Exception e) {
            log.error("EXIT: sweep failed: {}", e.getMessage(), e);
        }
    }
}
