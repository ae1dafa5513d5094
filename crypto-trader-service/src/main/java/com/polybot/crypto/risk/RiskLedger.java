package com.polybot.crypto.risk;

import com.polybot.crypto.config.CryptoTraderProperties;
import com.polybot.crypto.domain.Opportunity;
import com.polybot.crypto.domain.RiskDecision;
import com.polybot.crypto.repository.CryptoTradingRepository;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Gates every prospective trade on daily loss, daily trade count, open positions, total exposure
 * and per-market cooldown, in that order.
 *
 * <p>Aggregate counters are re-read from the store before each decision. Callers that need the
 * check and the following commit to be atomic must hold their own lock around both.
 */
@Slf4j
public class RiskLedger {

    private static final double WARNING_RATIO = 0.8;
    private static final double LOSS_WARNING_RATIO = 0.5;

    private final CryptoTraderProperties.Risk limits;
    private final CryptoTradingRepository repository;
    private final Clock clock;

    private final Map<String, Instant> cooldowns = new ConcurrentHashMap<>();
    private volatile double totalExposure;
    private volatile int openPositions;
    private volatile double dailyPnl;
    private volatile int dailyTrades;
    private volatile Instant refreshedAt;

    public RiskLedger(CryptoTraderProperties.Risk limits, CryptoTradingRepository repository, Clock clock) {
        this.limits = limits;
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Reloads exposure, open count, today's P&L and today's trade count from the store.
     */
    public synchronized void refresh() {
        Instant startOfDay = startOfDay();
        totalExposure = repository.openExposure();
        openPositions = repository.openPositionCount();
        dailyPnl = repository.realizedPnlSince(startOfDay);
        dailyTrades = repository.tradeCountSince(startOfDay);
        refreshedAt = clock.instant();
    }

    public RiskDecision canTrade(Opportunity opportunity, double proposedSize) {
        refresh();
        Instant now = clock.instant();

        if (dailyPnl <= -limits.dailyLossLimit()) {
            return reject(RiskDecision.Rejection.DAILY_LOSS, String.format(
                    "Daily loss limit reached: %.2f <= -%.2f", dailyPnl, limits.dailyLossLimit()));
        }
        if (dailyTrades >= limits.maxDailyTrades()) {
            return reject(RiskDecision.Rejection.DAILY_TRADES, String.format(
                    "Daily trade limit reached: %d/%d", dailyTrades, limits.maxDailyTrades()));
        }
        if (openPositions >= limits.maxSimultaneousPositions()) {
            return reject(RiskDecision.Rejection.POSITIONS, String.format(
                    "Max positions reached: %d/%d", openPositions, limits.maxSimultaneousPositions()));
        }
        if (totalExposure + proposedSize > limits.maxTotalExposure()) {
            return reject(RiskDecision.Rejection.EXPOSURE, String.format(
                    "Exposure limit: %.2f + %.2f > %.2f", totalExposure, proposedSize, limits.maxTotalExposure()));
        }
        Instant cooldownUntil = cooldowns.get(opportunity.marketId());
        if (cooldownUntil != null && cooldownUntil.isAfter(now)) {
            return reject(RiskDecision.Rejection.COOLDOWN, String.format(
                    "Market in cooldown for %ds", Duration.between(now, cooldownUntil).toSeconds()));
        }
        return RiskDecision.allow();
    }

    /**
     * Starts the market's cooldown and counts the trade until the next refresh replaces the count.
     */
    public void recordExecution(String marketId) {
        cooldowns.put(marketId, clock.instant().plus(Duration.ofMinutes(limits.cooldownMinutes())));
        synchronized (this) {
            dailyTrades++;
        }
    }

    public void clearCooldown(String marketId) {
        cooldowns.remove(marketId);
    }

    public boolean isInCooldown(String marketId) {
        Instant until = cooldowns.get(marketId);
        return until != null && until.isAfter(clock.instant());
    }

    public int activeCooldownCount() {
        Instant now = clock.instant();
        return (int) cooldowns.values().stream().filter(until -> until.isAfter(now)).count();
    }

    public double availableExposure() {
        return Math.max(0, limits.maxTotalExposure() - totalExposure);
    }

    public boolean shouldPauseTrading() {
        return dailyPnl <= -limits.dailyLossLimit() || dailyTrades >= limits.maxDailyTrades();
    }

    public List<String> warnings() {
        List<String> warnings = new ArrayList<>();
        if (totalExposure > limits.maxTotalExposure() * WARNING_RATIO) {
            warnings.add(String.format("Exposure at %.0f%% of limit", 100 * totalExposure / limits.maxTotalExposure()));
        }
        if (dailyPnl < 0 && -dailyPnl > limits.dailyLossLimit() * LOSS_WARNING_RATIO) {
            warnings.add(String.format("Daily loss at %.0f%% of limit", 100 * -dailyPnl / limits.dailyLossLimit()));
        }
        if (dailyTrades > limits.maxDailyTrades() * WARNING_RATIO) {
            warnings.add(String.format("Daily trades at %d/%d", dailyTrades, limits.maxDailyTrades()));
        }
        return warnings;
    }

    /**
     * Day rollover: zeroes the daily counters and drops expired cooldowns.
     */
    public synchronized void resetDaily() {
        Instant now = clock.instant();
        dailyPnl = 0;
        dailyTrades = 0;
        cooldowns.values().removeIf(until -> !until.isAfter(now));
        log.info("RISK: daily counters reset, {} cooldowns still active", cooldowns.size());
    }

    public RiskState state() {
        return new RiskState(totalExposure, openPositions, dailyPnl, dailyTrades, Map.copyOf(cooldowns), refreshedAt);
    }

    private RiskDecision reject(RiskDecision.Rejection rejection, String reason) {
        log.info("RISK: rejected ({}): {}", rejection, reason);
        return RiskDecision.reject(rejection, reason);
    }

    private Instant startOfDay() {
        return clock.instant().truncatedTo(ChronoUnit.DAYS);
    }
}
