package com.polybot.crypto.risk;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregates the ledger gates trades on. Counters come from the store; cooldowns are process-local.
 */
public record RiskState(
        double totalExposure,
        int openPositions,
        double dailyPnl,
        int dailyTrades,
        Map<String, Instant> cooldowns,
        Instant refreshedAt
) {
}
