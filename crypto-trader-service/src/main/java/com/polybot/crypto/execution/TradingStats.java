package com.polybot.crypto.execution;

public record TradingStats(
        int openPositions,
        double totalExposure,
        double todayPnl,
        int todayTrades,
        int totalClosedTrades,
        double winRate,
        double totalRealizedPnl
) {
}
