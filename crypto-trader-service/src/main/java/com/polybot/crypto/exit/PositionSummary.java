package com.polybot.crypto.exit;

import com.polybot.crypto.domain.CryptoAsset;
import com.polybot.crypto.domain.OutcomeSide;

/**
 * Live view of an open position; the near flags trip at 80% of the profit, stop and hold limits.
 */
public record PositionSummary(
        String positionId,
        String marketId,
        CryptoAsset asset,
        OutcomeSide side,
        double entryPrice,
        double currentPrice,
        double unrealizedPnl,
        double pnlPercent,
        long holdSeconds,
        boolean nearProfitTarget,
        boolean nearStopLoss,
        boolean nearTimeout
) {
}
