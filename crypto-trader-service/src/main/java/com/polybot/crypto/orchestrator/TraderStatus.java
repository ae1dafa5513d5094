package com.polybot.crypto.orchestrator;

import com.polybot.crypto.domain.AssetPrice;
import com.polybot.crypto.domain.CryptoAsset;
import com.polybot.crypto.domain.Opportunity;
import com.polybot.crypto.exit.PositionSummary;
import com.polybot.crypto.feed.ReconnectStateMachine;
import com.polybot.crypto.risk.RiskState;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record TraderStatus(
        boolean running,
        ReconnectStateMachine.Status feed,
        boolean feedExhausted,
        Map<CryptoAsset, AssetPrice> prices,
        int trackedMarkets,
        int cachedQuotes,
        RiskState risk,
        List<String> warnings,
        boolean tradingPaused,
        List<PositionSummary> openPositions,
        List<Opportunity> recentOpportunities,
        Instant asOf
) {
}
