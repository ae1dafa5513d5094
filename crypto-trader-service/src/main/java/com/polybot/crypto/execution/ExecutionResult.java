package com.polybot.crypto.execution;

import com.polybot.crypto.domain.Opportunity;
import com.polybot.crypto.domain.Position;
import com.polybot.crypto.domain.RiskDecision;

/**
 * Outcome of {@link PaperTradeExecutor#executeTrade}. On a storage failure the opportunity is
 * returned unchanged so it can be retried or reconciled.
 */
public record ExecutionResult(
        Outcome outcome,
        Opportunity opportunity,
        Position position,
        RiskDecision riskDecision,
        String error
) {

    public enum Outcome {
        EXECUTED,
        REJECTED,
        FAILED
    }

    static ExecutionResult executed(Opportunity opportunity, Position position) {
        return new ExecutionResult(Outcome.EXECUTED, opportunity, position, RiskDecision.allow(), null);
    }

    static ExecutionResult rejected(Opportunity opportunity, RiskDecision decision) {
        return new ExecutionResult(Outcome.REJECTED, opportunity, null, decision, decision.reason());
    }

    static ExecutionResult failed(Opportunity opportunity, String error) {
        return new ExecutionResult(Outcome.FAILED, opportunity, null, null, error);
    }

    public boolean success() {
        return outcome == Outcome.EXECUTED;
    }
}
