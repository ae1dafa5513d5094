package com.polybot.crypto.execution;

import com.polybot.crypto.domain.Position;

/**
 * Outcome of {@link PaperTradeExecutor#closePosition}. {@code position} is the closed position on
 * success and the untouched open position otherwise.
 */
public record CloseResult(
        Outcome outcome,
        Position position,
        String error
) {

    public enum Outcome {
        CLOSED,
        ALREADY_CLOSED,
        FAILED
    }

    public boolean success() {
        return outcome == Outcome.CLOSED;
    }
}
