package com.polybot.crypto.feed;

import java.util.OptionalLong;

/**
 * Connection lifecycle of the price stream with exponential reconnect backoff.
 *
 * <pre>
 * DISCONNECTED --start--> CONNECTING --connected--> CONNECTED
 *      ^                      |                         |
 *      |                    lost                      lost
 *      |                      v                         v
 *      +--exhausted/stop-- BACKOFF <--------------------+
 *                             |
 *                          retry --> CONNECTING
 * </pre>
 *
 * The n-th consecutive reconnect waits {@code baseDelay * multiplier^(n-1)}. A successful connect
 * resets the attempt count. Once {@code maxAttempts} reconnects have failed the machine parks in
 * DISCONNECTED with {@link Status#exhausted()} set and refuses to start again until {@link #reset()}.
 */
public class ReconnectStateMachine {

    private final long baseDelayMillis;
    private final double multiplier;
    private final int maxAttempts;

    private ConnectionState state = ConnectionState.DISCONNECTED;
    private int attempts;
    private long lastDelayMillis;
    private boolean exhausted;
    private boolean stopped = true;

    public ReconnectStateMachine(long baseDelayMillis, double multiplier, int maxAttempts) {
        this.baseDelayMillis = baseDelayMillis;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Begins a connection attempt.
     *
     * @return false when the machine is stopped, exhausted, or already connecting or connected
     */
    public synchronized boolean beginConnect() {
        if (exhausted) {
            return false;
        }
        if (state == ConnectionState.DISCONNECTED) {
            stopped = false;
        } else if (state != ConnectionState.BACKOFF || stopped) {
            return false;
        }
        state = ConnectionState.CONNECTING;
        return true;
    }

    public synchronized void onConnected() {
        if (stopped) {
            return;
        }
        state = ConnectionState.CONNECTED;
        attempts = 0;
        lastDelayMillis = 0;
    }

    /**
     * Records a failed connect or a dropped connection. Repeated reports of the same loss while
     * already backing off are ignored.
     *
     * @return the delay before the next attempt, or empty when no new retry should be scheduled
     */
    public synchronized OptionalLong onConnectionLost() {
        if (stopped) {
            state = ConnectionState.DISCONNECTED;
            return OptionalLong.empty();
        }
        if (state == ConnectionState.BACKOFF || exhausted) {
            return OptionalLong.empty();
        }
        if (attempts >= maxAttempts) {
            state = ConnectionState.DISCONNECTED;
            exhausted = true;
            return OptionalLong.empty();
        }
        lastDelayMillis = Math.round(baseDelayMillis * Math.pow(multiplier, attempts));
        attempts++;
        state = ConnectionState.BACKOFF;
        return OptionalLong.of(lastDelayMillis);
    }

    public synchronized void stop() {
        stopped = true;
        state = ConnectionState.DISCONNECTED;
    }

    /**
     * Clears exhaustion and attempt history so an operator can start the stream again.
     */
    public synchronized void reset() {
        stop();
        attempts = 0;
        lastDelayMillis = 0;
        exhausted = false;
    }

    public synchronized Status status() {
        return new Status(state, attempts, lastDelayMillis, exhausted);
    }

    public record Status(
            ConnectionState state,
            int attempts,
            long lastDelayMillis,
            boolean exhausted
    ) {
        public boolean connected() {
            return state == ConnectionState.CONNECTED;
        }
    }
}
