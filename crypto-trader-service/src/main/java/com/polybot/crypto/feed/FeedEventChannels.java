package com.polybot.crypto.feed;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * One bounded channel per feed event kind, drained by a single consumer.
 *
 * <p>{@link #next} favours terminal feed signals, then significant moves, then plain price updates.
 * When the price-update channel is full the oldest update is dropped; significant moves and feed
 * signals are never dropped.
 */
@Slf4j
public class FeedEventChannels {

    private static final long IDLE_POLL_MILLIS = 50;

    private final BlockingQueue<FeedEvent.PriceUpdate> priceUpdates;
    private final BlockingQueue<FeedEvent.SignificantMove> significantMoves = new LinkedBlockingQueue<>();
    private final BlockingQueue<FeedEvent.FeedExhausted> feedSignals = new LinkedBlockingQueue<>();
    private final Counter droppedCounter;

    public FeedEventChannels(int priceUpdateCapacity, MeterRegistry meterRegistry) {
        this.priceUpdates = new LinkedBlockingQueue<>(priceUpdateCapacity);
        this.droppedCounter = Counter.builder("crypto.feed.events.dropped")
                .description("Price updates dropped because the intake loop fell behind")
                .register(meterRegistry);
    }

    public void publish(FeedEvent event) {
        if (event instanceof FeedEvent.PriceUpdate update) {
            publish(update);
        } else if (event instanceof FeedEvent.SignificantMove move) {
            publish(move);
        } else if (event instanceof FeedEvent.FeedExhausted exhausted) {
            publish(exhausted);
        } else {
            throw new IllegalArgumentException("Unknown feed event " + event);
        }
    }

    public void publish(FeedEvent.PriceUpdate update) {
        while (!priceUpdates.offer(update)) {
            if (priceUpdates.poll() != null) {
                droppedCounter.increment();
                log.debug("PRICE FEED: intake behind, dropped oldest price update");
            }
        }
    }

    public void publish(FeedEvent.SignificantMove move) {
        significantMoves.add(move);
    }

    public void publish(FeedEvent.FeedExhausted exhausted) {
        feedSignals.add(exhausted);
    }

    /**
     * Next event by channel priority, waiting up to {@code timeout} when all channels are empty.
     *
     * @return the event, or null on timeout
     */
    public FeedEvent next(long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (true) {
            FeedEvent event = pollByPriority();
            if (event != null) {
                return event;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return null;
            }
            FeedEvent.PriceUpdate update = priceUpdates.poll(
                    Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(IDLE_POLL_MILLIS)), TimeUnit.NANOSECONDS);
            if (update != null) {
                return update;
            }
        }
    }

    public int pendingPriceUpdates() {
        return priceUpdates.size();
    }

    private FeedEvent pollByPriority() {
        FeedEvent urgent = pollUrgent();
        return urgent != null ? urgent : priceUpdates.poll();
    }

    private FeedEvent pollUrgent() {
        FeedEvent signal = feedSignals.poll();
        return signal != null ? signal : significantMoves.poll();
    }
}
