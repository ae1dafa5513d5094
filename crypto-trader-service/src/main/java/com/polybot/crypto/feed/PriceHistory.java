package com.polybot.crypto.feed;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Rolling window of price samples for one asset, oldest first.
 *
 * <p>At most one sample is kept per {@code sampleInterval}; samples older than {@code retention}
 * and samples beyond {@code maxSamples} are evicted, so timestamps stay strictly increasing.
 * Not thread-safe.
 */
class PriceHistory {

    private final Duration sampleInterval;
    private final Duration retention;
    private final int maxSamples;
    private final Deque<PriceSample> samples = new ArrayDeque<>();

    PriceHistory(Duration sampleInterval, Duration retention, int maxSamples) {
        this.sampleInterval = sampleInterval;
        this.retention = retention;
        this.maxSamples = maxSamples;
    }

    /**
     * @return true when the sample was retained
     */
    boolean add(double price, Instant timestamp) {
        PriceSample last = samples.peekLast();
        if (last != null && Duration.between(last.timestamp(), timestamp).compareTo(sampleInterval) < 0) {
            return false;
        }
        samples.addLast(new PriceSample(price, timestamp));
        prune(timestamp);
        return true;
    }

    /**
     * Relative change from the last sample at or before {@code now - window} (or the oldest sample
     * when none is that old) to {@code currentPrice}. Zero when there is no usable reference.
     */
    double changeOver(Duration window, double currentPrice, Instant now) {
        if (samples.isEmpty()) {
            return 0.0;
        }
        Instant target = now.minus(window);
        PriceSample reference = null;
        Iterator<PriceSample> newestFirst = samples.descendingIterator();
        while (newestFirst.hasNext()) {
            PriceSample sample = newestFirst.next();
            if (!sample.timestamp().isAfter(target)) {
                reference = sample;
                break;
            }
        }
        if (reference == null) {
            reference = samples.peekFirst();
        }
        if (reference.price() == 0) {
            return 0.0;
        }
        return (currentPrice - reference.price()) / reference.price();
    }

    int size() {
        return samples.size();
    }

    PriceSample oldest() {
        return samples.peekFirst();
    }

    private void prune(Instant now) {
        Instant cutoff = now.minus(retention);
        while (!samples.isEmpty() && samples.peekFirst().timestamp().isBefore(cutoff)) {
            samples.removeFirst();
        }
        while (samples.size() > maxSamples) {
            samples.removeFirst();
        }
    }

    record PriceSample(double price, Instant timestamp) {
    }
}
