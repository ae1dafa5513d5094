package com.polybot.crypto.concurrent;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * At most one load of a shared value runs at a time. Callers arriving while a load is running
 * receive that load's future instead of starting another; readers that must not wait use
 * {@link #latest()} and get the last completed value.
 *
 * @param <T> the loaded value type
 */
public final class SingleFlight<T> {

  private final AtomicReference<CompletableFuture<T>> inFlight = new AtomicReference<>();
  private volatile T latest;

  /**
   * Starts {@code loader} on {@code executor} unless a load is already running.
   *
   * @return the future of the running load, new or joined
   */
  public CompletableFuture<T> run(Supplier<T> loader, Executor executor) {
    CompletableFuture<T> mine = new CompletableFuture<>();
    if (!inFlight.compareAndSet(null, mine)) {
      CompletableFuture<T> current = inFlight.get();
      return current != null ? current : CompletableFuture.completedFuture(latest);
    }
    try {
      executor.execute(() -> load(loader, mine));
    } catch (RejectedExecutionException e) {
      inFlight.compareAndSet(mine, null);
      mine.completeExceptionally(e);
    }
    return mine;
  }

  public boolean isInFlight() {
    return inFlight.get() != null;
  }

  public Optional<T> latest() {
    return Optional.ofNullable(latest);
  }

  private void load(Supplier<T> loader, CompletableFuture<T> future) {
    T value;
    try {
      value = loader.get();
    } catch (Throwable t) {
      inFlight.compareAndSet(future, null);
      future.completeExceptionally(t);
      return;
    }
    latest = value;
    inFlight.compareAndSet(future, null);
    future.complete(value);
  }
}
