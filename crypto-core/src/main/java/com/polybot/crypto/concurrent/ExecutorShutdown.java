package com.polybot.crypto.concurrent;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Graceful stop for the component-owned executors. Periodic tasks that have not started are
 * dropped; a task already running is left to finish.
 */
public final class ExecutorShutdown {

  private ExecutorShutdown() {
  }

  /**
   * Stops accepting work and waits up to {@code timeout} for running tasks. Whatever is still
   * running after that is interrupted.
   *
   * @return true when every task finished within the timeout
   */
  public static boolean await(ExecutorService executor, Duration timeout) {
    executor.shutdown();
    try {
      if (executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        return true;
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    executor.shutdownNow();
    return false;
  }
}
