package io.tessera.conv.application.pipeline;

import io.tessera.conv.domain.error.ConversionCancelledException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * <strong>What:</strong> Batch-wide ceiling on resident source chunks.
 * <p><strong>Why:</strong> Memory stays bounded by {@code pipeline.max_in_flight_chunks} times the chunk size no
 * matter how many sessions and streams run at once.</p>
 * <p><strong>Role:</strong> A permit is taken before each chunk read and returned once the chunk was written or,
 * in the timing pass, discarded.</p>
 * <p><strong>Thread-safety:</strong> Fair semaphore; safe for every session and stream worker.</p>
 * <p><strong>Observability:</strong> Tracks the high-water mark of permits in use.</p>
 *
 * @since 0.1.0
 */
public final class ChunkBudget {
  private static final long POLL_MILLIS = 50L;

  private final int capacity;
  private final Semaphore permits;
  private final AtomicInteger inUse = new AtomicInteger();
  private final AtomicInteger highWaterMark = new AtomicInteger();

  /**
   * Creates a budget.
   *
   * @param capacity maximum resident chunks; must be positive
   */
  public ChunkBudget(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.capacity = capacity;
    this.permits = new Semaphore(capacity, true);
  }

  /**
   * Blocks until a permit is free, checking the signal while waiting.
   *
   * @param signal cancellation signal of the caller
   * @throws ConversionCancelledException if cancelled or interrupted while waiting
   */
  public void acquire(CancellationSignal signal) throws ConversionCancelledException {
    try {
      while (!permits.tryAcquire(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
        signal.throwIfCancelled();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new ConversionCancelledException("interrupted while waiting for a chunk permit", ex);
    }
    int now = inUse.incrementAndGet();
    highWaterMark.accumulateAndGet(now, Math::max);
  }

  /** Returns one permit. */
  public void release() {
    if (inUse.getAndDecrement() <= 0) {
      inUse.incrementAndGet();
      throw new IllegalStateException("chunk permit released twice");
    }
    permits.release();
  }

  public int capacity() {
    return capacity;
  }

  public int inUse() {
    return inUse.get();
  }

  /**
   * Returns the largest number of permits held at once since creation.
   *
   * @return high-water mark, never above {@link #capacity()}
   */
  public int highWaterMark() {
    return highWaterMark.get();
  }
}
