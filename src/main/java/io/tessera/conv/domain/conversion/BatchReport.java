package io.tessera.conv.domain.conversion;

import io.tessera.conv.domain.session.SessionId;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * <strong>What:</strong> Aggregated outcome of a batch run.
 * <p><strong>Role:</strong> Returned by the batch orchestrator and rendered by the CLI.</p>
 * <p><strong>Thread-safety:</strong> The report is immutable; the {@link Builder} serializes
 * concurrent contributions behind a single lock.</p>
 *
 * @param results results of sessions that ran, in input order
 * @param skipped sessions never started, in input order
 * @param elapsed wall time of the whole batch
 * @param cancelled whether the batch was cancelled
 * @since 0.1.0
 */
public record BatchReport(List<ConversionResult> results, List<SessionId> skipped, Duration elapsed, boolean cancelled) {

  public BatchReport {
    results = List.copyOf(Objects.requireNonNull(results, "results"));
    skipped = List.copyOf(Objects.requireNonNull(skipped, "skipped"));
    Objects.requireNonNull(elapsed, "elapsed");
  }

  public long successCount() {
    return count(ConversionStatus.SUCCESS);
  }

  public long warningCount() {
    return count(ConversionStatus.WARNING);
  }

  public long failedCount() {
    return count(ConversionStatus.FAILED);
  }

  public int skippedCount() {
    return skipped.size();
  }

  /**
   * Sums the source bytes processed by every session that ran.
   *
   * @return total bytes
   */
  public long totalBytes() {
    return results.stream().mapToLong(ConversionResult::bytesProcessed).sum();
  }

  /**
   * Sums per-session wall times; exceeds {@link #elapsed()} when sessions ran in parallel.
   *
   * @return summed session time
   */
  public Duration totalSessionTime() {
    return results.stream().map(ConversionResult::wallTime).reduce(Duration.ZERO, Duration::plus);
  }

  /**
   * Tells whether every session that ran finalized and none was skipped.
   *
   * @return {@code true} when no session failed or was skipped
   */
  public boolean allSucceeded() {
    return failedCount() == 0 && skipped.isEmpty();
  }

  private long count(ConversionStatus status) {
    return results.stream().filter(r -> r.status() == status).count();
  }

  /**
   * Creates a builder that orders contributions by the supplied input order.
   *
   * @param inputOrder session ids in submission order
   * @return new builder
   */
  public static Builder builder(List<SessionId> inputOrder) {
    return new Builder(inputOrder);
  }

  /**
   * Incremental, lock-guarded accumulator used by concurrent session workers.
   */
  public static final class Builder {
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<SessionId, Integer> positions = new HashMap<>();
    private final Map<SessionId, ConversionResult> results = new HashMap<>();
    private final Set<SessionId> skipped = new LinkedHashSet<>();
    private boolean cancelled;
    private boolean built;

    private Builder(List<SessionId> inputOrder) {
      int index = 0;
      for (SessionId id : inputOrder) {
        if (positions.putIfAbsent(id, index++) != null) {
          throw new IllegalArgumentException("session " + id + " submitted twice");
        }
      }
    }

    /**
     * Records the result of a session that ran.
     *
     * @param result session result
     * @throws IllegalStateException if the session is unknown, already recorded, or the report was built
     */
    public void add(ConversionResult result) {
      lock.lock();
      try {
        ensureOpen();
        SessionId id = result.sessionId();
        requireUnrecorded(id);
        results.put(id, result);
      } finally {
        lock.unlock();
      }
    }

    /**
     * Records a session that was never started.
     *
     * @param id skipped session
     */
    public void skip(SessionId id) {
      lock.lock();
      try {
        ensureOpen();
        requireUnrecorded(id);
        skipped.add(id);
      } finally {
        lock.unlock();
      }
    }

    public void markCancelled() {
      lock.lock();
      try {
        cancelled = true;
      } finally {
        lock.unlock();
      }
    }

    /**
     * Returns how many sessions have been recorded or skipped so far.
     *
     * @return completed contribution count
     */
    public int completed() {
      lock.lock();
      try {
        return results.size() + skipped.size();
      } finally {
        lock.unlock();
      }
    }

    /**
     * Freezes the report once every session completed or was skipped.
     *
     * @param elapsed batch wall time
     * @return immutable report
     * @throws IllegalStateException if some session is still unaccounted for
     */
    public BatchReport build(Duration elapsed) {
      lock.lock();
      try {
        ensureOpen();
        if (results.size() + skipped.size() != positions.size()) {
          throw new IllegalStateException(
              "batch incomplete: " + (positions.size() - results.size() - skipped.size()) + " session(s) outstanding");
        }
        built = true;
        List<ConversionResult> ordered = new ArrayList<>(results.values());
        ordered.sort((a, b) -> Integer.compare(positions.get(a.sessionId()), positions.get(b.sessionId())));
        List<SessionId> skippedOrdered = new ArrayList<>(skipped);
        skippedOrdered.sort((a, b) -> Integer.compare(positions.get(a), positions.get(b)));
        return new BatchReport(ordered, skippedOrdered, elapsed, cancelled);
      } finally {
        lock.unlock();
      }
    }

    private void requireUnrecorded(SessionId id) {
      if (!positions.containsKey(id)) {
        throw new IllegalStateException("session " + id + " is not part of this batch");
      }
      if (results.containsKey(id) || skipped.contains(id)) {
        throw new IllegalStateException("session " + id + " already recorded");
      }
    }

    private void ensureOpen() {
      if (built) {
        throw new IllegalStateException("batch report already built");
      }
    }
  }
}
