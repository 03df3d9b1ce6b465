package io.tessera.conv.application.pipeline;

import io.tessera.conv.domain.error.ConversionCancelledException;
import java.util.Optional;

/**
 * Cooperative cancellation flag checked between chunks. A child signal observes its parent, so cancelling the
 * batch stops every session while a session can stop its own stream tasks without touching its siblings.
 *
 * @since 0.1.0
 */
public final class CancellationSignal {
  private final CancellationSignal parent;
  private volatile String reason;

  private CancellationSignal(CancellationSignal parent) {
    this.parent = parent;
  }

  /**
   * Creates an independent signal.
   *
   * @return new root signal
   */
  public static CancellationSignal root() {
    return new CancellationSignal(null);
  }

  /**
   * Creates a signal that is also cancelled when this one is.
   *
   * @return child signal
   */
  public CancellationSignal child() {
    return new CancellationSignal(this);
  }

  /**
   * Requests cancellation. Only the first reason is kept.
   *
   * @param why reason recorded in failure details
   */
  public synchronized void cancel(String why) {
    if (reason == null) {
      reason = why == null || why.isBlank() ? "cancelled" : why;
    }
  }

  public boolean isCancelled() {
    return reason != null || (parent != null && parent.isCancelled());
  }

  /**
   * Returns the reason of the nearest cancelled signal.
   *
   * @return reason, or empty when not cancelled
   */
  public Optional<String> reason() {
    if (reason != null) {
      return Optional.of(reason);
    }
    return parent == null ? Optional.empty() : parent.reason();
  }

  /**
   * Throws when cancellation was requested.
   *
   * @throws ConversionCancelledException if this signal or an ancestor is cancelled
   */
  public void throwIfCancelled() throws ConversionCancelledException {
    if (isCancelled()) {
      throw new ConversionCancelledException(reason().orElse("cancelled"));
    }
  }
}
