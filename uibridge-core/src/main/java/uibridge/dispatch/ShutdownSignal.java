package uibridge.dispatch;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation context shared by the stages of one pipeline.
 *
 * <p>Starts uncancelled and flips to cancelled at most once; it never resets. Stages
 * receive the signal at construction, so independent pipelines (and tests) never share one
 * implicitly.
 */
public final class ShutdownSignal {
  private final AtomicBoolean cancelled = new AtomicBoolean(false);

  public boolean isCancelled() {
    return cancelled.get();
  }

  /**
   * Marks the signal cancelled.
   *
   * @return {@code true} if this call performed the transition, {@code false} if the
   *     signal was already cancelled
   */
  public boolean cancel() {
    return cancelled.compareAndSet(false, true);
  }

  @Override
  public String toString() {
    return "ShutdownSignal[cancelled=" + cancelled.get() + "]";
  }
}
