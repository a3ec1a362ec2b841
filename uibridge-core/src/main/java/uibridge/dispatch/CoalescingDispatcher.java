package uibridge.dispatch;

import uibridge.command.UiCommand;
import uibridge.execute.CommandExecutor;
import uibridge.spi.MetricsExporter;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Delivers the latest droppable command of each burst without letting slow remote calls
 * stall intake.
 *
 * <p>Each cycle blocks for one command, then drains everything already buffered without
 * blocking and keeps only the last command seen. Earlier commands of the drain are
 * discarded silently. The survivor is handed to the execution pool and not awaited, so two
 * survivors may run concurrently and finish in either order; they carry absolute state,
 * which makes that acceptable for this path only.
 *
 * <p>The loop ends when its channel is closed and drained. It does not consult the
 * {@link ShutdownSignal}: the router closes this channel whenever it stops. Executions
 * already handed off are neither tracked nor cancelled.
 */
public final class CoalescingDispatcher implements Runnable {
  private static final Logger logger = Logger.getLogger(CoalescingDispatcher.class.getName());

  private final CommandChannel channel;
  private final CommandExecutor executor;
  private final Executor executions;
  private final MetricsExporter metrics;

  public CoalescingDispatcher(CommandChannel channel, CommandExecutor executor, Executor executions,
      MetricsExporter metrics) {
    this.channel = Objects.requireNonNull(channel, "channel");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.executions = Objects.requireNonNull(executions, "executions");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public void run() {
    try {
      UiCommand latest;
      while ((latest = channel.receive()) != null) {
        spawn(drainLatest(latest));
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Returns the most recent command buffered behind {@code first}, or {@code first} itself.
   */
  UiCommand drainLatest(UiCommand first) {
    UiCommand latest = first;
    int discarded = 0;
    UiCommand next;
    while ((next = channel.tryReceive()) != null) {
      latest = next;
      discarded++;
    }
    if (discarded > 0) {
      int count = discarded;
      logger.finest(() -> "Coalesced " + count + " superseded droppable commands");
      metrics.incrementCoalesced(discarded);
    }
    return latest;
  }

  private void spawn(UiCommand command) {
    try {
      executions.execute(() -> executor.execute(command));
    } catch (RejectedExecutionException e) {
      logger.log(Level.FINE, "Execution pool shut down; dropping " + command.kind(), e);
    }
  }
}
