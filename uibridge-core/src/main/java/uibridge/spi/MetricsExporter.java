package uibridge.spi;

import uibridge.command.CommandKind;
import uibridge.command.DeliveryClass;

/**
 * Observability hook for exporting pipeline counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of commands the router forwarded on the given path.
   *
   * @param deliveryClass the path the command was routed to
   */
  void incrementRouted(DeliveryClass deliveryClass);

  /**
   * Adds to the count of droppable commands discarded because a newer one of the same
   * burst superseded them.
   *
   * @param discarded number of commands discarded in one drain, always positive
   */
  void incrementCoalesced(int discarded);

  /**
   * Increments the count of executions that completed normally.
   */
  void incrementExecutionSuccess(CommandKind kind);

  /**
   * Increments the count of executions aborted by a fatal remote-call failure.
   */
  void incrementExecutionFailure(CommandKind kind);

  /**
   * Increments the count of best-effort remote-call failures that were discarded.
   */
  default void incrementBestEffortFailure(CommandKind kind) {
  }

  /**
   * Records the current depth of both internal channels.
   *
   * @param droppableDepth number of commands waiting on the droppable path
   * @param guaranteedDepth number of commands waiting on the guaranteed path
   */
  void recordQueueDepths(int droppableDepth, int guaranteedDepth);

  /**
   * Records the wall time of one execution, remote call included.
   *
   * @param kind the executed command kind
   * @param durationMs duration in milliseconds (always non-negative)
   */
  default void recordExecutionDurationMs(CommandKind kind, long durationMs) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementRouted(DeliveryClass deliveryClass) {
    }

    @Override
    public void incrementCoalesced(int discarded) {
    }

    @Override
    public void incrementExecutionSuccess(CommandKind kind) {
    }

    @Override
    public void incrementExecutionFailure(CommandKind kind) {
    }

    @Override
    public void recordQueueDepths(int droppableDepth, int guaranteedDepth) {
    }
  }
}
