package uibridge;

import uibridge.command.CommandKind;
import uibridge.command.DeliveryClass;
import uibridge.spi.MetricsExporter;

import java.util.concurrent.atomic.AtomicInteger;

public class CountingMetrics implements MetricsExporter {
  public final AtomicInteger routedDroppable = new AtomicInteger();
  public final AtomicInteger routedGuaranteed = new AtomicInteger();
  public final AtomicInteger coalesced = new AtomicInteger();
  public final AtomicInteger success = new AtomicInteger();
  public final AtomicInteger failure = new AtomicInteger();
  public final AtomicInteger bestEffortFailure = new AtomicInteger();
  public final AtomicInteger durations = new AtomicInteger();

  @Override
  public void incrementRouted(DeliveryClass deliveryClass) {
    if (deliveryClass == DeliveryClass.DROPPABLE) {
      routedDroppable.incrementAndGet();
    } else {
      routedGuaranteed.incrementAndGet();
    }
  }

  @Override
  public void incrementCoalesced(int discarded) {
    coalesced.addAndGet(discarded);
  }

  @Override
  public void incrementExecutionSuccess(CommandKind kind) {
    success.incrementAndGet();
  }

  @Override
  public void incrementExecutionFailure(CommandKind kind) {
    failure.incrementAndGet();
  }

  @Override
  public void incrementBestEffortFailure(CommandKind kind) {
    bestEffortFailure.incrementAndGet();
  }

  @Override
  public void recordQueueDepths(int droppableDepth, int guaranteedDepth) {
  }

  @Override
  public void recordExecutionDurationMs(CommandKind kind, long durationMs) {
    durations.incrementAndGet();
  }
}
