package uibridge.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import uibridge.command.CommandKind;
import uibridge.command.DeliveryClass;
import uibridge.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Per-kind meters carry a {@code kind} tag holding the lower-case {@link CommandKind} name.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code uibridge.routed.droppable}: commands routed to the coalescing path</li>
 *   <li>{@code uibridge.routed.guaranteed}: commands routed to the sequential path</li>
 *   <li>{@code uibridge.coalesced.discarded}: droppable commands superseded within a burst</li>
 *   <li>{@code uibridge.execution.success}: executions that completed (tagged)</li>
 *   <li>{@code uibridge.execution.failure}: executions aborted by a fatal failure (tagged)</li>
 *   <li>{@code uibridge.execution.besteffort.failure}: ignored best-effort failures (tagged)</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code uibridge.queue.droppable.depth}</li>
 *   <li>{@code uibridge.queue.guaranteed.depth}</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code uibridge.execution.duration}: wall time per execution (tagged)</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  public static final String DEFAULT_NAME_PREFIX = "uibridge";

  private final MeterRegistry registry;
  private final Counter routedDroppable;
  private final Counter routedGuaranteed;
  private final Counter coalesced;
  private final Map<CommandKind, Counter> executionSuccess = new EnumMap<>(CommandKind.class);
  private final Map<CommandKind, Counter> executionFailure = new EnumMap<>(CommandKind.class);
  private final Map<CommandKind, Counter> bestEffortFailure = new EnumMap<>(CommandKind.class);
  private final Map<CommandKind, Timer> executionDuration = new EnumMap<>(CommandKind.class);
  private final Gauge droppableDepthGauge;
  private final Gauge guaranteedDepthGauge;

  private final AtomicInteger droppableDepth = new AtomicInteger();
  private final AtomicInteger guaranteedDepth = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "uibridge"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, DEFAULT_NAME_PREFIX);
  }

  /**
   * Creates an exporter with a custom metric name prefix, for running several pipelines
   * against one registry.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "editor.main"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.routedDroppable = Counter.builder(namePrefix + ".routed.droppable")
        .description("Commands routed to the coalescing path")
        .register(registry);
    this.routedGuaranteed = Counter.builder(namePrefix + ".routed.guaranteed")
        .description("Commands routed to the sequential path")
        .register(registry);
    this.coalesced = Counter.builder(namePrefix + ".coalesced.discarded")
        .description("Droppable commands superseded by a newer one")
        .register(registry);

    for (CommandKind kind : CommandKind.values()) {
      String tag = kind.name().toLowerCase(Locale.ROOT);
      executionSuccess.put(kind, Counter.builder(namePrefix + ".execution.success")
          .description("Executions that completed")
          .tag("kind", tag)
          .register(registry));
      executionFailure.put(kind, Counter.builder(namePrefix + ".execution.failure")
          .description("Executions aborted by a fatal remote-call failure")
          .tag("kind", tag)
          .register(registry));
      bestEffortFailure.put(kind, Counter.builder(namePrefix + ".execution.besteffort.failure")
          .description("Best-effort remote-call failures that were ignored")
          .tag("kind", tag)
          .register(registry));
      executionDuration.put(kind, Timer.builder(namePrefix + ".execution.duration")
          .description("Wall time of one execution")
          .tag("kind", tag)
          .register(registry));
    }

    this.droppableDepthGauge = Gauge.builder(namePrefix + ".queue.droppable.depth",
            droppableDepth, AtomicInteger::get)
        .register(registry);
    this.guaranteedDepthGauge = Gauge.builder(namePrefix + ".queue.guaranteed.depth",
            guaranteedDepth, AtomicInteger::get)
        .register(registry);
  }

  @Override
  public void incrementRouted(DeliveryClass deliveryClass) {
    if (closed) return;
    if (deliveryClass == DeliveryClass.DROPPABLE) {
      routedDroppable.increment();
    } else {
      routedGuaranteed.increment();
    }
  }

  @Override
  public void incrementCoalesced(int discarded) {
    if (closed) return;
    coalesced.increment(discarded);
  }

  @Override
  public void incrementExecutionSuccess(CommandKind kind) {
    if (closed) return;
    executionSuccess.get(kind).increment();
  }

  @Override
  public void incrementExecutionFailure(CommandKind kind) {
    if (closed) return;
    executionFailure.get(kind).increment();
  }

  @Override
  public void incrementBestEffortFailure(CommandKind kind) {
    if (closed) return;
    bestEffortFailure.get(kind).increment();
  }

  @Override
  public void recordQueueDepths(int droppableDepth, int guaranteedDepth) {
    if (closed) return;
    this.droppableDepth.set(droppableDepth);
    this.guaranteedDepth.set(guaranteedDepth);
  }

  @Override
  public void recordExecutionDurationMs(CommandKind kind, long durationMs) {
    if (closed) return;
    executionDuration.get(kind).record(durationMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>{@link uibridge.CommandPipeline#close()} calls this, so stale gauges do not outlive
   * the pipeline.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(routedDroppable, routedGuaranteed, coalesced,
        droppableDepthGauge, guaranteedDepthGauge));
    meters.addAll(executionSuccess.values());
    meters.addAll(executionFailure.values());
    meters.addAll(bestEffortFailure.values());
    meters.addAll(executionDuration.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
