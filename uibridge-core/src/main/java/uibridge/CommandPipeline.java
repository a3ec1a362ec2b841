package uibridge;

import uibridge.dispatch.CoalescingDispatcher;
import uibridge.dispatch.CommandChannel;
import uibridge.dispatch.CommandRouter;
import uibridge.dispatch.SequentialDispatcher;
import uibridge.dispatch.ShutdownSignal;
import uibridge.execute.CommandExecutor;
import uibridge.spi.MetricsExporter;
import uibridge.spi.RemoteSession;
import uibridge.spi.ShellIntegration;
import uibridge.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite that wires a {@link CommandRouter}, a {@link CoalescingDispatcher} and a
 * {@link SequentialDispatcher} between an inbound {@link CommandChannel} and a
 * {@link RemoteSession}.
 *
 * <p>The three loops run on their own daemon threads for the lifetime of the pipeline.
 * Droppable executions run on a bounded pool and are handed off without being awaited.
 * Guaranteed executions run on a separate single thread and are awaited one at a time, so
 * a backlog of slow droppable calls never delays them.
 *
 * <p>Closing the inbound channel is the normal way to stop the pipeline: the router
 * routes what is still buffered, cancels the {@linkplain #shutdownSignal() shutdown signal}
 * and closes both internal channels, and the loops wind down. {@link #close()} does the
 * same from the consumer side and then waits for the loops.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * CommandChannel inbound = new CommandChannel("ui");
 * try (CommandPipeline pipeline = CommandPipeline.builder()
 *     .remoteSession(session)
 *     .inbound(inbound)
 *     .build()) {
 *   inbound.send(new UiCommand.Resize(120, 40));
 *   inbound.send(new UiCommand.Keyboard("ihello<Esc>"));
 * }
 * }</pre>
 *
 * @see CommandPipeline.Builder
 */
public final class CommandPipeline implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(CommandPipeline.class.getName());

  private static final int LOOP_COUNT = 3;

  private final CommandChannel inbound;
  private final CommandChannel droppable;
  private final CommandChannel guaranteed;
  private final ShutdownSignal signal;
  private final MetricsExporter metrics;
  private final ExecutorService loops;
  private final ExecutorService droppableExecutions;
  private final ExecutorService guaranteedExecutions;
  private final long drainTimeoutMs;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private CommandPipeline(Builder builder) {
    RemoteSession remoteSession = Objects.requireNonNull(builder.remoteSession, "remoteSession");
    this.inbound = Objects.requireNonNull(builder.inbound, "inbound");

    if (builder.executionThreads < 1) {
      throw new IllegalArgumentException("executionThreads must be >= 1");
    }
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.signal = builder.shutdownSignal != null ? builder.shutdownSignal : new ShutdownSignal();
    this.drainTimeoutMs = builder.drainTimeoutMs;

    CommandExecutor executor = new CommandExecutor(remoteSession, builder.shellIntegration,
        metrics, builder.minWidth, builder.minHeight);

    this.droppable = new CommandChannel("droppable");
    this.guaranteed = new CommandChannel("guaranteed");
    this.droppableExecutions = Executors.newFixedThreadPool(builder.executionThreads,
        new DaemonThreadFactory("uibridge-exec-"));
    this.guaranteedExecutions = Executors.newSingleThreadExecutor(
        new DaemonThreadFactory("uibridge-guaranteed-"));
    this.loops = Executors.newFixedThreadPool(LOOP_COUNT, new DaemonThreadFactory("uibridge-loop-"));

    loops.execute(new CoalescingDispatcher(droppable, executor, droppableExecutions, metrics));
    loops.execute(new SequentialDispatcher(guaranteed, executor, guaranteedExecutions, signal));
    loops.execute(new CommandRouter(inbound, droppable, guaranteed, signal, metrics));
    loops.shutdown();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the cancellation context shared by the loops of this pipeline.
   */
  public ShutdownSignal shutdownSignal() {
    return signal;
  }

  /**
   * Returns {@code true} while at least one of the three loops is still running.
   */
  public boolean isRunning() {
    return !loops.isTerminated();
  }

  /**
   * Waits for the three loops to finish. Spawned droppable executions are not awaited.
   *
   * @return {@code true} if the loops finished within the timeout
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
    return loops.awaitTermination(timeout, unit);
  }

  /**
   * Stops the pipeline: closes the inbound channel so producers can no longer send, and
   * waits up to the drain timeout while the loops route and execute every command already
   * accepted. If the timeout elapses the shutdown signal is cancelled and the loops are
   * interrupted. The execution pools are then shut down without waiting for droppable
   * executions already handed off. Subsequent calls are no-ops.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    inbound.close();
    try {
      if (!loops.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; interrupting dispatch loops. Inbound remaining: "
            + inbound.size() + ", Droppable remaining: " + droppable.size()
            + ", Guaranteed remaining: " + guaranteed.size());
        signal.cancel();
        loops.shutdownNow();
      }
    } catch (InterruptedException e) {
      signal.cancel();
      loops.shutdownNow();
      Thread.currentThread().interrupt();
    } finally {
      droppableExecutions.shutdown();
      guaranteedExecutions.shutdown();
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        logger.log(Level.WARNING, "Failed to close metrics exporter", e);
      }
    }
  }

  /** Builder for {@link CommandPipeline}. */
  public static final class Builder {
    private RemoteSession remoteSession;
    private CommandChannel inbound;
    private ShellIntegration shellIntegration;
    private MetricsExporter metrics;
    private ShutdownSignal shutdownSignal;
    private int executionThreads = 4;
    private int minWidth = CommandExecutor.DEFAULT_MIN_WIDTH;
    private int minHeight = CommandExecutor.DEFAULT_MIN_HEIGHT;
    private long drainTimeoutMs = 5000;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /**
     * Sets the remote session every command is executed against.
     *
     * <p><b>Required.</b> Must be safe for concurrent use.
     *
     * @param remoteSession the session handle
     * @return this builder
     */
    public Builder remoteSession(RemoteSession remoteSession) {
      this.remoteSession = remoteSession;
      return this;
    }

    /**
     * Sets the channel the front-end sends raw commands to. Closing it shuts the pipeline down.
     *
     * <p><b>Required.</b>
     *
     * @param inbound the inbound channel
     * @return this builder
     */
    public Builder inbound(CommandChannel inbound) {
      this.inbound = inbound;
      return this;
    }

    /**
     * Sets the platform shell integration used by the register/unregister commands.
     *
     * <p>Optional. Without one, those commands report that the platform is unsupported.
     *
     * @param shellIntegration the shell integration
     * @return this builder
     */
    public Builder shellIntegration(ShellIntegration shellIntegration) {
      this.shellIntegration = shellIntegration;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the cancellation context shared by the loops.
     *
     * <p>Optional. Defaults to a fresh {@link ShutdownSignal} per pipeline.
     *
     * @param shutdownSignal the signal
     * @return this builder
     */
    public Builder shutdownSignal(ShutdownSignal shutdownSignal) {
      this.shutdownSignal = shutdownSignal;
      return this;
    }

    /**
     * Sets the size of the pool that runs droppable remote calls. Guaranteed calls always
     * run on one dedicated thread.
     *
     * <p>Optional. Defaults to {@code 4}. Must be &ge; 1.
     *
     * @param executionThreads number of execution threads
     * @return this builder
     */
    public Builder executionThreads(int executionThreads) {
      this.executionThreads = executionThreads;
      return this;
    }

    /**
     * Sets the lower bound applied to resize widths.
     *
     * <p>Optional. Defaults to {@code 10}. Must be &ge; 1.
     *
     * @param minWidth minimum width in cells
     * @return this builder
     */
    public Builder minWidth(int minWidth) {
      this.minWidth = minWidth;
      return this;
    }

    /**
     * Sets the lower bound applied to resize heights.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &ge; 1.
     *
     * @param minHeight minimum height in cells
     * @return this builder
     */
    public Builder minHeight(int minHeight) {
      this.minHeight = minHeight;
      return this;
    }

    /**
     * Sets how long {@link CommandPipeline#close()} waits for the loops before interrupting them.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Builds and starts the pipeline. The loops begin consuming immediately.
     *
     * @return a running pipeline
     * @throws NullPointerException if {@code remoteSession} or {@code inbound} is null
     * @throws IllegalArgumentException if a numeric setting is out of range
     * @throws IllegalStateException if this builder was already used
     */
    public CommandPipeline build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      return new CommandPipeline(this);
    }
  }
}
