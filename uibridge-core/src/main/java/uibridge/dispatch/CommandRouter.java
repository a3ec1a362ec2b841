package uibridge.dispatch;

import uibridge.command.CommandClassifier;
import uibridge.command.DeliveryClass;
import uibridge.command.UiCommand;
import uibridge.spi.MetricsExporter;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single consumer of the inbound command stream and sole producer into the droppable and
 * guaranteed channels.
 *
 * <p>Each received command is classified and sent to exactly one channel; nothing is
 * duplicated or discarded here. Closure of the inbound channel cancels the shared
 * {@link ShutdownSignal}, which is the canonical shutdown trigger for the whole pipeline.
 * A signal cancelled from elsewhere stops the blocking receives, but commands already
 * buffered inbound are still routed before the loop exits.
 * When the loop ends, for whatever reason, both outbound channels are closed so the
 * dispatchers observe the end of input.
 */
public final class CommandRouter implements Runnable {
  private static final Logger logger = Logger.getLogger(CommandRouter.class.getName());

  private final CommandChannel inbound;
  private final CommandChannel droppable;
  private final CommandChannel guaranteed;
  private final ShutdownSignal signal;
  private final MetricsExporter metrics;

  public CommandRouter(CommandChannel inbound, CommandChannel droppable, CommandChannel guaranteed,
      ShutdownSignal signal, MetricsExporter metrics) {
    this.inbound = Objects.requireNonNull(inbound, "inbound");
    this.droppable = Objects.requireNonNull(droppable, "droppable");
    this.guaranteed = Objects.requireNonNull(guaranteed, "guaranteed");
    this.signal = Objects.requireNonNull(signal, "signal");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public void run() {
    try {
      while (!signal.isCancelled()) {
        UiCommand command = inbound.receive();
        if (command == null) {
          if (signal.cancel()) {
            logger.fine("Inbound command channel closed; shutting down pipeline");
          }
          return;
        }
        route(command);
      }
      UiCommand buffered;
      while ((buffered = inbound.tryReceive()) != null) {
        route(buffered);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } finally {
      droppable.close();
      guaranteed.close();
    }
  }

  /**
   * Forwards one command to the channel matching its delivery class.
   *
   * @throws IllegalStateException if the target channel is closed while the router runs
   */
  void route(UiCommand command) {
    DeliveryClass deliveryClass = CommandClassifier.classify(command);
    CommandChannel target = deliveryClass == DeliveryClass.DROPPABLE ? droppable : guaranteed;
    try {
      target.send(command);
    } catch (ChannelClosedException e) {
      logger.log(Level.SEVERE, "Could not send " + command.kind() + " to " + target.name(), e);
      throw new IllegalStateException("Could not send " + deliveryClass + " command", e);
    }
    metrics.incrementRouted(deliveryClass);
    metrics.recordQueueDepths(droppable.size(), guaranteed.size());
  }
}
