package uibridge.dispatch;

import uibridge.command.UiCommand;
import uibridge.execute.CommandExecutionException;
import uibridge.execute.CommandExecutor;

import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Executes guaranteed commands one at a time, in arrival order.
 *
 * <p>Each command runs as its own task on the execution pool and the loop waits for that
 * task to finish before receiving the next command. A fatal failure aborts only the task
 * that raised it; the loop logs it and moves on. Commands are never reordered, coalesced
 * or dropped.
 *
 * <p>The loop checks the {@link ShutdownSignal} before every blocking receive. Once the
 * signal is cancelled it executes whatever is already buffered, without waiting for more,
 * and exits. Closure of the channel cancels the signal.
 */
public final class SequentialDispatcher implements Runnable {
  private static final Logger logger = Logger.getLogger(SequentialDispatcher.class.getName());

  private final CommandChannel channel;
  private final CommandExecutor executor;
  private final ExecutorService executions;
  private final ShutdownSignal signal;

  public SequentialDispatcher(CommandChannel channel, CommandExecutor executor,
      ExecutorService executions, ShutdownSignal signal) {
    this.channel = Objects.requireNonNull(channel, "channel");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.executions = Objects.requireNonNull(executions, "executions");
    this.signal = Objects.requireNonNull(signal, "signal");
  }

  @Override
  public void run() {
    try {
      while (!signal.isCancelled()) {
        UiCommand command = channel.receive();
        if (command == null) {
          signal.cancel();
          return;
        }
        executeAndWait(command);
      }
      UiCommand buffered;
      while ((buffered = channel.tryReceive()) != null) {
        executeAndWait(buffered);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private void executeAndWait(UiCommand command) throws InterruptedException {
    Future<?> execution;
    try {
      execution = executions.submit(() -> executor.execute(command));
    } catch (RejectedExecutionException e) {
      // Pool already shut down; keep the delivery guarantee on this thread.
      executeInline(command);
      return;
    }
    try {
      execution.get();
    } catch (ExecutionException e) {
      logger.log(Level.SEVERE, "Execution of " + command.kind() + " aborted", e.getCause());
    }
  }

  private void executeInline(UiCommand command) {
    try {
      executor.execute(command);
    } catch (CommandExecutionException e) {
      logger.log(Level.SEVERE, "Execution of " + command.kind() + " aborted", e);
    }
  }
}
