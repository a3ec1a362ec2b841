package uibridge.dispatch;

import uibridge.command.UiCommand;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Unbounded FIFO channel of {@link UiCommand}s with an explicit closed state.
 *
 * <p>{@link #send} never blocks. {@link #receive()} blocks until a command is available or
 * the channel is both closed and empty; commands sent before {@link #close()} are still
 * delivered. Any number of threads may send; the pipeline uses a single receiver per
 * channel.
 *
 * <p>Capacity is unbounded. Superseded commands are eliminated by the
 * coalescing policy downstream.
 */
public final class CommandChannel {
  private final String name;
  private final ArrayDeque<UiCommand> queue = new ArrayDeque<>();
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmptyOrClosed = lock.newCondition();
  private boolean closed;

  public CommandChannel(String name) {
    this.name = Objects.requireNonNull(name, "name");
  }

  public String name() {
    return name;
  }

  /**
   * Appends a command.
   *
   * @param command the command
   * @throws ChannelClosedException if the channel has been closed
   */
  public void send(UiCommand command) {
    Objects.requireNonNull(command, "command");
    lock.lock();
    try {
      if (closed) {
        throw new ChannelClosedException("Channel '" + name + "' is closed");
      }
      queue.addLast(command);
      notEmptyOrClosed.signal();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes the oldest command, waiting for one if necessary.
   *
   * @return the command, or {@code null} once the channel is closed and drained
   * @throws InterruptedException if interrupted while waiting
   */
  public UiCommand receive() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      while (queue.isEmpty() && !closed) {
        notEmptyOrClosed.await();
      }
      return queue.pollFirst();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Like {@link #receive()} but gives up after the timeout.
   *
   * @return the command, or {@code null} if closed and drained or the timeout elapsed
   * @throws InterruptedException if interrupted while waiting
   */
  public UiCommand receive(long timeout, TimeUnit unit) throws InterruptedException {
    long remaining = unit.toNanos(timeout);
    lock.lockInterruptibly();
    try {
      while (queue.isEmpty() && !closed) {
        if (remaining <= 0L) {
          return null;
        }
        remaining = notEmptyOrClosed.awaitNanos(remaining);
      }
      return queue.pollFirst();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes the oldest command without waiting.
   *
   * @return the command, or {@code null} if none is buffered
   */
  public UiCommand tryReceive() {
    lock.lock();
    try {
      return queue.pollFirst();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Closes the channel. Further sends fail; buffered commands remain receivable.
   * Subsequent calls are no-ops.
   */
  public void close() {
    lock.lock();
    try {
      closed = true;
      notEmptyOrClosed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  /** {@code true} once closed with nothing left to receive. */
  public boolean isDrained() {
    lock.lock();
    try {
      return closed && queue.isEmpty();
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return queue.size();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String toString() {
    return "CommandChannel[" + name + "]";
  }
}
