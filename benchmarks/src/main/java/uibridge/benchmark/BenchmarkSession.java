package uibridge.benchmark;

import uibridge.spi.RemoteSession;
import uibridge.spi.RemoteSessionException;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

/**
 * In-memory remote session that counts down a latch when a call matching the armed
 * predicate arrives. Optional per-call latency simulates a remote round trip.
 */
final class BenchmarkSession implements RemoteSession {

  private record Expectation(Predicate<String> match, CountDownLatch latch) {}

  private final AtomicReference<Expectation> expectation = new AtomicReference<>();
  private final long callLatencyNanos;

  BenchmarkSession(long callLatencyMicros) {
    this.callLatencyNanos = callLatencyMicros * 1000L;
  }

  CountDownLatch expect(Predicate<String> match) {
    CountDownLatch latch = new CountDownLatch(1);
    expectation.set(new Expectation(match, latch));
    return latch;
  }

  private void call(String call) {
    if (callLatencyNanos > 0) {
      long end = System.nanoTime() + callLatencyNanos;
      while (System.nanoTime() < end) {
        Thread.onSpinWait();
      }
    }
    Expectation current = expectation.get();
    if (current != null && current.match().test(call)) {
      current.latch().countDown();
    }
  }

  @Override
  public void command(String command) {
    call("command " + command);
  }

  @Override
  public void tryResize(long width, long height) {
    call("tryResize " + width + " " + height);
  }

  @Override
  public void input(String keys) {
    call("input " + keys);
  }

  @Override
  public void inputMouse(String button, String action, String modifier, long grid, long row, long column) {
    call("inputMouse " + button + " " + action);
  }

  @Override
  public void errWriteln(String message) {
    call("errWriteln " + message);
  }

  @Override
  public Object getVariable(String name) throws RemoteSessionException {
    throw new RemoteSessionException("Key not found: " + name);
  }

  @Override
  public Object getOption(String name) throws RemoteSessionException {
    throw new RemoteSessionException("Invalid option name: " + name);
  }
}
