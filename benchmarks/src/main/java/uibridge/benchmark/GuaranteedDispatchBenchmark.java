package uibridge.benchmark;

import org.openjdk.jmh.annotations.*;
import uibridge.CommandPipeline;
import uibridge.command.UiCommand;
import uibridge.dispatch.CommandChannel;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Measures end-to-end latency of the guaranteed path: send -> route -> sequential
 * dispatch -> remote call.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar GuaranteedDispatchBenchmark}
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class GuaranteedDispatchBenchmark {

  @Param({"0", "50"})
  private long callLatencyMicros;

  @Param({"1", "16"})
  private int batchSize;

  private BenchmarkSession session;
  private CommandChannel inbound;
  private CommandPipeline pipeline;
  private long sequence;

  @Setup(Level.Trial)
  public void setup() {
    session = new BenchmarkSession(callLatencyMicros);
    inbound = new CommandChannel("bench");
    pipeline = CommandPipeline.builder()
        .remoteSession(session)
        .inbound(inbound)
        .executionThreads(4)
        .build();
  }

  @TearDown(Level.Trial)
  public void tearDown() {
    pipeline.close();
  }

  @Benchmark
  public void sendKeyboardBatch() throws Exception {
    String last = null;
    for (int i = 0; i < batchSize; i++) {
      last = Long.toString(sequence++);
    }
    String expected = "input " + last;
    CountDownLatch latch = session.expect(expected::equals);

    long first = sequence - batchSize;
    for (long i = first; i < sequence; i++) {
      inbound.send(new UiCommand.Keyboard(Long.toString(i)));
    }

    latch.await(5, TimeUnit.SECONDS);
  }
}
