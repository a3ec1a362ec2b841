package uibridge.benchmark;

import org.openjdk.jmh.annotations.*;
import uibridge.CommandPipeline;
import uibridge.command.UiCommand;
import uibridge.dispatch.CommandChannel;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Measures how long a burst of resizes takes until the newest size reaches the remote
 * session. Slower remote calls let more of the burst coalesce away.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar CoalescingDispatchBenchmark}
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class CoalescingDispatchBenchmark {

  @Param({"0", "200"})
  private long callLatencyMicros;

  @Param({"10", "100", "1000"})
  private int burstSize;

  private BenchmarkSession session;
  private CommandChannel inbound;
  private CommandPipeline pipeline;
  private int width = 100;

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
  public void resizeBurst() throws Exception {
    if (width > 1_000_000) {
      width = 100;
    }
    int last = width + burstSize;
    String expected = "tryResize " + last + " 40";
    CountDownLatch latch = session.expect(expected::equals);

    for (int i = 0; i < burstSize; i++) {
      inbound.send(new UiCommand.Resize(++width, 40));
    }

    latch.await(5, TimeUnit.SECONDS);
  }
}
