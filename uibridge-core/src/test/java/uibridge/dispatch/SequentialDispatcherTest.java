package uibridge.dispatch;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import uibridge.CountingMetrics;
import uibridge.RecordingRemoteSession;
import uibridge.command.UiCommand;
import uibridge.execute.CommandExecutor;
import uibridge.util.DaemonThreadFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SequentialDispatcherTest {

  private final CommandChannel channel = new CommandChannel("guaranteed");
  private final RecordingRemoteSession session = new RecordingRemoteSession();
  private final CountingMetrics metrics = new CountingMetrics();
  private final ShutdownSignal signal = new ShutdownSignal();
  private final ExecutorService executions =
      Executors.newFixedThreadPool(4, new DaemonThreadFactory("test-exec-"));

  @AfterEach
  void tearDown() {
    executions.shutdownNow();
  }

  private SequentialDispatcher dispatcher() {
    return new SequentialDispatcher(channel, new CommandExecutor(session, null, metrics, 10, 3),
        executions, signal);
  }

  @Test
  void executesInSubmissionOrderOneAtATime() {
    session.callDelayMs(20);
    channel.send(new UiCommand.Keyboard("a"));
    channel.send(new UiCommand.Keyboard("b"));
    channel.send(new UiCommand.Quit());
    channel.close();

    dispatcher().run();

    assertEquals(List.of("input a", "input b", "command qa!"), session.calls());
    assertEquals(1, session.maxConcurrentCalls());
  }

  @Test
  void fatalFailureAbortsOnlyThatExecution() {
    session.failWhen(call -> call.equals("input b"));
    channel.send(new UiCommand.Keyboard("a"));
    channel.send(new UiCommand.Keyboard("b"));
    channel.send(new UiCommand.Keyboard("c"));
    channel.close();

    dispatcher().run();

    assertEquals(List.of("input a", "input b", "input c"), session.calls());
    assertEquals(1, metrics.failure.get());
    assertEquals(2, metrics.success.get());
  }

  @Test
  void bestEffortFailureLetsLaterCommandsThrough() {
    session.failWhen(call -> call.startsWith("command e "));
    channel.send(new UiCommand.FileDrop("/tmp/x.txt"));
    channel.send(new UiCommand.Keyboard("x"));
    channel.close();

    dispatcher().run();

    assertEquals(List.of("command e /tmp/x.txt", "input x"), session.calls());
  }

  @Test
  void channelClosureCancelsSignal() {
    channel.close();

    dispatcher().run();

    assertTrue(signal.isCancelled());
  }

  @Test
  void cancelledSignalDrainsBufferedCommandsWithoutBlocking() throws Exception {
    channel.send(new UiCommand.Keyboard("a"));
    channel.send(new UiCommand.Keyboard("b"));
    signal.cancel();

    Thread loop = new Thread(dispatcher());
    loop.start();
    loop.join(3000);

    assertFalse(loop.isAlive());
    assertFalse(channel.isClosed());
    assertEquals(List.of("input a", "input b"), session.calls());
  }

  @Test
  void executesInlineWhenPoolIsShutDown() {
    executions.shutdown();
    channel.send(new UiCommand.Keyboard("a"));
    channel.close();

    dispatcher().run();

    assertEquals(List.of("input a"), session.calls());
  }

  @Test
  void deliversEachCommandExactlyOnce() {
    for (int i = 0; i < 200; i++) {
      channel.send(new UiCommand.Keyboard(Integer.toString(i)));
    }
    channel.close();

    dispatcher().run();

    List<String> calls = session.calls();
    assertEquals(200, calls.size());
    for (int i = 0; i < 200; i++) {
      assertEquals("input " + i, calls.get(i));
    }
  }
}
