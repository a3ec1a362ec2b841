package uibridge.execute;

import org.junit.jupiter.api.Test;
import uibridge.CountingMetrics;
import uibridge.RecordingRemoteSession;
import uibridge.command.CommandKind;
import uibridge.command.GridPosition;
import uibridge.command.MouseAction;
import uibridge.command.SampleCommands;
import uibridge.command.ScrollDirection;
import uibridge.command.UiCommand;
import uibridge.spi.ShellIntegration;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommandExecutorTest {

  private final RecordingRemoteSession session = new RecordingRemoteSession();
  private final CountingMetrics metrics = new CountingMetrics();

  private CommandExecutor executor() {
    return executor(null);
  }

  private CommandExecutor executor(ShellIntegration shellIntegration) {
    return new CommandExecutor(session, shellIntegration, metrics,
        CommandExecutor.DEFAULT_MIN_WIDTH, CommandExecutor.DEFAULT_MIN_HEIGHT);
  }

  // ── Call mapping ────────────────────────────────────────────────

  @Test
  void resizeIsFlooredToMinimums() {
    executor().execute(new UiCommand.Resize(5, 1));

    assertEquals(List.of("tryResize 10 3"), session.calls());
  }

  @Test
  void resizeAboveMinimumsPassesThrough() {
    executor().execute(new UiCommand.Resize(120, 60));

    assertEquals(List.of("tryResize 120 60"), session.calls());
  }

  @Test
  void resizeUsesConfiguredMinimums() {
    new CommandExecutor(session, null, metrics, 40, 12).execute(new UiCommand.Resize(20, 20));

    assertEquals(List.of("tryResize 40 20"), session.calls());
  }

  @Test
  void keyboardInputIsForwardedVerbatim() {
    executor().execute(new UiCommand.Keyboard("<C-w>|<lt>"));

    assertEquals(List.of("input <C-w>|<lt>"), session.calls());
  }

  @Test
  void mouseButtonPassesRowBeforeColumn() {
    executor().execute(new UiCommand.MouseButton(MouseAction.PRESS, 2, GridPosition.of(7, 4)));

    assertEquals(List.of("inputMouse left press  2 4 7"), session.calls());
  }

  @Test
  void scrollUsesWheelButton() {
    executor().execute(new UiCommand.Scroll(ScrollDirection.DOWN, 1, GridPosition.of(0, 9)));

    assertEquals(List.of("inputMouse wheel down  1 9 0"), session.calls());
  }

  @Test
  void dragUsesDragAction() {
    executor().execute(new UiCommand.Drag(3, GridPosition.of(11, 12)));

    assertEquals(List.of("inputMouse left drag  3 12 11"), session.calls());
  }

  @Test
  void quitClosesAllWindows() {
    executor().execute(new UiCommand.Quit());

    assertEquals(List.of("command qa!"), session.calls());
  }

  @Test
  void focusEventsRunAutocommandOnlyIfDefined() {
    executor().execute(new UiCommand.FocusLost());
    executor().execute(new UiCommand.FocusGained());

    assertEquals(List.of(
        "command if exists('#FocusLost') | doautocmd <nomodeline> FocusLost | endif",
        "command if exists('#FocusGained') | doautocmd <nomodeline> FocusGained | endif"),
        session.calls());
  }

  @Test
  void fileDropEditsPath() {
    executor().execute(new UiCommand.FileDrop("/tmp/x.txt"));

    assertEquals(List.of("command e /tmp/x.txt"), session.calls());
  }

  @Test
  void everyKindExecutesAgainstHealthySession() {
    CommandExecutor executor = executor(new StubShellIntegration(true, true, true));

    for (UiCommand command : SampleCommands.oneOfEach()) {
      assertDoesNotThrow(() -> executor.execute(command), command.kind().toString());
    }
    assertEquals(CommandKind.values().length, metrics.success.get());
    assertEquals(CommandKind.values().length, metrics.durations.get());
  }

  // ── Failure policy ──────────────────────────────────────────────

  @Test
  void resizeFailureIsFatal() {
    session.failWhen(call -> call.startsWith("tryResize"));

    CommandExecutionException e = assertThrows(CommandExecutionException.class,
        () -> executor().execute(new UiCommand.Resize(100, 50)));

    assertEquals(CommandKind.RESIZE, e.kind());
    assertEquals(1, metrics.failure.get());
  }

  @Test
  void keyboardFailureIsFatal() {
    session.failWhen(call -> call.startsWith("input "));

    assertThrows(CommandExecutionException.class, () -> executor().execute(new UiCommand.Keyboard("a")));
  }

  @Test
  void focusLostFailureIsFatal() {
    session.failWhen(call -> call.contains("FocusLost"));

    CommandExecutionException e = assertThrows(CommandExecutionException.class,
        () -> executor().execute(new UiCommand.FocusLost()));

    assertEquals(CommandKind.FOCUS_LOST, e.kind());
  }

  @Test
  void fileDropFailureIsIgnored() {
    session.failWhen(call -> call.startsWith("command e "));

    assertDoesNotThrow(() -> executor().execute(new UiCommand.FileDrop("/tmp/x.txt")));
    assertEquals(1, metrics.bestEffortFailure.get());
    assertEquals(0, metrics.failure.get());
  }

  @Test
  void quitFailureIsIgnored() {
    session.failWhen(call -> true);

    assertDoesNotThrow(() -> executor().execute(new UiCommand.Quit()));
    assertEquals(1, metrics.bestEffortFailure.get());
  }

  // ── Shell integration ───────────────────────────────────────────

  @Test
  void registerWithoutIntegrationReportsUnsupported() {
    executor().execute(new UiCommand.RegisterShellIntegration());

    assertEquals(List.of("errWriteln " + CommandExecutor.UNSUPPORTED_SHELL_INTEGRATION), session.calls());
  }

  @Test
  void registerReportsEachFailedEntry() {
    executor(new StubShellIntegration(false, false, false)).execute(new UiCommand.RegisterShellIntegration());

    assertEquals(List.of(
        "errWriteln " + CommandExecutor.REGISTER_DIRECTORY_FAILED,
        "errWriteln " + CommandExecutor.REGISTER_FILE_FAILED),
        session.calls());
  }

  @Test
  void registerRemovesStaleEntriesFirst() {
    StubShellIntegration integration = new StubShellIntegration(true, true, true);

    executor(integration).execute(new UiCommand.RegisterShellIntegration());

    assertEquals(List.of("unregister", "directory", "file"), integration.calls);
    assertTrue(session.calls().isEmpty());
  }

  @Test
  void unregisterFailureIsReported() {
    executor(new StubShellIntegration(true, true, false)).execute(new UiCommand.UnregisterShellIntegration());

    assertEquals(List.of("errWriteln " + CommandExecutor.UNREGISTER_FAILED), session.calls());
  }

  @Test
  void integrationDiagnosticSurvivesBrokenSession() {
    session.failWhen(call -> call.startsWith("errWriteln"));

    assertDoesNotThrow(() ->
        executor(new StubShellIntegration(false, true, true)).execute(new UiCommand.RegisterShellIntegration()));
    assertEquals(1, metrics.success.get());
  }

  // ── Construction ────────────────────────────────────────────────

  @Test
  void rejectsInvalidConstruction() {
    assertThrows(NullPointerException.class, () -> new CommandExecutor(null));
    assertThrows(NullPointerException.class,
        () -> new CommandExecutor(session, null, null, 10, 3));
    assertThrows(IllegalArgumentException.class,
        () -> new CommandExecutor(session, null, metrics, 0, 3));
    assertThrows(IllegalArgumentException.class,
        () -> new CommandExecutor(session, null, metrics, 10, 0));
  }

  static final class StubShellIntegration implements ShellIntegration {
    final List<String> calls = new java.util.ArrayList<>();
    private final boolean directory;
    private final boolean file;
    private final boolean unregister;

    StubShellIntegration(boolean directory, boolean file, boolean unregister) {
      this.directory = directory;
      this.file = file;
      this.unregister = unregister;
    }

    @Override
    public boolean registerDirectoryEntry() {
      calls.add("directory");
      return directory;
    }

    @Override
    public boolean registerFileEntry() {
      calls.add("file");
      return file;
    }

    @Override
    public boolean unregister() {
      calls.add("unregister");
      return unregister;
    }
  }
}
