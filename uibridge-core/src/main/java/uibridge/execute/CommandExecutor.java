package uibridge.execute;

import uibridge.command.CommandKind;
import uibridge.command.GridPosition;
import uibridge.command.UiCommand;
import uibridge.spi.MetricsExporter;
import uibridge.spi.RemoteSession;
import uibridge.spi.RemoteSessionException;
import uibridge.spi.ShellIntegration;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Performs the remote call that corresponds to a command.
 *
 * <h2>Call mapping</h2>
 * <ul>
 *   <li>{@code QUIT} - {@code command("qa!")}</li>
 *   <li>{@code RESIZE} - {@code tryResize}, width floored to {@code minWidth} (default 10)
 *       and height to {@code minHeight} (default 3)</li>
 *   <li>{@code KEYBOARD} - {@code input}, verbatim</li>
 *   <li>{@code MOUSE_BUTTON} - {@code inputMouse("left", action, "", grid, row, column)}</li>
 *   <li>{@code SCROLL} - {@code inputMouse("wheel", direction, "", grid, row, column)}</li>
 *   <li>{@code DRAG} - {@code inputMouse("left", "drag", "", grid, row, column)}</li>
 *   <li>{@code FOCUS_LOST}/{@code FOCUS_GAINED} - runs the matching autocommand only if one
 *       is defined</li>
 *   <li>{@code FILE_DROP} - {@code command("e <path>")}</li>
 *   <li>shell integration - {@link ShellIntegration} calls; failures become warnings</li>
 * </ul>
 *
 * <p>Failures follow the kind's {@link uibridge.command.FailurePolicy}: fatal failures throw
 * {@link CommandExecutionException}, best-effort failures are logged and discarded.
 *
 * <p>This class is stateless apart from its collaborators and is safe to call from many
 * threads at once.
 */
public final class CommandExecutor {
  private static final Logger logger = Logger.getLogger(CommandExecutor.class.getName());

  public static final int DEFAULT_MIN_WIDTH = 10;
  public static final int DEFAULT_MIN_HEIGHT = 3;

  static final String QUIT_ALL = "qa!";
  static final String FOCUS_LOST_HOOK =
      "if exists('#FocusLost') | doautocmd <nomodeline> FocusLost | endif";
  static final String FOCUS_GAINED_HOOK =
      "if exists('#FocusGained') | doautocmd <nomodeline> FocusGained | endif";

  public static final String UNSUPPORTED_SHELL_INTEGRATION =
      "Shell integration is not supported on this platform";
  public static final String REGISTER_DIRECTORY_FAILED =
      "Could not register directory context menu item. Possibly already registered or not running as Admin?";
  public static final String REGISTER_FILE_FAILED =
      "Could not register file context menu item. Possibly already registered or not running as Admin?";
  public static final String UNREGISTER_FAILED =
      "Could not remove context menu items. Possibly already removed or not running as Admin?";

  private final RemoteSession session;
  private final ShellIntegration shellIntegration;
  private final MetricsExporter metrics;
  private final int minWidth;
  private final int minHeight;

  public CommandExecutor(RemoteSession session) {
    this(session, null, MetricsExporter.NOOP, DEFAULT_MIN_WIDTH, DEFAULT_MIN_HEIGHT);
  }

  /**
   * @param session the remote session
   * @param shellIntegration platform shell integration, or {@code null} where unsupported
   * @param metrics metrics exporter
   * @param minWidth lower bound applied to resize widths, {@code >= 1}
   * @param minHeight lower bound applied to resize heights, {@code >= 1}
   */
  public CommandExecutor(RemoteSession session, ShellIntegration shellIntegration,
      MetricsExporter metrics, int minWidth, int minHeight) {
    this.session = Objects.requireNonNull(session, "session");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    if (minWidth < 1 || minHeight < 1) {
      throw new IllegalArgumentException("minWidth and minHeight must be >= 1");
    }
    this.shellIntegration = shellIntegration;
    this.minWidth = minWidth;
    this.minHeight = minHeight;
  }

  /**
   * Executes a command to completion on the calling thread.
   *
   * @param command the command
   * @throws CommandExecutionException if a fatal remote call fails
   */
  public void execute(UiCommand command) {
    Objects.requireNonNull(command, "command");
    CommandKind kind = command.kind();
    long startNanos = System.nanoTime();
    try {
      remoteCallFor(command).invoke();
      metrics.incrementExecutionSuccess(kind);
    } catch (RemoteSessionException e) {
      handleFailure(kind, e);
    } finally {
      long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
      metrics.recordExecutionDurationMs(kind, Math.max(0L, elapsedMs));
    }
  }

  private RemoteCall remoteCallFor(UiCommand command) {
    return switch (command.kind()) {
      case QUIT -> () -> session.command(QUIT_ALL);
      case RESIZE -> {
        UiCommand.Resize resize = (UiCommand.Resize) command;
        yield () -> session.tryResize(
            Math.max(resize.width(), minWidth), Math.max(resize.height(), minHeight));
      }
      case KEYBOARD -> {
        String keys = ((UiCommand.Keyboard) command).input();
        yield () -> {
          logger.finest(() -> "Keyboard input sent: " + keys);
          session.input(keys);
        };
      }
      case MOUSE_BUTTON -> {
        UiCommand.MouseButton button = (UiCommand.MouseButton) command;
        yield () -> mouse("left", button.action().wireName(), button.gridId(), button.position());
      }
      case SCROLL -> {
        UiCommand.Scroll scroll = (UiCommand.Scroll) command;
        yield () -> mouse("wheel", scroll.direction().wireName(), scroll.gridId(), scroll.position());
      }
      case DRAG -> {
        UiCommand.Drag drag = (UiCommand.Drag) command;
        yield () -> mouse("left", "drag", drag.gridId(), drag.position());
      }
      case FOCUS_LOST -> () -> session.command(FOCUS_LOST_HOOK);
      case FOCUS_GAINED -> () -> session.command(FOCUS_GAINED_HOOK);
      case FILE_DROP -> {
        String path = ((UiCommand.FileDrop) command).path();
        yield () -> session.command("e " + path);
      }
      case REGISTER_SHELL_INTEGRATION -> this::registerShellIntegration;
      case UNREGISTER_SHELL_INTEGRATION -> this::unregisterShellIntegration;
    };
  }

  private void mouse(String button, String action, long gridId, GridPosition position)
      throws RemoteSessionException {
    session.inputMouse(button, action, "", gridId, position.row(), position.column());
  }

  private void registerShellIntegration() {
    if (shellIntegration == null) {
      reportIntegrationFailure(UNSUPPORTED_SHELL_INTEGRATION);
      return;
    }
    // Stale entries from an earlier registration; nothing to remove is the common case.
    if (!shellIntegration.unregister()) {
      logger.fine("No previous shell integration entries removed");
    }
    if (!shellIntegration.registerDirectoryEntry()) {
      reportIntegrationFailure(REGISTER_DIRECTORY_FAILED);
    }
    if (!shellIntegration.registerFileEntry()) {
      reportIntegrationFailure(REGISTER_FILE_FAILED);
    }
  }

  private void unregisterShellIntegration() {
    if (shellIntegration == null) {
      reportIntegrationFailure(UNSUPPORTED_SHELL_INTEGRATION);
      return;
    }
    if (!shellIntegration.unregister()) {
      reportIntegrationFailure(UNREGISTER_FAILED);
    }
  }

  private void reportIntegrationFailure(String message) {
    logger.warning(message);
    try {
      session.errWriteln(message);
    } catch (RemoteSessionException e) {
      logger.log(Level.FINE, "Could not write diagnostic to remote session", e);
    }
  }

  private void handleFailure(CommandKind kind, RemoteSessionException failure) {
    switch (kind.failurePolicy()) {
      case FATAL -> {
        metrics.incrementExecutionFailure(kind);
        throw new CommandExecutionException(kind, failure);
      }
      case BEST_EFFORT -> {
        metrics.incrementBestEffortFailure(kind);
        logger.log(Level.FINE, "Ignoring failed " + kind + " call", failure);
      }
      case LOGGED -> logger.log(Level.WARNING, kind + " reported a failure", failure);
    }
  }

  @FunctionalInterface
  private interface RemoteCall {
    void invoke() throws RemoteSessionException;
  }
}
