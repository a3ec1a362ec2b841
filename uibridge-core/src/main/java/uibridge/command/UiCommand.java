package uibridge.command;

import java.util.Objects;

/**
 * One user-intent action produced by the front-end and delivered to the remote session.
 *
 * <p>The variant set is closed. Every variant is an immutable record carrying only the data
 * its remote call needs; ownership of an instance moves along the pipeline and no stage
 * modifies it.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * inbound.send(new UiCommand.Resize(120, 40));
 * inbound.send(new UiCommand.Keyboard("<C-w>"));
 * inbound.send(new UiCommand.Scroll(ScrollDirection.DOWN, 1, GridPosition.of(3, 10)));
 * }</pre>
 *
 * @see CommandKind
 * @see CommandClassifier
 */
public sealed interface UiCommand {

  /** The variant tag. */
  CommandKind kind();

  /** Requests termination of the remote session. */
  record Quit() implements UiCommand {
    @Override
    public CommandKind kind() {
      return CommandKind.QUIT;
    }
  }

  /** New surface size in grid cells. Both dimensions are unsigned. */
  record Resize(int width, int height) implements UiCommand {
    public Resize {
      if (width < 0) {
        throw new IllegalArgumentException("width must be >= 0");
      }
      if (height < 0) {
        throw new IllegalArgumentException("height must be >= 0");
      }
    }

    @Override
    public CommandKind kind() {
      return CommandKind.RESIZE;
    }
  }

  /** Keyboard input in the remote session's key notation, passed through untouched. */
  record Keyboard(String input) implements UiCommand {
    public Keyboard {
      Objects.requireNonNull(input, "input");
    }

    @Override
    public CommandKind kind() {
      return CommandKind.KEYBOARD;
    }
  }

  /** Press or release of the primary button over a grid. */
  record MouseButton(MouseAction action, long gridId, GridPosition position) implements UiCommand {
    public MouseButton {
      Objects.requireNonNull(action, "action");
      Objects.requireNonNull(position, "position");
      if (gridId < 0) {
        throw new IllegalArgumentException("gridId must be >= 0");
      }
    }

    @Override
    public CommandKind kind() {
      return CommandKind.MOUSE_BUTTON;
    }
  }

  /** Wheel movement over a grid. */
  record Scroll(ScrollDirection direction, long gridId, GridPosition position) implements UiCommand {
    public Scroll {
      Objects.requireNonNull(direction, "direction");
      Objects.requireNonNull(position, "position");
      if (gridId < 0) {
        throw new IllegalArgumentException("gridId must be >= 0");
      }
    }

    @Override
    public CommandKind kind() {
      return CommandKind.SCROLL;
    }
  }

  /** Pointer movement with the primary button held. */
  record Drag(long gridId, GridPosition position) implements UiCommand {
    public Drag {
      Objects.requireNonNull(position, "position");
      if (gridId < 0) {
        throw new IllegalArgumentException("gridId must be >= 0");
      }
    }

    @Override
    public CommandKind kind() {
      return CommandKind.DRAG;
    }
  }

  /** A file dropped onto the window; the remote session is asked to open it. */
  record FileDrop(String path) implements UiCommand {
    public FileDrop {
      Objects.requireNonNull(path, "path");
    }

    @Override
    public CommandKind kind() {
      return CommandKind.FILE_DROP;
    }
  }

  record FocusLost() implements UiCommand {
    @Override
    public CommandKind kind() {
      return CommandKind.FOCUS_LOST;
    }
  }

  record FocusGained() implements UiCommand {
    @Override
    public CommandKind kind() {
      return CommandKind.FOCUS_GAINED;
    }
  }

  /** Installs the OS shell-integration entries (context menu items). */
  record RegisterShellIntegration() implements UiCommand {
    @Override
    public CommandKind kind() {
      return CommandKind.REGISTER_SHELL_INTEGRATION;
    }
  }

  /** Removes the OS shell-integration entries. */
  record UnregisterShellIntegration() implements UiCommand {
    @Override
    public CommandKind kind() {
      return CommandKind.UNREGISTER_SHELL_INTEGRATION;
    }
  }
}
