package uibridge.execute;

import uibridge.command.CommandKind;

import java.util.Objects;

/**
 * Aborts one execution whose remote call failed under
 * {@link uibridge.command.FailurePolicy#FATAL}.
 *
 * <p>A live session is expected to accept these calls, so the failure indicates a broken
 * session rather than a recoverable condition. It terminates only the execution task that
 * raised it; dispatcher loops keep running.
 */
public class CommandExecutionException extends RuntimeException {
  private final CommandKind kind;

  public CommandExecutionException(CommandKind kind, Throwable cause) {
    super(Objects.requireNonNull(kind, "kind") + " failed", cause);
    this.kind = kind;
  }

  public CommandKind kind() {
    return kind;
  }
}
