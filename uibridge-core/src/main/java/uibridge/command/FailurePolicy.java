package uibridge.command;

/**
 * How a failed remote call is treated for a given {@link CommandKind}.
 */
public enum FailurePolicy {
  /** The execution is aborted with {@link uibridge.execute.CommandExecutionException}. */
  FATAL,
  /** The failure is logged at {@code FINE} and discarded. */
  BEST_EFFORT,
  /** Partial failures are reported as warnings; the execution always completes. */
  LOGGED
}
