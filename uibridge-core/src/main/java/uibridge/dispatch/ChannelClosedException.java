package uibridge.dispatch;

/**
 * Thrown when a command is sent to a {@link CommandChannel} whose receiving side is gone.
 */
public class ChannelClosedException extends RuntimeException {

  public ChannelClosedException(String message) {
    super(message);
  }
}
