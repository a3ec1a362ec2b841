package uibridge.spi;

/**
 * Raised by a {@link RemoteSession} when a call fails or the session returns an error.
 */
public class RemoteSessionException extends Exception {

  public RemoteSessionException(String message) {
    super(message);
  }

  public RemoteSessionException(String message, Throwable cause) {
    super(message, cause);
  }
}
