package uibridge.spi;

/**
 * Procedure-call handle on the remote editor session.
 *
 * <p>Every method blocks until the session responds or the call fails. Implementations
 * must be safe for concurrent use: the pipeline invokes the same handle from its loop
 * threads and from every spawned execution, and relies on the implementation to keep
 * its own request/response correlation intact. Connection management, wire encoding and
 * timeouts are the implementation's concern.
 */
public interface RemoteSession {

  /**
   * Executes an ex-command.
   *
   * @param command the command line, without the leading colon
   * @throws RemoteSessionException if the call fails
   */
  void command(String command) throws RemoteSessionException;

  /**
   * Requests a resize of the attached surface.
   *
   * @param width new width in cells
   * @param height new height in cells
   * @throws RemoteSessionException if the call fails
   */
  void tryResize(long width, long height) throws RemoteSessionException;

  /**
   * Queues raw keyboard input.
   *
   * @param keys input in key notation, passed verbatim
   * @throws RemoteSessionException if the call fails
   */
  void input(String keys) throws RemoteSessionException;

  /**
   * Sends a mouse event.
   *
   * @param button {@code left}, {@code right}, {@code middle} or {@code wheel}
   * @param action button action or wheel direction
   * @param modifier modifier string, empty for none
   * @param grid grid id
   * @param row zero-based row
   * @param column zero-based column
   * @throws RemoteSessionException if the call fails
   */
  void inputMouse(String button, String action, String modifier, long grid, long row, long column)
      throws RemoteSessionException;

  /**
   * Writes a line to the session's error channel.
   *
   * @param message the message
   * @throws RemoteSessionException if the call fails
   */
  void errWriteln(String message) throws RemoteSessionException;

  /**
   * Reads a global variable.
   *
   * @param name variable name without the {@code g:} scope
   * @return the decoded value ({@code Long}, {@code Double}, {@code Boolean} or {@code String})
   * @throws RemoteSessionException if the variable does not exist or the call fails
   */
  Object getVariable(String name) throws RemoteSessionException;

  /**
   * Reads an option value.
   *
   * @param name option name
   * @return the decoded value
   * @throws RemoteSessionException if the option does not exist or the call fails
   */
  Object getOption(String name) throws RemoteSessionException;
}
