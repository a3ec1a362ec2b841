package uibridge.command;

/** Button transition reported by a {@link UiCommand.MouseButton} command. */
public enum MouseAction {
  PRESS("press"),
  RELEASE("release");

  private final String wireName;

  MouseAction(String wireName) {
    this.wireName = wireName;
  }

  /** Name passed verbatim to the remote session. */
  public String wireName() {
    return wireName;
  }
}
