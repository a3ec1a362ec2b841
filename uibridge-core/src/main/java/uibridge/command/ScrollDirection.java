package uibridge.command;

/** Wheel direction reported by a {@link UiCommand.Scroll} command. */
public enum ScrollDirection {
  UP("up"),
  DOWN("down"),
  LEFT("left"),
  RIGHT("right");

  private final String wireName;

  ScrollDirection(String wireName) {
    this.wireName = wireName;
  }

  /** Name passed verbatim to the remote session. */
  public String wireName() {
    return wireName;
  }
}
