package uibridge.command;

import java.util.Objects;

/**
 * Maps a command to the delivery class it is routed with.
 *
 * <p>The mapping is total and stable for the lifetime of the process: {@code RESIZE},
 * {@code SCROLL} and {@code DRAG} are {@linkplain DeliveryClass#DROPPABLE droppable},
 * every other kind is {@linkplain DeliveryClass#GUARANTEED guaranteed}.
 */
public final class CommandClassifier {

  private CommandClassifier() {}

  public static DeliveryClass classify(UiCommand command) {
    Objects.requireNonNull(command, "command");
    return command.kind().deliveryClass();
  }

  public static boolean isDroppable(UiCommand command) {
    return classify(command) == DeliveryClass.DROPPABLE;
  }
}
