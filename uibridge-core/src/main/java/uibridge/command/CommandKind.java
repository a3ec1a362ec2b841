package uibridge.command;

/**
 * Tag identifying a {@link UiCommand} variant.
 *
 * <p>Each constant carries the delivery class and failure policy of its variant, so
 * classification depends on the tag alone and never on payload values.
 */
public enum CommandKind {
  QUIT(DeliveryClass.GUARANTEED, FailurePolicy.BEST_EFFORT),
  RESIZE(DeliveryClass.DROPPABLE, FailurePolicy.FATAL),
  KEYBOARD(DeliveryClass.GUARANTEED, FailurePolicy.FATAL),
  MOUSE_BUTTON(DeliveryClass.GUARANTEED, FailurePolicy.FATAL),
  SCROLL(DeliveryClass.DROPPABLE, FailurePolicy.FATAL),
  DRAG(DeliveryClass.DROPPABLE, FailurePolicy.FATAL),
  FILE_DROP(DeliveryClass.GUARANTEED, FailurePolicy.BEST_EFFORT),
  FOCUS_LOST(DeliveryClass.GUARANTEED, FailurePolicy.FATAL),
  FOCUS_GAINED(DeliveryClass.GUARANTEED, FailurePolicy.FATAL),
  REGISTER_SHELL_INTEGRATION(DeliveryClass.GUARANTEED, FailurePolicy.LOGGED),
  UNREGISTER_SHELL_INTEGRATION(DeliveryClass.GUARANTEED, FailurePolicy.LOGGED);

  private final DeliveryClass deliveryClass;
  private final FailurePolicy failurePolicy;

  CommandKind(DeliveryClass deliveryClass, FailurePolicy failurePolicy) {
    this.deliveryClass = deliveryClass;
    this.failurePolicy = failurePolicy;
  }

  public DeliveryClass deliveryClass() {
    return deliveryClass;
  }

  public FailurePolicy failurePolicy() {
    return failurePolicy;
  }
}
