package uibridge.command;

/**
 * Quality-of-service class a command is delivered with.
 *
 * @see CommandClassifier
 */
public enum DeliveryClass {
  /** Only the latest command of a burst matters; earlier ones may be discarded. */
  DROPPABLE,
  /** Executed exactly once, in submission order. */
  GUARANTEED
}
