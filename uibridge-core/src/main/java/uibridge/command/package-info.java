/**
 * Immutable command model and its delivery classification.
 *
 * <p>{@link uibridge.command.UiCommand} is a closed set of record variants tagged by
 * {@link uibridge.command.CommandKind}. The tag alone determines the
 * {@linkplain uibridge.command.DeliveryClass delivery class} and the
 * {@linkplain uibridge.command.FailurePolicy failure policy} of a command.
 *
 * @see uibridge.command.CommandClassifier
 */
package uibridge.command;
