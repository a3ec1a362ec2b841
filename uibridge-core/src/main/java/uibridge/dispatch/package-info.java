/**
 * Command routing and the two delivery paths.
 *
 * <p>{@link uibridge.dispatch.CommandRouter} classifies inbound commands onto two
 * {@linkplain uibridge.dispatch.CommandChannel channels}. The
 * {@link uibridge.dispatch.CoalescingDispatcher} collapses bursts of droppable commands to
 * the latest one and hands it off without waiting; the
 * {@link uibridge.dispatch.SequentialDispatcher} executes guaranteed commands strictly one
 * at a time in arrival order. A {@link uibridge.dispatch.ShutdownSignal} coordinates
 * shutdown.
 *
 * @see uibridge.CommandPipeline
 */
package uibridge.dispatch;
