/**
 * Mapping from each command kind to its remote call, with per-kind failure handling.
 *
 * @see uibridge.execute.CommandExecutor
 */
package uibridge.execute;
