/**
 * Explicit registry of remote settings: each name maps to a typed getter/setter pair on
 * front-end state.
 *
 * @see uibridge.settings.DefaultSettingsRegistry
 */
package uibridge.settings;
