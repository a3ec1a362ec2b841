package uibridge.settings;

import uibridge.spi.RemoteSession;

import java.util.Set;

/**
 * Maps remote setting names to typed accessors on front-end state.
 *
 * <p>Settings shape what the front-end produces; they never affect how the command
 * pipeline dispatches.
 *
 * @see DefaultSettingsRegistry
 */
public interface SettingsRegistry {

  /**
   * Returns the names of all registered settings.
   */
  Set<String> names();

  /**
   * Returns the kind of a registered setting, or {@code null} if unknown.
   */
  SettingKind kindOf(String name);

  /**
   * Applies a value received from the remote session.
   *
   * @param name the setting name
   * @param value the decoded remote value
   * @return {@code true} if the value was applied, {@code false} if the name is unknown or
   *     the value could not be converted
   */
  boolean update(String name, Object value);

  /**
   * Reads the current value of a setting, or {@code null} if the name is unknown.
   */
  Object read(String name);

  /**
   * Pulls the current value of every registered setting from the session. Settings the
   * session does not define keep their current value.
   *
   * @param session the remote session
   */
  void readInitialValues(RemoteSession session);
}
