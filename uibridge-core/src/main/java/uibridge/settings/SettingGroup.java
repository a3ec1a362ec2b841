package uibridge.settings;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Registers related settings under a shared name prefix.
 *
 * @see DefaultSettingsRegistry#group(String)
 */
public final class SettingGroup {
  private final DefaultSettingsRegistry registry;
  private final String prefix;

  SettingGroup(DefaultSettingsRegistry registry, String prefix) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.prefix = Objects.requireNonNull(prefix, "prefix");
  }

  /** Registers a variable named {@code <prefix>_<field>}, or {@code <field>} without a prefix. */
  public <T> SettingGroup variable(String field, Class<T> type, Supplier<T> getter, Consumer<T> setter) {
    String name = prefix.isEmpty() ? field : prefix + "_" + field;
    registry.register(name, SettingKind.VARIABLE, type, getter, setter);
    return this;
  }

  /** Registers a variable under an explicit name, ignoring the group prefix. */
  public <T> SettingGroup global(String name, Class<T> type, Supplier<T> getter, Consumer<T> setter) {
    registry.register(name, SettingKind.VARIABLE, type, getter, setter);
    return this;
  }

  /** Registers an editor option. */
  public <T> SettingGroup option(String name, Class<T> type, Supplier<T> getter, Consumer<T> setter) {
    registry.register(name, SettingKind.OPTION, type, getter, setter);
    return this;
  }
}
