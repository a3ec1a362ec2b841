package uibridge.settings;

import uibridge.spi.RemoteSession;
import uibridge.spi.RemoteSessionException;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe registry of settings, populated by explicit calls at startup.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * CursorSettings cursor = new CursorSettings();
 * DefaultSettingsRegistry registry = new DefaultSettingsRegistry();
 * registry.group("cursor")
 *     .variable("animation_length", Double.class, cursor::animationLength, cursor::setAnimationLength)
 *     .global("cursor_vfx_mode", String.class, cursor::vfxMode, cursor::setVfxMode)
 *     .option("guifont", String.class, cursor::font, cursor::setFont);
 *
 * registry.readInitialValues(session);
 * }</pre>
 *
 * <p>Variables are looked up remotely as {@code <globalPrefix><name>}; options by their
 * own name.
 */
public final class DefaultSettingsRegistry implements SettingsRegistry {
  private static final Logger logger = Logger.getLogger(DefaultSettingsRegistry.class.getName());

  public static final String DEFAULT_GLOBAL_PREFIX = "neovide_";

  private final String globalPrefix;
  private final Map<String, Setting<?>> settings = new ConcurrentSkipListMap<>();

  public DefaultSettingsRegistry() {
    this(DEFAULT_GLOBAL_PREFIX);
  }

  public DefaultSettingsRegistry(String globalPrefix) {
    this.globalPrefix = Objects.requireNonNull(globalPrefix, "globalPrefix");
  }

  public String globalPrefix() {
    return globalPrefix;
  }

  /**
   * Registers a setting.
   *
   * @param name remote name, without the global prefix
   * @param kind variable or option
   * @param type value type: {@code Boolean}, {@code Integer}, {@code Long}, {@code Float},
   *     {@code Double} or {@code String}
   * @param getter reads the current value
   * @param setter applies a new value
   * @return this registry for chaining
   * @throws IllegalStateException if the name is already registered
   */
  public <T> DefaultSettingsRegistry register(String name, SettingKind kind, Class<T> type,
      Supplier<T> getter, Consumer<T> setter) {
    Setting<T> setting = new Setting<>(name, kind, type, getter, setter);
    if (settings.putIfAbsent(name, setting) != null) {
      throw new IllegalStateException("Setting already registered: " + name);
    }
    return this;
  }

  /**
   * Starts a group whose variables are named {@code <prefix>_<field>}.
   *
   * @param prefix group prefix, empty for none
   */
  public SettingGroup group(String prefix) {
    return new SettingGroup(this, prefix);
  }

  @Override
  public Set<String> names() {
    return Collections.unmodifiableSet(settings.keySet());
  }

  @Override
  public SettingKind kindOf(String name) {
    Setting<?> setting = settings.get(name);
    return setting == null ? null : setting.kind();
  }

  @Override
  public boolean update(String name, Object value) {
    Setting<?> setting = settings.get(name);
    if (setting == null) {
      logger.warning("Received value for unknown setting: " + name);
      return false;
    }
    try {
      setting.apply(value);
      return true;
    } catch (IllegalArgumentException e) {
      logger.warning(name + ": " + e.getMessage());
      return false;
    }
  }

  @Override
  public Object read(String name) {
    Setting<?> setting = settings.get(name);
    return setting == null ? null : setting.getter().get();
  }

  @Override
  public void readInitialValues(RemoteSession session) {
    Objects.requireNonNull(session, "session");
    for (Setting<?> setting : settings.values()) {
      Object value;
      try {
        value = setting.kind() == SettingKind.OPTION
            ? session.getOption(setting.name())
            : session.getVariable(globalPrefix + setting.name());
      } catch (RemoteSessionException e) {
        logger.log(Level.FINE, "Setting " + setting.name() + " not defined remotely; keeping default", e);
        continue;
      }
      update(setting.name(), value);
    }
  }

  private record Setting<T>(String name, SettingKind kind, Class<T> type,
      Supplier<T> getter, Consumer<T> setter) {

    Setting {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(kind, "kind");
      Objects.requireNonNull(type, "type");
      Objects.requireNonNull(getter, "getter");
      Objects.requireNonNull(setter, "setter");
      if (name.isEmpty()) {
        throw new IllegalArgumentException("name must not be empty");
      }
    }

    void apply(Object value) {
      setter.accept(SettingValues.convert(value, type));
    }
  }
}
