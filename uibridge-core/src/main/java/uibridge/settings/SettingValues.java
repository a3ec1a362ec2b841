package uibridge.settings;

import java.util.Objects;

/**
 * Converts decoded remote values to the Java types settings are registered with.
 *
 * <p>Remote integers arrive as {@code Long} and floats as {@code Double}. Booleans may also
 * arrive as integers, where any non-zero value is true.
 */
final class SettingValues {

  private SettingValues() {}

  static <T> T convert(Object value, Class<T> type) {
    Objects.requireNonNull(type, "type");
    if (value == null) {
      throw mismatch(null, type);
    }
    if (type.isInstance(value)) {
      return type.cast(value);
    }
    if (value instanceof Number number) {
      if (type == Integer.class) {
        try {
          return type.cast(Math.toIntExact(number.longValue()));
        } catch (ArithmeticException e) {
          throw mismatch(value, type);
        }
      }
      if (type == Long.class) {
        return type.cast(number.longValue());
      }
      if (type == Double.class) {
        return type.cast(number.doubleValue());
      }
      if (type == Float.class) {
        return type.cast(number.floatValue());
      }
      if (type == Boolean.class && !(number instanceof Double || number instanceof Float)) {
        return type.cast(number.longValue() != 0L);
      }
    }
    throw mismatch(value, type);
  }

  private static IllegalArgumentException mismatch(Object value, Class<?> type) {
    String received = value == null ? "nil" : value.getClass().getSimpleName() + " " + value;
    return new IllegalArgumentException(
        "Setting expected a " + type.getSimpleName() + ", but received " + received);
  }
}
