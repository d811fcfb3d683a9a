package trialdb.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable string key/value configuration bundle.
 *
 * <p>Built from a map, from the process environment, or by layering one bundle over
 * another. Values that are {@code null} are dropped.
 *
 * <pre>{@code
 * Settings settings = Settings.of(Map.of("DATABASE_POOL_SIZE", "20"))
 *     .overriddenBy(Settings.fromEnvironment());
 * }</pre>
 */
public final class Settings {
  /** Key of the deployment mode flag. */
  public static final String MODE = "mode";
  /** Mode value that selects non-production behavior. */
  public static final String DEBUG_MODE = "debug";

  private static final Settings EMPTY = new Settings(Map.of());

  private final Map<String, String> values;

  private Settings(Map<String, String> values) {
    this.values = values;
  }

  public static Settings empty() {
    return EMPTY;
  }

  public static Settings of(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    Map<String, String> copy = new LinkedHashMap<>();
    values.forEach((k, v) -> {
      if (k != null && v != null) {
        copy.put(k, v);
      }
    });
    return new Settings(Collections.unmodifiableMap(copy));
  }

  public static Settings fromEnvironment() {
    return of(System.getenv());
  }

  /**
   * Returns a new bundle where every key present in {@code overrides} replaces the value
   * in this one.
   */
  public Settings overriddenBy(Settings overrides) {
    Objects.requireNonNull(overrides, "overrides");
    Map<String, String> merged = new LinkedHashMap<>(values);
    merged.putAll(overrides.values);
    return new Settings(Collections.unmodifiableMap(merged));
  }

  /**
   * Returns a copy with one key set.
   */
  public Settings with(String key, String value) {
    Map<String, String> merged = new LinkedHashMap<>(values);
    merged.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
    return new Settings(Collections.unmodifiableMap(merged));
  }

  public Optional<String> get(String key) {
    return Optional.ofNullable(values.get(key));
  }

  public String get(String key, String defaultValue) {
    return values.getOrDefault(key, defaultValue);
  }

  public int getInt(String key, int defaultValue) {
    String raw = values.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Setting " + key + " is not an integer: " + raw, e);
    }
  }

  public long getLong(String key, long defaultValue) {
    String raw = values.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Setting " + key + " is not an integer: " + raw, e);
    }
  }

  public boolean contains(String key) {
    return values.containsKey(key);
  }

  /**
   * Returns {@code true} if the {@value #MODE} flag is set to {@value #DEBUG_MODE}.
   */
  public boolean isDebug() {
    return DEBUG_MODE.equals(values.get(MODE));
  }

  public Map<String, String> asMap() {
    return values;
  }

  @Override
  public String toString() {
    return "Settings" + values.keySet();
  }
}
