package com.verlumen.placement.config;

import com.google.common.flogger.FluentLogger;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads optimizer settings from a YAML file of {@code key: value} pairs, such as
 * {@code ga_population_size: 150}.
 *
 * <p>Reading is lenient: unknown keys are ignored and values that are not numbers fall back to
 * their default, both with a warning. Values that parse but fall outside their range are
 * rejected.
 */
public final class SettingsLoader {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final Yaml YAML = new Yaml();

  private SettingsLoader() {}

  public static PlacementSettings load(Path path) {
    try {
      return parse(Files.readString(path, StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to load settings from: " + path, e);
    }
  }

  /**
   * Parses settings YAML on top of {@link PlacementSettings#defaults()}.
   *
   * @throws IllegalArgumentException if the document is not a mapping or a value is out of range
   */
  public static PlacementSettings parse(String yamlContent) {
    Object document;
    try {
      document = YAML.load(yamlContent);
    } catch (YAMLException e) {
      throw new IllegalArgumentException("Malformed settings document", e);
    }
    PlacementSettings settings = PlacementSettings.defaults();
    if (document == null) {
      return settings;
    }
    if (!(document instanceof Map)) {
      throw new IllegalArgumentException("Settings document must be a mapping of keys to values");
    }

    for (Map.Entry<?, ?> entry : ((Map<?, ?>) document).entrySet()) {
      String name = String.valueOf(entry.getKey());
      Optional<SettingKey> key = SettingKey.fromKey(name);
      if (key.isEmpty()) {
        logger.atWarning().log("Ignoring unknown setting: %s", name);
        continue;
      }
      String raw = String.valueOf(entry.getValue());
      double value;
      try {
        value = key.get().parse(raw);
      } catch (NumberFormatException e) {
        logger.atWarning().log(
            "Invalid value for %s: %s, using default %s", name, raw, key.get().defaultValue());
        continue;
      }
      settings = settings.with(key.get(), value);
    }
    return settings;
  }
}
