package io.tessera.conv.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {

  private static final Set<String> OPTIONAL_KEYS = Set.of(
      "alignment.gap_error_threshold_ms",
      "alignment.drift_error_threshold_ms",
      "alignment.reference_stream");
  private static final String STREAM_COMPRESSION_PREFIX = "compression.streams.";

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI > YAML > defaults.
   *
   * @param yaml optional YAML-derived settings
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults
   * @param warn consumer invoked when a CLI key overrides a YAML key or a key is not recognized
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;
    Consumer<String> sink = warn == null ? message -> { } : warn;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      if (yamlCopy.containsKey(key)) {
        sink.accept("CLI overrides YAML for key: " + key);
      }
      if (entry.getValue() != null) {
        merged.put(key, entry.getValue());
      }
    }

    for (String key : merged.keySet()) {
      if (!isKnown(key, defaultsCopy)) {
        sink.accept("Ignoring unknown configuration key: " + key);
      }
    }
    return Map.copyOf(merged);
  }

  /**
   * Merges the layers and builds the validated configuration.
   *
   * @param yaml optional YAML-derived settings
   * @param cli CLI key/value overrides
   * @param warn consumer for override and unknown-key warnings
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static ConversionConfig resolve(
      Optional<Map<String, String>> yaml, Map<String, String> cli, Consumer<String> warn) {
    return ConversionConfig.fromMap(
        buildEffectiveConfig(yaml, cli, ConversionConfig.defaultValues(), warn));
  }

  private static boolean isKnown(String key, Map<String, String> defaults) {
    return defaults.containsKey(key)
        || OPTIONAL_KEYS.contains(key)
        || key.startsWith(STREAM_COMPRESSION_PREFIX);
  }
}
