package io.tessera.conv.api;

import io.tessera.conv.validation.Strings;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Parsed command line of the {@code convert} command.
 * <p><strong>Why:</strong> Separates the two inputs the CLI resolves itself ({@code manifest}, {@code config})
 * from the {@code key=value} overrides handed to the configuration merger.</p>
 * <p><strong>Grammar:</strong> an optional leading {@code convert} word, then any mix of {@code key=value}
 * pairs and flags. Keys are case-sensitive; flags are not. Later duplicate keys win.</p>
 *
 * @param manifest session manifest, if given
 * @param config explicit configuration file, if given
 * @param overrides remaining {@code key=value} pairs in command-line order
 * @param dryRun {@code --dry-run}: resolve and print the plan only
 * @param verbose {@code --verbose}: DEBUG logging
 * @param help {@code --help}: print usage and exit
 * @since 0.1.0
 */
public record ConvertArguments(
    Optional<Path> manifest,
    Optional<Path> config,
    Map<String, String> overrides,
    boolean dryRun,
    boolean verbose,
    boolean help) {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");
  private static final Set<String> DRY_RUN_FLAGS = Set.of("--dry-run", "-n");
  private static final String COMMAND_WORD = "convert";

  public ConvertArguments {
    manifest = manifest == null ? Optional.empty() : manifest;
    config = config == null ? Optional.empty() : config;
    overrides = overrides == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(overrides));
  }

  /**
   * Parses raw arguments. When a help flag is present the remaining arguments are not validated.
   *
   * @param args raw CLI arguments; {@code null} or blank entries are ignored
   * @return parsed arguments
   * @throws IllegalArgumentException on an unknown flag, an argument that is not {@code key=value}, an invalid
   *     key, or a value with control characters
   */
  public static ConvertArguments parse(String[] args) {
    if (args == null || args.length == 0) {
      return new ConvertArguments(Optional.empty(), Optional.empty(), Map.of(), false, false, false);
    }
    Map<String, String> pairs = new LinkedHashMap<>();
    boolean dryRun = false;
    boolean verbose = false;
    IllegalArgumentException deferred = null;
    boolean first = true;
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      String lower = arg.toLowerCase(Locale.ROOT);
      if (first) {
        first = false;
        if (lower.equals(COMMAND_WORD)) {
          continue;
        }
      }
      if (HELP_FLAGS.contains(lower)) {
        return new ConvertArguments(Optional.empty(), Optional.empty(), Map.of(), false, verbose, true);
      }
      if (VERBOSE_FLAGS.contains(lower)) {
        verbose = true;
      } else if (DRY_RUN_FLAGS.contains(lower)) {
        dryRun = true;
      } else if (deferred == null) {
        try {
          if (arg.startsWith("-") && arg.indexOf('=') < 0) {
            throw new IllegalArgumentException("unknown flag: " + arg);
          }
          putPair(pairs, raw, arg);
        } catch (IllegalArgumentException ex) {
          // a later --help still wins
          deferred = ex;
        }
      }
    }
    if (deferred != null) {
      throw deferred;
    }
    Optional<Path> manifest = Optional.ofNullable(pairs.remove("manifest")).map(Path::of);
    Optional<Path> config = Optional.ofNullable(pairs.remove("config")).map(Path::of);
    return new ConvertArguments(manifest, config, pairs, dryRun, verbose, false);
  }

  private static void putPair(Map<String, String> pairs, String raw, String arg) {
    int idx = arg.indexOf('=');
    if (idx <= 0 || idx == arg.length() - 1) {
      throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
    }
    String key = arg.substring(0, idx).trim();
    if (!KEY_PATTERN.matcher(key).matches()) {
      throw new IllegalArgumentException("invalid argument name: " + key);
    }
    pairs.put(key, Strings.requireNonBlank(key, arg.substring(idx + 1)));
  }
}
