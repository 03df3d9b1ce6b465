package io.tessera.conv.config;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves which YAML configuration file a run uses.
 *
 * <p>Order: an explicit path, then the {@value #ENV_VARIABLE} environment variable, then
 * {@code ./tessera.yaml}, {@code ./config/tessera.yaml}, and {@code ~/.tessera/tessera.yaml}. An explicit path
 * or environment value that names a missing file is an error; missing default locations are skipped and the
 * built-in defaults apply when none exists.</p>
 *
 * @since 0.1.0
 */
public final class ConfigLocator {
  private static final Logger log = LoggerFactory.getLogger(ConfigLocator.class);

  /** Environment variable naming the configuration file. */
  public static final String ENV_VARIABLE = "TESSERA_CONFIG";
  /** File name searched in the default locations. */
  public static final String FILE_NAME = "tessera.yaml";

  private final Function<String, String> environment;
  private final Path workingDirectory;
  private final Path homeDirectory;

  /** Creates a locator bound to the process environment, working directory, and user home. */
  public ConfigLocator() {
    this(System::getenv, Path.of("").toAbsolutePath(), Path.of(System.getProperty("user.home")));
  }

  /**
   * Creates a locator with explicit lookup sources.
   *
   * @param environment environment variable lookup
   * @param workingDirectory directory searched first among the defaults
   * @param homeDirectory user home directory
   */
  public ConfigLocator(Function<String, String> environment, Path workingDirectory, Path homeDirectory) {
    this.environment = Objects.requireNonNull(environment, "environment");
    this.workingDirectory = Objects.requireNonNull(workingDirectory, "workingDirectory");
    this.homeDirectory = Objects.requireNonNull(homeDirectory, "homeDirectory");
  }

  /**
   * Finds the configuration file to load.
   *
   * @param explicit path given on the command line, if any
   * @return configuration path, or empty when defaults apply
   * @throws NoSuchFileException if an explicit or environment-supplied file does not exist
   */
  public Optional<Path> locate(Optional<Path> explicit) throws NoSuchFileException {
    Objects.requireNonNull(explicit, "explicit");
    if (explicit.isPresent()) {
      return Optional.of(requireExisting(explicit.get(), "Config file not found"));
    }
    String fromEnv = environment.apply(ENV_VARIABLE);
    if (fromEnv != null && !fromEnv.isBlank()) {
      return Optional.of(requireExisting(Path.of(fromEnv.trim()),
          "Config file named by " + ENV_VARIABLE + " not found"));
    }
    for (Path candidate : defaultCandidates()) {
      if (Files.isRegularFile(candidate)) {
        log.debug("Using configuration file {}", candidate);
        return Optional.of(candidate);
      }
    }
    log.debug("No configuration file found; using built-in defaults");
    return Optional.empty();
  }

  /**
   * Lists the default locations in search order.
   *
   * @return candidate paths
   */
  public List<Path> defaultCandidates() {
    return List.of(
        workingDirectory.resolve(FILE_NAME),
        workingDirectory.resolve("config").resolve(FILE_NAME),
        homeDirectory.resolve(".tessera").resolve(FILE_NAME));
  }

  private static Path requireExisting(Path path, String message) throws NoSuchFileException {
    if (!Files.isRegularFile(path)) {
      throw new NoSuchFileException(path.toString(), null, message);
    }
    return path;
  }
}
