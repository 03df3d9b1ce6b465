package io.tessera.conv.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigLocatorTest {

  @TempDir Path tempDir;
  private Path work;
  private Path home;

  @BeforeEach
  void setUp() throws IOException {
    work = Files.createDirectories(tempDir.resolve("work"));
    home = Files.createDirectories(tempDir.resolve("home"));
  }

  @Test
  void explicitPathWins() throws IOException {
    Path explicit = write(tempDir.resolve("explicit.yaml"));
    write(work.resolve(ConfigLocator.FILE_NAME));

    Optional<Path> located = locator(Map.of()).locate(Optional.of(explicit));

    assertEquals(Optional.of(explicit), located);
  }

  @Test
  void missingExplicitPathFails() {
    NoSuchFileException ex = assertThrows(NoSuchFileException.class,
        () -> locator(Map.of()).locate(Optional.of(tempDir.resolve("nope.yaml"))));
    assertTrue(ex.getMessage().contains("Config file not found"));
  }

  @Test
  void environmentVariableIsConsultedBeforeDefaults() throws IOException {
    Path fromEnv = write(tempDir.resolve("env.yaml"));
    write(work.resolve(ConfigLocator.FILE_NAME));

    Optional<Path> located = locator(Map.of(ConfigLocator.ENV_VARIABLE, fromEnv.toString())).locate(Optional.empty());

    assertEquals(Optional.of(fromEnv), located);
  }

  @Test
  void environmentVariableNamingMissingFileFails() {
    Map<String, String> env = Map.of(ConfigLocator.ENV_VARIABLE, tempDir.resolve("gone.yaml").toString());
    NoSuchFileException ex = assertThrows(NoSuchFileException.class, () -> locator(env).locate(Optional.empty()));
    assertTrue(ex.getMessage().contains(ConfigLocator.ENV_VARIABLE));
  }

  @Test
  void defaultCandidatesAreSearchedInOrder() throws IOException {
    Path inHome = write(home.resolve(".tessera").resolve(ConfigLocator.FILE_NAME));
    assertEquals(Optional.of(inHome), locator(Map.of()).locate(Optional.empty()));

    Path inConfigDir = write(work.resolve("config").resolve(ConfigLocator.FILE_NAME));
    assertEquals(Optional.of(inConfigDir), locator(Map.of()).locate(Optional.empty()));

    Path inWork = write(work.resolve(ConfigLocator.FILE_NAME));
    assertEquals(Optional.of(inWork), locator(Map.of()).locate(Optional.empty()));
  }

  @Test
  void noConfigurationIsFine() throws IOException {
    assertEquals(Optional.empty(), locator(Map.of()).locate(Optional.empty()));
  }

  private ConfigLocator locator(Map<String, String> env) {
    return new ConfigLocator(env::get, work, home);
  }

  private static Path write(Path file) throws IOException {
    Files.createDirectories(file.getParent());
    Files.writeString(file, "batch:\n  parallelism: 2\n");
    return file;
  }
}
