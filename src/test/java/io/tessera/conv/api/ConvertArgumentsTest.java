package io.tessera.conv.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConvertArgumentsTest {

  @Test
  void separatesInputsOverridesAndFlags() {
    ConvertArguments args = ConvertArguments.parse(new String[] {
        "convert", "manifest=sessions.yaml", "--DRY-RUN", " output.root = /tmp/out ", "-v",
        "config=conf/tessera.yaml", "batch.parallelism=4"});

    assertEquals(Optional.of(Path.of("sessions.yaml")), args.manifest());
    assertEquals(Optional.of(Path.of("conf/tessera.yaml")), args.config());
    assertEquals(List.of("output.root", "batch.parallelism"), List.copyOf(args.overrides().keySet()));
    assertEquals("/tmp/out", args.overrides().get("output.root"));
    assertTrue(args.dryRun());
    assertTrue(args.verbose());
    assertFalse(args.help());
  }

  @Test
  void valueMayContainEqualsAndLaterDuplicateWins() {
    ConvertArguments args = ConvertArguments.parse(new String[] {
        "metrics.endpoint=http://h:4317/?a=b", "chunk_size_mb=8", "chunk_size_mb=16"});

    assertEquals("http://h:4317/?a=b", args.overrides().get("metrics.endpoint"));
    assertEquals("16", args.overrides().get("chunk_size_mb"));
    assertTrue(args.manifest().isEmpty());
  }

  @Test
  void emptyAndBlankArgumentsYieldNothing() {
    ConvertArguments args = ConvertArguments.parse(new String[] {null, "  "});

    assertTrue(args.overrides().isEmpty());
    assertFalse(ConvertArguments.parse(null).help());
  }

  @Test
  void commandWordOnlySkippedInFirstPosition() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ConvertArguments.parse(new String[] {"manifest=m.yaml", "convert"}));
    assertTrue(ex.getMessage().contains("argument must be key=value"));
  }

  @Test
  void helpWinsOverMalformedArguments() {
    assertTrue(ConvertArguments.parse(new String[] {"-h"}).help());
    assertTrue(ConvertArguments.parse(new String[] {"convert", "help"}).help());
    assertTrue(ConvertArguments.parse(new String[] {"manifest=", "--help"}).help());
  }

  @Test
  void rejectsMalformedPairsAndUnknownFlags() {
    assertThrows(IllegalArgumentException.class, () -> ConvertArguments.parse(new String[] {"manifest="}));
    assertThrows(IllegalArgumentException.class, () -> ConvertArguments.parse(new String[] {"=value"}));

    IllegalArgumentException flag = assertThrows(IllegalArgumentException.class,
        () -> ConvertArguments.parse(new String[] {"--force"}));
    assertEquals("unknown flag: --force", flag.getMessage());

    IllegalArgumentException badKey = assertThrows(IllegalArgumentException.class,
        () -> ConvertArguments.parse(new String[] {"out root=/tmp"}));
    assertTrue(badKey.getMessage().contains("invalid argument name"));

    IllegalArgumentException control = assertThrows(IllegalArgumentException.class,
        () -> ConvertArguments.parse(new String[] {"output.root=/tmp/a\u0007b"}));
    assertTrue(control.getMessage().contains("control characters"));
  }
}
