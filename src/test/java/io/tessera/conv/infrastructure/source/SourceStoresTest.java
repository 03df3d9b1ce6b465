package io.tessera.conv.infrastructure.source;

import static io.tessera.conv.testutil.SourceFixtures.dataset;
import static io.tessera.conv.testutil.SourceFixtures.ramp;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.tessera.conv.application.port.DatasetHandle;
import io.tessera.conv.application.port.SourceStore;
import io.tessera.conv.domain.error.SchemaMismatchException;
import io.tessera.conv.domain.error.SourceUnavailableException;
import io.tessera.conv.domain.source.DataType;
import io.tessera.conv.testutil.SourceFixtures;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SourceStoresTest {
  @TempDir Path tempDir;

  private final SourceStores stores = new SourceStores();

  @Test
  void directoryLayoutListsAndReadsDatasets() throws Exception {
    Path root = SourceFixtures.writeDirectory(tempDir.resolve("dir"), List.of(
        dataset("ecog/samples", DataType.INT16, 2, ramp(4, 2)),
        dataset("task/times", DataType.FLOAT64, 1, new double[] {0.1, 0.2})));

    try (SourceStore store = stores.open(root)) {
      assertInstanceOf(DirectorySourceStore.class, store);
      assertEquals(List.of("ecog/samples", "task/times"), List.copyOf(store.datasetPaths()));
      try (DatasetHandle handle = store.open("/ecog/samples")) {
        assertEquals(4, handle.descriptor().rows());
        assertEquals(2, handle.descriptor().channels());
        ByteBuffer buffer = ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN);
        handle.read(2L * handle.descriptor().rowBytes(), buffer);
        buffer.flip();
        assertEquals(20, buffer.getShort());
        assertEquals(21, buffer.getShort());
      }
    }
  }

  @Test
  void directoryLayoutConcatenatesNumberedSegments() throws Exception {
    Path root = Files.createDirectories(tempDir.resolve("segmented"));
    Files.writeString(root.resolve("lfp.json"), "{\"dtype\":\"int32\",\"channels\":1,\"rows\":3}");
    ByteBuffer first = ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN).putInt(7).putInt(8);
    ByteBuffer second = ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN).putInt(9);
    Files.write(root.resolve("lfp.0.bin"), first.array());
    Files.write(root.resolve("lfp.1.bin"), second.array());

    try (SourceStore store = stores.open(root); DatasetHandle handle = store.open("lfp")) {
      ByteBuffer all = ByteBuffer.allocate(12).order(ByteOrder.LITTLE_ENDIAN);
      handle.read(0, all);
      all.flip();
      assertEquals(7, all.getInt());
      assertEquals(8, all.getInt());
      assertEquals(9, all.getInt());
    }
  }

  @Test
  void packedLayoutReadsSameContent() throws Exception {
    Path file = SourceFixtures.writePacked(tempDir.resolve("session.tsrc"), List.of(
        dataset("cursor/position", DataType.FLOAT32, 2, ramp(3, 2)),
        dataset("task/codes", DataType.FLOAT64, 1, new double[] {5, 6})));

    try (SourceStore store = stores.open(file)) {
      assertInstanceOf(PackedSourceStore.class, store);
      assertTrue(store.datasetPaths().contains("task/codes"));
      try (DatasetHandle handle = store.open("task/codes")) {
        ByteBuffer buffer = ByteBuffer.allocate(16).order(ByteOrder.LITTLE_ENDIAN);
        handle.read(0, buffer);
        buffer.flip();
        assertArrayEquals(new double[] {5, 6}, new double[] {buffer.getDouble(), buffer.getDouble()});
      }
    }
  }

  @Test
  void missingLocationIsUnavailable() {
    assertThrows(SourceUnavailableException.class, () -> stores.open(tempDir.resolve("absent")));
  }

  @Test
  void unknownDatasetIsUnavailable() throws Exception {
    Path root = SourceFixtures.writeDirectory(tempDir.resolve("dir"), List.of(
        dataset("a", DataType.INT16, 1, ramp(2, 1))));
    try (SourceStore store = stores.open(root)) {
      assertThrows(SourceUnavailableException.class, () -> store.open("b"));
    }
  }

  @Test
  void truncatedPayloadIsUnavailableAndOversizedIsSchemaMismatch() throws Exception {
    Path root = SourceFixtures.writeDirectory(tempDir.resolve("dir"), List.of(
        dataset("short", DataType.INT16, 1, ramp(4, 1)),
        dataset("long", DataType.INT16, 1, ramp(4, 1))));
    Files.writeString(root.resolve("short.json"), "{\"dtype\":\"int16\",\"channels\":1,\"rows\":8}");
    Files.writeString(root.resolve("long.json"), "{\"dtype\":\"int16\",\"channels\":1,\"rows\":2}");

    try (SourceStore store = stores.open(root)) {
      assertThrows(SourceUnavailableException.class, () -> store.open("short"));
      assertThrows(SchemaMismatchException.class, () -> store.open("long"));
    }
  }

  @Test
  void fileWithoutMagicIsRejected() throws Exception {
    Path file = tempDir.resolve("garbage.tsrc");
    Files.write(file, "not a container at all".getBytes(StandardCharsets.UTF_8));
    SourceUnavailableException ex = assertThrows(SourceUnavailableException.class, () -> stores.open(file));
    assertTrue(ex.getMessage().contains("not a packed source container"));
  }

  @Test
  void truncatedPackedExtentIsUnavailable() throws Exception {
    Path file = SourceFixtures.writePacked(tempDir.resolve("cut.tsrc"), List.of(
        dataset("ecog", DataType.INT16, 1, ramp(100, 1))));
    byte[] bytes = Files.readAllBytes(file);
    Files.write(file, Arrays.copyOf(bytes, bytes.length - 10));

    try (SourceStore store = stores.open(file)) {
      assertThrows(SourceUnavailableException.class, () -> store.open("ecog"));
    }
  }
}
