package io.tessera.conv.infrastructure.source;

import io.tessera.conv.application.port.DatasetHandle;
import io.tessera.conv.application.port.SourceStore;
import io.tessera.conv.domain.error.SchemaMismatchException;
import io.tessera.conv.domain.error.SourceUnavailableException;
import io.tessera.conv.domain.source.DatasetDescriptor;
import io.tessera.conv.infrastructure.json.JsonSupport;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * <strong>What:</strong> Source store over a directory layout.
 * <p><strong>Format:</strong> dataset {@code a/b} is described by {@code a/b.json} and stored either in
 * {@code a/b.bin} or in numbered segments {@code a/b.0.bin}, {@code a/b.1.bin}, ... whose concatenation
 * forms the dataset.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the root path; each handle owns its channels.</p>
 *
 * @since 0.1.0
 */
public final class DirectorySourceStore implements SourceStore {
  private final Path root;

  private DirectorySourceStore(Path root) {
    this.root = root;
  }

  /**
   * Opens a directory store.
   *
   * @param root container directory
   * @return store
   * @throws SourceUnavailableException if the directory does not exist
   */
  public static DirectorySourceStore open(Path root) throws SourceUnavailableException {
    if (!Files.isDirectory(root)) {
      throw new SourceUnavailableException(null, "source directory not found: " + root);
    }
    return new DirectorySourceStore(root);
  }

  @Override
  public Path location() {
    return root;
  }

  @Override
  public Set<String> datasetPaths() {
    Set<String> paths = new TreeSet<>();
    try (Stream<Path> files = Files.walk(root)) {
      files.filter(Files::isRegularFile)
          .map(root::relativize)
          .map(p -> p.toString().replace('\\', '/'))
          .filter(name -> name.endsWith(SourceLayout.DESCRIPTOR_SUFFIX))
          .forEach(name -> paths.add(name.substring(0, name.length() - SourceLayout.DESCRIPTOR_SUFFIX.length())));
    } catch (IOException ex) {
      throw new IllegalStateException("cannot list datasets under " + root, ex);
    }
    return paths;
  }

  @Override
  public DatasetHandle open(String datasetPath) throws SourceUnavailableException, SchemaMismatchException {
    String path = datasetPath.startsWith("/") ? datasetPath.substring(1) : datasetPath;
    Path descriptorFile = resolve(path + SourceLayout.DESCRIPTOR_SUFFIX);
    if (!Files.isRegularFile(descriptorFile)) {
      throw new SourceUnavailableException(null, "dataset " + path + " not found in " + root);
    }
    DatasetDescriptor descriptor;
    try {
      descriptor = SourceLayout.parseDescriptor(path, JsonSupport.parseObject(Files.readAllBytes(descriptorFile)));
    } catch (IOException ex) {
      throw new SourceUnavailableException(null, "cannot read " + descriptorFile + ": " + ex.getMessage(), ex);
    } catch (IllegalArgumentException ex) {
      throw new SourceUnavailableException(null, "corrupt descriptor " + descriptorFile + ": " + ex.getMessage(), ex);
    }
    List<Path> parts = dataFiles(path);
    if (parts.isEmpty()) {
      throw new SourceUnavailableException(null, "dataset " + path + " has no data file in " + root);
    }
    List<FileChannel> channels = new ArrayList<>(parts.size());
    List<ExtentDatasetHandle.Extent> extents = new ArrayList<>(parts.size());
    long stored = 0;
    try {
      for (Path part : parts) {
        FileChannel channel = FileChannel.open(part, StandardOpenOption.READ);
        channels.add(channel);
        long size = channel.size();
        extents.add(new ExtentDatasetHandle.Extent(channel, 0, size));
        stored += size;
      }
    } catch (IOException ex) {
      SourceUnavailableException failure =
          new SourceUnavailableException(null, "cannot open data of " + path + ": " + ex.getMessage(), ex);
      closeAll(channels, failure);
      throw failure;
    }
    if (stored < descriptor.byteLength()) {
      SourceUnavailableException failure = new SourceUnavailableException(null,
          "dataset " + path + " is truncated (" + stored + " of " + descriptor.byteLength() + " bytes)");
      closeAll(channels, failure);
      throw failure;
    }
    if (stored > descriptor.byteLength()) {
      SchemaMismatchException failure = new SchemaMismatchException(null,
          "dataset " + path + " stores " + stored + " bytes but its shape requires " + descriptor.byteLength());
      closeAll(channels, failure);
      throw failure;
    }
    return new ExtentDatasetHandle(descriptor, extents, channels);
  }

  @Override
  public void close() {
    // Handles own their channels.
  }

  private List<Path> dataFiles(String path) {
    Path single = resolve(path + SourceLayout.DATA_SUFFIX);
    if (Files.isRegularFile(single)) {
      return List.of(single);
    }
    List<Path> parts = new ArrayList<>();
    for (int i = 0; ; i++) {
      Path part = resolve(path + "." + i + SourceLayout.DATA_SUFFIX);
      if (!Files.isRegularFile(part)) {
        break;
      }
      parts.add(part);
    }
    return parts;
  }

  private Path resolve(String relative) {
    Path resolved = root.resolve(relative).normalize();
    if (!resolved.startsWith(root.normalize())) {
      throw new IllegalArgumentException("dataset path escapes source root: " + relative);
    }
    return resolved;
  }

  private static void closeAll(List<FileChannel> channels, Exception primary) {
    for (FileChannel channel : channels) {
      try {
        channel.close();
      } catch (IOException closeEx) {
        primary.addSuppressed(closeEx);
      }
    }
  }
}
