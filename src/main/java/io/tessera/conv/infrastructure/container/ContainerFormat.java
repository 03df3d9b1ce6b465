package io.tessera.conv.infrastructure.container;

import io.tessera.conv.domain.session.SessionId;
import java.nio.file.Path;

/**
 * Layout constants of the target container ({@code .tsc}).
 *
 * <pre>
 * header (32 bytes, big-endian):
 *   magic "TSC1" | u16 version | u8 state | u8 reserved | i64 metadata offset | i64 metadata length | 8 reserved
 * frames, back to back:
 *   u8 kind | i32 header length | UTF-8 JSON header | payload ("stored_length" bytes, block frames only)
 * </pre>
 *
 * <p>Block frames ({@code B}) carry one compressed block of one dataset; the metadata frame ({@code M}) is
 * written last by finalize and holds the {@code general} section and the full catalog.</p>
 *
 * @since 0.1.0
 */
public final class ContainerFormat {
  public static final byte[] MAGIC = {'T', 'S', 'C', '1'};
  public static final int VERSION = 1;
  public static final int HEADER_BYTES = 32;
  public static final int STATE_POSITION = 6;
  public static final int METADATA_POSITION = 8;
  public static final byte FRAME_BLOCK = 'B';
  public static final byte FRAME_METADATA = 'M';
  public static final int MAX_FRAME_HEADER_BYTES = 1 << 20;
  public static final String EXTENSION = ".tsc";

  public static final String SECTION_ACQUISITION = "acquisition";
  public static final String SECTION_PROCESSING = "processing";
  public static final String SECTION_GENERAL = "general";

  public static final String DATASET_DATA = "data";
  public static final String DATASET_TIMESTAMPS = "timestamps";
  public static final String DATASET_VALID = "valid";

  /** Element type name of validity flags: one byte per sample, {@code 1} valid, {@code 0} invalid. */
  public static final String BOOL8 = "bool8";

  private ContainerFormat() {
    // Constants
  }

  /**
   * Resolves the container path of a session.
   *
   * @param root output root
   * @param id session identity
   * @return {@code <root>/<session-id>.tsc}
   */
  public static Path containerPath(Path root, SessionId id) {
    return root.resolve(id + EXTENSION);
  }

  static String acquisitionPath(String stream) {
    return SECTION_ACQUISITION + '/' + stream + '/' + DATASET_DATA;
  }

  static String processingPath(String modalitySection, String stream, String dataset) {
    return SECTION_PROCESSING + '/' + modalitySection + '/' + stream + '/' + dataset;
  }
}
