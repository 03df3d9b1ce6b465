package io.tessera.conv.api;

/**
 * <strong>What:</strong> Process exit codes of the conversion command.
 * <p><strong>Why:</strong> Lets batch schedulers tell argument mistakes, configuration errors, failed sessions,
 * and interruption apart without parsing logs.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Every session converted. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** A manifest or configuration file could not be read. */
  IO_ERROR(3),
  /** Configuration or manifest content was missing or malformed. */
  CONFIG_ERROR(4),
  /** At least one session failed, or the run crashed. */
  RUNTIME_FAILURE(5),
  /** The batch was cancelled by a signal. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value handed to the operating system.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
