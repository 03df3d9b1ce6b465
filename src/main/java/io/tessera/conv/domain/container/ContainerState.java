package io.tessera.conv.domain.container;

/**
 * Completeness flag stored in the target container header. Only {@link #COMPLETE} containers are
 * valid; readers refuse the other states.
 *
 * @since 0.1.0
 */
public enum ContainerState {
  PENDING((byte) 'P'),
  COMPLETE((byte) 'C'),
  ABORTED((byte) 'A');

  private final byte code;

  ContainerState(byte code) {
    this.code = code;
  }

  public byte code() {
    return code;
  }

  /**
   * Decodes a header state byte.
   *
   * @param code stored byte
   * @return matching state
   * @throws IllegalArgumentException if the byte is not a known state
   */
  public static ContainerState fromCode(byte code) {
    for (ContainerState state : values()) {
      if (state.code == code) {
        return state;
      }
    }
    throw new IllegalArgumentException("Unknown container state byte: " + code);
  }
}
