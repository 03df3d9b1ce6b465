package io.tessera.conv.logging;

import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.MDC;

/**
 * Puts MDC keys for the duration of a block and restores the previous values on close, so pooled worker
 * threads never leak a session or stream tag into unrelated work.
 *
 * <pre>{@code
 * try (MdcScope scope = MdcScope.of(MdcScope.SESSION, id.toString())) {
 *   ...
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public final class MdcScope implements AutoCloseable {
  /** MDC key carrying the session id. */
  public static final String SESSION = "session";
  /** MDC key carrying the stream name. */
  public static final String STREAM = "stream";

  private final Map<String, String> previous = new LinkedHashMap<>();

  private MdcScope() {}

  /**
   * Opens a scope with one key.
   *
   * @param key MDC key
   * @param value value to put
   * @return open scope
   */
  public static MdcScope of(String key, String value) {
    return new MdcScope().and(key, value);
  }

  /**
   * Adds another key to this scope.
   *
   * @param key MDC key
   * @param value value to put
   * @return this scope
   */
  public MdcScope and(String key, String value) {
    if (!previous.containsKey(key)) {
      previous.put(key, MDC.get(key));
    }
    MDC.put(key, value);
    return this;
  }

  @Override
  public void close() {
    for (Map.Entry<String, String> entry : previous.entrySet()) {
      if (entry.getValue() == null) {
        MDC.remove(entry.getKey());
      } else {
        MDC.put(entry.getKey(), entry.getValue());
      }
    }
  }
}
