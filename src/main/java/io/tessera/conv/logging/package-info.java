/**
 * <strong>Purpose:</strong> Logging utilities: runtime root level control and scoped MDC tags.
 * <p><strong>Concurrency:</strong> {@link io.tessera.conv.logging.MdcScope} is thread-confined; the MDC is
 * per thread.</p>
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.</p>
 *
 * @since 0.1.0
 */
package io.tessera.conv.logging;
