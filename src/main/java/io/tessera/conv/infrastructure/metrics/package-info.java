/**
 * OpenTelemetry binding of the {@link io.tessera.conv.application.port.MetricsPort}.
 * <p><strong>Role:</strong> Adapter layer; pipelines and writers only see the port.</p>
 */
package io.tessera.conv.infrastructure.metrics;
