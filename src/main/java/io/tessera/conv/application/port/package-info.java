/**
 * Ports between the conversion core and its adapters: source stores, target writers, metrics, and clocks.
 * <p><strong>Concurrency:</strong> Each port documents its own contract; source ports are read concurrently,
 * target writers are single-threaded.</p>
 *
 * @since 0.1.0
 */
package io.tessera.conv.application.port;
