/**
 * Single-file target container ({@code .tsc}): framed compressed blocks followed by a metadata frame, with a
 * fixed header whose state byte moves from PENDING to COMPLETE only after the metadata is durable.
 *
 * @since 0.1.0
 */
package io.tessera.conv.infrastructure.container;
