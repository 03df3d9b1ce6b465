/**
 * Source store adapters: a directory of {@code .json} descriptors with {@code .bin} payloads, or one packed
 * {@code .tsrc} file holding the same catalog and extents.
 */
package io.tessera.conv.infrastructure.source;
