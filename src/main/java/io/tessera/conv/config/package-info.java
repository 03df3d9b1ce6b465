/**
 * Configuration layer: the immutable {@link io.tessera.conv.config.ConversionConfig}, YAML loading, file
 * location, CLI/YAML/default merging, and the session manifest.
 */
package io.tessera.conv.config;
