/**
 * Command-line adapter: argument parsing, configuration resolution, and the batch summary printed by
 * {@link io.tessera.conv.api.ConvertCli}.
 */
package io.tessera.conv.api;
