/**
 * <strong>Purpose:</strong> Validation helpers used during CLI parsing, manifest loading, and configuration bootstrap.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No direct metrics or logging; failures surface via {@link IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package io.tessera.conv.validation;
