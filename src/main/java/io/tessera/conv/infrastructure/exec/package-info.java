/**
 * Executor factories for session and stream worker pools.
 * <p><strong>Role:</strong> Infrastructure utilities configuring named thread pools for the batch orchestrator
 * and the per-session stream tasks.</p>
 * <p><strong>Concurrency:</strong> Pools reject work beyond their bound instead of queueing without limit.</p>
 */
package io.tessera.conv.infrastructure.exec;
