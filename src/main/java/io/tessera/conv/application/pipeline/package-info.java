/**
 * Session pipelines and the batch orchestrator.
 * <p>{@link io.tessera.conv.application.pipeline.ConversionPipeline} converts one session through
 * LOCATING, READING, MAPPING, VALIDATING, WRITING, and FINALIZED; every failure path ends in ABORTED with
 * the target container left incomplete. {@link io.tessera.conv.application.pipeline.BatchOrchestrator} runs
 * sessions on a bounded {@code tessera-session-*} pool; stream tasks inside a session run on
 * {@code tessera-<session>-stream-*} threads while the session thread stays the single target writer.</p>
 * <p>Resident chunks are bounded batch-wide by {@link io.tessera.conv.application.pipeline.ChunkBudget}.</p>
 *
 * @since 0.1.0
 */
package io.tessera.conv.application.pipeline;
