package io.tessera.conv.application.pipeline;

import io.tessera.conv.application.mapping.ModalityMappers;
import io.tessera.conv.application.port.ClockPort;
import io.tessera.conv.application.port.MetricsPort;
import io.tessera.conv.application.port.SourceStoreFactory;
import io.tessera.conv.application.port.TargetWriterFactory;
import io.tessera.conv.config.ConversionConfig;
import java.util.Objects;

/**
 * Collaborators shared by every pipeline of a batch.
 *
 * @param config run configuration
 * @param sources opens source containers
 * @param targets opens one target writer per session
 * @param mappers modality mapper registry
 * @param budget batch-wide chunk budget
 * @param metrics metrics sink
 * @param clock wall clock for container timestamps
 * @since 0.1.0
 */
public record PipelineContext(
    ConversionConfig config,
    SourceStoreFactory sources,
    TargetWriterFactory targets,
    ModalityMappers mappers,
    ChunkBudget budget,
    MetricsPort metrics,
    ClockPort clock) {

  public PipelineContext {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(sources, "sources");
    Objects.requireNonNull(targets, "targets");
    mappers = Objects.requireNonNullElseGet(mappers, ModalityMappers::new);
    budget = Objects.requireNonNullElseGet(budget, () -> new ChunkBudget(config.pipeline().maxInFlightChunks()));
    metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    clock = Objects.requireNonNullElse(clock, ClockPort.SYSTEM);
  }

  /**
   * Creates a context with default mappers, a budget sized from the configuration, and the system clock.
   *
   * @param config run configuration
   * @param sources source store factory
   * @param targets target writer factory
   * @param metrics metrics sink
   * @return context
   */
  public static PipelineContext of(
      ConversionConfig config, SourceStoreFactory sources, TargetWriterFactory targets, MetricsPort metrics) {
    return new PipelineContext(config, sources, targets, null, null, metrics, null);
  }
}
