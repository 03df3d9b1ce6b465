package io.tessera.conv.infrastructure.container;

import io.tessera.conv.application.port.MetricsPort;
import io.tessera.conv.application.port.TargetWriter;
import io.tessera.conv.application.port.TargetWriterFactory;
import io.tessera.conv.config.ConversionConfig;
import io.tessera.conv.domain.container.ContainerState;
import io.tessera.conv.domain.error.WriteFailureException;
import io.tessera.conv.domain.session.SessionDescriptor;
import io.tessera.conv.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens one {@link ContainerFileWriter} per session under {@code output.root}.
 *
 * <p>An existing complete container is only replaced when {@code output.overwrite} is enabled; pending or
 * aborted leftovers of an interrupted run are always replaced.</p>
 *
 * @since 0.1.0
 */
public final class ContainerFileWriterFactory implements TargetWriterFactory {
  private static final Logger log = LoggerFactory.getLogger(ContainerFileWriterFactory.class);

  private final ConversionConfig config;
  private final MetricsPort metrics;

  public ContainerFileWriterFactory(ConversionConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  @Override
  public TargetWriter open(SessionDescriptor session) throws WriteFailureException {
    Path root;
    try {
      root = Paths.validateWritableDir(config.output().root(), true);
    } catch (IllegalArgumentException ex) {
      throw new WriteFailureException(null, "output root is unusable: " + ex.getMessage(), ex);
    }
    Path target = ContainerFormat.containerPath(root, session.id());
    if (Files.exists(target)) {
      Optional<ContainerState> state;
      try {
        state = ContainerFileReader.readState(target);
      } catch (IOException ex) {
        throw new WriteFailureException(null, "cannot inspect existing output " + target, ex);
      }
      boolean replaceable = state.isPresent() && state.get() != ContainerState.COMPLETE;
      if (!replaceable && !config.output().overwrite()) {
        throw new WriteFailureException(null,
            "output " + target + " already exists; enable output.overwrite to replace it");
      }
      log.info("Replacing existing output {} (state={})", target,
          state.map(ContainerState::name).orElse("unknown"));
    }
    return ContainerFileWriter.create(target, config.compression()::forStream, config.writer(), metrics);
  }
}
