package io.tessera.conv.api;

import io.tessera.conv.application.pipeline.BatchOrchestrator;
import io.tessera.conv.application.pipeline.PipelineContext;
import io.tessera.conv.config.ConfigLocator;
import io.tessera.conv.config.ConfigMerger;
import io.tessera.conv.config.ConversionConfig;
import io.tessera.conv.config.SessionManifestLoader;
import io.tessera.conv.config.YamlConfigLoader;
import io.tessera.conv.domain.conversion.BatchReport;
import io.tessera.conv.domain.session.SessionDescriptor;
import io.tessera.conv.infrastructure.container.ContainerFileWriterFactory;
import io.tessera.conv.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import io.tessera.conv.infrastructure.source.SourceStores;
import io.tessera.conv.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point converting every session of a manifest into target containers.
 *
 * @since 0.1.0
 */
public final class ConvertCli {
  private static final Logger log = LoggerFactory.getLogger(ConvertCli.class);
  private static final long SHUTDOWN_GRACE_SECONDS = 30L;

  private ConvertCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the conversion and returns a normalized exit code without terminating the JVM.
   *
   * @param args raw CLI arguments
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    return run(args, new ConfigLocator(), true);
  }

  static ExitCode run(String[] args, ConfigLocator locator, boolean installShutdownHook) {
    ConvertArguments arguments;
    Map<String, String> kv;
    try {
      arguments = ConvertArguments.parse(args);
      if (arguments.help()) {
        ConsoleReport.help();
        return ExitCode.SUCCESS;
      }
      kv = new LinkedHashMap<>(arguments.overrides());
      TelemetryConfigurator.configureMetrics(kv);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      ConsoleReport.usage();
      return ExitCode.INVALID_ARGS;
    }
    if (arguments.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for convert CLI");
    }
    if (arguments.manifest().isEmpty()) {
      log.error("Missing required argument: manifest");
      ConsoleReport.usage();
      return ExitCode.INVALID_ARGS;
    }

    Optional<Path> configPath;
    ConversionConfig config;
    try {
      configPath = locator.locate(arguments.config());
      Optional<Map<String, String>> yaml = configPath.isPresent()
          ? YamlConfigLoader.load(configPath.get())
          : Optional.empty();
      config = ConfigMerger.resolve(yaml, kv, log::warn);
    } catch (NoSuchFileException ex) {
      log.error("{}: {}", ex.getReason(), ex.getFile());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read configuration", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }
    if (!arguments.verbose()) {
      try {
        LoggingConfigurator.applyRootLevel(config.loggingLevel());
      } catch (IllegalArgumentException ex) {
        log.error("Invalid configuration: {}", ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      }
    }

    List<SessionDescriptor> sessions;
    Path manifest = arguments.manifest().get();
    try {
      sessions = SessionManifestLoader.load(manifest);
    } catch (IOException ex) {
      log.error("Unable to read session manifest {}", manifest, ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid session manifest {}: {}", manifest, ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    if (arguments.dryRun()) {
      ConsoleReport.plan(config, configPath, manifest, sessions);
      return ExitCode.SUCCESS;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      PipelineContext context = PipelineContext.of(
          config, new SourceStores(), new ContainerFileWriterFactory(config, metrics), metrics);
      BatchOrchestrator orchestrator = new BatchOrchestrator(context);
      CountDownLatch finished = new CountDownLatch(1);
      Thread hook = new Thread(() -> {
        orchestrator.cancel("shutdown signal");
        awaitQuietly(finished);
      }, "tessera-shutdown");
      if (installShutdownHook) {
        Runtime.getRuntime().addShutdownHook(hook);
      }
      BatchReport report;
      try {
        report = orchestrator.run(sessions);
      } finally {
        finished.countDown();
        if (installShutdownHook) {
          removeHook(hook);
        }
      }
      metrics.forceFlush();
      ConsoleReport.summary(report);
      if (report.cancelled()) {
        return ExitCode.INTERRUPTED;
      }
      return report.failedCount() > 0 ? ExitCode.RUNTIME_FAILURE : ExitCode.SUCCESS;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in conversion batch", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void awaitQuietly(CountDownLatch finished) {
    try {
      if (!finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
        log.warn("Batch did not stop within {}s of the shutdown signal", SHUTDOWN_GRACE_SECONDS);
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for the batch to stop");
    }
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM is shutting down; shutdown hook stays registered");
    }
  }
}
