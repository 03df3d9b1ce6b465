package io.tessera.conv.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.tessera.conv.application.port.MetricsPort;
import io.tessera.conv.application.port.TargetWriterFactory;
import io.tessera.conv.config.ConversionConfig;
import io.tessera.conv.domain.container.ContainerState;
import io.tessera.conv.domain.conversion.BatchReport;
import io.tessera.conv.domain.conversion.ConversionResult;
import io.tessera.conv.domain.conversion.ConversionStatus;
import io.tessera.conv.domain.conversion.FailureDetail;
import io.tessera.conv.domain.conversion.FailureKind;
import io.tessera.conv.domain.conversion.PipelineState;
import io.tessera.conv.domain.session.SessionDescriptor;
import io.tessera.conv.domain.session.SessionId;
import io.tessera.conv.infrastructure.container.ContainerFileReader;
import io.tessera.conv.infrastructure.container.ContainerFileWriterFactory;
import io.tessera.conv.infrastructure.source.SourceStores;
import io.tessera.conv.testutil.SourceFixtures;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BatchOrchestratorTest {
  @TempDir
  Path tempDir;

  private final CountingMetrics metrics = new CountingMetrics();

  @Test
  void failedSessionDoesNotAffectOthersWhenSkippingErrors() throws Exception {
    List<SessionDescriptor> sessions = sessions(5, 2);
    BatchOrchestrator orchestrator = new BatchOrchestrator(context("2", "true"));

    BatchReport report = orchestrator.run(sessions);

    assertEquals(5, report.results().size());
    assertEquals(4, report.successCount());
    assertEquals(1, report.failedCount());
    assertEquals(0, report.skippedCount());
    assertFalse(report.cancelled());
    for (int i = 0; i < sessions.size(); i++) {
      ConversionResult result = report.results().get(i);
      assertEquals(sessions.get(i).id(), result.sessionId());
      if (i == 2) {
        assertEquals(ConversionStatus.FAILED, result.status());
        assertEquals(FailureKind.SOURCE_UNAVAILABLE, result.failure().orElseThrow().kind());
        assertEquals(PipelineState.READING, result.failure().orElseThrow().failedState());
        assertTrue(result.output().isEmpty());
      } else {
        assertEquals(ConversionStatus.SUCCESS, result.status());
        assertEquals(Optional.of(ContainerState.COMPLETE),
            ContainerFileReader.readState(result.output().orElseThrow()));
      }
    }
    assertEquals(4L, metrics.count("convert.session.success"));
    assertEquals(1L, metrics.count("convert.session.failed"));

    List<Path> containers;
    try (Stream<Path> files = Files.list(tempDir.resolve("out"))) {
      containers = files.filter(p -> p.toString().endsWith(".tsc")).sorted().toList();
    }
    assertEquals(4, containers.size());
    for (Path container : containers) {
      assertEquals(Optional.of(ContainerState.COMPLETE), ContainerFileReader.readState(container));
    }
  }

  @Test
  void firstFailureStopsSubmissionWithoutSkipErrors() throws Exception {
    List<SessionDescriptor> sessions = sessions(4, 1);
    BatchOrchestrator orchestrator = new BatchOrchestrator(context("1", "false"));

    BatchReport report = orchestrator.run(sessions);

    assertEquals(2, report.results().size());
    assertEquals(ConversionStatus.SUCCESS, report.results().get(0).status());
    assertEquals(ConversionStatus.FAILED, report.results().get(1).status());
    assertEquals(List.of(sessions.get(2).id(), sessions.get(3).id()), report.skipped());
    assertEquals(2L, metrics.count("convert.session.skipped"));
    assertFalse(report.allSucceeded());
  }

  @Test
  void cancelledBatchSkipsEverySession() throws Exception {
    List<SessionDescriptor> sessions = sessions(3, -1);
    BatchOrchestrator orchestrator = new BatchOrchestrator(context("2", "true"));
    orchestrator.cancel("shutdown");

    BatchReport report = orchestrator.run(sessions);

    assertTrue(orchestrator.cancelled());
    assertTrue(report.cancelled());
    assertTrue(report.results().isEmpty());
    List<SessionId> expected = new ArrayList<>();
    for (SessionDescriptor session : sessions) {
      expected.add(session.id());
    }
    assertEquals(expected, report.skipped());
  }

  @Test
  void fatalErrorInOneSessionStillRecordsItsResult() throws Exception {
    List<SessionDescriptor> sessions = sessions(3, -1);
    ConversionConfig config = config("2", "true");
    TargetWriterFactory real = new ContainerFileWriterFactory(config, metrics);
    SessionId doomed = sessions.get(1).id();
    TargetWriterFactory targets = session -> {
      if (session.id().equals(doomed)) {
        throw new AssertionError("writer bootstrap blew up");
      }
      return real.open(session);
    };
    PipelineContext context = PipelineContext.of(config, new SourceStores(), targets, metrics);

    BatchReport report = new BatchOrchestrator(context).run(sessions);

    assertEquals(3, report.results().size());
    assertEquals(2, report.successCount());
    ConversionResult crashed = report.results().get(1);
    assertEquals(doomed, crashed.sessionId());
    assertEquals(ConversionStatus.FAILED, crashed.status());
    FailureDetail failure = crashed.failure().orElseThrow();
    assertEquals(FailureKind.INTERNAL, failure.kind());
    assertTrue(failure.message().contains("writer bootstrap blew up"));
    assertEquals(1L, metrics.count("convert.session.failed"));
  }

  @Test
  void parallelSessionsShareOneBudget() throws Exception {
    List<SessionDescriptor> sessions = sessions(4, -1);
    PipelineContext context = context("4", "false");

    BatchReport report = new BatchOrchestrator(context).run(sessions);

    assertTrue(report.allSucceeded());
    assertEquals(0, context.budget().inUse());
    assertTrue(context.budget().highWaterMark() <= context.budget().capacity());
    assertEquals(4L * (4_000L + 800L + 64L), report.totalBytes());
  }

  private List<SessionDescriptor> sessions(int count, int corruptIndex) throws Exception {
    List<SessionDescriptor> sessions = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      String subject = "m0" + (i + 1);
      SessionDescriptor session = SourceFixtures.healthySession(tempDir.resolve("src"), subject, i);
      if (i == corruptIndex) {
        truncate(tempDir.resolve("src").resolve(subject + "_" + i).resolve("ecog/samples.bin"));
      }
      sessions.add(session);
    }
    return sessions;
  }

  private static void truncate(Path file) throws IOException {
    try (FileChannel channel = FileChannel.open(file, StandardOpenOption.WRITE)) {
      channel.truncate(channel.size() / 2);
    }
  }

  private PipelineContext context(String parallelism, String skipErrors) {
    ConversionConfig config = config(parallelism, skipErrors);
    return PipelineContext.of(config, new SourceStores(), new ContainerFileWriterFactory(config, metrics), metrics);
  }

  private ConversionConfig config(String parallelism, String skipErrors) {
    return ConversionConfig.fromMap(Map.of(
        "output.root", tempDir.resolve("out").toString(),
        "batch.parallelism", parallelism,
        "batch.skip_errors", skipErrors,
        "chunk_size_mb", "0.001",
        "pipeline.max_in_flight_chunks", "3"));
  }

  private static final class CountingMetrics implements MetricsPort {
    private final Map<String, LongAdder> counters = new ConcurrentHashMap<>();

    @Override
    public void increment(String key) {
      counters.computeIfAbsent(key, k -> new LongAdder()).increment();
    }

    @Override
    public void incrementBy(String key, long delta) {
      counters.computeIfAbsent(key, k -> new LongAdder()).add(delta);
    }

    @Override
    public void observe(String key, long value) {
      increment(key + ".observations");
    }

    long count(String key) {
      LongAdder adder = counters.get(key);
      return adder == null ? 0L : adder.sum();
    }
  }
}
