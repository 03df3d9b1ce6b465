package io.tessera.conv.application.pipeline;

import io.tessera.conv.application.alignment.StreamBounds;
import io.tessera.conv.application.alignment.StreamTimingTracker;
import io.tessera.conv.application.alignment.TimeAlignmentValidator;
import io.tessera.conv.application.mapping.MappingStats;
import io.tessera.conv.application.mapping.ModalityMapper;
import io.tessera.conv.application.port.MappingListener;
import io.tessera.conv.application.port.TargetWriter;
import io.tessera.conv.application.source.ChunkCursor;
import io.tessera.conv.application.source.SessionSources;
import io.tessera.conv.application.source.SourceReader;
import io.tessera.conv.config.ConversionConfig;
import io.tessera.conv.domain.alignment.AlignmentFinding;
import io.tessera.conv.domain.alignment.AlignmentReport;
import io.tessera.conv.domain.alignment.Severity;
import io.tessera.conv.domain.container.ContainerMetadata;
import io.tessera.conv.domain.conversion.ConversionResult;
import io.tessera.conv.domain.conversion.ConversionStatus;
import io.tessera.conv.domain.conversion.FailureDetail;
import io.tessera.conv.domain.conversion.FailureKind;
import io.tessera.conv.domain.conversion.PipelineState;
import io.tessera.conv.domain.conversion.StreamSummary;
import io.tessera.conv.domain.error.AlignmentException;
import io.tessera.conv.domain.error.ConversionCancelledException;
import io.tessera.conv.domain.error.ConversionException;
import io.tessera.conv.domain.error.InvalidSamplesException;
import io.tessera.conv.domain.error.SourceUnavailableException;
import io.tessera.conv.domain.record.CanonicalRecord;
import io.tessera.conv.domain.session.SessionDescriptor;
import io.tessera.conv.domain.session.StreamDescriptor;
import io.tessera.conv.domain.source.RawChunk;
import io.tessera.conv.infrastructure.exec.ExecutorFactories;
import io.tessera.conv.logging.MdcScope;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Converts one session through
 * {@code INIT → LOCATING → READING → MAPPING → VALIDATING → WRITING → FINALIZED}, or ends in {@code ABORTED}.
 * <p><strong>Why:</strong> Timing is validated over the whole session before anything is written, so an
 * inconsistent session never produces a container that looks usable.</p>
 * <p><strong>Role:</strong> Single-use; the orchestrator creates one per session and calls {@link #run()} on a
 * session worker, which also acts as the session's only writer thread.</p>
 * <p><strong>Concurrency:</strong> Streams run in parallel on a per-session stream pool, each in source order.
 * In the write pass they hand mapped chunks to the session thread through a bounded queue. Every resident chunk
 * holds a {@link ChunkBudget} permit.</p>
 * <p><strong>Observability:</strong> Sets MDC {@code session} and {@code stream}; emits
 * {@code convert.chunk.read}, {@code convert.samples.mapped}, {@code convert.samples.invalid}, and
 * {@code convert.session.wallTimeNanos}.</p>
 *
 * @since 0.1.0
 */
public final class ConversionPipeline {
  private static final Logger log = LoggerFactory.getLogger(ConversionPipeline.class);
  private static final long HANDOFF_POLL_MILLIS = 50L;

  private final SessionDescriptor session;
  private final PipelineContext context;
  private final ConversionConfig config;
  private final CancellationSignal signal;
  private final TimeAlignmentValidator validator;
  private final MappingStats stats = new MappingStats();
  private final List<PipelineState> history = new ArrayList<>();
  private final FirstFailure failures;

  private final AtomicBoolean started = new AtomicBoolean();
  private volatile PipelineState state = PipelineState.INIT;
  private SessionSources sources;
  private TargetWriter writer;
  private ExecutorService streamPool;
  private List<StreamPlan> plans = List.of();
  private List<StreamSummary> summaries = List.of();
  private AlignmentReport report = AlignmentReport.empty();

  /**
   * Creates a pipeline for one session.
   *
   * @param session session to convert
   * @param context shared collaborators
   * @param batchSignal batch-level cancellation; the pipeline derives its own child signal
   */
  public ConversionPipeline(SessionDescriptor session, PipelineContext context, CancellationSignal batchSignal) {
    this.session = Objects.requireNonNull(session, "session");
    this.context = Objects.requireNonNull(context, "context");
    this.config = context.config();
    this.signal = Objects.requireNonNullElseGet(batchSignal, CancellationSignal::root).child();
    this.validator = new TimeAlignmentValidator(config.alignment(), config.mapping().maxRecordedInvalidRuns());
    this.failures = new FirstFailure(signal);
    history.add(PipelineState.INIT);
  }

  public PipelineState state() {
    return state;
  }

  /**
   * Returns every state visited so far, in order.
   *
   * @return state history starting with {@code INIT}
   */
  public synchronized List<PipelineState> history() {
    return List.copyOf(history);
  }

  /**
   * Requests cancellation of this session only.
   *
   * @param reason reason recorded in the failure detail
   */
  public void cancel(String reason) {
    signal.cancel(reason);
  }

  /**
   * Runs the session to a terminal state. Never throws for session-level failures; they are reported in the
   * result.
   *
   * @return session outcome
   * @throws IllegalStateException if the pipeline already ran
   */
  public ConversionResult run() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("pipeline for " + session.id() + " already ran");
    }
    long startNanos = System.nanoTime();
    try (MdcScope mdc = MdcScope.of(MdcScope.SESSION, session.id().toString())) {
      log.info("Converting session {} ({} streams)", session.id(), session.streams().size());
      ConversionException failure = null;
      PipelineState failedState = PipelineState.INIT;
      try {
        execute();
      } catch (ConversionException ex) {
        failure = ex;
        failedState = state;
      } catch (RuntimeException ex) {
        failure = new ConversionException(FailureKind.INTERNAL, null, "unexpected failure: " + ex, ex);
        failedState = state;
      } finally {
        failure = release(failure);
      }
      Duration wallTime = Duration.ofNanos(System.nanoTime() - startNanos);
      context.metrics().observe("convert.session.wallTimeNanos", wallTime.toNanos());
      if (failure == null) {
        return finished(wallTime);
      }
      return aborted(failure, failedState, wallTime);
    }
  }

  private void execute() throws ConversionException {
    transition(PipelineState.LOCATING);
    signal.throwIfCancelled();
    sources = SessionSources.open(session, context.sources());

    transition(PipelineState.READING);
    plans = openStreams();
    AlignmentReport preflight = validator.preflight(probeBounds());
    if (preflight.hasErrors()) {
      report = preflight;
      throw alignmentFailure(preflight, "pre-flight");
    }

    transition(PipelineState.MAPPING);
    streamPool = ExecutorFactories.newStreamPool(
        Math.min(config.pipeline().streamWorkers(), plans.size()),
        "tessera-" + session.id() + "-stream",
        ExecutorFactories.LOGGING_HANDLER);
    runStreams(this::timingPass);
    List<StreamTimingTracker> trackers = new ArrayList<>(plans.size());
    for (StreamPlan plan : plans) {
      trackers.add(plan.tracker);
    }
    report = validator.validate(trackers);
    summaries = summarize();
    checkInvalidFractions();

    transition(PipelineState.VALIDATING);
    if (report.hasErrors()) {
      throw alignmentFailure(report, "validation");
    }

    transition(PipelineState.WRITING);
    writer = context.targets().open(session);
    writePass();
    signal.throwIfCancelled();
    writer.finalizeContainer(new ContainerMetadata(
        session.id(), session.metadata(), summaries, report, Instant.ofEpochMilli(context.clock().nowMillis())));
    transition(PipelineState.FINALIZED);
  }

  private List<StreamPlan> openStreams() throws ConversionException {
    List<StreamPlan> opened = new ArrayList<>(session.streams().size());
    for (StreamDescriptor stream : session.streams()) {
      SourceReader samples = sources.reader(stream);
      Optional<SourceReader> timestamps = sources.timestampsReader(stream);
      ModalityMapper mapper = context.mappers().forStream(stream);
      mapper.checkSchema(stream, samples.descriptor(), timestamps.map(SourceReader::descriptor));
      opened.add(new StreamPlan(stream, mapper, samples, timestamps,
          samples.cursor(config.chunkSizeBytes()), validator.tracker(stream)));
      log.debug("Stream {} opened: {} rows x {} {}", stream.name(), samples.descriptor().rows(),
          samples.descriptor().channels(), samples.descriptor().type());
    }
    return opened;
  }

  private List<StreamBounds> probeBounds() throws SourceUnavailableException {
    List<StreamBounds> bounds = new ArrayList<>(plans.size());
    for (StreamPlan plan : plans) {
      StreamDescriptor stream = plan.stream;
      long rows = plan.samples.descriptor().rows();
      if (rows == 0 || !stream.regular()) {
        continue;
      }
      double first;
      double last;
      if (plan.timestamps.isPresent()) {
        SourceReader ts = plan.timestamps.get();
        first = ts.readRows(0L, 1).value(0, 0);
        last = ts.readRows(rows - 1, 1).value(0, 0);
      } else {
        first = stream.startTimeSeconds();
        last = stream.startTimeSeconds() + (rows - 1) / stream.sampleRateHz();
      }
      if (Double.isFinite(first) && Double.isFinite(last)) {
        bounds.add(new StreamBounds(stream, rows, first, last));
      }
    }
    return bounds;
  }

  private void timingPass(StreamPlan plan) throws ConversionException {
    ChunkCursor cursor = plan.cursor;
    cursor.rewind();
    double preceding = Double.NaN;
    while (true) {
      signal.throwIfCancelled();
      context.budget().acquire(signal);
      try {
        Optional<RawChunk> next = cursor.next();
        if (next.isEmpty()) {
          break;
        }
        RawChunk samples = next.get();
        Optional<RawChunk> times = timestampsFor(plan, samples);
        stats.onChunk(plan.stream.name(), samples.sizeBytes() + times.map(RawChunk::sizeBytes).orElse(0));
        context.metrics().increment("convert.chunk.read");
        CanonicalRecord record = plan.mapper.map(plan.stream, samples, times, preceding, stats);
        preceding = lastTimestamp(record, preceding);
        context.metrics().incrementBy("convert.samples.mapped", record.sampleCount());
        context.metrics().incrementBy("convert.samples.invalid", record.invalidCount());
        plan.tracker.accept(record);
      } finally {
        context.budget().release();
      }
    }
  }

  private void writePass() throws ConversionException {
    BlockingQueue<Handoff> queue = new ArrayBlockingQueue<>(config.pipeline().maxInFlightChunks());
    List<Future<?>> producers = new ArrayList<>(plans.size());
    for (StreamPlan plan : plans) {
      producers.add(streamPool.submit(() -> {
        try (MdcScope mdc = MdcScope.of(MdcScope.SESSION, session.id().toString())
            .and(MdcScope.STREAM, plan.stream.name())) {
          produce(plan, queue);
        } catch (Exception ex) {
          failures.record(ex, plan.stream.name());
        } finally {
          handOffMarker(queue, Handoff.done(plan.stream.name()));
        }
      }));
    }

    int remaining = plans.size();
    boolean interrupted = false;
    while (remaining > 0) {
      Handoff item;
      try {
        item = queue.poll(HANDOFF_POLL_MILLIS, TimeUnit.MILLISECONDS);
      } catch (InterruptedException ex) {
        interrupted = true;
        signal.cancel("interrupted");
        continue;
      }
      if (item == null) {
        continue;
      }
      if (item.done()) {
        remaining--;
        continue;
      }
      try {
        if (!signal.isCancelled()) {
          writer.appendRaw(item.stream(), item.raw());
          writer.append(item.mapped());
        }
      } catch (ConversionException | RuntimeException ex) {
        failures.record(ex, item.stream());
      } finally {
        context.budget().release();
      }
    }
    awaitAll(producers);
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
    failures.throwIfFailed();
  }

  private void produce(StreamPlan plan, BlockingQueue<Handoff> queue) throws ConversionException {
    ChunkCursor cursor = plan.cursor;
    cursor.rewind();
    double preceding = Double.NaN;
    while (true) {
      signal.throwIfCancelled();
      context.budget().acquire(signal);
      boolean handedOff = false;
      try {
        Optional<RawChunk> next = cursor.next();
        if (next.isEmpty()) {
          break;
        }
        RawChunk samples = next.get();
        CanonicalRecord record = plan.mapper.map(
            plan.stream, samples, timestampsFor(plan, samples), preceding, MappingListener.NONE);
        preceding = lastTimestamp(record, preceding);
        Handoff item = Handoff.chunk(plan.stream.name(), samples, record);
        while (!queue.offer(item, HANDOFF_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
          signal.throwIfCancelled();
        }
        handedOff = true;
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        throw new ConversionCancelledException("interrupted while handing off " + plan.stream.name(), ex);
      } finally {
        if (!handedOff) {
          context.budget().release();
        }
      }
    }
  }

  private static double lastTimestamp(CanonicalRecord record, double fallback) {
    return record.sampleCount() == 0 ? fallback : record.lastTimestamp();
  }

  private static void handOffMarker(BlockingQueue<Handoff> queue, Handoff marker) {
    boolean interrupted = false;
    while (true) {
      try {
        queue.put(marker);
        break;
      } catch (InterruptedException ex) {
        interrupted = true;
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  private Optional<RawChunk> timestampsFor(StreamPlan plan, RawChunk samples) throws SourceUnavailableException {
    if (plan.timestamps.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(plan.timestamps.get().readRows(samples.firstRow(), samples.rows()));
  }

  private void runStreams(StreamTask task) throws ConversionException {
    List<Future<?>> futures = new ArrayList<>(plans.size());
    for (StreamPlan plan : plans) {
      Callable<Void> callable = () -> {
        try (MdcScope mdc = MdcScope.of(MdcScope.SESSION, session.id().toString())
            .and(MdcScope.STREAM, plan.stream.name())) {
          task.run(plan);
        } catch (Exception ex) {
          failures.record(ex, plan.stream.name());
        }
        return null;
      };
      futures.add(streamPool.submit(callable));
    }
    awaitAll(futures);
    failures.throwIfFailed();
  }

  private void awaitAll(List<Future<?>> futures) {
    for (Future<?> future : futures) {
      boolean done = false;
      while (!done) {
        try {
          future.get();
          done = true;
        } catch (InterruptedException ex) {
          signal.cancel("interrupted");
          failures.record(new ConversionCancelledException("interrupted while waiting for stream tasks", ex), null);
        } catch (ExecutionException ex) {
          failures.record(ex.getCause(), null);
          done = true;
        }
      }
    }
  }

  private List<StreamSummary> summarize() {
    List<StreamSummary> result = new ArrayList<>(plans.size());
    for (StreamPlan plan : plans) {
      StreamBounds bounds = plan.tracker.bounds();
      double first = bounds.samples() == 0 ? Double.NaN : bounds.firstTimestamp();
      double last = bounds.samples() == 0 ? Double.NaN : bounds.lastTimestamp();
      result.add(stats.summarize(plan.stream, first, last));
    }
    return List.copyOf(result);
  }

  private void checkInvalidFractions() throws InvalidSamplesException {
    double limit = config.mapping().maxInvalidFraction();
    for (StreamPlan plan : plans) {
      double fraction = stats.invalidFraction(plan.stream.name());
      if (fraction > limit) {
        throw new InvalidSamplesException(plan.stream.name(), String.format(Locale.ROOT,
            "%.2f%% of samples are invalid (limit %.2f%%)", fraction * 100d, limit * 100d));
      }
    }
  }

  private static AlignmentException alignmentFailure(AlignmentReport report, String phase) {
    List<AlignmentFinding> errors = report.withSeverity(Severity.ERROR);
    AlignmentFinding first = errors.get(0);
    return new AlignmentException(first.stream(), phase + " found " + errors.size() + " timing error(s); first: "
        + first.type() + " " + first.description());
  }

  private synchronized void transition(PipelineState next) {
    if (!state.canTransitionTo(next)) {
      throw new IllegalStateException("illegal transition " + state + " -> " + next);
    }
    log.debug("Session {} {} -> {}", session.id(), state, next);
    state = next;
    history.add(next);
  }

  /** Releases readers, the writer, and the stream pool; returns the primary failure with close failures attached. */
  private ConversionException release(ConversionException failure) {
    ConversionException primary = failure;
    if (streamPool != null) {
      streamPool.shutdownNow();
    }
    if (writer != null) {
      if (!writer.finalized()) {
        writer.abandon();
      }
      try {
        writer.close();
      } catch (IOException ex) {
        primary = closeFailure(primary, ex, "target writer");
      }
    }
    if (sources != null) {
      try {
        sources.close();
      } catch (IOException ex) {
        primary = closeFailure(primary, ex, "session sources");
      }
    }
    return primary;
  }

  private ConversionException closeFailure(ConversionException primary, IOException ex, String what) {
    if (primary != null) {
      primary.addSuppressed(ex);
      return primary;
    }
    log.warn("Failed to close {} of session {}", what, session.id(), ex);
    return null;
  }

  private ConversionResult finished(Duration wallTime) {
    ConversionStatus status = report.hasWarnings() ? ConversionStatus.WARNING : ConversionStatus.SUCCESS;
    long bytes = summaries.stream().mapToLong(StreamSummary::bytesRead).sum();
    log.info("Session {} finished with {} ({} findings, {} bytes, {} ms)", session.id(), status,
        report.findings().size(), bytes, wallTime.toMillis());
    return new ConversionResult(session.id(), status, PipelineState.FINALIZED, bytes, wallTime, report, summaries,
        Optional.empty(), Optional.of(writer.location()));
  }

  private ConversionResult aborted(ConversionException failure, PipelineState failedState, Duration wallTime) {
    transition(PipelineState.ABORTED);
    FailureDetail detail = new FailureDetail(failure.kind(), failure.stream(), failedState, failure.getMessage());
    if (failure.kind() == FailureKind.INTERNAL) {
      log.error("Session {} aborted in {}", session.id(), failedState, failure);
    } else {
      log.warn("Session {} aborted in {}: {} {}", session.id(), failedState, failure.kind(), failure.getMessage());
      if (log.isDebugEnabled()) {
        log.debug("Session {} failure detail", session.id(), failure);
      }
    }
    long bytes = summaries.stream().mapToLong(StreamSummary::bytesRead).sum();
    return new ConversionResult(session.id(), ConversionStatus.FAILED, PipelineState.ABORTED, bytes, wallTime,
        report, summaries, Optional.of(detail), Optional.ofNullable(writer).map(TargetWriter::location));
  }

  @FunctionalInterface
  private interface StreamTask {
    void run(StreamPlan plan) throws ConversionException;
  }

  private static final class StreamPlan {
    final StreamDescriptor stream;
    final ModalityMapper mapper;
    final SourceReader samples;
    final Optional<SourceReader> timestamps;
    final ChunkCursor cursor;
    final StreamTimingTracker tracker;

    StreamPlan(StreamDescriptor stream, ModalityMapper mapper, SourceReader samples,
        Optional<SourceReader> timestamps, ChunkCursor cursor, StreamTimingTracker tracker) {
      this.stream = stream;
      this.mapper = mapper;
      this.samples = samples;
      this.timestamps = timestamps;
      this.cursor = cursor;
      this.tracker = tracker;
    }
  }

  private record Handoff(String stream, RawChunk raw, CanonicalRecord mapped, boolean done) {
    static Handoff chunk(String stream, RawChunk raw, CanonicalRecord mapped) {
      return new Handoff(stream, raw, mapped, false);
    }

    static Handoff done(String stream) {
      return new Handoff(stream, null, null, true);
    }
  }

  /** Keeps the earliest failure of a session; later ones are attached as suppressed. */
  private static final class FirstFailure {
    private final CancellationSignal signal;
    private final AtomicReference<ConversionException> first = new AtomicReference<>();

    FirstFailure(CancellationSignal signal) {
      this.signal = signal;
    }

    void record(Throwable error, String stream) {
      ConversionException failure = error instanceof ConversionException
          ? (ConversionException) error
          : new ConversionException(FailureKind.INTERNAL, stream, "unexpected failure: " + error, error);
      if (first.compareAndSet(null, failure)) {
        signal.cancel(failure.kind() + ": " + failure.getMessage());
        return;
      }
      ConversionException primary = first.get();
      if (primary != failure) {
        primary.addSuppressed(failure);
      }
    }

    void throwIfFailed() throws ConversionException {
      ConversionException failure = first.get();
      if (failure != null) {
        throw failure;
      }
    }
  }
}
