package io.tessera.conv.application.pipeline;

import io.tessera.conv.domain.alignment.AlignmentReport;
import io.tessera.conv.domain.conversion.BatchReport;
import io.tessera.conv.domain.conversion.ConversionResult;
import io.tessera.conv.domain.conversion.ConversionStatus;
import io.tessera.conv.domain.conversion.FailureDetail;
import io.tessera.conv.domain.conversion.FailureKind;
import io.tessera.conv.domain.conversion.PipelineState;
import io.tessera.conv.domain.session.SessionDescriptor;
import io.tessera.conv.domain.session.SessionId;
import io.tessera.conv.infrastructure.exec.ExecutorFactories;
import io.tessera.conv.logging.MdcScope;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs a batch of sessions with bounded parallelism and aggregates their results.
 * <p><strong>Why:</strong> Sessions are independent; a failure in one never corrupts another's container.</p>
 * <p><strong>Role:</strong> Entry point of the application layer used by the CLI.</p>
 * <p><strong>Concurrency:</strong> At most {@code batch.parallelism} sessions run at once, each on one worker
 * end to end. Results go into a lock-guarded {@link BatchReport.Builder}. With {@code batch.skip_errors=false}
 * the first failure stops submission; sessions already running complete.</p>
 * <p><strong>Observability:</strong> Emits {@code convert.session.success}, {@code convert.session.warning},
 * {@code convert.session.failed}, and {@code convert.session.skipped}.</p>
 *
 * @since 0.1.0
 */
public final class BatchOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(BatchOrchestrator.class);

  private final PipelineContext context;
  private final CancellationSignal batchSignal = CancellationSignal.root();

  public BatchOrchestrator(PipelineContext context) {
    this.context = Objects.requireNonNull(context, "context");
  }

  /**
   * Requests cancellation: running sessions abort at their next chunk boundary and pending ones are skipped.
   *
   * @param reason reason recorded in failure details
   */
  public void cancel(String reason) {
    log.warn("Batch cancellation requested: {}", reason);
    batchSignal.cancel(reason);
  }

  public boolean cancelled() {
    return batchSignal.isCancelled();
  }

  /**
   * Converts every session and blocks until the batch completes.
   *
   * @param sessions sessions in submission order; ids must be unique
   * @return aggregated report in submission order
   */
  public BatchReport run(List<SessionDescriptor> sessions) {
    Objects.requireNonNull(sessions, "sessions");
    List<SessionId> order = new ArrayList<>(sessions.size());
    for (SessionDescriptor session : sessions) {
      order.add(session.id());
    }
    BatchReport.Builder builder = BatchReport.builder(order);
    int parallelism = context.config().batch().parallelism();
    boolean skipErrors = context.config().batch().skipErrors();
    long started = System.nanoTime();
    log.info("Starting batch of {} session(s), parallelism={}, skipErrors={}",
        sessions.size(), parallelism, skipErrors);

    ExecutorService pool = ExecutorFactories.newSessionPool(parallelism, ExecutorFactories.LOGGING_HANDLER);
    Semaphore slots = new Semaphore(parallelism);
    AtomicBoolean halted = new AtomicBoolean();
    boolean interrupted = false;
    try {
      for (SessionDescriptor session : sessions) {
        if (!interrupted) {
          try {
            slots.acquire();
          } catch (InterruptedException ex) {
            interrupted = true;
            cancel("interrupted");
          }
        }
        if (interrupted || halted.get() || batchSignal.isCancelled()) {
          if (!interrupted) {
            slots.release();
          }
          skip(builder, session.id());
          continue;
        }
        pool.execute(() -> {
          ConversionResult result = null;
          try {
            result = convert(session);
          } catch (Error err) {
            // the worker dies with the error; the session still gets its result
            result = crashed(session.id(), err);
            throw err;
          } finally {
            if (result != null) {
              builder.add(result);
              count(result.status());
              if (result.failed() && !skipErrors && halted.compareAndSet(false, true)) {
                log.warn("Session {} failed; no further sessions will be started", session.id());
              }
            }
            slots.release();
          }
        });
      }
    } finally {
      pool.shutdown();
      interrupted |= awaitTermination(pool);
    }
    if (batchSignal.isCancelled()) {
      builder.markCancelled();
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
    BatchReport report = builder.build(Duration.ofNanos(System.nanoTime() - started));
    log.info("Batch finished: {} succeeded, {} with warnings, {} failed, {} skipped in {} ms",
        report.successCount(), report.warningCount(), report.failedCount(), report.skippedCount(),
        report.elapsed().toMillis());
    return report;
  }

  private ConversionResult convert(SessionDescriptor session) {
    try (MdcScope mdc = MdcScope.of(MdcScope.SESSION, session.id().toString())) {
      return new ConversionPipeline(session, context, batchSignal).run();
    } catch (RuntimeException ex) {
      log.error("Session {} crashed outside its pipeline", session.id(), ex);
      return crashed(session.id(), ex);
    }
  }

  private static ConversionResult crashed(SessionId id, Throwable cause) {
    FailureDetail detail = new FailureDetail(
        FailureKind.INTERNAL, Optional.empty(), PipelineState.INIT, "unexpected failure: " + cause);
    return new ConversionResult(id, ConversionStatus.FAILED, PipelineState.ABORTED, 0L, Duration.ZERO,
        AlignmentReport.empty(), List.of(), Optional.of(detail), Optional.empty());
  }

  private void skip(BatchReport.Builder builder, SessionId id) {
    builder.skip(id);
    context.metrics().increment("convert.session.skipped");
    log.info("Session {} skipped", id);
  }

  private void count(ConversionStatus status) {
    context.metrics().increment("convert.session." + status.name().toLowerCase(Locale.ROOT));
  }

  private boolean awaitTermination(ExecutorService pool) {
    boolean interrupted = false;
    while (true) {
      try {
        if (pool.awaitTermination(1, TimeUnit.SECONDS)) {
          return interrupted;
        }
      } catch (InterruptedException ex) {
        interrupted = true;
        cancel("interrupted");
      }
    }
  }
}
