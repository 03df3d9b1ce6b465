package io.tessera.conv.api;

import io.tessera.conv.config.ConversionConfig;
import io.tessera.conv.domain.alignment.Severity;
import io.tessera.conv.domain.conversion.BatchReport;
import io.tessera.conv.domain.conversion.ConversionResult;
import io.tessera.conv.domain.conversion.FailureDetail;
import io.tessera.conv.domain.session.SessionDescriptor;
import io.tessera.conv.domain.session.SessionId;
import io.tessera.conv.domain.session.StreamDescriptor;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Renders what the operator reads on stdout: usage, the dry-run plan, and the batch summary.
 *
 * <p>Writes to the stdout file descriptor so logging, which goes to stderr, never interleaves with the
 * summary.</p>
 *
 * @since 0.1.0
 */
final class ConsoleReport {
  static final String USAGE =
      "usage: convert manifest=PATH [config=PATH] [key=value ...] [--dry-run] [--verbose] [--help]";
  private static final String HELP_TEXT = """
      Tessera session converter

      Usage:
        convert manifest=PATH [config=PATH] [key=value ...] [flags]

      Inputs:
        manifest=PATH                  YAML manifest listing the sessions to convert (required)
        config=PATH                    YAML configuration; otherwise $TESSERA_CONFIG, ./tessera.yaml,
                                       ./config/tessera.yaml, ~/.tessera/tessera.yaml, then defaults

      Overrides (take precedence over the configuration file):
        output.root=DIR                Directory receiving one .tsc container per session
        output.overwrite=true|false    Replace existing complete containers (default false)
        batch.parallelism=N            Sessions converted concurrently (default 1)
        batch.skip_errors=true|false   Keep going after a failed session (default false)
        chunk_size_mb=N                Source chunk size in MiB (default 64)
        compression.algorithm=NAME     none|deflate|gzip|bzip2 (default gzip)
        compression.level=0-9          Codec level (default 4)
        alignment.gap_threshold_ms=MS  Gap reporting threshold (default 20)
        alignment.drift_threshold_ms=MS
                                       Drift reporting threshold (default 50)
        logging.level=LEVEL            Root log level (default INFO)
        metrics.exporter=otlp|none     OpenTelemetry metrics exporter (default none)
        metrics.endpoint=URL           OTLP endpoint when metrics.exporter=otlp

      Flags:
        --dry-run, -n                  Resolve configuration and manifest, print the plan, convert nothing
        --verbose, -v                  Enable DEBUG logging
        --help, -h                     Show this message

      Exit codes: 0 success, 2 invalid arguments, 3 I/O error, 4 configuration error,
      5 a session failed, 130 interrupted.
      """;

  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private ConsoleReport() {
    // Utility
  }

  static void usage() {
    writer().println(USAGE);
  }

  static void help() {
    writer().println(HELP_TEXT.stripTrailing());
  }

  static void plan(ConversionConfig config, Optional<Path> configPath, Path manifest, List<SessionDescriptor> sessions) {
    PrintWriter out = writer();
    out.println("Convert dry-run: no containers will be written.");
    out.println(" Manifest         : " + manifest.toAbsolutePath().normalize());
    out.println(" Configuration    : " + configPath.map(Path::toString).orElse("<built-in defaults>"));
    out.println(" Output root      : " + config.output().root());
    out.println(" Overwrite        : " + config.output().overwrite());
    out.println(" Parallelism      : " + config.batch().parallelism());
    out.println(" Skip errors      : " + config.batch().skipErrors());
    out.println(" Chunk size       : " + config.chunkSizeBytes() + " bytes");
    out.println(" Compression      : "
        + config.compression().defaults().algorithm().name().toLowerCase(Locale.ROOT)
        + " level " + config.compression().defaults().level());
    out.println(" Sessions         : " + sessions.size());
    for (SessionDescriptor session : sessions) {
      out.println("  " + session.id());
      for (StreamDescriptor stream : session.streams()) {
        out.println(String.format(Locale.ROOT, "    %-16s %-18s %s:%s %s",
            stream.name(),
            stream.modality().sectionName(),
            stream.source().getFileName(),
            stream.datasetPath(),
            stream.regular() ? stream.sampleRateHz() + " Hz" : "irregular"));
      }
    }
    out.println(" Re-run without --dry-run to convert.");
  }

  static void summary(BatchReport report) {
    PrintWriter out = writer();
    out.println("Conversion summary:");
    for (ConversionResult result : report.results()) {
      out.println(resultLine(result));
    }
    for (SessionId skipped : report.skipped()) {
      out.println(String.format(Locale.ROOT, "  %-32s SKIPPED", skipped));
    }
    out.println(String.format(Locale.ROOT,
        "Totals: %d succeeded, %d with warnings, %d failed, %d skipped; %,d bytes in %d ms%s",
        report.successCount(), report.warningCount(), report.failedCount(), report.skippedCount(),
        report.totalBytes(), report.elapsed().toMillis(), report.cancelled() ? " (cancelled)" : ""));
  }

  private static String resultLine(ConversionResult result) {
    StringBuilder line = new StringBuilder(String.format(Locale.ROOT, "  %-32s %-8s %,14d bytes  %6d ms",
        result.sessionId(), result.status(), result.bytesProcessed(), result.wallTime().toMillis()));
    if (result.failure().isPresent()) {
      FailureDetail failure = result.failure().get();
      line.append("  ").append(failure.kind()).append(" in ").append(failure.failedState());
      failure.stream().ifPresent(stream -> line.append(" [").append(stream).append(']'));
      line.append(": ").append(failure.message());
      return line.toString();
    }
    result.output().ifPresent(path -> line.append("  -> ").append(path));
    int warnings = result.report().withSeverity(Severity.WARNING).size();
    if (warnings > 0) {
      line.append("  (").append(warnings).append(" alignment warning(s))");
    }
    return line.toString();
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    return override != null ? override : STDOUT;
  }
}
