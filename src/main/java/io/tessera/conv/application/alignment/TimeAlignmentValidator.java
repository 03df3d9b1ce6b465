package io.tessera.conv.application.alignment;

import io.tessera.conv.config.ConversionConfig;
import io.tessera.conv.domain.alignment.AlignmentFinding;
import io.tessera.conv.domain.alignment.AlignmentReport;
import io.tessera.conv.domain.alignment.FindingType;
import io.tessera.conv.domain.alignment.Severity;
import io.tessera.conv.domain.alignment.TimeInterval;
import io.tessera.conv.domain.session.Modality;
import io.tessera.conv.domain.session.StreamDescriptor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Cross-stream timing-consistency validation for one session.
 * <p><strong>Why:</strong> Streams are sampled independently on a nominally shared clock; a converted session is
 * only trustworthy when per-stream timing is sane and stream ends agree.</p>
 * <p><strong>Role:</strong> Hands out one {@link StreamTimingTracker} per stream, runs a drift pre-flight on probed
 * bounds, and assembles the ordered {@link AlignmentReport} after the scan.</p>
 * <p><strong>Drift:</strong> notional end of each regular stream minus the reference stream's notional end. The
 * reference is the configured stream, else the first regular electrophysiology stream by name, else the first
 * regular stream by name. Irregular streams take no part in drift.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from configuration; trackers are confined to their stream task.</p>
 *
 * @since 0.1.0
 */
public final class TimeAlignmentValidator {
  private static final Logger log = LoggerFactory.getLogger(TimeAlignmentValidator.class);

  private final ConversionConfig.Alignment settings;
  private final int maxRecorded;

  /**
   * Creates a validator.
   *
   * @param settings thresholds
   * @param maxRecorded findings itemized per stream and type
   */
  public TimeAlignmentValidator(ConversionConfig.Alignment settings, int maxRecorded) {
    this.settings = Objects.requireNonNull(settings, "settings");
    if (maxRecorded < 1) {
      throw new IllegalArgumentException("maxRecorded must be >= 1");
    }
    this.maxRecorded = maxRecorded;
  }

  /**
   * Creates the tracker of one stream.
   *
   * @param stream stream declaration
   * @return fresh tracker
   */
  public StreamTimingTracker tracker(StreamDescriptor stream) {
    return new StreamTimingTracker(stream, settings, maxRecorded);
  }

  /**
   * Checks drift on bounds probed before the full scan.
   *
   * @param bounds probed bounds of every stream
   * @return report holding drift findings only
   */
  public AlignmentReport preflight(Collection<StreamBounds> bounds) {
    return new AlignmentReport(drift(bounds));
  }

  /**
   * Builds the session report once every tracker consumed its whole stream.
   *
   * @param trackers one tracker per stream
   * @return ordered report
   */
  public AlignmentReport validate(Collection<StreamTimingTracker> trackers) {
    List<AlignmentFinding> findings = new ArrayList<>();
    List<StreamBounds> bounds = new ArrayList<>(trackers.size());
    for (StreamTimingTracker tracker : trackers) {
      findings.addAll(tracker.finish());
      bounds.add(tracker.bounds());
    }
    findings.addAll(drift(bounds));
    return new AlignmentReport(findings);
  }

  /**
   * Selects the drift reference among the supplied streams.
   *
   * @param streams candidate streams
   * @return reference stream name, empty when no regular stream exists
   */
  public Optional<String> referenceStream(Collection<StreamDescriptor> streams) {
    if (settings.referenceStream().isPresent()) {
      String configured = settings.referenceStream().get();
      Optional<StreamDescriptor> match = streams.stream()
          .filter(s -> s.name().equals(configured) && s.regular())
          .findFirst();
      if (match.isPresent()) {
        return Optional.of(configured);
      }
      log.warn("Configured reference stream {} is absent or irregular; selecting a default", configured);
    }
    Comparator<StreamDescriptor> byName = Comparator.comparing(StreamDescriptor::name);
    Optional<StreamDescriptor> ephys = streams.stream()
        .filter(StreamDescriptor::regular)
        .filter(s -> s.modality() == Modality.ELECTROPHYSIOLOGY)
        .min(byName);
    if (ephys.isPresent()) {
      return Optional.of(ephys.get().name());
    }
    return streams.stream().filter(StreamDescriptor::regular).min(byName).map(StreamDescriptor::name);
  }

  private List<AlignmentFinding> drift(Collection<StreamBounds> bounds) {
    List<StreamDescriptor> streams = bounds.stream().map(StreamBounds::stream).toList();
    Optional<String> referenceName = referenceStream(streams);
    if (referenceName.isEmpty()) {
      return List.of();
    }
    StreamBounds reference = bounds.stream()
        .filter(b -> b.stream().name().equals(referenceName.get()))
        .findFirst()
        .orElseThrow();
    double referenceEnd = reference.notionalEnd();
    if (Double.isNaN(referenceEnd)) {
      return List.of();
    }
    List<AlignmentFinding> findings = new ArrayList<>();
    for (StreamBounds candidate : bounds) {
      if (candidate == reference || !candidate.stream().regular()) {
        continue;
      }
      double end = candidate.notionalEnd();
      if (Double.isNaN(end)) {
        continue;
      }
      double driftMs = (end - referenceEnd) * 1_000d;
      double magnitude = Math.abs(driftMs);
      if (magnitude > settings.driftThresholdMs()) {
        Severity severity = magnitude > settings.driftErrorThresholdMs() ? Severity.ERROR : Severity.WARNING;
        findings.add(new AlignmentFinding(candidate.stream().name(), severity, FindingType.DRIFT,
            new TimeInterval(Math.min(end, referenceEnd), Math.max(end, referenceEnd)),
            String.format(Locale.ROOT, "ends %+.3f ms relative to reference %s", driftMs, referenceName.get())));
      }
    }
    return findings;
  }
}
