package io.tessera.conv.application.alignment;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.tessera.conv.config.ConversionConfig;
import io.tessera.conv.domain.alignment.AlignmentFinding;
import io.tessera.conv.domain.alignment.AlignmentReport;
import io.tessera.conv.domain.alignment.FindingType;
import io.tessera.conv.domain.alignment.Severity;
import io.tessera.conv.domain.record.CanonicalRecord;
import io.tessera.conv.domain.session.Calibration;
import io.tessera.conv.domain.session.Modality;
import io.tessera.conv.domain.session.StreamDescriptor;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class TimeAlignmentValidatorTest {
  private static final Path SOURCE = Path.of("source.tsrc");

  private final ConversionConfig.Alignment defaults = ConversionConfig.defaults().alignment();

  @Test
  void gapAboveThresholdIsReportedWithItsInterval() {
    ConversionConfig.Alignment settings =
        ConversionConfig.fromMap(Map.of("alignment.gap_error_threshold_ms", "100")).alignment();
    TimeAlignmentValidator validator = new TimeAlignmentValidator(settings, 256);
    StreamDescriptor ecog = regular("ecog", Modality.ELECTROPHYSIOLOGY, 1_000d);
    StreamTimingTracker tracker = validator.tracker(ecog);

    double[] before = clock(100, 1_000d, 0d);
    double[] after = clock(100, 1_000d, 0.150d);
    tracker.accept(record(ecog, 0, before));
    tracker.accept(record(ecog, 100, after));
    AlignmentReport report = validator.validate(List.of(tracker));

    assertEquals(1, report.findings().size());
    AlignmentFinding gap = report.findings().get(0);
    assertEquals(FindingType.GAP, gap.type());
    assertEquals(Severity.WARNING, gap.severity());
    assertEquals("ecog", gap.stream());
    assertEquals(0.099d, gap.interval().startSeconds(), 1e-9);
    assertEquals(0.150d, gap.interval().endSeconds(), 1e-9);
    assertTrue(report.hasWarnings());
    assertFalse(report.hasErrors());
  }

  @Test
  void spacingWithinThresholdIsNotAGap() {
    TimeAlignmentValidator validator = new TimeAlignmentValidator(defaults, 256);
    StreamDescriptor ecog = regular("ecog", Modality.ELECTROPHYSIOLOGY, 1_000d);
    StreamTimingTracker tracker = validator.tracker(ecog);
    tracker.accept(record(ecog, 0, clock(1_000, 1_000d, 0d)));
    tracker.accept(record(ecog, 1_000, clock(1_000, 1_000d, 1.015d)));

    assertTrue(validator.validate(List.of(tracker)).findings().isEmpty());
  }

  @Test
  void decreasingTimestampIsAnError() {
    TimeAlignmentValidator validator = new TimeAlignmentValidator(defaults, 256);
    StreamDescriptor cursor = regular("cursor", Modality.KINEMATICS, 100d);
    StreamTimingTracker tracker = validator.tracker(cursor);
    tracker.accept(record(cursor, 0, new double[] {0.00, 0.01, 0.02, 0.015, 0.03}));

    AlignmentReport report = validator.validate(List.of(tracker));

    assertTrue(report.hasErrors());
    assertTrue(report.withSeverity(Severity.ERROR).stream()
        .anyMatch(f -> f.type() == FindingType.NON_MONOTONIC && f.interval().startSeconds() == 0.015d));
  }

  @Test
  void rateFarFromDeclaredIsAnError() {
    TimeAlignmentValidator validator = new TimeAlignmentValidator(defaults, 256);
    StreamDescriptor ecog = regular("ecog", Modality.ELECTROPHYSIOLOGY, 1_000d);
    StreamTimingTracker tracker = validator.tracker(ecog);
    tracker.accept(record(ecog, 0, clock(801, 800d, 0d)));

    AlignmentReport report = validator.validate(List.of(tracker));

    assertEquals(1, report.findings().size());
    assertEquals(FindingType.RATE_MISMATCH, report.findings().get(0).type());
    assertEquals(Severity.ERROR, report.findings().get(0).severity());
  }

  @Test
  void irregularStreamsSkipGapAndRateChecks() {
    TimeAlignmentValidator validator = new TimeAlignmentValidator(defaults, 256);
    StreamDescriptor events = new StreamDescriptor("events", Modality.BEHAVIORAL, SOURCE, "codes",
        Optional.of("times"), 0d, 0d, Calibration.identity(""));
    StreamTimingTracker tracker = validator.tracker(events);
    tracker.accept(record(events, 0, new double[] {0.1, 0.2, 5.0, 9.0}));

    assertTrue(validator.validate(List.of(tracker)).findings().isEmpty());
  }

  @Test
  void driftAgainstReferenceIsReportedForTheLaggingStream() {
    TimeAlignmentValidator validator = new TimeAlignmentValidator(defaults, 256);
    StreamDescriptor ecog = regular("ecog", Modality.ELECTROPHYSIOLOGY, 1_000d);
    StreamDescriptor cursor = regular("cursor", Modality.KINEMATICS, 100d);

    AlignmentReport report = validator.preflight(List.of(
        new StreamBounds(ecog, 1_000, 0d, 0.999d),
        new StreamBounds(cursor, 120, 0d, 1.19d)));

    assertEquals(1, report.findings().size());
    AlignmentFinding drift = report.findings().get(0);
    assertEquals(FindingType.DRIFT, drift.type());
    assertEquals("cursor", drift.stream());
    assertEquals(Severity.WARNING, drift.severity());
    assertEquals(1.0d, drift.interval().startSeconds(), 1e-9);
    assertEquals(1.2d, drift.interval().endSeconds(), 1e-9);
  }

  @Test
  void referenceFallsBackToElectrophysiologyWhenConfiguredStreamIsMissing() {
    ConversionConfig.Alignment settings =
        ConversionConfig.fromMap(Map.of("alignment.reference_stream", "missing")).alignment();
    TimeAlignmentValidator validator = new TimeAlignmentValidator(settings, 256);

    Optional<String> reference = validator.referenceStream(List.of(
        regular("cursor", Modality.KINEMATICS, 100d),
        regular("lfp", Modality.ELECTROPHYSIOLOGY, 500d),
        regular("ecog", Modality.ELECTROPHYSIOLOGY, 1_000d)));

    assertEquals(Optional.of("ecog"), reference);
  }

  @Test
  void findingsBeyondTheCapAreAggregated() {
    TimeAlignmentValidator validator = new TimeAlignmentValidator(defaults, 2);
    StreamDescriptor cursor = regular("cursor", Modality.KINEMATICS, 100d);
    StreamTimingTracker tracker = validator.tracker(cursor);
    tracker.accept(record(cursor, 0, new double[] {1.0, 0.9, 0.8, 0.7, 0.6, 0.5}));

    List<AlignmentFinding> findings = tracker.finish();

    assertEquals(3, findings.size());
    assertTrue(findings.get(2).description().startsWith("3 further non_monotonic"));
    assertEquals(Severity.ERROR, findings.get(2).severity());
    assertThrows(IllegalStateException.class, () -> tracker.accept(record(cursor, 6, new double[] {2.0})));
  }

  private static StreamDescriptor regular(String name, Modality modality, double rate) {
    Calibration calibration = modality == Modality.EYE_TRACKING
        ? new Calibration(1d, 0d, "", Map.of("viewing_distance", 60d))
        : Calibration.identity("");
    return new StreamDescriptor(name, modality, SOURCE, name, Optional.empty(), rate, 0d, calibration);
  }

  private static double[] clock(int samples, double rate, double start) {
    double[] times = new double[samples];
    for (int i = 0; i < samples; i++) {
      times[i] = start + i / rate;
    }
    return times;
  }

  private static CanonicalRecord record(StreamDescriptor stream, long firstSample, double[] times) {
    boolean[] valid = new boolean[times.length];
    Arrays.fill(valid, true);
    return new CanonicalRecord(stream.name(), stream.modality(), stream.unit(), firstSample, 1, times,
        new double[times.length], valid);
  }
}
