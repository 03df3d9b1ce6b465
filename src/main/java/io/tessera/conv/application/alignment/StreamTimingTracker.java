package io.tessera.conv.application.alignment;

import io.tessera.conv.config.ConversionConfig;
import io.tessera.conv.domain.alignment.AlignmentFinding;
import io.tessera.conv.domain.alignment.FindingType;
import io.tessera.conv.domain.alignment.Severity;
import io.tessera.conv.domain.alignment.TimeInterval;
import io.tessera.conv.domain.record.CanonicalRecord;
import io.tessera.conv.domain.session.StreamDescriptor;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * <strong>What:</strong> Incremental timing statistics of one stream, fed record by record in stream order.
 * <p><strong>Checks:</strong> decreasing timestamps (always ERROR); gaps, where the spacing of two consecutive
 * samples exceeds the nominal sample period by more than the gap threshold (regular streams only);
 * effective rate versus declared rate with gap time excluded (regular streams only); runs of invalid samples.</p>
 * <p><strong>Memory:</strong> constant apart from findings; at most {@code maxRecorded} findings per type are
 * itemized, the rest are folded into one aggregate finding.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one tracker belongs to one stream task.</p>
 *
 * @since 0.1.0
 */
public final class StreamTimingTracker {

  private static final class Overflow {
    long count;
    Severity severity = Severity.WARNING;
    double start = Double.POSITIVE_INFINITY;
    double end = Double.NEGATIVE_INFINITY;
  }

  private final StreamDescriptor stream;
  private final ConversionConfig.Alignment settings;
  private final int maxRecorded;
  private final List<AlignmentFinding> findings = new ArrayList<>();
  private final Map<FindingType, Integer> itemized = new EnumMap<>(FindingType.class);
  private final Map<FindingType, Overflow> overflow = new EnumMap<>(FindingType.class);

  private long samples;
  private double first = Double.NaN;
  private double last = Double.NaN;
  private double gapSeconds;
  private long runLength;
  private long runFirstSample;
  private double runStart;
  private double runEnd;
  private boolean finished;

  StreamTimingTracker(StreamDescriptor stream, ConversionConfig.Alignment settings, int maxRecorded) {
    this.stream = stream;
    this.settings = settings;
    this.maxRecorded = maxRecorded;
  }

  public StreamDescriptor stream() {
    return stream;
  }

  /**
   * Consumes the next window of the stream.
   *
   * @param record window following the previously accepted one
   */
  public void accept(CanonicalRecord record) {
    if (finished) {
      throw new IllegalStateException("tracker for " + stream.name() + " already finished");
    }
    double[] times = record.timestamps();
    boolean[] valid = record.valid();
    double period = stream.regular() ? 1d / stream.sampleRateHz() : 0d;
    for (int i = 0; i < times.length; i++) {
      double t = times[i];
      if (samples == 0) {
        first = t;
      } else {
        double delta = t - last;
        if (delta < 0) {
          record(Severity.ERROR, FindingType.NON_MONOTONIC, new TimeInterval(t, last),
              String.format(Locale.ROOT, "timestamp decreases by %.3f ms at sample %d",
                  -delta * 1_000d, record.firstSample() + i));
        } else if (stream.regular()) {
          double excessMs = (delta - period) * 1_000d;
          if (excessMs > settings.gapThresholdMs()) {
            gapSeconds += delta - period;
            Severity severity = excessMs > settings.gapErrorThresholdMs() ? Severity.ERROR : Severity.WARNING;
            record(severity, FindingType.GAP, new TimeInterval(last, t),
                String.format(Locale.ROOT, "%.3f ms without samples before sample %d",
                    excessMs, record.firstSample() + i));
          }
        }
      }
      last = t;
      samples++;
      if (valid[i]) {
        closeRun();
      } else {
        if (runLength == 0) {
          runStart = t;
          runFirstSample = record.firstSample() + i;
        }
        runLength++;
        runEnd = t;
      }
    }
  }

  /**
   * Closes open runs, applies the rate check, and returns the stream's findings.
   *
   * @return findings of this stream in detection order
   */
  public List<AlignmentFinding> finish() {
    if (!finished) {
      finished = true;
      closeRun();
      checkRate();
      for (Map.Entry<FindingType, Overflow> entry : overflow.entrySet()) {
        Overflow o = entry.getValue();
        findings.add(new AlignmentFinding(stream.name(), o.severity, entry.getKey(), new TimeInterval(o.start, o.end),
            o.count + " further " + entry.getKey().name().toLowerCase(Locale.ROOT) + " finding(s) not itemized"));
      }
    }
    return List.copyOf(findings);
  }

  /**
   * Returns the observed bounds of the stream.
   *
   * @return bounds from the accepted samples
   */
  public StreamBounds bounds() {
    return new StreamBounds(stream, samples, first, last);
  }

  public long samples() {
    return samples;
  }

  private void checkRate() {
    if (!stream.regular() || samples < 2) {
      return;
    }
    double span = (last - first) - gapSeconds;
    if (span <= 0) {
      return;
    }
    double effective = (samples - 1) / span;
    double declared = stream.sampleRateHz();
    double deviation = Math.abs(effective - declared) / declared;
    if (deviation > settings.rateTolerance()) {
      Severity severity = deviation > settings.rateErrorTolerance() ? Severity.ERROR : Severity.WARNING;
      record(severity, FindingType.RATE_MISMATCH, new TimeInterval(first, last),
          String.format(Locale.ROOT, "effective rate %.4f Hz deviates %.2f%% from declared %.4f Hz",
              effective, deviation * 100d, declared));
    }
  }

  private void closeRun() {
    if (runLength == 0) {
      return;
    }
    record(Severity.WARNING, FindingType.INVALID_SAMPLES, new TimeInterval(runStart, runEnd),
        runLength + " invalid sample(s) starting at sample " + runFirstSample);
    runLength = 0;
  }

  private void record(Severity severity, FindingType type, TimeInterval interval, String description) {
    int count = itemized.getOrDefault(type, 0);
    if (count < maxRecorded) {
      itemized.put(type, count + 1);
      findings.add(new AlignmentFinding(stream.name(), severity, type, interval, description));
      return;
    }
    Overflow o = overflow.computeIfAbsent(type, k -> new Overflow());
    o.count++;
    if (severity == Severity.ERROR) {
      o.severity = Severity.ERROR;
    }
    o.start = Math.min(o.start, interval.startSeconds());
    o.end = Math.max(o.end, interval.endSeconds());
  }
}
