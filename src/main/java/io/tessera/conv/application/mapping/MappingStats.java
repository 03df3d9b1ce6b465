package io.tessera.conv.application.mapping;

import io.tessera.conv.application.port.MappingListener;
import io.tessera.conv.domain.conversion.StreamSummary;
import io.tessera.conv.domain.session.Modality;
import io.tessera.conv.domain.session.StreamDescriptor;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Per-stream counters fed by mapping events and chunk reads; turned into {@link StreamSummary} values
 * for the conversion result. Safe for concurrent stream workers.
 *
 * @since 0.1.0
 */
public final class MappingStats implements MappingListener {

  private static final class Counters {
    final LongAdder samples = new LongAdder();
    final LongAdder invalid = new LongAdder();
    final LongAdder chunks = new LongAdder();
    final LongAdder bytes = new LongAdder();
  }

  private final Map<String, Counters> counters = new ConcurrentHashMap<>();

  @Override
  public void onMapped(String stream, Modality modality, int samples, int invalid) {
    Counters c = counters.computeIfAbsent(stream, k -> new Counters());
    c.samples.add(samples);
    c.invalid.add(invalid);
  }

  /**
   * Records one chunk read from the stream's sample dataset.
   *
   * @param stream stream name
   * @param bytes payload bytes of the chunk
   */
  public void onChunk(String stream, long bytes) {
    Counters c = counters.computeIfAbsent(stream, k -> new Counters());
    c.chunks.increment();
    c.bytes.add(bytes);
  }

  public long samples(String stream) {
    Counters c = counters.get(stream);
    return c == null ? 0L : c.samples.sum();
  }

  public long invalid(String stream) {
    Counters c = counters.get(stream);
    return c == null ? 0L : c.invalid.sum();
  }

  /**
   * Returns the invalid fraction of a stream.
   *
   * @param stream stream name
   * @return invalid samples divided by samples, {@code 0} for an empty stream
   */
  public double invalidFraction(String stream) {
    long samples = samples(stream);
    return samples == 0 ? 0d : (double) invalid(stream) / samples;
  }

  /**
   * Builds the summary of one stream.
   *
   * @param stream stream declaration
   * @param firstTimestamp first observed timestamp
   * @param lastTimestamp last observed timestamp
   * @return summary
   */
  public StreamSummary summarize(StreamDescriptor stream, double firstTimestamp, double lastTimestamp) {
    Counters c = counters.getOrDefault(stream.name(), new Counters());
    return new StreamSummary(stream.name(), stream.modality(), stream.unit(), c.samples.sum(), c.invalid.sum(),
        c.chunks.sum(), c.bytes.sum(), firstTimestamp, lastTimestamp);
  }
}
