package io.tessera.conv.config;

import io.tessera.conv.domain.session.Calibration;
import io.tessera.conv.domain.session.Modality;
import io.tessera.conv.domain.session.SessionDescriptor;
import io.tessera.conv.domain.session.SessionId;
import io.tessera.conv.domain.session.StreamDescriptor;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * <strong>What:</strong> Reads the YAML manifest that lists the sessions of a batch.
 * <p><strong>Role:</strong> Session locator adapter for the CLI; produces the {@link SessionDescriptor}s the
 * orchestrator consumes.</p>
 *
 * <pre>
 * sessions:
 *   - subject: beignet
 *     date: 2024-03-01
 *     index: 0
 *     source: raw/beignet_0.tsrc
 *     metadata: {experimenter: lab, task: center_out}
 *     streams:
 *       - name: ecog
 *         type: ephys
 *         dataset: ecog/samples
 *         sample_rate_hz: 1000
 *         calibration: {scale: 2.5e-7, unit: V}
 *       - name: events
 *         type: behavioral
 *         dataset: task/codes
 *         timestamps: task/times
 * </pre>
 *
 * <p>Relative source paths resolve against the manifest's directory. A stream-level {@code source} overrides
 * the session-level one.</p>
 *
 * @since 0.1.0
 */
public final class SessionManifestLoader {

  private SessionManifestLoader() {}

  /**
   * Loads every session declared in the manifest.
   *
   * @param manifest manifest file
   * @return sessions in declaration order
   * @throws IOException when the manifest cannot be read
   * @throws IllegalArgumentException when the manifest is malformed or declares a session twice
   */
  public static List<SessionDescriptor> load(Path manifest) throws IOException {
    Path absolute = manifest.toAbsolutePath().normalize();
    Path baseDir = absolute.getParent();
    Object document;
    try (Reader reader = Files.newBufferedReader(absolute, StandardCharsets.UTF_8)) {
      document = YamlConfigLoader.newYaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse session manifest " + absolute, ex);
    }
    if (document == null) {
      throw new IllegalArgumentException("Session manifest " + absolute + " is empty");
    }
    Map<String, Object> root = YamlConfigLoader.asMap(document, "manifest");
    List<?> entries = asList(root.get("sessions"), "sessions");
    List<SessionDescriptor> sessions = new ArrayList<>(entries.size());
    Set<SessionId> seen = new HashSet<>();
    for (int i = 0; i < entries.size(); i++) {
      String context = "sessions[" + i + "]";
      SessionDescriptor session = parseSession(YamlConfigLoader.asMap(entries.get(i), context), baseDir, context);
      if (!seen.add(session.id())) {
        throw new IllegalArgumentException("Session " + session.id() + " is declared more than once");
      }
      sessions.add(session);
    }
    return List.copyOf(sessions);
  }

  private static SessionDescriptor parseSession(Map<String, Object> node, Path baseDir, String context) {
    SessionId id = new SessionId(
        requireText(node, "subject", context),
        parseDate(node.get("date"), context),
        (int) parseLong(node.get("index"), 0L, context + ".index"));
    Optional<Path> defaultSource = optionalText(node.get("source")).map(s -> resolve(baseDir, s, context));
    Map<String, String> metadata = new LinkedHashMap<>();
    Object rawMetadata = node.get("metadata");
    if (rawMetadata != null) {
      for (Map.Entry<String, Object> entry : YamlConfigLoader.asMap(rawMetadata, context + ".metadata").entrySet()) {
        metadata.put(entry.getKey(), entry.getValue() == null ? "" : entry.getValue().toString());
      }
    }
    List<?> rawStreams = asList(node.get("streams"), context + ".streams");
    List<StreamDescriptor> streams = new ArrayList<>(rawStreams.size());
    for (int i = 0; i < rawStreams.size(); i++) {
      String streamContext = context + ".streams[" + i + "]";
      streams.add(parseStream(
          YamlConfigLoader.asMap(rawStreams.get(i), streamContext), baseDir, defaultSource, streamContext));
    }
    try {
      return new SessionDescriptor(id, streams, metadata);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(context + ": " + ex.getMessage(), ex);
    }
  }

  private static StreamDescriptor parseStream(
      Map<String, Object> node, Path baseDir, Optional<Path> defaultSource, String context) {
    String name = requireText(node, "name", context);
    Modality modality = Modality.fromDeclaredType(requireText(node, "type", context));
    Path source = optionalText(node.get("source"))
        .map(s -> resolve(baseDir, s, context))
        .or(() -> defaultSource)
        .orElseThrow(() -> new IllegalArgumentException(context + " has no source and its session declares none"));
    String dataset = requireText(node, "dataset", context);
    Optional<String> timestamps = optionalText(node.get("timestamps"));
    double rate = parseDouble(node.get("sample_rate_hz"), 0d, context + ".sample_rate_hz");
    double start = parseDouble(node.get("start_time_s"), 0d, context + ".start_time_s");
    Calibration calibration = node.get("calibration") == null
        ? Calibration.identity("")
        : parseCalibration(YamlConfigLoader.asMap(node.get("calibration"), context + ".calibration"),
            context + ".calibration");
    try {
      return new StreamDescriptor(name, modality, source, dataset, timestamps, rate, start, calibration);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(context + ": " + ex.getMessage(), ex);
    }
  }

  private static Calibration parseCalibration(Map<String, Object> node, String context) {
    Map<String, Double> parameters = new LinkedHashMap<>();
    Object rawParameters = node.get("parameters");
    if (rawParameters != null) {
      for (Map.Entry<String, Object> entry
          : YamlConfigLoader.asMap(rawParameters, context + ".parameters").entrySet()) {
        parameters.put(entry.getKey(),
            parseDouble(entry.getValue(), Double.NaN, context + ".parameters." + entry.getKey()));
      }
    }
    return new Calibration(
        parseDouble(node.get("scale"), 1d, context + ".scale"),
        parseDouble(node.get("offset"), 0d, context + ".offset"),
        optionalText(node.get("unit")).orElse(""),
        parameters);
  }

  private static LocalDate parseDate(Object value, String context) {
    if (value instanceof Date date) {
      return date.toInstant().atZone(ZoneOffset.UTC).toLocalDate();
    }
    if (value == null) {
      throw new IllegalArgumentException(context + ".date is required");
    }
    try {
      return LocalDate.parse(value.toString().trim());
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException(context + ".date must be yyyy-MM-dd (was " + value + ")", ex);
    }
  }

  private static Path resolve(Path baseDir, String raw, String context) {
    try {
      Path path = Path.of(raw);
      Path resolved = path.isAbsolute() || baseDir == null ? path : baseDir.resolve(path);
      return resolved.toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(context + ".source is not a valid path: " + raw, ex);
    }
  }

  private static List<?> asList(Object node, String context) {
    if (!(node instanceof List<?> list) || list.isEmpty()) {
      throw new IllegalArgumentException(context + " must be a non-empty list");
    }
    return list;
  }

  private static String requireText(Map<String, Object> node, String key, String context) {
    return optionalText(node.get(key))
        .orElseThrow(() -> new IllegalArgumentException(context + "." + key + " is required"));
  }

  private static Optional<String> optionalText(Object value) {
    if (value == null || value.toString().isBlank()) {
      return Optional.empty();
    }
    return Optional.of(value.toString().trim());
  }

  private static long parseLong(Object value, long fallback, String context) {
    if (value == null) {
      return fallback;
    }
    if (value instanceof Number number && !(value instanceof Double) && !(value instanceof Float)) {
      return number.longValue();
    }
    try {
      return Long.parseLong(value.toString().trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(context + " must be an integer (was " + value + ")", ex);
    }
  }

  private static double parseDouble(Object value, double fallback, String context) {
    if (value == null) {
      if (Double.isNaN(fallback)) {
        throw new IllegalArgumentException(context + " is required");
      }
      return fallback;
    }
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    try {
      return Double.parseDouble(value.toString().trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(context + " must be a number (was " + value + ")", ex);
    }
  }
}
