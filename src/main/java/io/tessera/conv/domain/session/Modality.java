package io.tessera.conv.domain.session;

import java.util.Locale;
import java.util.Map;

/**
 * Capability set of recorded signal categories. The variant is fixed per stream from its declared
 * type and selects the mapping strategy.
 *
 * @since 0.1.0
 */
public enum Modality {
  /** Neural voltage traces recorded as integer ADC codes. */
  ELECTROPHYSIOLOGY("V", "electrophysiology"),
  /** Limb, cursor, or marker positions. */
  KINEMATICS("m", "kinematics"),
  /** Gaze positions reported in screen pixels. */
  EYE_TRACKING("deg", "eye_tracking"),
  /** Discrete task events such as trial codes. */
  BEHAVIORAL("code", "behavioral");

  private static final Map<String, Modality> ALIASES = Map.ofEntries(
      Map.entry("electrophysiology", ELECTROPHYSIOLOGY),
      Map.entry("ephys", ELECTROPHYSIOLOGY),
      Map.entry("ecog", ELECTROPHYSIOLOGY),
      Map.entry("lfp", ELECTROPHYSIOLOGY),
      Map.entry("kinematics", KINEMATICS),
      Map.entry("cursor", KINEMATICS),
      Map.entry("eye_tracking", EYE_TRACKING),
      Map.entry("eyetracking", EYE_TRACKING),
      Map.entry("eye", EYE_TRACKING),
      Map.entry("behavioral", BEHAVIORAL),
      Map.entry("behavior", BEHAVIORAL),
      Map.entry("events", BEHAVIORAL));

  private final String defaultUnit;
  private final String sectionName;

  Modality(String defaultUnit, String sectionName) {
    this.defaultUnit = defaultUnit;
    this.sectionName = sectionName;
  }

  /**
   * Returns the physical unit applied when the calibration leaves the unit blank.
   *
   * @return default unit symbol
   */
  public String defaultUnit() {
    return defaultUnit;
  }

  /**
   * Returns the lower-case name used for the processing section of the target container.
   *
   * @return section name, for example {@code eye_tracking}
   */
  public String sectionName() {
    return sectionName;
  }

  /**
   * Resolves a declared modality type, accepting common aliases case-insensitively.
   *
   * @param declared declared type from the session descriptor
   * @return matching modality
   * @throws IllegalArgumentException if the value is blank or unknown
   */
  public static Modality fromDeclaredType(String declared) {
    if (declared == null || declared.isBlank()) {
      throw new IllegalArgumentException("modality type must not be blank");
    }
    String normalized = declared.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
    Modality modality = ALIASES.get(normalized);
    if (modality == null) {
      throw new IllegalArgumentException("Unsupported modality type: " + declared);
    }
    return modality;
  }
}
