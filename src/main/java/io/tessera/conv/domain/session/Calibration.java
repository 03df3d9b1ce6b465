package io.tessera.conv.domain.session;

import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Linear calibration applied to raw samples, plus named parameters needed by non-linear mappings.
 *
 * @param scale multiplier applied to the raw value
 * @param offset additive term applied after scaling
 * @param unit physical unit of the calibrated value; blank selects the modality default
 * @param parameters extra named parameters, for example {@code viewing_distance}
 * @since 0.1.0
 */
public record Calibration(double scale, double offset, String unit, Map<String, Double> parameters) {

  /**
   * Normalizes the unit and copies the parameters.
   *
   * @throws IllegalArgumentException if scale or offset is not finite, or scale is zero
   */
  public Calibration {
    if (!Double.isFinite(scale) || scale == 0d) {
      throw new IllegalArgumentException("calibration scale must be finite and non-zero (was " + scale + ")");
    }
    if (!Double.isFinite(offset)) {
      throw new IllegalArgumentException("calibration offset must be finite (was " + offset + ")");
    }
    unit = unit == null ? "" : unit.trim();
    parameters = Map.copyOf(Objects.requireNonNullElse(parameters, Map.of()));
  }

  /**
   * Identity calibration with the given unit.
   *
   * @param unit unit symbol; blank selects the modality default
   * @return calibration with scale 1 and offset 0
   */
  public static Calibration identity(String unit) {
    return new Calibration(1d, 0d, unit, Map.of());
  }

  /**
   * Looks up a named parameter.
   *
   * @param name parameter name
   * @return parameter value when present
   */
  public OptionalDouble parameter(String name) {
    Double value = parameters.get(name);
    return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
  }

  /**
   * Resolves the effective unit for the supplied modality.
   *
   * @param modality modality of the stream
   * @return explicit unit when configured, otherwise the modality default
   */
  public String unitFor(Modality modality) {
    return unit.isEmpty() ? modality.defaultUnit() : unit;
  }
}
