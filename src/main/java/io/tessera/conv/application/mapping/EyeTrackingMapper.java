package io.tessera.conv.application.mapping;

import io.tessera.conv.domain.error.SchemaMismatchException;
import io.tessera.conv.domain.session.Calibration;
import io.tessera.conv.domain.session.Modality;
import io.tessera.conv.domain.session.StreamDescriptor;
import io.tessera.conv.domain.source.DataType;
import io.tessera.conv.domain.source.DatasetDescriptor;
import java.util.OptionalDouble;

/**
 * Maps gaze positions in screen pixels to degrees of visual angle:
 * {@code deg = toDegrees(atan((raw * scale + offset) / viewing_distance))}, where the linear term converts
 * pixels into the unit of {@code viewing_distance}. Blinks and lost tracking arrive as NaN and are invalid.
 *
 * @since 0.1.0
 */
public final class EyeTrackingMapper extends AbstractModalityMapper {
  /** Calibration parameter holding the eye-to-screen distance. */
  public static final String VIEWING_DISTANCE = "viewing_distance";

  @Override
  public Modality modality() {
    return Modality.EYE_TRACKING;
  }

  @Override
  protected void checkDataset(StreamDescriptor stream, DatasetDescriptor samples) throws SchemaMismatchException {
    OptionalDouble distance = stream.calibration().parameter(VIEWING_DISTANCE);
    if (distance.isEmpty() || !Double.isFinite(distance.getAsDouble()) || distance.getAsDouble() <= 0d) {
      throw new SchemaMismatchException(stream.name(),
          "eye tracking requires a positive calibration parameter " + VIEWING_DISTANCE);
    }
  }

  @Override
  protected boolean rawValid(double raw, DataType type) {
    return Double.isFinite(raw);
  }

  @Override
  protected double calibrate(double raw, Calibration calibration) {
    double distance = calibration.parameter(VIEWING_DISTANCE).orElse(Double.NaN);
    return Math.toDegrees(Math.atan(linear(raw, calibration) / distance));
  }
}
