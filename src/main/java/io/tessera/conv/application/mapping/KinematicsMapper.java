package io.tessera.conv.application.mapping;

import io.tessera.conv.domain.session.Calibration;
import io.tessera.conv.domain.session.Modality;
import io.tessera.conv.domain.source.DataType;

/**
 * Maps tracked positions to meters ({@code raw * scale + offset}); NaN and infinite positions are invalid.
 *
 * @since 0.1.0
 */
public final class KinematicsMapper extends AbstractModalityMapper {

  @Override
  public Modality modality() {
    return Modality.KINEMATICS;
  }

  @Override
  protected boolean rawValid(double raw, DataType type) {
    return Double.isFinite(raw);
  }

  @Override
  protected double calibrate(double raw, Calibration calibration) {
    return linear(raw, calibration);
  }
}
