package io.tessera.conv.application.mapping;

import io.tessera.conv.domain.session.Calibration;
import io.tessera.conv.domain.session.Modality;
import io.tessera.conv.domain.source.DataType;

/**
 * Maps task event codes ({@code code * scale + offset}). Negative codes mark dropped events and, like
 * NaN, are invalid.
 *
 * @since 0.1.0
 */
public final class BehavioralMapper extends AbstractModalityMapper {

  @Override
  public Modality modality() {
    return Modality.BEHAVIORAL;
  }

  @Override
  protected boolean rawValid(double raw, DataType type) {
    return Double.isFinite(raw) && raw >= 0d;
  }

  @Override
  protected double calibrate(double raw, Calibration calibration) {
    return linear(raw, calibration);
  }
}
