package io.tessera.conv.application.mapping;

import io.tessera.conv.domain.error.SchemaMismatchException;
import io.tessera.conv.domain.session.Calibration;
import io.tessera.conv.domain.session.Modality;
import io.tessera.conv.domain.session.StreamDescriptor;
import io.tessera.conv.domain.source.DataType;
import io.tessera.conv.domain.source.DatasetDescriptor;

/**
 * Maps integer ADC codes to volts ({@code code * scale + offset}). Codes sitting on either rail of the
 * element type are clipped and flagged invalid.
 *
 * @since 0.1.0
 */
public final class ElectrophysiologyMapper extends AbstractModalityMapper {

  @Override
  public Modality modality() {
    return Modality.ELECTROPHYSIOLOGY;
  }

  @Override
  protected void checkDataset(StreamDescriptor stream, DatasetDescriptor samples) throws SchemaMismatchException {
    if (!samples.type().integral()) {
      throw new SchemaMismatchException(stream.name(),
          "electrophysiology dataset " + samples.path() + " must hold integer ADC codes (was " + samples.type() + ")");
    }
  }

  @Override
  protected boolean rawValid(double raw, DataType type) {
    return raw > type.minValue() && raw < type.maxValue();
  }

  @Override
  protected double calibrate(double raw, Calibration calibration) {
    return linear(raw, calibration);
  }
}
