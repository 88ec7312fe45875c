package asl.tubecal.calibration;

import asl.tubecal.input.TubeId;

/**
 * The first and last detectors of a tube coincide, so the tube has no direction.
 */
public class DegenerateTubeException extends TubeCalibrationException {

  public DegenerateTubeException(TubeId tube, String message) {
    super(tube, message);
  }
}
