package asl.tubecal.calibration;

import asl.tubecal.input.TubeId;

/**
 * Too few fitted positions fell inside the tube to fit the position correction.
 */
public class InsufficientDataException extends TubeCalibrationException {

  public InsufficientDataException(TubeId tube, String message) {
    super(tube, message);
  }
}
