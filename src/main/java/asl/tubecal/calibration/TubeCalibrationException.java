package asl.tubecal.calibration;

import asl.tubecal.input.TubeId;

/**
 * Failure to calibrate a single tube. Whether this ends the run or only skips the tube is
 * decided by the skip-tubes-on-error setting of the run.
 */
public abstract class TubeCalibrationException extends CalibrationException {

  private final TubeId tube;

  TubeCalibrationException(TubeId tube, String message) {
    super(tube + ": " + message);
    this.tube = tube;
  }

  TubeCalibrationException(TubeId tube, String message, Throwable cause) {
    super(tube + ": " + message, cause);
    this.tube = tube;
  }

  /**
   * @return tube that could not be calibrated
   */
  public TubeId getTube() {
    return tube;
  }
}
