package asl.tubecal.calibration;

import asl.tubecal.input.TubeId;

public class FitConvergenceException extends TubeCalibrationException {

  public FitConvergenceException(TubeId tube, String message) {
    super(tube, message);
  }

  public FitConvergenceException(TubeId tube, String message, Throwable cause) {
    super(tube, message, cause);
  }
}
