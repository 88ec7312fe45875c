package asl.tubecal.calibration;

/**
 * Thrown when the accumulated calibration table cannot be applied to the detector bank.
 */
public class CalibrationApplyException extends CalibrationException {

  public CalibrationApplyException(String message) {
    super(message);
  }
}
