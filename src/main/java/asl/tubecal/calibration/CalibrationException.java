package asl.tubecal.calibration;

/**
 * Base class of the failures a calibration run can report. Subclasses are split between fatal
 * errors, which end the run, and per-tube errors, which the run may skip over depending on
 * configuration.
 */
public class CalibrationException extends Exception {

  public CalibrationException(String message) {
    super(message);
  }

  public CalibrationException(String message, Throwable cause) {
    super(message, cause);
  }
}
