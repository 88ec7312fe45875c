package asl.tubecal.calibration;

/**
 * Internal consistency failure: a per-pixel array does not have one entry per detector.
 */
public class ArityMismatchException extends IllegalStateException {

  public ArityMismatchException(String message) {
    super(message);
  }
}
