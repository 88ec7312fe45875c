package asl.tubecal.calibration;

/**
 * Progress of a tube calibration run. A run moves forward through the states in order and ends
 * in REPORTED on success or ABORTED on a fatal error.
 */
public enum CalibrationState {
  INIT,
  LOADED,
  MERGED,
  PER_TUBE_LOOP,
  CALIBRATED,
  REPORTED,
  ABORTED
}
