package asl.tubecal.calibration;

/**
 * Thrown when the configuration or the supplied measurements cannot describe a valid run, such
 * as missing geometry metadata or a mismatch between strip positions and measurements. Always
 * fatal and raised before any tube is processed.
 */
public class ConfigurationException extends CalibrationException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
