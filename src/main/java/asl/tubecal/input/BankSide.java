package asl.tubecal.input;

/**
 * The two detector banks of the instrument. The rear bank sits on the beam axis and uses no
 * transverse offset when strip edges are calculated; the front bank is displaced sideways by
 * a configured side offset.
 */
public enum BankSide {

  REAR("rear", "Rear_Det_Z"),
  FRONT("front", "Front_Det_Z");

  private final String detectorName;
  private final String distanceLogName;

  BankSide(String detectorName, String distanceLogName) {
    this.detectorName = detectorName;
    this.distanceLogName = distanceLogName;
  }

  /**
   * Get the side matching the rear-detector flag of a configuration
   *
   * @param rear True if the rear bank is being calibrated
   * @return REAR if rear is set, FRONT otherwise
   */
  public static BankSide fromRearFlag(boolean rear) {
    return rear ? REAR : FRONT;
  }

  /**
   * Name used to prefix tube names in this bank (i.e., "rear-detector/left12")
   *
   * @return detector name
   */
  public String getDetectorName() {
    return detectorName;
  }

  /**
   * Name of the run log entry holding the sample-to-detector distance for this bank
   *
   * @return log name used in error messages when the distance is missing
   */
  public String getDistanceLogName() {
    return distanceLogName;
  }

  /**
   * Transverse offset applied to strip edges on this bank. Only the front bank uses the
   * configured value; the rear bank is always centred.
   *
   * @param configuredOffset side offset given in the configuration (metres)
   * @return offset to apply to calculated edges (metres)
   */
  public double sideOffset(double configuredOffset) {
    return this == FRONT ? configuredOffset : 0.;
  }

}
