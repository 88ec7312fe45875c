package asl.tubecal.output;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/**
 * New position of a single detector
 */
public class CalibrationRow {

  private final int detectorId;
  private final Vector3D position;

  public CalibrationRow(int detectorId, Vector3D position) {
    this.detectorId = detectorId;
    this.position = position;
  }

  public int getDetectorId() {
    return detectorId;
  }

  /**
   * @return calibrated position in metres
   */
  public Vector3D getPosition() {
    return position;
  }

  @Override
  public String toString() {
    return detectorId + " " + position.getX() + " " + position.getY() + " " + position.getZ();
  }
}
