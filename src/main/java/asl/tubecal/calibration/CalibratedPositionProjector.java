package asl.tubecal.calibration;

import asl.tubecal.input.TubeId;
import asl.tubecal.output.CalibrationRow;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.log4j.Logger;

/**
 * Places the pixels of a tube at their corrected positions. Pixels are laid out along the line
 * through the tube's first and last detectors, measured from the tube centre. The X coordinate
 * of the centre is taken as zero, as the tubes of these banks run along X and are centred on the
 * beam.
 */
public class CalibratedPositionProjector {

  private static final Logger logger = Logger.getLogger(CalibratedPositionProjector.class);

  /**
   * Project corrected positions into 3D
   *
   * @param tube Tube being placed, used to label failures
   * @param firstPosition Uncalibrated position of the first detector
   * @param lastPosition Uncalibrated position of the last detector
   * @param corrected Corrected position (m) of each pixel, relative to the tube centre
   * @param detectorIds Id of each pixel's detector
   * @return one row per detector, in pixel order
   * @throws DegenerateTubeException if the first and last detectors are at the same place
   */
  public List<CalibrationRow> project(TubeId tube, Vector3D firstPosition,
      Vector3D lastPosition, double[] corrected, int[] detectorIds)
      throws DegenerateTubeException {
    if (corrected.length != detectorIds.length) {
      throw new ArityMismatchException(tube + ": " + corrected.length
          + " corrected positions for " + detectorIds.length + " detectors");
    }
    double tubeLength = firstPosition.distance(lastPosition);
    if (tubeLength <= 0.) {
      throw new DegenerateTubeException(tube, "zero length tube cannot be calibrated");
    }
    Vector3D unitVector = lastPosition.subtract(firstPosition).scalarMultiply(1. / tubeLength);
    Vector3D midpoint = firstPosition.add(lastPosition).scalarMultiply(0.5);
    Vector3D centre = new Vector3D(0., midpoint.getY(), midpoint.getZ());
    logger.debug(tube + ": centre=" + centre + ", unit vector=" + unitVector);

    List<CalibrationRow> rows = new ArrayList<>(detectorIds.length);
    for (int i = 0; i < detectorIds.length; ++i) {
      Vector3D position = centre.add(corrected[i], unitVector);
      rows.add(new CalibrationRow(detectorIds[i], position));
    }
    return rows;
  }
}
