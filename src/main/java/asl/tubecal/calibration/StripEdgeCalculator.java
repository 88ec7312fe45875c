package asl.tubecal.calibration;

import asl.tubecal.input.BankSide;
import asl.tubecal.input.CalibrationConfiguration;
import asl.tubecal.input.StripMeasurement;
import java.util.ArrayList;
import java.util.List;
import org.apache.log4j.Logger;

/**
 * Converts the encoder position of a strip into the real-space positions of the edges of its
 * shadow on the detector. The strip sits in front of the tubes, so the shadow is shifted by
 * parallax in proportion to the strip's distance from the beam centre.
 *
 * Encoder values and strip dimensions are in mm; resulting edges are in metres along the tube
 * axis. Larger encoder values give smaller edge coordinates.
 */
public class StripEdgeCalculator {

  private static final Logger logger = Logger.getLogger(StripEdgeCalculator.class);

  private final CalibrationConfiguration config;

  public StripEdgeCalculator(CalibrationConfiguration config) {
    this.config = config;
  }

  /**
   * Position of a single strip edge
   *
   * @param encoder Encoder reading of the edge
   * @param encoderAtBeamCentre Reference encoder reading at the beam centre
   * @param sampleToDetectorDistance Sample to detector distance (mm)
   * @param sideOffset Offset of the bank (m)
   * @return real-space position of the edge (m)
   */
  public double computeEdge(double encoder, double encoderAtBeamCentre,
      double sampleToDetectorDistance, double sideOffset) {
    double stripToTube = config.getStripToTubeCentre();
    double distFromBeam = encoderAtBeamCentre - encoder;
    double parallaxShift = distFromBeam * stripToTube / (stripToTube - sampleToDetectorDistance);
    return -(encoder + parallaxShift - config.getHalfDetectorWidth()) / 1000. + sideOffset;
  }

  /**
   * Both edges of the shadow cast in a measurement. The left edge comes from the far side of the
   * strip (encoder + strip width), the right edge from the encoder position itself.
   *
   * @param measurement Measurement to get the shadow edges of
   * @return pair of edges (m)
   * @throws ConfigurationException if the measurement has no sample to detector distance
   */
  public EdgePair computeEdges(StripMeasurement measurement) throws ConfigurationException {
    if (!measurement.hasSampleToDetectorDistance()) {
      throw new ConfigurationException("Measurement " + measurement.getName()
          + " does not record a sample to detector distance ("
          + measurement.getBankSide().getDistanceLogName() + ")");
    }
    int position = measurement.getStripPosition();
    double reference = config.getEncoderAtBeamCentre(position);
    double distance = measurement.getSampleToDetectorDistance();
    BankSide side = measurement.getBankSide();
    double sideOffset = side.sideOffset(config.getSideOffset());

    double left = computeEdge(position + config.getStripWidth(), reference, distance, sideOffset);
    double right = computeEdge(position, reference, distance, sideOffset);
    return new EdgePair(left, right);
  }

  /**
   * Compute edges of every measurement
   *
   * @param measurements Measurements to process
   * @return each measurement with its edges, in the order given
   * @throws ConfigurationException if any measurement lacks geometry metadata
   */
  public List<StripShadow> computeAllEdges(List<StripMeasurement> measurements)
      throws ConfigurationException {
    List<StripShadow> shadows = new ArrayList<>();
    for (StripMeasurement measurement : measurements) {
      StripShadow shadow = new StripShadow(measurement, computeEdges(measurement));
      shadows.add(shadow);
      logger.info("Strip at " + shadow);
    }
    return shadows;
  }
}
