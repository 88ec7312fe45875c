package asl.tubecal.test;

import asl.tubecal.calibration.ConfigurationException;
import asl.tubecal.calibration.EdgePair;
import asl.tubecal.calibration.StripEdgeCalculator;
import asl.tubecal.input.BankSide;
import asl.tubecal.input.CalibrationConfiguration;
import asl.tubecal.input.DetectorBank;
import asl.tubecal.input.StripMeasurement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.apache.commons.math3.special.Erf;

/**
 * Synthetic strip scans over a small regular bank. Three strips are placed so that their shadows
 * fall on separate parts of a 1 m tube, each shadow being a flat-bottomed dip blurred by about one
 * pixel.
 */
public class TestUtils {

  public static final String TEST_DATA_LOCATION = "src/test/resources/";

  public static final int NUM_TUBES = 4;
  public static final int PIXELS_PER_TUBE = 128;
  public static final double TUBE_LENGTH = 1.0;
  public static final double TUBE_SPACING = 0.01;
  public static final double BANK_Z = 5.0;
  public static final int FIRST_DETECTOR_ID = 1000;

  public static final Integer[] STRIP_POSITIONS = {200, 450, 700};
  public static final double BACKGROUND = 10.;
  public static final double HEIGHT = 1000.;
  public static final double SAMPLE_TO_DETECTOR = 10000.;
  // one pixel of the synthetic tube
  public static final double BLUR = TUBE_LENGTH / (PIXELS_PER_TUBE - 1);

  public static DetectorBank createBank() {
    return DetectorBank.createRegularBank(BankSide.REAR, NUM_TUBES, PIXELS_PER_TUBE,
        TUBE_LENGTH, TUBE_SPACING, BANK_Z, FIRST_DETECTOR_ID);
  }

  /**
   * Configuration matching the synthetic scans
   *
   * @param fitEdges true to fit edges, false to fit flat-top peaks
   * @return new configuration
   */
  public static CalibrationConfiguration createConfiguration(boolean fitEdges) {
    CalibrationConfiguration config = new CalibrationConfiguration();
    config.setStripPositions(Arrays.asList(STRIP_POSITIONS));
    config.setStripWidth(100.);
    config.setStripToTubeCentre(21.);
    config.setHalfDetectorWidth(500.);
    config.setEncoderAtBeamCentre(500.);
    config.setEncoderOverrides(Collections.<Integer, Double>emptyMap());
    config.setRearDetector(true);
    config.setVerticalOffset(0.);
    config.setThreshold(400.);
    config.setStartingPixel(5);
    config.setEndingPixel(122);
    config.setFitEdges(fitEdges);
    config.setMargin(5);
    config.setOutEdge(fitEdges ? 6. : 10.);
    config.setInEdge(fitEdges ? 6. : 10.);
    config.setEdgeWidth(1.);
    config.setBackground(BACKGROUND);
    return config;
  }

  /**
   * Counts of a detector lying at x under a strip shadow spanning [left, right]
   */
  public static double shadow(double x, double left, double right) {
    double inLeft = 0.5 * Erf.erfc((left - x) / BLUR);
    double inRight = 0.5 * Erf.erfc((x - right) / BLUR);
    return BACKGROUND + HEIGHT * (1. - inLeft * inRight);
  }

  /**
   * Build one measurement per configured strip position. Each run gets a different proton
   * charge, with its counts scaled to match.
   *
   * @param config Configuration giving strip geometry
   * @param bank Bank to produce counts for
   * @param unshadowedTubes Tubes that see no shadow in any run
   * @return measurements in configured order
   * @throws ConfigurationException never, as every measurement has a distance
   */
  public static List<StripMeasurement> createMeasurements(CalibrationConfiguration config,
      DetectorBank bank, int... unshadowedTubes) throws ConfigurationException {
    StripEdgeCalculator calculator = new StripEdgeCalculator(config);
    List<StripMeasurement> out = new ArrayList<>();
    List<Integer> positions = config.getStripPositions();
    for (int i = 0; i < positions.size(); ++i) {
      double charge = 1. + 0.5 * i;
      String name = "SANS2D000" + (1000 + i);
      StripMeasurement unscaled = new StripMeasurement(name, positions.get(i),
          new double[bank.getNumberOfDetectors()], bank.getSide(), SAMPLE_TO_DETECTOR, charge);
      EdgePair edges = calculator.computeEdges(unscaled);

      double[] counts = new double[bank.getNumberOfDetectors()];
      for (int j = 0; j < counts.length; ++j) {
        int tube = j / bank.getPixelsPerTube();
        boolean blank = false;
        for (int skipped : unshadowedTubes) {
          blank |= skipped == tube;
        }
        double value = blank ? BACKGROUND + HEIGHT
            : shadow(bank.getBasePosition(j).getX(), edges.getLeft(), edges.getRight());
        counts[j] = value * charge;
      }
      out.add(new StripMeasurement(name, positions.get(i), counts, bank.getSide(),
          SAMPLE_TO_DETECTOR, charge));
    }
    return out;
  }
}
