package asl.tubecal.calibration;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import asl.tubecal.input.BankSide;
import asl.tubecal.input.CalibrationConfiguration;
import asl.tubecal.input.StripMeasurement;
import asl.tubecal.test.TestUtils;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;

public class StripEdgeCalculatorTest {

  @Test
  public void stripAtBeamCentreHasNoParallax() {
    StripEdgeCalculator calculator = new StripEdgeCalculator(new CalibrationConfiguration());
    // -(270 - 520.7) / 1000
    assertEquals(0.2507, calculator.computeEdge(270., 270., 23000., 0.), 1E-12);
  }

  @Test
  public void parallaxShiftsEdges() throws ConfigurationException {
    StripEdgeCalculator calculator = new StripEdgeCalculator(TestUtils.createConfiguration(false));
    StripMeasurement measurement = new StripMeasurement("run", 200, new double[1],
        BankSide.REAR, 10000., 1.);
    EdgePair pair = calculator.computeEdges(measurement);
    assertEquals(0.2004209, pair.getLeft(), 1E-6);
    assertEquals(0.3006313, pair.getRight(), 1E-6);
  }

  @Test
  public void overrideUsedForRearBank() throws ConfigurationException {
    CalibrationConfiguration config = new CalibrationConfiguration();
    StripEdgeCalculator calculator = new StripEdgeCalculator(config);
    StripMeasurement measurement = new StripMeasurement("run", 260, new double[1],
        BankSide.REAR, 23000., 1.);
    EdgePair pair = calculator.computeEdges(measurement);
    double expectedRight = calculator.computeEdge(260., 470., 23000., 0.);
    assertEquals(expectedRight, pair.getRight(), 1E-15);
    assertTrue(pair.getLeft() < pair.getRight());
  }

  @Test
  public void frontBankAddsSideOffset() throws ConfigurationException {
    CalibrationConfiguration config = new CalibrationConfiguration();
    config.setRearDetector(false);
    config.setSideOffset(-0.1);
    StripEdgeCalculator calculator = new StripEdgeCalculator(config);
    StripMeasurement front = new StripMeasurement("run", 425, new double[1],
        BankSide.FRONT, 5000., 1.);
    double withoutOffset = calculator.computeEdge(425., 270., 5000., 0.);
    assertEquals(withoutOffset - 0.1, calculator.computeEdges(front).getRight(), 1E-12);
  }

  @Test
  public void increasingPositionsGiveDecreasingEdges() throws ConfigurationException {
    CalibrationConfiguration config = new CalibrationConfiguration();
    StripEdgeCalculator calculator = new StripEdgeCalculator(config);
    double previous = Double.POSITIVE_INFINITY;
    for (int position : new int[]{5, 95, 425, 590, 755, 920, 1040}) {
      EdgePair pair = calculator.computeEdges(new StripMeasurement("run", position,
          new double[1], BankSide.REAR, 23281., 1.));
      assertTrue(pair.getRight() < previous);
      assertTrue(pair.getLeft() < pair.getRight());
      previous = pair.getLeft();
    }
  }

  @Test(expected = ConfigurationException.class)
  public void missingDistanceRejected() throws ConfigurationException {
    StripEdgeCalculator calculator = new StripEdgeCalculator(new CalibrationConfiguration());
    calculator.computeEdges(new StripMeasurement("run", 425, new double[1], BankSide.REAR,
        null, 1.));
  }

  @Test
  public void allEdgesKeepInputOrder() throws ConfigurationException {
    CalibrationConfiguration config = TestUtils.createConfiguration(false);
    List<StripMeasurement> measurements =
        TestUtils.createMeasurements(config, TestUtils.createBank());
    StripEdgeCalculator calculator = new StripEdgeCalculator(config);
    List<StripShadow> shadows = calculator.computeAllEdges(measurements);
    assertEquals(3, shadows.size());
    for (int i = 0; i < shadows.size(); ++i) {
      assertSame(measurements.get(i), shadows.get(i).getMeasurement());
      assertEquals(calculator.computeEdges(measurements.get(i)), shadows.get(i).getEdges());
    }
  }

  @Test
  public void repeatedMeasurementKeepsBothEntries() throws ConfigurationException {
    CalibrationConfiguration config = TestUtils.createConfiguration(false);
    StripMeasurement measurement =
        TestUtils.createMeasurements(config, TestUtils.createBank()).get(0);
    List<StripShadow> shadows = new StripEdgeCalculator(config)
        .computeAllEdges(Arrays.asList(measurement, measurement));
    assertEquals(2, shadows.size());
    assertEquals(shadows.get(0).getEdges(), shadows.get(1).getEdges());
  }
}
