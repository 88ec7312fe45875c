package asl.tubecal.input;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import org.junit.Test;

public class StripMeasurementTest {

  @Test
  public void rescaleToReferenceCharge() {
    StripMeasurement measurement = new StripMeasurement("SANS2D00028827", 425,
        new double[]{10., 20., 40.}, BankSide.REAR, 5000., 4.);
    StripMeasurement scaled = measurement.rescaledTo(2.);
    assertArrayEquals(new double[]{5., 10., 20.}, scaled.getCounts(), 1E-12);
    assertEquals(2., scaled.getIntensityNormalisation(), 0.);
    assertEquals(425, scaled.getStripPosition());
    // original is left as it was
    assertArrayEquals(new double[]{10., 20., 40.}, measurement.getCounts(), 0.);
  }

  @Test
  public void distanceIsOptional() {
    StripMeasurement measurement = new StripMeasurement("run", 5, new double[1],
        BankSide.FRONT, null, 1.);
    assertFalse(measurement.hasSampleToDetectorDistance());
  }

  @Test(expected = IllegalArgumentException.class)
  public void nameIsRequired() {
    new StripMeasurement(null, 5, new double[1], BankSide.REAR, 1., 1.);
  }
}
