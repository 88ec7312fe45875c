package asl.tubecal.calibration;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class FitModeTest {

  @Test
  public void peakModePairsEdges() {
    assertArrayEquals(new double[]{2., 7.},
        FitMode.FLAT_TOP_PEAK.combine(new double[]{1., 3., 5., 9.}), 0.);
  }

  @Test(expected = IllegalArgumentException.class)
  public void peakModeRejectsOddEdgeCount() {
    FitMode.FLAT_TOP_PEAK.combine(new double[]{1., 3., 5.});
  }

  @Test
  public void edgeModeKeepsEdges() {
    double[] edges = {1., 3., 5.};
    double[] combined = FitMode.EDGES.combine(edges);
    assertArrayEquals(edges, combined, 0.);
    assertNotSame(edges, combined);
  }

  @Test
  public void peakWindowAndSeeds() {
    double[] counts = new double[100];
    for (int i = 0; i < counts.length; ++i) {
      counts[i] = i == 50 ? 1010. : 500.;
    }
    FitParameters params = new FitParameters(25, 10., 10., 6., 10., null, null, 1000);
    FitMode.FitSetup setup = FitMode.FLAT_TOP_PEAK.setUp(counts, 50.5, params);
    assertEquals(15, setup.first);
    assertEquals(85, setup.last);
    assertArrayEquals(new double[]{1000., 50.5, 6., 70. / 3.}, setup.seed, 1E-12);
    assertTrue(setup.function instanceof FlatTopPeakFunction);
  }

  @Test
  public void configuredSeedsWin() {
    FitParameters params = new FitParameters(25, 10., 10., 6., 10., 400., 30., 1000);
    FitMode.FitSetup setup = FitMode.FLAT_TOP_PEAK.setUp(new double[100], 50., params);
    assertEquals(400., setup.seed[0], 0.);
    assertEquals(30., setup.seed[3], 0.);
  }

  @Test
  public void edgeWindowFollowsSlope() {
    double[] falling = new double[60];
    for (int i = 0; i < falling.length; ++i) {
      falling[i] = i < 30 ? 1000. : 10.;
    }
    FitParameters params = new FitParameters(5, 8., 3., 2., 10., null, null, 1000);
    FitMode.FitSetup setup = FitMode.EDGES.setUp(falling, 30., params);
    // descending: outer side before the edge
    assertEquals(22, setup.first);
    assertEquals(33, setup.last);
    assertEquals(-2., setup.seed[2], 0.);
    assertEquals(10., setup.seed[3], 0.);
    assertEquals(495., setup.seed[0], 0.);

    double[] rising = new double[60];
    for (int i = 0; i < rising.length; ++i) {
      rising[i] = i < 30 ? 10. : 1000.;
    }
    setup = FitMode.EDGES.setUp(rising, 30., params);
    assertEquals(27, setup.first);
    assertEquals(38, setup.last);
    assertEquals(2., setup.seed[2], 0.);
  }

  @Test
  public void edgeWindowTooSmall() {
    FitParameters params = new FitParameters(0, 8., 3., 2., 10., null, null, 1000);
    assertNull(FitMode.EDGES.setUp(new double[10], 5., params));
  }
}
