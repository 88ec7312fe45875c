package asl.tubecal.output;

import asl.tubecal.calibration.FitResult;
import asl.tubecal.input.TubeId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * Plot data describing how the calibration of one tube went: the tube's count profile, the
 * fitted models over each fit window, the difference between each known position and the
 * uncalibrated position of its fitted pixel, and how far every pixel moved.
 * Positions in the residual and shift plots are in mm.
 */
public class TubeDiagnostics {

  private final TubeId tube;
  private final XYSeriesCollection profile;
  private final XYSeriesCollection fits;
  private final XYSeriesCollection residuals;
  private final XYSeriesCollection shifts;

  private TubeDiagnostics(TubeId tube, XYSeriesCollection profile, XYSeriesCollection fits,
      XYSeriesCollection residuals, XYSeriesCollection shifts) {
    this.tube = tube;
    this.profile = profile;
    this.fits = fits;
    this.residuals = residuals;
    this.shifts = shifts;
  }

  /**
   * Build the diagnostic plots of a calibrated tube
   *
   * @param tube Tube that was calibrated
   * @param counts Counts of the tube's pixels
   * @param fitResult Fits of the tube's strip features
   * @param knownPositions Known position (m) of each fitted feature
   * @param baseX Uncalibrated X coordinate (m) of each pixel
   * @param rows Calibrated positions of each pixel
   * @return diagnostic plot data
   */
  public static TubeDiagnostics build(TubeId tube, double[] counts, FitResult fitResult,
      double[] knownPositions, double[] baseX, List<CalibrationRow> rows) {
    String suffix = tube.getDiagnosticSuffix();

    XYSeries tubeSeries = new XYSeries("Tube" + suffix);
    for (int i = 0; i < counts.length; ++i) {
      tubeSeries.add(i, counts[i]);
    }
    XYSeriesCollection profile = new XYSeriesCollection(tubeSeries);

    XYSeriesCollection fits = new XYSeriesCollection();
    List<FitResult.PeakFit> peaks = fitResult.getPeaks();
    for (int i = 0; i < peaks.size(); ++i) {
      FitResult.PeakFit peak = peaks.get(i);
      XYSeries fitSeries = new XYSeries("Fit" + suffix + " [" + i + "]");
      double[] pixels = peak.getWindowPixels();
      double[] fitted = peak.getFittedCounts();
      for (int j = 0; j < pixels.length; ++j) {
        fitSeries.add(pixels[j], fitted[j]);
      }
      fits.addSeries(fitSeries);
    }

    // pair each sorted fitted position with its known position
    double[] positions = fitResult.getPositions();
    Arrays.sort(positions);
    XYSeries dataSeries = new XYSeries("Data" + suffix, true, true);
    for (int i = 0; i < positions.length && i < knownPositions.length; ++i) {
      double nominal = interpolate(baseX, positions[i]) * 1000.;
      dataSeries.add(nominal, knownPositions[i] * 1000. - nominal);
    }
    XYSeriesCollection residuals = new XYSeriesCollection(dataSeries);

    XYSeries shiftSeries = new XYSeries("Shift" + suffix, true, true);
    for (int i = 0; i < rows.size() && i < baseX.length; ++i) {
      double reference = baseX[i] * 1000.;
      shiftSeries.add(reference, rows.get(i).getPosition().getX() * 1000. - reference);
    }
    XYSeriesCollection shifts = new XYSeriesCollection(shiftSeries);

    return new TubeDiagnostics(tube, profile, fits, residuals, shifts);
  }

  /**
   * Linear interpolation into per-pixel values at a fractional pixel, clamped to the tube
   */
  static double interpolate(double[] values, double pixel) {
    if (pixel <= 0) {
      return values[0];
    }
    if (pixel >= values.length - 1) {
      return values[values.length - 1];
    }
    int low = (int) Math.floor(pixel);
    double fraction = pixel - low;
    if (fraction == 0.) {
      return values[low];
    }
    return values[low] * (1. - fraction) + values[low + 1] * fraction;
  }

  public TubeId getTube() {
    return tube;
  }

  /**
   * @return name grouping this tube's diagnostics, e.g. "Tube_007"
   */
  public String getName() {
    return String.format("Tube_%03d", tube.getId());
  }

  public XYSeriesCollection getProfile() {
    return profile;
  }

  public XYSeriesCollection getFits() {
    return fits;
  }

  public XYSeriesCollection getResiduals() {
    return residuals;
  }

  public XYSeriesCollection getShifts() {
    return shifts;
  }

  /**
   * @return all plots, in the order profile, fits, residuals, shifts
   */
  public List<XYSeriesCollection> asList() {
    List<XYSeriesCollection> out = new ArrayList<>();
    out.add(profile);
    out.add(fits);
    out.add(residuals);
    out.add(shifts);
    return out;
  }
}
