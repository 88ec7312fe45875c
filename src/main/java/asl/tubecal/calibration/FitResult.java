package asl.tubecal.calibration;

import asl.tubecal.utils.NumericUtils;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Refined positions of all the strip features of one tube, in the order they were fit
 */
public class FitResult {

  private final List<PeakFit> peaks;

  public FitResult(List<PeakFit> peaks) {
    this.peaks = Collections.unmodifiableList(new ArrayList<>(peaks));
  }

  public List<PeakFit> getPeaks() {
    return peaks;
  }

  public int size() {
    return peaks.size();
  }

  /**
   * @return fitted positions in pixels
   */
  public double[] getPositions() {
    double[] out = new double[peaks.size()];
    for (int i = 0; i < out.length; ++i) {
      out[i] = peaks.get(i).getPosition();
    }
    return out;
  }

  public double[] getResolutions() {
    double[] out = new double[peaks.size()];
    for (int i = 0; i < out.length; ++i) {
      out[i] = peaks.get(i).getResolution();
    }
    return out;
  }

  /**
   * Mean resolution of the tube, the tube's cvalue
   *
   * @return mean of the resolutions that are not vanishingly small, or 0 if there are none
   */
  public double getMeanResolution() {
    return NumericUtils.meanSignificantMagnitude(getResolutions());
  }

  /**
   * Result of a single fit: the refined position, the resolution, and the fitted model over
   * the pixels of the fit window (kept for diagnostics)
   */
  public static class PeakFit {

    private final double guess;
    private final double position;
    private final double resolution;
    private final double[] windowPixels;
    private final double[] fittedCounts;

    public PeakFit(double guess, double position, double resolution, double[] windowPixels,
        double[] fittedCounts) {
      this.guess = guess;
      this.position = position;
      this.resolution = resolution;
      this.windowPixels = windowPixels.clone();
      this.fittedCounts = fittedCounts.clone();
    }

    public double getGuess() {
      return guess;
    }

    public double getPosition() {
      return position;
    }

    public double getResolution() {
      return resolution;
    }

    public double[] getWindowPixels() {
      return windowPixels.clone();
    }

    public double[] getFittedCounts() {
      return fittedCounts.clone();
    }
  }
}
