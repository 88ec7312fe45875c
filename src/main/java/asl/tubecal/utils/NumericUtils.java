package asl.tubecal.utils;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;

/**
 * Numeric helper functions shared by the calibration and reporting code
 */
public class NumericUtils {

  /**
   * Resolutions at or below this magnitude are treated as fits that did not use the edge-width
   * parameter and are left out of averages
   */
  public static final double NEGLIGIBLE_RESOLUTION = 1E-6;

  public static final ThreadLocal<DecimalFormat> DECIMAL_FORMAT =
      ThreadLocal.withInitial(() -> {
        DecimalFormat format = new DecimalFormat("#.###");
        setInfinityPrintable(format);
        return format;
      });

  /**
   * Mean of the magnitudes of the values that are not negligibly small
   *
   * @param values Values to average
   * @return mean of |v| over values with |v| > 1E-6, or 0 if there are none
   */
  public static double meanSignificantMagnitude(double[] values) {
    double sum = 0.;
    int count = 0;
    for (double value : values) {
      double magnitude = Math.abs(value);
      if (magnitude > NEGLIGIBLE_RESOLUTION) {
        sum += magnitude;
        ++count;
      }
    }
    return count == 0 ? 0. : sum / count;
  }

  /**
   * Per-tube shift of the expected strip edges, modelling strips that are not quite parallel to
   * the tubes. The last tube is unshifted and the first is shifted by the full offset in the
   * opposite direction, with tubes in between interpolated linearly.
   *
   * @param tubeIndex Index of the tube in the bank
   * @param numTubes Number of tubes in the bank
   * @param verticalOffset Shift between the first and last tube (m)
   * @return shift to add to each known edge of the tube (m)
   */
  public static double tubeOffset(int tubeIndex, int numTubes, double verticalOffset) {
    if (numTubes < 2) {
      return 0.;
    }
    double last = numTubes - 1;
    return (tubeIndex - last) * verticalOffset / last;
  }

  /**
   * Sets a decimalformat object so that infinity can be printed instead of
   * some unicode character that doesn't render correctly.
   *
   * @param df DecimalFormat object to change the infinity symbol value of
   */
  public static void setInfinityPrintable(DecimalFormat df) {
    DecimalFormatSymbols symbols = df.getDecimalFormatSymbols();
    symbols.setInfinity("Inf.");
    df.setDecimalFormatSymbols(symbols);
  }
}
