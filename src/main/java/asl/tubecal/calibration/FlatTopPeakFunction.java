package asl.tubecal.calibration;

import org.apache.commons.math3.special.Erf;

/**
 * Shadow of a strip: a flat-bottomed dip in the counts, with error-function shaped sides.
 * Parameters are, in order, the depth of the dip, its centre, the width of its sloping sides and
 * the width of the shadow. The level at the bottom of the dip is fixed.
 */
public class FlatTopPeakFunction extends FitFunction {

  private final double background;

  /**
   * @param background Counts at the bottom of the shadow
   */
  public FlatTopPeakFunction(double background) {
    this.background = background;
  }

  public double getBackground() {
    return background;
  }

  @Override
  public String getName() {
    return "FlatTopPeak";
  }

  @Override
  public int getParameterCount() {
    return 4;
  }

  @Override
  public int getCentreIndex() {
    return 1;
  }

  @Override
  public int getResolutionIndex() {
    return 2;
  }

  @Override
  public double value(double x, double[] params) {
    double height = params[0];
    double centre = params[1];
    double endGrad = Math.abs(params[2]);
    double width = Math.abs(params[3]);
    double lowerEdge = centre - width / 2.;
    double upperEdge = centre + width / 2.;
    // 1 inside the shadow, 0 well outside it
    double plateau = 0.5 * Erf.erfc((lowerEdge - x) / endGrad)
        * 0.5 * Erf.erfc((x - upperEdge) / endGrad);
    return background + height * (1. - plateau);
  }
}
