package asl.tubecal.calibration;

import org.apache.commons.math3.special.Erf;

/**
 * Step between two count levels, {@code A * erfc((B - x) / C) + D}. B is the position of the
 * edge and |C| its width; a negative C makes the step fall rather than rise.
 */
public class EndErfcFunction extends FitFunction {

  @Override
  public String getName() {
    return "EndErfc";
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
    double a = params[0];
    double b = params[1];
    double c = params[2];
    double d = params[3];
    return a * Erf.erfc((b - x) / c) + d;
  }
}
