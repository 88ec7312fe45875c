package asl.tubecal.calibration;

import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;

/**
 * Model of a tube's count profile near a strip edge or shadow, fit by least squares.
 * Implementations define the value of the model at a pixel for a given parameter vector; the
 * jacobian used by the solver is approximated through forward differences.
 */
public abstract class FitFunction implements ParameterValidator {

  private static final double STEP_FACTOR = 1E-7;

  /**
   * Smallest magnitude allowed for parameters that scale a distance in pixels
   */
  static final double MIN_SCALE = 1E-3;

  /**
   * @return name used to label plots of the fitted model
   */
  public abstract String getName();

  public abstract int getParameterCount();

  /**
   * @return index in the parameter vector of the fitted position
   */
  public abstract int getCentreIndex();

  /**
   * @return index in the parameter vector of the edge-sharpness parameter reported as the fit's
   * resolution
   */
  public abstract int getResolutionIndex();

  /**
   * Value of the model at a single point
   *
   * @param x Pixel position
   * @param params Model parameters
   * @return expected counts at the given position
   */
  public abstract double value(double x, double[] params);

  /**
   * Evaluate the model over a set of points
   *
   * @param xs Pixel positions
   * @param params Model parameters
   * @return expected counts at each position
   */
  public double[] evaluate(double[] xs, double[] params) {
    double[] out = new double[xs.length];
    for (int i = 0; i < xs.length; ++i) {
      out[i] = value(xs[i], params);
    }
    return out;
  }

  /**
   * Get the model and its jacobian over a fixed set of points, as used by the solver
   *
   * @param xs Pixel positions of the data being fit
   * @return function producing the model values and their derivatives for a parameter vector
   */
  public MultivariateJacobianFunction jacobian(final double[] xs) {
    return point -> jacobian(xs, point);
  }

  private Pair<RealVector, RealMatrix> jacobian(double[] xs, RealVector variables) {
    // approximate through forward differences
    double[] params = variables.toArray();
    double[] fInit = evaluate(xs, params);
    double[][] jacobian = new double[xs.length][params.length];

    for (int j = 0; j < params.length; ++j) {
      double[] shifted = params.clone();
      double step = STEP_FACTOR * Math.max(Math.abs(params[j]), 1.);
      shifted[j] += step;
      double[] diff = evaluate(xs, shifted);
      for (int i = 0; i < xs.length; ++i) {
        jacobian[i][j] = (diff[i] - fInit[i]) / step;
      }
    }

    RealMatrix jMat = MatrixUtils.createRealMatrix(jacobian);
    RealVector fnc = MatrixUtils.createRealVector(fInit);
    return new Pair<>(fnc, jMat);
  }

  /**
   * Keeps the resolution parameter away from zero, where the model is undefined. The sign of
   * the parameter is kept.
   *
   * @param params Parameters proposed by the solver
   * @return parameters the model can be evaluated at
   */
  @Override
  public RealVector validate(RealVector params) {
    int index = getResolutionIndex();
    double value = params.getEntry(index);
    if (Math.abs(value) < MIN_SCALE) {
      params.setEntry(index, value < 0 ? -MIN_SCALE : MIN_SCALE);
    }
    return params;
  }
}
