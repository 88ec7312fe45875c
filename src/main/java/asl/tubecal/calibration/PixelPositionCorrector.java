package asl.tubecal.calibration;

import asl.tubecal.input.TubeId;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.exception.ConvergenceException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.fitting.PolynomialCurveFitter;
import org.apache.commons.math3.fitting.WeightedObservedPoint;
import org.apache.log4j.Logger;

/**
 * Maps pixel indices of a tube onto real positions along it. A polynomial (quadratic unless
 * told otherwise) is fit through the pairs of fitted pixel position and known position, then
 * evaluated at every pixel. Fitted positions outside the tube are ignored.
 */
public class PixelPositionCorrector {

  public static final int DEFAULT_DEGREE = 2;

  private static final Logger logger = Logger.getLogger(PixelPositionCorrector.class);

  private final int degree;

  public PixelPositionCorrector() {
    this(DEFAULT_DEGREE);
  }

  public PixelPositionCorrector(int degree) {
    this.degree = degree;
  }

  /**
   * Fit the correction polynomial
   *
   * @param tube Tube being corrected, used to label failures
   * @param fittedPixels Fitted pixel positions of the strip features
   * @param knownPositions Real positions (m) of the same features
   * @param numPixels Number of pixels in the tube
   * @return correction polynomial, pixel index to position
   * @throws InsufficientDataException if fewer than degree + 1 fitted positions are inside the
   * tube
   * @throws FitConvergenceException if the polynomial fit fails
   */
  public PolynomialFunction fitCorrection(TubeId tube, double[] fittedPixels,
      double[] knownPositions, int numPixels)
      throws InsufficientDataException, FitConvergenceException {
    if (fittedPixels.length != knownPositions.length) {
      throw new ArityMismatchException(fittedPixels.length + " fitted positions for "
          + knownPositions.length + " known positions");
    }
    List<WeightedObservedPoint> observations = new ArrayList<>();
    List<Integer> missed = new ArrayList<>();
    for (int i = 0; i < fittedPixels.length; ++i) {
      if (fittedPixels[i] > 0. && fittedPixels[i] < numPixels) {
        observations.add(new WeightedObservedPoint(1., fittedPixels[i], knownPositions[i]));
      } else {
        missed.add(i);
      }
    }
    if (!missed.isEmpty()) {
      logger.debug(tube + ": only " + observations.size() + " out of " + fittedPixels.length
          + " points used, missed " + missed);
    }
    if (observations.size() < degree + 1) {
      throw new InsufficientDataException(tube, "only " + observations.size()
          + " usable points, need at least " + (degree + 1));
    }

    try {
      double[] coefficients = PolynomialCurveFitter.create(degree).fit(observations);
      return new PolynomialFunction(coefficients);
    } catch (ConvergenceException | TooManyEvaluationsException
        | TooManyIterationsException e) {
      throw new FitConvergenceException(tube, "position correction fit failed", e);
    }
  }

  /**
   * Corrected position of every pixel of a tube
   *
   * @param tube Tube being corrected, used to label failures
   * @param fittedPixels Fitted pixel positions of the strip features
   * @param knownPositions Real positions (m) of the same features
   * @param numPixels Number of pixels in the tube
   * @return corrected position of pixels 0 to numPixels - 1
   * @throws InsufficientDataException if too few fitted positions are inside the tube
   * @throws FitConvergenceException if the polynomial fit fails
   */
  public double[] correct(TubeId tube, double[] fittedPixels, double[] knownPositions,
      int numPixels) throws InsufficientDataException, FitConvergenceException {
    PolynomialFunction polynomial =
        fitCorrection(tube, fittedPixels, knownPositions, numPixels);
    double[] corrected = new double[numPixels];
    for (int i = 0; i < numPixels; ++i) {
      corrected[i] = polynomial.value(i);
    }
    return corrected;
  }
}
