package asl.tubecal.calibration;

import asl.tubecal.calibration.FitMode.FitSetup;
import asl.tubecal.input.TubeId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.apache.commons.math3.exception.ConvergenceException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealVector;
import org.apache.log4j.Logger;

/**
 * Refines guessed strip positions in a tube's count profile to sub-pixel precision.
 * Each guess gets its own fit over a window of pixels around it, using the model selected by
 * the {@link FitMode}. Fits are solved with a Levenberg-Marquardt optimizer.
 */
public class PeakFitter {

  private static final Logger logger = Logger.getLogger(PeakFitter.class);

  private static final double F_TOLER = 1E-10;
  private static final double X_TOLER = 1E-10;

  private final FitMode mode;
  private final FitParameters params;

  public PeakFitter(FitMode mode, FitParameters params) {
    this.mode = mode;
    this.params = params;
  }

  public FitMode getMode() {
    return mode;
  }

  /**
   * Fit every guessed position of a tube
   *
   * @param tube Tube being fit, used to label failures
   * @param counts Counts of each pixel of the tube
   * @param guesses Guessed positions, in pixels
   * @return fitted positions and resolutions, one per guess
   * @throws FitConvergenceException if any of the fits fails
   */
  public FitResult fitTube(TubeId tube, double[] counts, double[] guesses)
      throws FitConvergenceException {
    List<FitResult.PeakFit> peaks = new ArrayList<>();
    for (double guess : guesses) {
      peaks.add(fit(tube, counts, guess));
    }
    return new FitResult(peaks);
  }

  /**
   * Fit a single feature around a guessed position
   *
   * @param tube Tube being fit, used to label failures
   * @param counts Counts of each pixel of the tube
   * @param guess Guessed position, in pixels
   * @return refined position and resolution
   * @throws FitConvergenceException if the solver fails or produces a non-finite result
   */
  public FitResult.PeakFit fit(TubeId tube, double[] counts, double guess)
      throws FitConvergenceException {
    FitSetup setup = mode.setUp(counts, guess, params);
    FitFunction function = setup == null ? null : setup.function;
    if (setup == null || setup.last - setup.first + 1 < function.getParameterCount()) {
      throw new FitConvergenceException(tube, "too few pixels around guess "
          + guess + " to fit");
    }

    int size = setup.last - setup.first + 1;
    double[] xs = new double[size];
    double[] ys = new double[size];
    for (int i = 0; i < size; ++i) {
      xs[i] = setup.first + i;
      ys[i] = counts[setup.first + i];
    }

    RealVector startVector = MatrixUtils.createRealVector(setup.seed);
    RealVector observedComponents = MatrixUtils.createRealVector(ys);

    LeastSquaresProblem lsp = new LeastSquaresBuilder().
        start(startVector).
        target(observedComponents).
        model(function.jacobian(xs)).
        parameterValidator(function).
        lazyEvaluation(false).
        maxEvaluations(Integer.MAX_VALUE).
        maxIterations(params.getMaxIterations()).
        build();

    LeastSquaresOptimizer optimizer = new LevenbergMarquardtOptimizer().
        withCostRelativeTolerance(F_TOLER).
        withParameterRelativeTolerance(X_TOLER);

    double[] fitParams;
    try {
      LeastSquaresOptimizer.Optimum optimum = optimizer.optimize(lsp);
      fitParams = optimum.getPoint().toArray();
    } catch (ConvergenceException | TooManyEvaluationsException
        | TooManyIterationsException e) {
      throw new FitConvergenceException(tube, function.getName() + " fit around pixel "
          + guess + " did not converge", e);
    }

    for (double value : fitParams) {
      if (!Double.isFinite(value)) {
        throw new FitConvergenceException(tube, function.getName() + " fit around pixel "
            + guess + " produced non-finite parameters " + Arrays.toString(fitParams));
      }
    }

    double position = fitParams[function.getCentreIndex()];
    double resolution = Math.abs(fitParams[function.getResolutionIndex()]);
    logger.debug(tube + ": " + function.getName() + " fit moved " + guess + " to " + position
        + " (resolution " + resolution + ")");
    return new FitResult.PeakFit(guess, position, resolution, xs,
        function.evaluate(xs, fitParams));
  }
}
