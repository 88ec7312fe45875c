package asl.tubecal.calibration;

/**
 * Selects how the strip shadows in a tube are located. Edge fitting refines each detected
 * threshold crossing on its own; flat-top peak fitting treats the two edges of a shadow as one
 * feature and refines its centre. The mode decides both what the expected positions are and
 * which model is fit around each of them.
 */
public enum FitMode {

  /**
   * Fit an error-function step at each edge
   */
  EDGES {
    @Override
    public double[] combine(double[] edges) {
      return edges.clone();
    }

    @Override
    FitSetup setUp(double[] counts, double guess, FitParameters params) {
      int length = counts.length;
      int low = Math.max((int) (guess - params.getMargin()), 0);
      int high = Math.min((int) (guess + params.getMargin()), length);
      if (high - low < 2) {
        return null;
      }
      // a shadow starting at this edge means the counts are falling through it
      boolean descent = counts[low] > counts[high - 1];
      double start;
      double end;
      double sign;
      if (descent) {
        start = Math.max(guess - params.getOutEdge(), 0);
        end = Math.min(guess + params.getInEdge(), length);
        sign = -1.;
      } else {
        start = Math.max(guess - params.getInEdge(), 0);
        end = Math.min(guess + params.getOutEdge(), length);
        sign = 1.;
      }
      int first = (int) Math.ceil(start);
      int last = Math.min((int) Math.floor(end), length - 1);

      double min = Double.POSITIVE_INFINITY;
      double max = Double.NEGATIVE_INFINITY;
      for (int i = first; i <= last; ++i) {
        min = Math.min(min, counts[i]);
        max = Math.max(max, counts[i]);
      }
      double[] seed = {(max - min) / 2., guess, params.getEdgeWidth() * sign, min};
      return new FitSetup(first, last, new EndErfcFunction(), seed);
    }
  },

  /**
   * Fit a flat-bottomed shadow of unknown width centred between a pair of edges
   */
  FLAT_TOP_PEAK {
    @Override
    public double[] combine(double[] edges) {
      if (edges.length % 2 != 0) {
        throw new IllegalArgumentException("Cannot pair up an odd number (" + edges.length
            + ") of edges");
      }
      double[] centres = new double[edges.length / 2];
      for (int i = 0; i < centres.length; ++i) {
        centres[i] = (edges[2 * i] + edges[2 * i + 1]) / 2.;
      }
      return centres;
    }

    @Override
    FitSetup setUp(double[] counts, double guess, FitParameters params) {
      int length = counts.length;
      int first = Math.max((int) (guess - params.getOutEdge() - params.getMargin()), 0);
      int end = Math.min((int) (guess + params.getInEdge() + params.getMargin()), length);
      int last = Math.min(end, length - 1);
      double max = Double.NEGATIVE_INFINITY;
      for (int i = first; i <= last; ++i) {
        max = Math.max(max, counts[i]);
      }
      double height =
          params.getSeedHeight() != null ? params.getSeedHeight() : max - params.getBackground();
      double width = params.getSeedWidth() != null ? params.getSeedWidth() : (end - first) / 3.;
      double[] seed = {height, guess, params.getEdgeWidth(), width};
      return new FitSetup(first, last, new FlatTopPeakFunction(params.getBackground()), seed);
    }
  };

  /**
   * Turn a list of edges (known positions or detected pixels) into the positions fit in this
   * mode
   *
   * @param edges Ordered edge positions, two per strip shadow
   * @return the positions to fit, in the same order
   */
  public abstract double[] combine(double[] edges);

  /**
   * Choose the fit window, model and starting parameters around a guessed position
   *
   * @param counts Counts of the tube being fit
   * @param guess Guessed position (pixel index)
   * @param params Fit options
   * @return description of the fit to run, or null if the window holds too few points
   */
  abstract FitSetup setUp(double[] counts, double guess, FitParameters params);

  /**
   * Window, model and seed of a single fit. The window covers pixel indices first to last
   * inclusive.
   */
  static final class FitSetup {

    final int first;
    final int last;
    final FitFunction function;
    final double[] seed;

    FitSetup(int first, int last, FitFunction function, double[] seed) {
      this.first = first;
      this.last = last;
      this.function = function;
      this.seed = seed;
    }
  }
}
