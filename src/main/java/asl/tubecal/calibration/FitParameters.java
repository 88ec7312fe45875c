package asl.tubecal.calibration;

import asl.tubecal.input.CalibrationConfiguration;

/**
 * Options controlling the fit window and starting values of the peak and edge fits.
 * All distances are in pixels.
 */
public class FitParameters {

  private final int margin;
  private final double outEdge;
  private final double inEdge;
  private final double edgeWidth;
  private final double background;
  private final Double seedHeight;
  private final Double seedWidth;
  private final int maxIterations;

  /**
   * @param margin Half-width of the window used to tell rising from falling edges, and extra
   * room added on both sides of a peak-fit window
   * @param outEdge Window extent on the unshadowed side of a guess
   * @param inEdge Window extent on the shadowed side of a guess
   * @param edgeWidth Starting value of the edge-width parameter
   * @param background Fixed count level at the bottom of a shadow (peak fits)
   * @param seedHeight Starting shadow depth for peak fits, or null to estimate it
   * @param seedWidth Starting shadow width for peak fits, or null to estimate it
   * @param maxIterations Iteration limit of the solver
   */
  public FitParameters(int margin, double outEdge, double inEdge, double edgeWidth,
      double background, Double seedHeight, Double seedWidth, int maxIterations) {
    this.margin = margin;
    this.outEdge = outEdge;
    this.inEdge = inEdge;
    this.edgeWidth = edgeWidth;
    this.background = background;
    this.seedHeight = seedHeight;
    this.seedWidth = seedWidth;
    this.maxIterations = maxIterations;
  }

  public static FitParameters fromConfiguration(CalibrationConfiguration config) {
    return new FitParameters(config.getMargin(), config.getOutEdge(), config.getInEdge(),
        config.getEdgeWidth(), config.getBackground(), config.getSeedHeight(),
        config.getSeedWidth(), config.getMaxIterations());
  }

  public int getMargin() {
    return margin;
  }

  public double getOutEdge() {
    return outEdge;
  }

  public double getInEdge() {
    return inEdge;
  }

  public double getEdgeWidth() {
    return edgeWidth;
  }

  public double getBackground() {
    return background;
  }

  public Double getSeedHeight() {
    return seedHeight;
  }

  public Double getSeedWidth() {
    return seedWidth;
  }

  public int getMaxIterations() {
    return maxIterations;
  }
}
