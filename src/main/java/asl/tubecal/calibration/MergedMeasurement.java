package asl.tubecal.calibration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Composite of all strip measurements of a run: one count array covering the whole bank in
 * which each region shows the shadow of the strip closest to it, together with the edges
 * every tube is expected to show.
 */
public class MergedMeasurement {

  private final double[] counts;
  private final List<EdgePair> sortedEdges;
  private final double[] boundaries;
  private final double[] knownEdges;
  private final List<String> sourceNames;

  MergedMeasurement(double[] counts, List<EdgePair> sortedEdges, double[] boundaries,
      double[] knownEdges, List<String> sourceNames) {
    this.counts = counts;
    this.sortedEdges = Collections.unmodifiableList(new ArrayList<>(sortedEdges));
    this.boundaries = boundaries;
    this.knownEdges = knownEdges;
    this.sourceNames = Collections.unmodifiableList(new ArrayList<>(sourceNames));
  }

  /**
   * @return copy of the merged counts, one per detector of the bank
   */
  public double[] getCounts() {
    return counts.clone();
  }

  /**
   * @return edge pairs of the source measurements, sorted by left then right edge
   */
  public List<EdgePair> getSortedEdges() {
    return sortedEdges;
  }

  /**
   * Isolation boundaries of the source measurements; the measurement at sorted index i kept the
   * counts of detectors in [boundaries[i], boundaries[i + 1]).
   *
   * @return copy of the boundaries, one more than the number of measurements
   */
  public double[] getBoundaries() {
    return boundaries.clone();
  }

  /**
   * @return copy of the sorted, non-overlapping edge positions (m) every tube should show
   */
  public double[] getKnownEdges() {
    return knownEdges.clone();
  }

  public int getNumberOfKnownEdges() {
    return knownEdges.length;
  }

  /**
   * @return names of the source measurements in sorted order
   */
  public List<String> getSourceNames() {
    return sourceNames;
  }
}
