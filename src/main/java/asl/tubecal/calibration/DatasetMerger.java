package asl.tubecal.calibration;

import asl.tubecal.input.DetectorBank;
import asl.tubecal.input.StripMeasurement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.apache.log4j.Logger;

/**
 * Combines several single-strip measurements into one dataset. Each measurement is isolated to
 * the part of the bank nearest its own strip by setting all other counts to 1, and the isolated
 * datasets are multiplied together. Overlapping shadows are coalesced into a single span when
 * the list of expected edges is built.
 */
public class DatasetMerger {

  private static final Logger logger = Logger.getLogger(DatasetMerger.class);

  /**
   * Merge measurements over a detector bank
   *
   * @param shadows Each measurement with the edges of its shadow
   * @param bank Bank the counts were recorded on, providing each detector's position
   * @return merged counts and expected edges
   * @throws ConfigurationException if there are no measurements or their sizes do not match the
   * bank
   */
  public MergedMeasurement merge(List<StripShadow> shadows, DetectorBank bank)
      throws ConfigurationException {
    if (shadows.isEmpty()) {
      throw new ConfigurationException("No strip measurements to merge");
    }
    for (StripShadow shadow : shadows) {
      StripMeasurement measurement = shadow.getMeasurement();
      if (measurement.getNumberOfDetectors() != bank.getNumberOfDetectors()) {
        throw new ConfigurationException("Measurement " + measurement.getName() + " has "
            + measurement.getNumberOfDetectors() + " detectors but the bank has "
            + bank.getNumberOfDetectors());
      }
    }

    List<StripShadow> sorted = new ArrayList<>(shadows);
    sorted.sort((a, b) -> EdgePair.BY_LEFT_THEN_RIGHT.compare(a.getEdges(), b.getEdges()));

    List<EdgePair> sortedPairs = new ArrayList<>();
    List<String> names = new ArrayList<>();
    for (StripShadow shadow : sorted) {
      sortedPairs.add(shadow.getEdges());
      names.add(shadow.getMeasurement().getName());
    }
    double[] boundaries = computeBoundaries(sortedPairs);
    double[] knownEdges = mergeEdges(sortedPairs);

    if (sorted.size() == 1) {
      return new MergedMeasurement(sorted.get(0).getMeasurement().getCounts(), sortedPairs, boundaries,
          knownEdges, names);
    }

    double[] merged = new double[bank.getNumberOfDetectors()];
    Arrays.fill(merged, 1.);
    for (int i = 0; i < sorted.size(); ++i) {
      StripMeasurement measurement = sorted.get(i).getMeasurement();
      double low = boundaries[i];
      double high = boundaries[i + 1];
      logger.info("Isolating shadow in " + measurement.getName() + " between boundaries "
          + low + " and " + high);
      double[] counts = isolate(measurement.getCounts(), bank, low, high);
      for (int j = 0; j < merged.length; ++j) {
        merged[j] *= counts[j];
      }
    }
    return new MergedMeasurement(merged, sortedPairs, boundaries, knownEdges, names);
  }

  /**
   * Set the counts of every detector whose position along the tube lies outside [low, high)
   * to 1
   *
   * @param counts Counts of the whole bank, modified in place
   * @param bank Bank providing detector positions
   * @param low Lowest position kept (m)
   * @param high Position above the highest kept (m)
   * @return the same array, for chaining
   */
  static double[] isolate(double[] counts, DetectorBank bank, double low, double high) {
    for (int i = 0; i < counts.length; ++i) {
      double x = bank.getBasePosition(i).getX();
      if (x < low || x >= high) {
        counts[i] = 1.;
      }
    }
    return counts;
  }

  /**
   * Boundaries between the regions assigned to each measurement. The boundary before a
   * measurement lies halfway between its left edge and the furthest right edge of all the
   * measurements sorted before it, so that a chain of overlapping strips splits the overlaps
   * and a gap is split in the middle. The first and last boundaries are infinite.
   *
   * @param sortedPairs Edge pairs sorted by {@link EdgePair#BY_LEFT_THEN_RIGHT}
   * @return boundaries, one more than the number of pairs
   */
  public static double[] computeBoundaries(List<EdgePair> sortedPairs) {
    double[] boundaries = new double[sortedPairs.size() + 1];
    boundaries[0] = Double.NEGATIVE_INFINITY;
    boundaries[sortedPairs.size()] = Double.POSITIVE_INFINITY;
    double runningMax = Double.NEGATIVE_INFINITY;
    for (int i = 0; i < sortedPairs.size(); ++i) {
      EdgePair pair = sortedPairs.get(i);
      if (i > 0) {
        boundaries[i] = (pair.getLeft() + runningMax) / 2.;
      }
      runningMax = Math.max(runningMax, pair.getRight());
    }
    return boundaries;
  }

  /**
   * Coalesce overlapping or touching edge pairs into single spans and flatten the result
   *
   * @param sortedPairs Edge pairs sorted by {@link EdgePair#BY_LEFT_THEN_RIGHT}
   * @return left and right edge of each span, in ascending order
   */
  public static double[] mergeEdges(List<EdgePair> sortedPairs) {
    List<Double> flattened = new ArrayList<>();
    double start = sortedPairs.get(0).getLeft();
    double end = sortedPairs.get(0).getRight();
    for (EdgePair pair : sortedPairs.subList(1, sortedPairs.size())) {
      if (pair.getLeft() <= end) {
        end = Math.max(end, pair.getRight());
      } else {
        flattened.add(start);
        flattened.add(end);
        start = pair.getLeft();
        end = pair.getRight();
      }
    }
    flattened.add(start);
    flattened.add(end);

    double[] out = new double[flattened.size()];
    for (int i = 0; i < out.length; ++i) {
      out[i] = flattened.get(i);
    }
    return out;
  }
}
