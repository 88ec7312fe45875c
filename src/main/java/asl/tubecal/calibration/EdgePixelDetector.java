package asl.tubecal.calibration;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds the pixels of a tube where the counts cross a threshold. Counts below the threshold
 * are taken to be in a strip shadow. Every crossing is reported; no smoothing is done, so noise
 * near the threshold shows up as extra edges.
 */
public class EdgePixelDetector {

  private final double threshold;
  private final int firstPixel;
  private final int lastPixel;

  /**
   * @param threshold Count level separating shadowed from unshadowed pixels
   * @param firstPixel First pixel scanned
   * @param lastPixel Pixel after the last one scanned
   */
  public EdgePixelDetector(double threshold, int firstPixel, int lastPixel) {
    this.threshold = threshold;
    this.firstPixel = firstPixel;
    this.lastPixel = lastPixel;
  }

  /**
   * Scan a tube's counts for threshold crossings
   *
   * @param counts Counts of each pixel of the tube
   * @return indices of the first pixel past each crossing, in ascending order
   */
  public List<Integer> findEdges(double[] counts) {
    List<Integer> edges = new ArrayList<>();
    int end = Math.min(lastPixel, counts.length);
    if (firstPixel >= end) {
      return edges;
    }
    boolean inStrip = counts[firstPixel] < threshold;
    for (int pixel = firstPixel; pixel < end; ++pixel) {
      double count = counts[pixel];
      if (inStrip && count >= threshold) {
        edges.add(pixel);
        inStrip = false;
      } else if (!inStrip && count < threshold) {
        edges.add(pixel);
        inStrip = true;
      }
    }
    return edges;
  }
}
