package asl.tubecal.output;

import java.util.HashMap;
import java.util.Map;

/**
 * Interface by which external programs (such as Python scripts connected through the gateway
 * shell) read the results of a calibration run. CalResult holds two maps: one from string
 * descriptors to images stored as PNG byte arrays, and one from string descriptors to the
 * numbers produced by the run, given as arrays of doubles.
 */
public class CalResult {

  private final Map<String, double[]> numerMap;
  private final Map<String, byte[]> imageMap;

  private CalResult() {
    numerMap = new HashMap<>();
    imageMap = new HashMap<>();
  }

  /**
   * Get data from a tube calibration result
   *
   * @param table Calibrated detector positions
   * @param cvalues Cvalue of each calibrated tube
   * @param failedTubes Ids of the tubes that were skipped
   * @param cvaluePlot Plot of cvalue against tube id as a PNG
   * @return object holding these values in easily-accessed maps with variable descriptions
   */
  public static CalResult buildTubeCalData(CalibrationTable table, CvalueReport cvalues,
      double[] failedTubes, byte[] cvaluePlot) {
    CalResult out = new CalResult();
    out.numerMap.put("Detector_ids", table.getDetectorIds());
    out.numerMap.put("Calibrated_x", table.getCoordinates(0));
    out.numerMap.put("Calibrated_y", table.getCoordinates(1));
    out.numerMap.put("Calibrated_z", table.getCoordinates(2));
    out.numerMap.put("Calibrated_tubes", cvalues.getTubeIds());
    out.numerMap.put("Cvalues", cvalues.getValues());
    out.numerMap.put("Cvalue_threshold", new double[]{cvalues.getThreshold()});
    out.numerMap.put("Failed_tubes", failedTubes);
    out.imageMap.put("Cvalue_plot", cvaluePlot);
    return out;
  }

  /**
   * Return the map of images
   * @return map of byte arrays representing images, keyed by strings with image descriptions
   */
  public Map<String, byte[]> getImageMap() {
    return imageMap;
  }

  /**
   * Return the map of numeric data
   * @return map of double arrays keyed by strings describing the given numbers
   * (i.e., calibrated x coordinates, cvalues)
   */
  public Map<String, double[]> getNumerMap() {
    return numerMap;
  }
}
