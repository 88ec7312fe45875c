package asl.tubecal.output;

import asl.tubecal.input.TubeId;
import asl.tubecal.utils.NumericUtils;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Quality summary of a calibration run: the mean fit resolution (cvalue) of each calibrated
 * tube, checked against a threshold. Tubes whose cvalue exceeds the threshold had broad or badly
 * fit edges and should be looked at.
 */
public class CvalueReport {

  private final double threshold;
  private final Map<TubeId, Double> cvalues = new TreeMap<>();

  public CvalueReport(double threshold) {
    this.threshold = threshold;
  }

  public double getThreshold() {
    return threshold;
  }

  public void record(TubeId tube, double cvalue) {
    cvalues.put(tube, cvalue);
  }

  /**
   * @return cvalue of each calibrated tube, in tube order
   */
  public Map<TubeId, Double> getCvalues() {
    return Collections.unmodifiableMap(cvalues);
  }

  public int size() {
    return cvalues.size();
  }

  /**
   * @return tubes whose cvalue is above the threshold, with their cvalues
   */
  public Map<TubeId, Double> getViolations() {
    Map<TubeId, Double> out = new TreeMap<>();
    for (Map.Entry<TubeId, Double> entry : cvalues.entrySet()) {
      if (entry.getValue() > threshold) {
        out.put(entry.getKey(), entry.getValue());
      }
    }
    return out;
  }

  public boolean isNominal() {
    return getViolations().isEmpty();
  }

  /**
   * Human-readable summary: one warning line per tube over the threshold, or a single line
   * stating that every tube was below it
   *
   * @return lines of the report
   */
  public List<String> getStatusLines() {
    List<String> lines = new ArrayList<>();
    for (Map.Entry<TubeId, Double> entry : getViolations().entrySet()) {
      lines.add("Tube " + entry.getKey().getId() + " has cvalue " + entry.getValue());
    }
    if (lines.isEmpty()) {
      lines.add("CValues for all tubes were below threshold "
          + NumericUtils.DECIMAL_FORMAT.get().format(threshold));
    }
    return lines;
  }

  /**
   * @return ids of the tubes in the report, as doubles for scripting clients
   */
  public double[] getTubeIds() {
    double[] out = new double[cvalues.size()];
    int i = 0;
    for (TubeId tube : cvalues.keySet()) {
      out[i++] = tube.getId();
    }
    return out;
  }

  public double[] getValues() {
    double[] out = new double[cvalues.size()];
    int i = 0;
    for (double value : cvalues.values()) {
      out[i++] = value;
    }
    return out;
  }
}
