package asl.tubecal.output;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Calibrated detector positions accumulated over all tubes of a run. Rows are only ever
 * appended.
 */
public class CalibrationTable {

  private final List<CalibrationRow> rows = new ArrayList<>();

  /**
   * Add the rows of one tube to the end of the table
   *
   * @param tubeRows Rows for each detector of a tube
   */
  public void addAll(List<CalibrationRow> tubeRows) {
    rows.addAll(tubeRows);
  }

  public List<CalibrationRow> getRows() {
    return Collections.unmodifiableList(rows);
  }

  public int size() {
    return rows.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  /**
   * @return ids of all detectors in the table, in row order
   */
  public double[] getDetectorIds() {
    double[] out = new double[rows.size()];
    for (int i = 0; i < out.length; ++i) {
      out[i] = rows.get(i).getDetectorId();
    }
    return out;
  }

  /**
   * @param axis 0 for X, 1 for Y, 2 for Z
   * @return the given coordinate of each row's position
   */
  public double[] getCoordinates(int axis) {
    double[] out = new double[rows.size()];
    for (int i = 0; i < out.length; ++i) {
      out[i] = rows.get(i).getPosition().toArray()[axis];
    }
    return out;
  }
}
