package asl.tubecal.calibration;

import asl.tubecal.input.TubeId;

/**
 * The number of threshold crossings found in a tube differs from the number of known edges.
 */
public class EdgeCountMismatchException extends TubeCalibrationException {

  private final int expected;
  private final int found;

  public EdgeCountMismatchException(TubeId tube, int expected, int found) {
    super(tube, "found " + found + " edges but expected " + expected);
    this.expected = expected;
    this.found = found;
  }

  public int getExpected() {
    return expected;
  }

  public int getFound() {
    return found;
  }
}
