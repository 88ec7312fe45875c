package asl.tubecal.calibration;

import asl.tubecal.input.StripMeasurement;

/**
 * A strip measurement together with the edges of the shadow its strip casts on the bank.
 */
public class StripShadow {

  private final StripMeasurement measurement;
  private final EdgePair edges;

  public StripShadow(StripMeasurement measurement, EdgePair edges) {
    this.measurement = measurement;
    this.edges = edges;
  }

  public StripMeasurement getMeasurement() {
    return measurement;
  }

  public EdgePair getEdges() {
    return edges;
  }

  @Override
  public String toString() {
    return measurement.getStripPosition() + " (" + measurement.getName() + "): " + edges;
  }
}
