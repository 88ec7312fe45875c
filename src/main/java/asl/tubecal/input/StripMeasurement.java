package asl.tubecal.input;

import java.util.Arrays;

/**
 * A single calibration run: the time-integrated counts for every detector of a bank, recorded
 * with the attenuating strip placed at one encoder position. Loading and integrating the raw
 * data is done before an object of this type is constructed; the counts are indexed in the
 * same order as the detectors of the corresponding {@link DetectorBank}.
 *
 * Objects of this class are not modified after construction; rescaling produces a new
 * measurement.
 */
public class StripMeasurement {

  private final String name;
  private final int stripPosition;
  private final double[] counts;
  private final BankSide bankSide;
  private final Double sampleToDetectorDistance;
  private final double intensityNormalisation;

  /**
   * Create a measurement
   *
   * @param name Identifier of the data (i.e., the run file name)
   * @param stripPosition Encoder position of the strip during the run
   * @param counts Integrated counts per detector of the bank
   * @param bankSide Bank the counts were recorded on
   * @param sampleToDetectorDistance Sample to detector distance in mm, or null if the run log
   * did not record one
   * @param intensityNormalisation Beam intensity measure (proton charge) for the run
   * @throws IllegalArgumentException if the name is null
   */
  public StripMeasurement(String name, int stripPosition, double[] counts, BankSide bankSide,
      Double sampleToDetectorDistance, double intensityNormalisation) {
    if (name == null) {
      throw new IllegalArgumentException("A strip measurement needs a name");
    }
    this.name = name;
    this.stripPosition = stripPosition;
    this.counts = counts.clone();
    this.bankSide = bankSide;
    this.sampleToDetectorDistance = sampleToDetectorDistance;
    this.intensityNormalisation = intensityNormalisation;
  }

  public String getName() {
    return name;
  }

  public int getStripPosition() {
    return stripPosition;
  }

  /**
   * @return copy of the integrated counts, one per detector
   */
  public double[] getCounts() {
    return counts.clone();
  }

  public int getNumberOfDetectors() {
    return counts.length;
  }

  public BankSide getBankSide() {
    return bankSide;
  }

  /**
   * @return true if this measurement carries the geometry metadata needed for edge calculation
   */
  public boolean hasSampleToDetectorDistance() {
    return sampleToDetectorDistance != null;
  }

  /**
   * @return sample to detector distance in mm; check
   * {@link #hasSampleToDetectorDistance()} first
   */
  public double getSampleToDetectorDistance() {
    return sampleToDetectorDistance;
  }

  public double getIntensityNormalisation() {
    return intensityNormalisation;
  }

  /**
   * Produce a copy of this measurement with counts scaled to match a reference intensity.
   * The resulting measurement has the reference value as its normalisation.
   *
   * @param referenceIntensity Normalisation of the run all others are scaled to
   * @return New measurement with scaled counts
   */
  public StripMeasurement rescaledTo(double referenceIntensity) {
    double factor = referenceIntensity / intensityNormalisation;
    double[] scaled = new double[counts.length];
    for (int i = 0; i < counts.length; ++i) {
      scaled[i] = counts[i] * factor;
    }
    return new StripMeasurement(name, stripPosition, scaled, bankSide,
        sampleToDetectorDistance, referenceIntensity);
  }

  @Override
  public String toString() {
    return name + " (strip at " + stripPosition + ", " + bankSide.getDetectorName()
        + " bank, " + counts.length + " detectors)";
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof StripMeasurement)) {
      return false;
    }
    StripMeasurement other = (StripMeasurement) obj;
    return stripPosition == other.stripPosition && name.equals(other.name)
        && bankSide == other.bankSide && Arrays.equals(counts, other.counts);
  }

  @Override
  public int hashCode() {
    return 31 * name.hashCode() + stripPosition;
  }
}
