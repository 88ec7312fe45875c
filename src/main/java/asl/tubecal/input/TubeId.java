package asl.tubecal.input;

/**
 * Identifier of a single physical tube within a detector bank. Tubes are numbered from zero and
 * alternate between the left and right halves of the bank, so that even ids are left-side tubes
 * and odd ids are right-side tubes. Tubes are also grouped into modules of 24.
 */
public class TubeId implements Comparable<TubeId> {

  /**
   * Number of tubes making up a single detector module
   */
  public static final int TUBES_PER_MODULE = 24;

  private final int id;

  public TubeId(int id) {
    if (id < 0) {
      throw new IllegalArgumentException("Tube id cannot be negative: " + id);
    }
    this.id = id;
  }

  public int getId() {
    return id;
  }

  /**
   * @return "left" for even tube ids, "right" for odd ones
   */
  public String getSide() {
    return id % 2 == 0 ? "left" : "right";
  }

  /**
   * @return the index of this tube within its side of the bank
   */
  public int getSideNumber() {
    return id / 2;
  }

  /**
   * @return the module (starting from 1) containing this tube
   */
  public int getModule() {
    return id / TUBES_PER_MODULE + 1;
  }

  /**
   * @return the index of this tube within its module
   */
  public int getModuleTubeNumber() {
    return id % TUBES_PER_MODULE;
  }

  /**
   * Construct the instrument name of the tube, such as "rear-detector/left12"
   *
   * @param side Bank containing the tube
   * @return name of the tube as given in the instrument definition
   */
  public String getName(BankSide side) {
    return side.getDetectorName() + "-detector/" + getSide() + getSideNumber();
  }

  /**
   * Suffix used to label diagnostic data for this tube: id, module and tube-in-module number
   *
   * @return string of the form "37_2_13"
   */
  public String getDiagnosticSuffix() {
    return id + "_" + getModule() + "_" + getModuleTubeNumber();
  }

  @Override
  public int compareTo(TubeId other) {
    return Integer.compare(id, other.id);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof TubeId)) {
      return false;
    }
    return id == ((TubeId) obj).id;
  }

  @Override
  public int hashCode() {
    return Integer.hashCode(id);
  }

  @Override
  public String toString() {
    return "Tube " + id;
  }
}
