package asl.tubecal.calibration;

import java.util.Comparator;

/**
 * Real-space positions (metres along the tube axis) of the two edges of a strip shadow.
 * The left edge is never greater than the right edge.
 */
public class EdgePair {

  /**
   * Orders pairs by left edge, then by right edge
   */
  public static final Comparator<EdgePair> BY_LEFT_THEN_RIGHT =
      Comparator.comparingDouble(EdgePair::getLeft).thenComparingDouble(EdgePair::getRight);

  private final double left;
  private final double right;

  public EdgePair(double left, double right) {
    this.left = Math.min(left, right);
    this.right = Math.max(left, right);
  }

  public double getLeft() {
    return left;
  }

  public double getRight() {
    return right;
  }

  public double getWidth() {
    return right - left;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof EdgePair)) {
      return false;
    }
    EdgePair other = (EdgePair) obj;
    return Double.compare(left, other.left) == 0 && Double.compare(right, other.right) == 0;
  }

  @Override
  public int hashCode() {
    return 31 * Double.hashCode(left) + Double.hashCode(right);
  }

  @Override
  public String toString() {
    return "(" + left + ", " + right + ")";
  }
}
