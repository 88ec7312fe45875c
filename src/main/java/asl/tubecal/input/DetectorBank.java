package asl.tubecal.input;

import asl.tubecal.calibration.CalibrationApplyException;
import asl.tubecal.output.CalibrationRow;
import asl.tubecal.output.CalibrationTable;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.log4j.Logger;

/**
 * Geometry model of a detector bank made of equal-length tubes. Each detector has an id and two
 * positions: the base position from the instrument definition, which is never changed, and the
 * current position, which is replaced when a calibration table is applied.
 *
 * Detectors are stored tube by tube, so that the detectors of tube t occupy the indices
 * [t * pixelsPerTube, (t + 1) * pixelsPerTube). Count arrays of {@link StripMeasurement} objects
 * use the same indexing.
 */
public class DetectorBank {

  private static final Logger logger = Logger.getLogger(DetectorBank.class);

  private final BankSide side;
  private final int pixelsPerTube;
  private final int[] detectorIds;
  private final Vector3D[] basePositions;
  private final Map<Integer, Integer> indexById;
  private Vector3D[] positions;

  /**
   * Create a bank from explicit detector ids and their uncalibrated positions
   *
   * @param side Which bank of the instrument this is
   * @param pixelsPerTube Number of detectors in each tube
   * @param detectorIds Detector ids, tube by tube
   * @param basePositions Position of each detector (metres) before any calibration
   */
  public DetectorBank(BankSide side, int pixelsPerTube, int[] detectorIds,
      Vector3D[] basePositions) {
    if (pixelsPerTube < 1) {
      throw new IllegalArgumentException("Tubes must contain at least one pixel");
    }
    if (detectorIds.length != basePositions.length) {
      throw new IllegalArgumentException("Got " + detectorIds.length + " detector ids but "
          + basePositions.length + " positions");
    }
    if (detectorIds.length == 0 || detectorIds.length % pixelsPerTube != 0) {
      throw new IllegalArgumentException("Detector count " + detectorIds.length
          + " is not a whole number of tubes of " + pixelsPerTube + " pixels");
    }
    this.side = side;
    this.pixelsPerTube = pixelsPerTube;
    this.detectorIds = detectorIds.clone();
    this.basePositions = basePositions.clone();
    this.positions = basePositions.clone();
    indexById = new HashMap<>();
    for (int i = 0; i < detectorIds.length; ++i) {
      if (indexById.put(detectorIds[i], i) != null) {
        throw new IllegalArgumentException("Duplicate detector id " + detectorIds[i]);
      }
    }
  }

  /**
   * Build an idealised bank of horizontal tubes. Every tube runs parallel to the X axis and is
   * centred on X = 0, tubes are stacked along Y with a fixed spacing centred on Y = 0, and the
   * whole bank sits at a fixed Z. Pixels are spaced evenly from one end of the tube to the other.
   * Detector ids are assigned sequentially from the first id given.
   *
   * @param side Bank side
   * @param numTubes Number of tubes in the bank
   * @param pixelsPerTube Number of detectors in each tube
   * @param tubeLength Distance from the first to the last pixel of a tube (metres)
   * @param tubeSpacing Distance between adjacent tubes (metres)
   * @param z Distance of the bank from the sample along the beam (metres)
   * @param firstDetectorId Id of the first detector of the first tube
   * @return new bank with the described geometry
   */
  public static DetectorBank createRegularBank(BankSide side, int numTubes, int pixelsPerTube,
      double tubeLength, double tubeSpacing, double z, int firstDetectorId) {
    int total = numTubes * pixelsPerTube;
    int[] ids = new int[total];
    Vector3D[] pos = new Vector3D[total];
    double pitch = pixelsPerTube > 1 ? tubeLength / (pixelsPerTube - 1) : 0.;
    for (int tube = 0; tube < numTubes; ++tube) {
      double y = (tube - (numTubes - 1) / 2.) * tubeSpacing;
      for (int pixel = 0; pixel < pixelsPerTube; ++pixel) {
        int index = tube * pixelsPerTube + pixel;
        ids[index] = firstDetectorId + index;
        pos[index] = new Vector3D(-tubeLength / 2. + pixel * pitch, y, z);
      }
    }
    return new DetectorBank(side, pixelsPerTube, ids, pos);
  }

  public BankSide getSide() {
    return side;
  }

  public int getNumberOfTubes() {
    return detectorIds.length / pixelsPerTube;
  }

  public int getPixelsPerTube() {
    return pixelsPerTube;
  }

  public int getNumberOfDetectors() {
    return detectorIds.length;
  }

  /**
   * Get the bank-wide indices of the detectors in a tube, in pixel order
   *
   * @param tube Tube to get the indices of
   * @return array of length pixelsPerTube
   */
  public int[] getTubeIndices(TubeId tube) {
    checkTube(tube);
    int[] indices = new int[pixelsPerTube];
    int start = tube.getId() * pixelsPerTube;
    for (int i = 0; i < pixelsPerTube; ++i) {
      indices[i] = start + i;
    }
    return indices;
  }

  /**
   * @param tube Tube to get ids of
   * @return ordered detector ids of a tube
   */
  public int[] getTubeDetectorIds(TubeId tube) {
    checkTube(tube);
    int start = tube.getId() * pixelsPerTube;
    return Arrays.copyOfRange(detectorIds, start, start + pixelsPerTube);
  }

  /**
   * Extract the counts of a single tube from a bank-wide count array
   *
   * @param counts Counts for all detectors of the bank
   * @param tube Tube to extract
   * @return counts of the tube's pixels, in pixel order
   */
  public double[] getTubeCounts(double[] counts, TubeId tube) {
    checkTube(tube);
    if (counts.length != detectorIds.length) {
      throw new IllegalArgumentException("Count array has " + counts.length
          + " entries, bank has " + detectorIds.length + " detectors");
    }
    int start = tube.getId() * pixelsPerTube;
    return Arrays.copyOfRange(counts, start, start + pixelsPerTube);
  }

  /**
   * Uncalibrated position of a detector, used both to isolate strip shadows and as the
   * reference frame for projecting calibrated positions
   *
   * @param index Bank-wide index of the detector
   * @return position from the instrument definition
   */
  public Vector3D getBasePosition(int index) {
    return basePositions[index];
  }

  /**
   * @param tube Tube of interest
   * @return uncalibrated position of the tube's first pixel
   */
  public Vector3D getFirstBasePosition(TubeId tube) {
    checkTube(tube);
    return basePositions[tube.getId() * pixelsPerTube];
  }

  /**
   * @param tube Tube of interest
   * @return uncalibrated position of the tube's last pixel
   */
  public Vector3D getLastBasePosition(TubeId tube) {
    checkTube(tube);
    return basePositions[(tube.getId() + 1) * pixelsPerTube - 1];
  }

  public int getDetectorId(int index) {
    return detectorIds[index];
  }

  /**
   * Current (possibly calibrated) position of a detector
   *
   * @param detectorId Id of the detector
   * @return position in metres
   */
  public Vector3D getPosition(int detectorId) {
    Integer index = indexById.get(detectorId);
    if (index == null) {
      throw new IllegalArgumentException("No detector with id " + detectorId);
    }
    return positions[index];
  }

  /**
   * @param detectorId Id of the detector
   * @return true if the bank contains a detector with this id
   */
  public boolean hasDetector(int detectorId) {
    return indexById.containsKey(detectorId);
  }

  /**
   * Move detectors to the positions given in a calibration table. The update is atomic: every
   * row is checked before any position is changed, so a failed update leaves the bank as it was.
   * Detectors without a row keep their current position.
   *
   * @param table Table of detector ids and new positions
   * @throws CalibrationApplyException if the table is empty or names an unknown detector
   */
  public void applyCalibration(CalibrationTable table) throws CalibrationApplyException {
    if (table == null || table.isEmpty()) {
      throw new CalibrationApplyException("Calibration table is empty; no tube was calibrated");
    }
    Vector3D[] updated = positions.clone();
    for (CalibrationRow row : table.getRows()) {
      Integer index = indexById.get(row.getDetectorId());
      if (index == null) {
        throw new CalibrationApplyException("Calibration table refers to detector "
            + row.getDetectorId() + " which is not part of the " + side.getDetectorName()
            + " bank");
      }
      updated[index] = row.getPosition();
    }
    positions = updated;
    logger.info("Applied calibration of " + table.size() + " detectors to the "
        + side.getDetectorName() + " bank");
  }

  private void checkTube(TubeId tube) {
    if (tube.getId() >= getNumberOfTubes()) {
      throw new IndexOutOfBoundsException(tube + " is outside bank of "
          + getNumberOfTubes() + " tubes");
    }
  }
}
