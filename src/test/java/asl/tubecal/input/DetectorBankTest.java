package asl.tubecal.input;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import asl.tubecal.calibration.CalibrationApplyException;
import asl.tubecal.output.CalibrationRow;
import asl.tubecal.output.CalibrationTable;
import java.util.Arrays;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.junit.Test;

public class DetectorBankTest {

  private static DetectorBank smallBank() {
    return DetectorBank.createRegularBank(BankSide.REAR, 3, 5, 1.0, 0.01, 4.0, 100);
  }

  @Test
  public void regularBankLayout() {
    DetectorBank bank = smallBank();
    assertEquals(3, bank.getNumberOfTubes());
    assertEquals(15, bank.getNumberOfDetectors());

    Vector3D first = bank.getFirstBasePosition(new TubeId(1));
    Vector3D last = bank.getLastBasePosition(new TubeId(1));
    assertEquals(-0.5, first.getX(), 1E-12);
    assertEquals(0.5, last.getX(), 1E-12);
    assertEquals(0., first.getY(), 1E-12);
    assertEquals(4.0, first.getZ(), 1E-12);
    assertEquals(-0.01, bank.getFirstBasePosition(new TubeId(0)).getY(), 1E-12);
    assertEquals(0.25, bank.getBasePosition(8).getX(), 1E-12);
  }

  @Test
  public void tubeSlicing() {
    DetectorBank bank = smallBank();
    assertArrayEquals(new int[]{110, 111, 112, 113, 114},
        bank.getTubeDetectorIds(new TubeId(2)));
    assertArrayEquals(new int[]{5, 6, 7, 8, 9}, bank.getTubeIndices(new TubeId(1)));

    double[] counts = new double[15];
    for (int i = 0; i < counts.length; ++i) {
      counts[i] = i;
    }
    assertArrayEquals(new double[]{5, 6, 7, 8, 9},
        bank.getTubeCounts(counts, new TubeId(1)), 0.);
  }

  @Test(expected = IndexOutOfBoundsException.class)
  public void tubeOutsideBank() {
    smallBank().getTubeDetectorIds(new TubeId(3));
  }

  @Test(expected = IllegalArgumentException.class)
  public void partialTubeRejected() {
    new DetectorBank(BankSide.REAR, 4, new int[]{1, 2, 3},
        new Vector3D[]{Vector3D.ZERO, Vector3D.PLUS_I, Vector3D.PLUS_J});
  }

  @Test
  public void applyCalibrationMovesDetectors() throws CalibrationApplyException {
    DetectorBank bank = smallBank();
    CalibrationTable table = new CalibrationTable();
    Vector3D moved = new Vector3D(0.1, 0.2, 0.3);
    table.addAll(Arrays.asList(new CalibrationRow(103, moved)));
    bank.applyCalibration(table);

    assertEquals(moved, bank.getPosition(103));
    // base positions and other detectors are untouched
    assertEquals(0.25, bank.getBasePosition(3).getX(), 1E-12);
    assertEquals(bank.getBasePosition(4), bank.getPosition(104));
  }

  @Test
  public void applyCalibrationIsAtomic() {
    DetectorBank bank = smallBank();
    CalibrationTable table = new CalibrationTable();
    table.addAll(Arrays.asList(new CalibrationRow(100, Vector3D.ZERO),
        new CalibrationRow(999, Vector3D.ZERO)));
    try {
      bank.applyCalibration(table);
      fail("Unknown detector should have been rejected");
    } catch (CalibrationApplyException e) {
      assertTrue(e.getMessage().contains("999"));
    }
    assertEquals(bank.getBasePosition(0), bank.getPosition(100));
    assertFalse(bank.hasDetector(999));
  }

  @Test(expected = CalibrationApplyException.class)
  public void emptyTableRejected() throws CalibrationApplyException {
    smallBank().applyCalibration(new CalibrationTable());
  }
}
