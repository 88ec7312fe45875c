package asl.tubecal.input;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class TubeIdTest {

  @Test
  public void evenTubesAreOnTheLeft() {
    TubeId tube = new TubeId(24);
    assertEquals("left", tube.getSide());
    assertEquals(12, tube.getSideNumber());
    assertEquals("rear-detector/left12", tube.getName(BankSide.REAR));
  }

  @Test
  public void oddTubesAreOnTheRight() {
    TubeId tube = new TubeId(7);
    assertEquals("right", tube.getSide());
    assertEquals(3, tube.getSideNumber());
    assertEquals("front-detector/right3", tube.getName(BankSide.FRONT));
  }

  @Test
  public void diagnosticSuffixHasModuleNumbers() {
    TubeId tube = new TubeId(37);
    assertEquals(2, tube.getModule());
    assertEquals(13, tube.getModuleTubeNumber());
    assertEquals("37_2_13", tube.getDiagnosticSuffix());
  }

  @Test
  public void orderedById() {
    assertTrue(new TubeId(3).compareTo(new TubeId(10)) < 0);
    assertEquals(new TubeId(5), new TubeId(5));
    assertEquals("Tube 5", new TubeId(5).toString());
  }

  @Test(expected = IllegalArgumentException.class)
  public void negativeIdRejected() {
    new TubeId(-1);
  }
}
