package asl.tubecal.calibration;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import asl.tubecal.input.BankSide;
import asl.tubecal.input.StripMeasurement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.Test;

public class ExperimentTest {

  @Test
  public void experiment_constructorInitializes() {
    Experiment experiment = new MockExperiment();
    assertTrue(experiment.getInputNames().isEmpty());
    assertEquals("", experiment.getStatus());
    assertNull(experiment.getData());
  }

  @Test
  public void fireStateChange_updatesStatus() {
    MockExperiment experiment = new MockExperiment();
    experiment.fireStateChange("Fired Status Change");
    assertEquals("Fired Status Change", experiment.getStatus());

    assertEquals(1, experiment.numberOfChangesFired);
  }

  @Test
  public void getReportString_joinsLines() {
    assertEquals("first\nsecond", new MockExperiment().getReportString());
  }

  @Test
  public void runExperimentOnData_callsBackend() throws CalibrationException {
    MockExperiment experiment = new MockExperiment();
    List<StripMeasurement> measurements = Collections.singletonList(
        new StripMeasurement("SANS2D00028827", 425, new double[4], BankSide.REAR, 1., 1.));
    experiment.runExperimentOnData(measurements);

    assertTrue(experiment.hasEnoughDataCalled);
    assertTrue(experiment.backendCalled);
    assertEquals(Collections.singletonList("SANS2D00028827"), experiment.getInputNames());
    assertTrue(experiment.getData().isEmpty());
    assertEquals("Calculations done!", experiment.getStatus());
    assertEquals(3, experiment.numberOfChangesFired);
    assertNull(experiment.rejectedReason);
  }

  @Test(expected = ConfigurationException.class)
  public void runExperimentOnData_notEnoughData_throwsException() throws CalibrationException {
    MockExperiment experiment = new MockExperiment();
    //Dirty everything
    experiment.dataNames.add("Not Empty");

    experiment.setHasEnoughData = false;
    try {
      experiment.runExperimentOnData(new ArrayList<StripMeasurement>());
    } catch (ConfigurationException e) {
      assertTrue(experiment.hasEnoughDataCalled);
      assertEquals(false, experiment.backendCalled);
      assertEquals("Not enough strip measurements to run", experiment.rejectedReason);

      assertEquals(1, experiment.numberOfChangesFired);

      //These should have been reinitialized still
      assertTrue(experiment.getInputNames().isEmpty());
      assertTrue(experiment.getData().isEmpty());
      throw e;
    }
  }
}
