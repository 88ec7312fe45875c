package asl.tubecal.input;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import asl.tubecal.calibration.ConfigurationException;
import asl.tubecal.calibration.FitMode;
import asl.tubecal.test.TestUtils;
import java.io.File;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class CalibrationConfigurationTest {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void defaultsMatchRearBank() {
    CalibrationConfiguration config = new CalibrationConfiguration();
    assertEquals(Arrays.asList(1040, 920, 755, 590, 425, 260, 95, 5),
        config.getStripPositions());
    assertEquals(38.0, config.getStripWidth(), 0.);
    assertEquals(270.0, config.getEncoderAtBeamCentre(1040), 0.);
    assertEquals(470.0, config.getEncoderAtBeamCentre(260), 0.);
    assertEquals(FitMode.FLAT_TOP_PEAK, config.getFitMode());
    assertEquals(BankSide.REAR, config.getBankSide());
    assertNull(config.getSeedHeight());
  }

  @Test
  public void overridesOnlyApplyToRearBank() {
    CalibrationConfiguration config = new CalibrationConfiguration();
    config.setRearDetector(false);
    assertEquals(270.0, config.getEncoderAtBeamCentre(260), 0.);
    assertEquals(BankSide.FRONT, config.getBankSide());
  }

  @Test
  public void embeddedDefaultMatchesConstructor() throws ConfigurationException {
    CalibrationConfiguration embedded = CalibrationConfiguration.fromEmbeddedDefault();
    CalibrationConfiguration plain = new CalibrationConfiguration();
    assertEquals(plain.getStripPositions(), embedded.getStripPositions());
    assertEquals(plain.getEncoderOverrides(), embedded.getEncoderOverrides());
    assertEquals(plain.getHalfDetectorWidth(), embedded.getHalfDetectorWidth(), 0.);
    assertEquals(plain.getEndingPixel(), embedded.getEndingPixel());
    assertEquals(plain.getCvalueThreshold(), embedded.getCvalueThreshold(), 0.);
  }

  @Test
  public void readsTestFile() throws ConfigurationException {
    CalibrationConfiguration config = CalibrationConfiguration
        .fromFile(TestUtils.TEST_DATA_LOCATION + "front-calibration-config.xml");
    assertFalse(config.isRearDetector());
    assertEquals(Arrays.asList(920, 755, 590), config.getStripPositions());
    assertEquals(Arrays.asList("SANS2D00028797", "SANS2D00028798", "SANS2D00028799"),
        config.getDataIds());
    assertTrue(config.getEncoderOverrides().isEmpty());
    assertEquals(-0.098, config.getSideOffset(), 0.);
    assertTrue(config.isFitEdges());
    assertTrue(config.isSkipTubesOnError());
    assertEquals(800., config.getSeedHeight(), 0.);
    assertNull(config.getSeedWidth());
    // missing keys keep their defaults
    assertEquals(21.0, config.getStripToTubeCentre(), 0.);
  }

  @Test
  public void saveAndReload() throws Exception {
    CalibrationConfiguration config = TestUtils.createConfiguration(true);
    Map<Integer, Double> overrides = new HashMap<>();
    overrides.put(450, 480.5);
    config.setEncoderOverrides(overrides);
    config.setSeedWidth(12.);
    config.setParallelTubes(true);

    File file = folder.newFile("saved.xml");
    config.save(file.getAbsolutePath());
    CalibrationConfiguration reloaded = CalibrationConfiguration.fromFile(file.getAbsolutePath());

    assertEquals(config.getStripPositions(), reloaded.getStripPositions());
    assertEquals(overrides, reloaded.getEncoderOverrides());
    assertEquals(12., reloaded.getSeedWidth(), 0.);
    assertNull(reloaded.getSeedHeight());
    assertTrue(reloaded.isParallelTubes());
    assertTrue(reloaded.isFitEdges());
    assertEquals(400., reloaded.getThreshold(), 0.);
    assertEquals(122, reloaded.getEndingPixel());
  }

  @Test
  public void emptyOverridesSurviveSaving() throws Exception {
    CalibrationConfiguration config = new CalibrationConfiguration();
    config.setEncoderOverrides(Collections.<Integer, Double>emptyMap());
    File file = folder.newFile("no-overrides.xml");
    config.save(file.getAbsolutePath());
    assertTrue(CalibrationConfiguration.fromFile(file.getAbsolutePath())
        .getEncoderOverrides().isEmpty());
  }

  @Test(expected = ConfigurationException.class)
  public void missingFile() throws ConfigurationException {
    CalibrationConfiguration.fromFile(TestUtils.TEST_DATA_LOCATION + "no-such-config.xml");
  }

  @Test(expected = ConfigurationException.class)
  public void endingPixelBeforeStart() throws ConfigurationException {
    CalibrationConfiguration config = new CalibrationConfiguration();
    config.setStartingPixel(100);
    config.setEndingPixel(50);
    config.validate();
  }

  @Test(expected = ConfigurationException.class)
  public void dataIdsMustMatchPositions() throws ConfigurationException {
    CalibrationConfiguration config = new CalibrationConfiguration();
    config.setDataIds(Arrays.asList("a", "b"));
    config.validate();
  }

  @Test(expected = ConfigurationException.class)
  public void noStripPositions() throws ConfigurationException {
    CalibrationConfiguration config = new CalibrationConfiguration();
    config.setStripPositions(Collections.<Integer>emptyList());
    config.validate();
  }
}
