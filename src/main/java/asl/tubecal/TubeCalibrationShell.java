package asl.tubecal;

import asl.tubecal.calibration.CalibrationException;
import asl.tubecal.calibration.ConfigurationException;
import asl.tubecal.calibration.TubeCalibrationExperiment;
import asl.tubecal.input.CalibrationConfiguration;
import asl.tubecal.input.DetectorBank;
import asl.tubecal.input.StripMeasurement;
import asl.tubecal.input.TubeId;
import asl.tubecal.output.CalResult;
import asl.tubecal.utils.ReportingUtils;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.log4j.Logger;
import py4j.GatewayServer;

/**
 * Entry point for scripted calibration runs. A Python client connects through py4j, sets up
 * the configuration and bank, hands over the integrated counts of each strip measurement and
 * then runs the calibration, reading the results back as a {@link CalResult}.
 */
public class TubeCalibrationShell {

  private static final Logger logger = Logger.getLogger(TubeCalibrationShell.class);

  private CalibrationConfiguration config;
  private DetectorBank bank;
  private final List<StripMeasurement> measurements;
  private TubeCalibrationExperiment experiment;

  public TubeCalibrationShell() {
    config = new CalibrationConfiguration();
    measurements = new ArrayList<>();
  }

  /**
   * Replace the configuration with one read from an XML file
   * @param configLocation Path to the XML configuration
   * @throws ConfigurationException if the file cannot be read
   */
  public void loadConfiguration(String configLocation) throws ConfigurationException {
    config = CalibrationConfiguration.fromFile(configLocation);
  }

  public void setConfiguration(CalibrationConfiguration config) {
    this.config = config;
  }

  /**
   * Get the configuration in use, so that individual options can be changed by the client
   * @return the current configuration
   */
  public CalibrationConfiguration getConfiguration() {
    return config;
  }

  /**
   * Use an idealised bank of horizontal tubes for the configured side, see
   * {@link DetectorBank#createRegularBank}
   */
  public void setRegularBank(int numTubes, int pixelsPerTube, double tubeLength,
      double tubeSpacing, double z, int firstDetectorId) {
    bank = DetectorBank.createRegularBank(config.getBankSide(), numTubes, pixelsPerTube,
        tubeLength, tubeSpacing, z, firstDetectorId);
  }

  public DetectorBank getBank() {
    return bank;
  }

  /**
   * Add the integrated counts of one strip position. Measurements must be added in the order of
   * the configured strip positions.
   * @param name Identifier of the run
   * @param stripPosition Encoder position of the strip
   * @param counts Integrated counts of each detector, tube by tube
   * @param sampleToDetectorDistance Sample to detector distance (mm)
   * @param protonCharge Beam intensity of the run
   */
  public void addMeasurement(String name, int stripPosition, double[] counts,
      double sampleToDetectorDistance, double protonCharge) {
    measurements.add(new StripMeasurement(name, stripPosition, counts, config.getBankSide(),
        sampleToDetectorDistance, protonCharge));
  }

  public void clearMeasurements() {
    measurements.clear();
  }

  /**
   * Calibrate the bank with the measurements added so far
   * @return calibrated positions, cvalues and skipped tubes
   * @throws CalibrationException if the run aborts
   * @throws IOException if the cvalue plot cannot be rendered
   */
  public CalResult runCalibration() throws CalibrationException, IOException {
    if (bank == null) {
      throw new ConfigurationException("No detector bank has been set");
    }
    experiment = new TubeCalibrationExperiment(config, bank);
    experiment.runExperimentOnData(measurements);

    List<TubeId> failed = experiment.getFailedTubes();
    double[] failedIds = new double[failed.size()];
    for (int i = 0; i < failedIds.length; ++i) {
      failedIds[i] = failed.get(i).getId();
    }
    byte[] plot = ReportingUtils.chartToPNG(
        ReportingUtils.createCvalueChart(experiment.getCvalueReport()));
    return CalResult.buildTubeCalData(experiment.getCalibrationTable(),
        experiment.getCvalueReport(), failedIds, plot);
  }

  /**
   * Return the experiment of the last run, to enable reading the full results.
   * This should not be called until runCalibration() has been.
   * @return tube calibration experiment
   */
  public TubeCalibrationExperiment getExperiment() {
    return experiment;
  }

  public static void main(String[] args) {
    GatewayServer gatewayServer = new GatewayServer(new TubeCalibrationShell());
    gatewayServer.start();
    logger.info("Gateway Server Started");
  }
}
