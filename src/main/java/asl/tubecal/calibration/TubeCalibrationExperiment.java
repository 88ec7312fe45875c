package asl.tubecal.calibration;

import asl.tubecal.input.CalibrationConfiguration;
import asl.tubecal.input.DetectorBank;
import asl.tubecal.input.StripMeasurement;
import asl.tubecal.input.TubeId;
import asl.tubecal.output.CalibrationRow;
import asl.tubecal.output.CalibrationTable;
import asl.tubecal.output.CvalueReport;
import asl.tubecal.output.TubeDiagnostics;
import asl.tubecal.utils.NumericUtils;
import asl.tubecal.utils.ReportingUtils;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.IntStream;
import org.apache.log4j.Logger;

/**
 * Calibrates the pixel positions of every tube of a detector bank from a set of strip
 * measurements. Strip edges are calculated from the encoder positions, the measurements are
 * merged into one dataset, and then each tube is processed in turn: its threshold crossings are
 * found, refined by fitting, turned into a position correction and projected into 3D.
 * The accumulated calibration table is applied to the bank in one step at the end of the run.
 *
 * Tubes that cannot be calibrated either abort the run or are skipped, depending on the
 * skip-tubes-on-error setting. Skipped tubes are listed together at the end of the run.
 * The cvalue (mean fit resolution) of each calibrated tube is checked against a threshold.
 *
 * Plot data produced by a run consists of the four diagnostic plots of each calibrated tube,
 * in tube order.
 */
public class TubeCalibrationExperiment extends Experiment {

  private static final Logger logger = Logger.getLogger(TubeCalibrationExperiment.class);

  private final CalibrationConfiguration config;
  private final DetectorBank bank;

  private CalibrationState state;
  private List<StripShadow> stripEdges;
  private MergedMeasurement merged;
  private CalibrationTable table;
  private CvalueReport cvalueReport;
  private List<TubeDiagnostics> diagnostics;
  private List<String> errors;
  private List<TubeId> failedTubes;

  /**
   * @param config Parameters of the run
   * @param bank Detector bank being calibrated; its positions are replaced on success
   */
  public TubeCalibrationExperiment(CalibrationConfiguration config, DetectorBank bank) {
    super();
    this.config = config;
    this.bank = bank;
    state = CalibrationState.INIT;
    stripEdges = new ArrayList<>();
    table = new CalibrationTable();
    cvalueReport = new CvalueReport(config.getCvalueThreshold());
    diagnostics = new ArrayList<>();
    errors = new ArrayList<>();
    failedTubes = new ArrayList<>();
  }

  @Override
  public boolean hasEnoughData(final List<StripMeasurement> measurements) {
    return measurements != null && !measurements.isEmpty();
  }

  @Override
  void dataRejected(String reason) {
    state = CalibrationState.ABORTED;
    logger.error("Tube calibration aborted: " + reason);
    fireStateChange("Calibration aborted: " + reason);
  }

  @Override
  protected void backend(final List<StripMeasurement> measurements)
      throws CalibrationException {
    state = CalibrationState.INIT;
    stripEdges = new ArrayList<>();
    merged = null;
    table = new CalibrationTable();
    cvalueReport = new CvalueReport(config.getCvalueThreshold());
    diagnostics = new ArrayList<>();
    errors = new ArrayList<>();
    failedTubes = new ArrayList<>();

    try {
      List<StripMeasurement> scaled = checkAndNormalise(measurements);
      state = CalibrationState.LOADED;

      fireStateChange("Calculating strip edges...");
      stripEdges = new StripEdgeCalculator(config).computeAllEdges(scaled);

      fireStateChange("Merging strip measurements...");
      merged = new DatasetMerger().merge(stripEdges, bank);
      state = CalibrationState.MERGED;
      logger.info("Known edges after merge: " + formatEdges(merged.getKnownEdges()));

      state = CalibrationState.PER_TUBE_LOOP;
      calibrateTubes();

      fireStateChange("Applying calibration...");
      bank.applyCalibration(table);
      state = CalibrationState.CALIBRATED;

      report();
      state = CalibrationState.REPORTED;
    } catch (CalibrationException | RuntimeException e) {
      state = CalibrationState.ABORTED;
      logger.error("Tube calibration aborted: " + e.getMessage(), e);
      fireStateChange("Calibration aborted: " + e.getMessage());
      throw e;
    }
  }

  /**
   * Check measurements against the configuration and rescale them to the beam intensity of
   * the first run
   */
  private List<StripMeasurement> checkAndNormalise(List<StripMeasurement> measurements)
      throws ConfigurationException {
    config.validate();
    List<Integer> positions = config.getStripPositions();
    if (measurements.size() != positions.size()) {
      throw new ConfigurationException("Got " + measurements.size()
          + " measurements for " + positions.size() + " strip positions");
    }
    if (bank.getSide() != config.getBankSide()) {
      throw new ConfigurationException("Configured for the "
          + config.getBankSide().getDetectorName() + " bank but given the "
          + bank.getSide().getDetectorName() + " bank");
    }
    if (config.getEndingPixel() > bank.getPixelsPerTube()) {
      throw new ConfigurationException("Ending pixel " + config.getEndingPixel()
          + " is beyond the " + bank.getPixelsPerTube() + " pixels of a tube");
    }

    double reference = measurements.get(0).getIntensityNormalisation();
    List<StripMeasurement> scaled = new ArrayList<>();
    for (int i = 0; i < measurements.size(); ++i) {
      StripMeasurement measurement = measurements.get(i);
      if (measurement.getStripPosition() != positions.get(i)) {
        throw new ConfigurationException("Measurement " + measurement.getName()
            + " was taken at strip position " + measurement.getStripPosition()
            + " but position " + positions.get(i) + " was expected");
      }
      if (measurement.getBankSide() != bank.getSide()) {
        throw new ConfigurationException("Measurement " + measurement.getName()
            + " was recorded on the " + measurement.getBankSide().getDetectorName() + " bank");
      }
      if (measurement.getIntensityNormalisation() <= 0) {
        throw new ConfigurationException("Measurement " + measurement.getName()
            + " has non-positive intensity normalisation "
            + measurement.getIntensityNormalisation());
      }
      scaled.add(measurement.rescaledTo(reference));
    }
    return scaled;
  }

  private void calibrateTubes() throws CalibrationException {
    int numTubes = bank.getNumberOfTubes();
    double[] mergedCounts = merged.getCounts();
    PeakFitter fitter =
        new PeakFitter(config.getFitMode(), FitParameters.fromConfiguration(config));

    // one slot per tube, filled independently and read back in tube order
    TubeOutcome[] outcomes = new TubeOutcome[numTubes];
    TubeCalibrationException[] failures = new TubeCalibrationException[numTubes];

    if (config.isParallelTubes()) {
      fireStateChange("Calibrating " + numTubes + " tubes in parallel...");
      IntStream.range(0, numTubes).parallel().forEach(i -> {
        try {
          outcomes[i] = calibrateTube(new TubeId(i), mergedCounts, fitter);
        } catch (TubeCalibrationException e) {
          failures[i] = e;
        }
      });
    } else {
      for (int i = 0; i < numTubes; ++i) {
        fireStateChange("Calibrating tube " + i + " of " + numTubes + "...");
        try {
          outcomes[i] = calibrateTube(new TubeId(i), mergedCounts, fitter);
        } catch (TubeCalibrationException e) {
          failures[i] = e;
          if (!config.isSkipTubesOnError()) {
            break;
          }
        }
      }
    }

    for (int i = 0; i < numTubes; ++i) {
      if (failures[i] != null) {
        if (!config.isSkipTubesOnError()) {
          throw failures[i];
        }
        errors.add("Cannot calibrate " + failures[i].getMessage());
        failedTubes.add(failures[i].getTube());
        continue;
      }
      TubeOutcome outcome = outcomes[i];
      table.addAll(outcome.rows);
      cvalueReport.record(outcome.diagnostics.getTube(), outcome.meanResolution);
      diagnostics.add(outcome.diagnostics);
      xySeriesData.addAll(outcome.diagnostics.asList());
    }
  }

  /**
   * Run the full calibration of a single tube
   *
   * @param tube Tube to calibrate
   * @param mergedCounts Merged counts of the whole bank
   * @param fitter Fitter for the configured mode
   * @return calibrated rows, cvalue and diagnostics of the tube
   * @throws TubeCalibrationException if any step fails for this tube
   */
  TubeOutcome calibrateTube(TubeId tube, double[] mergedCounts, PeakFitter fitter)
      throws TubeCalibrationException {
    logger.info("Calibrating " + tube + " (" + tube.getName(bank.getSide()) + ")");
    double[] counts = bank.getTubeCounts(mergedCounts, tube);

    EdgePixelDetector detector = new EdgePixelDetector(config.getThreshold(),
        config.getStartingPixel(), config.getEndingPixel());
    List<Integer> guessedPixels = detector.findEdges(counts);
    double[] knownEdges = merged.getKnownEdges();
    if (guessedPixels.size() != knownEdges.length) {
      throw new EdgeCountMismatchException(tube, knownEdges.length, guessedPixels.size());
    }

    double offset = NumericUtils.tubeOffset(tube.getId(), bank.getNumberOfTubes(),
        config.getVerticalOffset());
    double[] guessed = new double[guessedPixels.size()];
    double[] known = new double[knownEdges.length];
    for (int i = 0; i < known.length; ++i) {
      guessed[i] = guessedPixels.get(i);
      known[i] = knownEdges[i] + offset;
    }
    logger.debug(tube + " guessed pixels: " + guessedPixels);
    logger.debug(tube + " known edges: " + formatEdges(known));

    FitMode mode = fitter.getMode();
    double[] guesses = mode.combine(guessed);
    double[] expected = mode.combine(known);

    FitResult fit = fitter.fitTube(tube, counts, guesses);
    double[] corrected = new PixelPositionCorrector()
        .correct(tube, fit.getPositions(), expected, bank.getPixelsPerTube());
    List<CalibrationRow> rows = new CalibratedPositionProjector().project(tube,
        bank.getFirstBasePosition(tube), bank.getLastBasePosition(tube), corrected,
        bank.getTubeDetectorIds(tube));

    int[] indices = bank.getTubeIndices(tube);
    double[] baseX = new double[indices.length];
    for (int i = 0; i < indices.length; ++i) {
      baseX[i] = bank.getBasePosition(indices[i]).getX();
    }
    TubeDiagnostics tubeDiagnostics =
        TubeDiagnostics.build(tube, counts, fit, expected, baseX, rows);
    return new TubeOutcome(rows, fit.getMeanResolution(), tubeDiagnostics);
  }

  private void report() throws CalibrationException {
    fireStateChange("Reporting...");

    logger.info(describeShadows(merged));

    if (!errors.isEmpty()) {
      logger.warn("There were the following tube calibration errors:");
      for (String error : errors) {
        logger.warn(error);
      }
    }

    if (cvalueReport.isNominal()) {
      logger.info(cvalueReport.getStatusLines().get(0));
    } else {
      for (String line : cvalueReport.getStatusLines()) {
        logger.warn(line);
      }
    }

    try {
      if (config.getCvalueReportPath() != null) {
        ReportingUtils.writeCvalueReport(config.getCvalueReportPath(), cvalueReport);
      }
      if (config.getGeometryPath() != null) {
        ReportingUtils.writeGeometry(config.getGeometryPath(), bank);
      }
      if (config.getDiagnosticsReportPath() != null) {
        ReportingUtils.writeDiagnosticsReport(config.getDiagnosticsReportPath(), cvalueReport,
            diagnostics, errors);
      }
    } catch (IOException e) {
      throw new CalibrationException("Could not write calibration output: " + e.getMessage(),
          e);
    }
  }

  /**
   * Summary of the merged shadows in sorted order: edges, width and the region of the bank
   * each measurement contributed to the merged counts
   */
  static String describeShadows(MergedMeasurement merged) {
    List<EdgePair> sortedEdges = merged.getSortedEdges();
    List<String> names = merged.getSourceNames();
    double[] boundaries = merged.getBoundaries();
    StringBuilder sb = new StringBuilder("Strip shadows:");
    for (int i = 0; i < sortedEdges.size(); ++i) {
      EdgePair pair = sortedEdges.get(i);
      sb.append("\n  ").append(names.get(i)).append(": edges ").append(pair)
          .append(", width ").append(pair.getWidth())
          .append(", region [").append(boundaries[i]).append(", ")
          .append(boundaries[i + 1]).append(')');
    }
    return sb.toString();
  }

  private static String formatEdges(double[] edges) {
    StringBuilder sb = new StringBuilder("[");
    for (int i = 0; i < edges.length; ++i) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(edges[i]);
    }
    return sb.append(']').toString();
  }

  @Override
  String[] getDataStrings() {
    List<String> lines = new ArrayList<>(cvalueReport.getStatusLines());
    lines.addAll(errors);
    return lines.toArray(new String[0]);
  }

  public CalibrationConfiguration getConfiguration() {
    return config;
  }

  public DetectorBank getBank() {
    return bank;
  }

  public CalibrationState getState() {
    return state;
  }

  /**
   * @return edges of each strip measurement, in the order the measurements were given
   */
  public List<StripShadow> getStripEdges() {
    return Collections.unmodifiableList(stripEdges);
  }

  /**
   * @return merged dataset of the last run, or null if the run did not get that far
   */
  public MergedMeasurement getMergedMeasurement() {
    return merged;
  }

  public CalibrationTable getCalibrationTable() {
    return table;
  }

  public CvalueReport getCvalueReport() {
    return cvalueReport;
  }

  public List<TubeDiagnostics> getDiagnostics() {
    return Collections.unmodifiableList(diagnostics);
  }

  /**
   * @return messages of the tubes skipped during the last run, in tube order
   */
  public List<String> getErrors() {
    return Collections.unmodifiableList(errors);
  }

  public List<TubeId> getFailedTubes() {
    return Collections.unmodifiableList(failedTubes);
  }

  /**
   * Calibration of a single tube, held until all tubes are done
   */
  static final class TubeOutcome {

    final List<CalibrationRow> rows;
    final double meanResolution;
    final TubeDiagnostics diagnostics;

    TubeOutcome(List<CalibrationRow> rows, double meanResolution,
        TubeDiagnostics diagnostics) {
      this.rows = rows;
      this.meanResolution = meanResolution;
      this.diagnostics = diagnostics;
    }
  }
}
