package asl.tubecal.input;

import asl.tubecal.calibration.ConfigurationException;
import asl.tubecal.calibration.FitMode;
import java.io.File;
import java.net.URL;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration.HierarchicalConfiguration;
import org.apache.commons.configuration.XMLConfiguration;
import org.apache.log4j.Logger;

/**
 * Parameters of a tube calibration run: where the strips were placed, the strip geometry, the
 * edge-finding threshold and region, and the fitting options. Values default to those used for
 * the SANS2D rear detector and can be read from (and written back to) an XML file.
 *
 * The XML layout mirrors the groups below, e.g. the strip width is read from
 * {@code TubeCalibration.Strips.Width}. Encoder overrides are given as
 * {@code <Override position="260" encoder="470.0"/>} entries.
 */
public class CalibrationConfiguration {

  static final String DEFAULT_CONFIG_PATH = "tube-calibration-config.xml";
  private static final Logger logger = Logger.getLogger(CalibrationConfiguration.class);

  private static final String OVERRIDE_KEY = "Strips.EncoderOverrides.Override";

  // strips
  private List<Integer> stripPositions =
      new ArrayList<>(Arrays.asList(1040, 920, 755, 590, 425, 260, 95, 5));
  private List<String> dataIds = new ArrayList<>();
  private double stripWidth = 38.0;
  private double stripToTubeCentre = 21.0;
  private double halfDetectorWidth = 520.7;
  private double sideOffset = 0.0;
  private double encoderAtBeamCentre = 270.0;
  private Map<Integer, Double> encoderOverrides = new LinkedHashMap<>();

  // detector
  private boolean rearDetector = true;
  private boolean skipTubesOnError = false;
  private double verticalOffset = -0.005;
  private boolean parallelTubes = false;

  // edge finding
  private double threshold = 600;
  private int startingPixel = 20;
  private int endingPixel = 495;

  // fitting
  private boolean fitEdges = false;
  private int margin = 25;
  private double outEdge = 10.0;
  private double inEdge = 10.0;
  private double edgeWidth = 6.0;
  private double background = 10.0;
  private Double seedHeight = null;
  private Double seedWidth = null;
  private int maxIterations = 1000;

  // output
  private double cvalueThreshold = 6.0;
  private String cvalueReportPath = null;
  private String geometryPath = null;
  private String diagnosticsReportPath = null;

  /**
   * Create a configuration holding the default values
   */
  public CalibrationConfiguration() {
    encoderOverrides.put(260, 470.0);
  }

  /**
   * Read a configuration from an XML file. Keys missing from the file keep their defaults.
   *
   * @param configLocation Path of the XML file
   * @return configuration read from the file
   * @throws ConfigurationException if the file cannot be read or parsed
   */
  public static CalibrationConfiguration fromFile(String configLocation)
      throws ConfigurationException {
    logger.info("Attempting reading in config file from " + configLocation);
    try {
      XMLConfiguration config = new XMLConfiguration(new File(configLocation));
      return fromXml(config);
    } catch (org.apache.commons.configuration.ConfigurationException e) {
      throw new ConfigurationException("Error reading XML configuration " + configLocation, e);
    }
  }

  /**
   * Read the configuration shipped inside the jar
   *
   * @return configuration read from the embedded resource
   * @throws ConfigurationException if the resource is missing or unreadable
   */
  public static CalibrationConfiguration fromEmbeddedDefault() throws ConfigurationException {
    URL resource =
        CalibrationConfiguration.class.getClassLoader().getResource(DEFAULT_CONFIG_PATH);
    if (resource == null) {
      throw new ConfigurationException("Config XML file " + DEFAULT_CONFIG_PATH
          + " not part of resources");
    }
    try {
      return fromXml(new XMLConfiguration(resource));
    } catch (org.apache.commons.configuration.ConfigurationException e) {
      throw new ConfigurationException("Error reading embedded XML configuration", e);
    }
  }

  private static CalibrationConfiguration fromXml(XMLConfiguration config)
      throws ConfigurationException {
    CalibrationConfiguration out = new CalibrationConfiguration();
    try {
      String[] positions = config.getStringArray("Strips.Position");
      if (positions.length > 0) {
        List<Integer> parsed = new ArrayList<>();
        for (String position : positions) {
          parsed.add(Integer.parseInt(position.trim()));
        }
        out.stripPositions = parsed;
      }
      String[] ids = config.getStringArray("Strips.DataId");
      out.dataIds = new ArrayList<>();
      for (String id : ids) {
        out.dataIds.add(id.trim());
      }
      out.stripWidth = config.getDouble("Strips.Width", out.stripWidth);
      out.stripToTubeCentre = config.getDouble("Strips.StripToTubeCentre",
          out.stripToTubeCentre);
      out.halfDetectorWidth = config.getDouble("Strips.HalfDetectorWidth",
          out.halfDetectorWidth);
      out.sideOffset = config.getDouble("Strips.SideOffset", out.sideOffset);
      out.encoderAtBeamCentre = config.getDouble("Strips.EncoderAtBeamCentre",
          out.encoderAtBeamCentre);

      // an EncoderOverrides element, even an empty one, replaces the default override
      if (config.getMaxIndex("Strips.EncoderOverrides") >= 0
          || config.getMaxIndex(OVERRIDE_KEY) >= 0) {
        out.encoderOverrides = new LinkedHashMap<>();
        for (HierarchicalConfiguration sub : config.configurationsAt(OVERRIDE_KEY)) {
          out.encoderOverrides.put(sub.getInt("[@position]"), sub.getDouble("[@encoder]"));
        }
      }

      out.rearDetector = config.getBoolean("Detector.Rear", out.rearDetector);
      out.skipTubesOnError = config.getBoolean("Detector.SkipTubesOnError",
          out.skipTubesOnError);
      out.verticalOffset = config.getDouble("Detector.VerticalOffset", out.verticalOffset);
      out.parallelTubes = config.getBoolean("Detector.ParallelTubes", out.parallelTubes);

      out.threshold = config.getDouble("EdgeFinding.Threshold", out.threshold);
      out.startingPixel = config.getInt("EdgeFinding.StartingPixel", out.startingPixel);
      out.endingPixel = config.getInt("EdgeFinding.EndingPixel", out.endingPixel);

      out.fitEdges = config.getBoolean("Fitting.FitEdges", out.fitEdges);
      out.margin = config.getInt("Fitting.Margin", out.margin);
      out.outEdge = config.getDouble("Fitting.OutEdge", out.outEdge);
      out.inEdge = config.getDouble("Fitting.InEdge", out.inEdge);
      out.edgeWidth = config.getDouble("Fitting.EdgeWidth", out.edgeWidth);
      out.background = config.getDouble("Fitting.Background", out.background);
      if (config.containsKey("Fitting.SeedHeight")) {
        out.seedHeight = config.getDouble("Fitting.SeedHeight");
      }
      if (config.containsKey("Fitting.SeedWidth")) {
        out.seedWidth = config.getDouble("Fitting.SeedWidth");
      }
      out.maxIterations = config.getInt("Fitting.MaxIterations", out.maxIterations);

      out.cvalueThreshold = config.getDouble("Output.CvalueThreshold", out.cvalueThreshold);
      out.cvalueReportPath = config.getString("Output.CvalueReportPath");
      out.geometryPath = config.getString("Output.GeometryPath");
      out.diagnosticsReportPath = config.getString("Output.DiagnosticsReportPath");
    } catch (RuntimeException e) {
      // commons-configuration signals badly-typed values with unchecked exceptions
      throw new ConfigurationException("Malformed configuration value: " + e.getMessage(), e);
    }
    logger.info("Successfully loaded in configuration for " + out.stripPositions.size()
        + " strip positions");
    return out;
  }

  /**
   * Write this configuration out as XML, in the layout read by {@link #fromFile(String)}
   *
   * @param configLocation Path of the file to write
   * @throws ConfigurationException if the file cannot be written
   */
  public void save(String configLocation) throws ConfigurationException {
    XMLConfiguration config = new XMLConfiguration();
    config.setRootElementName("TubeCalibration");
    for (int position : stripPositions) {
      config.addProperty("Strips.Position", position);
    }
    for (String id : dataIds) {
      config.addProperty("Strips.DataId", id);
    }
    config.addProperty("Strips.Width", stripWidth);
    config.addProperty("Strips.StripToTubeCentre", stripToTubeCentre);
    config.addProperty("Strips.HalfDetectorWidth", halfDetectorWidth);
    config.addProperty("Strips.SideOffset", sideOffset);
    config.addProperty("Strips.EncoderAtBeamCentre", encoderAtBeamCentre);
    if (encoderOverrides.isEmpty()) {
      config.addProperty("Strips.EncoderOverrides", "");
    }
    int index = 0;
    for (Map.Entry<Integer, Double> entry : encoderOverrides.entrySet()) {
      config.addProperty(OVERRIDE_KEY + "(-1)[@position]", entry.getKey());
      config.addProperty(OVERRIDE_KEY + "(" + index + ")[@encoder]", entry.getValue());
      ++index;
    }

    config.addProperty("Detector.Rear", rearDetector);
    config.addProperty("Detector.SkipTubesOnError", skipTubesOnError);
    config.addProperty("Detector.VerticalOffset", verticalOffset);
    config.addProperty("Detector.ParallelTubes", parallelTubes);

    config.addProperty("EdgeFinding.Threshold", threshold);
    config.addProperty("EdgeFinding.StartingPixel", startingPixel);
    config.addProperty("EdgeFinding.EndingPixel", endingPixel);

    config.addProperty("Fitting.FitEdges", fitEdges);
    config.addProperty("Fitting.Margin", margin);
    config.addProperty("Fitting.OutEdge", outEdge);
    config.addProperty("Fitting.InEdge", inEdge);
    config.addProperty("Fitting.EdgeWidth", edgeWidth);
    config.addProperty("Fitting.Background", background);
    if (seedHeight != null) {
      config.addProperty("Fitting.SeedHeight", seedHeight);
    }
    if (seedWidth != null) {
      config.addProperty("Fitting.SeedWidth", seedWidth);
    }
    config.addProperty("Fitting.MaxIterations", maxIterations);

    config.addProperty("Output.CvalueThreshold", cvalueThreshold);
    if (cvalueReportPath != null) {
      config.addProperty("Output.CvalueReportPath", cvalueReportPath);
    }
    if (geometryPath != null) {
      config.addProperty("Output.GeometryPath", geometryPath);
    }
    if (diagnosticsReportPath != null) {
      config.addProperty("Output.DiagnosticsReportPath", diagnosticsReportPath);
    }

    try {
      config.save(new File(configLocation));
      logger.info("Saved configuration to " + configLocation);
    } catch (org.apache.commons.configuration.ConfigurationException e) {
      throw new ConfigurationException("Could not write configuration to " + configLocation, e);
    }
  }

  /**
   * Check that the parameters can describe a run at all
   *
   * @throws ConfigurationException describing the first problem found
   */
  public void validate() throws ConfigurationException {
    if (stripPositions.isEmpty()) {
      throw new ConfigurationException("No strip positions given");
    }
    if (!dataIds.isEmpty() && dataIds.size() != stripPositions.size()) {
      throw new ConfigurationException("Got " + dataIds.size() + " data identifiers for "
          + stripPositions.size() + " strip positions");
    }
    if (stripWidth <= 0) {
      throw new ConfigurationException("Strip width must be positive, got " + stripWidth);
    }
    if (startingPixel < 0) {
      throw new ConfigurationException("Starting pixel cannot be negative: " + startingPixel);
    }
    if (endingPixel <= startingPixel) {
      throw new ConfigurationException("Ending pixel " + endingPixel
          + " is not after starting pixel " + startingPixel);
    }
    if (margin < 0) {
      throw new ConfigurationException("Fit margin cannot be negative: " + margin);
    }
    if (maxIterations < 1) {
      throw new ConfigurationException("At least one fit iteration must be allowed");
    }
  }

  /**
   * Encoder reading at the beam centre to use for a given strip position. Overrides only apply
   * on the rear bank.
   *
   * @param stripPosition Encoder position of the strip
   * @return reference encoder value for the parallax correction
   */
  public double getEncoderAtBeamCentre(int stripPosition) {
    if (rearDetector && encoderOverrides.containsKey(stripPosition)) {
      return encoderOverrides.get(stripPosition);
    }
    return encoderAtBeamCentre;
  }

  /**
   * @return which fit model is used on each expected position
   */
  public FitMode getFitMode() {
    return fitEdges ? FitMode.EDGES : FitMode.FLAT_TOP_PEAK;
  }

  public BankSide getBankSide() {
    return BankSide.fromRearFlag(rearDetector);
  }

  public List<Integer> getStripPositions() {
    return Collections.unmodifiableList(stripPositions);
  }

  public void setStripPositions(List<Integer> stripPositions) {
    this.stripPositions = new ArrayList<>(stripPositions);
  }

  public List<String> getDataIds() {
    return Collections.unmodifiableList(dataIds);
  }

  public void setDataIds(List<String> dataIds) {
    this.dataIds = new ArrayList<>(dataIds);
  }

  public double getStripWidth() {
    return stripWidth;
  }

  public void setStripWidth(double stripWidth) {
    this.stripWidth = stripWidth;
  }

  public double getStripToTubeCentre() {
    return stripToTubeCentre;
  }

  public void setStripToTubeCentre(double stripToTubeCentre) {
    this.stripToTubeCentre = stripToTubeCentre;
  }

  public double getHalfDetectorWidth() {
    return halfDetectorWidth;
  }

  public void setHalfDetectorWidth(double halfDetectorWidth) {
    this.halfDetectorWidth = halfDetectorWidth;
  }

  public double getSideOffset() {
    return sideOffset;
  }

  public void setSideOffset(double sideOffset) {
    this.sideOffset = sideOffset;
  }

  public double getEncoderAtBeamCentre() {
    return encoderAtBeamCentre;
  }

  public void setEncoderAtBeamCentre(double encoderAtBeamCentre) {
    this.encoderAtBeamCentre = encoderAtBeamCentre;
  }

  public Map<Integer, Double> getEncoderOverrides() {
    return Collections.unmodifiableMap(encoderOverrides);
  }

  public void setEncoderOverrides(Map<Integer, Double> encoderOverrides) {
    this.encoderOverrides = new LinkedHashMap<>(encoderOverrides);
  }

  public boolean isRearDetector() {
    return rearDetector;
  }

  public void setRearDetector(boolean rearDetector) {
    this.rearDetector = rearDetector;
  }

  public boolean isSkipTubesOnError() {
    return skipTubesOnError;
  }

  public void setSkipTubesOnError(boolean skipTubesOnError) {
    this.skipTubesOnError = skipTubesOnError;
  }

  public double getVerticalOffset() {
    return verticalOffset;
  }

  public void setVerticalOffset(double verticalOffset) {
    this.verticalOffset = verticalOffset;
  }

  public boolean isParallelTubes() {
    return parallelTubes;
  }

  public void setParallelTubes(boolean parallelTubes) {
    this.parallelTubes = parallelTubes;
  }

  public double getThreshold() {
    return threshold;
  }

  public void setThreshold(double threshold) {
    this.threshold = threshold;
  }

  public int getStartingPixel() {
    return startingPixel;
  }

  public void setStartingPixel(int startingPixel) {
    this.startingPixel = startingPixel;
  }

  public int getEndingPixel() {
    return endingPixel;
  }

  public void setEndingPixel(int endingPixel) {
    this.endingPixel = endingPixel;
  }

  public boolean isFitEdges() {
    return fitEdges;
  }

  public void setFitEdges(boolean fitEdges) {
    this.fitEdges = fitEdges;
  }

  public int getMargin() {
    return margin;
  }

  public void setMargin(int margin) {
    this.margin = margin;
  }

  public double getOutEdge() {
    return outEdge;
  }

  public void setOutEdge(double outEdge) {
    this.outEdge = outEdge;
  }

  public double getInEdge() {
    return inEdge;
  }

  public void setInEdge(double inEdge) {
    this.inEdge = inEdge;
  }

  public double getEdgeWidth() {
    return edgeWidth;
  }

  public void setEdgeWidth(double edgeWidth) {
    this.edgeWidth = edgeWidth;
  }

  public double getBackground() {
    return background;
  }

  public void setBackground(double background) {
    this.background = background;
  }

  /**
   * @return seed of the shadow depth for peak fits, or null to estimate it from the data
   */
  public Double getSeedHeight() {
    return seedHeight;
  }

  public void setSeedHeight(Double seedHeight) {
    this.seedHeight = seedHeight;
  }

  /**
   * @return seed of the shadow width for peak fits, or null to estimate it from the window
   */
  public Double getSeedWidth() {
    return seedWidth;
  }

  public void setSeedWidth(Double seedWidth) {
    this.seedWidth = seedWidth;
  }

  public int getMaxIterations() {
    return maxIterations;
  }

  public void setMaxIterations(int maxIterations) {
    this.maxIterations = maxIterations;
  }

  public double getCvalueThreshold() {
    return cvalueThreshold;
  }

  public void setCvalueThreshold(double cvalueThreshold) {
    this.cvalueThreshold = cvalueThreshold;
  }

  public String getCvalueReportPath() {
    return cvalueReportPath;
  }

  public void setCvalueReportPath(String cvalueReportPath) {
    this.cvalueReportPath = cvalueReportPath;
  }

  public String getGeometryPath() {
    return geometryPath;
  }

  public void setGeometryPath(String geometryPath) {
    this.geometryPath = geometryPath;
  }

  public String getDiagnosticsReportPath() {
    return diagnosticsReportPath;
  }

  public void setDiagnosticsReportPath(String diagnosticsReportPath) {
    this.diagnosticsReportPath = diagnosticsReportPath;
  }
}
