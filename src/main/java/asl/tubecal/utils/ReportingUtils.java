package asl.tubecal.utils;

import asl.tubecal.input.DetectorBank;
import asl.tubecal.output.CvalueReport;
import asl.tubecal.output.TubeDiagnostics;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.log4j.Logger;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.jfree.chart.ChartFactory;
import org.jfree.chart.ChartUtilities;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * This class defines functions relevant to creating output files, such as images of plots,
 * PDF reports and the flat-text exports of a calibration run. These methods are all static.
 */
public class ReportingUtils {

  private static final Logger logger = Logger.getLogger(ReportingUtils.class);

  private static final int CHART_WIDTH = 640;
  private static final int CHART_HEIGHT = 300;

  /**
   * Add a buffered image to a PDDocument page
   *
   * @param bi BufferedImage to be added to PDF
   * @param pdf PDF to have BufferedImage appended to
   * @throws IOException if the image cannot be encoded into the document
   */
  private static void bufferedImageToPDFPage(BufferedImage bi, PDDocument pdf)
      throws IOException {

    PDRectangle rec = new PDRectangle(bi.getWidth(), bi.getHeight());
    PDPage page = new PDPage(rec);

    PDImageXObject pdImageXObject = LosslessFactory.createFromImage(pdf, bi);
    pdf.addPage(page);
    try (PDPageContentStream contentStream = new PDPageContentStream(pdf, page,
        PDPageContentStream.AppendMode.OVERWRITE, true, false)) {
      contentStream.drawImage(pdImageXObject, 0, 0, bi.getWidth(), bi.getHeight());
    }
  }

  /**
   * Converts a series of charts into a buffered image. Each chart has the dimensions given as
   * the width and height parameters, and so the resulting image has width given by that
   * parameter and height equal to height multiplied by the number of charts passed in
   * (that is, the charts are concatenated vertically)
   *
   * @param width width of each chart plot
   * @param height height of each chart plot
   * @param charts series of charts to be plotted in
   * @return buffered image consisting of the concatenation of the given charts
   */
  public static BufferedImage chartsToImage(int width, int height, JFreeChart... charts) {
    BufferedImage[] bis = new BufferedImage[charts.length];
    for (int i = 0; i < charts.length; ++i) {
      bis[i] = charts[i].createBufferedImage(width, height);
    }
    return mergeBufferedImages(bis);
  }

  /**
   * Takes in a series of charts and produces a PDF page of those charts.
   *
   * @param width Width of each chart to be added to the PDF
   * @param height Height of each chart to be added to the PDF
   * @param pdf PDF document to have the data appended to
   * @param charts series of charts to place in the PDF
   * @throws IOException if the page cannot be written
   */
  public static void chartsToPDFPage(int width, int height, PDDocument pdf,
      JFreeChart... charts) throws IOException {
    BufferedImage bi = chartsToImage(width, height, charts);
    bufferedImageToPDFPage(bi, pdf);
  }

  /**
   * Encode a chart as a PNG image, as handed to scripting clients
   *
   * @param chart Chart to render
   * @return PNG data
   * @throws IOException if encoding fails
   */
  public static byte[] chartToPNG(JFreeChart chart) throws IOException {
    return ChartUtilities.encodeAsPNG(chart.createBufferedImage(CHART_WIDTH, CHART_HEIGHT));
  }

  /**
   * Line chart of plot data, with a legend entry per series
   *
   * @param data Series to plot
   * @param title Chart title
   * @param xAxisLabel Domain label
   * @param yAxisLabel Range label
   * @return chart ready to be rendered
   */
  public static JFreeChart createChart(XYSeriesCollection data, String title, String xAxisLabel,
      String yAxisLabel) {
    return ChartFactory.createXYLineChart(title, xAxisLabel, yAxisLabel, data,
        PlotOrientation.VERTICAL, true, false, false);
  }

  /**
   * Chart of each tube's cvalue with the threshold drawn across it
   *
   * @param report Cvalues of a run
   * @return chart of cvalue against tube id
   */
  public static JFreeChart createCvalueChart(CvalueReport report) {
    XYSeries cvalues = new XYSeries("Cvalue");
    XYSeries threshold = new XYSeries("Threshold");
    double[] ids = report.getTubeIds();
    double[] values = report.getValues();
    for (int i = 0; i < ids.length; ++i) {
      cvalues.add(ids[i], values[i]);
      threshold.add(ids[i], report.getThreshold());
    }
    XYSeriesCollection xysc = new XYSeriesCollection();
    xysc.addSeries(cvalues);
    xysc.addSeries(threshold);
    return createChart(xysc, "Mean fit resolution per tube", "Tube", "Cvalue (pixels)");
  }

  /**
   * Utility function to combine a series of buffered images into a single buffered image.
   * Images are concatenated vertically and centered horizontally into an image as wide as the
   * widest passed-in image
   *
   * @param images Buffered images to send in
   * @return Single concatenated buffered image
   */
  private static BufferedImage mergeBufferedImages(BufferedImage... images) {

    int maxWidth = 0;
    int totalHeight = 0;
    for (BufferedImage bi : images) {
      if (maxWidth < bi.getWidth()) {
        maxWidth = bi.getWidth();
      }
      totalHeight += bi.getHeight();
    }

    BufferedImage out = new BufferedImage(maxWidth, totalHeight, BufferedImage.TYPE_INT_RGB);
    Graphics2D g = out.createGraphics();

    int heightIndex = 0;
    for (BufferedImage bi : images) {
      int centeringOffset = 0;
      if (bi.getWidth() < maxWidth) {
        centeringOffset = (maxWidth - bi.getWidth()) / 2;
      }
      g.drawImage(bi, null, centeringOffset, heightIndex);
      heightIndex += bi.getHeight();
    }
    g.dispose();

    return out;
  }

  /**
   * Add a page to a PDF document consisting of textual data
   *
   * @param toWrite String to add to a new PDF page
   * @param pdf Document to append the page to
   * @throws IOException if the text cannot be laid out or written
   */
  public static void textToPDFPage(String toWrite, PDDocument pdf) throws IOException {

    if (toWrite.length() == 0) {
      return;
    }

    PDPage page = new PDPage();
    pdf.addPage(page);

    PDFont pdfFont = PDType1Font.COURIER;
    float fontSize = 12;
    float leading = 1.5f * fontSize;

    PDRectangle mediaBox = page.getMediaBox();
    float margin = 72;
    float width = mediaBox.getWidth() - 2 * margin;
    float startX = mediaBox.getLowerLeftX() + margin;
    float startY = mediaBox.getUpperRightY() - margin;

    List<String> lines = new ArrayList<>();

    for (String text : toWrite.split("\n")) {

      int lastSpace = -1;
      while (text.length() > 0) {

        int spaceIndex = text.indexOf(' ', lastSpace + 1);
        if (spaceIndex < 0) {
          spaceIndex = text.length();
        }
        String subString = text.substring(0, spaceIndex);
        float size = fontSize * pdfFont.getStringWidth(subString) / 1000;
        if (size > width) {
          if (lastSpace < 0) {
            lastSpace = spaceIndex;
          }
          subString = text.substring(0, lastSpace);
          lines.add(subString);
          text = text.substring(lastSpace).trim();
          lastSpace = -1;
        } else if (spaceIndex == text.length()) {
          lines.add(text);
          text = "";
        } else {
          lastSpace = spaceIndex;
        }
      }
    }

    try (PDPageContentStream contentStream = new PDPageContentStream(pdf, page)) {
      contentStream.beginText();
      contentStream.setFont(pdfFont, fontSize);
      contentStream.newLineAtOffset(startX, startY);
      for (String line : lines) {
        contentStream.showText(line);
        contentStream.newLineAtOffset(0, -leading);
      }
      contentStream.endText();
    }
  }

  /**
   * Write a PDF of a calibration run: a summary page of cvalue warnings and skipped tubes,
   * a chart of the cvalues, then one page of diagnostic plots per calibrated tube
   *
   * @param path File to write
   * @param report Cvalues of the run
   * @param diagnostics Plot data of each calibrated tube
   * @param errors Messages of tubes that were skipped
   * @throws IOException if the document cannot be written
   */
  public static void writeDiagnosticsReport(String path, CvalueReport report,
      List<TubeDiagnostics> diagnostics, List<String> errors) throws IOException {
    StringBuilder sb = new StringBuilder();
    for (String line : report.getStatusLines()) {
      sb.append(line).append('\n');
    }
    if (!errors.isEmpty()) {
      sb.append('\n').append("There were the following tube calibration errors:").append('\n');
      for (String error : errors) {
        sb.append(error).append('\n');
      }
    }

    try (PDDocument pdf = new PDDocument()) {
      textToPDFPage(sb.toString(), pdf);
      if (report.size() > 0) {
        chartsToPDFPage(CHART_WIDTH, CHART_HEIGHT, pdf, createCvalueChart(report));
      }
      for (TubeDiagnostics tube : diagnostics) {
        String name = tube.getName();
        chartsToPDFPage(CHART_WIDTH, CHART_HEIGHT, pdf,
            createChart(tube.getProfile(), name + " counts", "Pixel", "Counts"),
            createChart(tube.getFits(), name + " fits", "Pixel", "Counts"),
            createChart(tube.getResiduals(), name + " known - measured",
                "Uncalibrated position (mm)", "Difference (mm)"),
            createChart(tube.getShifts(), name + " calibration shift",
                "Uncalibrated position (mm)", "Shift (mm)"));
      }
      pdf.save(path);
    }
    logger.info("Wrote diagnostics report for " + diagnostics.size() + " tubes to " + path);
  }

  /**
   * Write the cvalue status lines as flat text
   *
   * @param path File to write
   * @param report Cvalues of the run
   * @throws IOException if the file cannot be written
   */
  public static void writeCvalueReport(String path, CvalueReport report) throws IOException {
    Files.write(Paths.get(path), report.getStatusLines(), StandardCharsets.UTF_8);
    logger.info("Wrote cvalue report to " + path);
  }

  /**
   * Write the current position of every detector of a bank as flat text, one
   * "id x y z" line (metres) per detector
   *
   * @param path File to write
   * @param bank Bank to write out
   * @throws IOException if the file cannot be written
   */
  public static void writeGeometry(String path, DetectorBank bank) throws IOException {
    List<String> lines = new ArrayList<>();
    for (int i = 0; i < bank.getNumberOfDetectors(); ++i) {
      int id = bank.getDetectorId(i);
      Vector3D position = bank.getPosition(id);
      lines.add(id + " " + position.getX() + " " + position.getY() + " " + position.getZ());
    }
    Files.write(Paths.get(path), lines, StandardCharsets.UTF_8);
    logger.info("Wrote geometry of " + lines.size() + " detectors to " + path);
  }

  /**
   * Parse geometry written by {@link #writeGeometry(String, DetectorBank)}
   *
   * @param path File to read
   * @return map from detector id to position, in file order
   * @throws IOException if the file cannot be read or a line is malformed
   */
  public static Map<Integer, Vector3D> readGeometry(String path) throws IOException {
    Map<Integer, Vector3D> out = new LinkedHashMap<>();
    for (String line : Files.readAllLines(Paths.get(path), StandardCharsets.UTF_8)) {
      if (line.trim().isEmpty()) {
        continue;
      }
      String[] fields = line.trim().split("\\s+");
      if (fields.length != 4) {
        throw new IOException("Malformed geometry line: " + line);
      }
      try {
        out.put(Integer.parseInt(fields[0]), new Vector3D(Double.parseDouble(fields[1]),
            Double.parseDouble(fields[2]), Double.parseDouble(fields[3])));
      } catch (NumberFormatException e) {
        throw new IOException("Malformed geometry line: " + line, e);
      }
    }
    return out;
  }
}
