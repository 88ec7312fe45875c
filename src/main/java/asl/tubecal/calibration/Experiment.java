package asl.tubecal.calibration;

import asl.tubecal.input.StripMeasurement;
import java.util.ArrayList;
import java.util.List;
import javax.swing.event.ChangeEvent;
import javax.swing.event.ChangeListener;
import javax.swing.event.EventListenerList;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * This class defines the template pattern for calculations run over a set of strip
 * measurements. Concrete extensions define a backend that does the calculations and fills in
 * plottable results.
 *
 * Experiments work in a manner similar to builder patterns: set any options first, then call
 * "runExperimentOnData" with the measurements to process. Results beyond the plot data (such as
 * the calibration table of a tube calibration) are read from the implementing class afterwards
 * and are not valid until a run has completed.
 */
public abstract class Experiment {

  private final EventListenerList eventHelper;

  List<XYSeriesCollection> xySeriesData;

  /**
   * Names of the measurements sent into the experiment, in the order given
   */
  List<String> dataNames;

  private String status;

  /**
   * Initialize all fields common to experiment objects
   */
  Experiment() {
    dataNames = new ArrayList<>();
    status = "";
    eventHelper = new EventListenerList();
  }

  /**
   * Stub method to be overridden to produce String data for the experiment result.
   * @return String containing human-readable data
   */
  String[] getDataStrings() {
    return new String[]{""};
  }

  /**
   * Get the result strings as a single block of text, as used for reports
   * @return String containing human-readable data
   */
  public String getReportString() {
    StringBuilder sb = new StringBuilder();
    String[] strings = getDataStrings();
    for (int i = 0; i < strings.length; ++i) {
      sb.append(strings[i]);
      if (i + 1 < strings.length) {
        sb.append('\n');
      }
    }
    return sb.toString();
  }

  /**
   * Add an object to the list of objects to be notified when the experiment's
   * status changes
   *
   * @param listener ChangeListener to be notified
   */
  public void addChangeListener(ChangeListener listener) {
    eventHelper.add(ChangeListener.class, listener);
  }

  /**
   * Abstract function that runs the calculations specific to a given procedure,
   * overwritten by concrete experiments with specific operations.
   *
   * @param measurements Strip measurements to process
   * @throws CalibrationException if the calculation cannot be completed
   */
  protected abstract void backend(final List<StripMeasurement> measurements)
      throws CalibrationException;

  /**
   * Update processing status and notify listeners of change
   *
   * @param newStatus Status change message to notify listeners of
   */
  void fireStateChange(String newStatus) {
    status = newStatus;
    ChangeListener[] listeners = eventHelper.getListeners(ChangeListener.class);
    if (listeners != null && listeners.length > 0) {
      ChangeEvent event = new ChangeEvent(this);
      for (ChangeListener listener : listeners) {
        listener.stateChanged(event);
      }
    }
  }

  /**
   * Return the plottable data for this experiment, populated in the backend
   * function of an implementing class. The results are returned as a list, where each
   * entry is the data to be placed into a separate chart.
   *
   * @return Plottable data, or null if no run has been started
   */
  public List<XYSeriesCollection> getData() {
    return xySeriesData;
  }

  /**
   * Get the names of data sent into the experiment, mainly used in report generation
   *
   * @return Names of the strip measurements
   */
  public List<String> getInputNames() {
    return dataNames;
  }

  /**
   * Return newest status message produced by this experiment
   *
   * @return String representing status of the calculation
   */
  public String getStatus() {
    return status;
  }

  /**
   * Called when a run is refused because {@link #hasEnoughData(List)} failed; the backend is
   * not run in that case. Does nothing unless overridden.
   *
   * @param reason Why the measurements were refused
   */
  void dataRejected(String reason) {
  }

  /**
   * Used to check if the input has enough data to do the calculation.
   *
   * @param measurements Measurements to be fed into the experiment
   * @return True if there is enough data to run
   */
  public abstract boolean hasEnoughData(final List<StripMeasurement> measurements);

  /**
   * Driver to do data processing on inputted data (calls a concrete backend
   * method which is different for each type of experiment)
   *
   * @param measurements Strip measurements to be processed
   * @throws CalibrationException if there is not enough data or the backend fails
   */
  public void runExperimentOnData(final List<StripMeasurement> measurements)
      throws CalibrationException {

    fireStateChange("Beginning loading data...");

    dataNames = new ArrayList<>();
    xySeriesData = new ArrayList<>();

    if (!hasEnoughData(measurements)) {
      String reason = "Not enough strip measurements to run";
      dataRejected(reason);
      throw new ConfigurationException(reason);
    }

    for (StripMeasurement measurement : measurements) {
      dataNames.add(measurement.getName());
    }

    fireStateChange("Beginning calculations...");

    backend(measurements);

    fireStateChange("Calculations done!");
  }
}
