package asl.resonance.record;

import asl.resonance.fit.DampedSineFitter;
import asl.resonance.fit.FitDivergedException;
import asl.resonance.fit.FitEngine;
import asl.resonance.fit.InitialGuessEstimator;
import asl.resonance.fit.ModelVariant;
import asl.resonance.input.ColumnFileReader;
import asl.resonance.input.ColumnFileReader.DataFormatException;
import asl.resonance.input.Configuration;
import asl.resonance.input.FilenameMetadata;
import asl.resonance.input.FilenameMetadata.Timestamp;
import asl.resonance.input.Measurement;
import asl.resonance.output.FitResult;
import asl.resonance.utils.FFTResult;
import asl.resonance.utils.NumericUtils;
import asl.resonance.utils.TimeSeriesUtils;
import java.io.File;
import java.io.IOException;
import java.text.DecimalFormat;
import java.util.Optional;
import org.apache.commons.math3.complex.Complex;
import org.apache.log4j.Logger;

/**
 * One resonance measurement and everything derived from it: the raw data, the spectrum (read
 * directly, or transformed from a decay), the fit and the metadata from the source name.
 *
 * Operations must happen in order. A record is read, then (decay data only) transformed, then
 * fit; fit results can only be queried once a fit has succeeded. Calling an operation out of
 * order throws an exception instead of returning stale or placeholder values:
 * <ul>
 *   <li>fitting or transforming before the data is read: {@link IllegalStateException}</li>
 *   <li>transforming a record that is already a spectrum: {@link IllegalStateException}</li>
 *   <li>fitting a Lorentzian to decay data that was not transformed:
 *   {@link NotTransformedException}</li>
 *   <li>querying fit results before a fit: {@link NotFittedException}</li>
 * </ul>
 * A fit can be repeated with another model or seed; the new result replaces the old one.
 * Transforming again discards the fit. A fit that fails leaves the record as it was.
 *
 * Records are not thread-safe.
 */
public class ResonanceRecord {

  private static final Logger logger = Logger.getLogger(ResonanceRecord.class);

  private final String sourceId;
  private final RecordType type;
  private final File source;
  private final int[] columns;
  private final FitEngine engine;

  private RecordState state;
  private Measurement measurement;
  private FFTResult spectrum;
  private FitResult fitResult;
  private double driveCurrent;
  private Timestamp timestamp;

  private ResonanceRecord(String sourceId, RecordType type, File source, int[] columns,
      Measurement measurement, FitEngine engine) {
    this.sourceId = sourceId;
    this.type = type;
    this.source = source;
    this.columns = columns;
    this.measurement = measurement;
    this.engine = engine;
    state = RecordState.CREATED;
    driveCurrent = Double.NaN;
  }

  /**
   * Create a record for a measurement file, using the columns and solver settings of the given
   * configuration. Nothing is read until {@link #read()} is called.
   *
   * @param file Measurement file
   * @param type Whether the file holds a spectrum or a decay
   * @param config Configuration for column layout and solver settings
   * @return New record in the CREATED state
   */
  public static ResonanceRecord fromFile(File file, RecordType type, Configuration config) {
    int[] columns = type.requiresTransform() ? config.getFidColumns()
        : config.getSpectrumColumns();
    return new ResonanceRecord(file.getName(), type, file, columns, null,
        new FitEngine(config));
  }

  /**
   * Create a record for a measurement file with the default column layout and solver settings
   *
   * @param file Measurement file
   * @param type Whether the file holds a spectrum or a decay
   * @return New record in the CREATED state
   */
  public static ResonanceRecord fromFile(File file, RecordType type) {
    return fromFile(file, type, Configuration.defaults());
  }

  /**
   * Create a record for data already in memory. The source name is still parsed for metadata
   * when the record is read.
   *
   * @param sourceId Name identifying the data (i.e., the name of the file it came from)
   * @param measurement Measurement data
   * @param engine Solver to fit with
   * @return New record in the CREATED state
   */
  public static ResonanceRecord fromMeasurement(String sourceId, Measurement measurement,
      FitEngine engine) {
    RecordType type = measurement.isTimeDomain() ? RecordType.FID : RecordType.SPECTRUM;
    return new ResonanceRecord(sourceId, type, null, null, measurement, engine);
  }

  public static ResonanceRecord fromMeasurement(String sourceId, Measurement measurement) {
    return fromMeasurement(sourceId, measurement, new FitEngine());
  }

  /**
   * Load the measurement and parse the metadata in the source name. A name without a drive
   * current gives a current of NaN (and a logged warning), not an error. Reading again starts
   * the record over from its source.
   *
   * @throws IOException If the source file cannot be read
   * @throws DataFormatException If the source file is malformed
   */
  public void read() throws IOException, DataFormatException {
    if (source != null) {
      logger.info("Reading " + type.getName().toLowerCase() + " data from " + source.getPath());
      measurement = type.requiresTransform() ? ColumnFileReader.readDecay(source, columns)
          : ColumnFileReader.readSpectrum(source, columns);
    }

    driveCurrent = FilenameMetadata.currentOrNaN(sourceId);
    Optional<Timestamp> parsedTime = FilenameMetadata.findTimestamp(sourceId);
    timestamp = parsedTime.orElse(null);

    fitResult = null;
    spectrum = type.requiresTransform() ? null
        : FFTResult.fromSpectrum(measurement.getFrequency(), measurement.getComplexSignal());
    state = RecordState.READ;
  }

  /**
   * Transform the whole decay to the frequency domain, keeping all frequencies
   */
  public void transform() {
    transform(0, -1, 0., 0.);
  }

  /**
   * Transform a window of the decay to the frequency domain. Any existing fit is discarded.
   *
   * @param startIndex First sample of the window
   * @param endIndex Sample to stop before (negative values count back from the end)
   * @param freqMin Lowest frequency to keep (Hz)
   * @param freqMax Highest frequency to keep (Hz); 0 keeps everything up to Nyquist
   * @see FFTResult#singleSidedFFT(double[], double[], int, int, double, double)
   */
  public void transform(int startIndex, int endIndex, double freqMin, double freqMax) {
    if (state == RecordState.CREATED) {
      throw new IllegalStateException("Record " + sourceId + " must be read before transform");
    }
    if (!type.requiresTransform()) {
      throw new IllegalStateException("Record " + sourceId
          + " already holds a spectrum; only decay data is transformed");
    }
    spectrum = FFTResult.singleSidedFFT(measurement.getTime(), measurement.getTimeSignal(),
        startIndex, endIndex, freqMin, freqMax);
    fitResult = null;
    state = RecordState.TRANSFORMED;
  }

  /**
   * Fit a model with the seed estimated from the data
   *
   * @param variant Model to fit
   * @throws FitDivergedException if the solver does not produce a usable fit
   */
  public void fit(ModelVariant variant) throws FitDivergedException {
    fit(variant, null, 0.);
  }

  /**
   * Fit a model to the record's data, replacing any earlier fit.
   *
   * Lorentzian models are fit to the spectrum, so decay data must be transformed first. The
   * damped sine is fit to decay data directly in the time domain and needs no transform.
   *
   * Estimated seeds for transformed decays differ from
   * {@link InitialGuessEstimator#guess(double[], Complex[], double)}: a linewidth estimate
   * above {@link InitialGuessEstimator#FID_LINEWIDTH_CEILING} is replaced with
   * {@link InitialGuessEstimator#FID_FALLBACK_LINEWIDTH}, and
   * {@link FitResult#getSeed()} reports the replaced value. Measured spectra use the
   * estimator's seed unchanged.
   *
   * @param variant Model to fit
   * @param seed Starting parameters, or null to estimate them from the data
   * @param phaseHint Starting phase used when the seed is estimated (radians)
   * @throws FitDivergedException if the solver does not produce a usable fit
   */
  public void fit(ModelVariant variant, double[] seed, double phaseHint)
      throws FitDivergedException {
    if (state == RecordState.CREATED) {
      throw new IllegalStateException("Record " + sourceId + " must be read before fit");
    }

    if (!variant.isSpectral()) {
      if (!type.requiresTransform()) {
        throw new IllegalArgumentException(variant.getName()
            + " is a time-domain model and cannot be fit to spectrum " + sourceId);
      }
      double[] time = measurement.getTime();
      double[] signal = measurement.getTimeSignal();
      double[] start = seed == null ? DampedSineFitter.guess(time, signal) : seed;
      fitResult = engine.solve(variant, time, signal, start);
      state = RecordState.FITTED;
      return;
    }

    if (spectrum == null) {
      throw new NotTransformedException("Decay record " + sourceId
          + " must be transformed before a spectral fit");
    }

    double[] freqs = spectrum.getFreqs();
    if (seed == null && type.requiresTransform()) {
      seed = InitialGuessEstimator.guess(freqs, spectrum.getFFT(), phaseHint,
          InitialGuessEstimator.FID_LINEWIDTH_CEILING,
          InitialGuessEstimator.FID_FALLBACK_LINEWIDTH);
    }
    fitResult = engine.fit(freqs, spectrum.getFFT(), seed, variant, phaseHint);
    state = RecordState.FITTED;
    logger.info("Fit " + sourceId + ": f0 = " + fitResult.getParameter(0) + " Hz, gamma = "
        + fitResult.getParameter(2) + " Hz");
  }

  private FitResult requireFit() {
    if (state != RecordState.FITTED) {
      throw new NotFittedException("Record " + sourceId + " has not been fit (state "
          + state + ")");
    }
    return fitResult;
  }

  public FitResult getFitResult() {
    return requireFit();
  }

  public double parameter(int index) {
    return requireFit().getParameter(index);
  }

  public double parameterError(int index) {
    return requireFit().getParameterError(index);
  }

  /**
   * Fit resonant frequency (or the oscillation frequency of a damped sine)
   *
   * @return Frequency in Hz
   */
  public double resonantFrequency() {
    return parameter(0);
  }

  public double resonantFrequencyError() {
    return parameterError(0);
  }

  /**
   * Fit linewidth gamma (the decay rate of a damped sine)
   *
   * @return Linewidth in Hz
   */
  public double linewidth() {
    return parameter(2);
  }

  public double linewidthError() {
    return parameterError(2);
  }

  public double t2Seconds() {
    return requireFit().getT2Seconds();
  }

  public double t2Minutes() {
    return requireFit().getT2Minutes();
  }

  /**
   * Difference between the mean level of the last fifth of the data and the mean level of the
   * slice from 30% to 50% of it. Uses the decay signal, or the in-phase column of a spectrum.
   *
   * @return Level shift of the primary data column
   * @see TimeSeriesUtils#levelShift(double[])
   */
  public double signalGap() {
    if (state == RecordState.CREATED) {
      throw new IllegalStateException("Record " + sourceId + " must be read first");
    }
    return TimeSeriesUtils.levelShift(measurement.getPrimarySignal());
  }

  /**
   * Get the spectrum a Lorentzian fit would be made against
   *
   * @return Spectrum of the record
   * @throws NotTransformedException if this is decay data that has not been transformed
   */
  public FFTResult getSpectrum() {
    if (state == RecordState.CREATED) {
      throw new IllegalStateException("Record " + sourceId + " must be read first");
    }
    if (spectrum == null) {
      throw new NotTransformedException("Decay record " + sourceId + " has not been transformed");
    }
    return spectrum;
  }

  public Measurement getMeasurement() {
    if (state == RecordState.CREATED) {
      throw new IllegalStateException("Record " + sourceId + " must be read first");
    }
    return measurement;
  }

  public RecordState getState() {
    return state;
  }

  public RecordType getType() {
    return type;
  }

  public String getSourceId() {
    return sourceId;
  }

  /**
   * Drive current parsed from the source name
   *
   * @return Current in microamps, NaN if the name has none or the record has not been read
   */
  public double getDriveCurrent() {
    return driveCurrent;
  }

  /**
   * Acquisition time parsed from the source name
   *
   * @return Timestamp, if the name encodes one and the record has been read
   */
  public Optional<Timestamp> getTimestamp() {
    return Optional.ofNullable(timestamp);
  }

  /**
   * Summary of the fit results of this record, with metadata
   *
   * @return Multi-line text report
   * @throws NotFittedException if the record has not been fit
   */
  public String getReportString() {
    FitResult result = requireFit();
    DecimalFormat df = NumericUtils.DECIMAL_FORMAT.get();
    StringBuilder sb = new StringBuilder();
    sb.append("Source: ").append(sourceId).append(" (").append(type.getName()).append(")\n");
    sb.append("Drive current (uA): ");
    sb.append(Double.isNaN(driveCurrent) ? "unknown" : df.format(driveCurrent)).append('\n');
    if (timestamp != null) {
      sb.append("Acquired: ").append(timestamp).append('\n');
    }
    sb.append(result.getReportString()).append('\n');
    if (result.getParameter(2) != 0.) {
      sb.append("T2 (s): ").append(df.format(result.getT2Seconds())).append('\n');
      sb.append("T2 (min): ").append(df.format(result.getT2Minutes())).append('\n');
    }
    sb.append("Signal gap: ").append(df.format(signalGap()));
    return sb.toString();
  }

}
