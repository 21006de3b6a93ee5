package asl.resonance.input;

import asl.resonance.fit.DimensionMismatchException;
import asl.resonance.utils.NumericUtils;
import org.apache.commons.math3.complex.Complex;

/**
 * Raw data of one measurement, either a sampled decay (time and signal) or a swept-frequency
 * response (frequency, in-phase X, quadrature Y, magnitude R and phase). All columns of a
 * measurement have the same length. Getters return copies.
 */
public class Measurement {

  private final boolean timeDomain;
  private final double[] abscissa;
  private final double[][] columns;

  private Measurement(boolean timeDomain, double[] abscissa, double[]... columns) {
    for (double[] column : columns) {
      if (column.length != abscissa.length) {
        throw new DimensionMismatchException("Measurement column", abscissa.length,
            column.length);
      }
    }
    this.timeDomain = timeDomain;
    this.abscissa = abscissa.clone();
    this.columns = new double[columns.length][];
    for (int i = 0; i < columns.length; ++i) {
      this.columns[i] = columns[i].clone();
    }
  }

  /**
   * Create a decay measurement
   *
   * @param time Sample times (s)
   * @param signal Sample values
   * @return New measurement
   */
  public static Measurement timeDomain(double[] time, double[] signal) {
    return new Measurement(true, time, signal);
  }

  /**
   * Create a swept-frequency measurement with all five columns as recorded by the lock-in
   *
   * @param frequency Frequency of each point (Hz)
   * @param inPhase In-phase (X) component
   * @param quadrature Quadrature (Y) component
   * @param magnitude Magnitude (R) as recorded
   * @param phase Phase as recorded
   * @return New measurement
   */
  public static Measurement spectral(double[] frequency, double[] inPhase, double[] quadrature,
      double[] magnitude, double[] phase) {
    return new Measurement(false, frequency, inPhase, quadrature, magnitude, phase);
  }

  /**
   * Create a swept-frequency measurement from its in-phase and quadrature components; the
   * magnitude and phase (radians) are derived from them
   *
   * @param frequency Frequency of each point (Hz)
   * @param inPhase In-phase (X) component
   * @param quadrature Quadrature (Y) component
   * @return New measurement
   */
  public static Measurement spectral(double[] frequency, double[] inPhase, double[] quadrature) {
    if (inPhase.length != quadrature.length) {
      throw new DimensionMismatchException("Quadrature column", inPhase.length,
          quadrature.length);
    }
    double[] magnitude = new double[inPhase.length];
    double[] phase = new double[inPhase.length];
    for (int i = 0; i < inPhase.length; ++i) {
      magnitude[i] = Math.hypot(inPhase[i], quadrature[i]);
      phase[i] = Math.atan2(quadrature[i], inPhase[i]);
    }
    return spectral(frequency, inPhase, quadrature, magnitude, phase);
  }

  /**
   * True if this is a sampled decay rather than a frequency sweep
   *
   * @return True for decay data
   */
  public boolean isTimeDomain() {
    return timeDomain;
  }

  public int size() {
    return abscissa.length;
  }

  /**
   * Get the sample times of a decay measurement
   *
   * @return Sample times (s)
   */
  public double[] getTime() {
    requireTimeDomain(true);
    return abscissa.clone();
  }

  public double[] getTimeSignal() {
    requireTimeDomain(true);
    return columns[0].clone();
  }

  public double[] getFrequency() {
    requireTimeDomain(false);
    return abscissa.clone();
  }

  public double[] getInPhase() {
    requireTimeDomain(false);
    return columns[0].clone();
  }

  public double[] getQuadrature() {
    requireTimeDomain(false);
    return columns[1].clone();
  }

  public double[] getMagnitude() {
    requireTimeDomain(false);
    return columns[2].clone();
  }

  public double[] getPhase() {
    requireTimeDomain(false);
    return columns[3].clone();
  }

  /**
   * Get the complex response X + iY of a frequency sweep
   *
   * @return Complex value at each frequency
   */
  public Complex[] getComplexSignal() {
    requireTimeDomain(false);
    return NumericUtils.toComplex(columns[0], columns[1]);
  }

  /**
   * The data the level shift of a measurement is taken from: the signal of a decay or the
   * in-phase column of a sweep
   *
   * @return Copy of the primary data column
   */
  public double[] getPrimarySignal() {
    return columns[0].clone();
  }

  private void requireTimeDomain(boolean expected) {
    if (timeDomain != expected) {
      throw new IllegalStateException("Measurement is "
          + (timeDomain ? "time-domain decay data" : "swept-frequency data"));
    }
  }

}
