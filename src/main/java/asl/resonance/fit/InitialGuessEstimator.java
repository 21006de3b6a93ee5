package asl.resonance.fit;

import asl.resonance.utils.NumericUtils;
import org.apache.commons.math3.complex.Complex;

/**
 * Produces starting parameters [f0, A, gamma, phi] for a complex Lorentzian fit from the
 * measured spectrum itself.
 *
 * The estimates are heuristics which the solver's convergence on real data was tuned against,
 * and they are kept as they are:
 * <ul>
 *   <li>A is the peak magnitude minus the smallest magnitude (not the peak value itself)</li>
 *   <li>gamma is the frequency distance between the maximum and minimum of the imaginary
 *   part (the two lobes of the dispersive component)</li>
 *   <li>f0 is the frequency at the index midway between those two extrema (the mean index,
 *   truncated to an integer)</li>
 *   <li>phi is whatever the caller passes in</li>
 * </ul>
 * The resonance peak must be the dominant feature of the data. With several peaks or a poor
 * signal-to-noise ratio the guess can land far away enough that the fit fails.
 */
public class InitialGuessEstimator {

  /**
   * Linewidth ceiling used for transformed decay signals (Hz); narrower lines are expected there
   */
  public static final double FID_LINEWIDTH_CEILING = 0.1;

  /**
   * Linewidth substituted when the estimate exceeds {@link #FID_LINEWIDTH_CEILING} (Hz)
   */
  public static final double FID_FALLBACK_LINEWIDTH = 1E-3;

  private InitialGuessEstimator() {
  }

  /**
   * Guess starting parameters with a phase of 0
   *
   * @param freqs Frequency of each point (Hz)
   * @param signal Complex spectrum at each frequency
   * @return Array {f0, A, gamma, phi}
   */
  public static double[] guess(double[] freqs, Complex[] signal) {
    return guess(freqs, signal, 0.);
  }

  /**
   * Guess starting parameters for a complex Lorentzian fit
   *
   * @param freqs Frequency of each point (Hz)
   * @param signal Complex spectrum at each frequency
   * @param phaseHint Starting phase, in radians
   * @return Array {f0, A, gamma, phi}
   */
  public static double[] guess(double[] freqs, Complex[] signal, double phaseHint) {
    if (freqs.length != signal.length) {
      throw new DimensionMismatchException("Spectrum values", freqs.length, signal.length);
    }
    if (signal.length == 0) {
      throw new DimensionMismatchException("Cannot estimate parameters of an empty spectrum");
    }

    double[] magnitude = NumericUtils.magnitudes(signal);
    double amplitudeGuess =
        magnitude[NumericUtils.argMax(magnitude)] - magnitude[NumericUtils.argMin(magnitude)];

    double[] imag = NumericUtils.imaginaryParts(signal);
    int imagMaxIdx = NumericUtils.argMax(imag);
    int imagMinIdx = NumericUtils.argMin(imag);
    double gammaGuess = Math.abs(freqs[imagMaxIdx] - freqs[imagMinIdx]);
    double f0Guess = freqs[(imagMaxIdx + imagMinIdx) / 2];

    return new double[]{f0Guess, amplitudeGuess, gammaGuess, phaseHint};
  }

  /**
   * Guess starting parameters, replacing an implausibly wide linewidth estimate. Transformed
   * decay signals with a low-frequency line often have their dispersive extrema far apart in
   * the filtered band, which this guards against.
   *
   * @param freqs Frequency of each point (Hz)
   * @param signal Complex spectrum at each frequency
   * @param phaseHint Starting phase, in radians
   * @param linewidthCeiling Largest linewidth estimate to accept (Hz)
   * @param fallbackLinewidth Linewidth to use when the estimate is above the ceiling (Hz)
   * @return Array {f0, A, gamma, phi}
   */
  public static double[] guess(double[] freqs, Complex[] signal, double phaseHint,
      double linewidthCeiling, double fallbackLinewidth) {
    double[] guess = guess(freqs, signal, phaseHint);
    if (guess[2] > linewidthCeiling) {
      guess[2] = fallbackLinewidth;
    }
    return guess;
  }

}
