package asl.resonance.fit;

import asl.resonance.output.FitResult;
import asl.resonance.utils.FFTResult;
import asl.resonance.utils.NumericUtils;
import asl.resonance.utils.TimeSeriesUtils;

/**
 * Time-domain fit of a free induction decay to an exponentially damped sine,
 * <pre>
 *   y(t) = A * sin(2 * pi * f * t + phi) * exp(-gamma * t) + B
 * </pre>
 * with parameters ordered {f, A, gamma, phi, B}. This is a cross-check on the linewidth from
 * the spectral fit, since the same gamma governs both the decay envelope and the width of the
 * transformed line.
 */
public class DampedSineFitter {

  private DampedSineFitter() {
  }

  /**
   * Evaluate the damped sine at each time
   *
   * @param time Sample times (s)
   * @param params {f, A, gamma, phi, B}
   * @return Model value at each time
   */
  public static double[] dampedSine(double[] time, double[] params) {
    double freq = params[0];
    double amplitude = params[1];
    double gamma = params[2];
    double phi = params[3];
    double offset = params[4];
    double[] out = new double[time.length];
    for (int i = 0; i < time.length; ++i) {
      double t = time[i];
      out[i] = amplitude * Math.sin(NumericUtils.TAU * freq * t + phi) * Math.exp(-gamma * t)
          + offset;
    }
    return out;
  }

  /**
   * Partial derivatives of the damped sine with respect to {f, A, gamma, phi, B}
   *
   * @param time Sample times (s)
   * @param params {f, A, gamma, phi, B}
   * @return Matrix with one row per time and 5 columns
   */
  public static double[][] dampedSineJacobian(double[] time, double[] params) {
    double freq = params[0];
    double amplitude = params[1];
    double gamma = params[2];
    double phi = params[3];
    double[][] jacobian = new double[time.length][5];
    for (int i = 0; i < time.length; ++i) {
      double t = time[i];
      double theta = NumericUtils.TAU * freq * t + phi;
      double envelope = Math.exp(-gamma * t);
      double sin = Math.sin(theta);
      double cos = Math.cos(theta);
      jacobian[i][0] = amplitude * cos * envelope * NumericUtils.TAU * t;
      jacobian[i][1] = sin * envelope;
      jacobian[i][2] = -t * amplitude * sin * envelope;
      jacobian[i][3] = amplitude * cos * envelope;
      jacobian[i][4] = 1.;
    }
    return jacobian;
  }

  /**
   * Estimate starting parameters from the data. The offset is the mean, the amplitude is the
   * largest excursion less the offset, the frequency is the peak of the spectrum of the
   * demeaned data and the decay rate is one over the record length.
   *
   * @param time Sample times (s)
   * @param signal Sampled decay
   * @return {f, A, gamma, phi, B} with phi = 0
   */
  public static double[] guess(double[] time, double[] signal) {
    if (time.length != signal.length) {
      throw new DimensionMismatchException("Time signal", time.length, signal.length);
    }
    if (signal.length < ModelVariant.DAMPED_SINE.getParameterCount()) {
      throw new InsufficientDataException("Need at least "
          + ModelVariant.DAMPED_SINE.getParameterCount() + " samples for a damped sine fit, got "
          + signal.length);
    }

    double offset = TimeSeriesUtils.getMean(signal);
    double largest = 0.;
    for (double point : signal) {
      largest = Math.max(largest, Math.abs(point));
    }
    double amplitude = largest - Math.abs(offset);

    double[] demeaned = TimeSeriesUtils.demean(signal);
    FFTResult spectrum =
        FFTResult.singleSidedFFT(time, demeaned, 0, demeaned.length, 0., 0.);
    double freq = spectrum.getFreq(spectrum.getPeakIndex());

    double duration = time[time.length - 1] - time[0];
    double gamma = duration > 0 ? 1. / duration : 1.;

    return new double[]{freq, amplitude, gamma, 0., offset};
  }

  /**
   * Fit a damped sine to a decay with the default solver settings
   *
   * @param time Sample times (s)
   * @param signal Sampled decay
   * @return Fit of {f, A, gamma, phi, B}
   * @throws FitDivergedException if the solver does not produce a usable fit
   */
  public static FitResult fit(double[] time, double[] signal) throws FitDivergedException {
    return fit(new FitEngine(), time, signal);
  }

  /**
   * Fit a damped sine to a decay
   *
   * @param engine Solver to use
   * @param time Sample times (s)
   * @param signal Sampled decay
   * @return Fit of {f, A, gamma, phi, B}
   * @throws FitDivergedException if the solver does not produce a usable fit
   */
  public static FitResult fit(FitEngine engine, double[] time, double[] signal)
      throws FitDivergedException {
    double[] seed = guess(time, signal);
    return engine.solve(ModelVariant.DAMPED_SINE, time, signal, seed);
  }

}
