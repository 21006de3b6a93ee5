package asl.resonance.fit;

import org.apache.commons.math3.complex.Complex;

/**
 * Complex Lorentzian lineshape of a driven, damped oscillator and its variant with a complex
 * linear background, along with the real-vector forms used by the least-squares solver.
 *
 * The lineshape is
 * <pre>
 *   L(f) = A * exp(i * phi) * (gamma - i * (f - f0)) / (gamma^2 + (f - f0)^2)
 * </pre>
 * which is the same as A * exp(i * phi) / (gamma + i * (f - f0)). The vector form of a model
 * evaluated over n frequencies is the n real parts followed by the n imaginary parts, so a
 * real-valued solver can fit the complex data without ever seeing a complex number.
 *
 * The model is undefined at f == f0 when gamma is 0; callers keep gamma away from zero.
 */
public class LorentzianModel {

  /**
   * Number of parameters of the plain lineshape: f0, A, gamma, phi
   */
  public static final int LORENTZ_PARAMS = 4;

  /**
   * Number of parameters with linear background: f0, A, gamma, phi, a_r, b_r, a_i, b_i
   */
  public static final int BACKGROUND_PARAMS = 8;

  private LorentzianModel() {
  }

  /**
   * Evaluate the complex Lorentzian at a single frequency
   *
   * @param f Frequency (Hz)
   * @param f0 Resonant frequency (Hz)
   * @param amplitude Scaling factor A
   * @param gamma Half-width (Hz)
   * @param phi Phase (radians)
   * @return Value of the lineshape at f
   */
  public static Complex complexLorentz(double f, double f0, double amplitude, double gamma,
      double phi) {
    double delta = f - f0;
    double denom = gamma * gamma + delta * delta;
    Complex scale = new Complex(Math.cos(phi), Math.sin(phi)).multiply(amplitude);
    return scale.multiply(new Complex(gamma, -delta)).divide(denom);
  }

  public static Complex[] complexLorentz(double[] freqs, double f0, double amplitude,
      double gamma, double phi) {
    Complex[] out = new Complex[freqs.length];
    for (int i = 0; i < freqs.length; ++i) {
      out[i] = complexLorentz(freqs[i], f0, amplitude, gamma, phi);
    }
    return out;
  }

  /**
   * Evaluate the complex Lorentzian plus a complex linear background
   * (a_r + i * a_i) * f + (b_r + i * b_i) at a single frequency
   *
   * @param f Frequency (Hz)
   * @param f0 Resonant frequency (Hz)
   * @param amplitude Scaling factor A
   * @param gamma Half-width (Hz)
   * @param phi Phase (radians)
   * @param aReal Real slope
   * @param bReal Real intercept
   * @param aImag Imaginary slope
   * @param bImag Imaginary intercept
   * @return Value of the lineshape with background at f
   */
  public static Complex complexLorentzWithBackground(double f, double f0, double amplitude,
      double gamma, double phi, double aReal, double bReal, double aImag, double bImag) {
    Complex background = new Complex(aReal * f + bReal, aImag * f + bImag);
    return complexLorentz(f, f0, amplitude, gamma, phi).add(background);
  }

  public static Complex[] complexLorentzWithBackground(double[] freqs, double f0,
      double amplitude, double gamma, double phi, double aReal, double bReal, double aImag,
      double bImag) {
    Complex[] out = new Complex[freqs.length];
    for (int i = 0; i < freqs.length; ++i) {
      out[i] = complexLorentzWithBackground(freqs[i], f0, amplitude, gamma, phi,
          aReal, bReal, aImag, bImag);
    }
    return out;
  }

  /**
   * Real parts of the lineshape at each frequency, followed by the imaginary parts
   *
   * @param freqs Frequencies (Hz)
   * @param f0 Resonant frequency (Hz)
   * @param amplitude Scaling factor A
   * @param gamma Half-width (Hz)
   * @param phi Phase (radians)
   * @return Array of length 2 * freqs.length
   */
  public static double[] vectorModel(double[] freqs, double f0, double amplitude, double gamma,
      double phi) {
    return toVector(complexLorentz(freqs, f0, amplitude, gamma, phi));
  }

  /**
   * Vector form of the lineshape with linear background. Equal to the plain vector form with
   * a_r * f + b_r added to the real half and a_i * f + b_i added to the imaginary half.
   *
   * @return Array of length 2 * freqs.length
   * @see #complexLorentzWithBackground(double, double, double, double, double, double, double,
   * double, double)
   */
  public static double[] vectorModelWithBackground(double[] freqs, double f0, double amplitude,
      double gamma, double phi, double aReal, double bReal, double aImag, double bImag) {
    double[] out = vectorModel(freqs, f0, amplitude, gamma, phi);
    int n = freqs.length;
    for (int i = 0; i < n; ++i) {
      out[i] += aReal * freqs[i] + bReal;
      out[n + i] += aImag * freqs[i] + bImag;
    }
    return out;
  }

  /**
   * Derivatives of the plain vector model with respect to (f0, A, gamma, phi).
   * With L = A * exp(i * phi) / D and D = gamma + i * (f - f0):
   * dL/dA = L / A, dL/dphi = i * L, dL/dgamma = -A * exp(i * phi) / D^2 and
   * dL/df0 = i * A * exp(i * phi) / D^2.
   *
   * @param freqs Frequencies (Hz)
   * @param params Parameters f0, A, gamma, phi (any extra entries are ignored)
   * @return Matrix with 2 * freqs.length rows and 4 columns
   */
  public static double[][] vectorJacobian(double[] freqs, double[] params) {
    return vectorJacobian(freqs, params, LORENTZ_PARAMS);
  }

  /**
   * Derivatives of the vector model with linear background with respect to all 8 parameters.
   * The lineshape columns are those of the plain model; the background columns are f and 1 in
   * the real half (a_r, b_r) or the imaginary half (a_i, b_i).
   *
   * @param freqs Frequencies (Hz)
   * @param params Parameters f0, A, gamma, phi, a_r, b_r, a_i, b_i
   * @return Matrix with 2 * freqs.length rows and 8 columns
   */
  public static double[][] vectorJacobianWithBackground(double[] freqs, double[] params) {
    double[][] jacobian = vectorJacobian(freqs, params, BACKGROUND_PARAMS);
    int n = freqs.length;
    for (int i = 0; i < n; ++i) {
      jacobian[i][4] = freqs[i];
      jacobian[i][5] = 1.;
      jacobian[n + i][6] = freqs[i];
      jacobian[n + i][7] = 1.;
    }
    return jacobian;
  }

  private static double[][] vectorJacobian(double[] freqs, double[] params, int columns) {
    double f0 = params[0];
    double amplitude = params[1];
    double gamma = params[2];
    double phi = params[3];

    int n = freqs.length;
    double[][] jacobian = new double[2 * n][columns];
    Complex rotation = new Complex(Math.cos(phi), Math.sin(phi));
    Complex scale = rotation.multiply(amplitude);

    for (int i = 0; i < n; ++i) {
      Complex inverse = new Complex(gamma, freqs[i] - f0).reciprocal();
      Complex inverseSquared = inverse.multiply(inverse);
      Complex lorentz = scale.multiply(inverse);

      Complex dF0 = scale.multiply(inverseSquared).multiply(Complex.I);
      Complex dAmplitude = rotation.multiply(inverse);
      Complex dGamma = scale.multiply(inverseSquared).negate();
      Complex dPhi = lorentz.multiply(Complex.I);

      Complex[] partials = {dF0, dAmplitude, dGamma, dPhi};
      for (int p = 0; p < partials.length; ++p) {
        jacobian[i][p] = partials[p].getReal();
        jacobian[n + i][p] = partials[p].getImaginary();
      }
    }

    return jacobian;
  }

  /**
   * Split complex values into the vector form used by the solver: all real parts, then all
   * imaginary parts.
   *
   * @param values Complex values
   * @return Array of length 2 * values.length
   */
  public static double[] toVector(Complex[] values) {
    int n = values.length;
    double[] out = new double[2 * n];
    for (int i = 0; i < n; ++i) {
      out[i] = values[i].getReal();
      out[n + i] = values[i].getImaginary();
    }
    return out;
  }

  /**
   * Rebuild complex values from their vector form
   *
   * @param vector Real parts followed by imaginary parts (even length)
   * @return Complex array of half the vector's length
   */
  public static Complex[] fromVector(double[] vector) {
    if (vector.length % 2 != 0) {
      throw new DimensionMismatchException("Vector form must have even length, got "
          + vector.length);
    }
    int n = vector.length / 2;
    Complex[] out = new Complex[n];
    for (int i = 0; i < n; ++i) {
      out[i] = new Complex(vector[i], vector[n + i]);
    }
    return out;
  }

}
