package asl.resonance.utils;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import org.apache.commons.math3.complex.Complex;

/**
 * Class containing methods to serve as math functions, mainly index searches and
 * component extraction on arrays of complex numbers
 */
public class NumericUtils {

  /**
   * 2 * Pi, sometimes also referred to as Tau.
   * The number of radians in a full circle.
   */
  public final static double TAU = Math.PI * 2; // radians in full circle

  public static final ThreadLocal<DecimalFormat> DECIMAL_FORMAT =
      ThreadLocal.withInitial(() -> {
        DecimalFormat format = new DecimalFormat("#.#####");
        setInfinityPrintable(format);
        return format;
      });

  /**
   * Index of the largest value in the array. Ties resolve to the first occurrence.
   *
   * @param data Array to search (must not be empty)
   * @return Index of the maximum
   */
  public static int argMax(double[] data) {
    int idx = 0;
    for (int i = 1; i < data.length; ++i) {
      if (data[i] > data[idx]) {
        idx = i;
      }
    }
    return idx;
  }

  /**
   * Index of the smallest value in the array. Ties resolve to the first occurrence.
   *
   * @param data Array to search (must not be empty)
   * @return Index of the minimum
   */
  public static int argMin(double[] data) {
    int idx = 0;
    for (int i = 1; i < data.length; ++i) {
      if (data[i] < data[idx]) {
        idx = i;
      }
    }
    return idx;
  }

  /**
   * Get the magnitude of each entry of a complex array
   *
   * @param complexes Complex values
   * @return Array where each entry is abs() of the corresponding complex value
   */
  public static double[] magnitudes(Complex[] complexes) {
    double[] out = new double[complexes.length];
    for (int i = 0; i < complexes.length; ++i) {
      out[i] = complexes[i].abs();
    }
    return out;
  }

  public static double[] realParts(Complex[] complexes) {
    double[] out = new double[complexes.length];
    for (int i = 0; i < complexes.length; ++i) {
      out[i] = complexes[i].getReal();
    }
    return out;
  }

  public static double[] imaginaryParts(Complex[] complexes) {
    double[] out = new double[complexes.length];
    for (int i = 0; i < complexes.length; ++i) {
      out[i] = complexes[i].getImaginary();
    }
    return out;
  }

  /**
   * Build complex values from paired real and imaginary components (i.e., in-phase and
   * quadrature lock-in outputs)
   *
   * @param real Real components
   * @param imag Imaginary components, same length as real
   * @return Array of complex numbers real[i] + i * imag[i]
   */
  public static Complex[] toComplex(double[] real, double[] imag) {
    Complex[] out = new Complex[real.length];
    for (int i = 0; i < real.length; ++i) {
      out[i] = new Complex(real[i], imag[i]);
    }
    return out;
  }

  /**
   * Sets decimalformat object so that infinity can be printed in a text report
   *
   * @param df DecimalFormat object to change the infinity symbol value of
   */
  public static void setInfinityPrintable(DecimalFormat df) {
    DecimalFormatSymbols symbols = df.getDecimalFormatSymbols();
    symbols.setInfinity("Inf.");
    df.setDecimalFormatSymbols(symbols);
  }

}
