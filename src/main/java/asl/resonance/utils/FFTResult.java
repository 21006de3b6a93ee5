package asl.resonance.utils;

import asl.resonance.fit.DimensionMismatchException;
import asl.resonance.fit.InsufficientDataException;
import java.util.Arrays;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.apache.commons.math3.util.ArithmeticUtils;
import org.apache.log4j.Logger;

/**
 * Holds a one-sided complex spectrum and the (non-negative, ascending) frequencies of each
 * point. Spectra come either from the Fourier transform of a free induction decay, done here,
 * or from swept-frequency measurements read directly from file.
 *
 * The transform is the unnormalized, untapered DFT of real data: for N input points the result
 * holds the N/2 + 1 non-negative frequency bins spaced 1 / (N * dt) apart. Lengths that are not
 * powers of two are transformed exactly (no zero padding) with a chirp-z convolution on top of
 * the radix-2 FFT.
 *
 * Instances are immutable; accessors return copies.
 */
public class FFTResult {

  private static final Logger logger = Logger.getLogger(FFTResult.class);

  /**
   * Intervals in the time axis further than this fraction from the first interval get flagged
   */
  private static final double UNIFORM_SAMPLING_TOLERANCE = 0.01;

  final private Complex[] transform; // the FFT data
  final private double[] freqs; // array of frequencies matching the fft data

  /**
   * Instantiate the structure holding an FFT and its frequency range
   *
   * @param inFFT Precalculated FFT result for some timeseries
   * @param inFreq Frequencies matched up to each FFT value
   */
  private FFTResult(Complex[] inFFT, double[] inFreq) {
    transform = inFFT;
    freqs = inFreq;
  }

  /**
   * Wrap spectrum data read from a measurement (i.e., a lock-in frequency sweep) so that it
   * can be filtered and fit the same way as a transformed decay signal.
   *
   * @param frequencies Frequency of each measurement point in Hz
   * @param spectrum Complex signal at each frequency
   * @return Spectrum holding copies of the given data
   */
  public static FFTResult fromSpectrum(double[] frequencies, Complex[] spectrum) {
    if (frequencies.length != spectrum.length) {
      throw new DimensionMismatchException("Spectrum values", frequencies.length,
          spectrum.length);
    }
    return new FFTResult(spectrum.clone(), frequencies.clone());
  }

  /**
   * Calculate the one-sided FFT of an entire timeseries with no frequency limits.
   *
   * @param time Time of each sample in seconds
   * @param timeSignal Real-valued samples
   * @return Complex spectrum from 0 Hz to the Nyquist frequency
   * @see #singleSidedFFT(double[], double[], int, int, double, double)
   */
  public static FFTResult singleSidedFFT(double[] time, double[] timeSignal) {
    return singleSidedFFT(time, timeSignal, 0, -1, 0., 0.);
  }

  /**
   * Calculates the FFT of a window of timeseries data and returns the non-negative frequencies
   * within the given frequency range.
   *
   * The window is [startIndex, endIndex) with sequence-slice semantics (negative values count
   * back from the end, so the default end of -1 leaves off the last sample). The sample interval
   * is taken from the first two points of the time axis; sampling is assumed uniform.
   *
   * @param time Time of each sample in seconds
   * @param timeSignal Real-valued samples, same length as the time axis
   * @param startIndex First sample of the window
   * @param endIndex Sample to stop the window before
   * @param freqMin Lowest frequency to include (Hz, inclusive)
   * @param freqMax Highest frequency to include (Hz, inclusive); 0 means the Nyquist frequency
   * @return Complex spectrum and matching frequencies within the given range
   */
  public static FFTResult singleSidedFFT(double[] time, double[] timeSignal,
      int startIndex, int endIndex, double freqMin, double freqMax) {

    if (time.length != timeSignal.length) {
      throw new DimensionMismatchException("Time signal", time.length, timeSignal.length);
    }

    double[] windowed = TimeSeriesUtils.slice(timeSignal, startIndex, endIndex);
    if (windowed.length < 2) {
      throw new InsufficientDataException("Window [" + startIndex + ", " + endIndex + ") of "
          + timeSignal.length + " samples leaves " + windowed.length
          + " points; at least 2 are needed for a transform");
    }

    if (!TimeSeriesUtils.isUniformlySampled(time, UNIFORM_SAMPLING_TOLERANCE)) {
      logger.debug("Time axis is not uniformly sampled; interval taken from first two samples");
    }

    double deltaT = time[1] - time[0];
    int length = windowed.length;
    Complex[] frqDomn = discreteFourierTransform(windowed);

    int singleSide = length / 2 + 1;
    double deltaFrq = 1. / (length * deltaT);

    Complex[] fftOut = new Complex[singleSide];
    double[] frequencies = new double[singleSide];

    for (int i = 0; i < singleSide; ++i) {
      fftOut[i] = frqDomn[i];
      frequencies[i] = i * deltaFrq;
    }

    if (freqMax == 0.) {
      freqMax = frequencies[singleSide - 1];
    }

    return new FFTResult(fftOut, frequencies).filterFrequencies(freqMin, freqMax);
  }

  /**
   * Full (two-sided) forward DFT of real data, without normalization or zero-padding.
   * Power-of-two lengths go straight to the radix-2 transform; other lengths use Bluestein's
   * algorithm, which rewrites the DFT as a convolution that can be done at a padded
   * power-of-two length.
   *
   * @param data Real-valued data
   * @return Complex DFT of the same length as the input
   */
  public static Complex[] discreteFourierTransform(double[] data) {
    FastFourierTransformer fft = new FastFourierTransformer(DftNormalization.STANDARD);
    int length = data.length;

    if (ArithmeticUtils.isPowerOfTwo(length)) {
      return fft.transform(data, TransformType.FORWARD);
    }

    // chirp terms, w[j] = exp(-i * pi * j^2 / N); j^2 taken mod 2N to keep the angle small
    Complex[] chirp = new Complex[length];
    for (int j = 0; j < length; ++j) {
      long jSquared = ((long) j * j) % (2L * length);
      double angle = Math.PI * jSquared / length;
      chirp[j] = new Complex(Math.cos(angle), -Math.sin(angle));
    }

    int padding = 2;
    while (padding < 2 * length - 1) {
      padding *= 2;
    }

    Complex[] weighted = new Complex[padding];
    Complex[] kernel = new Complex[padding];
    Arrays.fill(weighted, Complex.ZERO);
    Arrays.fill(kernel, Complex.ZERO);
    for (int j = 0; j < length; ++j) {
      weighted[j] = chirp[j].multiply(data[j]);
      kernel[j] = chirp[j].conjugate();
    }
    // kernel is symmetric in j, so the negative indices wrap to the end of the padded array
    for (int j = 1; j < length; ++j) {
      kernel[padding - j] = kernel[j];
    }

    Complex[] weightedFFT = fft.transform(weighted, TransformType.FORWARD);
    Complex[] kernelFFT = fft.transform(kernel, TransformType.FORWARD);
    Complex[] product = new Complex[padding];
    for (int i = 0; i < padding; ++i) {
      product[i] = weightedFFT[i].multiply(kernelFFT[i]);
    }
    Complex[] convolved = fft.transform(product, TransformType.INVERSE);

    Complex[] out = new Complex[length];
    for (int k = 0; k < length; ++k) {
      out[k] = convolved[k].multiply(chirp[k]);
    }
    return out;
  }

  /**
   * Get the points of this spectrum whose frequencies are in the range [freqMin, freqMax],
   * both ends inclusive. Filtering a result again with the same bounds gives the same result.
   *
   * @param freqMin Lowest frequency to include (Hz)
   * @param freqMax Highest frequency to include (Hz); 0 means no upper limit
   * @return New spectrum containing only the points in range, in ascending frequency order
   */
  public FFTResult filterFrequencies(double freqMin, double freqMax) {
    if (freqMax == 0. && freqs.length > 0) {
      freqMax = freqs[freqs.length - 1];
    }

    int count = 0;
    for (double freq : freqs) {
      if (freq >= freqMin && freq <= freqMax) {
        ++count;
      }
    }

    Complex[] filteredFFT = new Complex[count];
    double[] filteredFreqs = new double[count];
    int idx = 0;
    for (int i = 0; i < freqs.length; ++i) {
      if (freqs[i] >= freqMin && freqs[i] <= freqMax) {
        filteredFFT[idx] = transform[i];
        filteredFreqs[idx] = freqs[i];
        ++idx;
      }
    }

    return new FFTResult(filteredFFT, filteredFreqs);
  }

  /**
   * Get the index of the point with the largest magnitude
   *
   * @return Index of the spectral peak
   */
  public int getPeakIndex() {
    return NumericUtils.argMax(NumericUtils.magnitudes(transform));
  }

  /**
   * Get the FFT for some sort of previously calculated data
   *
   * @return Array of FFT results, as complex numbers
   */
  public Complex[] getFFT() {
    return transform.clone();
  }

  /**
   * Return the value of the FFT at the given index
   *
   * @param idx Index to get the FFT value at
   * @return FFT value at index
   */
  public Complex getFFT(int idx) {
    return transform[idx];
  }

  /**
   * Get the frequency value at the given index
   *
   * @param idx Index to get the frequency value at
   * @return Frequency value at index
   */
  public double getFreq(int idx) {
    return freqs[idx];
  }

  /**
   * Get the frequency range for the (previously calculated) FFT
   *
   * @return Array of frequencies (doubles), matching index to each FFT point
   */
  public double[] getFreqs() {
    return freqs.clone();
  }

  /**
   * Get the size of the complex array of FFT values, also the size of the
   * double array of frequencies for the FFT at each index
   *
   * @return int representing size of this object's arrays
   */
  public int size() {
    return transform.length;
  }

}
