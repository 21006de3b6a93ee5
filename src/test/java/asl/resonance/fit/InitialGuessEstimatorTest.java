package asl.resonance.fit;

import static org.junit.Assert.assertEquals;

import org.apache.commons.math3.complex.Complex;
import org.junit.Test;

public class InitialGuessEstimatorTest {

  @Test
  public void guess_fivePointLorentzian() {
    double[] freqs = {4.8, 4.9, 5.0, 5.1, 5.2};
    Complex[] signal = LorentzianModel.complexLorentz(freqs, 5.0, 50.0, 0.15, 0.0);
    double[] guess = InitialGuessEstimator.guess(freqs, signal);
    // imaginary maximum at 4.8, minimum at 5.2
    assertEquals(5.0, guess[0], 0.);
    // peak magnitude A / gamma less edge magnitude A / sqrt(gamma^2 + 0.2^2)
    assertEquals(50. / 0.15 - 50. / 0.25, guess[1], 1E-9);
    assertEquals(0.4, guess[2], 1E-12);
    assertEquals(0., guess[3], 0.);
  }

  @Test
  public void guess_passesPhaseHintThrough() {
    double[] freqs = {4.8, 4.9, 5.0, 5.1, 5.2};
    Complex[] signal = LorentzianModel.complexLorentz(freqs, 5.0, 50.0, 0.15, 0.0);
    assertEquals(1.25, InitialGuessEstimator.guess(freqs, signal, 1.25)[3], 0.);
  }

  @Test
  public void guess_meanIndexIsTruncated() {
    double[] freqs = {1., 2., 3., 4., 5.};
    Complex[] signal = {
        new Complex(1., 5.), new Complex(2., 1.), new Complex(3., 0.),
        new Complex(1., -5.), new Complex(0., 2.)};
    double[] guess = InitialGuessEstimator.guess(freqs, signal);
    // extrema at indices 0 and 3, mean 1.5 truncates to 1
    assertEquals(2., guess[0], 0.);
    assertEquals(3., guess[2], 0.);
  }

  @Test
  public void guess_tiesResolveToFirstOccurrence() {
    double[] freqs = {1., 2., 3., 4., 5.};
    Complex[] signal = {
        new Complex(0., 0.), new Complex(0., 4.), new Complex(0., 4.),
        new Complex(0., -4.), new Complex(0., -4.)};
    double[] guess = InitialGuessEstimator.guess(freqs, signal);
    assertEquals(2., guess[2], 0.);
    // (1 + 3) / 2 = 2
    assertEquals(3., guess[0], 0.);
  }

  @Test
  public void guess_wideLinewidthReplacedAboveCeiling() {
    double[] freqs = {4.8, 4.9, 5.0, 5.1, 5.2};
    Complex[] signal = LorentzianModel.complexLorentz(freqs, 5.0, 50.0, 0.15, 0.0);
    double[] clamped = InitialGuessEstimator.guess(freqs, signal, 0.,
        InitialGuessEstimator.FID_LINEWIDTH_CEILING, InitialGuessEstimator.FID_FALLBACK_LINEWIDTH);
    assertEquals(InitialGuessEstimator.FID_FALLBACK_LINEWIDTH, clamped[2], 0.);

    double[] kept = InitialGuessEstimator.guess(freqs, signal, 0., 1., 1E-3);
    assertEquals(0.4, kept[2], 1E-12);
  }

  @Test(expected = DimensionMismatchException.class)
  public void guess_mismatchedLengths_throws() {
    InitialGuessEstimator.guess(new double[]{1., 2.}, new Complex[]{Complex.ONE});
  }

  @Test(expected = DimensionMismatchException.class)
  public void guess_emptyInput_throws() {
    InitialGuessEstimator.guess(new double[]{}, new Complex[]{});
  }

}
