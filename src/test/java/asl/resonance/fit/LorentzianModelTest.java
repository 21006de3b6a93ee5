package asl.resonance.fit;

import static org.junit.Assert.assertEquals;

import asl.resonance.test.TestUtils;
import org.apache.commons.math3.complex.Complex;
import org.junit.Test;

public class LorentzianModelTest {

  private static final double[] PARAMS = {5.0, 100.0, 0.2, 0.3};
  private static final double[] BACKGROUND_PARAMS =
      {5.0, 100.0, 0.2, 0.3, 1.5, -2.0, 0.75, 4.0};

  @Test
  public void complexLorentz_peakValueAtResonance() {
    Complex peak = LorentzianModel.complexLorentz(5.0, 5.0, 100.0, 0.2, 0.3);
    // A * exp(i * phi) / gamma
    assertEquals(500. * Math.cos(0.3), peak.getReal(), 1E-10);
    assertEquals(500. * Math.sin(0.3), peak.getImaginary(), 1E-10);
  }

  @Test
  public void complexLorentz_matchesReciprocalForm() {
    for (double f : TestUtils.linspace(4., 6., 11)) {
      Complex expected = new Complex(Math.cos(0.3), Math.sin(0.3)).multiply(100.)
          .divide(new Complex(0.2, f - 5.0));
      Complex actual = LorentzianModel.complexLorentz(f, 5.0, 100.0, 0.2, 0.3);
      assertEquals(expected.getReal(), actual.getReal(), 1E-10);
      assertEquals(expected.getImaginary(), actual.getImaginary(), 1E-10);
    }
  }

  @Test
  public void vectorModel_realPartsThenImaginaryParts() {
    double[] freqs = {4.9, 5.0, 5.3};
    double[] vector = LorentzianModel.vectorModel(freqs, 5.0, 100.0, 0.2, 0.3);
    assertEquals(6, vector.length);
    for (int i = 0; i < freqs.length; ++i) {
      Complex value = LorentzianModel.complexLorentz(freqs[i], 5.0, 100.0, 0.2, 0.3);
      assertEquals(value.getReal(), vector[i], 0.);
      assertEquals(value.getImaginary(), vector[3 + i], 0.);
    }
  }

  @Test
  public void vectorModelWithBackground_addsLinearTerms() {
    double[] freqs = {4.0, 5.5};
    double[] plain = LorentzianModel.vectorModel(freqs, 5.0, 100.0, 0.2, 0.3);
    double[] withBackground = LorentzianModel.vectorModelWithBackground(freqs, 5.0, 100.0,
        0.2, 0.3, 1.5, -2.0, 0.75, 4.0);
    for (int i = 0; i < freqs.length; ++i) {
      assertEquals(plain[i] + 1.5 * freqs[i] - 2.0, withBackground[i], 1E-12);
      assertEquals(plain[2 + i] + 0.75 * freqs[i] + 4.0, withBackground[2 + i], 1E-12);
      Complex value = LorentzianModel.complexLorentzWithBackground(freqs[i], 5.0, 100.0, 0.2,
          0.3, 1.5, -2.0, 0.75, 4.0);
      assertEquals(value.getReal(), withBackground[i], 1E-12);
      assertEquals(value.getImaginary(), withBackground[2 + i], 1E-12);
    }
  }

  private static void assertJacobianMatchesDifferences(ModelVariant variant, double[] abscissa,
      double[] params) {
    double[][] analytic = variant.jacobian(abscissa, params);
    for (int p = 0; p < params.length; ++p) {
      double step = 1E-6 * Math.max(1., Math.abs(params[p]));
      double[] up = params.clone();
      double[] down = params.clone();
      up[p] += step;
      down[p] -= step;
      double[] valueUp = variant.value(abscissa, up);
      double[] valueDown = variant.value(abscissa, down);
      for (int row = 0; row < valueUp.length; ++row) {
        double numeric = (valueUp[row] - valueDown[row]) / (2 * step);
        double tolerance = 1E-5 * Math.max(1., Math.abs(numeric));
        assertEquals(variant.getParameterName(p) + " row " + row, numeric, analytic[row][p],
            tolerance);
      }
    }
  }

  @Test
  public void vectorJacobian_matchesFiniteDifferences() {
    double[] freqs = TestUtils.linspace(4.5, 5.5, 21);
    assertJacobianMatchesDifferences(ModelVariant.PLAIN, freqs, PARAMS);
  }

  @Test
  public void vectorJacobianWithBackground_matchesFiniteDifferences() {
    double[] freqs = TestUtils.linspace(4.5, 5.5, 21);
    assertJacobianMatchesDifferences(ModelVariant.LINEAR_BACKGROUND, freqs, BACKGROUND_PARAMS);
  }

  @Test
  public void dampedSineJacobian_matchesFiniteDifferences() {
    double[] time = TestUtils.timeAxis(0.05, 60);
    double[] params = {1.3, 2.0, 0.4, 0.7, -0.2};
    assertJacobianMatchesDifferences(ModelVariant.DAMPED_SINE, time, params);
  }

  @Test
  public void fromVector_invertsToVector() {
    Complex[] values = {new Complex(1., 2.), new Complex(-3., 0.5)};
    Complex[] back = LorentzianModel.fromVector(LorentzianModel.toVector(values));
    assertEquals(values[0], back[0]);
    assertEquals(values[1], back[1]);
  }

  @Test(expected = DimensionMismatchException.class)
  public void fromVector_oddLength_throws() {
    LorentzianModel.fromVector(new double[]{1., 2., 3.});
  }

}
