package asl.resonance.fit;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class ModelVariantTest {

  @Test
  public void parameterCountsAndNames() {
    assertEquals(LorentzianModel.LORENTZ_PARAMS, ModelVariant.PLAIN.getParameterCount());
    assertEquals(LorentzianModel.BACKGROUND_PARAMS,
        ModelVariant.LINEAR_BACKGROUND.getParameterCount());
    assertEquals(5, ModelVariant.DAMPED_SINE.getParameterCount());
    assertArrayEquals(new String[]{"f0", "A", "gamma", "phi"},
        ModelVariant.PLAIN.getParameterNames());
    assertEquals("b_imag", ModelVariant.LINEAR_BACKGROUND.getParameterName(7));
    // linewidth sits at the same index in every model
    for (ModelVariant variant : ModelVariant.values()) {
      assertEquals("gamma", variant.getParameterName(2));
    }
  }

  @Test
  public void vectorLengths() {
    assertTrue(ModelVariant.PLAIN.isSpectral());
    assertFalse(ModelVariant.DAMPED_SINE.isSpectral());
    assertEquals(20, ModelVariant.LINEAR_BACKGROUND.getVectorLength(10));
    assertEquals(10, ModelVariant.DAMPED_SINE.getVectorLength(10));
    double[] freqs = {4.9, 5.0, 5.1};
    assertEquals(6, ModelVariant.PLAIN.value(freqs, new double[]{5., 1., 0.1, 0.}).length);
    assertEquals(6, ModelVariant.LINEAR_BACKGROUND
        .jacobian(freqs, new double[]{5., 1., 0.1, 0., 0., 0., 0., 0.}).length);
  }

}
