package asl.resonance.record;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import asl.resonance.fit.FitDivergedException;
import asl.resonance.fit.InitialGuessEstimator;
import asl.resonance.fit.LorentzianModel;
import asl.resonance.fit.ModelVariant;
import asl.resonance.input.Configuration;
import asl.resonance.input.Measurement;
import asl.resonance.test.TestUtils;
import asl.resonance.utils.FFTResult;
import java.io.File;
import java.util.Arrays;
import org.apache.commons.math3.complex.Complex;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class ResonanceRecordTest {

  @Rule
  public TemporaryFolder tempFolder = new TemporaryFolder();

  private static Measurement sweep() {
    double[] freqs = TestUtils.linspace(4.0, 6.0, 201);
    Complex[] signal = TestUtils.noisyLorentz(freqs, 5.0, 100.0, 0.2, 0.3, 1.0);
    double[] real = new double[signal.length];
    double[] imag = new double[signal.length];
    for (int i = 0; i < signal.length; ++i) {
      real[i] = signal[i].getReal();
      imag[i] = signal[i].getImaginary();
    }
    return Measurement.spectral(freqs, real, imag);
  }

  private static Measurement decay() {
    // cosine decay at 5 Hz with a decay rate of 0.2 / s; the linewidth is 0.2 / (2 pi) Hz
    double[] time = TestUtils.timeAxis(0.01, 10000);
    double[] signal = TestUtils.dampedSine(time, 5.0, 1.0, 0.2, Math.PI / 2, 0., 0.);
    return Measurement.timeDomain(time, signal);
  }

  private static void assertNotFitted(ResonanceRecord record) {
    try {
      record.resonantFrequency();
      fail("Frequency should not be available before a fit");
    } catch (NotFittedException e) {
      assertTrue(e.getMessage().contains(record.getSourceId()));
    }
    try {
      record.linewidthError();
      fail("Linewidth error should not be available before a fit");
    } catch (NotFittedException expected) {
      assertEquals(NotFittedException.class, expected.getClass());
    }
    try {
      record.getFitResult();
      fail("Fit result should not be available before a fit");
    } catch (NotFittedException expected) {
      assertEquals(NotFittedException.class, expected.getClass());
    }
  }

  @Test
  public void created_accessorsThrowNotFitted() {
    ResonanceRecord record = ResonanceRecord.fromMeasurement("Curr_100_uA.dat", sweep());
    assertEquals(RecordState.CREATED, record.getState());
    assertNotFitted(record);
  }

  @Test(expected = IllegalStateException.class)
  public void created_fitThrows() throws FitDivergedException {
    ResonanceRecord.fromMeasurement("sweep.dat", sweep()).fit(ModelVariant.PLAIN);
  }

  @Test(expected = IllegalStateException.class)
  public void created_signalGapThrows() {
    ResonanceRecord.fromMeasurement("sweep.dat", sweep()).signalGap();
  }

  @Test(expected = IllegalStateException.class)
  public void created_transformThrows() {
    ResonanceRecord.fromMeasurement("fid.dat", decay()).transform();
  }

  @Test
  public void spectrum_readFitAndQuery() throws Exception {
    ResonanceRecord record = ResonanceRecord.fromMeasurement("sweep_Curr_250_uA.dat", sweep());
    assertEquals(RecordType.SPECTRUM, record.getType());
    record.read();
    assertEquals(RecordState.READ, record.getState());
    assertEquals(250., record.getDriveCurrent(), 0.);
    assertNotFitted(record);

    record.fit(ModelVariant.PLAIN);
    assertEquals(RecordState.FITTED, record.getState());
    assertEquals(5.0, record.resonantFrequency(), 0.01);
    assertEquals(0.2, record.linewidth(), 0.02);
    assertTrue(record.resonantFrequencyError() > 0.);
    assertEquals(1. / record.linewidth(), record.t2Seconds(), 1E-12);
    assertEquals(1. / (60. * record.linewidth()), record.t2Minutes(), 1E-12);
    assertEquals(record.parameter(1), record.getFitResult().getParameter(1), 0.);
    assertTrue(record.getReportString().contains("sweep_Curr_250_uA.dat"));
  }

  @Test
  public void spectrum_refitReplacesResult() throws Exception {
    ResonanceRecord record = ResonanceRecord.fromMeasurement("sweep.dat", sweep());
    record.read();
    record.fit(ModelVariant.PLAIN);
    assertEquals(ModelVariant.PLAIN, record.getFitResult().getVariant());
    record.fit(ModelVariant.LINEAR_BACKGROUND);
    assertEquals(RecordState.FITTED, record.getState());
    assertEquals(ModelVariant.LINEAR_BACKGROUND, record.getFitResult().getVariant());
    assertEquals(5.0, record.resonantFrequency(), 0.01);
  }

  @Test
  public void spectrum_transformThrows() throws Exception {
    ResonanceRecord record = ResonanceRecord.fromMeasurement("sweep.dat", sweep());
    record.read();
    try {
      record.transform();
      fail("A spectrum cannot be transformed");
    } catch (IllegalStateException expected) {
      assertEquals(RecordState.READ, record.getState());
    }
  }

  @Test
  public void spectrum_missingCurrentIsNaN() throws Exception {
    ResonanceRecord record = ResonanceRecord.fromMeasurement("sweep.dat", sweep());
    record.read();
    assertTrue(Double.isNaN(record.getDriveCurrent()));
    assertFalse(record.getTimestamp().isPresent());
  }

  @Test
  public void fid_fitBeforeTransformThrows() throws Exception {
    ResonanceRecord record = ResonanceRecord.fromMeasurement("fid.dat", decay());
    assertEquals(RecordType.FID, record.getType());
    assertTrue(record.getType().requiresTransform());
    record.read();
    try {
      record.fit(ModelVariant.PLAIN);
      fail("Decay data must be transformed before a spectral fit");
    } catch (NotTransformedException expected) {
      assertEquals(RecordState.READ, record.getState());
    }
  }

  @Test
  public void fid_transformFitAndRetransform() throws Exception {
    ResonanceRecord record = ResonanceRecord.fromMeasurement("fid.dat", decay());
    record.read();
    record.transform(0, -1, 4., 6.);
    assertEquals(RecordState.TRANSFORMED, record.getState());
    assertNotFitted(record);

    record.fit(ModelVariant.PLAIN);
    assertEquals(RecordState.FITTED, record.getState());
    assertEquals(5.0, record.resonantFrequency(), 0.01);
    double expectedWidth = 0.2 / (2 * Math.PI);
    assertEquals(expectedWidth, Math.abs(record.linewidth()), 0.25 * expectedWidth);

    record.transform(0, -1, 4., 6.);
    assertEquals(RecordState.TRANSFORMED, record.getState());
    assertNotFitted(record);
  }

  @Test
  public void fid_estimatedSeedCapsLinewidth() throws Exception {
    ResonanceRecord record = ResonanceRecord.fromMeasurement("fid.dat", decay());
    record.read();
    record.transform(0, -1, 4., 6.);
    record.fit(ModelVariant.PLAIN);
    FFTResult spectrum = record.getSpectrum();
    double[] expected = InitialGuessEstimator.guess(spectrum.getFreqs(), spectrum.getFFT(), 0.,
        InitialGuessEstimator.FID_LINEWIDTH_CEILING,
        InitialGuessEstimator.FID_FALLBACK_LINEWIDTH);
    double[] seed = record.getFitResult().getSeed();
    assertEquals(Arrays.toString(expected), Arrays.toString(seed));
    assertTrue(seed[2] <= InitialGuessEstimator.FID_LINEWIDTH_CEILING);
  }

  @Test
  public void fid_dampedSineFitNeedsNoTransform() throws Exception {
    double[] time = TestUtils.timeAxis(0.01, 1000);
    double[] signal = TestUtils.dampedSine(time, 3.0, 2.0, 0.3, 0.5, 0.1, 0.01);
    ResonanceRecord record = ResonanceRecord.fromMeasurement("fid.dat",
        Measurement.timeDomain(time, signal));
    record.read();
    record.fit(ModelVariant.DAMPED_SINE);
    assertEquals(RecordState.FITTED, record.getState());
    assertEquals(3.0, record.resonantFrequency(), 3E-3);
    assertEquals(0.3, record.linewidth(), 0.015);
  }

  @Test(expected = IllegalArgumentException.class)
  public void spectrum_dampedSineFitThrows() throws Exception {
    ResonanceRecord record = ResonanceRecord.fromMeasurement("sweep.dat", sweep());
    record.read();
    record.fit(ModelVariant.DAMPED_SINE);
  }

  @Test
  public void signalGap_usesDecaySignal() throws Exception {
    double[] time = TestUtils.timeAxis(1., 10);
    double[] signal = new double[10];
    Arrays.fill(signal, 5, 10, 5.);
    ResonanceRecord record = ResonanceRecord.fromMeasurement("step.dat",
        Measurement.timeDomain(time, signal));
    record.read();
    assertEquals(5., record.signalGap(), 1E-14);
  }

  @Test
  public void signalGap_usesInPhaseColumnOfSpectrum() throws Exception {
    double[] freqs = TestUtils.linspace(1., 10., 10);
    double[] inPhase = {1., 1., 1., 1., 1., 1., 1., 1., 3., 3.};
    double[] quadrature = new double[10];
    Arrays.fill(quadrature, 100.);
    ResonanceRecord record = ResonanceRecord.fromMeasurement("sweep.dat",
        Measurement.spectral(freqs, inPhase, quadrature));
    record.read();
    assertEquals(2., record.signalGap(), 1E-14);
  }

  @Test
  public void fromFile_readsColumnsAndMetadata() throws Exception {
    double[] freqs = TestUtils.linspace(4.0, 6.0, 201);
    Complex[] signal = LorentzianModel.complexLorentz(freqs, 5.0, 100.0, 0.2, 0.3);
    File file = TestUtils.writeSpectrumFile(
        tempFolder.newFile("sweep_Curr_-35_uA_24_06_2019_14_05_33.dat"), freqs, signal);
    ResonanceRecord record = ResonanceRecord.fromFile(file, RecordType.SPECTRUM,
        Configuration.defaults());
    record.read();
    assertEquals(-35., record.getDriveCurrent(), 0.);
    assertTrue(record.getTimestamp().isPresent());
    assertEquals(14, record.getTimestamp().get().getHour());
    assertEquals(201, record.getSpectrum().size());
    record.fit(ModelVariant.PLAIN);
    assertEquals(5.0, record.resonantFrequency(), 1E-6);
    assertEquals(0.2, record.linewidth(), 1E-6);
  }

}
