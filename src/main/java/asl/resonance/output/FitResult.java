package asl.resonance.output;

import asl.resonance.fit.DimensionMismatchException;
import asl.resonance.fit.DivisionByZeroException;
import asl.resonance.fit.LorentzianModel;
import asl.resonance.fit.ModelVariant;
import asl.resonance.utils.NumericUtils;
import java.text.DecimalFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.math3.complex.Complex;

/**
 * Result of a least-squares fit: best-fit parameters, their estimated covariance and some
 * diagnostics from the solver (seed, residuals, iteration counts).
 *
 * The covariance is square and symmetric with one row per parameter. Its diagonal holds the
 * variances, so the standard error of parameter i is sqrt(covariance[i][i]). The fit engine does
 * not hand out results with a negative or NaN variance.
 *
 * Like the calibration results this suite's sibling tools produce, a name-to-value map of the
 * results is available for external collaborators (plotting, database ingestion).
 */
public class FitResult {

  private final ModelVariant variant;
  private final double[] parameters;
  private final double[][] covariance;
  private final double[] seed;
  private final double initialResidual;
  private final double fitResidual;
  private final int iterations;
  private final int evaluations;

  /**
   * Create a new fit result holding copies of the given arrays
   *
   * @param variant Model that was fit
   * @param parameters Best-fit parameters
   * @param covariance Covariance estimate of the parameters (n x n)
   * @param seed Starting parameters given to the solver
   * @param initialResidual Sum of squared residuals at the seed
   * @param fitResidual Sum of squared residuals at the best-fit parameters
   * @param iterations Number of solver iterations
   * @param evaluations Number of model evaluations
   */
  public FitResult(ModelVariant variant, double[] parameters, double[][] covariance,
      double[] seed, double initialResidual, double fitResidual, int iterations,
      int evaluations) {
    int count = variant.getParameterCount();
    if (parameters.length != count) {
      throw new DimensionMismatchException("Fit parameters", count, parameters.length);
    }
    if (covariance.length != count) {
      throw new DimensionMismatchException("Covariance rows", count, covariance.length);
    }
    this.variant = variant;
    this.parameters = parameters.clone();
    this.covariance = new double[count][];
    for (int i = 0; i < count; ++i) {
      if (covariance[i].length != count) {
        throw new DimensionMismatchException("Covariance columns", count, covariance[i].length);
      }
      this.covariance[i] = covariance[i].clone();
    }
    this.seed = seed.clone();
    this.initialResidual = initialResidual;
    this.fitResidual = fitResidual;
    this.iterations = iterations;
    this.evaluations = evaluations;
  }

  public ModelVariant getVariant() {
    return variant;
  }

  public double[] getParameters() {
    return parameters.clone();
  }

  public double getParameter(int index) {
    return parameters[index];
  }

  /**
   * Get the standard error of a parameter, the square root of its variance
   *
   * @param index Parameter index
   * @return Standard error (may be infinite if the fit had no spare degrees of freedom)
   */
  public double getParameterError(int index) {
    return Math.sqrt(covariance[index][index]);
  }

  public double[] getParameterErrors() {
    double[] errors = new double[parameters.length];
    for (int i = 0; i < errors.length; ++i) {
      errors[i] = getParameterError(i);
    }
    return errors;
  }

  public double[][] getCovariance() {
    double[][] out = new double[covariance.length][];
    for (int i = 0; i < covariance.length; ++i) {
      out[i] = covariance[i].clone();
    }
    return out;
  }

  public double[] getSeed() {
    return seed.clone();
  }

  /**
   * Sum of squared residuals between the data and the model evaluated at the seed
   *
   * @return Initial residual
   */
  public double getInitialResidual() {
    return initialResidual;
  }

  /**
   * Sum of squared residuals between the data and the best-fit model
   *
   * @return Fit residual
   */
  public double getFitResidual() {
    return fitResidual;
  }

  public int getIterations() {
    return iterations;
  }

  public int getEvaluations() {
    return evaluations;
  }

  /**
   * Get the transverse relaxation time T2 = 1 / gamma, in seconds
   *
   * @return T2 in seconds
   * @throws DivisionByZeroException if the fit linewidth is exactly zero
   */
  public double getT2Seconds() {
    return 1. / nonZeroLinewidth();
  }

  /**
   * Get the transverse relaxation time T2 = 1 / (60 * gamma), in minutes
   *
   * @return T2 in minutes
   * @throws DivisionByZeroException if the fit linewidth is exactly zero
   */
  public double getT2Minutes() {
    return 1. / (60. * nonZeroLinewidth());
  }

  private double nonZeroLinewidth() {
    double gamma = parameters[2];
    if (gamma == 0.) {
      throw new DivisionByZeroException("Fit linewidth is zero; relaxation time is undefined");
    }
    return gamma;
  }

  /**
   * Evaluate the vector form of the fit model at the given points
   *
   * @param abscissa Frequencies (Hz) or times (s), depending on the model
   * @return Model values in the form the solver compared against the data
   */
  public double[] evaluateModel(double[] abscissa) {
    return variant.value(abscissa, parameters);
  }

  /**
   * Evaluate the fit lineshape as complex values, for comparing against (or plotting over)
   * the measured spectrum
   *
   * @param freqs Frequencies (Hz)
   * @return Complex best-fit curve at each frequency
   * @throws IllegalStateException if the fit model is not a spectral lineshape
   */
  public Complex[] evaluateSpectrum(double[] freqs) {
    if (!variant.isSpectral()) {
      throw new IllegalStateException(variant.getName() + " is not a spectral model");
    }
    return LorentzianModel.fromVector(evaluateModel(freqs));
  }

  /**
   * Get the results as a map from descriptive names to values. Each parameter maps to a
   * two-entry array of its value and standard error; residuals and counts map to a single
   * value.
   *
   * @return Map of result names to values, in a stable order
   */
  public Map<String, double[]> getNamedValues() {
    Map<String, double[]> numerMap = new LinkedHashMap<>();
    for (int i = 0; i < parameters.length; ++i) {
      numerMap.put(variant.getParameterName(i), new double[]{parameters[i], getParameterError(i)});
    }
    numerMap.put("Initial_residual", new double[]{initialResidual});
    numerMap.put("Fit_residual", new double[]{fitResidual});
    numerMap.put("Iterations", new double[]{iterations});
    return numerMap;
  }

  /**
   * Produce a human-readable listing of the fit values with errors
   *
   * @return Multi-line string, one parameter per line
   */
  public String getReportString() {
    DecimalFormat df = NumericUtils.DECIMAL_FORMAT.get();
    StringBuilder sb = new StringBuilder();
    sb.append("Model: ").append(variant.getName()).append('\n');
    for (int i = 0; i < parameters.length; ++i) {
      sb.append(variant.getParameterName(i)).append(": ");
      sb.append(df.format(parameters[i])).append(" +/- ");
      sb.append(df.format(getParameterError(i))).append('\n');
    }
    sb.append("Initial residual: ").append(initialResidual).append('\n');
    sb.append("Fit residual: ").append(fitResidual).append('\n');
    sb.append("Iterations: ").append(iterations);
    return sb.toString();
  }

}
