package asl.resonance.fit;

import asl.resonance.input.Configuration;
import asl.resonance.output.FitResult;
import asl.resonance.utils.FFTResult;
import java.util.Arrays;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.exception.ConvergenceException;
import org.apache.commons.math3.exception.MaxCountExceededException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.util.Pair;
import org.apache.log4j.Logger;

/**
 * Levenberg-Marquardt solver for the models in {@link ModelVariant}.
 *
 * Complex spectra are fit through their vector form (real parts followed by imaginary parts),
 * so both components of the data constrain the fit equally. Parameter errors come from the
 * asymptotic covariance (J^T J)^-1 at the optimum, scaled by the residual variance
 * SSR / (m - n) for m data entries and n parameters. With no spare degrees of freedom the
 * covariance is filled with positive infinity instead.
 *
 * Any failure of the solver to produce a usable answer (budget exceeded, singular normal
 * matrix, non-finite parameters, a negative or NaN variance) is reported as a
 * {@link FitDivergedException}.
 */
public class FitEngine {

  private static final Logger logger = Logger.getLogger(FitEngine.class);

  /**
   * Pivot threshold used when inverting the normal matrix for the covariance
   */
  public static final double SINGULARITY_THRESHOLD = 1E-14;

  private final double costTolerance;
  private final double parameterTolerance;
  private final double orthoTolerance;
  private final int maxIterations;
  private final int maxEvaluations;

  /**
   * Create a solver with the default tolerances and budget
   */
  public FitEngine() {
    this(Configuration.DEFAULT_COST_TOLERANCE, Configuration.DEFAULT_PARAMETER_TOLERANCE,
        Configuration.DEFAULT_ORTHO_TOLERANCE, Configuration.DEFAULT_MAX_ITERATIONS,
        Configuration.DEFAULT_MAX_EVALUATIONS);
  }

  /**
   * Create a solver with tolerances and budget taken from the configuration
   *
   * @param config Configuration to read solver settings from
   */
  public FitEngine(Configuration config) {
    this(config.getCostTolerance(), config.getParameterTolerance(), config.getOrthoTolerance(),
        config.getMaxIterations(), config.getMaxEvaluations());
  }

  /**
   * Create a solver with explicit settings
   *
   * @param costTolerance Relative cost change at which the solver stops
   * @param parameterTolerance Relative parameter change at which the solver stops
   * @param orthoTolerance Orthogonality between residuals and Jacobian at which it stops
   * @param maxIterations Iterations allowed before the fit is declared divergent
   * @param maxEvaluations Model evaluations allowed before the fit is declared divergent
   */
  public FitEngine(double costTolerance, double parameterTolerance, double orthoTolerance,
      int maxIterations, int maxEvaluations) {
    this.costTolerance = costTolerance;
    this.parameterTolerance = parameterTolerance;
    this.orthoTolerance = orthoTolerance;
    this.maxIterations = maxIterations;
    this.maxEvaluations = maxEvaluations;
  }

  public int getMaxIterations() {
    return maxIterations;
  }

  public int getMaxEvaluations() {
    return maxEvaluations;
  }

  /**
   * Fit a spectrum, estimating the seed from the data with phase 0
   *
   * @param freqs Frequency of each point (Hz)
   * @param signal Complex spectrum at each frequency
   * @param variant Lorentzian model to fit
   * @return Best-fit parameters with their covariance
   * @throws FitDivergedException if the solver does not produce a usable fit
   */
  public FitResult fit(double[] freqs, Complex[] signal, ModelVariant variant)
      throws FitDivergedException {
    return fit(freqs, signal, null, variant, 0.);
  }

  /**
   * Fit the contents of a spectrum
   *
   * @param spectrum Spectrum to fit
   * @param variant Lorentzian model to fit
   * @param seed Starting parameters, or null to estimate them from the data
   * @param phaseHint Starting phase used when the seed is estimated (radians)
   * @return Best-fit parameters with their covariance
   * @throws FitDivergedException if the solver does not produce a usable fit
   */
  public FitResult fit(FFTResult spectrum, ModelVariant variant, double[] seed, double phaseHint)
      throws FitDivergedException {
    return fit(spectrum.getFreqs(), spectrum.getFFT(), seed, variant, phaseHint);
  }

  /**
   * Fit a complex Lorentzian lineshape (optionally with linear background) to a spectrum.
   *
   * When the seed is null it is estimated with {@link InitialGuessEstimator}; the background
   * terms of a {@link ModelVariant#LINEAR_BACKGROUND} fit start at zero, which is also how a
   * four-entry seed is extended for that model.
   *
   * @param freqs Frequency of each point (Hz)
   * @param signal Complex spectrum at each frequency
   * @param seed Starting parameters, or null to estimate them from the data
   * @param variant Lorentzian model to fit
   * @param phaseHint Starting phase used when the seed is estimated (radians)
   * @return Best-fit parameters with their covariance
   * @throws FitDivergedException if the solver does not produce a usable fit
   */
  public FitResult fit(double[] freqs, Complex[] signal, double[] seed, ModelVariant variant,
      double phaseHint) throws FitDivergedException {
    if (!variant.isSpectral()) {
      throw new IllegalArgumentException(variant.getName() + " cannot be fit to a spectrum");
    }
    if (freqs.length != signal.length) {
      throw new DimensionMismatchException("Spectrum values", freqs.length, signal.length);
    }

    double[] start = buildSeed(freqs, signal, seed, variant, phaseHint);
    double[] observed = LorentzianModel.toVector(signal);
    return solve(variant, freqs, observed, start);
  }

  private static double[] buildSeed(double[] freqs, Complex[] signal, double[] seed,
      ModelVariant variant, double phaseHint) {
    int count = variant.getParameterCount();
    if (seed == null) {
      seed = InitialGuessEstimator.guess(freqs, signal, phaseHint);
    }
    if (seed.length == count) {
      return seed.clone();
    }
    if (seed.length == LorentzianModel.LORENTZ_PARAMS && variant == ModelVariant.LINEAR_BACKGROUND) {
      // background terms start flat
      return Arrays.copyOf(seed, count);
    }
    throw new DimensionMismatchException("Seed parameters", count, seed.length);
  }

  /**
   * Fit any of the models to data already in the model's vector form
   *
   * @param variant Model to fit
   * @param abscissa Frequencies or times the data was measured at
   * @param observed Data in vector form ({@link ModelVariant#getVectorLength(int)} entries)
   * @param seed Starting parameters, one per model parameter
   * @return Best-fit parameters with their covariance
   * @throws FitDivergedException if the solver does not produce a usable fit
   */
  public FitResult solve(final ModelVariant variant, final double[] abscissa, double[] observed,
      double[] seed) throws FitDivergedException {
    int n = variant.getParameterCount();
    int m = variant.getVectorLength(abscissa.length);
    if (observed.length != m) {
      throw new DimensionMismatchException("Observed values", m, observed.length);
    }
    if (seed.length != n) {
      throw new DimensionMismatchException("Seed parameters", n, seed.length);
    }
    // one measured point per parameter at least, even though a spectral point holds two values
    if (abscissa.length < n) {
      throw new DimensionMismatchException("Need at least " + n + " points to fit "
          + variant.getName() + ", got " + abscissa.length);
    }

    MultivariateJacobianFunction model = new MultivariateJacobianFunction() {
      @Override
      public Pair<RealVector, RealMatrix> value(RealVector point) {
        double[] params = point.toArray();
        RealVector values = MatrixUtils.createRealVector(variant.value(abscissa, params));
        RealMatrix jacobian = MatrixUtils.createRealMatrix(variant.jacobian(abscissa, params));
        return new Pair<>(values, jacobian);
      }
    };

    RealVector startVector = MatrixUtils.createRealVector(seed);
    RealVector observedComponents = MatrixUtils.createRealVector(observed);

    LeastSquaresProblem lsp = new LeastSquaresBuilder().
        start(startVector).
        target(observedComponents).
        model(model).
        parameterValidator(new LinewidthValidator()).
        lazyEvaluation(false).
        maxEvaluations(maxEvaluations).
        maxIterations(maxIterations).
        build();

    LeastSquaresOptimizer optimizer = new LevenbergMarquardtOptimizer().
        withCostRelativeTolerance(costTolerance).
        withOrthoTolerance(orthoTolerance).
        withParameterRelativeTolerance(parameterTolerance);

    LeastSquaresProblem.Evaluation initEval = lsp.evaluate(startVector);
    double initialResidual = square(initEval.getCost());
    logger.debug("Fitting " + variant.getName() + " from seed " + Arrays.toString(seed)
        + ", initial residual " + initialResidual);

    LeastSquaresOptimizer.Optimum optimum;
    RealMatrix normalInverse;
    try {
      optimum = optimizer.optimize(lsp);
      normalInverse = optimum.getCovariances(SINGULARITY_THRESHOLD);
    } catch (MaxCountExceededException e) {
      throw new FitDivergedException("Solver budget exceeded for " + variant.getName()
          + " (" + maxIterations + " iterations, " + maxEvaluations + " evaluations)", e);
    } catch (SingularMatrixException e) {
      throw new FitDivergedException("Singular normal matrix at the " + variant.getName()
          + " optimum; parameters are not identifiable from this data", e);
    } catch (ConvergenceException e) {
      throw new FitDivergedException("Solver failed to converge for " + variant.getName(), e);
    }

    double[] fitParams = optimum.getPoint().toArray();
    for (int i = 0; i < n; ++i) {
      if (!Double.isFinite(fitParams[i])) {
        throw new FitDivergedException("Fit produced a non-finite value for "
            + variant.getParameterName(i));
      }
    }

    double fitResidual = square(optimum.getCost());
    double[][] covariance = scaleCovariance(normalInverse, fitResidual, m, n);
    for (int i = 0; i < n; ++i) {
      double variance = covariance[i][i];
      if (Double.isNaN(variance) || variance < 0) {
        throw new FitDivergedException("Invalid variance " + variance + " for "
            + variant.getParameterName(i) + "; fit is degenerate");
      }
    }

    logger.debug("Fit of " + variant.getName() + " finished after " + optimum.getIterations()
        + " iterations: " + Arrays.toString(fitParams) + ", residual " + fitResidual);

    return new FitResult(variant, fitParams, covariance, seed, initialResidual, fitResidual,
        optimum.getIterations(), optimum.getEvaluations());
  }

  /**
   * Scale the inverse of the normal matrix by the residual variance. When there are as many
   * data values as parameters the variance is undefined and every entry becomes infinite.
   *
   * @param normalInverse (J^T J)^-1 at the optimum
   * @param sumSquares Sum of squared residuals at the optimum
   * @param dataCount Number of data values (m)
   * @param paramCount Number of parameters (n)
   * @return Covariance matrix as a 2D array
   */
  static double[][] scaleCovariance(RealMatrix normalInverse, double sumSquares, int dataCount,
      int paramCount) {
    double[][] covariance = normalInverse.getData();
    int dof = dataCount - paramCount;
    for (double[] row : covariance) {
      for (int j = 0; j < row.length; ++j) {
        row[j] = dof > 0 ? row[j] * sumSquares / dof : Double.POSITIVE_INFINITY;
      }
    }
    // enforce exact symmetry lost to rounding in the inversion
    for (int i = 0; i < covariance.length; ++i) {
      for (int j = i + 1; j < covariance.length; ++j) {
        double mean = (covariance[i][j] + covariance[j][i]) / 2.;
        covariance[i][j] = mean;
        covariance[j][i] = mean;
      }
    }
    return covariance;
  }

  private static double square(double value) {
    return value * value;
  }

  /**
   * Keeps the linewidth (the third parameter of every model) off zero, where the Lorentzian
   * is singular at resonance and the relaxation time is undefined.
   */
  private static class LinewidthValidator implements ParameterValidator {

    private static final int LINEWIDTH_INDEX = 2;
    private static final double MIN_LINEWIDTH = 1E-12;

    @Override
    public RealVector validate(RealVector params) {
      double gamma = params.getEntry(LINEWIDTH_INDEX);
      if (Math.abs(gamma) < MIN_LINEWIDTH) {
        // keep the sign the solver was heading in
        params.setEntry(LINEWIDTH_INDEX, gamma < 0 ? -MIN_LINEWIDTH : MIN_LINEWIDTH);
      }
      return params;
    }
  }

}
