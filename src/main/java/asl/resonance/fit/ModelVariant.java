package asl.resonance.fit;

/**
 * Enumerated type defining each model the fit engine can solve for. Each entry knows how many
 * parameters it takes, what they are called, and how to produce the model's vector form and
 * its Jacobian over a set of abscissa values, so the solver itself does not care which model
 * it is fitting.
 *
 * The two Lorentzian models take frequency (Hz) as the abscissa and produce vectors twice the
 * length of their input (real parts, then imaginary parts). The damped sine takes time (s) and
 * produces a vector the same length as its input.
 */
public enum ModelVariant {

  PLAIN("Complex Lorentzian", true,
      "f0", "A", "gamma", "phi") {
    @Override
    public double[] value(double[] abscissa, double[] params) {
      return LorentzianModel.vectorModel(abscissa, params[0], params[1], params[2], params[3]);
    }

    @Override
    public double[][] jacobian(double[] abscissa, double[] params) {
      return LorentzianModel.vectorJacobian(abscissa, params);
    }
  },
  LINEAR_BACKGROUND("Complex Lorentzian with linear background", true,
      "f0", "A", "gamma", "phi", "a_real", "b_real", "a_imag", "b_imag") {
    @Override
    public double[] value(double[] abscissa, double[] params) {
      return LorentzianModel.vectorModelWithBackground(abscissa, params[0], params[1],
          params[2], params[3], params[4], params[5], params[6], params[7]);
    }

    @Override
    public double[][] jacobian(double[] abscissa, double[] params) {
      return LorentzianModel.vectorJacobianWithBackground(abscissa, params);
    }
  },
  DAMPED_SINE("Exponentially damped sine", false,
      "f", "A", "gamma", "phi", "B") {
    @Override
    public double[] value(double[] abscissa, double[] params) {
      return DampedSineFitter.dampedSine(abscissa, params);
    }

    @Override
    public double[][] jacobian(double[] abscissa, double[] params) {
      return DampedSineFitter.dampedSineJacobian(abscissa, params);
    }
  };

  private final String name;
  private final boolean spectral;
  private final String[] parameterNames;

  ModelVariant(String name, boolean spectral, String... parameterNames) {
    this.name = name;
    this.spectral = spectral;
    this.parameterNames = parameterNames;
  }

  /**
   * Evaluate the vector form of the model
   *
   * @param abscissa Frequencies or times the model is evaluated at
   * @param params Model parameters, {@link #getParameterCount()} of them
   * @return Vector form of the model, {@link #getVectorLength(int)} entries long
   */
  public abstract double[] value(double[] abscissa, double[] params);

  /**
   * Evaluate the partial derivatives of the vector form of the model
   *
   * @param abscissa Frequencies or times the model is evaluated at
   * @param params Model parameters, {@link #getParameterCount()} of them
   * @return Matrix with one row per vector entry and one column per parameter
   */
  public abstract double[][] jacobian(double[] abscissa, double[] params);

  /**
   * Get the full name of this model (used in reports)
   *
   * @return Name of model, as String
   */
  public String getName() {
    return name;
  }

  public int getParameterCount() {
    return parameterNames.length;
  }

  /**
   * Get the name of the parameter at the given position of the parameter vector
   *
   * @param index Parameter index
   * @return Short name (i.e., "f0", "gamma")
   */
  public String getParameterName(int index) {
    return parameterNames[index];
  }

  public String[] getParameterNames() {
    return parameterNames.clone();
  }

  /**
   * True if this model is a complex frequency-domain lineshape (fit against both real and
   * imaginary parts of a spectrum)
   *
   * @return True for the Lorentzian models
   */
  public boolean isSpectral() {
    return spectral;
  }

  /**
   * Length of the model's vector form for a given number of abscissa points
   *
   * @param points Number of frequencies or times
   * @return Number of entries the solver compares against data
   */
  public int getVectorLength(int points) {
    return spectral ? 2 * points : points;
  }

}
