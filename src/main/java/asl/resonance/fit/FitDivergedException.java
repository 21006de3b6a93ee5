package asl.resonance.fit;

/**
 * Thrown when the least-squares solver cannot produce a usable optimum: the iteration or
 * evaluation budget ran out, the normal matrix was singular, or the estimated covariance has
 * a negative or NaN variance on its diagonal.
 *
 * The solver exception that caused the failure, if any, is kept as the cause.
 */
public class FitDivergedException extends Exception {

  private static final long serialVersionUID = 1L;

  public FitDivergedException(String message) {
    super(message);
  }

  public FitDivergedException(String message, Throwable cause) {
    super(message, cause);
  }
}
