package asl.resonance.fit;

/**
 * Thrown when a quantity derived from a fit parameter (i.e., T2 from the linewidth) would require
 * dividing by zero.
 */
public class DivisionByZeroException extends ArithmeticException {

  private static final long serialVersionUID = 1L;

  public DivisionByZeroException(String message) {
    super(message);
  }
}
