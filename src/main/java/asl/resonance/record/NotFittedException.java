package asl.resonance.record;

/**
 * Thrown when fit results are requested from a record that has not been fit
 */
public class NotFittedException extends IllegalStateException {

  private static final long serialVersionUID = 1740823375160591127L;

  public NotFittedException(String message) {
    super(message);
  }

}
