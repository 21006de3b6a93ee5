package asl.resonance.fit;

/**
 * Thrown when a time series window is too short to be transformed (sample interval undefined).
 */
public class InsufficientDataException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  public InsufficientDataException(String message) {
    super(message);
  }
}
