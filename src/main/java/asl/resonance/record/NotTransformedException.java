package asl.resonance.record;

/**
 * Thrown when decay data is fit before it has been transformed to a spectrum
 */
public class NotTransformedException extends IllegalStateException {

  private static final long serialVersionUID = -6613070924561812409L;

  public NotTransformedException(String message) {
    super(message);
  }

}
