package asl.resonance.fit;

/**
 * Thrown when arrays that must be paired index-for-index (frequencies and spectrum values,
 * times and samples, parameters and the model they feed) do not have matching lengths.
 */
public class DimensionMismatchException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  public DimensionMismatchException(String message) {
    super(message);
  }

  public DimensionMismatchException(String what, int expected, int actual) {
    super(what + ": expected length " + expected + " but got " + actual);
  }
}
