package asl.resonance.record;

/**
 * Kind of data a resonance record holds, which determines whether the record must be
 * transformed to the frequency domain before it can be fit.
 */
public enum RecordType {

  SPECTRUM("Swept-frequency spectrum", false),
  FID("Free induction decay", true);

  private final String name;
  private final boolean requiresTransform;

  RecordType(String name, boolean requiresTransform) {
    this.name = name;
    this.requiresTransform = requiresTransform;
  }

  public String getName() {
    return name;
  }

  /**
   * True if data of this kind is recorded in the time domain and has to be transformed before
   * a Lorentzian can be fit to it
   *
   * @return True for decay data
   */
  public boolean requiresTransform() {
    return requiresTransform;
  }

}
