package asl.resonance.record;

/**
 * Stages a resonance record passes through. A record is created empty, read from its source,
 * (for decay data) transformed to a spectrum, and fit. Fitting may be repeated.
 */
public enum RecordState {
  CREATED,
  READ,
  TRANSFORMED,
  FITTED
}
