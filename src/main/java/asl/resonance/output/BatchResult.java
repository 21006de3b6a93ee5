package asl.resonance.output;

import asl.resonance.record.ResonanceRecord;
import asl.resonance.utils.NumericUtils;
import java.text.DecimalFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of fitting a set of measurement files: the records that were fit, in input order,
 * and for every file that could not be processed, what went wrong.
 */
public class BatchResult {

  private final List<ResonanceRecord> successes;
  private final List<Failure> failures;

  public BatchResult(List<ResonanceRecord> successes, List<Failure> failures) {
    this.successes = Collections.unmodifiableList(new ArrayList<>(successes));
    this.failures = Collections.unmodifiableList(new ArrayList<>(failures));
  }

  public List<ResonanceRecord> getSuccesses() {
    return successes;
  }

  public List<Failure> getFailures() {
    return failures;
  }

  public int size() {
    return successes.size() + failures.size();
  }

  /**
   * One line per file: current, fit frequency and linewidth with errors for fitted records,
   * then the error kind and message for each failure
   *
   * @return Text table of the batch
   */
  public String getReportString() {
    DecimalFormat df = NumericUtils.DECIMAL_FORMAT.get();
    StringBuilder sb = new StringBuilder();
    sb.append("file\tcurrent_uA\tf0_Hz\tf0_err\tgamma_Hz\tgamma_err\n");
    for (ResonanceRecord record : successes) {
      double current = record.getDriveCurrent();
      sb.append(record.getSourceId()).append('\t');
      sb.append(Double.isNaN(current) ? "NaN" : df.format(current)).append('\t');
      sb.append(df.format(record.resonantFrequency())).append('\t');
      sb.append(df.format(record.resonantFrequencyError())).append('\t');
      sb.append(df.format(record.linewidth())).append('\t');
      sb.append(df.format(record.linewidthError())).append('\n');
    }
    for (Failure failure : failures) {
      sb.append(failure.getSourceId()).append("\tFAILED (").append(failure.getErrorKind());
      sb.append("): ").append(failure.getMessage()).append('\n');
    }
    return sb.toString();
  }

  /**
   * A file that could not be read or fit
   */
  public static class Failure {

    private final String sourceId;
    private final String errorKind;
    private final String message;

    public Failure(String sourceId, Throwable error) {
      this.sourceId = sourceId;
      this.errorKind = error.getClass().getSimpleName();
      this.message = error.getMessage();
    }

    public String getSourceId() {
      return sourceId;
    }

    /**
     * Simple name of the exception class that stopped processing, i.e. FitDivergedException
     *
     * @return Error kind
     */
    public String getErrorKind() {
      return errorKind;
    }

    public String getMessage() {
      return message;
    }
  }

}
