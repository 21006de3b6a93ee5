package asl.resonance;

import asl.resonance.fit.ModelVariant;
import asl.resonance.input.Configuration;
import asl.resonance.output.BatchResult;
import asl.resonance.record.RecordType;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import org.apache.log4j.Logger;

/**
 * Command-line entry point: fits every measurement file in a directory and prints one line of
 * results per file.
 *
 * <pre>
 *   ResonanceShell &lt;directory&gt; [--fid] [--decay] [--background] [--threads N]
 *       [--config FILE]
 * </pre>
 * --fid treats the files as decays to transform before fitting, --decay fits decays with a
 * damped sine in the time domain instead, and --background adds a linear background to the
 * Lorentzian.
 */
public class ResonanceShell {

  private static final Logger logger = Logger.getLogger(ResonanceShell.class);

  static final String USAGE = "usage: ResonanceShell <directory> [--fid] [--decay] "
      + "[--background] [--threads N] [--config FILE]";

  private BatchResult result;

  /**
   * Parse arguments and run a batch fit
   *
   * @param args Command-line arguments
   * @param out Stream to print results to
   * @return Process exit status: 0 on success (even if some files failed), 1 if the batch
   * could not run, 2 on bad arguments
   */
  public int run(String[] args, PrintStream out) {
    String directory = null;
    RecordType type = RecordType.SPECTRUM;
    boolean background = false;
    boolean decay = false;
    Integer threads = null;
    String configPath = null;

    for (int i = 0; i < args.length; ++i) {
      String arg = args[i];
      switch (arg) {
        case "--fid":
          type = RecordType.FID;
          break;
        case "--decay":
          type = RecordType.FID;
          decay = true;
          break;
        case "--background":
          background = true;
          break;
        case "--threads":
        case "--config":
          if (i + 1 >= args.length) {
            out.println("Missing value for " + arg);
            out.println(USAGE);
            return 2;
          }
          String value = args[++i];
          if (arg.equals("--config")) {
            configPath = value;
            break;
          }
          try {
            threads = Integer.parseInt(value);
          } catch (NumberFormatException e) {
            out.println("Thread count is not a number: " + value);
            out.println(USAGE);
            return 2;
          }
          if (threads < 1) {
            out.println("Thread count must be positive: " + value);
            return 2;
          }
          break;
        default:
          if (arg.startsWith("--") || directory != null) {
            out.println("Unexpected argument: " + arg);
            out.println(USAGE);
            return 2;
          }
          directory = arg;
      }
    }

    if (decay && background) {
      out.println("--background applies only to Lorentzian fits, not --decay");
      return 2;
    }

    Configuration config = configPath == null ? Configuration.getInstance()
        : Configuration.fromFile(configPath);
    if (directory == null) {
      directory = config.getDefaultDataFolder();
    }

    ModelVariant variant = decay ? ModelVariant.DAMPED_SINE
        : background ? ModelVariant.LINEAR_BACKGROUND : ModelVariant.PLAIN;
    BatchAnalysis analysis = threads == null ? new BatchAnalysis(config, type, variant)
        : new BatchAnalysis(config, type, variant, threads);

    try {
      result = analysis.analyze(new File(directory));
    } catch (IOException e) {
      logger.error("Could not read data directory " + directory, e);
      out.println("Could not read data directory " + directory + ": " + e.getMessage());
      return 1;
    } catch (InterruptedException e) {
      logger.error("Interrupted while fitting " + directory, e);
      Thread.currentThread().interrupt();
      return 1;
    }

    out.print(result.getReportString());
    return 0;
  }

  /**
   * Return the results of the last batch run.
   * This should not be called until run(..) has been.
   * @return Batch results, or null if no batch has completed
   */
  public BatchResult getResult() {
    return result;
  }

  public static void main(String[] args) {
    int status = new ResonanceShell().run(args, System.out);
    if (status != 0) {
      System.exit(status);
    }
  }

}
