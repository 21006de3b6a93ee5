package asl.resonance;

import asl.resonance.fit.ModelVariant;
import asl.resonance.input.ColumnFileReader;
import asl.resonance.input.Configuration;
import asl.resonance.input.FilenameMetadata;
import asl.resonance.output.BatchResult;
import asl.resonance.output.BatchResult.Failure;
import asl.resonance.record.RecordType;
import asl.resonance.record.ResonanceRecord;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.apache.log4j.Logger;

/**
 * Reads and fits every measurement file of a directory (a sweep of drive currents, or a series
 * over time), one task per file on a fixed pool of threads. Files that cannot be read or fit
 * are logged and reported in the result; they do not stop the rest of the batch.
 */
public class BatchAnalysis {

  private static final Logger logger = Logger.getLogger(BatchAnalysis.class);

  private final Configuration config;
  private final RecordType type;
  private final ModelVariant variant;
  private final int threads;

  /**
   * @param config Column layout and solver settings for each file
   * @param type Kind of data in the files
   * @param variant Model to fit to each file
   * @param threads Number of worker threads
   */
  public BatchAnalysis(Configuration config, RecordType type, ModelVariant variant,
      int threads) {
    if (threads < 1) {
      throw new IllegalArgumentException("Thread count must be positive, got " + threads);
    }
    this.config = config;
    this.type = type;
    this.variant = variant;
    this.threads = threads;
  }

  public BatchAnalysis(Configuration config, RecordType type, ModelVariant variant) {
    this(config, type, variant, config.getBatchThreads());
  }

  /**
   * Fit all measurement files in a directory, in order of increasing drive current
   *
   * @param directory Directory holding the measurement files
   * @return Fitted records and failures
   * @throws IOException If the directory cannot be listed
   * @throws InterruptedException If interrupted while waiting for the fits
   */
  public BatchResult analyze(File directory) throws IOException, InterruptedException {
    List<File> files = FilenameMetadata.sortByCurrent(ColumnFileReader.listDataFiles(directory));
    logger.info("Found " + files.size() + " data files in " + directory.getPath());
    return analyze(files);
  }

  /**
   * Fit the given measurement files. Results keep the order of the input list.
   *
   * @param files Measurement files
   * @return Fitted records and failures
   * @throws InterruptedException If interrupted while waiting for the fits
   */
  public BatchResult analyze(List<File> files) throws InterruptedException {
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    List<Future<ResonanceRecord>> futures = new ArrayList<>();
    try {
      for (final File file : files) {
        futures.add(executor.submit(new Callable<ResonanceRecord>() {
          @Override
          public ResonanceRecord call() throws Exception {
            return process(file);
          }
        }));
      }

      List<ResonanceRecord> successes = new ArrayList<>();
      List<Failure> failures = new ArrayList<>();
      for (int i = 0; i < files.size(); ++i) {
        String name = files.get(i).getName();
        try {
          successes.add(futures.get(i).get());
        } catch (ExecutionException e) {
          Throwable cause = e.getCause() == null ? e : e.getCause();
          logger.error("Could not fit " + name + ": " + cause.getMessage(), cause);
          failures.add(new Failure(name, cause));
        }
      }
      logger.info("Batch complete: " + successes.size() + " fit, " + failures.size()
          + " failed");
      return new BatchResult(successes, failures);
    } finally {
      executor.shutdown();
      if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    }
  }

  /**
   * Read, transform (decay data only) and fit a single file
   *
   * @param file Measurement file
   * @return Fitted record
   * @throws Exception Any error reading or fitting the file
   */
  ResonanceRecord process(File file) throws Exception {
    ResonanceRecord record = ResonanceRecord.fromFile(file, type, config);
    record.read();
    if (type.requiresTransform() && variant.isSpectral()) {
      record.transform();
    }
    record.fit(variant);
    return record;
  }

}
