package asl.resonance.input;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.apache.log4j.Logger;

/**
 * Reader for the whitespace-delimited numeric text files written by the acquisition software.
 * Each row has the same number of fields; columns are chosen by zero-based index.
 *
 * Blank lines and lines starting with '#' are ignored. If the first remaining line does not
 * start with a number it is taken to be a header describing the columns and skipped.
 */
public class ColumnFileReader {

  /**
   * Extension of measurement files within a data directory
   */
  public static final String DATA_EXTENSION = ".dat";

  private static final Logger logger = Logger.getLogger(ColumnFileReader.class);

  private ColumnFileReader() {
  }

  /**
   * Read the selected columns of a file
   *
   * @param file File to read
   * @param columns Zero-based indices of the columns to return, in the order wanted
   * @return One array per requested column, each with one entry per data row
   * @throws IOException If the file cannot be read
   * @throws DataFormatException If rows differ in length, a value is not numeric, a requested
   * column does not exist, or the file holds no data
   */
  public static double[][] readColumns(File file, int... columns)
      throws IOException, DataFormatException {
    List<double[]> rows = new ArrayList<>();
    int rowLength = -1;
    int lineNumber = 0;
    boolean firstDataLine = true;

    try (BufferedReader br = new BufferedReader(new FileReader(file))) {
      String line;
      while ((line = br.readLine()) != null) {
        ++lineNumber;
        String trimmed = line.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) {
          continue;
        }
        String[] args = trimmed.split("\\s+");

        if (firstDataLine) {
          firstDataLine = false;
          // if this first line is a format description header skip it
          try {
            Double.parseDouble(args[0]);
          } catch (NumberFormatException e) {
            logger.debug("Skipping header line of " + file.getName() + ": " + trimmed);
            continue;
          }
        }

        if (rowLength < 0) {
          rowLength = args.length;
        } else if (args.length != rowLength) {
          throw new DataFormatException(file, lineNumber, "expected " + rowLength
              + " fields but found " + args.length);
        }

        double[] row = new double[args.length];
        for (int i = 0; i < args.length; ++i) {
          try {
            row[i] = Double.parseDouble(args[i]);
          } catch (NumberFormatException e) {
            throw new DataFormatException(file, lineNumber, "value '" + args[i]
                + "' is not a number");
          }
        }
        rows.add(row);
      }
    }

    if (rows.isEmpty()) {
      throw new DataFormatException(file, lineNumber, "file contains no data rows");
    }
    for (int column : columns) {
      if (column < 0 || column >= rowLength) {
        throw new DataFormatException(file, 0, "column " + column + " requested but rows have "
            + rowLength + " fields");
      }
    }

    double[][] out = new double[columns.length][rows.size()];
    for (int r = 0; r < rows.size(); ++r) {
      double[] row = rows.get(r);
      for (int c = 0; c < columns.length; ++c) {
        out[c][r] = row[columns[c]];
      }
    }
    logger.info("Read " + rows.size() + " rows of columns " + Arrays.toString(columns)
        + " from " + file.getName());
    return out;
  }

  /**
   * Read a swept-frequency measurement
   *
   * @param file File to read
   * @param columns Indices of frequency, X, Y, R and phase columns
   * @return Measurement holding the five columns
   * @throws IOException If the file cannot be read
   * @throws DataFormatException If the file is malformed
   */
  public static Measurement readSpectrum(File file, int[] columns)
      throws IOException, DataFormatException {
    if (columns.length != 5) {
      throw new IllegalArgumentException("Spectral files need 5 column indices, got "
          + columns.length);
    }
    double[][] data = readColumns(file, columns);
    return Measurement.spectral(data[0], data[1], data[2], data[3], data[4]);
  }

  /**
   * Read a decay measurement
   *
   * @param file File to read
   * @param columns Indices of the time and signal columns
   * @return Measurement holding time and signal
   * @throws IOException If the file cannot be read
   * @throws DataFormatException If the file is malformed
   */
  public static Measurement readDecay(File file, int[] columns)
      throws IOException, DataFormatException {
    if (columns.length != 2) {
      throw new IllegalArgumentException("Decay files need 2 column indices, got "
          + columns.length);
    }
    double[][] data = readColumns(file, columns);
    return Measurement.timeDomain(data[0], data[1]);
  }

  /**
   * List the measurement files in a directory, in name order
   *
   * @param directory Directory to search (not recursive)
   * @return All files in the directory ending with {@link #DATA_EXTENSION}
   * @throws IOException If the path is not a readable directory
   */
  public static List<File> listDataFiles(File directory) throws IOException {
    File[] found = directory.listFiles(
        (dir, name) -> name.endsWith(DATA_EXTENSION) && new File(dir, name).isFile());
    if (found == null) {
      throw new IOException("Not a readable directory: " + directory.getPath());
    }
    Arrays.sort(found);
    return new ArrayList<>(Arrays.asList(found));
  }

  /**
   * Exception for files that do not have the consistent numeric column layout expected
   */
  public static class DataFormatException extends Exception {

    private static final long serialVersionUID = 4637104585286617092L;

    private final String fileName;
    private final int lineNumber;

    /**
     * @param file File being read
     * @param lineNumber One-based line at which the problem was found (0 if not line-specific)
     * @param problem Description of what is wrong
     */
    public DataFormatException(File file, int lineNumber, String problem) {
      super("Malformed data in " + file.getName()
          + (lineNumber > 0 ? " at line " + lineNumber : "") + ": " + problem);
      this.fileName = file.getName();
      this.lineNumber = lineNumber;
    }

    public String getFileName() {
      return fileName;
    }

    public int getLineNumber() {
      return lineNumber;
    }
  }

}
