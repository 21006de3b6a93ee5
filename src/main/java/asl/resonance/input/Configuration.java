package asl.resonance.input;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.XMLConfiguration;
import org.apache.log4j.Logger;

/**
 * Configuration file with the tunable parts of the analysis: least-squares solver tolerances and
 * iteration budget, the column layout of measurement files, the default data folder and the
 * number of worker threads for batch fitting.
 *
 * Any value not in the XML file keeps its default, and a file that cannot be read leaves every
 * value at its default.
 */
public class Configuration {

  private static Configuration instance;

  private static final String DEFAULT_CONFIG_PATH = "resonance-config.xml";
  private static final Logger logger = Logger.getLogger(Configuration.class);

  public static final double DEFAULT_COST_TOLERANCE = 1.0E-10;
  public static final double DEFAULT_PARAMETER_TOLERANCE = 1.0E-10;
  public static final double DEFAULT_ORTHO_TOLERANCE = 1.0E-10;
  public static final int DEFAULT_MAX_ITERATIONS = 1000;
  public static final int DEFAULT_MAX_EVALUATIONS = 5000;

  private String loadedConfigPath;

  private String defaultDataFolder = "data";

  private double costTolerance = DEFAULT_COST_TOLERANCE;
  private double parameterTolerance = DEFAULT_PARAMETER_TOLERANCE;
  private double orthoTolerance = DEFAULT_ORTHO_TOLERANCE;
  private int maxIterations = DEFAULT_MAX_ITERATIONS;
  private int maxEvaluations = DEFAULT_MAX_EVALUATIONS;

  // frequency, X, Y, R, phase
  private int[] spectrumColumns = {0, 1, 3, 5, 7};
  // time, signal
  private int[] fidColumns = {0, 1};

  private int batchThreads = Runtime.getRuntime().availableProcessors();

  private Configuration() {
  }

  private Configuration(String configLocation) {
    logger.info("Attempting reading in config file from " + configLocation);
    try {
      XMLConfiguration config = new XMLConfiguration(configLocation);

      String defaultDataFolderParam = config.getString("LocalPaths.DataPath");
      if (defaultDataFolderParam != null) {
        defaultDataFolder = defaultDataFolderParam;
      }

      costTolerance = config.getDouble("Solver.CostTolerance", costTolerance);
      parameterTolerance = config.getDouble("Solver.ParameterTolerance", parameterTolerance);
      orthoTolerance = config.getDouble("Solver.OrthoTolerance", orthoTolerance);
      maxIterations = config.getInt("Solver.MaxIterations", maxIterations);
      maxEvaluations = config.getInt("Solver.MaxEvaluations", maxEvaluations);

      spectrumColumns = parseColumns(config.getStringArray("Columns.Spectrum"), spectrumColumns);
      fidColumns = parseColumns(config.getStringArray("Columns.FID"), fidColumns);

      int threadsParam = config.getInt("Batch.Threads", -1);
      if (threadsParam > 0) {
        batchThreads = threadsParam;
      }

      loadedConfigPath = configLocation;
      File loaded = config.getFile();
      if (loaded != null) {
        try {
          loadedConfigPath = loaded.getCanonicalPath();
        } catch (IOException e) {
          logger.warn("Could not resolve canonical path of " + configLocation, e);
        }
      }
      logger.info("Succesfully loaded in configuration: " + loadedConfigPath);
    } catch (ConfigurationException e) {
      logger.error("Error encountered while reading XML file, load failed, using defaults", e);
    }
  }

  private static int[] parseColumns(String[] values, int[] defaults) {
    if (values == null || values.length != defaults.length) {
      if (values != null && values.length > 0) {
        logger.warn("Expected " + defaults.length + " column indices but got " + values.length
            + "; keeping defaults");
      }
      return defaults;
    }
    int[] columns = new int[values.length];
    try {
      for (int i = 0; i < values.length; ++i) {
        columns[i] = Integer.parseInt(values[i].trim());
      }
    } catch (NumberFormatException e) {
      logger.warn("Could not parse column indices, keeping defaults", e);
      return defaults;
    }
    return columns;
  }

  private static boolean copyEmbedXML(String pathToPlaceFile) {
    File fileOut = new File(pathToPlaceFile);
    try (InputStream stream =
        Configuration.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_PATH)) {
      if (stream == null) {
        logger.error("Major error: config XML file not part of resources!!");
        return false;
      }
      logger.info("Copying over embedded jar file to absolute path " + fileOut.getAbsolutePath());
      Files.copy(stream, fileOut.toPath());
      return true;
    } catch (IOException e) {
      logger.warn("Could not copy over the file...", e);
    }
    return false;
  }

  /**
   * Gets the current instance of the configuration, or creates one if none exists
   * @return the current configuration instance
   */
  synchronized public static Configuration getInstance() {
    return getInstance(System.getProperty("user.dir") + File.separator + DEFAULT_CONFIG_PATH);
  }

  /**
   * Gets the current instance of the configuration, or creates one from a specified file if none
   * exists. If the file does not exist, the embedded default configuration is written there
   * first.
   * @param configLocation New configuration file location to read from
   * @return the current configuration instance
   */
  synchronized public static Configuration getInstance(String configLocation) {
    if (instance == null) {
      File config = new File(configLocation);
      if (!config.exists()) {
        boolean success = copyEmbedXML(configLocation);
        if (!success) {
          logger.warn("Could not find or write to specified config location: " + configLocation);
          logger.warn("Will attempt to initialize config file at user home directory.");
          configLocation = System.getProperty("user.home") + File.separator + DEFAULT_CONFIG_PATH;
          config = new File(configLocation);
          if (!config.exists()) {
            success = copyEmbedXML(configLocation);
            if (!success) {
              logger.warn("Could not find or write to user home directory either!");
            }
          }
        }
      }
      instance = new Configuration(configLocation);
    }
    return instance;
  }

  /**
   * Read a configuration from the given file without touching the shared instance.
   * @param configLocation Configuration file location
   * @return configuration with values from the file, defaults elsewhere
   */
  public static Configuration fromFile(String configLocation) {
    return new Configuration(configLocation);
  }

  /**
   * Get a configuration holding only default values (no file is read)
   * @return default configuration
   */
  public static Configuration defaults() {
    return new Configuration();
  }

  /**
   * Path of the file this configuration was read from, or null if only defaults are in use
   * @return canonical path of the loaded file
   */
  public String getLoadedConfigPath() {
    return loadedConfigPath;
  }

  /**
   * Gets the default data folder. If none was specified in the XML file, the default is the 'data'
   * subdirectory under the current working directory.
   *
   * The property is defined from Configuration.LocalPaths.DataPath
   * @return The folder to start looking for measurement files from.
   */
  public String getDefaultDataFolder() {
    return defaultDataFolder;
  }

  /**
   * Relative change in cost below which the solver stops (Solver.CostTolerance)
   * @return cost relative tolerance
   */
  public double getCostTolerance() {
    return costTolerance;
  }

  /**
   * Relative change in parameters below which the solver stops (Solver.ParameterTolerance)
   * @return parameter relative tolerance
   */
  public double getParameterTolerance() {
    return parameterTolerance;
  }

  public double getOrthoTolerance() {
    return orthoTolerance;
  }

  /**
   * Upper limit on solver iterations before a fit is declared divergent (Solver.MaxIterations)
   * @return iteration budget
   */
  public int getMaxIterations() {
    return maxIterations;
  }

  public int getMaxEvaluations() {
    return maxEvaluations;
  }

  /**
   * Column indices (zero-based) of frequency, in-phase, quadrature, magnitude and phase in
   * swept-frequency measurement files (Columns.Spectrum)
   * @return five column indices
   */
  public int[] getSpectrumColumns() {
    return spectrumColumns.clone();
  }

  /**
   * Column indices (zero-based) of time and signal in decay measurement files (Columns.FID)
   * @return two column indices
   */
  public int[] getFidColumns() {
    return fidColumns.clone();
  }

  /**
   * Number of worker threads for fitting directories of files (Batch.Threads)
   * @return thread count, at least 1
   */
  public int getBatchThreads() {
    return Math.max(1, batchThreads);
  }

}
