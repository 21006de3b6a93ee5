package asl.resonance.utils;

/**
 * Contains static methods for basic operations on sampled data: windowing with sequence-slice
 * index semantics and the summary statistics used by the signal-level helpers.
 */
public class TimeSeriesUtils {

  /**
   * Resolve an index the way sequence slicing does: negative values count back from the end,
   * and anything outside the range [0, length] is clamped to the nearest bound.
   *
   * @param index Index to resolve, possibly negative
   * @param length Length of the sequence being indexed
   * @return Index in the range [0, length]
   */
  public static int resolveSliceIndex(int index, int length) {
    if (index < 0) {
      index += length;
    }
    return Math.max(0, Math.min(index, length));
  }

  /**
   * Get the data in the half-open range [start, end). Negative indices are offsets from the end
   * of the data, so (0, -1) is everything except the last point. If end resolves to a point before
   * start the result is empty.
   *
   * @param data Data to take a window from
   * @param start First index to include
   * @param end Index to stop before
   * @return Copy of the windowed data
   */
  public static double[] slice(double[] data, int start, int end) {
    int from = resolveSliceIndex(start, data.length);
    int to = resolveSliceIndex(end, data.length);
    if (to <= from) {
      return new double[]{};
    }
    double[] out = new double[to - from];
    System.arraycopy(data, from, out, 0, out.length);
    return out;
  }

  /**
   * Remove mean (constant value) from a dataset
   *
   * @return timeseries as numeric list with previous mean subtracted
   */
  public static double[] demean(double[] dataSet) {
    double[] dataOut = dataSet.clone();
    TimeSeriesUtils.demeanInPlace(dataOut);
    return dataOut;
  }

  /**
   * In-place subtraction of mean from each point in an incoming data set.
   *
   * @param dataSet The data to have the mean removed from.
   */
  public static void demeanInPlace(double[] dataSet) {

    if (dataSet.length == 0) {
      return;
    }

    double mean = getMean(dataSet);

    for (int i = 0; i < dataSet.length; ++i) {
      dataSet[i] -= mean;
    }
  }

  /**
   * Return the calculation of the arithmetic mean (using a recursive definition for stability)
   *
   * @param dataSet Range of data to get the mean value from
   * @return the arithmetic mean, or NaN if there is no data
   */
  public static double getMean(double[] dataSet) {
    if (dataSet.length == 0) {
      return Double.NaN;
    }

    double mean = 0.0;
    double inc = 1;

    for (double data : dataSet) {
      mean = mean + ((data - mean) / inc);
      ++inc;
    }
    return mean;
  }

  /**
   * Check whether the samples of a time axis are (within tolerance) evenly spaced. The transform
   * takes its interval from the first two points only, so this is only used to flag suspicious
   * input.
   *
   * @param time Time axis, in seconds
   * @param relativeTolerance Allowed deviation of any interval from the first one, as a fraction
   * @return True if all intervals are within tolerance of the first
   */
  public static boolean isUniformlySampled(double[] time, double relativeTolerance) {
    if (time.length < 3) {
      return true;
    }
    double deltaT = time[1] - time[0];
    for (int i = 2; i < time.length; ++i) {
      double step = time[i] - time[i - 1];
      if (Math.abs(step - deltaT) > Math.abs(deltaT) * relativeTolerance) {
        return false;
      }
    }
    return true;
  }

  /**
   * Difference between the mean of the final fifth of the data and the mean of the slice from
   * 30% to 50% of the data. Used on step-response FID files where the acquisition switches level
   * halfway through.
   *
   * @param data Timeseries data
   * @return Mean level of the tail minus mean level of the middle slice
   */
  public static double levelShift(double[] data) {
    int length = data.length;
    double[] tail = slice(data, (int) (0.8 * length), length);
    double[] middle = slice(data, (int) (0.3 * length), (int) (0.5 * length));
    return getMean(tail) - getMean(middle);
  }

}
