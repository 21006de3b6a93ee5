package asl.resonance.input;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.log4j.Logger;

/**
 * Parses the metadata the acquisition software encodes into measurement file names: the coil
 * drive current, written as "Curr_&lt;digits&gt;_uA", and the time of acquisition, which is
 * taken from the last digit groups of the name.
 */
public class FilenameMetadata {

  private static final Logger logger = Logger.getLogger(FilenameMetadata.class);

  /**
   * Drive current in microamps: one or more optional minus signs, then 1 to 5 digits
   */
  public static final Pattern CURRENT_PATTERN = Pattern.compile("Curr_(-*)(\\d{1,5})_uA");

  private static final Pattern DIGITS = Pattern.compile("\\d+");

  // day, hour, minute, second are the 6th, 3rd, 2nd and last digit groups from the end
  private static final int TIMESTAMP_GROUPS = 6;

  private FilenameMetadata() {
  }

  /**
   * Find the drive current encoded in a file name. Repeated minus signs are read as a single
   * one.
   *
   * @param sourceId File name or path
   * @return The current in microamps if the name contains one
   */
  public static Optional<Double> findCurrent(String sourceId) {
    Matcher matcher = CURRENT_PATTERN.matcher(sourceId);
    if (!matcher.find()) {
      return Optional.empty();
    }
    double value = Double.parseDouble(matcher.group(2));
    if (!matcher.group(1).isEmpty()) {
      value = -value;
    }
    return Optional.of(value);
  }

  /**
   * Get the drive current encoded in a file name
   *
   * @param sourceId File name or path
   * @return The current in microamps
   * @throws MetadataNotFoundException if the name has no current
   */
  public static double parseCurrent(String sourceId) throws MetadataNotFoundException {
    Optional<Double> current = findCurrent(sourceId);
    if (!current.isPresent()) {
      throw new MetadataNotFoundException("No drive current (Curr_..._uA) in " + sourceId);
    }
    return current.get();
  }

  /**
   * Get the drive current encoded in a file name, or NaN (with a warning logged) if there is
   * none
   *
   * @param sourceId File name or path
   * @return The current in microamps, or NaN
   */
  public static double currentOrNaN(String sourceId) {
    try {
      return parseCurrent(sourceId);
    } catch (MetadataNotFoundException e) {
      logger.warn(e.getMessage() + "; drive current set to NaN");
      return Double.NaN;
    }
  }

  /**
   * Find the acquisition time encoded in a file name. Only the final component of a path is
   * examined.
   *
   * @param sourceId File name or path
   * @return Timestamp if the name has at least six groups of digits
   */
  public static Optional<Timestamp> findTimestamp(String sourceId) {
    String name = new File(sourceId).getName();
    List<Integer> groups = new ArrayList<>();
    Matcher matcher = DIGITS.matcher(name);
    while (matcher.find()) {
      try {
        groups.add(Integer.parseInt(matcher.group()));
      } catch (NumberFormatException e) {
        // too long to be part of a time
        logger.debug("Ignoring digit group " + matcher.group() + " in " + name);
        groups.add(-1);
      }
    }
    int size = groups.size();
    if (size < TIMESTAMP_GROUPS) {
      return Optional.empty();
    }
    int day = groups.get(size - 6);
    int hour = groups.get(size - 3);
    int minute = groups.get(size - 2);
    int second = groups.get(size - 1);
    if (day < 0 || hour < 0 || minute < 0 || second < 0) {
      return Optional.empty();
    }
    return Optional.of(new Timestamp(day, hour, minute, second));
  }

  /**
   * Get the acquisition time encoded in a file name
   *
   * @param sourceId File name or path
   * @return Timestamp of the file
   * @throws MetadataNotFoundException if the name does not encode a time
   */
  public static Timestamp parseTimestamp(String sourceId) throws MetadataNotFoundException {
    Optional<Timestamp> timestamp = findTimestamp(sourceId);
    if (!timestamp.isPresent()) {
      throw new MetadataNotFoundException("No acquisition time in " + sourceId);
    }
    return timestamp.get();
  }

  /**
   * Hours elapsed between two timestamps, with days counted as 24 hours. Days are days of the
   * month, so the start and the time must fall in the same month.
   *
   * @param time Later timestamp
   * @param start Earlier timestamp
   * @return Elapsed time in hours (negative if time is before start)
   */
  public static double hoursFromStart(Timestamp time, Timestamp start) {
    return (time.getDay() - start.getDay()) * 24.
        + (time.getHour() - start.getHour())
        + (time.getMinute() - start.getMinute()) / 60.
        + (time.getSecond() - start.getSecond()) / 3600.;
  }

  /**
   * Order files by ascending drive current. Files without a current go at the end, in their
   * original order.
   *
   * @param files Files to sort
   * @return New sorted list
   */
  public static List<File> sortByCurrent(List<File> files) {
    List<File> sorted = new ArrayList<>(files);
    Comparator<File> byCurrent = Comparator.comparingDouble(
        file -> findCurrent(file.getName()).orElse(Double.POSITIVE_INFINITY));
    // stable, so ties (including the files with no current) keep their order
    Collections.sort(sorted, byCurrent);
    return sorted;
  }

  /**
   * Time of acquisition to the second, within a month
   */
  public static class Timestamp {

    private final int day;
    private final int hour;
    private final int minute;
    private final int second;

    public Timestamp(int day, int hour, int minute, int second) {
      this.day = day;
      this.hour = hour;
      this.minute = minute;
      this.second = second;
    }

    public int getDay() {
      return day;
    }

    public int getHour() {
      return hour;
    }

    public int getMinute() {
      return minute;
    }

    public int getSecond() {
      return second;
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof Timestamp)) {
        return false;
      }
      Timestamp that = (Timestamp) other;
      return day == that.day && hour == that.hour && minute == that.minute
          && second == that.second;
    }

    @Override
    public int hashCode() {
      return ((day * 31 + hour) * 31 + minute) * 31 + second;
    }

    @Override
    public String toString() {
      return String.format("day %d, %02d:%02d:%02d", day, hour, minute, second);
    }
  }

  /**
   * Exception for file names missing a piece of expected metadata
   */
  public static class MetadataNotFoundException extends Exception {

    private static final long serialVersionUID = -2365483196057238712L;

    public MetadataNotFoundException(String message) {
      super(message);
    }
  }

}
