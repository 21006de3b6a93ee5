package asl.resonance.input;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import asl.resonance.input.FilenameMetadata.MetadataNotFoundException;
import asl.resonance.input.FilenameMetadata.Timestamp;
import java.io.File;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.junit.Test;

public class FilenameMetadataTest {

  @Test
  public void findCurrent_readsMicroamps() {
    assertEquals(Optional.of(150.), FilenameMetadata.findCurrent("data/run_Curr_150_uA.dat"));
    assertEquals(Optional.of(-42.), FilenameMetadata.findCurrent("run_Curr_-42_uA_2.dat"));
    assertEquals(Optional.of(12345.), FilenameMetadata.findCurrent("Curr_12345_uA.dat"));
  }

  @Test
  public void findCurrent_repeatedMinusIsNegative() {
    assertEquals(Optional.of(-7.), FilenameMetadata.findCurrent("x_Curr_--7_uA.dat"));
  }

  @Test
  public void findCurrent_absentOrMalformed_isEmpty() {
    assertFalse(FilenameMetadata.findCurrent("run_without_current.dat").isPresent());
    assertFalse(FilenameMetadata.findCurrent("Curr_123456_uA.dat").isPresent());
    assertFalse(FilenameMetadata.findCurrent("Curr__uA.dat").isPresent());
  }

  @Test(expected = MetadataNotFoundException.class)
  public void parseCurrent_absent_throws() throws MetadataNotFoundException {
    FilenameMetadata.parseCurrent("run_without_current.dat");
  }

  @Test
  public void currentOrNaN_absent_isNaN() {
    assertTrue(Double.isNaN(FilenameMetadata.currentOrNaN("run_without_current.dat")));
    assertEquals(80., FilenameMetadata.currentOrNaN("Curr_80_uA.dat"), 0.);
  }

  @Test
  public void findTimestamp_usesTrailingDigitGroups() throws MetadataNotFoundException {
    Timestamp timestamp = FilenameMetadata.parseTimestamp(
        "/lab/2019/FID_24_06_2019_14_05_33.dat");
    assertEquals(new Timestamp(24, 14, 5, 33), timestamp);
  }

  @Test
  public void findTimestamp_tooFewGroups_isEmpty() {
    assertFalse(FilenameMetadata.findTimestamp("FID_14_05_33.dat").isPresent());
  }

  @Test
  public void hoursFromStart_weightsComponents() {
    Timestamp start = new Timestamp(23, 18, 0, 0);
    Timestamp time = new Timestamp(24, 19, 30, 36);
    assertEquals(24. + 1. + 0.5 + 0.01, FilenameMetadata.hoursFromStart(time, start), 1E-12);
    assertEquals(0., FilenameMetadata.hoursFromStart(start, start), 0.);
  }

  @Test
  public void sortByCurrent_missingCurrentsLast() {
    List<File> files = Arrays.asList(new File("c_Curr_300_uA.dat"), new File("nothing.dat"),
        new File("a_Curr_-5_uA.dat"), new File("b_Curr_20_uA.dat"));
    List<File> sorted = FilenameMetadata.sortByCurrent(files);
    assertEquals("a_Curr_-5_uA.dat", sorted.get(0).getName());
    assertEquals("b_Curr_20_uA.dat", sorted.get(1).getName());
    assertEquals("c_Curr_300_uA.dat", sorted.get(2).getName());
    assertEquals("nothing.dat", sorted.get(3).getName());
  }

}
