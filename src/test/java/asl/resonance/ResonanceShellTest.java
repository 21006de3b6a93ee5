package asl.resonance;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import asl.resonance.fit.LorentzianModel;
import asl.resonance.test.TestUtils;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import org.apache.commons.math3.complex.Complex;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class ResonanceShellTest {

  @Rule
  public TemporaryFolder tempFolder = new TemporaryFolder();

  private File directory;
  private String configPath;
  private ByteArrayOutputStream buffer;
  private PrintStream out;

  @Before
  public void setUp() throws IOException {
    directory = tempFolder.newFolder("data");
    double[] freqs = TestUtils.linspace(4.0, 6.0, 101);
    Complex[] signal = LorentzianModel.complexLorentz(freqs, 5.0, 80.0, 0.15, 0.1);
    TestUtils.writeSpectrumFile(new File(directory, "run_Curr_10_uA.dat"), freqs, signal);

    File config = tempFolder.newFile("config.xml");
    try (PrintWriter writer = new PrintWriter(config, "UTF-8")) {
      writer.println("<Configuration><Batch><Threads>1</Threads></Batch></Configuration>");
    }
    configPath = config.getAbsolutePath();

    buffer = new ByteArrayOutputStream();
    out = new PrintStream(buffer, true);
  }

  @Test
  public void run_printsOneLinePerFile() {
    ResonanceShell shell = new ResonanceShell();
    int status = shell.run(new String[]{directory.getPath(), "--config", configPath}, out);
    assertEquals(0, status);
    assertEquals(1, shell.getResult().getSuccesses().size());
    String printed = buffer.toString();
    assertTrue(printed, printed.contains("run_Curr_10_uA.dat\t10\t5\t"));
  }

  @Test
  public void run_backgroundOption() {
    ResonanceShell shell = new ResonanceShell();
    int status = shell.run(new String[]{directory.getPath(), "--background", "--threads", "2",
        "--config", configPath}, out);
    assertEquals(0, status);
    assertEquals(8, shell.getResult().getSuccesses().get(0).getFitResult().getParameters().length);
  }

  @Test
  public void run_badArguments() {
    ResonanceShell shell = new ResonanceShell();
    assertEquals(2, shell.run(new String[]{directory.getPath(), "--threads", "zero"}, out));
    assertEquals(2, shell.run(new String[]{directory.getPath(), "--threads"}, out));
    assertEquals(2, shell.run(new String[]{directory.getPath(), "--bogus"}, out));
    assertEquals(2, shell.run(new String[]{directory.getPath(), "--decay", "--background"}, out));
    assertTrue(buffer.toString().contains(ResonanceShell.USAGE));
  }

  @Test
  public void run_missingDirectory() {
    ResonanceShell shell = new ResonanceShell();
    int status = shell.run(new String[]{new File(directory, "absent").getPath(), "--config",
        configPath}, out);
    assertEquals(1, status);
  }

}
