package exm.gopy.ui;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Arrays;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import exm.gopy.aggregate.SymbolSummary;

public class AggregateMainTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @Test
  public void testRun() throws IOException {
    ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    PrintStream out = new PrintStream(outBytes, true, "UTF-8");
    ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
    PrintStream err = new PrintStream(errBytes, true, "UTF-8");

    int code = AggregateMain.run(new String[] {"-n", "4", "-w", "2",
                   "-s", "3", "-d", tmp.getRoot().getPath()}, out, err);
    assertEquals(errBytes.toString("UTF-8"), 0, code);
    for (int i = 1; i <= 4; i++) {
      assertTrue(new File(tmp.getRoot(), "data" + i + ".csv").isFile());
    }
    String[] lines = outBytes.toString("UTF-8").split("\n");
    assertEquals(5, lines.length);
    assertTrue(lines[0].startsWith("syml"));
    assertTrue(lines[1].startsWith("A "));
    assertTrue(lines[4].startsWith("D "));
  }

  @Test
  public void testBadCount() throws IOException {
    PrintStream out = new PrintStream(new ByteArrayOutputStream(), true,
                                      "UTF-8");
    PrintStream err = new PrintStream(new ByteArrayOutputStream(), true,
                                      "UTF-8");
    assertEquals(ExitCode.ERROR_COMMAND.code(),
        AggregateMain.run(new String[] {"-n", "0", "-d",
                          tmp.getRoot().getPath()}, out, err));
    assertEquals(ExitCode.ERROR_COMMAND.code(),
        AggregateMain.run(new String[] {"-w", "many", "-d",
                          tmp.getRoot().getPath()}, out, err));
  }

  @Test
  public void testPrintTable() throws IOException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    AggregateMain.printTable(Arrays.asList(
        new SymbolSummary("A", 50.25, 1.5),
        new SymbolSummary("B", Double.NaN, Double.NaN)),
        new PrintStream(bytes, true, "UTF-8"));
    String nl = System.lineSeparator();
    assertEquals(
        "syml        median          std" + nl +
        "A        50.250000     1.500000" + nl +
        "B              NaN          NaN" + nl,
        bytes.toString("UTF-8"));
  }

  @Test
  public void testBadValueMessage() throws IOException {
    ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
    PrintStream err = new PrintStream(errBytes, true, "UTF-8");
    PrintStream out = new PrintStream(new ByteArrayOutputStream(), true,
                                      "UTF-8");
    assertEquals(ExitCode.ERROR_COMMAND.code(),
        AggregateMain.run(new String[] {"-s", "soon", "-d",
                          tmp.getRoot().getPath()}, out, err));
    assertTrue(errBytes.toString("UTF-8").contains(
        "Invalid integral value for option gopy.aggregate.seed: soon"));
  }
}
