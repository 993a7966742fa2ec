package exm.gopy.aggregate;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.rules.TemporaryFolder;

import com.google.common.collect.ListMultimap;

public class SymbolSummarizerTest {

  private static final double DELTA = 1e-9;

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private File csv(String text) throws IOException {
    File f = tmp.newFile();
    FileUtils.writeStringToFile(f, text, StandardCharsets.UTF_8);
    return f;
  }

  @Test
  public void testSummarize() throws IOException {
    File f = csv("syml,value\n" +
                 "A,1.0\n" +
                 "B,10\n" +
                 "A,3.0\n" +
                 "C,7.5\n" +
                 "A,2.0\n" +
                 "B,20\n");
    List<SymbolSummary> result = SymbolSummarizer.summarize(f);
    assertEquals(4, result.size());

    assertEquals(new SymbolSummary("A", 2.0, Math.sqrt(2.0 / 3.0)),
                 result.get(0));
    assertEquals(15.0, result.get(1).getMedian(), DELTA);
    assertEquals(5.0, result.get(1).getStd(), DELTA);
    assertEquals(7.5, result.get(2).getMedian(), DELTA);
    assertEquals(0.0, result.get(2).getStd(), DELTA);

    // No rows for D
    assertEquals("D", result.get(3).getSymbol());
    assertTrue(Double.isNaN(result.get(3).getMedian()));
    assertTrue(Double.isNaN(result.get(3).getStd()));
  }

  @Test
  public void testColumnOrderDoesNotMatter() throws IOException {
    ListMultimap<String, Double> values =
        SymbolSummarizer.readValues(csv("value,syml\n4.5,B\n0.5,B\n"));
    assertEquals(Arrays.asList(4.5, 0.5), values.get("B"));
    assertTrue(values.get("A").isEmpty());
  }

  @Test
  public void testBadValue() throws IOException {
    exception.expect(IOException.class);
    exception.expectMessage("bad value 'abc'");
    SymbolSummarizer.summarize(csv("syml,value\nA,abc\n"));
  }

  @Test
  public void testMissingColumn() throws IOException {
    exception.expect(IOException.class);
    SymbolSummarizer.summarize(csv("syml,price\nA,1\n"));
  }
}
