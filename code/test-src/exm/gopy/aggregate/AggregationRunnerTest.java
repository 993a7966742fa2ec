package exm.gopy.aggregate;

import static org.junit.Assert.assertEquals;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.rules.TemporaryFolder;

public class AggregationRunnerTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Test
  public void testMatchesSequentialSummaries() throws Exception {
    List<File> files = new SampleGenerator(new Random(7))
                              .generate(tmp.getRoot(), 8);
    List<List<SymbolSummary>> expected = new ArrayList<List<SymbolSummary>>();
    for (File f: files) {
      expected.add(SymbolSummarizer.summarize(f));
    }

    AggregationRunner runner = new AggregationRunner(3);
    assertEquals(expected, runner.summarizeAll(files));
    assertEquals(MedianOfMedians.reduce(expected), runner.run(files));
  }

  @Test
  public void testWorkerCountDoesNotChangeResult() throws Exception {
    List<File> files = new SampleGenerator(new Random(11))
                              .generate(tmp.getRoot(), 5);
    assertEquals(new AggregationRunner(1).run(files),
                 new AggregationRunner(5).run(files));
  }

  @Test
  public void testFailureIsReported() throws Exception {
    File good = tmp.newFile("good.csv");
    FileUtils.writeStringToFile(good, "syml,value\nA,1\n",
                                StandardCharsets.UTF_8);
    File bad = tmp.newFile("bad.csv");
    FileUtils.writeStringToFile(bad, "syml,value\nA,oops\n",
                                StandardCharsets.UTF_8);
    exception.expect(IOException.class);
    exception.expectMessage("oops");
    new AggregationRunner(2).run(Arrays.asList(good, bad));
  }
}
