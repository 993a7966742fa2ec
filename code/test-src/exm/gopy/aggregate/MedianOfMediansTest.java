package exm.gopy.aggregate;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

public class MedianOfMediansTest {

  private static final double DELTA = 1e-9;

  private static List<SymbolSummary> file(double a, double b, double c,
                                          double d) {
    // std values are ignored by the reduction
    return Arrays.asList(new SymbolSummary("A", a, 99.0),
                         new SymbolSummary("B", b, 99.0),
                         new SymbolSummary("C", c, 99.0),
                         new SymbolSummary("D", d, 99.0));
  }

  @Test
  public void testReduceOverMedians() {
    List<List<SymbolSummary>> perFile = new ArrayList<List<SymbolSummary>>();
    perFile.add(file(1.0, 10.0, 5.0, 0.0));
    perFile.add(file(2.0, 20.0, 5.0, 0.0));
    perFile.add(file(6.0, 30.0, 5.0, 0.0));

    List<SymbolSummary> result = MedianOfMedians.reduce(perFile);
    assertEquals(4, result.size());

    SymbolSummary a = result.get(0);
    assertEquals("A", a.getSymbol());
    assertEquals(2.0, a.getMedian(), DELTA);
    assertEquals(Math.sqrt(14.0 / 3.0), a.getStd(), DELTA);

    SymbolSummary b = result.get(1);
    assertEquals("B", b.getSymbol());
    assertEquals(20.0, b.getMedian(), DELTA);

    SymbolSummary c = result.get(2);
    assertEquals(5.0, c.getMedian(), DELTA);
    assertEquals(0.0, c.getStd(), DELTA);
    assertEquals("D", result.get(3).getSymbol());
  }

  @Test
  public void testMissingSymbolGivesNaN() {
    List<List<SymbolSummary>> perFile = new ArrayList<List<SymbolSummary>>();
    perFile.add(file(1.0, 1.0, 1.0, Double.NaN));
    perFile.add(file(3.0, 1.0, 1.0, 4.0));

    List<SymbolSummary> result = MedianOfMedians.reduce(perFile);
    assertEquals(2.0, result.get(0).getMedian(), DELTA);
    assertTrue(Double.isNaN(result.get(3).getMedian()));
  }
}
