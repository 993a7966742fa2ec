/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.gopy.aggregate;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

/**
 * Combines per-file summaries: for each symbol, the median and standard
 * deviation of that symbol's per-file medians.  Raw values are never
 * revisited.
 */
public class MedianOfMedians {

  public static List<SymbolSummary> reduce(
                        List<List<SymbolSummary>> perFile) {
    ListMultimap<String, Double> medians = ArrayListMultimap.create();
    for (List<SymbolSummary> fileSummary: perFile) {
      for (SymbolSummary s: fileSummary) {
        medians.put(s.getSymbol(), s.getMedian());
      }
    }

    List<SymbolSummary> result =
        new ArrayList<SymbolSummary>(Symbols.ALL.size());
    for (String symbol: Symbols.ALL) {
      List<Double> vals = medians.get(symbol);
      result.add(new SymbolSummary(symbol, Statistics.median(vals),
                                   Statistics.std(vals)));
    }
    return result;
  }
}
