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

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.log4j.Logger;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

import exm.gopy.common.Logging;

/**
 * Per-symbol median and standard deviation of the values in one file
 */
public class SymbolSummarizer {

  private static final Logger logger = Logging.getGopyLogger();

  /**
   * @return one summary per symbol, in {@link Symbols#ALL} order.
   *         A symbol without rows gets NaN statistics.
   */
  public static List<SymbolSummary> summarize(File file) throws IOException {
    ListMultimap<String, Double> values = readValues(file);
    List<SymbolSummary> result =
        new ArrayList<SymbolSummary>(Symbols.ALL.size());
    for (String symbol: Symbols.ALL) {
      List<Double> vals = values.get(symbol);
      result.add(new SymbolSummary(symbol, Statistics.median(vals),
                                   Statistics.std(vals)));
    }
    return result;
  }

  static ListMultimap<String, Double> readValues(File file)
      throws IOException {
    CSVFormat format = CSVFormat.DEFAULT.builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .build();
    ListMultimap<String, Double> values = ArrayListMultimap.create();
    Reader reader = Files.newBufferedReader(file.toPath(),
                                            StandardCharsets.UTF_8);
    CSVParser parser = CSVParser.parse(reader, format);
    try {
      for (CSVRecord record: parser) {
        String symbol = record.get(Symbols.SYMBOL_COLUMN);
        String value = record.get(Symbols.VALUE_COLUMN);
        try {
          values.put(symbol, Double.parseDouble(value));
        } catch (NumberFormatException e) {
          throw new IOException(file + ":" + record.getRecordNumber() +
                                ": bad value '" + value + "'", e);
        }
      }
    } catch (IllegalArgumentException e) {
      // Missing column
      throw new IOException(file + ": " + e.getMessage(), e);
    } finally {
      parser.close();
    }
    logger.trace("read " + values.size() + " values from " + file);
    return values;
  }
}
