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
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.log4j.Logger;

import exm.gopy.common.Logging;

/**
 * Writes files of random sample data: data1.csv, data2.csv, ...
 * each holding rows of a random symbol and a value in [0, 100).
 */
public class SampleGenerator {

  public static final int ROWS_PER_FILE = 100;
  public static final double MAX_VALUE = 100.0;

  private static final Logger logger = Logging.getGopyLogger();

  private final Random random;

  public SampleGenerator(Random random) {
    this.random = random;
  }

  public static String fileName(int index) {
    return "data" + index + ".csv";
  }

  /**
   * @param dir existing directory to write into
   * @param count number of files
   * @return the files written, in order
   */
  public List<File> generate(File dir, int count) throws IOException {
    List<File> files = new ArrayList<File>(count);
    for (int i = 1; i <= count; i++) {
      File file = new File(dir, fileName(i));
      writeFile(file);
      files.add(file);
    }
    logger.debug("generated " + count + " sample files in " + dir);
    return files;
  }

  private void writeFile(File file) throws IOException {
    CSVFormat format = CSVFormat.DEFAULT.builder()
        .setHeader(Symbols.SYMBOL_COLUMN, Symbols.VALUE_COLUMN)
        .build();
    Writer writer = Files.newBufferedWriter(file.toPath(),
                                            StandardCharsets.UTF_8);
    CSVPrinter printer = new CSVPrinter(writer, format);
    try {
      for (int row = 0; row < ROWS_PER_FILE; row++) {
        String symbol = Symbols.ALL.get(random.nextInt(Symbols.ALL.size()));
        double value = random.nextDouble() * MAX_VALUE;
        printer.printRecord(symbol, value);
      }
    } finally {
      printer.close();
    }
  }
}
