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

package exm.gopy.ui;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;
import java.util.Random;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.log4j.Logger;

import exm.gopy.aggregate.AggregationRunner;
import exm.gopy.aggregate.SampleGenerator;
import exm.gopy.aggregate.SymbolSummary;
import exm.gopy.common.Logging;
import exm.gopy.common.Settings;
import exm.gopy.common.exceptions.InvalidOptionException;

/**
 * Generates sample data files, summarizes them in parallel and prints
 * the median-of-medians table.
 */
public class AggregateMain {
  private static final String COUNT_FLAG = "n";
  private static final String DIR_FLAG = "d";
  private static final String WORKERS_FLAG = "w";
  private static final String SEED_FLAG = "s";

  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  public static int run(String[] argv, PrintStream out, PrintStream err) {
    Options opts = new Options();
    opts.addOption(COUNT_FLAG, "count", true, "Number of data files");
    opts.addOption(DIR_FLAG, "dir", true,
                   "Directory for data files (default: current)");
    opts.addOption(WORKERS_FLAG, "workers", true, "Worker threads");
    opts.addOption(SEED_FLAG, "seed", true, "Random seed");

    int count;
    int workers;
    long seed;
    File dir;
    Logger logger;
    try {
      CommandLineParser parser = new DefaultParser();
      CommandLine cmd = parser.parse(opts, argv);
      Settings.initGopyProperties();
      logger = Logging.setupLogging(Settings.get(Settings.LOG_FILE),
                              Settings.getBoolean(Settings.LOG_TRACE));
      count = positive(Settings.AGGREGATE_FILES,
          cmd.getOptionValue(COUNT_FLAG, Settings.get(Settings.AGGREGATE_FILES)));
      workers = positive(Settings.AGGREGATE_WORKERS,
          cmd.getOptionValue(WORKERS_FLAG,
                             Settings.get(Settings.AGGREGATE_WORKERS)));
      seed = Settings.parseLong(Settings.AGGREGATE_SEED,
          cmd.getOptionValue(SEED_FLAG, Settings.get(Settings.AGGREGATE_SEED)));
      dir = new File(cmd.getOptionValue(DIR_FLAG, "."));
    } catch (ParseException ex) {
      err.println(ex.getMessage());
      PrintWriter pw = new PrintWriter(err);
      new HelpFormatter().printHelp(pw, HelpFormatter.DEFAULT_WIDTH,
          "gopy-aggregate", null, opts, HelpFormatter.DEFAULT_LEFT_PAD,
          HelpFormatter.DEFAULT_DESC_PAD, null);
      pw.flush();
      return ExitCode.ERROR_COMMAND.code();
    } catch (InvalidOptionException ex) {
      err.println("Error setting up options: " + ex.getMessage());
      return ExitCode.ERROR_COMMAND.code();
    }

    try {
      List<File> files = new SampleGenerator(new Random(seed))
                                .generate(dir, count);
      List<SymbolSummary> table = new AggregationRunner(workers).run(files);
      printTable(table, out);
      logger.debug("aggregation done");
      return ExitCode.SUCCESS.code();
    } catch (IOException ex) {
      err.println("I/O error: " + ex.getMessage());
      return ExitCode.ERROR_IO.code();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      err.println("Interrupted");
      return ExitCode.ERROR_INTERNAL.code();
    }
  }

  /**
   * Command line values override the settings but are not stored in them
   */
  private static int positive(String key, String value)
      throws InvalidOptionException {
    int val = Settings.parseInt(key, value);
    if (val < 1) {
      throw new InvalidOptionException(key + " must be positive, was " + val);
    }
    return val;
  }

  static void printTable(List<SymbolSummary> table, PrintStream out) {
    out.println(String.format(Locale.ROOT, "%-5s %12s %12s", "syml", "median", "std"));
    for (SymbolSummary s: table) {
      out.println(String.format(Locale.ROOT, "%-5s %12.6f %12.6f", s.getSymbol(),
                                s.getMedian(), s.getStd()));
    }
    out.flush();
  }
}
