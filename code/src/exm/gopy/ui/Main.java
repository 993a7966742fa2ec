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

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.apache.log4j.Logger;

import exm.gopy.common.Logging;
import exm.gopy.common.Settings;
import exm.gopy.common.exceptions.GopyFatal;
import exm.gopy.common.exceptions.InvalidOptionException;
import exm.gopy.target.Backend;

/**
 * Command line interface to the translator.  Some options are passed
 * indirectly through Java properties.  See Settings.java for handling of
 * these options.
 */
public class Main {
  private static final String TARGET_FLAG = "t";
  private static final String AST_FLAG = "a";
  private static final String OUTPUT_FLAG = "o";
  private static final String HELP_FLAG = "h";

  /** Input name that means standard input */
  private static final String STDIN = "-";

  public static void main(String[] args) {
    int code = run(args, System.in, System.out, System.err);
    System.exit(code);
  }

  /**
   * Run translator as if from the command line
   * @return exit code
   */
  public static int run(String[] argv, InputStream in, PrintStream out,
                        PrintStream err) {
    Options opts = initOptions();
    Args args;
    try {
      args = processArgs(opts, argv);
    } catch (ParseException ex) {
      // Use Apache CLI-provided messages
      err.println(ex.getMessage());
      usage(opts, err);
      return ExitCode.ERROR_COMMAND.code();
    }
    if (args == null) {
      usage(opts, out);
      return ExitCode.SUCCESS.code();
    }

    Logger logger;
    Backend backend;
    int indentWidth;
    try {
      Settings.initGopyProperties();
      recordArgValues(args);
      logger = setupLogging();
      String target = args.target != null ? args.target
                                          : Settings.get(Settings.TARGET);
      backend = Backend.fromName(target);
      indentWidth = Settings.getInt(Settings.INDENT_WIDTH);
    } catch (InvalidOptionException ex) {
      err.println("Error setting up options: " + ex.getMessage());
      return ExitCode.ERROR_COMMAND.code();
    }

    String source;
    try {
      source = readInput(args.inputFilename, in);
    } catch (IOException ex) {
      err.println("Error reading input " + args.inputFilename + ": " +
                  ex.getMessage());
      return ExitCode.ERROR_IO.code();
    }

    // Buffer output so we don't create invalid output in case of
    // translation errors
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    GopyCompiler compiler = new GopyCompiler(logger, indentWidth, err);
    try {
      compiler.compile(args.inputFilename, source, backend, args.astOnly,
                       buffer);
    } catch (GopyFatal ex) {
      return ex.exitCode;
    }

    try {
      writeOutput(args.outputFilename, buffer.toByteArray(), out);
    } catch (IOException ex) {
      err.println("Error writing output " + args.outputFilename + ": " +
                  ex.getMessage());
      return ExitCode.ERROR_IO.code();
    }
    return ExitCode.SUCCESS.code();
  }

  private static Options initOptions() {
    Options opts = new Options();

    Option target = new Option(TARGET_FLAG, "target", true,
                               "Target language: python (default) or tcl");
    opts.addOption(target);

    opts.addOption(AST_FLAG, "ast", false,
                   "Print the parsed syntax tree instead of translating");

    Option output = new Option(OUTPUT_FLAG, "output", true,
                               "Output file (default: standard output)");
    opts.addOption(output);

    opts.addOption(HELP_FLAG, "help", false, "Print this message");
    return opts;
  }

  /**
   * @return null if only help was requested
   */
  private static Args processArgs(Options opts, String[] argv)
      throws ParseException {
    CommandLineParser parser = new DefaultParser();
    CommandLine cmd = parser.parse(opts, argv);

    if (cmd.hasOption(HELP_FLAG)) {
      return null;
    }

    String[] remainingArgs = cmd.getArgs();
    if (remainingArgs.length != 1) {
      throw new ParseException("Expected one input file (or - for stdin)," +
                        " but got " + remainingArgs.length + " arguments");
    }

    return new Args(remainingArgs[0], cmd.getOptionValue(OUTPUT_FLAG),
                    cmd.getOptionValue(TARGET_FLAG), cmd.hasOption(AST_FLAG));
  }

  /**
   * Store in properties for later logging
   */
  private static void recordArgValues(Args args) {
    Settings.set(Settings.INPUT_FILENAME, args.inputFilename);
    if (args.outputFilename != null) {
      Settings.set(Settings.OUTPUT_FILENAME, args.outputFilename);
    }
  }

  private static Logger setupLogging() throws InvalidOptionException {
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
    return Logging.setupLogging(logfile, trace);
  }

  private static void usage(Options opts, PrintStream stream) {
    HelpFormatter fmt = new HelpFormatter();
    PrintWriter pw = new PrintWriter(stream);
    fmt.printHelp(pw, HelpFormatter.DEFAULT_WIDTH, "gopy [options] <input>",
                  null, opts, HelpFormatter.DEFAULT_LEFT_PAD,
                  HelpFormatter.DEFAULT_DESC_PAD, null);
    pw.flush();
  }

  private static String readInput(String inputFilename, InputStream in)
      throws IOException {
    if (STDIN.equals(inputFilename)) {
      return IOUtils.toString(in, StandardCharsets.UTF_8);
    }
    File input = new File(inputFilename);
    if (!input.isFile() || !input.canRead()) {
      throw new IOException("Input file \"" + input + "\" is not readable");
    }
    return FileUtils.readFileToString(input, StandardCharsets.UTF_8);
  }

  private static void writeOutput(String outputFilename, byte[] bytes,
                                  PrintStream out) throws IOException {
    if (outputFilename == null) {
      out.write(bytes);
      out.flush();
    } else {
      FileUtils.writeByteArrayToFile(new File(outputFilename), bytes);
    }
  }

  private static class Args {
    public final String inputFilename;
    public final String outputFilename;
    public final String target;
    public final boolean astOnly;

    public Args(String inputFilename, String outputFilename, String target,
                boolean astOnly) {
      super();
      this.inputFilename = inputFilename;
      this.outputFilename = outputFilename;
      this.target = target;
      this.astOnly = astOnly;
    }
  }
}
