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

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Date;

import org.apache.commons.io.IOUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.apache.commons.lang3.time.DateFormatUtils;
import org.apache.log4j.Logger;

import exm.gopy.ast.Function;
import exm.gopy.common.Settings;
import exm.gopy.common.exceptions.GopyFatal;
import exm.gopy.common.exceptions.LexError;
import exm.gopy.common.exceptions.ParseError;
import exm.gopy.common.exceptions.UserException;
import exm.gopy.frontend.Lexer;
import exm.gopy.frontend.Parser;
import exm.gopy.lower.Lowering;
import exm.gopy.target.Backend;
import exm.gopy.target.tree.FunctionDef;

/**
 * This is the main entry point to the translator
 */
public class GopyCompiler {

  private static final String TIMESTAMP_FORMAT = "yyyy/MM/dd HH:mm:ss";

  private final Logger logger;
  private final int indentWidth;
  private final PrintStream err;

  public GopyCompiler(Logger logger, int indentWidth) {
    this(logger, indentWidth, System.err);
  }

  public GopyCompiler(Logger logger, int indentWidth, PrintStream err) {
    this.logger = logger;
    this.indentWidth = indentWidth;
    this.err = err;
  }

  public Function parse(String source) throws UserException {
    return new Parser(new Lexer(source)).parseFunction();
  }

  /**
   * Run the whole pipeline: lex, parse, lower, render.
   * Either returns the complete output or throws; there is no partial
   * result.
   */
  public String translate(String source, Backend backend)
      throws UserException {
    Function function = parse(source);
    FunctionDef target = new Lowering(logger).lower(function);
    String text = backend.createRenderer(indentWidth).render(target);
    logger.debug("rendered " + function.getName() + " as " +
                 backend.getName());
    return text;
  }

  /**
   * Translate source and write the result to output.  Errors are reported
   * on the error stream and end in a GopyFatal carrying the exit code.
   * @param inputName name of input used in error messages
   * @param astOnly write the parsed AST instead of target code
   */
  public void compile(String inputName, String source, Backend backend,
                      boolean astOnly, OutputStream output) {
    try {
      logger.info("gopy starting: " + timestamp());
      logSettings();
      String text;
      if (astOnly) {
        text = parse(source).toString() + "\n";
      } else {
        text = translate(source, backend);
      }
      IOUtils.write(text, output, StandardCharsets.UTF_8);
      output.flush();
      logger.debug("gopy done: " + timestamp());
    }
    catch (GopyFatal e) {
      // Rethrow
      throw e;
    }
    catch (LexError e) {
      reportUserError(inputName, e);
      throw new GopyFatal(ExitCode.ERROR_PARSER.code());
    }
    catch (ParseError e) {
      reportUserError(inputName, e);
      throw new GopyFatal(ExitCode.ERROR_PARSER.code());
    }
    catch (UserException e) {
      reportUserError(inputName, e);
      throw new GopyFatal(ExitCode.ERROR_USER.code());
    }
    catch (IOException e) {
      err.println("I/O error while writing to output");
      err.println(e.getMessage());
      throw new GopyFatal(ExitCode.ERROR_IO.code());
    }
    catch (Throwable e) {
      reportInternalError(err, e);
      throw new GopyFatal(ExitCode.ERROR_INTERNAL.code());
    }
  }

  private void logSettings() {
    if (!logger.isDebugEnabled())
      return;
    logger.debug("Translator settings:");
    for (String key: Settings.getKeys()) {
      logger.debug(String.format("%-30s: %s", key, Settings.get(key)));
    }
  }

  private void reportUserError(String inputName, UserException e) {
    err.println("gopy error:");
    // Positioned messages already start with line:column:
    String sep = e.getPosition() != null ? ":" : ": ";
    err.println(inputName + sep + e.getMessage());
    if (logger.isDebugEnabled())
      logger.debug(ExceptionUtils.getStackTrace(e));
  }

  public static void reportInternalError(PrintStream err, Throwable e) {
    err.println("GOPY INTERNAL ERROR");
    err.println("Please report this");
    e.printStackTrace(err);
  }

  private static String timestamp() {
    return DateFormatUtils.format(new Date(), TIMESTAMP_FORMAT);
  }
}
