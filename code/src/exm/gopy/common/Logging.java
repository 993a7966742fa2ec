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

package exm.gopy.common;

import java.io.IOException;

import org.apache.log4j.Appender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.gopy.common.exceptions.InvalidOptionException;

public class Logging
{
  private static final String GOPY_LOGGER_NAME = "exm.gopy";

  private static final String LOG_PATTERN = "%-5p %c{1} - %m%n";

  /** Name of the file appender added by setupLogging */
  private static final String FILE_APPENDER_NAME = "gopy-logfile";

  public static Logger getGopyLogger()
  {
    return Logger.getLogger(GOPY_LOGGER_NAME);
  }

  /**
   * Send translator log output to logfile.  With no logfile, only warnings
   * and above reach whatever appenders log4j.properties configured.
   * @param logfile empty or null to disable file logging
   * @param trace log at TRACE level instead of DEBUG
   * @return the project logger
   */
  public static Logger setupLogging(String logfile, boolean trace)
                    throws InvalidOptionException
  {
    Logger gopyLogger = getGopyLogger();
    // Each run logs only to its own file
    removeFileAppender(gopyLogger);
    if (logfile == null || logfile.length() == 0) {
      // Even if logging is disabled, this must be valid:
      gopyLogger.setLevel(Level.WARN);
      return gopyLogger;
    }

    Layout layout = new PatternLayout(LOG_PATTERN);
    try {
      FileAppender appender = new FileAppender(layout, logfile, false);
      appender.setName(FILE_APPENDER_NAME);
      gopyLogger.addAppender(appender);
    } catch (IOException e) {
      throw new InvalidOptionException("Could not open log file " +
                                       logfile + ": " + e.getMessage());
    }
    gopyLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    return gopyLogger;
  }

  private static void removeFileAppender(Logger gopyLogger)
  {
    Appender old = gopyLogger.getAppender(FILE_APPENDER_NAME);
    if (old != null) {
      gopyLogger.removeAppender(old);
      old.close();
    }
  }
}
