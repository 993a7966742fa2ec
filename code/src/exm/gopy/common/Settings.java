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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.gopy.common.exceptions.InvalidOptionException;

/**
 * General translator settings.  Each key can be overridden by a Java
 * system property of the same name, e.g. -Dgopy.indent-width=2
 * */
public class Settings
{
  /** Backend used when the command line does not pick one */
  public static final String TARGET = "gopy.target";
  public static final String INDENT_WIDTH = "gopy.indent-width";

  public static final String INPUT_FILENAME = "gopy.input_filename";
  public static final String OUTPUT_FILENAME = "gopy.output_filename";

  public static final String LOG_FILE = "gopy.log.file";
  public static final String LOG_TRACE = "gopy.log.trace";

  public static final String AGGREGATE_WORKERS = "gopy.aggregate.workers";
  public static final String AGGREGATE_FILES = "gopy.aggregate.files";
  public static final String AGGREGATE_SEED = "gopy.aggregate.seed";

  private static final String[] TARGETS = {"python", "tcl"};

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    // Set defaults here
    defaults.setProperty(TARGET, "python");
    defaults.setProperty(INDENT_WIDTH, "4");
    defaults.setProperty(INPUT_FILENAME, "");
    defaults.setProperty(OUTPUT_FILENAME, "");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    defaults.setProperty(AGGREGATE_WORKERS, "5");
    defaults.setProperty(AGGREGATE_FILES, "5");
    defaults.setProperty(AGGREGATE_SEED, "0");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initGopyProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  public static String get(String key) {
    return properties.getProperty(key);
  }

  public static List<String> getKeys() {
    List<String> keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private static void validateProperties() throws InvalidOptionException {
    getStringChoice(TARGET, TARGETS);
    getBoolean(LOG_TRACE);
    if (getInt(INDENT_WIDTH) < 1) {
      throw new InvalidOptionException(INDENT_WIDTH + " must be positive");
    }
    if (getInt(AGGREGATE_WORKERS) < 1) {
      throw new InvalidOptionException(AGGREGATE_WORKERS + " must be positive");
    }
    if (getInt(AGGREGATE_FILES) < 1) {
      throw new InvalidOptionException(AGGREGATE_FILES + " must be positive");
    }
    getLong(AGGREGATE_SEED);
  }

  public static String getStringChoice(String key, String[] choices)
      throws InvalidOptionException {
    String val = properties.getProperty(key);
    for (String choice: choices) {
      if (choice.equals(val)) {
        return val;
      }
    }
    StringBuilder sb = new StringBuilder();
    for (String choice: choices) {
      if (sb.length() > 0) {
        sb.append(", ");
      }
      sb.append("'");
      sb.append(choice);
      sb.append("'");
    }
    throw new InvalidOptionException("Expected property " + key +
        " to be one of: " + sb.toString() + " but was '" + val + "'");
  }

  public static long getLong(String key) throws InvalidOptionException {
    return parseLong(key, properties.getProperty(key));
  }

  public static int getInt(String key) throws InvalidOptionException {
    return parseInt(key, properties.getProperty(key));
  }

  /**
   * Parse a value given for option key, e.g. from the command line
   */
  public static long parseLong(String key, String strVal)
      throws InvalidOptionException {
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Long.parseLong(strVal);
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
      key + ": " + strVal);
    }
  }

  public static int parseInt(String key, String strVal)
      throws InvalidOptionException {
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Integer.parseInt(strVal);
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
      key + ": " + strVal);
    }
  }

  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

    String lStrVal = strVal.toLowerCase();
    if (lStrVal.equals("true")) {
      return true;
    } else if (lStrVal.equals("false")) {
      return false;
    } else {
      throw new InvalidOptionException(
          "option string for " + key + " must be true or false, but was '" +
              strVal + "'");
    }
  }
}
