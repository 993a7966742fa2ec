package exm.gopy.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import exm.gopy.common.exceptions.InvalidOptionException;

public class LoggingTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @After
  public void resetLogging() throws InvalidOptionException {
    Logging.setupLogging(null, false);
  }

  private static String read(File f) throws IOException {
    return FileUtils.readFileToString(f, StandardCharsets.UTF_8);
  }

  @Test
  public void testSecondLogFileReplacesFirst()
      throws IOException, InvalidOptionException {
    File first = new File(tmp.getRoot(), "first.log");
    File second = new File(tmp.getRoot(), "second.log");

    Logging.setupLogging(first.getPath(), false).debug("only-first");
    Logger logger = Logging.setupLogging(second.getPath(), false);
    logger.debug("only-second");

    assertTrue(read(first).contains("only-first"));
    assertFalse("Old log file still attached",
                read(first).contains("only-second"));
    assertTrue(read(second).contains("only-second"));
  }

  @Test
  public void testNoLogFileDetachesPrevious()
      throws IOException, InvalidOptionException {
    File first = new File(tmp.getRoot(), "first.log");
    Logging.setupLogging(first.getPath(), true);
    Logger logger = Logging.setupLogging("", false);
    assertEquals(Level.WARN, logger.getLevel());
    logger.warn("after-reset");
    assertFalse(read(first).contains("after-reset"));
  }

  @Test
  public void testTraceLevel() throws InvalidOptionException {
    File log = new File(tmp.getRoot(), "trace.log");
    assertEquals(Level.TRACE,
                 Logging.setupLogging(log.getPath(), true).getLevel());
    assertEquals(Level.DEBUG,
                 Logging.setupLogging(log.getPath(), false).getLevel());
  }
}
