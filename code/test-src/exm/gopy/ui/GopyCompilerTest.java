package exm.gopy.ui;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.io.StringWriter;
import java.io.UnsupportedEncodingException;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;
import org.apache.log4j.WriterAppender;
import org.junit.Before;
import org.junit.Test;

import exm.gopy.common.Logging;
import exm.gopy.common.Settings;
import exm.gopy.common.exceptions.GopyFatal;
import exm.gopy.common.exceptions.UserException;
import exm.gopy.target.Backend;

public class GopyCompilerTest {

  private ByteArrayOutputStream errBytes;
  private GopyCompiler compiler;

  @Before
  public void setUp() throws UnsupportedEncodingException {
    errBytes = new ByteArrayOutputStream();
    compiler = new GopyCompiler(Logging.getGopyLogger(), 4,
                                new PrintStream(errBytes, true, "UTF-8"));
  }

  private String errText() throws UnsupportedEncodingException {
    return errBytes.toString("UTF-8");
  }

  private int compileExpectingFailure(String source) {
    try {
      compiler.compile("test.go", source, Backend.PYTHON, false,
                       new ByteArrayOutputStream());
      fail("Expected failure");
      return -1;
    } catch (GopyFatal e) {
      return e.exitCode;
    }
  }

  @Test
  public void testTranslate() throws UserException {
    assertEquals("def id(x):\n    return x\n",
        compiler.translate("func id(x int) int { return x }", Backend.PYTHON));
    assertEquals("proc id { x } {\n    return $x\n}\n",
        compiler.translate("func id(x int) int { return x }", Backend.TCL));
  }

  @Test
  public void testCompileWritesOutput() throws UnsupportedEncodingException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    compiler.compile("test.go", "func f() { return 1 }", Backend.PYTHON,
                     false, out);
    assertEquals("def f():\n    return 1\n", out.toString("UTF-8"));
    assertEquals("", errText());
  }

  @Test
  public void testAstOnly() throws UnsupportedEncodingException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    compiler.compile("test.go", "func f() { return 1 }", Backend.PYTHON,
                     true, out);
    assertEquals("Function(name=f, params=[], body=[Return(Num(1))])\n",
                 out.toString("UTF-8"));
  }

  @Test
  public void testParseErrorExitCode() throws UnsupportedEncodingException {
    assertEquals(ExitCode.ERROR_PARSER.code(),
                 compileExpectingFailure("func f( { }"));
    String err = errText();
    assertTrue(err, err.startsWith("gopy error:"));
    assertTrue(err, err.contains("test.go:1:9: Expected IDENT, got LBRACE({)"));
  }

  @Test
  public void testLexErrorExitCode() {
    assertEquals(ExitCode.ERROR_PARSER.code(),
                 compileExpectingFailure("func f() { return 1 ? 2 }"));
  }

  @Test
  public void testWriteFailure() throws UnsupportedEncodingException {
    OutputStream broken = new OutputStream() {
      @Override
      public void write(int b) throws IOException {
        throw new IOException("disk full");
      }
    };
    try {
      compiler.compile("test.go", "func f() {}", Backend.PYTHON, false,
                       broken);
      fail("Expected failure");
    } catch (GopyFatal e) {
      assertEquals(ExitCode.ERROR_IO.code(), e.exitCode);
    }
    assertTrue(errText().contains("disk full"));
  }

  @Test
  public void testNoPartialOutput() {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try {
      compiler.compile("test.go", "func f() { return 1 } trailing",
                       Backend.PYTHON, false, out);
      fail("Expected failure");
    } catch (GopyFatal e) {
      assertEquals(ExitCode.ERROR_PARSER.code(), e.exitCode);
    }
    assertEquals(0, out.size());
  }

  @Test
  public void testSettingsLoggedAtDebug() {
    StringWriter log = new StringWriter();
    Logger logger = Logger.getLogger("exm.gopy.test.compiler");
    logger.setLevel(Level.DEBUG);
    logger.setAdditivity(false);
    WriterAppender appender =
        new WriterAppender(new PatternLayout("%m%n"), log);
    logger.addAppender(appender);
    try {
      Settings.set(Settings.INPUT_FILENAME, "settings-input.go");
      new GopyCompiler(logger, 4, new PrintStream(errBytes))
          .compile("settings-input.go", "func f() {}", Backend.PYTHON,
                   false, new ByteArrayOutputStream());
    } finally {
      logger.removeAppender(appender);
      Settings.set(Settings.INPUT_FILENAME, "");
    }
    String text = log.toString();
    assertTrue(text, text.contains("Translator settings:"));
    assertTrue(text, text.contains(String.format("%-30s: %s",
        Settings.INPUT_FILENAME, "settings-input.go")));
    assertTrue(text, text.contains(Settings.INDENT_WIDTH));
  }
}
