package exm.gopy.pybackend;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import exm.gopy.common.exceptions.GopyRuntimeError;
import exm.gopy.common.exceptions.UserException;
import exm.gopy.frontend.Parser;
import exm.gopy.lower.Lowering;
import exm.gopy.target.tree.BinOperator;
import exm.gopy.target.tree.BinaryExpr;
import exm.gopy.target.tree.FunctionDef;
import exm.gopy.target.tree.IfStatement;
import exm.gopy.target.tree.LiteralInt;
import exm.gopy.target.tree.Name;
import exm.gopy.target.tree.ReturnStatement;
import exm.gopy.target.tree.Sequence;
import exm.gopy.target.tree.TargetTree;

public class PythonRendererTest {

  private static String translate(String source) throws UserException {
    FunctionDef fn = new Lowering().lower(Parser.parse(source));
    return new PythonRenderer(4).render(fn);
  }

  private static Sequence seq(TargetTree... members) {
    return new Sequence(Arrays.asList(members));
  }

  @Test
  public void testAdd() throws UserException {
    assertEquals(
        "def add(a, b):\n" +
        "    if a:\n" +
        "        return a + b\n" +
        "    else:\n" +
        "        return b\n",
        translate("func add(a int, b int) int {\n" +
                  "  if a {\n" +
                  "    return a + b\n" +
                  "  } else {\n" +
                  "    return b\n" +
                  "  }\n" +
                  "}\n"));
  }

  @Test
  public void testEmptyBodyIsPass() throws UserException {
    assertEquals("def f():\n    pass\n", translate("func f() {}"));
  }

  @Test
  public void testMissingAndEmptyElseRenderAlike() throws UserException {
    String expected = "def f(x):\n    if x:\n        return 1\n";
    assertEquals(expected, translate("func f(x) { if x { return 1 } }"));
    assertEquals(expected,
                 translate("func f(x) { if x { return 1 } else { } }"));
  }

  @Test
  public void testElif() throws UserException {
    assertEquals(
        "def sign(x, y):\n" +
        "    if x:\n" +
        "        return 1\n" +
        "    elif y:\n" +
        "        return 2\n" +
        "    else:\n" +
        "        return 3\n",
        translate("func sign(x, y) { if x { return 1 } else if y { " +
                  "return 2 } else { return 3 } }"));
  }

  @Test
  public void testWhileAndAssign() throws UserException {
    assertEquals(
        "def countdown(n):\n" +
        "    total = 0\n" +
        "    while n:\n" +
        "        total = total + n * 2\n" +
        "        n = n - 1\n" +
        "    log(total)\n" +
        "    return total / (n + 1)\n",
        translate("func countdown(n int) int { total := 0 for n { " +
                  "total = total + n * 2 n = n - 1 } log(total) " +
                  "return total / (n + 1) }"));
  }

  @Test
  public void testParenthesesFollowTree() throws UserException {
    assertEquals("def f(a, b, c):\n    return (a + b) * c\n",
                 translate("func f(a, b, c) { return (a + b) * c }"));
    assertEquals("def f(a, b, c):\n    return a - (b - c)\n",
                 translate("func f(a, b, c) { return a - (b - c) }"));
    assertEquals("def f(a, b, c):\n    return a - b - c\n",
                 translate("func f(a, b, c) { return (a - b) - c }"));
    assertEquals("def f(a, b, c):\n    return a + b * c\n",
                 translate("func f(a, b, c) { return a + (b * c) }"));
  }

  @Test
  public void testCallArguments() throws UserException {
    assertEquals("def f(a):\n    return g(a, h(), 1 + a)\n",
                 translate("func f(a) { return g(a, h(), 1 + a) }"));
  }

  @Test
  public void testIndentWidth() throws UserException {
    FunctionDef fn = new Lowering().lower(
        Parser.parse("func f(x) { if x { return x } }"));
    assertEquals("def f(x):\n  if x:\n    return x\n",
                 new PythonRenderer(2).render(fn));
  }

  @Test
  public void testRenderIsRepeatable() {
    FunctionDef fn = new FunctionDef("f", Collections.<String>emptyList(),
        seq(new ReturnStatement(new LiteralInt(7))));
    PythonRenderer renderer = new PythonRenderer(4);
    assertEquals(renderer.render(fn), renderer.render(fn));
  }

  @Test
  public void testElseWithSeveralStatementsIsNotElif() {
    IfStatement nested = new IfStatement(Name.load("y"),
        seq(new ReturnStatement(new LiteralInt(2))), Sequence.empty());
    IfStatement outer = new IfStatement(Name.load("x"),
        seq(new ReturnStatement(new LiteralInt(1))),
        seq(nested, new ReturnStatement(new LiteralInt(3))));
    FunctionDef fn = new FunctionDef("f", Arrays.asList("x", "y"),
                                     seq(outer));
    assertEquals(
        "def f(x, y):\n" +
        "    if x:\n" +
        "        return 1\n" +
        "    else:\n" +
        "        if y:\n" +
        "            return 2\n" +
        "        return 3\n",
        new PythonRenderer(4).render(fn));
  }

  @Test
  public void testOperatorSymbols() {
    assertEquals("+", PythonRenderer.operatorSymbol(BinOperator.ADD));
    assertEquals("/", PythonRenderer.operatorSymbol(BinOperator.DIV));
    BinaryExpr e = new BinaryExpr(new LiteralInt(6), BinOperator.DIV,
        new BinaryExpr(new LiteralInt(3), BinOperator.MULT, new LiteralInt(2)));
    assertEquals("6 / (3 * 2)", new PythonRenderer(4).render(e));
  }

  @Test(expected=GopyRuntimeError.class)
  public void testStoreNameRejectedAsValue() {
    new PythonRenderer(4).render(new ReturnStatement(Name.store("x")));
  }
}
