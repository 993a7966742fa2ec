package exm.gopy.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.gopy.ast.Assign;
import exm.gopy.ast.BinaryOp;
import exm.gopy.ast.Call;
import exm.gopy.ast.CallStatement;
import exm.gopy.ast.Expression;
import exm.gopy.ast.For;
import exm.gopy.ast.Function;
import exm.gopy.ast.If;
import exm.gopy.ast.Num;
import exm.gopy.ast.Return;
import exm.gopy.ast.Statement;
import exm.gopy.ast.Var;
import exm.gopy.common.exceptions.LexError;
import exm.gopy.common.exceptions.ParseError;
import exm.gopy.common.exceptions.UserException;

public class ParserTest {

  private static final String ADD =
      "func add(a int, b int) int {\n" +
      "  if a {\n" +
      "    return a + b\n" +
      "  } else {\n" +
      "    return b\n" +
      "  }\n" +
      "}\n";

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static Expression expr(String text) throws UserException {
    Parser parser = new Parser(new Lexer(text));
    return parser.parseExpr();
  }

  private static BinaryOp op(Expression l, String op, Expression r) {
    return new BinaryOp(l, op, r);
  }

  @Test
  public void testAdd() throws UserException {
    Function expected = new Function("add", Arrays.asList("a", "b"),
        Arrays.<Statement>asList(
          new If(new Var("a"),
              Arrays.<Statement>asList(new Return(
                  op(new Var("a"), BinaryOp.PLUS, new Var("b")))),
              Arrays.<Statement>asList(new Return(new Var("b"))))));
    assertEquals(expected, Parser.parse(ADD));
  }

  @Test
  public void testAstToString() throws UserException {
    Function fn = Parser.parse("func f(x) { if x { return 1 } }");
    assertEquals("Function(name=f, params=[x], body=[If(cond=Var(x), " +
        "then=[Return(Num(1))], otherwise=None)])", fn.toString());
  }

  @Test
  public void testNoParams() throws UserException {
    Function fn = Parser.parse("func zero() { return 0 }");
    assertEquals("zero", fn.getName());
    assertTrue(fn.getParams().isEmpty());
    assertEquals(Arrays.<Statement>asList(new Return(new Num(0))),
                 fn.getBody());
  }

  @Test
  public void testEmptyBody() throws UserException {
    Function fn = Parser.parse("func nothing() {}");
    assertTrue(fn.getBody().isEmpty());
  }

  @Test
  public void testParseFromTokenList() throws UserException {
    // No trailing EOF token: the parser supplies one
    Function fn = new Parser(Arrays.asList(
        new Token(TokenKind.FUNC, "func", new SourcePosition(0, 1, 1)),
        new Token(TokenKind.IDENT, "g", new SourcePosition(5, 1, 6)),
        new Token(TokenKind.LPAREN, "(", new SourcePosition(6, 1, 7)),
        new Token(TokenKind.RPAREN, ")", new SourcePosition(7, 1, 8)),
        new Token(TokenKind.LBRACE, "{", new SourcePosition(9, 1, 10)),
        new Token(TokenKind.RBRACE, "}", new SourcePosition(10, 1, 11))))
        .parseFunction();
    assertEquals(new Function("g", Collections.<String>emptyList(),
                              Collections.<Statement>emptyList()), fn);
  }

  @Test
  public void testIfWithoutElse() throws UserException {
    Function fn = Parser.parse("func f(x) { if x { x = 1 } }");
    If stmt = (If) fn.getBody().get(0);
    assertFalse(stmt.hasElse());
    assertNull(stmt.getElseBlock());
  }

  @Test
  public void testEmptyElseIsNotMissingElse() throws UserException {
    If withEmpty = (If) Parser.parse("func f(x) { if x { } else { } }")
                              .getBody().get(0);
    assertTrue(withEmpty.hasElse());
    assertTrue(withEmpty.getElseBlock().isEmpty());
  }

  @Test
  public void testElseIf() throws UserException {
    If outer = (If) Parser.parse(
        "func f(x, y) { if x { return 1 } else if y { return 2 } " +
        "else { return 3 } }").getBody().get(0);
    assertEquals(1, outer.getElseBlock().size());
    If inner = (If) outer.getElseBlock().get(0);
    assertEquals(new Var("y"), inner.getCondition());
    assertEquals(Arrays.<Statement>asList(new Return(new Num(3))),
                 inner.getElseBlock());
  }

  @Test
  public void testFor() throws UserException {
    Function fn = Parser.parse("func f(n) { for n { n = n - 1 } }");
    assertEquals(new For(new Var("n"), Arrays.<Statement>asList(
        new Assign("n", op(new Var("n"), BinaryOp.MINUS, new Num(1))))),
        fn.getBody().get(0));
  }

  @Test
  public void testBothAssignForms() throws UserException {
    Function fn = Parser.parse("func f() { x := 1 y = x }");
    assertEquals(Arrays.<Statement>asList(new Assign("x", new Num(1)),
                                          new Assign("y", new Var("x"))),
                 fn.getBody());
  }

  @Test
  public void testCalls() throws UserException {
    Function fn = Parser.parse("func f(a) { print(a, g()) return h(a) }");
    assertEquals(new CallStatement(new Call("print", Arrays.<Expression>asList(
                     new Var("a"),
                     new Call("g", Collections.<Expression>emptyList())))),
                 fn.getBody().get(0));
    assertEquals(new Return(new Call("h",
                     Arrays.<Expression>asList(new Var("a")))),
                 fn.getBody().get(1));
  }

  @Test
  public void testLeftAssociative() throws UserException {
    assertEquals(op(op(new Var("a"), BinaryOp.MINUS, new Var("b")),
                    BinaryOp.MINUS, new Var("c")),
                 expr("a - b - c"));
  }

  @Test
  public void testPrecedence() throws UserException {
    assertEquals(op(new Var("a"), BinaryOp.PLUS,
                    op(new Var("b"), BinaryOp.TIMES, new Var("c"))),
                 expr("a + b * c"));
    assertEquals(op(op(new Var("a"), BinaryOp.DIV, new Var("b")),
                    BinaryOp.MINUS, new Num(2)),
                 expr("a / b - 2"));
  }

  @Test
  public void testParentheses() throws UserException {
    assertEquals(op(op(new Var("a"), BinaryOp.PLUS, new Var("b")),
                    BinaryOp.TIMES, new Var("c")),
                 expr("(a + b) * c"));
  }

  @Test
  public void testMissingParam() throws LexError {
    try {
      Parser.parse("func f( { }");
      fail("Expected parse error");
    } catch (ParseError e) {
      assertEquals(EnumSet.of(TokenKind.IDENT), e.getExpected());
      assertEquals(TokenKind.LBRACE, e.getActual().getKind());
      assertEquals("1:9: Expected IDENT, got LBRACE({)", e.getMessage());
    } catch (UserException e) {
      fail("Wrong error: " + e);
    }
  }

  @Test
  public void testBadStatement() throws UserException {
    try {
      Parser.parse("func f() { + }");
      fail("Expected parse error");
    } catch (ParseError e) {
      assertEquals(EnumSet.of(TokenKind.RETURN, TokenKind.IF, TokenKind.FOR,
                              TokenKind.IDENT), e.getExpected());
      assertEquals(TokenKind.PLUS, e.getActual().getKind());
    }
  }

  @Test
  public void testUnterminatedBody() throws UserException {
    try {
      Parser.parse("func f() { return 1");
      fail("Expected parse error");
    } catch (ParseError e) {
      assertEquals(TokenKind.EOF, e.getActual().getKind());
    }
  }

  @Test
  public void testTrailingInput() throws UserException {
    exception.expect(ParseError.class);
    exception.expectMessage("Expected EOF");
    Parser.parse("func f() { } func g() { }");
  }

  @Test
  public void testIntegerOutOfRange() throws UserException {
    exception.expect(ParseError.class);
    exception.expectMessage("Integer literal out of range");
    Parser.parse("func f() { return 99999999999999999999 }");
  }

  @Test
  public void testLexErrorPropagates() throws UserException {
    exception.expect(LexError.class);
    Parser.parse("func f() { return 1 ; }");
  }
}
