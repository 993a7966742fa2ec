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
package exm.gopy.frontend;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;

import org.apache.log4j.Logger;

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
import exm.gopy.common.Logging;
import exm.gopy.common.exceptions.LexError;
import exm.gopy.common.exceptions.ParseError;
import exm.gopy.common.exceptions.UserException;

/**
 * Recursive descent parser with one token of lookahead.
 *
 * Grammar:
 * <pre>
 * function  := 'func' IDENT '(' [ param { ',' param } ] ')' [ 'int' ]
 *              '{' block '}' EOF
 * param     := IDENT [ 'int' ]
 * block     := { statement }
 * statement := 'return' expr
 *            | 'if' expr '{' block '}' [ 'else' ( '{' block '}' | if ) ]
 *            | 'for' expr '{' block '}'
 *            | IDENT ( '=' | ':=' ) expr
 *            | IDENT '(' args ')'
 * expr      := product { ( '+' | '-' ) product }
 * product   := term { ( '*' | '/' ) term }
 * term      := NUMBER | IDENT [ '(' args ')' ] | '(' expr ')'
 * args      := [ expr { ',' expr } ]
 * </pre>
 *
 * The first unexpected token aborts the parse with a {@link ParseError}.
 */
public class Parser {

  private static final Logger logger = Logging.getGopyLogger();

  private static final EnumSet<TokenKind> STATEMENT_START =
      EnumSet.of(TokenKind.RETURN, TokenKind.IF, TokenKind.FOR,
                 TokenKind.IDENT);

  private static final EnumSet<TokenKind> AFTER_STATEMENT_IDENT =
      EnumSet.of(TokenKind.EQ, TokenKind.COLON_EQ, TokenKind.LPAREN);

  private static final EnumSet<TokenKind> TERM_START =
      EnumSet.of(TokenKind.NUMBER, TokenKind.IDENT, TokenKind.LPAREN);

  private final TokenStream tokens;

  /** Lookahead token */
  private Token cur;

  public Parser(TokenStream tokens) throws LexError {
    this.tokens = tokens;
    this.cur = tokens.nextToken();
  }

  public Parser(List<Token> tokens) throws LexError {
    this(new ListTokenStream(tokens));
  }

  /**
   * Convenience: lex and parse source text
   */
  public static Function parse(String source) throws UserException {
    return new Parser(new Lexer(source)).parseFunction();
  }

  /**
   * Parse exactly one function definition, consuming all input.
   */
  public Function parseFunction() throws LexError, ParseError {
    eat(TokenKind.FUNC);
    String name = eat(TokenKind.IDENT).getText();
    eat(TokenKind.LPAREN);
    List<String> params = new ArrayList<String>();
    if (!cur.is(TokenKind.RPAREN)) {
      params.add(parseParam());
      while (cur.is(TokenKind.COMMA)) {
        eat(TokenKind.COMMA);
        params.add(parseParam());
      }
    }
    eat(TokenKind.RPAREN);
    // Result type is erased
    if (cur.is(TokenKind.INT)) {
      eat(TokenKind.INT);
    }
    List<Statement> body = parseBracedBlock();
    eat(TokenKind.EOF);

    logger.debug("parsed function " + name + " with " + params.size() +
                 " params and " + body.size() + " statements");
    return new Function(name, params, body);
  }

  private String parseParam() throws LexError, ParseError {
    String param = eat(TokenKind.IDENT).getText();
    // Parameter type is erased
    if (cur.is(TokenKind.INT)) {
      eat(TokenKind.INT);
    }
    return param;
  }

  private List<Statement> parseBracedBlock() throws LexError, ParseError {
    eat(TokenKind.LBRACE);
    List<Statement> block = parseBlock();
    eat(TokenKind.RBRACE);
    return block;
  }

  /**
   * Statements up to, but not including, the closing brace
   */
  private List<Statement> parseBlock() throws LexError, ParseError {
    List<Statement> stmts = new ArrayList<Statement>();
    while (!cur.is(TokenKind.RBRACE)) {
      stmts.add(parseStatement());
    }
    return stmts;
  }

  private Statement parseStatement() throws LexError, ParseError {
    if (logger.isTraceEnabled()) {
      logger.trace("statement at " + cur.getPosition() + ": " + cur);
    }
    switch (cur.getKind()) {
      case RETURN:
        eat(TokenKind.RETURN);
        return new Return(parseExpr());
      case IF:
        return parseIf();
      case FOR: {
        eat(TokenKind.FOR);
        Expression cond = parseExpr();
        List<Statement> body = parseBracedBlock();
        return new For(cond, body);
      }
      case IDENT: {
        Token ident = eat(TokenKind.IDENT);
        if (cur.is(TokenKind.EQ) || cur.is(TokenKind.COLON_EQ)) {
          eat(cur.getKind());
          return new Assign(ident.getText(), parseExpr());
        } else if (cur.is(TokenKind.LPAREN)) {
          return new CallStatement(parseCall(ident));
        }
        throw new ParseError(cur, AFTER_STATEMENT_IDENT);
      }
      default:
        throw new ParseError(cur, STATEMENT_START);
    }
  }

  private If parseIf() throws LexError, ParseError {
    eat(TokenKind.IF);
    Expression cond = parseExpr();
    List<Statement> thenBlock = parseBracedBlock();
    List<Statement> elseBlock = null;
    if (cur.is(TokenKind.ELSE)) {
      eat(TokenKind.ELSE);
      if (cur.is(TokenKind.IF)) {
        // else if: nested conditional is the whole else block
        elseBlock = new ArrayList<Statement>(1);
        elseBlock.add(parseIf());
      } else {
        elseBlock = parseBracedBlock();
      }
    }
    return new If(cond, thenBlock, elseBlock);
  }

  /**
   * Left-associative addition and subtraction
   */
  Expression parseExpr() throws LexError, ParseError {
    Expression node = parseProduct();
    while (cur.is(TokenKind.PLUS) || cur.is(TokenKind.MINUS)) {
      String op = eat(cur.getKind()).getText();
      node = new BinaryOp(node, op, parseProduct());
    }
    return node;
  }

  /**
   * Left-associative multiplication and division
   */
  private Expression parseProduct() throws LexError, ParseError {
    Expression node = parseTerm();
    while (cur.is(TokenKind.STAR) || cur.is(TokenKind.SLASH)) {
      String op = eat(cur.getKind()).getText();
      node = new BinaryOp(node, op, parseTerm());
    }
    return node;
  }

  private Expression parseTerm() throws LexError, ParseError {
    Token tok = cur;
    switch (tok.getKind()) {
      case NUMBER:
        eat(TokenKind.NUMBER);
        try {
          return new Num(Long.parseLong(tok.getText()));
        } catch (NumberFormatException e) {
          throw new ParseError(tok, "Integer literal out of range");
        }
      case IDENT:
        eat(TokenKind.IDENT);
        if (cur.is(TokenKind.LPAREN)) {
          return parseCall(tok);
        }
        return new Var(tok.getText());
      case LPAREN: {
        eat(TokenKind.LPAREN);
        Expression inner = parseExpr();
        eat(TokenKind.RPAREN);
        return inner;
      }
      default:
        throw new ParseError(tok, TERM_START);
    }
  }

  /**
   * Argument list of a call whose name was already consumed
   */
  private Call parseCall(Token name) throws LexError, ParseError {
    eat(TokenKind.LPAREN);
    List<Expression> args = new ArrayList<Expression>();
    if (!cur.is(TokenKind.RPAREN)) {
      args.add(parseExpr());
      while (cur.is(TokenKind.COMMA)) {
        eat(TokenKind.COMMA);
        args.add(parseExpr());
      }
    }
    eat(TokenKind.RPAREN);
    return new Call(name.getText(), args);
  }

  /**
   * Consume the lookahead token, which must be of the given kind
   * @return the consumed token
   */
  private Token eat(TokenKind kind) throws LexError, ParseError {
    if (!cur.is(kind)) {
      throw new ParseError(cur, kind);
    }
    Token consumed = cur;
    if (!kind.equals(TokenKind.EOF)) {
      cur = tokens.nextToken();
    }
    return consumed;
  }

  /**
   * Feeds a pre-lexed list of tokens to the parser.  Supplies an EOF
   * token if the list does not end with one.
   */
  private static class ListTokenStream implements TokenStream {
    private final Iterator<Token> it;
    private Token last = null;

    ListTokenStream(List<Token> tokens) {
      this.it = tokens.iterator();
    }

    @Override
    public Token nextToken() {
      if (last != null && last.is(TokenKind.EOF)) {
        return last;
      }
      if (it.hasNext()) {
        last = it.next();
      } else {
        SourcePosition pos = last == null ? new SourcePosition(0, 1, 1)
                                          : last.getPosition();
        last = new Token(TokenKind.EOF, "", pos);
      }
      return last;
    }
  }
}
