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
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.log4j.Logger;

import exm.gopy.common.Logging;
import exm.gopy.common.exceptions.LexError;

/**
 * Scans source text into tokens on demand.
 *
 * At each position the patterns of {@link TokenKind} are tried in
 * declaration order and the first match wins.  Whitespace is skipped.
 */
public class Lexer implements TokenStream {

  private static final Pattern WHITESPACE = Pattern.compile("[ \\t\\r\\n]+");

  private static final Logger logger = Logging.getGopyLogger();

  private final String source;
  private final Matcher matcher;

  private int pos = 0;
  private int line = 1;
  /** Offset of first character on current line */
  private int lineStart = 0;

  public Lexer(String source) {
    this.source = source;
    this.matcher = WHITESPACE.matcher(source);
    // Let \b see the character before the region
    this.matcher.useTransparentBounds(true);
  }

  /**
   * Lex the whole source eagerly
   * @return all tokens, the last one being EOF
   */
  public static List<Token> tokenize(String source) throws LexError {
    Lexer lexer = new Lexer(source);
    List<Token> result = new ArrayList<Token>();
    Token tok;
    do {
      tok = lexer.nextToken();
      result.add(tok);
    } while (!tok.is(TokenKind.EOF));
    return result;
  }

  @Override
  public Token nextToken() throws LexError {
    skipWhitespace();
    SourcePosition start = position();
    if (pos >= source.length()) {
      return new Token(TokenKind.EOF, "", start);
    }

    for (TokenKind kind: TokenKind.values()) {
      Pattern p = kind.pattern();
      if (p != null && lookingAt(p)) {
        String text = matcher.group();
        pos = matcher.end();
        Token tok = new Token(kind, text, start);
        if (logger.isTraceEnabled()) {
          logger.trace("token " + tok + " at " + start);
        }
        return tok;
      }
    }
    throw new LexError(start, source.charAt(pos));
  }

  private void skipWhitespace() {
    if (pos < source.length() && lookingAt(WHITESPACE)) {
      for (int i = pos; i < matcher.end(); i++) {
        if (source.charAt(i) == '\n') {
          line++;
          lineStart = i + 1;
        }
      }
      pos = matcher.end();
    }
  }

  private boolean lookingAt(Pattern p) {
    matcher.usePattern(p);
    matcher.region(pos, source.length());
    return matcher.lookingAt();
  }

  private SourcePosition position() {
    return new SourcePosition(pos, line, pos - lineStart + 1);
  }
}
