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

import java.util.regex.Pattern;

/**
 * Token kinds of the source language.
 *
 * Declaration order is the order in which the lexer tries the patterns:
 * keywords come before IDENT and ":=" before "=".
 */
public enum TokenKind
{
  FUNC("\\bfunc\\b"),
  RETURN("\\breturn\\b"),
  IF("\\bif\\b"),
  ELSE("\\belse\\b"),
  FOR("\\bfor\\b"),
  INT("\\bint\\b"),
  IDENT("[A-Za-z_][A-Za-z0-9_]*"),
  NUMBER("[0-9]+"),
  COLON_EQ(":="),
  PLUS("\\+"),
  MINUS("-"),
  STAR("\\*"),
  SLASH("/"),
  EQ("="),
  LPAREN("\\("),
  RPAREN("\\)"),
  LBRACE("\\{"),
  RBRACE("\\}"),
  COMMA(","),
  /** End of input, never matched against the text */
  EOF(null);

  private final Pattern pattern;

  TokenKind(String regex)
  {
    this.pattern = regex == null ? null : Pattern.compile(regex);
  }

  /**
   * @return the pattern to scan for, or null for EOF
   */
  public Pattern pattern()
  {
    return pattern;
  }
}
