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

/**
 * A classified piece of source text.  Immutable.
 */
public class Token {
  private final TokenKind kind;
  private final String text;
  private final SourcePosition position;

  public Token(TokenKind kind, String text, SourcePosition position) {
    this.kind = kind;
    this.text = text;
    this.position = position;
  }

  public TokenKind getKind() {
    return kind;
  }

  public String getText() {
    return text;
  }

  public SourcePosition getPosition() {
    return position;
  }

  public boolean is(TokenKind k) {
    return kind == k;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = kind.ordinal();
    result = prime * result + text.hashCode();
    result = prime * result + position.hashCode();
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Token))
      return false;
    Token other = (Token) obj;
    return kind == other.kind && text.equals(other.text) &&
           position.equals(other.position);
  }

  @Override
  public String toString() {
    if (kind == TokenKind.EOF) {
      return "EOF";
    }
    return kind + "(" + text + ")";
  }
}
