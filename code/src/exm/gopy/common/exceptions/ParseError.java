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

package exm.gopy.common.exceptions;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

import exm.gopy.frontend.Token;
import exm.gopy.frontend.TokenKind;

/**
 * The parser found a token it did not expect.  Records what would have
 * been accepted at that point and what was actually there.
 */
public class ParseError extends UserException {

  private final Set<TokenKind> expected;
  private final Token actual;

  public ParseError(Token actual, TokenKind expected) {
    this(actual, EnumSet.of(expected));
  }

  public ParseError(Token actual, Set<TokenKind> expected) {
    super(actual.getPosition(), "Expected " + describe(expected) +
          ", got " + actual);
    this.expected = Collections.unmodifiableSet(EnumSet.copyOf(expected));
    this.actual = actual;
  }

  /**
   * For errors on a well-formed token, e.g. an out of range literal
   */
  public ParseError(Token actual, String message) {
    super(actual.getPosition(), message + ": " + actual);
    this.expected = Collections.emptySet();
    this.actual = actual;
  }

  public Set<TokenKind> getExpected() {
    return expected;
  }

  public Token getActual() {
    return actual;
  }

  private static String describe(Set<TokenKind> kinds) {
    if (kinds.size() == 1) {
      return kinds.iterator().next().toString();
    }
    return "one of " + StringUtils.join(kinds, ", ");
  }

  private static final long serialVersionUID = 1L;
}
