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
package exm.gopy.target.tree;

/**
 * Arithmetic operators of the target tree.  Precedence is shared by all
 * renderers: higher binds tighter.
 */
public enum BinOperator {
  ADD(1),
  SUB(1),
  MULT(2),
  DIV(2);

  private final int precedence;

  BinOperator(int precedence) {
    this.precedence = precedence;
  }

  public int precedence() {
    return precedence;
  }
}
