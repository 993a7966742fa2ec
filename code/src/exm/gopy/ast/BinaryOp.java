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
package exm.gopy.ast;

/**
 * Binary arithmetic.  The operator is kept as its source symbol; the
 * parser only produces "+", "-", "*" and "/".
 */
public class BinaryOp extends Expression {
  public static final String PLUS = "+";
  public static final String MINUS = "-";
  public static final String TIMES = "*";
  public static final String DIV = "/";

  private final Expression left;
  private final String op;
  private final Expression right;

  public BinaryOp(Expression left, String op, Expression right) {
    this.left = left;
    this.op = op;
    this.right = right;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.BINARY_OP;
  }

  public Expression getLeft() {
    return left;
  }

  public String getOp() {
    return op;
  }

  public Expression getRight() {
    return right;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof BinaryOp))
      return false;
    BinaryOp other = (BinaryOp) obj;
    return op.equals(other.op) && left.equals(other.left) &&
           right.equals(other.right);
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = left.hashCode();
    result = prime * result + op.hashCode();
    result = prime * result + right.hashCode();
    return result;
  }

  @Override
  public String toString() {
    return "BinaryOp(" + left + ", " + op + ", " + right + ")";
  }
}
