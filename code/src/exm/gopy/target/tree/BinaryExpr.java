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

public class BinaryExpr extends Expr
{
  private final Expr left;
  private final BinOperator op;
  private final Expr right;

  public BinaryExpr(Expr left, BinOperator op, Expr right)
  {
    this.left = left;
    this.op = op;
    this.right = right;
  }

  @Override
  public TreeKind kind() {
    return TreeKind.BINARY;
  }

  public Expr left() {
    return left;
  }

  public BinOperator op() {
    return op;
  }

  public Expr right() {
    return right;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof BinaryExpr))
      return false;
    BinaryExpr other = (BinaryExpr) obj;
    return op == other.op && left.equals(other.left) &&
           right.equals(other.right);
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = left.hashCode();
    result = prime * result + op.ordinal();
    result = prime * result + right.hashCode();
    return result;
  }

  @Override
  public String toString() {
    return "BinOp(" + left + ", " + op + ", " + right + ")";
  }
}
