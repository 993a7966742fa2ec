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
 * If-then-else construct.  The else block is always present, and is empty
 * when there is nothing to do otherwise.
 * */
public class IfStatement extends TargetTree
{
  private final Expr condition;
  private final Sequence thenBlock;
  private final Sequence elseBlock;

  public IfStatement(Expr condition, Sequence thenBlock, Sequence elseBlock)
  {
    this.condition = condition;
    this.thenBlock = thenBlock;
    this.elseBlock = elseBlock;
  }

  @Override
  public TreeKind kind() {
    return TreeKind.IF;
  }

  public Expr condition() {
    return condition;
  }

  public Sequence thenBlock() {
    return thenBlock;
  }

  public Sequence elseBlock() {
    return elseBlock;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof IfStatement))
      return false;
    IfStatement other = (IfStatement) obj;
    return condition.equals(other.condition) &&
           thenBlock.equals(other.thenBlock) &&
           elseBlock.equals(other.elseBlock);
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = condition.hashCode();
    result = prime * result + thenBlock.hashCode();
    result = prime * result + elseBlock.hashCode();
    return result;
  }

  @Override
  public String toString() {
    return "If(" + condition + ", " + thenBlock + ", " + elseBlock + ")";
  }
}
