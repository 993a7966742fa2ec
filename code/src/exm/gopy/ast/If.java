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

import java.util.List;

import com.google.common.collect.ImmutableList;

public class If extends Statement {

  private final Expression condition;
  private final ImmutableList<Statement> thenBlock;
  /** null exactly when the source had no else clause */
  private final ImmutableList<Statement> elseBlock;

  public If(Expression condition, List<Statement> thenBlock) {
    this(condition, thenBlock, null);
  }

  public If(Expression condition, List<Statement> thenBlock,
            List<Statement> elseBlock) {
    this.condition = condition;
    this.thenBlock = ImmutableList.copyOf(thenBlock);
    this.elseBlock = elseBlock == null ? null : ImmutableList.copyOf(elseBlock);
  }

  @Override
  public NodeKind kind() {
    return NodeKind.IF;
  }

  public Expression getCondition() {
    return condition;
  }

  public List<Statement> getThenBlock() {
    return thenBlock;
  }

  /**
   * @return else statements, or null if there was no else clause
   */
  public List<Statement> getElseBlock() {
    return elseBlock;
  }

  public boolean hasElse() {
    return elseBlock != null;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof If))
      return false;
    If other = (If) obj;
    if (!condition.equals(other.condition) ||
        !thenBlock.equals(other.thenBlock)) {
      return false;
    }
    if (elseBlock == null) {
      return other.elseBlock == null;
    }
    return elseBlock.equals(other.elseBlock);
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = condition.hashCode();
    result = prime * result + thenBlock.hashCode();
    result = prime * result + (elseBlock == null ? 0 : elseBlock.hashCode());
    return result;
  }

  @Override
  public String toString() {
    return "If(cond=" + condition + ", then=" + thenBlock + ", otherwise=" +
           (elseBlock == null ? "None" : elseBlock) + ")";
  }
}
