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
 * Loop while condition holds
 */
public class WhileLoop extends TargetTree {
  private final Expr condition;
  private final Sequence loopBody;

  public WhileLoop(Expr condition, Sequence loopBody)
  {
    this.condition = condition;
    this.loopBody = loopBody;
  }

  @Override
  public TreeKind kind() {
    return TreeKind.WHILE;
  }

  public Expr condition() {
    return condition;
  }

  public Sequence loopBody() {
    return loopBody;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof WhileLoop))
      return false;
    WhileLoop other = (WhileLoop) obj;
    return condition.equals(other.condition) &&
           loopBody.equals(other.loopBody);
  }

  @Override
  public int hashCode() {
    return 31 * condition.hashCode() + loopBody.hashCode();
  }

  @Override
  public String toString() {
    return "While(" + condition + ", " + loopBody + ")";
  }
}
