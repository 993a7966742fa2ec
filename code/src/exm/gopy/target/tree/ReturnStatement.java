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

public class ReturnStatement extends TargetTree
{
  private final Expr value;

  public ReturnStatement(Expr value)
  {
    this.value = value;
  }

  @Override
  public TreeKind kind() {
    return TreeKind.RETURN;
  }

  public Expr value() {
    return value;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof ReturnStatement))
      return false;
    return value.equals(((ReturnStatement) obj).value);
  }

  @Override
  public int hashCode() {
    return 31 * TreeKind.RETURN.hashCode() + value.hashCode();
  }

  @Override
  public String toString() {
    return "Return(" + value + ")";
  }
}
