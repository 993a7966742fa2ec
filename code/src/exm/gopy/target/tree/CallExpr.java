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

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Call of a named function, in expression context
 */
public class CallExpr extends Expr
{
  private final Name function;
  private final ImmutableList<Expr> args;

  public CallExpr(String function, List<? extends Expr> args)
  {
    this.function = Name.load(function);
    this.args = ImmutableList.copyOf(args);
  }

  @Override
  public TreeKind kind() {
    return TreeKind.CALL;
  }

  public Name function() {
    return function;
  }

  public List<Expr> args() {
    return args;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof CallExpr))
      return false;
    CallExpr other = (CallExpr) obj;
    return function.equals(other.function) && args.equals(other.args);
  }

  @Override
  public int hashCode() {
    return 31 * function.hashCode() + args.hashCode();
  }

  @Override
  public String toString() {
    return "Call(" + function + ", " + args + ")";
  }
}
