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

import exm.gopy.common.exceptions.GopyRuntimeError;

/**
 * Store a value into a single name
 */
public class SetVariable extends TargetTree
{
  private final Name variable;
  private final Expr expression;

  public SetVariable(Name variable, Expr expression)
  {
    if (variable.context() != Name.Context.STORE) {
      throw new GopyRuntimeError("assignment target must be a store: " +
                                 variable);
    }
    this.variable = variable;
    this.expression = expression;
  }

  public SetVariable(String variable, Expr expression)
  {
    this(Name.store(variable), expression);
  }

  @Override
  public TreeKind kind() {
    return TreeKind.SET_VARIABLE;
  }

  public Name variable() {
    return variable;
  }

  public Expr expression() {
    return expression;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof SetVariable))
      return false;
    SetVariable other = (SetVariable) obj;
    return variable.equals(other.variable) &&
           expression.equals(other.expression);
  }

  @Override
  public int hashCode() {
    return 31 * variable.hashCode() + expression.hashCode();
  }

  @Override
  public String toString() {
    return "Set(" + variable + ", " + expression + ")";
  }
}
