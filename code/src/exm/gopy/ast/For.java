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

/**
 * Condition-only loop: repeats the body while the condition holds.
 * There is no init or post clause.
 */
public class For extends Statement {
  private final Expression condition;
  private final ImmutableList<Statement> body;

  public For(Expression condition, List<Statement> body) {
    this.condition = condition;
    this.body = ImmutableList.copyOf(body);
  }

  @Override
  public NodeKind kind() {
    return NodeKind.FOR;
  }

  public Expression getCondition() {
    return condition;
  }

  public List<Statement> getBody() {
    return body;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof For))
      return false;
    For other = (For) obj;
    return condition.equals(other.condition) && body.equals(other.body);
  }

  @Override
  public int hashCode() {
    return 31 * condition.hashCode() + body.hashCode();
  }

  @Override
  public String toString() {
    return "For(cond=" + condition + ", body=" + body + ")";
  }
}
