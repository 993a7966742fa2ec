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

public class Call extends Expression {
  private final String name;
  private final ImmutableList<Expression> args;

  public Call(String name, List<Expression> args) {
    this.name = name;
    this.args = ImmutableList.copyOf(args);
  }

  @Override
  public NodeKind kind() {
    return NodeKind.CALL;
  }

  public String getName() {
    return name;
  }

  public List<Expression> getArgs() {
    return args;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Call))
      return false;
    Call other = (Call) obj;
    return name.equals(other.name) && args.equals(other.args);
  }

  @Override
  public int hashCode() {
    return 31 * name.hashCode() + args.hashCode();
  }

  @Override
  public String toString() {
    return "Call(" + name + ", " + args + ")";
  }
}
