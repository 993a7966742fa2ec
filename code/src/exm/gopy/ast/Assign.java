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
 * Assignment to a single name.  Both "=" and ":=" produce this node:
 * declaration and re-assignment are not distinguished.
 */
public class Assign extends Statement {
  private final String name;
  private final Expression value;

  public Assign(String name, Expression value) {
    this.name = name;
    this.value = value;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.ASSIGN;
  }

  public String getName() {
    return name;
  }

  public Expression getValue() {
    return value;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Assign))
      return false;
    Assign other = (Assign) obj;
    return name.equals(other.name) && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return 31 * name.hashCode() + value.hashCode();
  }

  @Override
  public String toString() {
    return "Assign(" + name + ", " + value + ")";
  }
}
