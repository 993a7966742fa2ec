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
 * Reference to a variable, either reading it or storing to it
 */
public class Name extends Expr
{
  public static enum Context {
    LOAD,
    STORE,
  }

  private final String id;
  private final Context context;

  public Name(String id, Context context)
  {
    this.id = id;
    this.context = context;
  }

  public static Name load(String id) {
    return new Name(id, Context.LOAD);
  }

  public static Name store(String id) {
    return new Name(id, Context.STORE);
  }

  @Override
  public TreeKind kind() {
    return TreeKind.NAME;
  }

  public String id() {
    return id;
  }

  public Context context() {
    return context;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Name))
      return false;
    Name other = (Name) obj;
    return id.equals(other.id) && context == other.context;
  }

  @Override
  public int hashCode() {
    return 31 * id.hashCode() + context.ordinal();
  }

  @Override
  public String toString() {
    return "Name(" + id + ", " + context + ")";
  }
}
