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
 * Function definition with untyped parameters
 */
public class FunctionDef extends TargetTree
{
  private final String name;
  private final ImmutableList<String> params;
  private final Sequence body;

  public FunctionDef(String name, List<String> params, Sequence body)
  {
    this.name = name;
    this.params = ImmutableList.copyOf(params);
    this.body = body;
  }

  @Override
  public TreeKind kind() {
    return TreeKind.FUNCTION_DEF;
  }

  public String name() {
    return name;
  }

  public List<String> params() {
    return params;
  }

  public Sequence body() {
    return body;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof FunctionDef))
      return false;
    FunctionDef other = (FunctionDef) obj;
    return name.equals(other.name) && params.equals(other.params) &&
           body.equals(other.body);
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = name.hashCode();
    result = prime * result + params.hashCode();
    result = prime * result + body.hashCode();
    return result;
  }

  @Override
  public String toString() {
    return "FunctionDef(" + name + ", " + params + ", " + body + ")";
  }
}
