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
 * Root of a parsed program: one function definition.
 * Parameter types are not kept.
 */
public class Function extends Node {
  private final String name;
  private final ImmutableList<String> params;
  private final ImmutableList<Statement> body;

  public Function(String name, List<String> params, List<Statement> body) {
    this.name = name;
    this.params = ImmutableList.copyOf(params);
    this.body = ImmutableList.copyOf(body);
  }

  @Override
  public NodeKind kind() {
    return NodeKind.FUNCTION;
  }

  public String getName() {
    return name;
  }

  public List<String> getParams() {
    return params;
  }

  public List<Statement> getBody() {
    return body;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Function))
      return false;
    Function other = (Function) obj;
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
    return "Function(name=" + name + ", params=" + params +
           ", body=" + body + ")";
  }
}
