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
 * A call evaluated for its effect, e.g. "log(x)" on its own line
 */
public class CallStatement extends Statement {
  private final Call call;

  public CallStatement(Call call) {
    this.call = call;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.CALL_STATEMENT;
  }

  public Call getCall() {
    return call;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof CallStatement))
      return false;
    return call.equals(((CallStatement) obj).call);
  }

  @Override
  public int hashCode() {
    return call.hashCode();
  }

  @Override
  public String toString() {
    return "CallStatement(" + call + ")";
  }
}
