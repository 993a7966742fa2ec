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

package exm.gopy.common.exceptions;

import exm.gopy.ast.Node;

/**
 * An AST node carries an operator or variant the lowering has no
 * target construct for.
 */
public class LoweringError
extends UserException
{
  public LoweringError(String msg)
  {
    super(msg);
  }

  public static LoweringError unknownOperator(String op) {
    return new LoweringError("No target operator for '" + op + "'");
  }

  public static LoweringError unknownNode(Node node) {
    return new LoweringError("Cannot lower node of kind " + node.kind() +
                             ": " + node);
  }

  private static final long serialVersionUID = 1L;
}
