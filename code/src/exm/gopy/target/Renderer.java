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
package exm.gopy.target;

import org.apache.commons.lang3.StringUtils;

import exm.gopy.common.exceptions.GopyRuntimeError;
import exm.gopy.target.tree.BinOperator;
import exm.gopy.target.tree.BinaryExpr;
import exm.gopy.target.tree.Expr;
import exm.gopy.target.tree.ExprStatement;
import exm.gopy.target.tree.FunctionDef;
import exm.gopy.target.tree.IfStatement;
import exm.gopy.target.tree.ReturnStatement;
import exm.gopy.target.tree.Sequence;
import exm.gopy.target.tree.SetVariable;
import exm.gopy.target.tree.TargetTree;
import exm.gopy.target.tree.TreeKind;
import exm.gopy.target.tree.WhileLoop;

/**
 * Turns a target tree into source text of one output language.
 *
 * Subclasses supply the syntax of each construct; this class dispatches
 * on the tree kind and keeps track of indentation.  A renderer holds
 * indentation state while rendering, so instances are not thread-safe.
 */
public abstract class Renderer
{
  private final int indentWidth;
  private int indentation = 0;

  protected Renderer(int indentWidth)
  {
    this.indentWidth = indentWidth;
  }

  public String render(TargetTree tree)
  {
    StringBuilder sb = new StringBuilder(2048);
    indentation = 0;
    appendTo(sb, tree);
    return sb.toString();
  }

  protected void appendTo(StringBuilder sb, TargetTree tree)
  {
    switch (tree.kind()) {
      case FUNCTION_DEF:
        appendFunction(sb, (FunctionDef) tree);
        break;
      case SEQUENCE:
        appendSequence(sb, (Sequence) tree);
        break;
      case IF:
        appendIf(sb, (IfStatement) tree);
        break;
      case WHILE:
        appendWhile(sb, (WhileLoop) tree);
        break;
      case SET_VARIABLE:
        appendSetVariable(sb, (SetVariable) tree);
        break;
      case RETURN:
        appendReturn(sb, (ReturnStatement) tree);
        break;
      case EXPR_STATEMENT:
        appendExprStatement(sb, (ExprStatement) tree);
        break;
      case BINARY:
      case CALL:
      case NAME:
      case LITERAL_INT:
        appendExpr(sb, (Expr) tree);
        break;
      default:
        throw new GopyRuntimeError("Unknown tree kind: " + tree.kind());
    }
  }

  protected void appendSequence(StringBuilder sb, Sequence seq)
  {
    for (TargetTree member: seq.members()) {
      appendTo(sb, member);
    }
  }

  protected abstract void appendFunction(StringBuilder sb, FunctionDef fn);

  protected abstract void appendIf(StringBuilder sb, IfStatement stmt);

  protected abstract void appendWhile(StringBuilder sb, WhileLoop loop);

  protected abstract void appendSetVariable(StringBuilder sb, SetVariable set);

  protected abstract void appendReturn(StringBuilder sb, ReturnStatement ret);

  protected abstract void appendExprStatement(StringBuilder sb,
                                              ExprStatement stmt);

  protected abstract void appendExpr(StringBuilder sb, Expr expr);

  /**
   * Whether an operand must be parenthesized to keep the tree's
   * grouping.  Operators are left-associative, so a right operand of the
   * same precedence needs parentheses.
   */
  protected static boolean needsParens(BinOperator parent, Expr operand,
                                       boolean rightOperand)
  {
    if (operand.kind() != TreeKind.BINARY) {
      return false;
    }
    int childPrec = ((BinaryExpr) operand).op().precedence();
    if (childPrec < parent.precedence()) {
      return true;
    }
    return rightOperand && childPrec == parent.precedence();
  }

  public void indent(StringBuilder sb)
  {
    sb.append(StringUtils.repeat(' ', indentation));
  }

  public void increaseIndent()
  {
    indentation += indentWidth;
  }

  public void decreaseIndent()
  {
    indentation -= indentWidth;
  }
}
