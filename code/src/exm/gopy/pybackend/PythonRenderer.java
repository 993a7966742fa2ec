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
package exm.gopy.pybackend;

import java.util.Iterator;

import org.apache.commons.lang3.StringUtils;

import exm.gopy.common.exceptions.GopyRuntimeError;
import exm.gopy.target.Renderer;
import exm.gopy.target.tree.BinOperator;
import exm.gopy.target.tree.BinaryExpr;
import exm.gopy.target.tree.CallExpr;
import exm.gopy.target.tree.Expr;
import exm.gopy.target.tree.ExprStatement;
import exm.gopy.target.tree.FunctionDef;
import exm.gopy.target.tree.IfStatement;
import exm.gopy.target.tree.LiteralInt;
import exm.gopy.target.tree.Name;
import exm.gopy.target.tree.ReturnStatement;
import exm.gopy.target.tree.Sequence;
import exm.gopy.target.tree.SetVariable;
import exm.gopy.target.tree.TreeKind;
import exm.gopy.target.tree.WhileLoop;

/**
 * Renders Python source, in the layout Python's own unparser uses:
 * an else block that is a lone if becomes elif, an empty else block is
 * left out and an empty body becomes pass.
 */
public class PythonRenderer extends Renderer
{
  public PythonRenderer(int indentWidth)
  {
    super(indentWidth);
  }

  @Override
  protected void appendFunction(StringBuilder sb, FunctionDef fn)
  {
    indent(sb);
    sb.append("def ");
    sb.append(fn.name());
    sb.append("(");
    sb.append(StringUtils.join(fn.params(), ", "));
    sb.append("):\n");
    appendBlock(sb, fn.body());
  }

  @Override
  protected void appendIf(StringBuilder sb, IfStatement stmt)
  {
    appendIf(sb, stmt, "if ");
  }

  private void appendIf(StringBuilder sb, IfStatement stmt, String keyword)
  {
    indent(sb);
    sb.append(keyword);
    appendExpr(sb, stmt.condition());
    sb.append(":\n");
    appendBlock(sb, stmt.thenBlock());

    Sequence elseBlock = stmt.elseBlock();
    if (elseBlock.size() == 1 &&
        elseBlock.members().get(0).kind() == TreeKind.IF) {
      appendIf(sb, (IfStatement) elseBlock.members().get(0), "elif ");
    } else if (!elseBlock.isEmpty()) {
      indent(sb);
      sb.append("else:\n");
      appendBlock(sb, elseBlock);
    }
  }

  @Override
  protected void appendWhile(StringBuilder sb, WhileLoop loop)
  {
    indent(sb);
    sb.append("while ");
    appendExpr(sb, loop.condition());
    sb.append(":\n");
    appendBlock(sb, loop.loopBody());
  }

  @Override
  protected void appendSetVariable(StringBuilder sb, SetVariable set)
  {
    indent(sb);
    sb.append(set.variable().id());
    sb.append(" = ");
    appendExpr(sb, set.expression());
    sb.append('\n');
  }

  @Override
  protected void appendReturn(StringBuilder sb, ReturnStatement ret)
  {
    indent(sb);
    sb.append("return ");
    appendExpr(sb, ret.value());
    sb.append('\n');
  }

  @Override
  protected void appendExprStatement(StringBuilder sb, ExprStatement stmt)
  {
    indent(sb);
    appendExpr(sb, stmt.value());
    sb.append('\n');
  }

  /**
   * Indented body; Python does not allow an empty one
   */
  private void appendBlock(StringBuilder sb, Sequence body)
  {
    increaseIndent();
    if (body.isEmpty()) {
      indent(sb);
      sb.append("pass\n");
    } else {
      appendSequence(sb, body);
    }
    decreaseIndent();
  }

  @Override
  protected void appendExpr(StringBuilder sb, Expr expr)
  {
    switch (expr.kind()) {
      case NAME:
        appendName(sb, (Name) expr);
        break;
      case LITERAL_INT:
        sb.append(((LiteralInt) expr).value());
        break;
      case BINARY:
        appendBinary(sb, (BinaryExpr) expr);
        break;
      case CALL:
        appendCall(sb, (CallExpr) expr);
        break;
      default:
        throw new GopyRuntimeError("Not a Python expression: " + expr);
    }
  }

  private void appendBinary(StringBuilder sb, BinaryExpr binop)
  {
    appendOperand(sb, binop.op(), binop.left(), false);
    sb.append(' ');
    sb.append(operatorSymbol(binop.op()));
    sb.append(' ');
    appendOperand(sb, binop.op(), binop.right(), true);
  }

  private void appendOperand(StringBuilder sb, BinOperator parent,
                             Expr operand, boolean rightOperand)
  {
    boolean parens = needsParens(parent, operand, rightOperand);
    if (parens)
      sb.append('(');
    appendExpr(sb, operand);
    if (parens)
      sb.append(')');
  }

  private void appendName(StringBuilder sb, Name name)
  {
    if (name.context() != Name.Context.LOAD) {
      throw new GopyRuntimeError("Cannot read from store target " + name);
    }
    sb.append(name.id());
  }

  private void appendCall(StringBuilder sb, CallExpr call)
  {
    sb.append(call.function().id());
    sb.append('(');
    Iterator<Expr> it = call.args().iterator();
    while (it.hasNext()) {
      appendExpr(sb, it.next());
      if (it.hasNext())
        sb.append(", ");
    }
    sb.append(')');
  }

  static String operatorSymbol(BinOperator op)
  {
    switch (op) {
      case ADD:
        return "+";
      case SUB:
        return "-";
      case MULT:
        return "*";
      case DIV:
        return "/";
      default:
        throw new GopyRuntimeError("Unknown operator: " + op);
    }
  }
}
