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
package exm.gopy.tclbackend;

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
 * Renders Tcl source.
 *
 * Expressions appear in two contexts: as a command word, where
 * arithmetic must be wrapped in [ expr { ... } ], and inside the braces
 * of expr/if/while, where it is written infix.  Division is written as
 * double(l) / r so that it never truncates.
 */
public class TclRenderer extends Renderer
{
  public TclRenderer(int indentWidth)
  {
    super(indentWidth);
  }

  @Override
  protected void appendFunction(StringBuilder sb, FunctionDef fn)
  {
    indent(sb);
    sb.append("proc ");
    sb.append(fn.name());
    if (fn.params().isEmpty()) {
      sb.append(" {}");
    } else {
      sb.append(" { ");
      sb.append(StringUtils.join(fn.params(), ' '));
      sb.append(" }");
    }
    sb.append(' ');
    appendBlock(sb, fn.body());
    sb.append('\n');
  }

  @Override
  protected void appendIf(StringBuilder sb, IfStatement stmt)
  {
    indent(sb);
    sb.append("if { ");
    appendInExpr(sb, stmt.condition());
    sb.append(" } ");
    appendBlock(sb, stmt.thenBlock());
    if (!stmt.elseBlock().isEmpty()) {
      sb.append(" else ");
      appendBlock(sb, stmt.elseBlock());
    }
    sb.append('\n');
  }

  @Override
  protected void appendWhile(StringBuilder sb, WhileLoop loop)
  {
    indent(sb);
    // E.g. while { $i > 2 }
    sb.append("while { ");
    appendInExpr(sb, loop.condition());
    sb.append(" } ");
    appendBlock(sb, loop.loopBody());
    sb.append('\n');
  }

  @Override
  protected void appendSetVariable(StringBuilder sb, SetVariable set)
  {
    indent(sb);
    sb.append("set ");
    sb.append(set.variable().id());
    sb.append(' ');
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
    Expr value = stmt.value();
    if (value.kind() == TreeKind.CALL) {
      // A call on its own is just a command
      appendCommand(sb, (CallExpr) value);
    } else {
      sb.append("expr { ");
      appendInExpr(sb, value);
      sb.append(" }");
    }
    sb.append('\n');
  }

  /**
   * Append the body inside curly braces.
   */
  private void appendBlock(StringBuilder sb, Sequence body)
  {
    sb.append("{\n");
    increaseIndent();
    appendSequence(sb, body);
    decreaseIndent();
    indent(sb);
    sb.append("}");
  }

  /**
   * Expression as a single command word
   */
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
        sb.append("[ expr { ");
        appendInExpr(sb, expr);
        sb.append(" } ]");
        break;
      case CALL:
        sb.append("[ ");
        appendCommand(sb, (CallExpr) expr);
        sb.append(" ]");
        break;
      default:
        throw new GopyRuntimeError("Not a Tcl expression: " + expr);
    }
  }

  /**
   * Expression inside the braces of expr, if or while
   */
  private void appendInExpr(StringBuilder sb, Expr expr)
  {
    if (expr.kind() != TreeKind.BINARY) {
      appendExpr(sb, expr);
      return;
    }
    BinaryExpr binop = (BinaryExpr) expr;
    if (binop.op() == BinOperator.DIV) {
      sb.append("double(");
      appendInExpr(sb, binop.left());
      sb.append(")");
    } else {
      appendOperand(sb, binop.op(), binop.left(), false);
    }
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
    appendInExpr(sb, operand);
    if (parens)
      sb.append(')');
  }

  private void appendName(StringBuilder sb, Name name)
  {
    if (name.context() != Name.Context.LOAD) {
      throw new GopyRuntimeError("Cannot read from store target " + name);
    }
    sb.append('$');
    sb.append(name.id());
  }

  private void appendCommand(StringBuilder sb, CallExpr call)
  {
    sb.append(call.function().id());
    for (Expr arg: call.args()) {
      sb.append(' ');
      appendExpr(sb, arg);
    }
  }

  private static String operatorSymbol(BinOperator op)
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
