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
package exm.gopy.lower;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import exm.gopy.ast.Assign;
import exm.gopy.ast.BinaryOp;
import exm.gopy.ast.Call;
import exm.gopy.ast.CallStatement;
import exm.gopy.ast.Expression;
import exm.gopy.ast.For;
import exm.gopy.ast.Function;
import exm.gopy.ast.If;
import exm.gopy.ast.Num;
import exm.gopy.ast.Return;
import exm.gopy.ast.Statement;
import exm.gopy.ast.Var;
import exm.gopy.common.Logging;
import exm.gopy.common.exceptions.LoweringError;
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
import exm.gopy.target.tree.TargetTree;
import exm.gopy.target.tree.WhileLoop;

/**
 * Translates a parsed function into the language-neutral target tree.
 *
 * One case per AST node kind.  No semantic analysis happens here: names
 * are not resolved and nothing is type checked.
 */
public class Lowering {

  private final Logger logger;

  public Lowering() {
    this(Logging.getGopyLogger());
  }

  public Lowering(Logger logger) {
    this.logger = logger;
  }

  public FunctionDef lower(Function function) throws LoweringError {
    logger.debug("lowering function " + function.getName());
    Sequence body = lowerBlock(function.getBody());
    return new FunctionDef(function.getName(), function.getParams(), body);
  }

  /**
   * Statements are lowered one by one, in source order
   */
  Sequence lowerBlock(List<Statement> stmts) throws LoweringError {
    List<TargetTree> result = new ArrayList<TargetTree>(stmts.size());
    for (Statement stmt: stmts) {
      result.add(lowerStatement(stmt));
    }
    return new Sequence(result);
  }

  TargetTree lowerStatement(Statement stmt) throws LoweringError {
    if (logger.isTraceEnabled()) {
      logger.trace("lower " + stmt.kind());
    }
    switch (stmt.kind()) {
      case RETURN:
        return new ReturnStatement(lowerExpr(((Return) stmt).getValue()));
      case ASSIGN: {
        Assign assign = (Assign) stmt;
        return new SetVariable(Name.store(assign.getName()),
                               lowerExpr(assign.getValue()));
      }
      case IF: {
        If ifStmt = (If) stmt;
        Sequence elseBlock;
        if (ifStmt.hasElse()) {
          elseBlock = lowerBlock(ifStmt.getElseBlock());
        } else {
          elseBlock = Sequence.empty();
        }
        return new IfStatement(lowerExpr(ifStmt.getCondition()),
                               lowerBlock(ifStmt.getThenBlock()), elseBlock);
      }
      case FOR: {
        // Condition-only loop: a while loop, never a counted loop
        For loop = (For) stmt;
        return new WhileLoop(lowerExpr(loop.getCondition()),
                             lowerBlock(loop.getBody()));
      }
      case CALL_STATEMENT:
        return new ExprStatement(lowerCall(((CallStatement) stmt).getCall()));
      default:
        throw LoweringError.unknownNode(stmt);
    }
  }

  Expr lowerExpr(Expression expr) throws LoweringError {
    switch (expr.kind()) {
      case BINARY_OP: {
        BinaryOp binop = (BinaryOp) expr;
        return new BinaryExpr(lowerExpr(binop.getLeft()),
                              lowerOperator(binop.getOp()),
                              lowerExpr(binop.getRight()));
      }
      case CALL:
        return lowerCall((Call) expr);
      case VAR:
        return Name.load(((Var) expr).getName());
      case NUM:
        return new LiteralInt(((Num) expr).getValue());
      default:
        throw LoweringError.unknownNode(expr);
    }
  }

  private CallExpr lowerCall(Call call) throws LoweringError {
    List<Expr> args = new ArrayList<Expr>(call.getArgs().size());
    for (Expression arg: call.getArgs()) {
      args.add(lowerExpr(arg));
    }
    return new CallExpr(call.getName(), args);
  }

  /**
   * Map source operator symbol 1:1 onto a target operator
   */
  static BinOperator lowerOperator(String op) throws LoweringError {
    if (BinaryOp.PLUS.equals(op)) {
      return BinOperator.ADD;
    } else if (BinaryOp.MINUS.equals(op)) {
      return BinOperator.SUB;
    } else if (BinaryOp.TIMES.equals(op)) {
      return BinOperator.MULT;
    } else if (BinaryOp.DIV.equals(op)) {
      return BinOperator.DIV;
    } else {
      throw LoweringError.unknownOperator(op);
    }
  }
}
