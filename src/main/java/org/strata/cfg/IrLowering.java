/*
 * Copyright 2026 The Strata Authors
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
 * limitations under the License.
 */

package org.strata.cfg;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.strata.ast.Argument;
import org.strata.ast.Expr;
import org.strata.ast.Operator;
import org.strata.ast.PrefixOperator;
import org.strata.ast.ProgramUnit;
import org.strata.ast.Statement;

/**
 * Lowers the body of a program unit to a list of {@link IrInstr}s.
 *
 * <p>Structured statements become conditional branches between generated labels. Labels are
 * named {@code L<kind><n>} with a counter shared by all kinds, so every label is unique within a
 * lowering; RETURN jumps to a single {@code Lreturn} label that is appended after the body if (and
 * only if) some RETURN uses it.
 */
public final class IrLowering implements Statement.Visitor<Void>, Expr.Visitor<String> {

  static final String RETURN_LABEL = "Lreturn";

  /** Where EXIT and CONTINUE go inside the innermost enclosing loop. */
  private record LoopLabels(String continueLabel, String exitLabel) {}

  private final List<IrInstr> instrs = new ArrayList<>();
  private final Deque<LoopLabels> loops = new ArrayDeque<>();
  private int numTemps;
  private int numLabels;
  private boolean sawReturn;

  private IrLowering() {}

  public static ImmutableList<IrInstr> lower(ProgramUnit unit) {
    return lower(unit.body());
  }

  /**
   * Lowers a statement list.
   *
   * @throws IllegalStateException if an EXIT or CONTINUE is not inside a loop
   */
  public static ImmutableList<IrInstr> lower(List<Statement> body) {
    IrLowering lowering = new IrLowering();
    lowering.emitAll(body);
    if (lowering.sawReturn) {
      lowering.emit(new IrInstr.Label(RETURN_LABEL));
    }
    return ImmutableList.copyOf(lowering.instrs);
  }

  private void emit(IrInstr instr) {
    instrs.add(instr);
  }

  private void emitAll(List<Statement> statements) {
    statements.forEach(s -> s.accept(this));
  }

  private String newTemp() {
    return "_t" + (++numTemps);
  }

  private String newLabel(String kind) {
    return "L" + kind + (++numLabels);
  }

  /** Emits the instructions that compute {@code expr} and returns the operand holding its value. */
  private String operand(Expr expr) {
    return expr.accept(this);
  }

  @Override
  public Void visitAssign(Statement.Assign assign) {
    String value = operand(assign.value());
    emit(new IrInstr.Assign(operand(assign.target()), value));
    return null;
  }

  @Override
  public Void visitIf(Statement.If ifStatement) {
    String end = newLabel("end");
    List<Statement.ConditionalBody> arms = new ArrayList<>();
    arms.add(new Statement.ConditionalBody(ifStatement.cond(), ifStatement.thenBody()));
    arms.addAll(ifStatement.elifs());
    for (int i = 0; i < arms.size(); i++) {
      Statement.ConditionalBody arm = arms.get(i);
      boolean last = (i == arms.size() - 1);
      String then = newLabel("then");
      String next;
      if (!last) {
        next = newLabel("elsif");
      } else if (ifStatement.hasElse()) {
        next = newLabel("else");
      } else {
        next = end;
      }
      emit(new IrInstr.BranchCond(operand(arm.cond()), then, next));
      emit(new IrInstr.Label(then));
      emitAll(arm.body());
      emit(new IrInstr.Goto(end));
      if (!next.equals(end)) {
        emit(new IrInstr.Label(next));
      }
    }
    emitAll(ifStatement.elseBody());
    emit(new IrInstr.Label(end));
    return null;
  }

  @Override
  public Void visitCase(Statement.Case caseStatement) {
    String selector = operand(caseStatement.cond());
    String end = newLabel("end");
    List<Statement.CaseEntry> entries = caseStatement.entries();
    for (int i = 0; i < entries.size(); i++) {
      Statement.CaseEntry entry = entries.get(i);
      String test = null;
      for (String value : entry.values()) {
        String match = caseMatch(selector, value);
        if (test == null) {
          test = match;
        } else {
          String combined = newTemp();
          emit(new IrInstr.BinOp(combined, Operator.OR, test, match));
          test = combined;
        }
      }
      String body = newLabel("case");
      boolean lastEntry = (i == entries.size() - 1);
      String next =
          (lastEntry && caseStatement.elseBody().isEmpty())
              ? end
              : newLabel(lastEntry ? "else" : "next");
      emit(new IrInstr.BranchCond(test, body, next));
      emit(new IrInstr.Label(body));
      emitAll(entry.body());
      emit(new IrInstr.Goto(end));
      if (!next.equals(end)) {
        emit(new IrInstr.Label(next));
      }
    }
    emitAll(caseStatement.elseBody());
    emit(new IrInstr.Label(end));
    return null;
  }

  /** Emits a test of {@code selector} against one CASE label and returns the result temporary. */
  private String caseMatch(String selector, String value) {
    int range = value.indexOf("..");
    String result = newTemp();
    if (range < 0) {
      emit(new IrInstr.BinOp(result, Operator.EQ, selector, value));
      return result;
    }
    String low = newTemp();
    String high = newTemp();
    emit(new IrInstr.BinOp(low, Operator.GE, selector, value.substring(0, range)));
    emit(new IrInstr.BinOp(high, Operator.LE, selector, value.substring(range + 2)));
    emit(new IrInstr.BinOp(result, Operator.AND, low, high));
    return result;
  }

  @Override
  public Void visitFor(Statement.For forStatement) {
    String variable = forStatement.variable();
    String head = newLabel("head");
    String body = newLabel("body");
    String cont = newLabel("cont");
    String exit = newLabel("exit");
    emit(new IrInstr.Assign(variable, operand(forStatement.from())));
    emit(new IrInstr.Label(head));
    String limit = operand(forStatement.to());
    String inRange = newTemp();
    Operator rangeTest = isNegativeLiteral(forStatement.step()) ? Operator.GE : Operator.LE;
    emit(new IrInstr.BinOp(inRange, rangeTest, variable, limit));
    emit(new IrInstr.BranchCond(inRange, body, exit));
    emit(new IrInstr.Label(body));
    loopBody(forStatement.body(), cont, exit);
    emit(new IrInstr.Label(cont));
    String step = (forStatement.step() == null) ? "1" : operand(forStatement.step());
    emit(new IrInstr.BinOp(variable, Operator.ADD, variable, step));
    emit(new IrInstr.Goto(head));
    emit(new IrInstr.Label(exit));
    return null;
  }

  /**
   * True for a step written as a negative constant ({@code BY -1}). Any other step is assumed to
   * count upward.
   */
  private static boolean isNegativeLiteral(@Nullable Expr step) {
    if (step instanceof Expr.UnaryOp unary && unary.op() == PrefixOperator.NEG) {
      return unary.operand() instanceof Expr.Literal;
    }
    return step instanceof Expr.Literal literal && literal.raw().startsWith("-");
  }

  @Override
  public Void visitWhile(Statement.While whileStatement) {
    String head = newLabel("head");
    String body = newLabel("body");
    String exit = newLabel("exit");
    emit(new IrInstr.Label(head));
    emit(new IrInstr.BranchCond(operand(whileStatement.cond()), body, exit));
    emit(new IrInstr.Label(body));
    loopBody(whileStatement.body(), head, exit);
    emit(new IrInstr.Goto(head));
    emit(new IrInstr.Label(exit));
    return null;
  }

  @Override
  public Void visitRepeat(Statement.Repeat repeat) {
    String body = newLabel("body");
    String cont = newLabel("cont");
    String exit = newLabel("exit");
    emit(new IrInstr.Label(body));
    loopBody(repeat.body(), cont, exit);
    emit(new IrInstr.Label(cont));
    emit(new IrInstr.BranchCond(operand(repeat.until()), exit, body));
    emit(new IrInstr.Label(exit));
    return null;
  }

  private void loopBody(List<Statement> body, String continueLabel, String exitLabel) {
    loops.push(new LoopLabels(continueLabel, exitLabel));
    emitAll(body);
    loops.pop();
  }

  @Override
  public Void visitCall(Statement.Call call) {
    emit(new IrInstr.Call(null, call.name(), arguments(call.args())));
    return null;
  }

  @Override
  public Void visitReturn(Statement.Return returnStatement) {
    sawReturn = true;
    emit(new IrInstr.Goto(RETURN_LABEL));
    return null;
  }

  @Override
  public Void visitExit(Statement.Exit exit) {
    checkState(!loops.isEmpty(), "EXIT outside of a loop");
    emit(new IrInstr.Goto(loops.peek().exitLabel()));
    return null;
  }

  @Override
  public Void visitContinue(Statement.Continue continueStatement) {
    checkState(!loops.isEmpty(), "CONTINUE outside of a loop");
    emit(new IrInstr.Goto(loops.peek().continueLabel()));
    return null;
  }

  private ImmutableList<String> arguments(List<Argument> args) {
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    for (Argument arg : args) {
      String value = operand(arg.value());
      if (arg.name() == null) {
        builder.add(value);
      } else {
        builder.add(arg.name() + (arg.output() ? " => " : " := ") + value);
      }
    }
    return builder.build();
  }

  @Override
  public String visitVar(Expr.Var var) {
    return var.name();
  }

  @Override
  public String visitLiteral(Expr.Literal literal) {
    return literal.raw();
  }

  @Override
  public String visitBinOp(Expr.BinOp binOp) {
    String left = operand(binOp.left());
    String right = operand(binOp.right());
    String dest = newTemp();
    emit(new IrInstr.BinOp(dest, binOp.op(), left, right));
    return dest;
  }

  @Override
  public String visitUnaryOp(Expr.UnaryOp unaryOp) {
    String value = operand(unaryOp.operand());
    String dest = newTemp();
    emit(new IrInstr.Unary(dest, unaryOp.op(), value));
    return dest;
  }

  @Override
  public String visitCall(Expr.Call call) {
    ImmutableList<String> args = arguments(call.args());
    String dest = newTemp();
    emit(new IrInstr.Call(dest, call.name(), args));
    return dest;
  }

  @Override
  public String visitIndex(Expr.Index index) {
    String base = operand(index.base());
    List<String> subscripts = new ArrayList<>();
    index.indices().forEach(i -> subscripts.add(operand(i)));
    return base + "[" + String.join(", ", subscripts) + "]";
  }

  @Override
  public String visitMember(Expr.Member member) {
    return operand(member.base()) + "." + member.field();
  }
}
