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

package org.strata.analysis;

import com.google.common.collect.ImmutableSet;
import java.util.List;
import org.strata.ast.Argument;
import org.strata.ast.Expr;
import org.strata.ast.Statement;

/**
 * Decides whether two adjacent statements may be exchanged.
 *
 * <p>Two statements conflict if one writes a variable the other reads or writes. A <i>barrier</i>
 * is a statement that must never move regardless of its variables: anything containing a call,
 * whose side effects are unknown, or a RETURN, EXIT or CONTINUE, which decide whether later
 * statements run at all.
 */
public final class Hazards {

  // Static methods only
  private Hazards() {}

  /** True if {@code a} and {@code b} have a RAW, WAR or WAW dependence, ignoring case. */
  public static boolean conflict(Statement a, Statement b) {
    ImmutableSet<String> writesA = Dependencies.writeVars(a);
    ImmutableSet<String> writesB = Dependencies.writeVars(b);
    return Names.intersect(writesA, Dependencies.readVars(b))
        || Names.intersect(Dependencies.readVars(a), writesB)
        || Names.intersect(writesA, writesB);
  }

  public static boolean isBarrier(Statement statement) {
    return statement.accept(BARRIER_FINDER);
  }

  /** True if {@code a} and {@code b}, in either order, have the same effect. */
  public static boolean canSwap(Statement a, Statement b) {
    return !isBarrier(a) && !isBarrier(b) && !conflict(a, b);
  }

  private static final BarrierFinder BARRIER_FINDER = new BarrierFinder();

  /** Stateless, so a single instance is shared. */
  private static class BarrierFinder
      implements Statement.Visitor<Boolean>, Expr.Visitor<Boolean> {

    boolean any(List<Statement> statements) {
      return statements.stream().anyMatch(s -> s.accept(this));
    }

    boolean anyArg(List<Argument> args) {
      return args.stream().anyMatch(arg -> arg.value().accept(this));
    }

    @Override
    public Boolean visitAssign(Statement.Assign assign) {
      return assign.target().accept(this) || assign.value().accept(this);
    }

    @Override
    public Boolean visitIf(Statement.If ifStatement) {
      return ifStatement.cond().accept(this)
          || any(ifStatement.thenBody())
          || ifStatement.elifs().stream().anyMatch(e -> e.cond().accept(this) || any(e.body()))
          || any(ifStatement.elseBody());
    }

    @Override
    public Boolean visitCase(Statement.Case caseStatement) {
      return caseStatement.cond().accept(this)
          || caseStatement.entries().stream().anyMatch(e -> any(e.body()))
          || any(caseStatement.elseBody());
    }

    @Override
    public Boolean visitFor(Statement.For forStatement) {
      return forStatement.from().accept(this)
          || forStatement.to().accept(this)
          || (forStatement.step() != null && forStatement.step().accept(this))
          || any(forStatement.body());
    }

    @Override
    public Boolean visitWhile(Statement.While whileStatement) {
      return whileStatement.cond().accept(this) || any(whileStatement.body());
    }

    @Override
    public Boolean visitRepeat(Statement.Repeat repeat) {
      return any(repeat.body()) || repeat.until().accept(this);
    }

    @Override
    public Boolean visitCall(Statement.Call call) {
      return true;
    }

    @Override
    public Boolean visitReturn(Statement.Return returnStatement) {
      return true;
    }

    @Override
    public Boolean visitExit(Statement.Exit exit) {
      return true;
    }

    @Override
    public Boolean visitContinue(Statement.Continue continueStatement) {
      return true;
    }

    @Override
    public Boolean visitVar(Expr.Var var) {
      return false;
    }

    @Override
    public Boolean visitLiteral(Expr.Literal literal) {
      return false;
    }

    @Override
    public Boolean visitBinOp(Expr.BinOp binOp) {
      return binOp.left().accept(this) || binOp.right().accept(this);
    }

    @Override
    public Boolean visitUnaryOp(Expr.UnaryOp unaryOp) {
      return unaryOp.operand().accept(this);
    }

    @Override
    public Boolean visitCall(Expr.Call call) {
      return true;
    }

    @Override
    public Boolean visitIndex(Expr.Index index) {
      return index.base().accept(this) || index.indices().stream().anyMatch(i -> i.accept(this));
    }

    @Override
    public Boolean visitMember(Expr.Member member) {
      return member.base().accept(this);
    }
  }
}
