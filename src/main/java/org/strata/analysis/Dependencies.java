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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.strata.ast.Argument;
import org.strata.ast.Expr;
import org.strata.ast.Statement;

/**
 * Computes the variables read and written by statements and expressions. Names are returned as
 * written in the source, in first-occurrence order; callers that compare them should use {@link
 * Names#canonical}.
 *
 * <p>The sets are recomputed on every call. Function and function block calls are assumed not to
 * write any variable visible to the caller, except the targets of their output arguments ({@code Q
 * => done} writes {@code done}).
 */
public final class Dependencies {

  // Static methods only
  private Dependencies() {}

  public static ImmutableSet<String> readVars(Statement statement) {
    ReadCollector collector = new ReadCollector();
    statement.accept(collector);
    return ImmutableSet.copyOf(collector.names);
  }

  public static ImmutableSet<String> readVars(Expr expr) {
    ReadCollector collector = new ReadCollector();
    expr.accept(collector);
    return ImmutableSet.copyOf(collector.names);
  }

  public static ImmutableSet<String> readVars(List<Statement> statements) {
    ReadCollector collector = new ReadCollector();
    collector.addAll(statements);
    return ImmutableSet.copyOf(collector.names);
  }

  public static ImmutableSet<String> writeVars(Statement statement) {
    WriteCollector collector = new WriteCollector();
    statement.accept(collector);
    return ImmutableSet.copyOf(collector.names);
  }

  /** Expressions have no side effects on variables, so this is always empty. */
  public static ImmutableSet<String> writeVars(Expr expr) {
    return ImmutableSet.of();
  }

  public static ImmutableSet<String> writeVars(List<Statement> statements) {
    WriteCollector collector = new WriteCollector();
    collector.addAll(statements);
    return ImmutableSet.copyOf(collector.names);
  }

  /** Returns {@code readVars(statements) ∪ writeVars(statements)}. */
  public static ImmutableSet<String> referencedVars(List<Statement> statements) {
    return ImmutableSet.<String>builder()
        .addAll(readVars(statements))
        .addAll(writeVars(statements))
        .build();
  }

  private static class ReadCollector implements Statement.Visitor<Void>, Expr.Visitor<Void> {
    final Set<String> names = new LinkedHashSet<>();

    void addAll(List<Statement> statements) {
      statements.forEach(s -> s.accept(this));
    }

    /** An output argument's target is written, not read; only its subscripts are read. */
    void addArgs(List<Argument> args) {
      for (Argument arg : args) {
        if (arg.output()) {
          addSubscripts(arg.value());
        } else {
          arg.value().accept(this);
        }
      }
    }

    /** Adds the subscripts of a place expression but not the variable it names. */
    void addSubscripts(Expr place) {
      if (place instanceof Expr.Index index) {
        addSubscripts(index.base());
        index.indices().forEach(i -> i.accept(this));
      } else if (place instanceof Expr.Member member) {
        addSubscripts(member.base());
      }
    }

    @Override
    public Void visitAssign(Statement.Assign assign) {
      addSubscripts(assign.target());
      assign.value().accept(this);
      return null;
    }

    @Override
    public Void visitIf(Statement.If ifStatement) {
      ifStatement.cond().accept(this);
      addAll(ifStatement.thenBody());
      for (Statement.ConditionalBody elif : ifStatement.elifs()) {
        elif.cond().accept(this);
        addAll(elif.body());
      }
      addAll(ifStatement.elseBody());
      return null;
    }

    @Override
    public Void visitCase(Statement.Case caseStatement) {
      caseStatement.cond().accept(this);
      caseStatement.entries().forEach(entry -> addAll(entry.body()));
      addAll(caseStatement.elseBody());
      return null;
    }

    @Override
    public Void visitFor(Statement.For forStatement) {
      forStatement.from().accept(this);
      forStatement.to().accept(this);
      if (forStatement.step() != null) {
        forStatement.step().accept(this);
      }
      addAll(forStatement.body());
      return null;
    }

    @Override
    public Void visitWhile(Statement.While whileStatement) {
      whileStatement.cond().accept(this);
      addAll(whileStatement.body());
      return null;
    }

    @Override
    public Void visitRepeat(Statement.Repeat repeat) {
      addAll(repeat.body());
      repeat.until().accept(this);
      return null;
    }

    @Override
    public Void visitCall(Statement.Call call) {
      addArgs(call.args());
      return null;
    }

    @Override
    public Void visitReturn(Statement.Return returnStatement) {
      return null;
    }

    @Override
    public Void visitExit(Statement.Exit exit) {
      return null;
    }

    @Override
    public Void visitContinue(Statement.Continue continueStatement) {
      return null;
    }

    @Override
    public Void visitVar(Expr.Var var) {
      names.add(var.name());
      return null;
    }

    @Override
    public Void visitLiteral(Expr.Literal literal) {
      return null;
    }

    @Override
    public Void visitBinOp(Expr.BinOp binOp) {
      binOp.left().accept(this);
      binOp.right().accept(this);
      return null;
    }

    @Override
    public Void visitUnaryOp(Expr.UnaryOp unaryOp) {
      unaryOp.operand().accept(this);
      return null;
    }

    @Override
    public Void visitCall(Expr.Call call) {
      addArgs(call.args());
      return null;
    }

    @Override
    public Void visitIndex(Expr.Index index) {
      index.base().accept(this);
      index.indices().forEach(i -> i.accept(this));
      return null;
    }

    @Override
    public Void visitMember(Expr.Member member) {
      member.base().accept(this);
      return null;
    }
  }

  private static class WriteCollector implements Statement.Visitor<Void> {
    final Set<String> names = new LinkedHashSet<>();

    void addAll(List<Statement> statements) {
      statements.forEach(s -> s.accept(this));
    }

    @Override
    public Void visitAssign(Statement.Assign assign) {
      names.add(Expr.rootName(assign.target()));
      return null;
    }

    @Override
    public Void visitIf(Statement.If ifStatement) {
      addAll(ifStatement.thenBody());
      ifStatement.elifs().forEach(elif -> addAll(elif.body()));
      addAll(ifStatement.elseBody());
      return null;
    }

    @Override
    public Void visitCase(Statement.Case caseStatement) {
      caseStatement.entries().forEach(entry -> addAll(entry.body()));
      addAll(caseStatement.elseBody());
      return null;
    }

    @Override
    public Void visitFor(Statement.For forStatement) {
      names.add(forStatement.variable());
      addAll(forStatement.body());
      return null;
    }

    @Override
    public Void visitWhile(Statement.While whileStatement) {
      addAll(whileStatement.body());
      return null;
    }

    @Override
    public Void visitRepeat(Statement.Repeat repeat) {
      addAll(repeat.body());
      return null;
    }

    @Override
    public Void visitCall(Statement.Call call) {
      call.args().stream()
          .filter(arg -> arg.output())
          .forEach(arg -> names.add(Expr.rootName(arg.value())));
      return null;
    }

    @Override
    public Void visitReturn(Statement.Return returnStatement) {
      return null;
    }

    @Override
    public Void visitExit(Statement.Exit exit) {
      return null;
    }

    @Override
    public Void visitContinue(Statement.Continue continueStatement) {
      return null;
    }
  }
}
