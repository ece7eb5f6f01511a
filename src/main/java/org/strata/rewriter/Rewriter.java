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

package org.strata.rewriter;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import java.util.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.strata.ToolkitOptions;
import org.strata.analysis.Dependencies;
import org.strata.analysis.Hazards;
import org.strata.analysis.Names;
import org.strata.ast.Argument;
import org.strata.ast.Ast;
import org.strata.ast.Expr;
import org.strata.ast.PrefixOperator;
import org.strata.ast.ProgramUnit;
import org.strata.ast.Qualifier;
import org.strata.ast.Statement;
import org.strata.ast.VarBlock;
import org.strata.ast.VarDecl;

/**
 * Applies random semantics-preserving mutations to an Ast:
 *
 * <ul>
 *   <li>swapping the operands of {@code + * AND OR};
 *   <li>inverting an IF/ELSE (negating the condition and exchanging the branches);
 *   <li>renaming local variables consistently throughout their unit;
 *   <li>exchanging adjacent statements that have no data dependence on each other.
 * </ul>
 *
 * <p>Mutations are applied bottom-up and every random choice is drawn from the generator passed
 * to the constructor, so a Rewriter built with a given seed always produces the same result. The
 * input Ast is never modified.
 */
public final class Rewriter {
  private static final Logger LOGGER = LoggerFactory.getLogger(Rewriter.class);

  private final RandomGenerator random;
  private final ToolkitOptions options;

  public Rewriter(RandomGenerator random, ToolkitOptions options) {
    this.random = random;
    this.options = options;
  }

  public Ast rewrite(Ast ast) {
    List<String> unitNames = new ArrayList<>();
    ast.units().forEach(unit -> unitNames.add(unit.name()));
    ImmutableList.Builder<ProgramUnit> units = ImmutableList.builder();
    for (ProgramUnit unit : ast.units()) {
      units.add(rewrite(unit, unitNames));
    }
    return new Ast(units.build());
  }

  /**
   * Rewrites one unit with a fresh RenameMap.
   *
   * @param reserved additional names (such as other units) that renamed variables must avoid
   */
  ProgramUnit rewrite(ProgramUnit unit, Iterable<String> reserved) {
    RenameMap renames = chooseRenames(unit, reserved);
    if (!renames.isEmpty()) {
      LOGGER.debug("Renaming in {}: {}", unit.name(), renames);
    }
    UnitRewriter rewriter = new UnitRewriter(renames);
    ImmutableList<VarBlock> varBlocks =
        unit.varBlocks().stream()
            .map(rewriter::varBlock)
            .collect(ImmutableList.toImmutableList());
    return unit.withVarBlocks(varBlocks).withBody(rewriter.statements(unit.body()));
  }

  /**
   * True if the rewriter may rename a variable with this declaration. Only private variables
   * are renamed; names written entirely in upper case are left alone, as are single characters.
   */
  static boolean isRenameable(ProgramUnit.Declaration declaration) {
    String name = declaration.decl().name();
    return declaration.storage().isLocal()
        && declaration.qualifier() != Qualifier.CONSTANT
        && name.length() > 1
        && !name.equals(Ascii.toUpperCase(name));
  }

  private RenameMap chooseRenames(ProgramUnit unit, Iterable<String> reserved) {
    Set<String> taken = new LinkedHashSet<>();
    reserved.forEach(taken::add);
    taken.add(unit.name());
    unit.declarations().forEach(d -> taken.add(d.decl().name()));
    taken.addAll(Dependencies.referencedVars(unit.body()));
    RenameMap renames = new RenameMap(taken);
    Set<String> decided = new HashSet<>();
    for (ProgramUnit.Declaration declaration : unit.declarations()) {
      String name = declaration.decl().name();
      if (!isRenameable(declaration) || !decided.add(Names.canonical(name))) {
        continue;
      }
      if (random.nextDouble() < options.renameProbability()) {
        attempt("rename of " + name, null, () -> renames.assign(name, options.renamePrefix()));
      }
    }
    return renames;
  }

  /**
   * Returns the result of {@code mutation}, or {@code original} if the mutation's guard fails.
   */
  @CanIgnoreReturnValue
  private static <T> T attempt(String description, T original, Supplier<T> mutation) {
    try {
      return mutation.get();
    } catch (RewriteGuardViolation e) {
      LOGGER.debug("Skipped {}: {}", description, e.getMessage());
      return original;
    }
  }

  static Expr.BinOp commute(Expr.BinOp binOp) {
    RewriteGuardViolation.check(binOp.op().isSwappable(), "%s is not swappable", binOp.op());
    return new Expr.BinOp(binOp.op(), binOp.right(), binOp.left());
  }

  static Statement.If invert(Statement.If ifStatement) {
    RewriteGuardViolation.check(ifStatement.elifs().isEmpty(), "IF has ELSIF arms");
    RewriteGuardViolation.check(ifStatement.hasElse(), "IF has no ELSE");
    return new Statement.If(
        new Expr.UnaryOp(PrefixOperator.NOT, ifStatement.cond()),
        ifStatement.elseBody(),
        ImmutableList.of(),
        ifStatement.thenBody());
  }

  /** Exchanges {@code statements[i]} and {@code statements[i + 1]}. */
  static void swap(List<Statement> statements, int i) {
    Statement first = statements.get(i);
    Statement second = statements.get(i + 1);
    RewriteGuardViolation.check(
        !Hazards.isBarrier(first) && !Hazards.isBarrier(second), "Statement is a barrier");
    RewriteGuardViolation.check(!Hazards.conflict(first, second), "Statements are dependent");
    Collections.swap(statements, i, i + 1);
  }

  /** Rewrites the statements and expressions of a single unit. */
  private class UnitRewriter implements Statement.Visitor<Statement>, Expr.Visitor<Expr> {
    final RenameMap renames;

    UnitRewriter(RenameMap renames) {
      this.renames = renames;
    }

    VarBlock varBlock(VarBlock block) {
      return block.withDecls(
          block.decls().stream().map(this::varDecl).collect(ImmutableList.toImmutableList()));
    }

    private VarDecl varDecl(VarDecl decl) {
      Expr init = (decl.init() == null) ? null : decl.init().accept(this);
      return new VarDecl(renames.apply(decl.name()), decl.type(), init);
    }

    /** Rewrites each statement, then tries {@code size} random swaps of adjacent statements. */
    ImmutableList<Statement> statements(List<Statement> statements) {
      List<Statement> result = new ArrayList<>(statements.size());
      statements.forEach(s -> result.add(s.accept(this)));
      int n = result.size();
      if (n >= 2) {
        for (int attempts = 0; attempts < n; attempts++) {
          int i = random.nextInt(n - 1);
          if (random.nextDouble() < options.swapProbability()) {
            attempt(
                "swap at " + i,
                null,
                () -> {
                  swap(result, i);
                  return null;
                });
          }
        }
      }
      return ImmutableList.copyOf(result);
    }

    private ImmutableList<Argument> arguments(List<Argument> args) {
      return args.stream()
          .map(arg -> arg.withValue(arg.value().accept(this)))
          .collect(ImmutableList.toImmutableList());
    }

    private ImmutableList<Expr> exprs(List<Expr> exprs) {
      return exprs.stream().map(e -> e.accept(this)).collect(ImmutableList.toImmutableList());
    }

    @Override
    public Statement visitAssign(Statement.Assign assign) {
      return new Statement.Assign(assign.target().accept(this), assign.value().accept(this));
    }

    @Override
    public Statement visitIf(Statement.If ifStatement) {
      Expr cond = ifStatement.cond().accept(this);
      ImmutableList<Statement> thenBody = statements(ifStatement.thenBody());
      ImmutableList.Builder<Statement.ConditionalBody> elifs = ImmutableList.builder();
      for (Statement.ConditionalBody elif : ifStatement.elifs()) {
        elifs.add(new Statement.ConditionalBody(elif.cond().accept(this), statements(elif.body())));
      }
      Statement.If result =
          new Statement.If(cond, thenBody, elifs.build(), statements(ifStatement.elseBody()));
      if (random.nextDouble() < options.invertProbability()) {
        return attempt("inversion", result, () -> invert(result));
      }
      return result;
    }

    @Override
    public Statement visitCase(Statement.Case caseStatement) {
      return new Statement.Case(
          caseStatement.cond().accept(this),
          caseStatement.entries().stream()
              .map(e -> new Statement.CaseEntry(e.values(), statements(e.body())))
              .collect(ImmutableList.toImmutableList()),
          statements(caseStatement.elseBody()));
    }

    @Override
    public Statement visitFor(Statement.For forStatement) {
      Expr step = (forStatement.step() == null) ? null : forStatement.step().accept(this);
      return new Statement.For(
          renames.apply(forStatement.variable()),
          forStatement.from().accept(this),
          forStatement.to().accept(this),
          step,
          statements(forStatement.body()));
    }

    @Override
    public Statement visitWhile(Statement.While whileStatement) {
      return new Statement.While(
          whileStatement.cond().accept(this), statements(whileStatement.body()));
    }

    @Override
    public Statement visitRepeat(Statement.Repeat repeat) {
      return new Statement.Repeat(statements(repeat.body()), repeat.until().accept(this));
    }

    @Override
    public Statement visitCall(Statement.Call call) {
      // A function block instance is a variable, so its calls follow its renaming.
      return new Statement.Call(renames.apply(call.name()), arguments(call.args()));
    }

    @Override
    public Statement visitReturn(Statement.Return returnStatement) {
      return returnStatement;
    }

    @Override
    public Statement visitExit(Statement.Exit exit) {
      return exit;
    }

    @Override
    public Statement visitContinue(Statement.Continue continueStatement) {
      return continueStatement;
    }

    @Override
    public Expr visitVar(Expr.Var var) {
      return renames.isRenamed(var.name()) ? new Expr.Var(renames.apply(var.name())) : var;
    }

    @Override
    public Expr visitLiteral(Expr.Literal literal) {
      return literal;
    }

    @Override
    public Expr visitBinOp(Expr.BinOp binOp) {
      Expr.BinOp result =
          new Expr.BinOp(binOp.op(), binOp.left().accept(this), binOp.right().accept(this));
      if (result.op().isSwappable() && random.nextDouble() < options.commuteProbability()) {
        return attempt("commutation", result, () -> commute(result));
      }
      return result;
    }

    @Override
    public Expr visitUnaryOp(Expr.UnaryOp unaryOp) {
      return new Expr.UnaryOp(unaryOp.op(), unaryOp.operand().accept(this));
    }

    @Override
    public Expr visitCall(Expr.Call call) {
      return new Expr.Call(call.name(), arguments(call.args()));
    }

    @Override
    public Expr visitIndex(Expr.Index index) {
      return new Expr.Index(index.base().accept(this), exprs(index.indices()));
    }

    @Override
    public Expr visitMember(Expr.Member member) {
      return new Expr.Member(member.base().accept(this), member.field());
    }
  }
}
