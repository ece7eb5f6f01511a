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

package org.strata.slicer;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.strata.analysis.Dependencies;
import org.strata.analysis.Names;
import org.strata.ast.Ast;
import org.strata.ast.Expr;
import org.strata.ast.ProgramUnit;
import org.strata.ast.Statement;

/**
 * Backward slicing: keeps the statements that may affect the final values of a set of seed
 * variables.
 *
 * <p>The slice is conservative. A variable, once relevant, stays relevant even past an assignment
 * to it, since a statement list does not tell us which assignments always execute. Statements
 * are kept in their original order.
 */
public final class Slicer {

  // Static methods only
  private Slicer() {}

  /** Returns the statements of {@code body} that may affect any of {@code seeds}. */
  public static ImmutableList<Statement> backwardSlice(List<Statement> body, Set<String> seeds) {
    Set<String> relevant = new HashSet<>(Names.canonical(seeds));
    return new Scope(relevant, false).slice(body);
  }

  /** Slices the body of every unit, keeping all declarations. */
  public static Ast slice(Ast ast, Set<String> seeds) {
    return new Ast(
        ast.units().stream()
            .map(unit -> sliceUnit(unit, seeds))
            .collect(ImmutableList.toImmutableList()));
  }

  public static ProgramUnit sliceUnit(ProgramUnit unit, Set<String> seeds) {
    return unit.withBody(backwardSlice(unit.body(), seeds));
  }

  /**
   * Slices one statement list. {@code relevant} holds canonical names and grows as statements are
   * kept; {@code laterKept} is true if a statement that runs after this list (in an enclosing
   * list) has been kept.
   */
  private static class Scope implements Statement.Visitor<@Nullable Statement> {
    final Set<String> relevant;
    final boolean laterKept;

    /** True once any statement of this list, at or after the current one, has been kept. */
    boolean keptHere;

    Scope(Set<String> relevant, boolean laterKept) {
      this.relevant = relevant;
      this.laterKept = laterKept;
    }

    ImmutableList<Statement> slice(List<Statement> statements) {
      List<Statement> kept = new ArrayList<>();
      for (int i = statements.size() - 1; i >= 0; i--) {
        Statement s = statements.get(i).accept(this);
        if (s != null) {
          kept.add(s);
          keptHere = true;
        }
      }
      return ImmutableList.copyOf(kept).reverse();
    }

    /** Slices a nested list that runs before the statements already scanned in this list. */
    private ImmutableList<Statement> nested(List<Statement> statements, Set<String> rel) {
      return new Scope(rel, laterKept || keptHere).slice(statements);
    }

    private boolean later() {
      return laterKept || keptHere;
    }

    private void addReads(Expr expr) {
      relevant.addAll(Names.canonical(Dependencies.readVars(expr)));
    }

    @Override
    public @Nullable Statement visitAssign(Statement.Assign assign) {
      if (!relevant.contains(Names.canonical(Expr.rootName(assign.target())))) {
        return null;
      }
      relevant.addAll(Names.canonical(Dependencies.readVars(assign)));
      return assign;
    }

    @Override
    public @Nullable Statement visitIf(Statement.If ifStatement) {
      Set<String> snapshot = Set.copyOf(relevant);
      Set<String> union = new HashSet<>();
      boolean any = false;

      Set<String> rel = new HashSet<>(snapshot);
      ImmutableList<Statement> thenBody = nested(ifStatement.thenBody(), rel);
      union.addAll(rel);
      any |= !thenBody.isEmpty();

      ImmutableList.Builder<Statement.ConditionalBody> elifs = ImmutableList.builder();
      for (Statement.ConditionalBody elif : ifStatement.elifs()) {
        rel = new HashSet<>(snapshot);
        ImmutableList<Statement> body = nested(elif.body(), rel);
        union.addAll(rel);
        any |= !body.isEmpty();
        elifs.add(new Statement.ConditionalBody(elif.cond(), body));
      }

      rel = new HashSet<>(snapshot);
      ImmutableList<Statement> elseBody = nested(ifStatement.elseBody(), rel);
      union.addAll(rel);
      any |= !elseBody.isEmpty();

      if (!any) {
        return null;
      }
      relevant.addAll(union);
      addReads(ifStatement.cond());
      ifStatement.elifs().forEach(elif -> addReads(elif.cond()));
      return new Statement.If(ifStatement.cond(), thenBody, elifs.build(), elseBody);
    }

    @Override
    public @Nullable Statement visitCase(Statement.Case caseStatement) {
      Set<String> snapshot = Set.copyOf(relevant);
      Set<String> union = new HashSet<>();
      boolean any = false;

      ImmutableList.Builder<Statement.CaseEntry> entries = ImmutableList.builder();
      for (Statement.CaseEntry entry : caseStatement.entries()) {
        Set<String> rel = new HashSet<>(snapshot);
        ImmutableList<Statement> body = nested(entry.body(), rel);
        union.addAll(rel);
        any |= !body.isEmpty();
        entries.add(new Statement.CaseEntry(entry.values(), body));
      }
      Set<String> rel = new HashSet<>(snapshot);
      ImmutableList<Statement> elseBody = nested(caseStatement.elseBody(), rel);
      union.addAll(rel);
      any |= !elseBody.isEmpty();

      if (!any) {
        return null;
      }
      relevant.addAll(union);
      addReads(caseStatement.cond());
      return new Statement.Case(caseStatement.cond(), entries.build(), elseBody);
    }

    /**
     * Slices a loop body to a fixpoint, so that values carried from one iteration to the next are
     * accounted for. Returns null if nothing in the loop is relevant and {@code keep} is false.
     */
    private @Nullable ImmutableList<Statement> loopBody(
        List<Statement> body, List<Expr> header, boolean keep) {
      Set<String> rel = new HashSet<>(relevant);
      ImmutableList<Statement> sliced;
      while (true) {
        int sizeBefore = rel.size();
        boolean keepBefore = keep;
        // Once the loop is kept, its EXITs and CONTINUEs decide which iterations run.
        sliced = new Scope(rel, keep || later()).slice(body);
        if (!sliced.isEmpty()) {
          keep = true;
        }
        if (keep) {
          header.forEach(e -> rel.addAll(Names.canonical(Dependencies.readVars(e))));
        }
        if (rel.size() == sizeBefore && keep == keepBefore) {
          break;
        }
      }
      if (!keep) {
        return null;
      }
      relevant.addAll(rel);
      return sliced;
    }

    @Override
    public @Nullable Statement visitFor(Statement.For forStatement) {
      List<Expr> header = new ArrayList<>();
      header.add(forStatement.from());
      header.add(forStatement.to());
      if (forStatement.step() != null) {
        header.add(forStatement.step());
      }
      boolean variableRelevant = relevant.contains(Names.canonical(forStatement.variable()));
      ImmutableList<Statement> body = loopBody(forStatement.body(), header, variableRelevant);
      if (body == null) {
        return null;
      }
      return new Statement.For(
          forStatement.variable(),
          forStatement.from(),
          forStatement.to(),
          forStatement.step(),
          body);
    }

    @Override
    public @Nullable Statement visitWhile(Statement.While whileStatement) {
      ImmutableList<Statement> body =
          loopBody(whileStatement.body(), List.of(whileStatement.cond()), false);
      return (body == null) ? null : new Statement.While(whileStatement.cond(), body);
    }

    @Override
    public @Nullable Statement visitRepeat(Statement.Repeat repeat) {
      ImmutableList<Statement> body = loopBody(repeat.body(), List.of(repeat.until()), false);
      return (body == null) ? null : new Statement.Repeat(body, repeat.until());
    }

    @Override
    public @Nullable Statement visitCall(Statement.Call call) {
      boolean bindsRelevant = Names.intersect(relevant, Dependencies.writeVars(call));
      if (!bindsRelevant && !relevant.contains(Names.canonical(call.name()))) {
        return null;
      }
      // The outputs depend on the instance's earlier calls.
      relevant.add(Names.canonical(call.name()));
      relevant.addAll(Names.canonical(Dependencies.readVars(call)));
      return call;
    }

    @Override
    public @Nullable Statement visitReturn(Statement.Return returnStatement) {
      return later() ? returnStatement : null;
    }

    @Override
    public @Nullable Statement visitExit(Statement.Exit exit) {
      return later() ? exit : null;
    }

    @Override
    public @Nullable Statement visitContinue(Statement.Continue continueStatement) {
      return later() ? continueStatement : null;
    }
  }
}
