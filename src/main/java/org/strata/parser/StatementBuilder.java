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

package org.strata.parser;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.strata.ast.Expr;
import org.strata.ast.Statement;
import org.strata.parser.StructuredTextParser.AssignStatementContext;
import org.strata.parser.StructuredTextParser.CallStatementContext;
import org.strata.parser.StructuredTextParser.CaseEntryContext;
import org.strata.parser.StructuredTextParser.CaseLabelContext;
import org.strata.parser.StructuredTextParser.CaseStatementContext;
import org.strata.parser.StructuredTextParser.ContinueStatementContext;
import org.strata.parser.StructuredTextParser.ExitStatementContext;
import org.strata.parser.StructuredTextParser.ExpressionContext;
import org.strata.parser.StructuredTextParser.ForStatementContext;
import org.strata.parser.StructuredTextParser.IfStatementContext;
import org.strata.parser.StructuredTextParser.RepeatStatementContext;
import org.strata.parser.StructuredTextParser.ReturnStatementContext;
import org.strata.parser.StructuredTextParser.StatementListContext;
import org.strata.parser.StructuredTextParser.WhileStatementContext;

/** Builds {@link Statement}s. */
class StatementBuilder extends VisitorBase<Statement> {
  private final ExpressionBuilder expressions;

  StatementBuilder(ExpressionBuilder expressions) {
    this.expressions = expressions;
  }

  /** Returns the statements of a (possibly absent) statement list. */
  ImmutableList<Statement> statements(@Nullable StatementListContext ctx) {
    if (ctx == null) {
      return ImmutableList.of();
    }
    return ctx.statement().stream().map(this::visit).collect(ImmutableList.toImmutableList());
  }

  private Expr expression(ExpressionContext ctx) {
    return expressions.visit(ctx);
  }

  @Override
  public Statement visitAssignStatement(AssignStatementContext ctx) {
    return new Statement.Assign(expressions.visit(ctx.target), expression(ctx.value));
  }

  @Override
  public Statement visitIfStatement(IfStatementContext ctx) {
    List<ExpressionContext> conds = ctx.conds;
    List<StatementListContext> bodies = ctx.bodies;
    ImmutableList.Builder<Statement.ConditionalBody> elifs = ImmutableList.builder();
    for (int i = 1; i < conds.size(); i++) {
      elifs.add(
          new Statement.ConditionalBody(expression(conds.get(i)), statements(bodies.get(i))));
    }
    return new Statement.If(
        expression(conds.get(0)),
        statements(bodies.get(0)),
        elifs.build(),
        statements(ctx.elseBody));
  }

  @Override
  public Statement visitCaseStatement(CaseStatementContext ctx) {
    ImmutableList.Builder<Statement.CaseEntry> entries = ImmutableList.builder();
    for (CaseEntryContext entry : ctx.caseEntry()) {
      // Labels are kept as written ("1", "2..5", "-3", "Idle"); getText() drops the whitespace.
      ImmutableList<String> values =
          entry.caseLabel().stream()
              .map(CaseLabelContext::getText)
              .collect(ImmutableList.toImmutableList());
      entries.add(new Statement.CaseEntry(values, statements(entry.statementList())));
    }
    return new Statement.Case(expression(ctx.selector), entries.build(), statements(ctx.elseBody));
  }

  @Override
  public Statement visitForStatement(ForStatementContext ctx) {
    Expr step = (ctx.step == null) ? null : expression(ctx.step);
    return new Statement.For(
        ctx.variable.getText(),
        expression(ctx.from),
        expression(ctx.to),
        step,
        statements(ctx.statementList()));
  }

  @Override
  public Statement visitWhileStatement(WhileStatementContext ctx) {
    return new Statement.While(expression(ctx.cond), statements(ctx.statementList()));
  }

  @Override
  public Statement visitRepeatStatement(RepeatStatementContext ctx) {
    return new Statement.Repeat(statements(ctx.statementList()), expression(ctx.cond));
  }

  @Override
  public Statement visitCallStatement(CallStatementContext ctx) {
    return new Statement.Call(
        ctx.name.getText(), expressions.callArguments(ctx.callArgumentList()));
  }

  @Override
  public Statement visitReturnStatement(ReturnStatementContext ctx) {
    return new Statement.Return();
  }

  @Override
  public Statement visitExitStatement(ExitStatementContext ctx) {
    return new Statement.Exit();
  }

  @Override
  public Statement visitContinueStatement(ContinueStatementContext ctx) {
    return new Statement.Continue();
  }
}
