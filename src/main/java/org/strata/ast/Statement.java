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

package org.strata.ast;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * A Structured Text statement.
 *
 * <p>Nested statement lists are always non-null; an absent ELSE is an empty {@code elseBody}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
  @JsonSubTypes.Type(Statement.Assign.class),
  @JsonSubTypes.Type(Statement.If.class),
  @JsonSubTypes.Type(Statement.Case.class),
  @JsonSubTypes.Type(Statement.For.class),
  @JsonSubTypes.Type(Statement.While.class),
  @JsonSubTypes.Type(Statement.Repeat.class),
  @JsonSubTypes.Type(Statement.Call.class),
  @JsonSubTypes.Type(Statement.Return.class),
  @JsonSubTypes.Type(Statement.Exit.class),
  @JsonSubTypes.Type(Statement.Continue.class)
})
public sealed interface Statement {

  <T> T accept(Visitor<T> visitor);

  /** One method per kind of Statement. */
  interface Visitor<T> {
    T visitAssign(Assign assign);

    T visitIf(If ifStatement);

    T visitCase(Case caseStatement);

    T visitFor(For forStatement);

    T visitWhile(While whileStatement);

    T visitRepeat(Repeat repeat);

    T visitCall(Call call);

    T visitReturn(Return returnStatement);

    T visitExit(Exit exit);

    T visitContinue(Continue continueStatement);
  }

  @JsonTypeName("assign")
  record Assign(Expr target, Expr value) implements Statement {
    public Assign {
      Preconditions.checkArgument(Expr.isPlace(target), "Cannot assign to %s", target);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitAssign(this);
    }
  }

  /** An ELSIF arm. */
  record ConditionalBody(Expr cond, ImmutableList<Statement> body) {}

  @JsonTypeName("if")
  record If(
      Expr cond,
      ImmutableList<Statement> thenBody,
      ImmutableList<ConditionalBody> elifs,
      ImmutableList<Statement> elseBody)
      implements Statement {

    public boolean hasElse() {
      return !elseBody.isEmpty();
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitIf(this);
    }
  }

  /**
   * One arm of a CASE statement. Each value is the label as written: a single constant
   * ({@code "3"}, {@code "Idle"}) or a range ({@code "2..5"}).
   */
  record CaseEntry(ImmutableList<String> values, ImmutableList<Statement> body) {
    public CaseEntry {
      Preconditions.checkArgument(!values.isEmpty(), "A CASE entry needs at least one label");
    }
  }

  @JsonTypeName("case")
  record Case(Expr cond, ImmutableList<CaseEntry> entries, ImmutableList<Statement> elseBody)
      implements Statement {
    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitCase(this);
    }
  }

  @JsonTypeName("for")
  record For(
      String variable, Expr from, Expr to, @Nullable Expr step, ImmutableList<Statement> body)
      implements Statement {
    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitFor(this);
    }
  }

  @JsonTypeName("while")
  record While(Expr cond, ImmutableList<Statement> body) implements Statement {
    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitWhile(this);
    }
  }

  /** {@code REPEAT body UNTIL until END_REPEAT}; the body always runs at least once. */
  @JsonTypeName("repeat")
  record Repeat(ImmutableList<Statement> body, Expr until) implements Statement {
    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitRepeat(this);
    }
  }

  /** A function or function block invocation used as a statement, e.g. {@code timer(IN := x);}. */
  @JsonTypeName("call")
  record Call(String name, ImmutableList<Argument> args) implements Statement {
    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitCall(this);
    }
  }

  @JsonTypeName("return")
  record Return() implements Statement {
    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitReturn(this);
    }
  }

  @JsonTypeName("exit")
  record Exit() implements Statement {
    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitExit(this);
    }
  }

  @JsonTypeName("continue")
  record Continue() implements Statement {
    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitContinue(this);
    }
  }
}
