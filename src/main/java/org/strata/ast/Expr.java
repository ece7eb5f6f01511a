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

/**
 * An expression. Expressions are immutable; rewriting an expression means building a new one.
 *
 * <p>{@link Var}, {@link Index} and {@link Member} are <i>place</i> expressions: they name storage
 * and may appear on the left of an assignment.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
  @JsonSubTypes.Type(Expr.Var.class),
  @JsonSubTypes.Type(Expr.Literal.class),
  @JsonSubTypes.Type(Expr.BinOp.class),
  @JsonSubTypes.Type(Expr.UnaryOp.class),
  @JsonSubTypes.Type(Expr.Call.class),
  @JsonSubTypes.Type(Expr.Index.class),
  @JsonSubTypes.Type(Expr.Member.class)
})
public sealed interface Expr {

  <T> T accept(Visitor<T> visitor);

  /** One method per kind of Expr. */
  interface Visitor<T> {
    T visitVar(Var var);

    T visitLiteral(Literal literal);

    T visitBinOp(BinOp binOp);

    T visitUnaryOp(UnaryOp unaryOp);

    T visitCall(Call call);

    T visitIndex(Index index);

    T visitMember(Member member);
  }

  /** A reference to a variable, in the case it was written. */
  @JsonTypeName("var")
  record Var(String name) implements Expr {
    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitVar(this);
    }
  }

  /** A literal, kept exactly as it appeared in source (e.g. {@code "16#FF"} or {@code "T#5s"}). */
  @JsonTypeName("literal")
  record Literal(String raw) implements Expr {
    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitLiteral(this);
    }
  }

  @JsonTypeName("binop")
  record BinOp(Operator op, Expr left, Expr right) implements Expr {
    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitBinOp(this);
    }
  }

  @JsonTypeName("unaryop")
  record UnaryOp(PrefixOperator op, Expr operand) implements Expr {
    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitUnaryOp(this);
    }
  }

  /** A function call used as a value. */
  @JsonTypeName("call")
  record Call(String name, ImmutableList<Argument> args) implements Expr {
    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitCall(this);
    }
  }

  @JsonTypeName("index")
  record Index(Expr base, ImmutableList<Expr> indices) implements Expr {
    public Index {
      Preconditions.checkArgument(isPlace(base), "Index base must be a place");
      Preconditions.checkArgument(!indices.isEmpty(), "Index needs at least one subscript");
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitIndex(this);
    }
  }

  /** A structure field or function block output, {@code base.field}. */
  @JsonTypeName("member")
  record Member(Expr base, String field) implements Expr {
    public Member {
      Preconditions.checkArgument(isPlace(base), "Member base must be a place");
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitMember(this);
    }
  }

  /** True if {@code expr} names storage. */
  static boolean isPlace(Expr expr) {
    return expr instanceof Var || expr instanceof Index || expr instanceof Member;
  }

  /**
   * Returns the variable at the root of a place expression: {@code a} for {@code a}, {@code a[i]}
   * and {@code a.b[2].c}.
   */
  static String rootName(Expr place) {
    Expr e = place;
    while (true) {
      if (e instanceof Var var) {
        return var.name();
      } else if (e instanceof Index index) {
        e = index.base();
      } else if (e instanceof Member member) {
        e = member.base();
      } else {
        throw new IllegalArgumentException("Not a place expression: " + place);
      }
    }
  }
}
