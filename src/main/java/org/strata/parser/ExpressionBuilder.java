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
import org.antlr.v4.runtime.ParserRuleContext;
import org.jspecify.annotations.Nullable;
import org.strata.ast.Argument;
import org.strata.ast.Expr;
import org.strata.ast.Operator;
import org.strata.ast.PrefixOperator;
import org.strata.parser.StructuredTextParser.ArgumentContext;
import org.strata.parser.StructuredTextParser.ArgumentListContext;
import org.strata.parser.StructuredTextParser.BinaryExpressionContext;
import org.strata.parser.StructuredTextParser.CallArgumentContext;
import org.strata.parser.StructuredTextParser.CallArgumentListContext;
import org.strata.parser.StructuredTextParser.CallExpressionContext;
import org.strata.parser.StructuredTextParser.IndexPlaceContext;
import org.strata.parser.StructuredTextParser.InputArgumentContext;
import org.strata.parser.StructuredTextParser.LiteralExpressionContext;
import org.strata.parser.StructuredTextParser.MemberPlaceContext;
import org.strata.parser.StructuredTextParser.NamedArgumentContext;
import org.strata.parser.StructuredTextParser.OutputArgumentContext;
import org.strata.parser.StructuredTextParser.PlaceExpressionContext;
import org.strata.parser.StructuredTextParser.PositionalArgumentContext;
import org.strata.parser.StructuredTextParser.UnaryExpressionContext;
import org.strata.parser.StructuredTextParser.VarPlaceContext;

/** Builds an {@link Expr} from an expression or place parse tree. */
class ExpressionBuilder extends VisitorBase<Expr> {

  @Override
  public Expr visitLiteralExpression(LiteralExpressionContext ctx) {
    return new Expr.Literal(ctx.literal().getText());
  }

  @Override
  public Expr visitPlaceExpression(PlaceExpressionContext ctx) {
    return visit(ctx.place());
  }

  @Override
  public Expr visitCallExpression(CallExpressionContext ctx) {
    return new Expr.Call(ctx.name.getText(), arguments(ctx.argumentList()));
  }

  @Override
  public Expr visitBinaryExpression(BinaryExpressionContext ctx) {
    Operator op = Operator.fromSymbol(ctx.op.getText());
    return new Expr.BinOp(op, visit(ctx.left), visit(ctx.right));
  }

  @Override
  public Expr visitUnaryExpression(UnaryExpressionContext ctx) {
    PrefixOperator op =
        (ctx.op.getType() == StructuredTextParser.NOT) ? PrefixOperator.NOT : PrefixOperator.NEG;
    return new Expr.UnaryOp(op, visit(ctx.operand));
  }

  @Override
  public Expr visitVarPlace(VarPlaceContext ctx) {
    return new Expr.Var(ctx.IDENT().getText());
  }

  @Override
  public Expr visitMemberPlace(MemberPlaceContext ctx) {
    return new Expr.Member(visit(ctx.place()), ctx.field.getText());
  }

  @Override
  public Expr visitIndexPlace(IndexPlaceContext ctx) {
    ImmutableList<Expr> indices =
        ctx.indices.stream().map(this::visit).collect(ImmutableList.toImmutableList());
    return new Expr.Index(visit(ctx.place()), indices);
  }

  /** Returns the arguments of a call; {@code ctx} is null if the parentheses were empty. */
  ImmutableList<Argument> arguments(@Nullable ArgumentListContext ctx) {
    if (ctx == null) {
      return ImmutableList.of();
    }
    return ctx.argument().stream().map(this::argument).collect(ImmutableList.toImmutableList());
  }

  /** Returns the arguments of a call statement, which may include output bindings. */
  ImmutableList<Argument> callArguments(@Nullable CallArgumentListContext ctx) {
    if (ctx == null) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<Argument> builder = ImmutableList.builder();
    for (CallArgumentContext arg : ctx.callArgument()) {
      if (arg instanceof OutputArgumentContext output) {
        builder.add(Argument.output(output.name.getText(), visit(output.target)));
      } else if (arg instanceof InputArgumentContext input) {
        builder.add(argument(input.argument()));
      } else {
        throw unexpected(arg);
      }
    }
    return builder.build();
  }

  private Argument argument(ArgumentContext arg) {
    if (arg instanceof NamedArgumentContext named) {
      return Argument.named(named.name.getText(), visit(named.value));
    } else if (arg instanceof PositionalArgumentContext positional) {
      return Argument.positional(visit(positional.value));
    }
    throw unexpected(arg);
  }

  private static BuildError unexpected(ParserRuleContext arg) {
    return new BuildError(
        "Unexpected argument form", arg.start.getLine(), arg.start.getCharPositionInLine());
  }
}
