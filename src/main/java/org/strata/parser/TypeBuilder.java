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
import org.antlr.v4.runtime.Token;
import org.strata.ast.Expr;
import org.strata.ast.TypeRef;
import org.strata.ast.VarDecl;
import org.strata.parser.StructuredTextParser.ArrayTypeContext;
import org.strata.parser.StructuredTextParser.SimpleTypeContext;
import org.strata.parser.StructuredTextParser.StructTypeContext;
import org.strata.parser.StructuredTextParser.SubrangeContext;
import org.strata.parser.StructuredTextParser.VarDeclContext;

/** Builds {@link TypeRef}s and the {@link VarDecl}s that use them. */
class TypeBuilder extends VisitorBase<TypeRef> {
  private final ExpressionBuilder expressions;

  TypeBuilder(ExpressionBuilder expressions) {
    this.expressions = expressions;
  }

  /**
   * Returns one VarDecl per name in the declaration; {@code a, b : INT := 0;} declares both
   * variables with the same type and initial value.
   */
  ImmutableList<VarDecl> declarations(VarDeclContext ctx) {
    TypeRef type = visit(ctx.typeRef());
    Expr init = (ctx.init == null) ? null : expressions.visit(ctx.init);
    ImmutableList.Builder<VarDecl> builder = ImmutableList.builder();
    for (Token name : ctx.names) {
      builder.add(new VarDecl(name.getText(), type, init));
    }
    return builder.build();
  }

  ImmutableList<VarDecl> declarations(List<VarDeclContext> contexts) {
    ImmutableList.Builder<VarDecl> builder = ImmutableList.builder();
    contexts.forEach(ctx -> builder.addAll(declarations(ctx)));
    return builder.build();
  }

  @Override
  public TypeRef visitSimpleType(SimpleTypeContext ctx) {
    String name = ctx.name.getText();
    if (ctx.length != null) {
      // STRING(80) and STRING[80] are equivalent; we keep the bracketed form.
      name = name + "[" + ctx.length.getText() + "]";
    }
    return TypeRef.ofName(name);
  }

  @Override
  public TypeRef visitArrayType(ArrayTypeContext ctx) {
    // ARRAY[1..2, 1..3] OF INT is an array of arrays, outermost dimension first.
    TypeRef result = visit(ctx.typeRef());
    List<SubrangeContext> ranges = ctx.subrange();
    for (int i = ranges.size() - 1; i >= 0; i--) {
      SubrangeContext range = ranges.get(i);
      result = new TypeRef.Array(range.lower.getText(), range.upper.getText(), result);
    }
    return result;
  }

  @Override
  public TypeRef visitStructType(StructTypeContext ctx) {
    return new TypeRef.Struct(declarations(ctx.varDecl()));
  }
}
