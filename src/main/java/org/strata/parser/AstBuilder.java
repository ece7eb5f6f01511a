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

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.strata.ast.Ast;
import org.strata.ast.ProgramUnit;
import org.strata.ast.ProgramUnit.UnitKind;
import org.strata.ast.Qualifier;
import org.strata.ast.Storage;
import org.strata.ast.VarBlock;
import org.strata.parser.StructuredTextParser.FileContext;
import org.strata.parser.StructuredTextParser.FunctionBlockDeclContext;
import org.strata.parser.StructuredTextParser.FunctionDeclContext;
import org.strata.parser.StructuredTextParser.ProgramDeclContext;
import org.strata.parser.StructuredTextParser.VarBlockContext;

/**
 * Converts a parse tree into an {@link Ast} in a single walk. The result holds no references to
 * the parse tree or the token stream.
 */
public final class AstBuilder extends VisitorBase<ProgramUnit> {
  private final ExpressionBuilder expressions = new ExpressionBuilder();
  private final TypeBuilder types = new TypeBuilder(expressions);
  private final StatementBuilder statements = new StatementBuilder(expressions);

  private AstBuilder() {}

  /**
   * Builds the Ast for a complete source file.
   *
   * @throws BuildError if the tree has a shape the builders do not handle
   */
  public static Ast build(FileContext ctx) {
    AstBuilder builder = new AstBuilder();
    return new Ast(
        ctx.programUnit().stream().map(builder::visit).collect(ImmutableList.toImmutableList()));
  }

  @Override
  public ProgramUnit visitProgramDecl(ProgramDeclContext ctx) {
    return new ProgramUnit(
        UnitKind.PROGRAM,
        ctx.name.getText(),
        null,
        varBlocks(ctx.varBlock()),
        statements.statements(ctx.statementList()));
  }

  @Override
  public ProgramUnit visitFunctionBlockDecl(FunctionBlockDeclContext ctx) {
    return new ProgramUnit(
        UnitKind.FUNCTION_BLOCK,
        ctx.name.getText(),
        null,
        varBlocks(ctx.varBlock()),
        statements.statements(ctx.statementList()));
  }

  @Override
  public ProgramUnit visitFunctionDecl(FunctionDeclContext ctx) {
    return new ProgramUnit(
        UnitKind.FUNCTION,
        ctx.name.getText(),
        types.visit(ctx.returnType),
        varBlocks(ctx.varBlock()),
        statements.statements(ctx.statementList()));
  }

  private ImmutableList<VarBlock> varBlocks(List<VarBlockContext> blocks) {
    ImmutableList.Builder<VarBlock> builder = ImmutableList.builder();
    for (VarBlockContext block : blocks) {
      Storage storage = Storage.valueOf(Ascii.toUpperCase(block.storage.getText()));
      Qualifier qualifier =
          (block.qualifier == null)
              ? Qualifier.NONE
              : Qualifier.valueOf(Ascii.toUpperCase(block.qualifier.getText()));
      builder.add(new VarBlock(storage, qualifier, types.declarations(block.varDecl())));
    }
    return builder.build();
  }
}
