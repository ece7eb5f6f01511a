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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * A program organization unit: a PROGRAM, FUNCTION_BLOCK or FUNCTION with its variable blocks and
 * body. {@code returnType} is non-null exactly when {@code kind} is FUNCTION.
 */
public record ProgramUnit(
    UnitKind kind,
    String name,
    @Nullable TypeRef returnType,
    ImmutableList<VarBlock> varBlocks,
    ImmutableList<Statement> body) {

  public enum UnitKind {
    PROGRAM,
    FUNCTION_BLOCK,
    FUNCTION;

    public String keyword() {
      return name();
    }

    public String endKeyword() {
      return "END_" + name();
    }
  }

  /** A declaration paired with the storage class and qualifier of the block it came from. */
  public record Declaration(Storage storage, Qualifier qualifier, VarDecl decl) {}

  public ProgramUnit {
    Preconditions.checkArgument(
        (kind == UnitKind.FUNCTION) == (returnType != null),
        "Only a FUNCTION has a return type");
  }

  /** Returns every declaration of the unit in source order, each tagged with its block. */
  public ImmutableList<Declaration> declarations() {
    ImmutableList.Builder<Declaration> builder = ImmutableList.builder();
    for (VarBlock block : varBlocks) {
      for (VarDecl decl : block.decls()) {
        builder.add(new Declaration(block.storage(), block.qualifier(), decl));
      }
    }
    return builder.build();
  }

  public ProgramUnit withBody(ImmutableList<Statement> newBody) {
    return new ProgramUnit(kind, name, returnType, varBlocks, newBody);
  }

  public ProgramUnit withVarBlocks(ImmutableList<VarBlock> newVarBlocks) {
    return new ProgramUnit(kind, name, returnType, newVarBlocks, body);
  }
}
