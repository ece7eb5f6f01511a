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

package org.strata.validator;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.strata.analysis.Dependencies;
import org.strata.analysis.Names;
import org.strata.ast.Ast;
import org.strata.ast.ProgramUnit;
import org.strata.ast.Storage;
import org.strata.parser.ParseResult;
import org.strata.parser.SourceParser;

/**
 * Parses code and checks that every variable a unit's body refers to is declared. A unit may use
 * its own var blocks, any VAR_GLOBAL of the file, and (for a FUNCTION) its own name as the result.
 *
 * <p>Names used only as the callee of a call statement are not checked, since they are usually
 * function blocks or functions declared elsewhere.
 */
public final class SemanticValidator implements Validator {

  @Override
  public Validation validate(String code) {
    ParseResult result = SourceParser.parse(code);
    if (!result.succeeded()) {
      return Validation.fail("Syntax error: " + result.error().describe());
    }
    try {
      check(result.ast());
    } catch (SemanticError e) {
      return Validation.fail(e.getMessage());
    }
    return Validation.pass();
  }

  /**
   * Throws a {@link SemanticError} for the first unit that refers to an undeclared variable.
   */
  public static void check(Ast ast) {
    ImmutableSet<String> globals =
        Names.canonical(
            ast.units().stream()
                .flatMap(unit -> unit.declarations().stream())
                .filter(d -> d.storage() == Storage.VAR_GLOBAL)
                .map(d -> d.decl().name())
                .collect(ImmutableList.toImmutableList()));
    for (ProgramUnit unit : ast.units()) {
      ImmutableSet.Builder<String> declared = ImmutableSet.<String>builder().addAll(globals);
      unit.declarations().forEach(d -> declared.add(Names.canonical(d.decl().name())));
      if (unit.kind() == ProgramUnit.UnitKind.FUNCTION) {
        declared.add(Names.canonical(unit.name()));
      }
      ImmutableSet<String> known = declared.build();
      ImmutableList<String> undefined =
          Dependencies.referencedVars(unit.body()).stream()
              .filter(name -> !known.contains(Names.canonical(name)))
              .collect(ImmutableList.toImmutableList());
      if (!undefined.isEmpty()) {
        throw new SemanticError(unit.name(), undefined);
      }
    }
  }
}
