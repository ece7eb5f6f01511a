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

import org.jspecify.annotations.Nullable;

/** A single declared variable. {@code a, b : INT;} in source becomes two VarDecls. */
public record VarDecl(String name, TypeRef type, @Nullable Expr init) {

  public VarDecl withName(String newName) {
    return new VarDecl(newName, type, init);
  }
}
