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

import com.google.common.collect.ImmutableList;

/** One {@code VAR ... END_VAR} block (or one of its variants) with its declarations. */
public record VarBlock(Storage storage, Qualifier qualifier, ImmutableList<VarDecl> decls) {

  public VarBlock withDecls(ImmutableList<VarDecl> newDecls) {
    return new VarBlock(storage, qualifier, newDecls);
  }
}
