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

import com.google.common.base.Preconditions;
import org.jspecify.annotations.Nullable;
import org.strata.ast.Ast;

/** The outcome of {@link SourceParser#parse}: exactly one of an Ast or a SyntaxError. */
public final class ParseResult {
  private final @Nullable Ast ast;
  private final @Nullable SyntaxError error;

  private ParseResult(@Nullable Ast ast, @Nullable SyntaxError error) {
    this.ast = ast;
    this.error = error;
  }

  public static ParseResult success(Ast ast) {
    return new ParseResult(Preconditions.checkNotNull(ast), null);
  }

  public static ParseResult failure(SyntaxError error) {
    return new ParseResult(null, Preconditions.checkNotNull(error));
  }

  public boolean succeeded() {
    return ast != null;
  }

  /** Returns the Ast; only valid if {@link #succeeded}. */
  public Ast ast() {
    Preconditions.checkState(ast != null, "Parse failed: %s", error);
    return ast;
  }

  /** Returns the SyntaxError; only valid if the parse did not succeed. */
  public SyntaxError error() {
    Preconditions.checkState(error != null, "Parse succeeded");
    return error;
  }

  @Override
  public String toString() {
    return succeeded() ? "ParseResult(success)" : "ParseResult(" + error.describe() + ")";
  }
}
