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

import static com.google.common.base.Preconditions.checkArgument;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

/**
 * One argument of a call. {@code name} is null for a positional argument and holds the formal
 * parameter for a named one ({@code IN := x}).
 *
 * <p>An output argument ({@code Q => done}) passes nothing in: after the call, the callee's output
 * {@code name} is stored into {@code value}, which is always a place (a variable, element or
 * field). Only call statements have output arguments.
 */
public record Argument(
    @Nullable String name,
    Expr value,
    @JsonInclude(JsonInclude.Include.NON_DEFAULT) boolean output) {

  public Argument {
    checkArgument(!output || name != null, "Output argument needs a parameter name");
  }

  public static Argument positional(Expr value) {
    return new Argument(null, value, false);
  }

  public static Argument named(String name, Expr value) {
    return new Argument(name, value, false);
  }

  public static Argument output(String name, Expr target) {
    return new Argument(name, target, true);
  }

  public Argument withValue(Expr newValue) {
    return new Argument(name, newValue, output);
  }
}
