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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/** A program unit refers to variables that it does not declare. */
public class SemanticError extends RuntimeException {
  public final String unit;

  /** The undeclared names, as first written in the unit's body. */
  public final ImmutableList<String> undefined;

  public SemanticError(String unit, ImmutableList<String> undefined) {
    this.unit = unit;
    this.undefined = undefined;
  }

  @Override
  public String getMessage() {
    return String.format(
        "Undefined variable(s) in %s: %s", unit, Joiner.on(", ").join(undefined));
  }
}
