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

import com.google.common.base.Ascii;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/** The program organization units of one source text, in source order. */
public record Ast(ImmutableList<ProgramUnit> units) {

  public Ast {
    Preconditions.checkArgument(!units.isEmpty(), "Source contains no program units");
  }

  public static Ast of(ProgramUnit... units) {
    return new Ast(ImmutableList.copyOf(units));
  }

  /** Returns the unit with the given name, ignoring case, or null if there is none. */
  public @Nullable ProgramUnit unit(String name) {
    for (ProgramUnit unit : units) {
      if (Ascii.equalsIgnoreCase(unit.name(), name)) {
        return unit;
      }
    }
    return null;
  }
}
