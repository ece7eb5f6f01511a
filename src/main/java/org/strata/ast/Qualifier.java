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

/** The optional qualifier following a VAR keyword. */
public enum Qualifier {
  NONE,
  CONSTANT,
  RETAIN,
  PERSISTENT;

  /** Returns the keyword as written after the storage keyword, or the empty string for NONE. */
  public String keyword() {
    return this == NONE ? "" : name();
  }
}
