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

/** Which VAR block a declaration appears in. */
public enum Storage {
  VAR,
  VAR_INPUT,
  VAR_OUTPUT,
  VAR_IN_OUT,
  VAR_TEMP,
  VAR_GLOBAL,
  VAR_EXTERNAL;

  /** The keyword that opens a block of this storage class. */
  public String keyword() {
    return name();
  }

  /** True for the blocks that make up a unit's calling interface. */
  public boolean isInterface() {
    return this == VAR_INPUT || this == VAR_OUTPUT || this == VAR_IN_OUT;
  }

  /** True for variables that are private to the unit. */
  public boolean isLocal() {
    return this == VAR || this == VAR_TEMP;
  }
}
