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

package org.strata.cfg;

import com.google.common.collect.ImmutableList;

/**
 * A maximal straight-line run of instructions: control enters only at {@code first} and leaves
 * only after {@code last} (both inclusive instruction indices).
 */
public record BasicBlock(int id, int first, int last, ImmutableList<IrInstr> instrs) {

  public boolean contains(int instrIndex) {
    return instrIndex >= first && instrIndex <= last;
  }

  @Override
  public String toString() {
    return String.format("B%d[%d..%d]", id, first, last);
  }
}
