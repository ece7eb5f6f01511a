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
import com.google.common.collect.ImmutableMap;

/**
 * An instruction-level control-flow graph: one node per instruction, identified by its index.
 * Built by {@link CfgBuilder}.
 */
public final class InstrCfg {
  private final ImmutableList<IrInstr> instrs;
  private final ImmutableList<ImmutableList<Integer>> succ;
  private final ImmutableList<ImmutableList<Integer>> pred;
  private final ImmutableMap<String, Integer> labelIndex;

  InstrCfg(
      ImmutableList<IrInstr> instrs,
      ImmutableList<ImmutableList<Integer>> succ,
      ImmutableList<ImmutableList<Integer>> pred,
      ImmutableMap<String, Integer> labelIndex) {
    this.instrs = instrs;
    this.succ = succ;
    this.pred = pred;
    this.labelIndex = labelIndex;
  }

  public ImmutableList<IrInstr> instrs() {
    return instrs;
  }

  public int size() {
    return instrs.size();
  }

  public ImmutableList<Integer> succ(int index) {
    return succ.get(index);
  }

  public ImmutableList<Integer> pred(int index) {
    return pred.get(index);
  }

  /** All successor lists, indexed by instruction. */
  public ImmutableList<ImmutableList<Integer>> successors() {
    return succ;
  }

  /** The entry node; meaningless if the graph is empty. */
  public int entry() {
    return 0;
  }

  /** The instructions with no successors, in index order. */
  public ImmutableList<Integer> exits() {
    ImmutableList.Builder<Integer> builder = ImmutableList.builder();
    for (int i = 0; i < succ.size(); i++) {
      if (succ.get(i).isEmpty()) {
        builder.add(i);
      }
    }
    return builder.build();
  }

  /** Maps each label name to the index of its {@link IrInstr.Label} instruction. */
  public ImmutableMap<String, Integer> labelIndex() {
    return labelIndex;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < instrs.size(); i++) {
      sb.append(String.format("%3d: %-30s -> %s%n", i, instrs.get(i), succ.get(i)));
    }
    return sb.toString();
  }
}
