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

/** A control-flow graph over basic blocks, derived from an {@link InstrCfg}. */
public final class BlockCfg {
  private final ImmutableList<BasicBlock> blocks;
  private final ImmutableList<ImmutableList<Integer>> succ;
  private final ImmutableList<ImmutableList<Integer>> pred;

  /** For each instruction index, the id of the block containing it. */
  private final int[] blockOf;

  BlockCfg(
      ImmutableList<BasicBlock> blocks,
      ImmutableList<ImmutableList<Integer>> succ,
      ImmutableList<ImmutableList<Integer>> pred,
      int[] blockOf) {
    this.blocks = blocks;
    this.succ = succ;
    this.pred = pred;
    this.blockOf = blockOf;
  }

  public ImmutableList<BasicBlock> blocks() {
    return blocks;
  }

  public ImmutableList<Integer> succ(int blockId) {
    return succ.get(blockId);
  }

  public ImmutableList<Integer> pred(int blockId) {
    return pred.get(blockId);
  }

  /** Returns the block containing the given instruction. */
  public BasicBlock blockOf(int instrIndex) {
    return blocks.get(blockOf[instrIndex]);
  }

  /** The instruction indices at which blocks begin, in increasing order. */
  public ImmutableList<Integer> leaders() {
    return blocks.stream().map(BasicBlock::first).collect(ImmutableList.toImmutableList());
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (BasicBlock block : blocks) {
      sb.append(block).append(" -> ").append(succ.get(block.id())).append('\n');
    }
    return sb.toString();
  }
}
