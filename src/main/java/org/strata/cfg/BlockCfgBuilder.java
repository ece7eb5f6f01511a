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
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/** Coalesces an {@link InstrCfg} into a {@link BlockCfg}. */
public final class BlockCfgBuilder {

  // Static methods only
  private BlockCfgBuilder() {}

  /**
   * Partitions the instructions into basic blocks. A block begins at each <i>leader</i>: the first
   * instruction, every instruction that a branch or goto targets, and every instruction that
   * follows a branch or goto. A block's successors are the blocks containing the successors of its
   * last instruction.
   */
  public static BlockCfg build(InstrCfg cfg) {
    int n = cfg.size();
    TreeSet<Integer> leaders = new TreeSet<>();
    if (n > 0) {
      leaders.add(0);
    }
    for (int i = 0; i < n; i++) {
      IrInstr instr = cfg.instrs().get(i);
      if (instr.isJump()) {
        leaders.addAll(cfg.succ(i));
        if (i + 1 < n) {
          leaders.add(i + 1);
        }
      }
    }
    int[] blockOf = new int[n];
    ImmutableList.Builder<BasicBlock> blocks = ImmutableList.builder();
    List<Integer> starts = new ArrayList<>(leaders);
    for (int b = 0; b < starts.size(); b++) {
      int first = starts.get(b);
      int last = (b + 1 < starts.size()) ? starts.get(b + 1) - 1 : n - 1;
      for (int i = first; i <= last; i++) {
        blockOf[i] = b;
      }
      blocks.add(new BasicBlock(b, first, last, cfg.instrs().subList(first, last + 1)));
    }
    ImmutableList<BasicBlock> blockList = blocks.build();
    List<List<Integer>> succ = new ArrayList<>();
    List<List<Integer>> pred = new ArrayList<>();
    for (int b = 0; b < blockList.size(); b++) {
      succ.add(new ArrayList<>());
      pred.add(new ArrayList<>());
    }
    for (BasicBlock block : blockList) {
      for (int target : cfg.succ(block.last())) {
        int targetBlock = blockOf[target];
        if (!succ.get(block.id()).contains(targetBlock)) {
          succ.get(block.id()).add(targetBlock);
          pred.get(targetBlock).add(block.id());
        }
      }
    }
    return new BlockCfg(blockList, freeze(succ), freeze(pred), blockOf);
  }

  private static ImmutableList<ImmutableList<Integer>> freeze(List<List<Integer>> lists) {
    return lists.stream().map(ImmutableList::copyOf).collect(ImmutableList.toImmutableList());
  }
}
