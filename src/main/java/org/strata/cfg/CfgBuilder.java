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
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Builds an {@link InstrCfg} from a list of instructions. */
public final class CfgBuilder {

  // Static methods only
  private CfgBuilder() {}

  /**
   * Builds the graph in two passes: the first maps each label to its index, the second adds edges.
   * A BranchCond has an edge to each of its targets and a Goto to its one target; neither falls
   * through. Every other instruction falls through to the next one, if there is one.
   *
   * @throws LabelResolutionError if a jump names an undefined label or a label is defined twice
   */
  public static InstrCfg build(List<IrInstr> instrs) {
    Map<String, Integer> labels = new HashMap<>();
    for (int i = 0; i < instrs.size(); i++) {
      if (instrs.get(i) instanceof IrInstr.Label label) {
        Integer prev = labels.putIfAbsent(label.name(), i);
        if (prev != null) {
          throw new LabelResolutionError("Duplicate label", label.name(), i);
        }
      }
    }
    int n = instrs.size();
    List<List<Integer>> succ = new ArrayList<>();
    List<List<Integer>> pred = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      succ.add(new ArrayList<>());
      pred.add(new ArrayList<>());
    }
    for (int i = 0; i < n; i++) {
      IrInstr instr = instrs.get(i);
      if (instr instanceof IrInstr.BranchCond branch) {
        addEdge(succ, pred, i, resolve(labels, branch.trueLabel(), i));
        addEdge(succ, pred, i, resolve(labels, branch.falseLabel(), i));
      } else if (instr instanceof IrInstr.Goto jump) {
        addEdge(succ, pred, i, resolve(labels, jump.targetLabel(), i));
      } else if (i + 1 < n) {
        addEdge(succ, pred, i, i + 1);
      }
    }
    return new InstrCfg(
        ImmutableList.copyOf(instrs), freeze(succ), freeze(pred), ImmutableMap.copyOf(labels));
  }

  private static int resolve(Map<String, Integer> labels, String label, int from) {
    Integer target = labels.get(label);
    if (target == null) {
      throw new LabelResolutionError("Unresolved label", label, from);
    }
    return target;
  }

  private static void addEdge(
      List<List<Integer>> succ, List<List<Integer>> pred, int from, int to) {
    // A branch whose two targets coincide still has a single edge.
    if (!succ.get(from).contains(to)) {
      succ.get(from).add(to);
      pred.get(to).add(from);
    }
  }

  private static ImmutableList<ImmutableList<Integer>> freeze(List<List<Integer>> lists) {
    return lists.stream().map(ImmutableList::copyOf).collect(ImmutableList.toImmutableList());
  }
}
