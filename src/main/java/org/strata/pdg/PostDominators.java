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

package org.strata.pdg;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/** Computes post-dominator sets by iterating the standard data-flow equations to a fixpoint. */
public final class PostDominators {

  // Static methods only
  private PostDominators() {}

  /**
   * Returns, for each node, the set of nodes that post-dominate it (including itself).
   *
   * <p>{@code pdom(exit) = {exit}}; for every other node {@code pdom(n) = {n} ∪ ⋂ pdom(s)} over
   * its successors {@code s}. A node with no path to {@code exitId} ends up post-dominated by every
   * node.
   *
   * @param succ the successors of each node, indexed by node; must include {@code exitId}
   * @param exitId the unique exit node, which must have no successors
   */
  public static ImmutableList<ImmutableSet<Integer>> compute(
      List<? extends List<Integer>> succ, int exitId) {
    int n = succ.size();
    checkArgument(exitId >= 0 && exitId < n, "Exit %s is not a node", exitId);
    checkArgument(succ.get(exitId).isEmpty(), "Exit node has successors");
    List<BitSet> pdom = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      BitSet set = new BitSet(n);
      if (i == exitId) {
        set.set(exitId);
      } else {
        set.set(0, n);
      }
      pdom.add(set);
    }
    boolean changed = true;
    while (changed) {
      changed = false;
      for (int i = n - 1; i >= 0; i--) {
        if (i == exitId) {
          continue;
        }
        BitSet next = new BitSet(n);
        List<Integer> successors = succ.get(i);
        if (successors.isEmpty()) {
          next.set(0, n);
        } else {
          next.or(pdom.get(successors.get(0)));
          for (int s : successors.subList(1, successors.size())) {
            next.and(pdom.get(s));
          }
        }
        next.set(i);
        if (!next.equals(pdom.get(i))) {
          pdom.set(i, next);
          changed = true;
        }
      }
    }
    return pdom.stream()
        .map(set -> set.stream().boxed().collect(ImmutableSet.toImmutableSet()))
        .collect(ImmutableList.toImmutableList());
  }
}
