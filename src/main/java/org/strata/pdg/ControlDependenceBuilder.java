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

import com.google.common.collect.ImmutableSetMultimap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Derives control dependence from post-dominator sets via post-dominance frontiers. */
public final class ControlDependenceBuilder {

  // Static methods only
  private ControlDependenceBuilder() {}

  /**
   * Builds the control dependences of a CFG whose unique exit is {@code exitId}.
   *
   * <ol>
   *   <li>Picks the immediate post-dominator of each node: of the strict post-dominators, the one
   *       closest to the node. Every other strict post-dominator also post-dominates that one, so
   *       it is the candidate with the largest post-dominator set.
   *   <li>Walks the post-dominator tree bottom-up, computing each node's frontier from its CFG
   *       predecessors (the local part) and its children's frontiers (the up part).
   *   <li>Inverts the frontiers: {@code y} in PDF(x) means {@code y} controls {@code x}.
   * </ol>
   *
   * The exit node never appears in the result.
   */
  public static ControlDependence build(
      List<? extends List<Integer>> succ, int exitId, List<? extends Set<Integer>> postdom) {
    int n = succ.size();
    int[] ipdom = immediatePostDominators(n, exitId, postdom);

    List<List<Integer>> pred = new ArrayList<>(n);
    List<List<Integer>> children = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      pred.add(new ArrayList<>());
      children.add(new ArrayList<>());
    }
    for (int i = 0; i < n; i++) {
      for (int s : succ.get(i)) {
        pred.get(s).add(i);
      }
      if (ipdom[i] >= 0) {
        children.get(ipdom[i]).add(i);
      }
    }

    List<Set<Integer>> pdf = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      pdf.add(new LinkedHashSet<>());
    }
    for (int x : postorder(exitId, children)) {
      Set<Integer> frontier = pdf.get(x);
      for (int y : pred.get(x)) {
        if (ipdom[y] != x) {
          frontier.add(y);
        }
      }
      for (int z : children.get(x)) {
        for (int y : pdf.get(z)) {
          if (ipdom[y] != x) {
            frontier.add(y);
          }
        }
      }
    }

    ImmutableSetMultimap.Builder<Integer, Integer> dependents = ImmutableSetMultimap.builder();
    for (int x = 0; x < n; x++) {
      if (x == exitId) {
        continue;
      }
      for (int y : pdf.get(x)) {
        if (y != exitId) {
          dependents.put(y, x);
        }
      }
    }
    return new ControlDependence(n - 1, dependents.build());
  }

  /**
   * Returns the immediate post-dominator of each node, or -1 for the exit. Ties (which only arise
   * for nodes that cannot reach the exit) go to the lowest index.
   */
  static int[] immediatePostDominators(int n, int exitId, List<? extends Set<Integer>> postdom) {
    int[] ipdom = new int[n];
    Arrays.fill(ipdom, -1);
    for (int i = 0; i < n; i++) {
      if (i == exitId) {
        continue;
      }
      int best = -1;
      for (int candidate = 0; candidate < n; candidate++) {
        if (candidate == i || !postdom.get(i).contains(candidate)) {
          continue;
        }
        if (best < 0 || postdom.get(candidate).size() > postdom.get(best).size()) {
          best = candidate;
        }
      }
      ipdom[i] = best;
    }
    return ipdom;
  }

  /** Returns the nodes of the tree rooted at {@code root}, children before parents. */
  private static List<Integer> postorder(int root, List<List<Integer>> children) {
    List<Integer> result = new ArrayList<>();
    Deque<int[]> stack = new ArrayDeque<>();
    // Each entry is {node, index of the next child to visit}.
    stack.push(new int[] {root, 0});
    while (!stack.isEmpty()) {
      int[] top = stack.peek();
      List<Integer> kids = children.get(top[0]);
      if (top[1] < kids.size()) {
        int child = kids.get(top[1]++);
        stack.push(new int[] {child, 0});
      } else {
        stack.pop();
        result.add(top[0]);
      }
    }
    return result;
  }
}
