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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import java.util.ArrayList;
import java.util.List;
import org.strata.cfg.InstrCfg;

/**
 * The control dependences of an instruction-level CFG: instruction {@code c} controls {@code n}
 * if {@code c} is in the post-dominance frontier of {@code n}, i.e. {@code c} is a branch one of
 * whose edges always leads to {@code n} while another may avoid it.
 */
public final class ControlDependence {
  private final int size;
  private final ImmutableSetMultimap<Integer, Integer> dependents;

  ControlDependence(int size, ImmutableSetMultimap<Integer, Integer> dependents) {
    this.size = size;
    this.dependents = dependents;
  }

  /** Computes the control dependences of {@code cfg}. */
  public static ControlDependence of(InstrCfg cfg) {
    int n = cfg.size();
    // Node n is a virtual exit that every real exit flows to.
    List<List<Integer>> succExt = new ArrayList<>(n + 1);
    for (int i = 0; i < n; i++) {
      List<Integer> succ = new ArrayList<>(cfg.succ(i));
      if (succ.isEmpty()) {
        succ.add(n);
      }
      succExt.add(succ);
    }
    succExt.add(List.of());
    return ControlDependenceBuilder.build(succExt, n, PostDominators.compute(succExt, n));
  }

  /** The number of instructions; node ids range from 0 to {@code size() - 1}. */
  public int size() {
    return size;
  }

  /** The nodes directly controlled by {@code controller}. */
  public ImmutableSet<Integer> dependents(int controller) {
    return dependents.get(controller);
  }

  /** The nodes that directly control {@code node}. */
  public ImmutableSet<Integer> controllers(int node) {
    return dependents.inverse().get(node);
  }

  /** All dependences, keyed by controlling node. */
  public ImmutableSetMultimap<Integer, Integer> asMultimap() {
    return dependents;
  }

  @Override
  public String toString() {
    return dependents.toString();
  }
}
