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

package org.strata;

import com.google.common.collect.ImmutableList;
import org.strata.ast.ProgramUnit;
import org.strata.cfg.BlockCfg;
import org.strata.cfg.BlockCfgBuilder;
import org.strata.cfg.CfgBuilder;
import org.strata.cfg.InstrCfg;
import org.strata.cfg.IrInstr;
import org.strata.cfg.IrLowering;
import org.strata.pdg.ControlDependence;

/**
 * The control-flow views of one program unit: its lowered instructions, the instruction-level and
 * block-level graphs over them, and the control dependences between instructions.
 */
public record ControlFlow(
    ImmutableList<IrInstr> ir,
    InstrCfg instrCfg,
    BlockCfg blockCfg,
    ControlDependence controlDependence) {

  /**
   * Lowers {@code unit} and builds each view.
   *
   * @throws org.strata.cfg.LabelResolutionError if the lowered code has a bad jump
   */
  public static ControlFlow of(ProgramUnit unit) {
    ImmutableList<IrInstr> ir = IrLowering.lower(unit);
    InstrCfg instrCfg = CfgBuilder.build(ir);
    return new ControlFlow(
        ir, instrCfg, BlockCfgBuilder.build(instrCfg), ControlDependence.of(instrCfg));
  }
}
