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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;
import org.strata.ast.Operator;
import org.strata.ast.PrefixOperator;

/**
 * A three-address instruction. Operands are strings: a variable name, a temporary ({@code _tN}),
 * a literal as written, or a place such as {@code a[_t3]} or {@code fb.Q}.
 */
public sealed interface IrInstr {

  /** True if control never falls through to the next instruction. */
  default boolean isJump() {
    return false;
  }

  /** {@code dest := src} */
  record Assign(String dest, String src) implements IrInstr {
    @Override
    public String toString() {
      return dest + " := " + src;
    }
  }

  /** {@code dest := left op right} */
  record BinOp(String dest, Operator op, String left, String right) implements IrInstr {
    @Override
    public String toString() {
      return String.format("%s := %s %s %s", dest, left, op.symbol(), right);
    }
  }

  /** {@code dest := op operand} */
  record Unary(String dest, PrefixOperator op, String operand) implements IrInstr {
    @Override
    public String toString() {
      return String.format(
          "%s := %s%s%s", dest, op.symbol(), op == PrefixOperator.NOT ? " " : "", operand);
    }
  }

  /** A call; {@code dest} is null when the call is a statement. */
  record Call(@Nullable String dest, String name, ImmutableList<String> args) implements IrInstr {
    @Override
    public String toString() {
      String call = name + "(" + Joiner.on(", ").join(args) + ")";
      return (dest == null) ? call : dest + " := " + call;
    }
  }

  /** Transfers control to {@code trueLabel} if {@code cond} is true, else to {@code falseLabel}. */
  record BranchCond(String cond, String trueLabel, String falseLabel) implements IrInstr {
    @Override
    public boolean isJump() {
      return true;
    }

    @Override
    public String toString() {
      return String.format("if %s goto %s else %s", cond, trueLabel, falseLabel);
    }
  }

  record Label(String name) implements IrInstr {
    @Override
    public String toString() {
      return name + ":";
    }
  }

  record Goto(String targetLabel) implements IrInstr {
    @Override
    public boolean isJump() {
      return true;
    }

    @Override
    public String toString() {
      return "goto " + targetLabel;
    }
  }
}
