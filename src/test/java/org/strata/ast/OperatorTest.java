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

package org.strata.ast;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class OperatorTest {

  private static Object[] symbols() {
    return new Object[] {
      new Object[] {"OR", Operator.OR},
      new Object[] {"xor", Operator.XOR},
      new Object[] {"And", Operator.AND},
      new Object[] {"&", Operator.AND},
      new Object[] {"<>", Operator.NE},
      new Object[] {"<=", Operator.LE},
      new Object[] {"mod", Operator.MOD},
      new Object[] {"**", Operator.POW},
    };
  }

  @Test
  @Parameters(method = "symbols")
  public void fromSymbol(String symbol, Operator expected) {
    assertThat(Operator.fromSymbol(symbol)).isEqualTo(expected);
  }

  @Test
  public void unknownSymbol() {
    assertThrows(IllegalArgumentException.class, () -> Operator.fromSymbol("=="));
    assertThrows(IllegalArgumentException.class, () -> PrefixOperator.fromSymbol("!"));
  }

  @Test
  public void precedenceOrder() {
    assertThat(Operator.OR.precedence()).isLessThan(Operator.XOR.precedence());
    assertThat(Operator.XOR.precedence()).isLessThan(Operator.AND.precedence());
    assertThat(Operator.AND.precedence()).isLessThan(Operator.EQ.precedence());
    assertThat(Operator.EQ.precedence()).isLessThan(Operator.LT.precedence());
    assertThat(Operator.LT.precedence()).isLessThan(Operator.ADD.precedence());
    assertThat(Operator.ADD.precedence()).isLessThan(Operator.MUL.precedence());
    assertThat(Operator.MUL.precedence()).isLessThan(Operator.UNARY_PRECEDENCE);
    assertThat(Operator.UNARY_PRECEDENCE).isLessThan(Operator.POW.precedence());
  }

  @Test
  public void onlyAddMulAndOrAreSwappable() {
    for (Operator op : Operator.values()) {
      boolean expected =
          op == Operator.ADD || op == Operator.MUL || op == Operator.AND || op == Operator.OR;
      assertThat(op.isSwappable()).isEqualTo(expected);
      if (op.isSwappable()) {
        assertThat(op.commutative()).isTrue();
      }
    }
    assertThat(Operator.XOR.commutative()).isTrue();
    assertThat(Operator.SUB.commutative()).isFalse();
  }
}
