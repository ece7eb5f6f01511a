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

package org.strata.analysis;

import static com.google.common.truth.Truth.assertThat;
import static org.strata.testing.Sources.statement;

import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class HazardsTest {

  private static Object[] pairs() {
    return new Object[] {
      // first statement, second statement, conflict?
      new Object[] {"a := 1;", "b := 2;", false},
      new Object[] {"a := 1;", "b := a;", true}, // read after write
      new Object[] {"b := a;", "a := 1;", true}, // write after read
      new Object[] {"a := 1;", "a := 2;", true}, // write after write
      new Object[] {"a := b;", "c := b;", false}, // reads never conflict
      new Object[] {"A := 1;", "b := a;", true},
      new Object[] {"arr[i] := 1;", "i := 2;", true},
      new Object[] {"arr[1] := 1;", "arr[2] := 2;", true},
      new Object[] {"IF c THEN x := 1; END_IF", "c := FALSE;", true},
      new Object[] {"FOR i := 1 TO 3 DO END_FOR", "y := i;", true},
    };
  }

  @Test
  @Parameters(method = "pairs")
  public void conflict(String first, String second, boolean expected) {
    assertThat(Hazards.conflict(statement(first), statement(second))).isEqualTo(expected);
    assertThat(Hazards.conflict(statement(second), statement(first))).isEqualTo(expected);
  }

  private static Object[] barriers() {
    return new Object[] {
      new Object[] {"x := 1;", false},
      new Object[] {"fb(IN := x);", true},
      new Object[] {"x := ABS(y);", true},
      new Object[] {"IF a THEN RETURN; END_IF", true},
      new Object[] {"WHILE a DO EXIT; END_WHILE", true},
      new Object[] {"FOR i := 1 TO 3 DO CONTINUE; END_FOR", true},
      new Object[] {"WHILE a DO a := NOT a; END_WHILE", false},
    };
  }

  @Test
  @Parameters(method = "barriers")
  public void isBarrier(String text, boolean expected) {
    assertThat(Hazards.isBarrier(statement(text))).isEqualTo(expected);
  }

  @Test
  public void canSwap() {
    assertThat(Hazards.canSwap(statement("a := 1;"), statement("b := 2;"))).isTrue();
    assertThat(Hazards.canSwap(statement("a := 1;"), statement("b := a;"))).isFalse();
    assertThat(Hazards.canSwap(statement("a := 1;"), statement("fb();"))).isFalse();
  }
}
