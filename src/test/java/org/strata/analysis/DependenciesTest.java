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

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.strata.ast.Statement;
import org.strata.testing.Sources;

@RunWith(JUnit4.class)
public class DependenciesTest {

  @Test
  public void assignment() {
    Statement s = Sources.statement("x := a + b * a;");
    assertThat(Dependencies.readVars(s)).containsExactly("a", "b").inOrder();
    assertThat(Dependencies.writeVars(s)).containsExactly("x");
  }

  @Test
  public void subscriptsOfTargetAreRead() {
    Statement s = Sources.statement("buf[i + 1].field := v;");
    assertThat(Dependencies.readVars(s)).containsExactly("i", "v");
    assertThat(Dependencies.writeVars(s)).containsExactly("buf");
  }

  @Test
  public void placesInValueAreRead() {
    Statement s = Sources.statement("x := fb.Q AND arr[j];");
    assertThat(Dependencies.readVars(s)).containsExactly("fb", "arr", "j").inOrder();
  }

  @Test
  public void ifIncludesConditionsAndAllBranches() {
    Statement s = Sources.statement("IF a THEN x := 1; ELSIF b THEN y := c; ELSE z := d; END_IF");
    assertThat(Dependencies.readVars(s)).containsExactly("a", "b", "c", "d").inOrder();
    assertThat(Dependencies.writeVars(s)).containsExactly("x", "y", "z").inOrder();
  }

  @Test
  public void caseSelectorIsRead() {
    Statement s = Sources.statement("CASE mode OF 1: x := a; ELSE y := b; END_CASE");
    assertThat(Dependencies.readVars(s)).containsExactly("mode", "a", "b").inOrder();
    assertThat(Dependencies.writeVars(s)).containsExactly("x", "y").inOrder();
  }

  @Test
  public void forWritesItsVariable() {
    Statement s = Sources.statement("FOR i := lo TO hi BY step DO sum := sum + i; END_FOR");
    assertThat(Dependencies.readVars(s)).containsExactly("lo", "hi", "step", "sum", "i").inOrder();
    assertThat(Dependencies.writeVars(s)).containsExactly("i", "sum").inOrder();
  }

  @Test
  public void loops() {
    assertThat(Dependencies.readVars(Sources.statement("WHILE go DO n := n - 1; END_WHILE")))
        .containsExactly("go", "n");
    assertThat(Dependencies.readVars(Sources.statement("REPEAT n := m; UNTIL done END_REPEAT")))
        .containsExactly("m", "done")
        .inOrder();
  }

  @Test
  public void outputArgumentsAreWritten() {
    Statement s = Sources.statement("t(IN := go, PT := T#1s, Q => done, ET => log[k].elapsed);");
    assertThat(Dependencies.readVars(s)).containsExactly("go", "k").inOrder();
    assertThat(Dependencies.writeVars(s)).containsExactly("done", "log").inOrder();
    assertThat(Dependencies.referencedVars(ImmutableList.of(s)))
        .containsExactly("go", "k", "done", "log");
  }

  @Test
  public void callsReadArgumentsAndWriteNothing() {
    Statement s = Sources.statement("timer(IN := start AND NOT stop, PT := delay);");
    assertThat(Dependencies.readVars(s)).containsExactly("start", "stop", "delay").inOrder();
    assertThat(Dependencies.writeVars(s)).isEmpty();
    assertThat(Dependencies.readVars(Sources.statement("x := LIMIT(lo, v, hi);")))
        .containsExactly("lo", "v", "hi")
        .inOrder();
  }

  @Test
  public void jumpsHaveNoDependencies() {
    ImmutableList<Statement> loop = Sources.body("WHILE TRUE DO EXIT; CONTINUE; END_WHILE RETURN;");
    assertThat(Dependencies.referencedVars(loop)).isEmpty();
  }

  @Test
  public void referencedVarsOfList() {
    ImmutableList<Statement> statements = Sources.body("a := b; c := a + d;");
    assertThat(Dependencies.readVars(statements)).containsExactly("b", "a", "d").inOrder();
    assertThat(Dependencies.writeVars(statements)).containsExactly("a", "c").inOrder();
    assertThat(Dependencies.referencedVars(statements)).containsExactly("a", "b", "c", "d");
  }

  @Test
  public void namesKeepTheirSpelling() {
    Statement s = Sources.statement("Speed := SPEED + speed;");
    assertThat(Dependencies.readVars(s)).containsExactly("SPEED", "speed").inOrder();
    assertThat(Names.canonical(Dependencies.readVars(s))).containsExactly("SPEED");
  }
}
