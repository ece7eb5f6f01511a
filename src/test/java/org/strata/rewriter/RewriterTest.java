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

package org.strata.rewriter;

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.SplittableRandom;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.strata.ToolkitOptions;
import org.strata.analysis.Dependencies;
import org.strata.ast.Ast;
import org.strata.ast.Expr;
import org.strata.ast.ProgramUnit;
import org.strata.ast.Statement;
import org.strata.parser.ParseResult;
import org.strata.parser.SourceParser;
import org.strata.unparser.Unparser;

@RunWith(JUnit4.class)
public class RewriterTest {

  private static final ToolkitOptions NONE = ToolkitOptions.builder().allProbabilities(0).build();

  private static final String COUNTER =
      """
      FUNCTION_BLOCK Counter
      VAR
          Speed : REAL;
          MAX : INT;
          k : INT;
      END_VAR
      VAR_INPUT
          limit : REAL;
      END_VAR
      VAR CONSTANT
          Scale : REAL := 2.0;
      END_VAR
      Speed := Speed + limit * Scale;
      IF Speed > 10.0 THEN
          k := MAX;
      END_IF;
      END_FUNCTION_BLOCK
      """;

  private static Ast parse(String source) {
    ParseResult result = SourceParser.parse(source);
    assertWithMessage("Parse failed: %s", result).that(result.succeeded()).isTrue();
    return result.ast();
  }

  private static Ast program(String body) {
    return parse("PROGRAM P\n" + body + "\nEND_PROGRAM");
  }

  private static Ast rewrite(Ast ast, long seed, ToolkitOptions options) {
    return new Rewriter(new SplittableRandom(seed), options).rewrite(ast);
  }

  private static ImmutableList<Statement> body(Ast ast) {
    return ast.units().get(0).body();
  }

  private static String bodyText(Ast ast) {
    return Unparser.standard().unparse(body(ast), 0);
  }

  /** One unparsed line per top-level statement. */
  private static List<String> statementTexts(Ast ast) {
    List<String> result = new ArrayList<>();
    for (Statement s : body(ast)) {
      result.add(Unparser.standard().unparse(ImmutableList.of(s), 0).strip());
    }
    return result;
  }

  @Test
  public void sameSeedSameResult() {
    Ast ast = parse(COUNTER);
    ToolkitOptions options = ToolkitOptions.builder().allProbabilities(0.5).build();
    for (long seed = 0; seed < 10; seed++) {
      assertThat(rewrite(ast, seed, options)).isEqualTo(rewrite(ast, seed, options));
    }
  }

  @Test
  public void inputIsNotModified() {
    Ast ast = parse(COUNTER);
    rewrite(ast, 3, ToolkitOptions.builder().allProbabilities(1).build());
    assertThat(ast).isEqualTo(parse(COUNTER));
  }

  @Test
  public void noMutationsWithZeroProbabilities() {
    Ast ast = parse(COUNTER);
    assertThat(rewrite(ast, 17, NONE)).isEqualTo(ast);
  }

  @Test
  public void commutesSwappableOperators() {
    ToolkitOptions options = NONE.toBuilder().commuteProbability(1).build();
    assertThat(bodyText(rewrite(program("x := a + b * c;"), 1, options)))
        .isEqualTo("x := c * b + a;\n");
    assertThat(bodyText(rewrite(program("x := a AND b OR c;"), 1, options)))
        .isEqualTo("x := c OR b AND a;\n");
  }

  @Test
  public void leavesOtherOperatorsInPlace() {
    ToolkitOptions options = NONE.toBuilder().commuteProbability(1).build();
    Ast ast = program("x := a - b / c;\ny := a < b;\nz := a ** b;");
    assertThat(rewrite(ast, 1, options)).isEqualTo(ast);
  }

  @Test
  public void invertsIfWithElse() {
    ToolkitOptions options = NONE.toBuilder().invertProbability(1).build();
    Ast ast = program("IF a > b THEN x := 1; ELSE x := 2; y := 3; END_IF;");
    assertThat(bodyText(rewrite(ast, 1, options)))
        .isEqualTo(
            """
            IF NOT (a > b) THEN
                x := 2;
                y := 3;
            ELSE
                x := 1;
            END_IF;
            """);
  }

  @Test
  public void leavesIfWithoutElseOrWithElsif() {
    ToolkitOptions options = NONE.toBuilder().invertProbability(1).build();
    Ast ast =
        program(
            "IF a THEN x := 1; END_IF;\n"
                + "IF a THEN x := 1; ELSIF b THEN x := 2; ELSE x := 3; END_IF;");
    assertThat(rewrite(ast, 1, options)).isEqualTo(ast);
  }

  @Test
  public void invertsNestedIf() {
    ToolkitOptions options = NONE.toBuilder().invertProbability(1).build();
    Ast ast = program("WHILE go DO IF a THEN x := 1; ELSE x := 2; END_IF; END_WHILE;");
    assertThat(bodyText(rewrite(ast, 1, options)))
        .isEqualTo(
            """
            WHILE go DO
                IF NOT a THEN
                    x := 2;
                ELSE
                    x := 1;
                END_IF;
            END_WHILE;
            """);
  }

  @Test
  public void renamesPrivateVariables() {
    ToolkitOptions options = NONE.toBuilder().renameProbability(1).build();
    Ast result = rewrite(parse(COUNTER), 1, options);
    ProgramUnit unit = result.units().get(0);
    assertThat(unit.declarations().stream().map(d -> d.decl().name()))
        .containsExactly("var_Speed", "MAX", "k", "limit", "Scale")
        .inOrder();
    assertThat(bodyText(result))
        .isEqualTo(
            """
            var_Speed := var_Speed + limit * Scale;
            IF var_Speed > 10.0 THEN
                k := MAX;
            END_IF;
            """);
  }

  @Test
  public void renamedKeywordLookalikesStillParse() {
    ToolkitOptions options = NONE.toBuilder().renameProbability(1).build();
    Ast ast = program("VAR Temp : INT; Input : INT; END_VAR\nTemp := Input + 1;");
    Ast result = rewrite(ast, 1, options);
    assertThat(bodyText(result)).isEqualTo("var_Temp2 := var_Input2 + 1;\n");

    ParseResult reparsed = SourceParser.parse(Unparser.standard().unparse(result));
    assertWithMessage("Reparse failed: %s", reparsed).that(reparsed.succeeded()).isTrue();
    assertThat(bodyText(reparsed.ast())).isEqualTo(bodyText(result));
  }

  @Test
  public void renameIsAllOrNothing() {
    ToolkitOptions options = ToolkitOptions.builder().allProbabilities(0.5).build();
    Set<Boolean> outcomes = new HashSet<>();
    for (long seed = 0; seed < 40; seed++) {
      ProgramUnit unit = rewrite(parse(COUNTER), seed, options).units().get(0);
      Set<String> names = new HashSet<>(Dependencies.referencedVars(unit.body()));
      unit.declarations().forEach(d -> names.add(d.decl().name()));
      boolean renamed = names.contains("var_Speed");
      assertWithMessage("seed %s", seed).that(names.contains("Speed")).isEqualTo(!renamed);
      outcomes.add(renamed);
    }
    assertThat(outcomes).containsExactly(true, false);
  }

  @Test
  public void renameAvoidsExistingNames() {
    ToolkitOptions options = NONE.toBuilder().renameProbability(1).build();
    Ast ast =
        parse(
            """
            PROGRAM P
            VAR
                total : INT;
                VAR_TOTAL : INT;
            END_VAR
            total := VAR_TOTAL;
            END_PROGRAM
            """);
    assertThat(bodyText(rewrite(ast, 1, options))).isEqualTo("var_total2 := VAR_TOTAL;\n");
  }

  @Test
  public void renamesFunctionBlockInstances() {
    ToolkitOptions options = NONE.toBuilder().renameProbability(1).build();
    Ast ast =
        parse(
            """
            PROGRAM P
            VAR
                timer : TON;
            END_VAR
            timer(IN := start, PT := T#5s);
            done := timer.Q;
            END_PROGRAM
            """);
    assertThat(bodyText(rewrite(ast, 1, options)))
        .isEqualTo("var_timer(IN := start, PT := T#5s);\ndone := var_timer.Q;\n");
  }

  @Test
  public void renamesCaseInsensitively() {
    ToolkitOptions options = NONE.toBuilder().renameProbability(1).build();
    Ast ast =
        parse(
            """
            PROGRAM P
            VAR
                count : INT;
            END_VAR
            FOR COUNT := 1 TO 3 DO
                Count := count + 1;
            END_FOR;
            END_PROGRAM
            """);
    assertThat(bodyText(rewrite(ast, 1, options)))
        .isEqualTo(
            """
            FOR var_count := 1 TO 3 DO
                var_count := var_count + 1;
            END_FOR;
            """);
  }

  @Test
  public void swapsKeepDependentStatementsInOrder() {
    ToolkitOptions options = NONE.toBuilder().swapProbability(1).build();
    Ast ast = program("a := 1;\nb := a;\nc := 2;\nd := c;\ne := 3;");
    Set<List<String>> orders = new HashSet<>();
    for (long seed = 0; seed < 50; seed++) {
      List<String> texts = statementTexts(rewrite(ast, seed, options));
      assertWithMessage("seed %s", seed)
          .that(texts)
          .containsExactly("a := 1;", "b := a;", "c := 2;", "d := c;", "e := 3;");
      assertThat(texts.indexOf("b := a;")).isGreaterThan(texts.indexOf("a := 1;"));
      assertThat(texts.indexOf("d := c;")).isGreaterThan(texts.indexOf("c := 2;"));
      orders.add(texts);
    }
    assertThat(orders.size()).isGreaterThan(1);
  }

  @Test
  public void barriersStayInPlace() {
    ToolkitOptions options = NONE.toBuilder().swapProbability(1).build();
    Ast ast = program("a := 1;\nlog(a);\nc := 2;\nRETURN;\nd := 3;");
    for (long seed = 0; seed < 20; seed++) {
      assertThat(rewrite(ast, seed, options)).isEqualTo(ast);
    }
  }

  @Test
  public void commuteGuard() {
    Expr.BinOp sub = (Expr.BinOp) ((Statement.Assign) body(program("x := a - b;")).get(0)).value();
    RewriteGuardViolation e =
        assertThrows(RewriteGuardViolation.class, () -> Rewriter.commute(sub));
    assertThat(e).hasMessageThat().isEqualTo("SUB is not swappable");
  }

  @Test
  public void invertGuards() {
    Statement.If noElse = (Statement.If) body(program("IF a THEN x := 1; END_IF;")).get(0);
    assertThrows(RewriteGuardViolation.class, () -> Rewriter.invert(noElse));
    Statement.If withElsif =
        (Statement.If)
            body(program("IF a THEN x := 1; ELSIF b THEN x := 2; ELSE x := 3; END_IF;")).get(0);
    assertThrows(RewriteGuardViolation.class, () -> Rewriter.invert(withElsif));
  }

  @Test
  public void swapGuard() {
    List<Statement> statements = new ArrayList<>(body(program("a := 1;\nb := a;\nc := 2;")));
    List<Statement> before = List.copyOf(statements);
    assertThrows(RewriteGuardViolation.class, () -> Rewriter.swap(statements, 0));
    assertThat(statements).isEqualTo(before);
    Rewriter.swap(statements, 1);
    assertThat(statements)
        .containsExactly(before.get(0), before.get(2), before.get(1))
        .inOrder();
  }

  @Test
  public void renameableDeclarations() {
    ProgramUnit unit = parse(COUNTER).units().get(0);
    List<String> renameable = new ArrayList<>();
    for (ProgramUnit.Declaration d : unit.declarations()) {
      if (Rewriter.isRenameable(d)) {
        renameable.add(d.decl().name());
      }
    }
    assertThat(renameable).containsExactly("Speed");
  }
}
