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

package org.strata.parser;

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.strata.ast.Argument;
import org.strata.ast.Ast;
import org.strata.ast.Expr;
import org.strata.ast.Operator;
import org.strata.ast.PrefixOperator;
import org.strata.ast.ProgramUnit.UnitKind;
import org.strata.ast.ProgramUnit;
import org.strata.ast.Qualifier;
import org.strata.ast.Statement;
import org.strata.ast.Storage;
import org.strata.ast.TypeRef;
import org.strata.ast.VarBlock;
import org.strata.ast.VarDecl;

@RunWith(JUnit4.class)
public class AstBuilderTest {

  private static Ast parse(String code) {
    ParseResult result = SourceParser.parse(code);
    assertWithMessage("Parse failed: %s", result).that(result.succeeded()).isTrue();
    return result.ast();
  }

  /** Parses a PROGRAM with the given body and returns its statements. */
  private static ImmutableList<Statement> body(String statements) {
    return parse("PROGRAM P\n" + statements + "\nEND_PROGRAM").units().get(0).body();
  }

  private static Expr value(String expression) {
    Statement s = body("x := " + expression + ";").get(0);
    return ((Statement.Assign) s).value();
  }

  private static Expr.Var var(String name) {
    return new Expr.Var(name);
  }

  private static Expr.Literal lit(String raw) {
    return new Expr.Literal(raw);
  }

  @Test
  public void binaryPrecedence() {
    assertThat(value("a + b * 2"))
        .isEqualTo(
            new Expr.BinOp(
                Operator.ADD, var("a"), new Expr.BinOp(Operator.MUL, var("b"), lit("2"))));
    assertThat(value("a OR b AND c"))
        .isEqualTo(
            new Expr.BinOp(
                Operator.OR, var("a"), new Expr.BinOp(Operator.AND, var("b"), var("c"))));
    assertThat(value("a - b - c"))
        .isEqualTo(
            new Expr.BinOp(
                Operator.SUB, new Expr.BinOp(Operator.SUB, var("a"), var("b")), var("c")));
  }

  @Test
  public void powerIsRightAssociativeAndBindsTighterThanNegation() {
    assertThat(value("2 ** 3 ** 4"))
        .isEqualTo(
            new Expr.BinOp(
                Operator.POW, lit("2"), new Expr.BinOp(Operator.POW, lit("3"), lit("4"))));
    assertThat(value("-a ** 2"))
        .isEqualTo(
            new Expr.UnaryOp(
                PrefixOperator.NEG, new Expr.BinOp(Operator.POW, var("a"), lit("2"))));
  }

  @Test
  public void ampersandIsAnd() {
    assertThat(value("a & b")).isEqualTo(new Expr.BinOp(Operator.AND, var("a"), var("b")));
  }

  @Test
  public void notAppliesToComparisonOnlyWithParentheses() {
    assertThat(value("NOT a = b"))
        .isEqualTo(
            new Expr.BinOp(
                Operator.EQ, new Expr.UnaryOp(PrefixOperator.NOT, var("a")), var("b")));
    assertThat(value("NOT (a = b)"))
        .isEqualTo(
            new Expr.UnaryOp(PrefixOperator.NOT, new Expr.BinOp(Operator.EQ, var("a"), var("b"))));
  }

  @Test
  public void placesAndCalls() {
    Statement.Assign assign = (Statement.Assign) body("fb.out[i, 2].x := MAX(a, IN := b);").get(0);
    assertThat(assign.target())
        .isEqualTo(
            new Expr.Member(
                new Expr.Index(
                    new Expr.Member(var("fb"), "out"), ImmutableList.of(var("i"), lit("2"))),
                "x"));
    assertThat(assign.value())
        .isEqualTo(
            new Expr.Call(
                "MAX",
                ImmutableList.of(Argument.positional(var("a")), Argument.named("IN", var("b")))));
    assertThat(Expr.rootName(assign.target())).isEqualTo("fb");
  }

  @Test
  public void literalsKeepTheirSpelling() {
    assertThat(value("16#ff")).isEqualTo(lit("16#ff"));
    assertThat(value("t#1s500ms")).isEqualTo(lit("t#1s500ms"));
    assertThat(value("'a$'b'")).isEqualTo(lit("'a$'b'"));
    assertThat(value("TRUE")).isEqualTo(lit("TRUE"));
  }

  @Test
  public void ifStatement() {
    Statement.If withElse =
        (Statement.If)
            body("IF a THEN x := 1; ELSIF b THEN x := 2; ELSIF c THEN ELSE x := 3; END_IF")
                .get(0);
    assertThat(withElse.cond()).isEqualTo(var("a"));
    assertThat(withElse.elifs()).hasSize(2);
    assertThat(withElse.elifs().get(1).body()).isEmpty();
    assertThat(withElse.hasElse()).isTrue();

    Statement.If withoutElse = (Statement.If) body("IF a THEN x := 1; END_IF;").get(0);
    assertThat(withoutElse.elifs()).isEmpty();
    assertThat(withoutElse.hasElse()).isFalse();
  }

  @Test
  public void caseLabels() {
    Statement.Case caseStatement =
        (Statement.Case)
            body("CASE s OF 1, 2: x := 1; 3 .. 5: x := 2; -1: Idle: x := 3; END_CASE").get(0);
    assertThat(caseStatement.entries().stream().map(Statement.CaseEntry::values))
        .containsExactly(
            ImmutableList.of("1", "2"),
            ImmutableList.of("3..5"),
            ImmutableList.of("-1"),
            ImmutableList.of("Idle"))
        .inOrder();
    assertThat(caseStatement.entries().get(2).body()).isEmpty();
    assertThat(caseStatement.elseBody()).isEmpty();
  }

  @Test
  public void loopsAndJumps() {
    ImmutableList<Statement> statements =
        body(
            "FOR i := 0 TO n - 1 DO EXIT; END_FOR;"
                + " FOR j := 10 TO 0 BY -2 DO CONTINUE; END_FOR"
                + " WHILE x DO END_WHILE"
                + " REPEAT x := x + 1; UNTIL x > 3 END_REPEAT"
                + " RETURN;");
    Statement.For first = (Statement.For) statements.get(0);
    assertThat(first.variable()).isEqualTo("i");
    assertThat(first.step()).isNull();
    assertThat(first.body()).containsExactly(new Statement.Exit());
    Statement.For second = (Statement.For) statements.get(1);
    assertThat(second.step()).isEqualTo(new Expr.UnaryOp(PrefixOperator.NEG, lit("2")));
    assertThat(statements.get(2)).isEqualTo(new Statement.While(var("x"), ImmutableList.of()));
    assertThat(((Statement.Repeat) statements.get(3)).until())
        .isEqualTo(new Expr.BinOp(Operator.GT, var("x"), lit("3")));
    assertThat(statements.get(4)).isEqualTo(new Statement.Return());
  }

  @Test
  public void callStatement() {
    assertThat(body("timer(IN := start, PT := T#5s); reset();"))
        .containsExactly(
            new Statement.Call(
                "timer",
                ImmutableList.of(
                    Argument.named("IN", var("start")), Argument.named("PT", lit("T#5s")))),
            new Statement.Call("reset", ImmutableList.of()))
        .inOrder();
  }

  @Test
  public void outputArguments() {
    Expr logEntry = new Expr.Index(var("log"), ImmutableList.of(lit("2")));
    assertThat(body("t(IN := go, Q => done, ET => log[2]);"))
        .containsExactly(
            new Statement.Call(
                "t",
                ImmutableList.of(
                    Argument.named("IN", var("go")),
                    Argument.output("Q", var("done")),
                    Argument.output("ET", logEntry))));
  }

  @Test
  public void declarations() {
    ProgramUnit unit =
        parse(
                "FUNCTION_BLOCK FB\n"
                    + "VAR_INPUT a, b : INT := 1; END_VAR\n"
                    + "VAR CONSTANT K : REAL := 2.5; END_VAR\n"
                    + "VAR RETAIN s : STRING(20); t : string[30]; END_VAR\n"
                    + "VAR m : ARRAY[1..2, 0..N] OF Motor; END_VAR\n"
                    + "END_FUNCTION_BLOCK")
            .units()
            .get(0);
    assertThat(unit.kind()).isEqualTo(UnitKind.FUNCTION_BLOCK);
    assertThat(unit.returnType()).isNull();
    TypeRef intType = new TypeRef.Scalar("INT");
    assertThat(unit.varBlocks())
        .containsExactly(
            new VarBlock(
                Storage.VAR_INPUT,
                Qualifier.NONE,
                ImmutableList.of(
                    new VarDecl("a", intType, lit("1")), new VarDecl("b", intType, lit("1")))),
            new VarBlock(
                Storage.VAR,
                Qualifier.CONSTANT,
                ImmutableList.of(new VarDecl("K", new TypeRef.Scalar("REAL"), lit("2.5")))),
            new VarBlock(
                Storage.VAR,
                Qualifier.RETAIN,
                ImmutableList.of(
                    new VarDecl("s", new TypeRef.Scalar("STRING[20]"), null),
                    new VarDecl("t", new TypeRef.Scalar("string[30]"), null))),
            new VarBlock(
                Storage.VAR,
                Qualifier.NONE,
                ImmutableList.of(
                    new VarDecl(
                        "m",
                        new TypeRef.Array(
                            "1", "2", new TypeRef.Array("0", "N", new TypeRef.Named("Motor"))),
                        null))))
        .inOrder();
  }

  @Test
  public void structDeclaration() {
    VarDecl decl =
        parse("PROGRAM P VAR p : STRUCT x : REAL; y : INT := 3; END_STRUCT; END_VAR END_PROGRAM")
            .units()
            .get(0)
            .declarations()
            .get(0)
            .decl();
    assertThat(decl.type())
        .isEqualTo(
            new TypeRef.Struct(
                ImmutableList.of(
                    new VarDecl("x", new TypeRef.Scalar("REAL"), null),
                    new VarDecl("y", new TypeRef.Scalar("INT"), lit("3")))));
  }

  @Test
  public void multipleUnits() {
    Ast ast =
        parse(
            "FUNCTION Twice : INT VAR_INPUT v : INT; END_VAR Twice := v * 2; END_FUNCTION\n"
                + "PROGRAM Main VAR r : INT; END_VAR r := Twice(3); END_PROGRAM");
    assertThat(ast.units()).hasSize(2);
    assertThat(ast.units().get(0).returnType()).isEqualTo(new TypeRef.Scalar("INT"));
    assertThat(ast.unit("main")).isSameInstanceAs(ast.units().get(1));
    assertThat(ast.unit("Other")).isNull();
  }

  @Test
  public void keywordsAreCaseInsensitiveButNamesKeepTheirCase() {
    ProgramUnit unit =
        parse("program Mixed var Speed : Real; end_var speed := SPEED + 1; end_program")
            .units()
            .get(0);
    assertThat(unit.name()).isEqualTo("Mixed");
    assertThat(unit.declarations().get(0).decl().type()).isEqualTo(new TypeRef.Scalar("Real"));
    assertThat(unit.body())
        .containsExactly(
            new Statement.Assign(
                var("speed"), new Expr.BinOp(Operator.ADD, var("SPEED"), lit("1"))));
  }
}
