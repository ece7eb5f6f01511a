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

package org.strata.unparser;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import java.util.List;
import org.strata.ToolkitOptions;
import org.strata.ast.Argument;
import org.strata.ast.Ast;
import org.strata.ast.Expr;
import org.strata.ast.Operator;
import org.strata.ast.PrefixOperator;
import org.strata.ast.ProgramUnit;
import org.strata.ast.Qualifier;
import org.strata.ast.Statement;
import org.strata.ast.Storage;
import org.strata.ast.TypeRef;
import org.strata.ast.VarDecl;

/**
 * Renders an Ast as Structured Text in a canonical layout: upper-case keywords, one indentation
 * unit per nesting level, every statement terminated by {@code ;}, and only the parentheses that
 * the operator precedences require.
 *
 * <p>Declarations are emitted in their original order; consecutive declarations with the same
 * storage class and qualifier share one {@code VAR ... END_VAR} block.
 */
public final class Unparser {
  private static final Joiner COMMA_JOINER = Joiner.on(", ");

  private final String indentUnit;

  public Unparser(ToolkitOptions options) {
    this.indentUnit = options.indent();
  }

  /** An Unparser with the default four-space indentation. */
  public static Unparser standard() {
    return new Unparser(ToolkitOptions.DEFAULT);
  }

  /** Units are separated by a blank line; the result ends with a newline. */
  public String unparse(Ast ast) {
    StringBuilder sb = new StringBuilder();
    for (ProgramUnit unit : ast.units()) {
      if (sb.length() > 0) {
        sb.append('\n');
      }
      unit(sb, unit);
    }
    return sb.toString();
  }

  public String unparse(ProgramUnit unit) {
    StringBuilder sb = new StringBuilder();
    unit(sb, unit);
    return sb.toString();
  }

  /** Returns the statements, each line indented by {@code depth} units. */
  public String unparse(List<Statement> statements, int depth) {
    StringBuilder sb = new StringBuilder();
    statements(sb, statements, depth);
    return sb.toString();
  }

  private void line(StringBuilder sb, int depth, String text) {
    sb.append(Strings.repeat(indentUnit, depth)).append(text).append('\n');
  }

  private void unit(StringBuilder sb, ProgramUnit unit) {
    String header = unit.kind().keyword() + " " + unit.name();
    if (unit.returnType() != null) {
      header = header + " : " + type(unit.returnType(), 0);
    }
    line(sb, 0, header);
    declarations(sb, unit.declarations());
    statements(sb, unit.body(), 1);
    line(sb, 0, unit.kind().endKeyword());
  }

  private void declarations(StringBuilder sb, List<ProgramUnit.Declaration> declarations) {
    Storage storage = null;
    Qualifier qualifier = null;
    for (ProgramUnit.Declaration d : declarations) {
      if (d.storage() != storage || d.qualifier() != qualifier) {
        if (storage != null) {
          line(sb, 1, "END_VAR");
        }
        storage = d.storage();
        qualifier = d.qualifier();
        String keyword = storage.keyword();
        if (qualifier != Qualifier.NONE) {
          keyword = keyword + " " + qualifier.keyword();
        }
        line(sb, 1, keyword);
      }
      varDecl(sb, d.decl(), 2);
    }
    if (storage != null) {
      line(sb, 1, "END_VAR");
    }
  }

  private void varDecl(StringBuilder sb, VarDecl decl, int depth) {
    String text = decl.name() + " : " + type(decl.type(), depth);
    if (decl.init() != null) {
      text = text + " := " + expression(decl.init());
    }
    line(sb, depth, text + ";");
  }

  /**
   * Returns the type as it appears after the colon. A STRUCT spans several lines; its fields are
   * indented one level deeper than {@code depth} and its END_STRUCT lines up with the declaration.
   */
  private String type(TypeRef type, int depth) {
    return type.accept(
        new TypeRef.Visitor<String>() {
          @Override
          public String visitScalar(TypeRef.Scalar scalar) {
            return scalar.name();
          }

          @Override
          public String visitNamed(TypeRef.Named named) {
            return named.name();
          }

          @Override
          public String visitArray(TypeRef.Array array) {
            // Nested arrays print as one multi-dimensional ARRAY, which parses back the same way.
            StringBuilder ranges = new StringBuilder();
            TypeRef elem = array;
            while (elem instanceof TypeRef.Array a) {
              if (ranges.length() > 0) {
                ranges.append(", ");
              }
              ranges.append(a.lower()).append("..").append(a.upper());
              elem = a.elem();
            }
            return "ARRAY[" + ranges + "] OF " + type(elem, depth);
          }

          @Override
          public String visitStruct(TypeRef.Struct struct) {
            StringBuilder sb = new StringBuilder("STRUCT\n");
            struct.fields().forEach(field -> varDecl(sb, field, depth + 1));
            return sb + Strings.repeat(indentUnit, depth) + "END_STRUCT";
          }
        });
  }

  private void statements(StringBuilder sb, List<Statement> statements, int depth) {
    StatementPrinter printer = new StatementPrinter(sb, depth);
    statements.forEach(s -> s.accept(printer));
  }

  /** Appends each visited statement to {@code sb} at the given depth. */
  private class StatementPrinter implements Statement.Visitor<Void> {
    final StringBuilder sb;
    final int depth;

    StatementPrinter(StringBuilder sb, int depth) {
      this.sb = sb;
      this.depth = depth;
    }

    private void line(String text) {
      Unparser.this.line(sb, depth, text);
    }

    private void body(List<Statement> body, int extraDepth) {
      statements(sb, body, depth + extraDepth);
    }

    @Override
    public Void visitAssign(Statement.Assign assign) {
      line(expression(assign.target()) + " := " + expression(assign.value()) + ";");
      return null;
    }

    @Override
    public Void visitIf(Statement.If ifStatement) {
      line("IF " + expression(ifStatement.cond()) + " THEN");
      body(ifStatement.thenBody(), 1);
      for (Statement.ConditionalBody elif : ifStatement.elifs()) {
        line("ELSIF " + expression(elif.cond()) + " THEN");
        body(elif.body(), 1);
      }
      if (ifStatement.hasElse()) {
        line("ELSE");
        body(ifStatement.elseBody(), 1);
      }
      line("END_IF;");
      return null;
    }

    @Override
    public Void visitCase(Statement.Case caseStatement) {
      line("CASE " + expression(caseStatement.cond()) + " OF");
      for (Statement.CaseEntry entry : caseStatement.entries()) {
        Unparser.this.line(sb, depth + 1, COMMA_JOINER.join(entry.values()) + ":");
        body(entry.body(), 2);
      }
      if (!caseStatement.elseBody().isEmpty()) {
        line("ELSE");
        body(caseStatement.elseBody(), 1);
      }
      line("END_CASE;");
      return null;
    }

    @Override
    public Void visitFor(Statement.For forStatement) {
      String header =
          "FOR "
              + forStatement.variable()
              + " := "
              + expression(forStatement.from())
              + " TO "
              + expression(forStatement.to());
      if (forStatement.step() != null) {
        header = header + " BY " + expression(forStatement.step());
      }
      line(header + " DO");
      body(forStatement.body(), 1);
      line("END_FOR;");
      return null;
    }

    @Override
    public Void visitWhile(Statement.While whileStatement) {
      line("WHILE " + expression(whileStatement.cond()) + " DO");
      body(whileStatement.body(), 1);
      line("END_WHILE;");
      return null;
    }

    @Override
    public Void visitRepeat(Statement.Repeat repeat) {
      line("REPEAT");
      body(repeat.body(), 1);
      line("UNTIL " + expression(repeat.until()));
      line("END_REPEAT;");
      return null;
    }

    @Override
    public Void visitCall(Statement.Call call) {
      line(call.name() + "(" + arguments(call.args()) + ");");
      return null;
    }

    @Override
    public Void visitReturn(Statement.Return returnStatement) {
      line("RETURN;");
      return null;
    }

    @Override
    public Void visitExit(Statement.Exit exit) {
      line("EXIT;");
      return null;
    }

    @Override
    public Void visitContinue(Statement.Continue continueStatement) {
      line("CONTINUE;");
      return null;
    }
  }

  /** Returns the expression with the minimum parentheses needed to parse back to the same tree. */
  public static String expression(Expr expr) {
    return expr.accept(EXPRESSION_PRINTER);
  }

  private static String arguments(List<Argument> args) {
    return COMMA_JOINER.join(args.stream().map(Unparser::argument).iterator());
  }

  private static String argument(Argument arg) {
    String value = expression(arg.value());
    if (arg.name() == null) {
      return value;
    }
    return arg.name() + (arg.output() ? " => " : " := ") + value;
  }

  /** The binding strength of an expression's outermost operator. */
  static int precedence(Expr expr) {
    if (expr instanceof Expr.BinOp binOp) {
      return binOp.op().precedence();
    } else if (expr instanceof Expr.UnaryOp) {
      return Operator.UNARY_PRECEDENCE;
    }
    return Operator.PRIMARY_PRECEDENCE;
  }

  private static final Expr.Visitor<String> EXPRESSION_PRINTER =
      new Expr.Visitor<String>() {
        @Override
        public String visitVar(Expr.Var var) {
          return var.name();
        }

        @Override
        public String visitLiteral(Expr.Literal literal) {
          return literal.raw();
        }

        @Override
        public String visitBinOp(Expr.BinOp binOp) {
          Operator op = binOp.op();
          int left = precedence(binOp.left());
          int right = precedence(binOp.right());
          // Operators at the same level group to the left except **, which groups to the right.
          boolean parenLeft =
              left < op.precedence() || (left == op.precedence() && op.isRightAssociative());
          boolean parenRight =
              right < op.precedence() || (right == op.precedence() && !op.isRightAssociative());
          return wrap(binOp.left(), parenLeft)
              + " "
              + op.symbol()
              + " "
              + wrap(binOp.right(), parenRight);
        }

        @Override
        public String visitUnaryOp(Expr.UnaryOp unaryOp) {
          Expr operand = unaryOp.operand();
          boolean paren =
              precedence(operand) < Operator.UNARY_PRECEDENCE || operand instanceof Expr.UnaryOp;
          String separator = (unaryOp.op() == PrefixOperator.NOT) ? " " : "";
          return unaryOp.op().symbol() + separator + wrap(operand, paren);
        }

        @Override
        public String visitCall(Expr.Call call) {
          return call.name() + "(" + arguments(call.args()) + ")";
        }

        @Override
        public String visitIndex(Expr.Index index) {
          return index.base().accept(this)
              + "["
              + COMMA_JOINER.join(index.indices().stream().map(i -> i.accept(this)).iterator())
              + "]";
        }

        @Override
        public String visitMember(Expr.Member member) {
          return member.base().accept(this) + "." + member.field();
        }

        private String wrap(Expr expr, boolean paren) {
          String s = expr.accept(this);
          return paren ? "(" + s + ")" : s;
        }
      };
}
