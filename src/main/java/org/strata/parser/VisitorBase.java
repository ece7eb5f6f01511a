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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.FormatMethod;
import java.util.function.Function;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.strata.parser.StructuredTextParser.ParenExpressionContext;

/**
 * A base class for the AST-building visitors that provides two useful functions:
 *
 * <ul>
 *   <li>It disables the default "visit the children" behavior for node types that haven't been
 *       overridden; visiting such a node throws a {@link BuildError}, so a grammar change that the
 *       builders haven't caught up with fails loudly instead of producing a partial tree.
 *   <li>It provides error() methods that automatically fill in the node currently being visited as
 *       the location of the error.
 * </ul>
 */
class VisitorBase<T> extends StructuredTextBaseVisitor<T> {

  /** The node currently being visited. */
  private ParseTree currentNode;

  @Override
  protected final T defaultResult() {
    // Called by every visitXXX() method we haven't overridden.
    throw error(
        "Unexpected %s", (currentNode == null) ? "node" : currentNode.getClass().getSimpleName());
  }

  @Override
  public final T visit(ParseTree tree) {
    return visitWithCurrentNode(tree, super::visit);
  }

  /**
   * Calls {@code visitor} with the given node, binding {@link #currentNode} for the duration of the
   * call.
   *
   * <p>Assumes that if the function throws an exception, this Visitor will not be used again (no
   * attempt is made to restore the correct currentNode state).
   */
  @CanIgnoreReturnValue
  T visitWithCurrentNode(ParseTree node, Function<ParseTree, T> visitor) {
    ParseTree prevNode = currentNode;
    currentNode = node;
    T result = visitor.apply(node);
    currentNode = prevNode;
    return result;
  }

  @Override
  public T visitParenExpression(ParenExpressionContext ctx) {
    // Parentheses only affect grouping, which the tree shape already records.
    return visit(ctx.expression());
  }

  /** Returns the first token of the current node. */
  Token currentToken() {
    return (currentNode instanceof ParserRuleContext prc) ? prc.start : null;
  }

  /** Returns a {@link BuildError} pointing at the current node. */
  @FormatMethod
  BuildError error(String fmt, Object... fmtArgs) {
    Token token = currentToken();
    String msg = String.format(fmt, fmtArgs);
    if (token == null) {
      return new BuildError(msg, 0, 0);
    }
    return new BuildError(msg, token.getLine(), token.getCharPositionInLine());
  }
}
