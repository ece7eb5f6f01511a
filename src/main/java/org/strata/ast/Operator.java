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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Ascii;

/**
 * The binary operators of Structured Text.
 *
 * <p>Precedences increase with binding strength; {@link PrefixOperator} operands bind at {@link
 * #UNARY_PRECEDENCE}, between the multiplicative operators and {@link #POW}.
 */
public enum Operator {
  OR("OR", 1, true),
  XOR("XOR", 2, true),
  AND("AND", 3, true),
  EQ("=", 4, false),
  NE("<>", 4, false),
  LT("<", 5, false),
  GT(">", 5, false),
  LE("<=", 5, false),
  GE(">=", 5, false),
  ADD("+", 6, true),
  SUB("-", 6, false),
  MUL("*", 7, true),
  DIV("/", 7, false),
  MOD("MOD", 7, false),
  POW("**", 9, false);

  public static final int UNARY_PRECEDENCE = 8;
  public static final int PRIMARY_PRECEDENCE = 10;

  private final String symbol;
  private final int precedence;
  private final boolean commutative;

  Operator(String symbol, int precedence, boolean commutative) {
    this.symbol = symbol;
    this.precedence = precedence;
    this.commutative = commutative;
  }

  /** The operator as it is written in source, e.g. {@code "<="} or {@code "MOD"}. */
  @JsonValue
  public String symbol() {
    return symbol;
  }

  public int precedence() {
    return precedence;
  }

  /**
   * True if swapping the operands never changes the result. XOR is commutative but the rewriter
   * only swaps the operators listed in {@link #isSwappable}.
   */
  public boolean commutative() {
    return commutative;
  }

  /** True for the operators whose operands the rewriter may exchange: {@code + * AND OR}. */
  public boolean isSwappable() {
    return this == ADD || this == MUL || this == AND || this == OR;
  }

  /** {@code **} groups to the right; everything else groups to the left. */
  public boolean isRightAssociative() {
    return this == POW;
  }

  /** Returns the operator written as {@code symbol}; {@code &} is accepted as a synonym for AND. */
  @JsonCreator
  public static Operator fromSymbol(String symbol) {
    String upper = Ascii.toUpperCase(symbol);
    if (upper.equals("&")) {
      return AND;
    }
    for (Operator op : values()) {
      if (op.symbol.equals(upper)) {
        return op;
      }
    }
    throw new IllegalArgumentException("Unknown operator: " + symbol);
  }
}
