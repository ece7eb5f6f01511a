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

/** The unary operators. */
public enum PrefixOperator {
  NOT("NOT"),
  NEG("-");

  private final String symbol;

  PrefixOperator(String symbol) {
    this.symbol = symbol;
  }

  @JsonValue
  public String symbol() {
    return symbol;
  }

  @JsonCreator
  public static PrefixOperator fromSymbol(String symbol) {
    return switch (Ascii.toUpperCase(symbol)) {
      case "NOT" -> NOT;
      case "-" -> NEG;
      default -> throw new IllegalArgumentException("Unknown prefix operator: " + symbol);
    };
  }
}
