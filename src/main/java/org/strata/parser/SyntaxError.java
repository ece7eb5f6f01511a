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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * Source text that does not match the grammar. A SyntaxError is returned (not thrown) by {@link
 * SourceParser#parse}; it is only thrown internally to abort the parse at the first error.
 */
public class SyntaxError extends RuntimeException {
  public final String msg;

  /** The text of the token at which parsing failed ({@code "<EOF>"} at end of input). */
  public final String offendingToken;

  public final int lineNum;
  public final int charPositionInLine;

  /** Display names of the tokens the parser would have accepted; may be empty. */
  public final ImmutableList<String> expected;

  public SyntaxError(
      String msg,
      String offendingToken,
      int lineNum,
      int charPositionInLine,
      ImmutableList<String> expected) {
    super(msg);
    this.msg = msg;
    this.offendingToken = offendingToken;
    this.lineNum = lineNum;
    this.charPositionInLine = charPositionInLine;
    this.expected = expected;
  }

  @Override
  public String getMessage() {
    return String.format("%s (%s:%s)", msg, lineNum, charPositionInLine);
  }

  /** Like {@link #getMessage} but also lists the expected tokens, if any are known. */
  public String describe() {
    if (expected.isEmpty()) {
      return getMessage();
    }
    return getMessage() + "; expected one of " + Joiner.on(", ").join(expected);
  }
}
